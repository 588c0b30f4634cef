/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

public class OperatorUnary extends Operator
{
    public Operator operand;

    public OperatorUnary ()
    {
    }

    public OperatorUnary (Operator operand)
    {
        this.operand = operand;
    }

    public Operator deepCopy ()
    {
        OperatorUnary result = (OperatorUnary) super.deepCopy ();
        result.operand = operand.deepCopy ();
        return result;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        operand = operand.transform (transformer);
        return this;
    }

    public Operator simplify ()
    {
        operand = operand.simplify ();
        return this;
    }

    public boolean equals (Object that)
    {
        if (! super.equals (that)) return false;
        return operand.equals (((OperatorUnary) that).operand);
    }

    public int hashCode ()
    {
        return super.hashCode () * 31 + operand.hashCode ();
    }
}
