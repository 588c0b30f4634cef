/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

public class OperatorBinary extends Operator
{
    public Operator operand0;
    public Operator operand1;

    public OperatorBinary ()
    {
    }

    public OperatorBinary (Operator operand0, Operator operand1)
    {
        this.operand0 = operand0;
        this.operand1 = operand1;
    }

    public Operator deepCopy ()
    {
        OperatorBinary result = (OperatorBinary) super.deepCopy ();
        result.operand0 = operand0.deepCopy ();
        result.operand1 = operand1.deepCopy ();
        return result;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand0.visit (visitor);
        operand1.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        operand0 = operand0.transform (transformer);
        operand1 = operand1.transform (transformer);
        return this;
    }

    public Operator simplify ()
    {
        operand0 = operand0.simplify ();
        operand1 = operand1.simplify ();
        return this;
    }

    public boolean equals (Object that)
    {
        if (! super.equals (that)) return false;
        OperatorBinary o = (OperatorBinary) that;
        return operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        return (super.hashCode () * 31 + operand0.hashCode ()) * 31 + operand1.hashCode ();
    }
}
