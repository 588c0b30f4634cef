/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
    Base for the associative operators (sum and product), which hold any number of operands
    in a flat list rather than as a chain of binary nodes.
**/
public class OperatorNary extends Operator
{
    public Operator[] operands;

    public OperatorNary (Operator... operands)
    {
        this.operands = operands;
    }

    public OperatorNary (List<Operator> operands)
    {
        this.operands = operands.toArray (new Operator[operands.size ()]);
    }

    public Operator deepCopy ()
    {
        OperatorNary result = (OperatorNary) super.deepCopy ();
        result.operands = new Operator[operands.length];
        for (int i = 0; i < operands.length; i++) result.operands[i] = operands[i].deepCopy ();
        return result;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator op : operands) op.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        for (int i = 0; i < operands.length; i++) operands[i] = operands[i].transform (transformer);
        return this;
    }

    /**
        Simplifies each operand, then lifts the operands of any child of the same class up into this node.
    **/
    public Operator simplify ()
    {
        List<Operator> flat = new ArrayList<Operator> ();
        for (Operator op : operands)
        {
            op = op.simplify ();
            if (op.getClass () == getClass ()) flat.addAll (Arrays.asList (((OperatorNary) op).operands));
            else                               flat.add (op);
        }
        operands = flat.toArray (new Operator[flat.size ()]);
        return this;
    }

    public boolean equals (Object that)
    {
        if (! super.equals (that)) return false;
        return Arrays.equals (operands, ((OperatorNary) that).operands);
    }

    public int hashCode ()
    {
        return super.hashCode () * 31 + Arrays.hashCode (operands);
    }
}
