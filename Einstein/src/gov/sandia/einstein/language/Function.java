/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import java.util.Arrays;

/**
    A named operator with positional arguments. The set of function kinds is closed:
    anything the parser does not recognize as a registered function becomes a PlainFunction.
**/
public class Function extends Operator
{
    public enum Kind
    {
        PLAIN,
        DERIVATIVE,
        CONSERVATIVE,
        KRONECKER_DELTA,
        LEVI_CIVITA
    }

    public Operator[] operands = new Operator[0];  // always non-null

    public Kind kind ()
    {
        return Kind.PLAIN;
    }

    /**
        The name under which this function is written and parsed.
    **/
    public String name ()
    {
        return toString ();
    }

    /**
        @return The number of arguments this function requires, or -1 if variable.
        For a variable count, the minimum is given by minimumArguments().
    **/
    public int arguments ()
    {
        return -1;
    }

    public int minimumArguments ()
    {
        return 0;
    }

    public Operator deepCopy ()
    {
        Function result = (Function) super.deepCopy ();
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

    public Operator simplify ()
    {
        for (int i = 0; i < operands.length; i++) operands[i] = operands[i].simplify ();
        return this;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (name () + "(");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) renderer.result.append (", ");
            operands[i].render (renderer);
        }
        renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (! super.equals (that)) return false;
        Function f = (Function) that;
        return name ().equals (f.name ())  &&  Arrays.equals (operands, f.operands);
    }

    public int hashCode ()
    {
        return (super.hashCode () * 31 + name ().hashCode ()) * 31 + Arrays.hashCode (operands);
    }
}
