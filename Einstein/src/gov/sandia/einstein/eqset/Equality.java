/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.Renderer;

/**
    A pair of expressions which are asserted to be equal.
**/
public class Equality
{
    public Operator lhs;
    public Operator rhs;
    public int      component = -1;  // Position of this scalar equation within the expansion of a vector equation, or -1 for a scalar equation.

    public Equality (Operator lhs, Operator rhs)
    {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public Equality (Operator lhs, Operator rhs, int component)
    {
        this (lhs, rhs);
        this.component = component;
    }

    public Equality deepCopy ()
    {
        return new Equality (lhs.deepCopy (), rhs.deepCopy (), component);
    }

    public void render (Renderer renderer)
    {
        lhs.render (renderer);
        renderer.result.append (" = ");
        rhs.render (renderer);
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public String toString ()
    {
        return render ();
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Equality)) return false;
        Equality e = (Equality) that;
        return lhs.equals (e.lhs)  &&  rhs.equals (e.rhs);
    }

    public int hashCode ()
    {
        return lhs.hashCode () * 31 + rhs.hashCode ();
    }
}
