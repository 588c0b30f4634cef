/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

public class Constant extends Operator
{
    public double value;

    public Constant (double value)
    {
        this.value = value;
    }

    public Constant (int value)
    {
        this.value = value;
    }

    public Operator simplify ()
    {
        if (value == 0) value = 0;  // Normalize -0 so that equals() and render() agree.
        return this;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        if (value < 0)
        {
            renderer.result.append ("-");
            renderer.result.append (format (-value));
        }
        else
        {
            renderer.result.append (format (value));
        }
    }

    public static String format (double value)
    {
        if (value == Math.rint (value)  &&  Math.abs (value) < 1e15) return String.valueOf ((long) value);
        return String.valueOf (value);
    }

    public String toString ()
    {
        return format (value);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        return Double.compare (value, ((Constant) that).value) == 0  ||  value == ((Constant) that).value;
    }

    public int hashCode ()
    {
        if (value == 0) return 0;
        return Double.hashCode (value);
    }
}
