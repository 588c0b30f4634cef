/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

/**
    An index symbol, such as the i in u_i. Two Index objects with the same name are the same index.
    Stands alone as an expression only in the argument list of KD() and LC().
**/
public class Index extends Operator
{
    public String name;

    public Index (String name)
    {
        this.name = name;
    }

    public String toString ()
    {
        return name;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Index)) return false;
        return name.equals (((Index) that).name);
    }

    public int hashCode ()
    {
        return name.hashCode ();
    }
}
