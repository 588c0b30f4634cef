/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.function;

import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Operator;

/**
    LC(i, j, k): the permutation symbol in three dimensions.
**/
public class LeviCivita extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "LC";
            }

            public Operator createInstance ()
            {
                return new LeviCivita ();
            }
        };
    }

    public LeviCivita ()
    {
    }

    public LeviCivita (Index i, Index j, Index k)
    {
        operands = new Operator[] {i, j, k};
    }

    public Kind kind ()
    {
        return Kind.LEVI_CIVITA;
    }

    public int arguments ()
    {
        return 3;
    }

    /**
        @return +1 for an even permutation of (0,1,2), -1 for an odd permutation, 0 if any value repeats.
    **/
    public static int value (int i, int j, int k)
    {
        return (j - i) * (k - i) * (k - j) / 2;
    }

    public String toString ()
    {
        return "LC";
    }
}
