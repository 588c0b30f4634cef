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
    KD(i, j): 1 where the two indices take the same value, 0 elsewhere.
**/
public class KroneckerDelta extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "KD";
            }

            public Operator createInstance ()
            {
                return new KroneckerDelta ();
            }
        };
    }

    public KroneckerDelta ()
    {
    }

    public KroneckerDelta (Index i, Index j)
    {
        operands = new Operator[] {i, j};
    }

    public Kind kind ()
    {
        return Kind.KRONECKER_DELTA;
    }

    public int arguments ()
    {
        return 2;
    }

    public static int value (int i, int j)
    {
        return i == j ? 1 : 0;
    }

    public String toString ()
    {
        return "KD";
    }
}
