/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.function;

import java.util.Arrays;

import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Operator;

/**
    Conservative(f, x_j): a derivative that is to be discretized in conservative (flux) form.
    Expansion never evaluates it. It stays in this form over scalar arguments so that a later
    discretization stage can recognize it.
**/
public class Conservative extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "Conservative";
            }

            public Operator createInstance ()
            {
                return new Conservative ();
            }
        };
    }

    public Conservative ()
    {
    }

    public Conservative (Operator target, Operator... directions)
    {
        operands = new Operator[directions.length + 1];
        operands[0] = target;
        System.arraycopy (directions, 0, operands, 1, directions.length);
    }

    public Kind kind ()
    {
        return Kind.CONSERVATIVE;
    }

    public int minimumArguments ()
    {
        return 2;
    }

    public Operator target ()
    {
        return operands[0];
    }

    public Operator[] directions ()
    {
        return Arrays.copyOfRange (operands, 1, operands.length);
    }

    public String toString ()
    {
        return "Conservative";
    }
}
