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
    Der(f, x_j, ...): partial derivative of the first argument with respect to each of the
    following arguments in turn. Once expanded, any derivative that cannot be evaluated
    symbolically is left in this form over scalar terms, for example Der(u0, x1).
**/
public class Derivative extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "Der";
            }

            public Operator createInstance ()
            {
                return new Derivative ();
            }
        };
    }

    public Derivative ()
    {
    }

    public Derivative (Operator target, Operator... directions)
    {
        operands = new Operator[directions.length + 1];
        operands[0] = target;
        System.arraycopy (directions, 0, operands, 1, directions.length);
    }

    public Kind kind ()
    {
        return Kind.DERIVATIVE;
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
        return "Der";
    }
}
