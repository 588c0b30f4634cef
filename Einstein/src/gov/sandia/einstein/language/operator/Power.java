/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.operator;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.OperatorBinary;
import gov.sandia.einstein.language.Renderer;

public class Power extends OperatorBinary
{
    public Power (Operator base, Operator exponent)
    {
        super (base, exponent);
    }

    public int precedence ()
    {
        return 2;
    }

    public Operator simplify ()
    {
        super.simplify ();
        if (operand0 instanceof Constant  &&  operand1 instanceof Constant)
        {
            return new Constant (Math.pow (operand0.getDouble (), operand1.getDouble ()));
        }
        if (operand1.isScalar ())
        {
            double e = operand1.getDouble ();
            if (e == 1) return operand0;            // A^1 --> A
            if (e == 0) return new Constant (1);    // A^0 --> 1
        }
        return this;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        boolean baseParens =  operand0.precedence () >= precedence ()  ||  isNegative (operand0);
        boolean expParens  =  operand1.precedence () >  precedence ()  ||  isNegative (operand1)  ||  operand1 instanceof Negate;
        render (renderer, operand0, baseParens);
        renderer.result.append ("^");
        render (renderer, operand1, expParens);
    }

    protected static boolean isNegative (Operator op)
    {
        return op instanceof Constant  &&  ((Constant) op).value < 0;
    }

    public String toString ()
    {
        return "^";
    }
}
