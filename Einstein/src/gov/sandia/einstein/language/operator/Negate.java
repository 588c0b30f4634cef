/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.operator;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.OperatorUnary;
import gov.sandia.einstein.language.Renderer;

public class Negate extends OperatorUnary
{
    public Negate (Operator operand)
    {
        super (operand);
    }

    public int precedence ()
    {
        return 2;
    }

    public Operator simplify ()
    {
        super.simplify ();
        if (operand instanceof Negate) return ((Negate) operand).operand;  // --A --> A
        if (operand instanceof Constant) return new Constant (-((Constant) operand).value).simplify ();
        if (operand instanceof Multiply  &&  ((Multiply) operand).operands[0] instanceof Constant)  // -(2*A) --> -2*A
        {
            return ((Multiply) operand).negated ();
        }
        return this;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("-");
        boolean needParens =  operand instanceof Add  ||  operand instanceof Negate  ||  operand instanceof Constant  &&  ((Constant) operand).value < 0;
        render (renderer, operand, needParens);
    }

    public String toString ()
    {
        return "-";
    }
}
