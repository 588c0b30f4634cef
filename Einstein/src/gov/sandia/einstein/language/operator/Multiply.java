/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.OperatorNary;
import gov.sandia.einstein.language.Renderer;

public class Multiply extends OperatorNary
{
    public Multiply (Operator... operands)
    {
        super (operands);
    }

    public Multiply (List<Operator> operands)
    {
        super (operands);
    }

    public int precedence ()
    {
        return 4;
    }

    /**
        Collects all constant factors into a single leading coefficient, and pulls negations out of the factors.
    **/
    public Operator simplify ()
    {
        super.simplify ();

        double coefficient = 1;
        List<Operator> kept = new ArrayList<Operator> ();
        for (Operator op : operands)
        {
            if (op instanceof Constant)
            {
                coefficient *= ((Constant) op).value;
            }
            else if (op instanceof Negate)  // (-A)*B --> -(A*B)
            {
                coefficient = -coefficient;
                kept.add (((Negate) op).operand);
            }
            else
            {
                kept.add (op);
            }
        }

        if (coefficient == 0  ||  kept.isEmpty ()) return new Constant (coefficient).simplify ();
        Operator product;
        if (kept.size () == 1) product = kept.get (0);
        else                   product = new Multiply (kept);
        if (coefficient ==  1) return product;
        if (coefficient == -1) return new Negate (product);
        kept.add (0, new Constant (coefficient));
        operands = kept.toArray (new Operator[kept.size ()]);
        return this;
    }

    /**
        @return The value of the leading constant factor, or 1 if there is none.
    **/
    public double coefficient ()
    {
        if (operands.length > 0  &&  operands[0] instanceof Constant) return ((Constant) operands[0]).value;
        return 1;
    }

    /**
        @return A product equal to the negative of this one, formed by changing the sign of the coefficient.
    **/
    public Operator negated ()
    {
        double c = coefficient ();
        List<Operator> factors = new ArrayList<Operator> (Arrays.asList (operands));
        if (operands.length > 0  &&  operands[0] instanceof Constant) factors.remove (0);
        if (c != -1) factors.add (0, new Constant (-c));
        if (factors.size () == 1) return factors.get (0);
        return new Multiply (factors);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        for (int i = 0; i < operands.length; i++)
        {
            Operator op = operands[i];
            boolean needParens = op.precedence () > precedence ();
            if (i > 0)
            {
                renderer.result.append ("*");
                if (op instanceof Negate  ||  op instanceof Constant  &&  ((Constant) op).value < 0) needParens = true;
            }
            render (renderer, op, needParens);
        }
    }

    public String toString ()
    {
        return "*";
    }
}
