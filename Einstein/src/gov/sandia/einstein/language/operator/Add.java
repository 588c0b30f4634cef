/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.operator;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.OperatorNary;
import gov.sandia.einstein.language.Renderer;

public class Add extends OperatorNary
{
    public Add (Operator... operands)
    {
        super (operands);
    }

    public Add (List<Operator> operands)
    {
        super (operands);
    }

    public int precedence ()
    {
        return 5;
    }

    public Operator simplify ()
    {
        super.simplify ();

        double sum = 0;
        List<Operator> kept = new ArrayList<Operator> ();
        for (Operator op : operands)
        {
            if (op instanceof Constant) sum += ((Constant) op).value;
            else                        kept.add (op);
        }
        if (sum != 0) kept.add (new Constant (sum));  // The constant always goes last.
        if (kept.isEmpty ()) return new Constant (0);
        if (kept.size () == 1) return kept.get (0);
        operands = kept.toArray (new Operator[kept.size ()]);
        return this;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        for (int i = 0; i < operands.length; i++)
        {
            Operator op = operands[i];
            if (i > 0)
            {
                if (op instanceof Negate)  // A+(-B) --> A-B
                {
                    renderer.result.append ("-");
                    Operator inner = ((Negate) op).operand;
                    render (renderer, inner, inner.precedence () >= precedence ());
                    continue;
                }
                if (op instanceof Constant  &&  ((Constant) op).value < 0)
                {
                    renderer.result.append ("-" + Constant.format (-((Constant) op).value));
                    continue;
                }
                if (op instanceof Multiply  &&  ((Multiply) op).coefficient () < 0)
                {
                    renderer.result.append ("-");
                    ((Multiply) op).negated ().render (renderer);
                    continue;
                }
                renderer.result.append ("+");
            }
            render (renderer, op, op.precedence () > precedence ());
        }
    }

    public String toString ()
    {
        return "+";
    }
}
