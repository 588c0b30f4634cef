/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.Term;
import gov.sandia.einstein.language.Visitor;
import gov.sandia.einstein.language.function.Derivative;
import gov.sandia.einstein.language.function.PlainFunction;
import gov.sandia.einstein.language.operator.Add;
import gov.sandia.einstein.language.operator.Multiply;
import gov.sandia.einstein.language.operator.Negate;
import gov.sandia.einstein.language.operator.Power;

/**
    Symbolic differentiation of scalar expressions with respect to a single coordinate.
    Fields are functions of every coordinate, so the derivative of a field stays unevaluated as Der(field, x).
**/
public class Differentiator
{
    public static Operator differentiate (Operator expression, Operator direction)
    {
        if (! (direction instanceof Term)) throw new ExpansionException ("Can only differentiate with respect to a coordinate, not " + direction.render ());
        Term x = (Term) direction;
        if (! x.coordinate  ||  x.isIndexed ()) throw new ExpansionException ("Can only differentiate with respect to a scalar coordinate, not " + x.render ());
        return d (expression, x).simplify ();
    }

    protected static Operator d (Operator e, Term x)
    {
        if (e instanceof Constant  ||  e instanceof Index) return new Constant (0);

        if (e instanceof Term)
        {
            Term t = (Term) e;
            if (t.coordinate) return new Constant (t.equals (x) ? 1 : 0);
            if (t.constant)   return new Constant (0);
            return new Derivative (t, x);
        }

        if (e instanceof Add)
        {
            Operator[] operands = ((Add) e).operands;
            List<Operator> terms = new ArrayList<Operator> ();
            for (Operator o : operands) terms.add (d (o, x));
            return new Add (terms);
        }

        if (e instanceof Multiply)  // product rule
        {
            Operator[] factors = ((Multiply) e).operands;
            List<Operator> terms = new ArrayList<Operator> ();
            for (int i = 0; i < factors.length; i++)
            {
                if (! dependsOn (factors[i], x)) continue;
                Operator[] product = new Operator[factors.length];
                for (int j = 0; j < factors.length; j++)
                {
                    if (j == i) product[j] = d (factors[j], x);
                    else        product[j] = factors[j].deepCopy ();
                }
                terms.add (new Multiply (product));
            }
            if (terms.isEmpty ()) return new Constant (0);
            return new Add (terms);
        }

        if (e instanceof Negate) return new Negate (d (((Negate) e).operand, x));

        if (e instanceof Power)
        {
            Operator b = ((Power) e).operand0;
            Operator c = ((Power) e).operand1;
            if (! dependsOn (c, x))  // c*b^(c-1)*db
            {
                return new Multiply (c.deepCopy (), new Power (b.deepCopy (), new Add (c.deepCopy (), new Constant (-1))), d (b, x));
            }
            // b^c*(dc*log(b) + c*db/b)
            Operator logTerm   = new Multiply (d (c, x), new PlainFunction ("log", b.deepCopy ()));
            Operator ratioTerm = new Multiply (c.deepCopy (), d (b, x), new Power (b.deepCopy (), new Constant (-1)));
            return new Multiply (e.deepCopy (), new Add (logTerm, ratioTerm));
        }

        if (e instanceof Derivative)  // Der(f, d...) --> Der(f, d..., x)
        {
            Derivative der = (Derivative) e;
            if (! dependsOn (der.target (), x)) return new Constant (0);
            Operator[] directions = new Operator[der.operands.length];
            for (int i = 1; i < der.operands.length; i++) directions[i-1] = der.operands[i].deepCopy ();
            directions[directions.length - 1] = x;
            return new Derivative (der.target ().deepCopy (), directions);
        }

        if (e instanceof Function)
        {
            if (! dependsOn (e, x)) return new Constant (0);
            return new Derivative (e.deepCopy (), x);
        }

        throw new ExpansionException ("Cannot differentiate " + e.render ());
    }

    /**
        @return true if the expression contains a field (which varies with every coordinate) or the coordinate x itself.
    **/
    public static boolean dependsOn (Operator e, Term x)
    {
        class DependencyVisitor extends Visitor
        {
            boolean found;
            public boolean visit (Operator op)
            {
                if (found) return false;
                if (op instanceof Term)
                {
                    Term t = (Term) op;
                    if (t.isField ()  ||  t.equals (x)) found = true;
                }
                return ! found;
            }
        }
        DependencyVisitor v = new DependencyVisitor ();
        e.visit (v);
        return v.found;
    }
}
