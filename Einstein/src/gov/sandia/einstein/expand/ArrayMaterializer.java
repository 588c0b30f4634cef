/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.Term;
import gov.sandia.einstein.language.function.Conservative;
import gov.sandia.einstein.language.function.KroneckerDelta;
import gov.sandia.einstein.language.function.LeviCivita;
import gov.sandia.einstein.language.function.PlainFunction;
import gov.sandia.einstein.language.operator.Add;
import gov.sandia.einstein.language.operator.Multiply;
import gov.sandia.einstein.language.operator.Negate;
import gov.sandia.einstein.language.operator.Power;
import gov.sandia.einstein.language.type.Tensor;

/**
    Converts terms and functions into explicit arrays of scalar expressions, and evaluates
    compound expressions over those arrays. Each axis of an array corresponds to one index symbol.
    Elements are enumerated in row-major order, binding each index to the values 0 through ndim-1.
**/
public class ArrayMaterializer
{
    private static Logger logger = Logger.getLogger (ArrayMaterializer.class);

    protected ExpansionContext context;
    protected int              ndim;

    public ArrayMaterializer (ExpansionContext context)
    {
        this.context = context;
        ndim         = context.ndim;
    }

    /**
        Expands the given term or function and records the result in the dictionary.
        All terms and nested functions that a function depends on must already be recorded.
    **/
    public Materialized materialize (Operator op)
    {
        if (context.contains (op)) return context.get (op);

        Materialized result;
        if      (op instanceof Term)     result = materializeTerm ((Term) op);
        else if (op instanceof Function) result = materializeFunction ((Function) op);
        else throw new ExpansionException ("Only terms and functions can be materialized, not " + op.render ());

        context.put (op, result);
        if (logger.isDebugEnabled ()) logger.debug ("materialized " + op.render () + " as " + result);
        return result;
    }

    protected Materialized materializeTerm (Term term)
    {
        List<Index> raw = term.indices;
        Tensor array = new Tensor (ndim, raw.size ());
        for (int i = 0; i < array.size (); i++) array.setFlat (i, term.expand (array.index (i)));
        return new Materialized (term.name, raw, array);
    }

    protected Materialized materializeFunction (Function f)
    {
        List<Index> raw = IndexSignature.raw (f);
        Tensor array = new Tensor (ndim, raw.size ());
        switch (f.kind ())
        {
            case KRONECKER_DELTA:
                for (int i = 0; i < array.size (); i++)
                {
                    int[] c = array.index (i);
                    array.setFlat (i, new Constant (KroneckerDelta.value (c[0], c[1])));
                }
                break;

            case LEVI_CIVITA:
                if (ndim != 3) throw new ExpansionException ("LC() is only defined for ndim=3, not ndim=" + ndim);
                for (int i = 0; i < array.size (); i++)
                {
                    int[] c = array.index (i);
                    array.setFlat (i, new Constant (LeviCivita.value (c[0], c[1], c[2])));
                }
                break;

            case DERIVATIVE:
            {
                Operator[][] elements = arguments (f, raw, array);
                for (int i = 0; i < elements.length; i++)
                {
                    Operator[] a = elements[i];
                    Operator d = a[0];
                    for (int j = 1; j < a.length; j++) d = Differentiator.differentiate (d, a[j]);  // higher order by composition
                    array.setFlat (i, d);
                }
                break;
            }

            case CONSERVATIVE:
            {
                Operator[][] elements = arguments (f, raw, array);
                for (int i = 0; i < elements.length; i++)
                {
                    Operator[] a = elements[i];
                    array.setFlat (i, new Conservative (a[0], Arrays.copyOfRange (a, 1, a.length)));
                }
                break;
            }

            default:  // PLAIN
            {
                Operator[][] elements = arguments (f, raw, array);
                for (int i = 0; i < elements.length; i++) array.setFlat (i, new PlainFunction (f.name (), elements[i]).simplify ());
            }
        }
        return new Materialized (context.nextName (), raw, array);
    }

    /**
        Evaluates every argument of f, then for each element of the result array gathers the scalar
        argument values that element depends on. The coordinates of an element are split across the
        arguments from left to right, each argument taking as many as it has free indices.
        @return One row per element of array, holding one scalar per argument of f.
    **/
    protected Operator[][] arguments (Function f, List<Index> raw, Tensor array)
    {
        int count = f.operands.length;
        Materialized[] args = new Materialized[count];
        int total = 0;
        for (int a = 0; a < count; a++)
        {
            args[a] = evaluate (f.operands[a]);
            total += args[a].indices.size ();
        }
        if (total != raw.size ()) throw new IllegalStateException ("Arguments of " + f.render () + " carry " + total + " indices, but function has " + raw.size ());

        Operator[][] result = new Operator[array.size ()][count];
        for (int i = 0; i < array.size (); i++)
        {
            int[] c = array.index (i);
            int start = 0;
            for (int a = 0; a < count; a++)
            {
                int r = args[a].indices.size ();
                result[i][a] = args[a].array.get (Arrays.copyOfRange (c, start, start + r)).deepCopy ();
                start += r;
            }
        }
        return result;
    }

    /**
        Computes the array for an arbitrary expression, using the dictionary for terms and functions.
        The result is labeled by the free indices of the expression. Repeated indices are summed.
    **/
    public Materialized evaluate (Operator op)
    {
        List<Index> none = Collections.emptyList ();

        if (op instanceof Constant) return new Materialized (none, Tensor.scalar (ndim, op.deepCopy ()));

        if (op instanceof Term  ||  op instanceof Function)
        {
            Materialized m = context.get (op);
            List<Index> outer = IndexSignature.of (op);
            return new Materialized (m.name, outer, Contraction.contract (outer, m.indices, m.array.copy ()));
        }

        if (op instanceof Index) throw new ExpansionException ("Index " + op + " may only appear as an argument of KD() or LC()");

        if (op instanceof Negate)
        {
            Materialized m = evaluate (((Negate) op).operand);
            return new Materialized (m.indices, Contraction.negate (m.array));
        }

        if (op instanceof Add)
        {
            IndexSignature.of (op);  // Verifies that all addends carry the same set of indices.
            Operator[] addends = ((Add) op).operands;
            Materialized first = evaluate (addends[0]);
            Tensor sum = first.array;
            for (int i = 1; i < addends.length; i++)
            {
                Materialized m = evaluate (addends[i]);
                sum = Contraction.add (first.indices, sum, m.indices, m.array);
            }
            return new Materialized (first.indices, sum);
        }

        if (op instanceof Multiply)
        {
            IndexSignature.of (op);  // Rejects any symbol that occurs more than twice.
            Operator[] factors = ((Multiply) op).operands;
            Materialized first = evaluate (factors[0]);
            List<Index> labels = new ArrayList<Index> (first.indices);
            Tensor product = first.array;
            for (int i = 1; i < factors.length; i++)
            {
                Materialized m = evaluate (factors[i]);
                product = Contraction.outer (product, m.array);
                labels.addAll (m.indices);
                List<Index> outer = IndexSignature.removeRepeated (labels);
                product = Contraction.contract (outer, labels, product);
                labels  = outer;
            }
            return new Materialized (labels, product);
        }

        if (op instanceof Power)
        {
            IndexSignature.of (op);  // Verifies that an indexed base is only squared.
            Power p = (Power) op;
            Materialized base = evaluate (p.operand0);
            if (! base.indices.isEmpty ()) return new Materialized (none, Contraction.selfContract (base.array));
            Materialized exponent = evaluate (p.operand1);
            Operator element = new Power (base.array.get ().deepCopy (), exponent.array.get ().deepCopy ()).simplify ();
            return new Materialized (none, Tensor.scalar (ndim, element));
        }

        throw new ExpansionException ("Cannot evaluate " + op.render ());
    }
}
