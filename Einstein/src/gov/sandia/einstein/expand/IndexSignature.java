/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.Term;
import gov.sandia.einstein.language.Visitor;
import gov.sandia.einstein.language.operator.Add;
import gov.sandia.einstein.language.operator.Multiply;
import gov.sandia.einstein.language.operator.Negate;
import gov.sandia.einstein.language.operator.Power;

/**
    Determines the free indices of an expression. A symbol that occurs exactly twice within
    a product (or within a single term or function) is summed and drops out. The order of
    the result follows first occurrence.
**/
public class IndexSignature
{
    public static List<Index> of (Operator op)
    {
        if (op instanceof Term)     return removeRepeated (((Term) op).indices);
        if (op instanceof Index)    return Collections.singletonList ((Index) op);
        if (op instanceof Constant) return Collections.emptyList ();
        if (op instanceof Negate)   return of (((Negate) op).operand);
        if (op instanceof Function) return removeRepeated (raw ((Function) op));

        if (op instanceof Multiply)
        {
            List<Index> all = new ArrayList<Index> ();
            for (Operator o : ((Multiply) op).operands) all.addAll (of (o));
            return removeRepeated (all);
        }

        if (op instanceof Add)
        {
            Operator[] addends = ((Add) op).operands;
            List<Index> first = of (addends[0]);
            HashSet<Index> firstSet = new HashSet<Index> (first);
            for (int i = 1; i < addends.length; i++)
            {
                List<Index> next = of (addends[i]);
                if (next.size () != first.size ()  ||  ! firstSet.equals (new HashSet<Index> (next)))
                {
                    throw new IndexMismatchException ("Addends of a sum have different free indices: " + addends[0].render () + " has " + first + " but " + addends[i].render () + " has " + next);
                }
            }
            return first;
        }

        if (op instanceof Power)
        {
            Power p = (Power) op;
            if (hasIndexedTerms (p.operand1)) throw new UnsupportedPowerException ("Exponent may not carry indices: " + p.render ());
            List<Index> base = of (p.operand0);
            if (base.isEmpty ()) return base;
            if (! isTwo (p.operand1)) throw new UnsupportedPowerException ("Indexed base may only be squared: " + p.render ());
            return Collections.emptyList ();  // full self-contraction
        }

        return Collections.emptyList ();
    }

    /**
        The index list of a function before summation elimination.
        For KD and LC these are the index arguments themselves.
        For all other functions, the free indices of each argument, concatenated in argument order.
    **/
    public static List<Index> raw (Function f)
    {
        List<Index> result = new ArrayList<Index> ();
        Function.Kind kind = f.kind ();
        if (kind == Function.Kind.KRONECKER_DELTA  ||  kind == Function.Kind.LEVI_CIVITA)
        {
            for (Operator o : f.operands) result.add ((Index) o);
            return result;
        }
        for (Operator o : f.operands) result.addAll (of (o));
        return result;
    }

    /**
        Drops every symbol that occurs exactly twice. Symbols that occur once are kept in order of appearance.
        @throws IndexMismatchException if any symbol occurs more than twice.
    **/
    public static List<Index> removeRepeated (List<Index> indices)
    {
        Map<Index,Integer> counts = new LinkedHashMap<Index,Integer> ();
        for (Index i : indices)
        {
            Integer c = counts.get (i);
            counts.put (i, c == null ? 1 : c + 1);
        }
        List<Index> result = new ArrayList<Index> ();
        for (Entry<Index,Integer> e : counts.entrySet ())
        {
            int c = e.getValue ();
            if (c > 2) throw new IndexMismatchException ("Index " + e.getKey () + " occurs " + c + " times in " + indices);
            if (c == 1) result.add (e.getKey ());
        }
        return result;
    }

    public static boolean hasIndexedTerms (Operator op)
    {
        class IndexedVisitor extends Visitor
        {
            boolean found;
            public boolean visit (Operator o)
            {
                if (found) return false;
                if (o instanceof Index  ||  o instanceof Term  &&  ((Term) o).isIndexed ()) found = true;
                return ! found;
            }
        }
        IndexedVisitor v = new IndexedVisitor ();
        op.visit (v);
        return v.found;
    }

    public static boolean isTwo (Operator op)
    {
        Operator e = op.deepCopy ().simplify ();
        return e.isScalar ()  &&  e.getDouble () == 2;
    }
}
