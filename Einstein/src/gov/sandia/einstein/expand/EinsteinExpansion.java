/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.einstein.eqset.Equality;
import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.SymbolTable;
import gov.sandia.einstein.language.Term;
import gov.sandia.einstein.language.Visitor;
import gov.sandia.einstein.language.type.Tensor;

/**
    Expands one equation in index notation into explicit scalar equations.
    <ol>
    <li>Materialize every distinct term.
    <li>Materialize Kronecker delta and Levi-Civita symbols.
    <li>Materialize the remaining functions, innermost first, each under a placeholder name ArrN.
    <li>Evaluate both sides through the dictionary.
    <li>Check that the sides match, then emit one equation per element in row-major order.
    </ol>
    An instance may be reused, but each call to expand() works in a fresh context.
**/
public class EinsteinExpansion
{
    private static Logger logger = Logger.getLogger (EinsteinExpansion.class);

    public enum TermClass
    {
        CONSTANT_SCALAR,
        CONSTANT_INDEXED,
        COORDINATE,
        FIELD
    }

    public int                   ndim;
    public SymbolTable           symbols;
    public Map<Term,TermClass>   classes;  // from most recent call to expand()
    protected ExpansionContext   context;
    protected ArrayMaterializer  materializer;

    public EinsteinExpansion (int ndim, SymbolTable symbols)
    {
        if (ndim < 1) throw new IllegalArgumentException ("ndim must be at least 1");
        this.ndim    = ndim;
        this.symbols = symbols;
    }

    /**
        The implicit arguments of every field: the spatial coordinates followed by time.
        Once expand() has run, a vector coordinate in the equation (such as x_j) supplies the spatial
        coordinates as its own elements. Otherwise they are named from the symbol table.
    **/
    public List<Term> coordinates ()
    {
        List<Term> result = new ArrayList<Term> ();
        if (classes != null)
        {
            for (Map.Entry<Term,TermClass> e : classes.entrySet ())
            {
                Term t = e.getKey ();
                if (e.getValue () != TermClass.COORDINATE  ||  t.indices.size () != 1) continue;
                Tensor elements = context.get (t).array;
                for (int i = 0; i < ndim; i++) result.add ((Term) elements.get (i));
                break;
            }
        }
        if (result.isEmpty ())
        {
            for (int i = 0; i < ndim; i++) result.add (new Term (symbols.coordinate + i, false, true));
        }
        result.add (new Term (symbols.time, false, true));
        return result;
    }

    /**
        @return The distinct terms of the most recently expanded equation that fall in the given class.
    **/
    public List<Term> terms (TermClass c)
    {
        List<Term> result = new ArrayList<Term> ();
        if (classes == null) return result;
        for (Map.Entry<Term,TermClass> e : classes.entrySet ()) if (e.getValue () == c) result.add (e.getKey ());
        return result;
    }

    public static TermClass classify (Term t)
    {
        if (t.constant) return t.isIndexed () ? TermClass.CONSTANT_INDEXED : TermClass.CONSTANT_SCALAR;
        if (t.coordinate) return TermClass.COORDINATE;
        return TermClass.FIELD;
    }

    public List<Equality> expand (Equality equation)
    {
        context      = new ExpansionContext (ndim);
        materializer = new ArrayMaterializer (context);
        classes      = new LinkedHashMap<Term,TermClass> ();

        Operator lhs = equation.lhs;
        Operator rhs = equation.rhs;
        IndexSignature.of (lhs);
        IndexSignature.of (rhs);

        // Terms
        for (Term t : collectTerms (lhs, rhs))
        {
            classes.put (t, classify (t));
            materializer.materialize (t);
        }

        // Kronecker delta and Levi-Civita
        List<Function> functions = collectFunctions (lhs, rhs);
        Iterator<Function> it = functions.iterator ();
        while (it.hasNext ())
        {
            Function f = it.next ();
            Function.Kind kind = f.kind ();
            if (kind == Function.Kind.KRONECKER_DELTA  ||  kind == Function.Kind.LEVI_CIVITA)
            {
                materializer.materialize (f);
                it.remove ();
            }
        }

        // Other functions, in rounds until all nested functions are resolved
        while (! functions.isEmpty ())
        {
            boolean progress = false;
            it = functions.iterator ();
            while (it.hasNext ())
            {
                Function f = it.next ();
                if (! ready (f)) continue;
                materializer.materialize (f);
                it.remove ();
                progress = true;
            }
            if (! progress) throw new UnknownTermException ("Could not resolve nested functions: " + functions);
        }

        Materialized left  = materializer.evaluate (lhs);
        Materialized right = materializer.evaluate (rhs);

        int rank = left.array.rank ();
        if (rank != right.array.rank ())
        {
            throw new ShapeMismatchException ("Left side has free indices " + left.indices + " but right side has " + right.indices);
        }
        Tensor r = right.array;
        if (rank > 0)
        {
            if (! new HashSet<Index> (left.indices).equals (new HashSet<Index> (right.indices)))
            {
                throw new IndexMismatchException ("Left side has free indices " + left.indices + " but right side has " + right.indices);
            }
            if (! left.indices.equals (right.indices))
            {
                int[] order = new int[rank];
                for (int a = 0; a < rank; a++) order[a] = right.indices.indexOf (left.indices.get (a));
                r = r.permute (order);
            }
        }

        List<Equality> result = new ArrayList<Equality> ();
        for (int i = 0; i < left.array.size (); i++)
        {
            Operator l = left.array.getFlat (i).deepCopy ().simplify ();
            Operator v = r         .getFlat (i).deepCopy ().simplify ();
            result.add (new Equality (l, v, rank == 0 ? -1 : i));
        }
        if (logger.isDebugEnabled ())
        {
            logger.debug ("fields " + terms (TermClass.FIELD) + " over " + coordinates ());
            for (Equality e : result) logger.debug ("expanded " + e);
        }
        return result;
    }

    /**
        @return true if every function nested within the arguments of f has already been materialized.
    **/
    protected boolean ready (Function f)
    {
        class ReadyVisitor extends Visitor
        {
            boolean ready = true;
            public boolean visit (Operator op)
            {
                if (! ready) return false;
                if (op instanceof Function  &&  ! context.contains (op)) ready = false;
                return ready;
            }
        }
        ReadyVisitor v = new ReadyVisitor ();
        for (Operator o : f.operands) o.visit (v);
        return v.ready;
    }

    public static Set<Term> collectTerms (Operator... roots)
    {
        final Set<Term> result = new LinkedHashSet<Term> ();
        Visitor v = new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof Term) result.add ((Term) op);
                return true;
            }
        };
        for (Operator r : roots) r.visit (v);
        return result;
    }

    /**
        @return Distinct functions in the given trees, each listed after the functions nested inside it.
    **/
    public static List<Function> collectFunctions (Operator... roots)
    {
        final Set<Function> result = new LinkedHashSet<Function> ();
        Visitor v = new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof Function)
                {
                    Function f = (Function) op;
                    for (Operator o : f.operands) o.visit (this);
                    result.add (f);
                    return false;
                }
                return true;
            }
        };
        for (Operator r : roots) r.visit (v);
        return new ArrayList<Function> (result);
    }
}
