/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.einstein.expand.Equation;
import gov.sandia.einstein.expand.ExpansionException;
import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.Term;
import gov.sandia.einstein.language.Visitor;

/**
    A named group of equations that are expanded together.
    A failure in one equation is logged and recorded, and does not stop the others.
**/
public class EquationSet
{
    private static Logger logger = Logger.getLogger (EquationSet.class);

    public String                                name;
    public List<Equation>                        equations = new ArrayList<Equation> ();
    protected Map<Equation,List<Equality>>       expanded  = new LinkedHashMap<Equation,List<Equality>> ();
    protected Map<Equation,ExpansionException>   failures  = new LinkedHashMap<Equation,ExpansionException> ();
    protected boolean                            done;

    public EquationSet (String name)
    {
        this.name = name;
    }

    public Equation add (Equation e)
    {
        equations.add (e);
        done = false;
        return e;
    }

    public EquationSet expandAll ()
    {
        expanded.clear ();
        failures.clear ();
        for (Equation e : equations)
        {
            try
            {
                expanded.put (e, e.expand ());
            }
            catch (ExpansionException x)
            {
                logger.warn (name + ": " + x.getMessage ());
                failures.put (e, x);
            }
        }
        done = true;
        logger.debug (name + ": expanded " + expanded.size () + " of " + equations.size () + " equations");
        return this;
    }

    /**
        @return Every scalar equation, grouped by source equation in the order the equations were added.
    **/
    public List<Equality> expanded ()
    {
        if (! done) expandAll ();
        List<Equality> result = new ArrayList<Equality> ();
        for (List<Equality> l : expanded.values ()) result.addAll (l);
        return result;
    }

    public List<Equality> expanded (Equation e)
    {
        if (! done) expandAll ();
        List<Equality> result = expanded.get (e);
        if (result == null) return Collections.emptyList ();
        return result;
    }

    public Map<Equation,ExpansionException> failures ()
    {
        if (! done) expandAll ();
        return failures;
    }

    /**
        @return Names of all field terms in the expanded equations, on either side.
    **/
    public Set<String> requiredFields ()
    {
        Set<String> result = new LinkedHashSet<String> ();
        for (Equality e : expanded ()) collectTerms (e, result, false);
        return result;
    }

    public Set<String> requiredConstants ()
    {
        Set<String> result = new LinkedHashSet<String> ();
        for (Equality e : expanded ()) collectTerms (e, result, true);
        return result;
    }

    /**
        @return The distinct outermost function nodes in the expanded equations,
        such as Der(u0, x1) or Conservative(rho*u0, x0).
    **/
    public Set<Operator> requiredFunctions ()
    {
        final Set<Operator> result = new LinkedHashSet<Operator> ();
        Visitor v = new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof Function)
                {
                    result.add (op);
                    return false;
                }
                return true;
            }
        };
        for (Equality e : expanded ())
        {
            e.lhs.visit (v);
            e.rhs.visit (v);
        }
        return result;
    }

    protected static void collectTerms (Equality e, Set<String> result, boolean constants)
    {
        collectTerms (e.lhs, result, constants);
        collectTerms (e.rhs, result, constants);
    }

    protected static void collectTerms (Operator op, final Set<String> result, final boolean constants)
    {
        op.visit (new Visitor ()
        {
            public boolean visit (Operator o)
            {
                if (o instanceof Term)
                {
                    Term t = (Term) o;
                    if (constants ? t.constant : t.isField ()) result.add (t.name);
                }
                return true;
            }
        });
    }

    public String toString ()
    {
        return name;
    }
}
