/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.einstein.db.MNode;
import gov.sandia.einstein.expand.Equation;
import gov.sandia.einstein.language.ExpressionParser;
import gov.sandia.einstein.language.ParseException;
import gov.sandia.einstein.language.SymbolTable;

/**
    Everything needed to expand a system of equations, built from a problem document:
    <pre>
    ndim:3
    coordinate:x
    time:t
    constants
     Re
     gama:1.4
    substitutions
     0:Eq(tau_i_j, (Der(u_i,x_j) + Der(u_j,x_i))/Re)
    equations
     mass:Eq(Der(rho,t), -Conservative(rho*u_j,x_j))
    relations
     0:Eq(p, (gama-1)*(rhoE - rho*u_j**2/2))
    known
     rho
    maxRounds:1000
    </pre>
    A constant with no value is an input. A constant with a value is defined by that formula.
    An entry that fails to parse is recorded in parseFailures under its path, such as equations.mass,
    and the remaining entries load as usual.
**/
public class Problem
{
    private static Logger logger = Logger.getLogger (Problem.class);

    public int                  ndim;
    public SymbolTable          symbols;
    public ConstantTable        constants;
    public List<String>         substitutions = new ArrayList<String> ();
    public EquationSet          equations     = new EquationSet ("equations");
    public ConstituentRelations relations     = new ConstituentRelations ();
    public Set<String>          known         = new LinkedHashSet<String> ();
    public int                  maxRounds;
    public Map<String,ParseException> parseFailures = new LinkedHashMap<String,ParseException> ();

    /**
        @throws IllegalArgumentException if ndim or maxRounds is not a usable number.
    **/
    public Problem (MNode doc)
    {
        ndim = integer (doc, 3, "ndim");
        if (ndim < 1) throw new IllegalArgumentException ("ndim must be at least 1, not " + ndim);
        maxRounds = integer (doc, EvaluationOrder.DEFAULT_ROUNDS, "maxRounds");

        symbols = new SymbolTable ();
        symbols.coordinate = doc.getOrDefault ("x", "coordinate");
        symbols.time       = doc.getOrDefault ("t", "time");

        // Declare every constant before parsing any formula, so that definitions may refer to each other in any order.
        constants = new ConstantTable (symbols);
        constants.maxRounds = maxRounds;
        for (MNode c : doc.childOrEmpty ("constants")) symbols.constants.add (c.key ());
        for (MNode c : doc.childOrEmpty ("constants"))
        {
            String formula = c.get ();
            if (formula.isEmpty ())
            {
                constants.addInput (c.key ());
                continue;
            }
            try
            {
                constants.define (c.key (), formula);
            }
            catch (ParseException e)
            {
                fail ("constants." + c.key (), e);
            }
        }

        for (MNode s : doc.childOrEmpty ("substitutions"))
        {
            String rule = text (s);
            try
            {
                ExpressionParser.parse (rule, symbols);
                substitutions.add (rule);
            }
            catch (ParseException e)
            {
                fail ("substitutions." + s.key (), e);
            }
        }

        load ("equations", doc, equations);
        load ("relations", doc, relations);
        relations.maxRounds = maxRounds;
        for (MNode k : doc.childOrEmpty ("known")) known.add (k.key ());

        logger.info ("Loaded problem with ndim=" + ndim + ", " + equations.equations.size () + " equations and " + relations.equations.size () + " relations");
    }

    protected void load (String key, MNode doc, EquationSet set)
    {
        for (MNode e : doc.childOrEmpty (key))
        {
            try
            {
                set.add (new Equation (text (e), ndim, symbols, substitutions));
            }
            catch (ParseException x)
            {
                fail (key + "." + e.key (), x);
            }
        }
    }

    protected void fail (String key, ParseException e)
    {
        logger.warn (key + ": " + e.getMessage ());
        parseFailures.put (key, e);
    }

    protected static int integer (MNode doc, int defaultValue, String key)
    {
        try
        {
            return doc.getOrDefault (defaultValue, key);
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException (key + " must be a number, not \"" + doc.get (key) + "\"", e);
        }
    }

    /**
        An entry in a list may be written either as key:text or as the bare text in the key position.
    **/
    protected static String text (MNode n)
    {
        if (n.data ()) return n.get ();
        return n.key ();
    }
}
