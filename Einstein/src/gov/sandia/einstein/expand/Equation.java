/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gov.sandia.einstein.eqset.Equality;
import gov.sandia.einstein.language.ExpressionParser;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.ParseException;
import gov.sandia.einstein.language.SymbolTable;
import gov.sandia.einstein.language.Transformer;

/**
    One equation as written by the user, together with the context needed to expand it.
    Substitution rules are applied once, at construction.
**/
public class Equation
{
    public String         text;
    public int            ndim;
    public SymbolTable    symbols;
    public List<Equality> substitutions;
    public Equality       parsed;  // after substitution

    public Equation (String text, int ndim, SymbolTable symbols) throws ParseException
    {
        this (text, ndim, symbols, Collections.<String>emptyList ());
    }

    public Equation (String text, int ndim, SymbolTable symbols, List<String> substitutions) throws ParseException
    {
        this.text    = text;
        this.ndim    = ndim;
        this.symbols = symbols;
        this.substitutions = new ArrayList<Equality> ();
        for (String s : substitutions) this.substitutions.add (ExpressionParser.parse (s, symbols));

        parsed = ExpressionParser.parse (text, symbols);
        parsed.lhs = substitute (parsed.lhs, this.substitutions);
        parsed.rhs = substitute (parsed.rhs, this.substitutions);
    }

    /**
        Replaces every sub-tree structurally equal to the left side of a rule with a copy of its right side.
        Rules apply in list order, so a later rule may rewrite the output of an earlier one.
    **/
    public static Operator substitute (Operator op, List<Equality> rules)
    {
        for (final Equality rule : rules)
        {
            op = op.transform (new Transformer ()
            {
                public Operator transform (Operator o)
                {
                    if (o.equals (rule.lhs)) return rule.rhs.deepCopy ();
                    return null;
                }
            });
        }
        return op;
    }

    /**
        @return Explicit scalar equations in row-major order of the free indices.
        @throws ExpansionException with the text of this equation attached.
    **/
    public List<Equality> expand ()
    {
        try
        {
            return new EinsteinExpansion (ndim, symbols).expand (parsed.deepCopy ());
        }
        catch (ExpansionException e)
        {
            if (e.equation == null) e.equation = text;
            throw e;
        }
    }

    public String toString ()
    {
        return text;
    }
}
