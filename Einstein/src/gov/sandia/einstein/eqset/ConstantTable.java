/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gov.sandia.einstein.expand.EinsteinExpansion;
import gov.sandia.einstein.language.ExpressionParser;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.ParseException;
import gov.sandia.einstein.language.SymbolTable;
import gov.sandia.einstein.language.Term;

/**
    Constants of the problem. Inputs are supplied from outside. The rest are defined
    by formulas over other constants and must be computed in dependency order.
**/
public class ConstantTable
{
    public SymbolTable           symbols;
    public Set<String>           inputs      = new LinkedHashSet<String> ();
    public Map<String,Equality>  definitions = new LinkedHashMap<String,Equality> ();
    public int                   maxRounds   = EvaluationOrder.DEFAULT_ROUNDS;

    public ConstantTable (SymbolTable symbols)
    {
        this.symbols = symbols;
    }

    public void addInput (String name)
    {
        symbols.constants.add (name);
        inputs.add (name);
    }

    /**
        Registers name as a constant and parses its formula.
        Every constant the formula refers to should be declared first, or it will be read as a field.
    **/
    public Equality define (String name, String formula) throws ParseException
    {
        symbols.constants.add (name);
        Operator value = ExpressionParser.parseExpression (formula, symbols);
        Equality result = new Equality (new Term (name, true, false), value);
        definitions.put (name, result);
        return result;
    }

    public Map<String,Set<String>> requirements ()
    {
        Map<String,Set<String>> result = new LinkedHashMap<String,Set<String>> ();
        for (Map.Entry<String,Equality> d : definitions.entrySet ())
        {
            Set<String> names = new LinkedHashSet<String> ();
            for (Term t : EinsteinExpansion.collectTerms (d.getValue ().rhs)) names.add (t.name);  // An undeclared name stays unmet, so order() reports it.
            result.put (d.getKey (), names);
        }
        return result;
    }

    /**
        @return Names of the defined constants, in an order where each follows the constants it uses.
    **/
    public List<String> order ()
    {
        return EvaluationOrder.sort (inputs, requirements (), maxRounds);
    }
}
