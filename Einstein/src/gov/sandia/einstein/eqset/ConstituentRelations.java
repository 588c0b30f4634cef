/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gov.sandia.einstein.expand.Equation;
import gov.sandia.einstein.expand.ExpansionException;
import gov.sandia.einstein.language.Term;

/**
    Auxiliary quantities defined by formulas over other quantities, for example pressure from
    density, momentum and energy. After expansion each scalar relation defines exactly one field.
    order() finds a sequence in which they can be evaluated.
**/
public class ConstituentRelations extends EquationSet
{
    public int maxRounds = EvaluationOrder.DEFAULT_ROUNDS;

    public ConstituentRelations ()
    {
        super ("relations");
    }

    /**
        @return Each defined quantity mapped to its scalar relation.
        @throws ExpansionException if a relation does not define a single field.
    **/
    public Map<String,Equality> relations ()
    {
        Map<String,Equality> result = new LinkedHashMap<String,Equality> ();
        for (Equation source : equations)
        {
            for (Equality e : expanded (source))
            {
                String problem = null;
                if (! (e.lhs instanceof Term)  ||  ! ((Term) e.lhs).isField ())
                {
                    problem = "Relation must define a single field: " + e;
                }
                else if (result.containsKey (((Term) e.lhs).name))
                {
                    problem = "Quantity " + ((Term) e.lhs).name + " is defined by more than one relation";
                }
                if (problem != null)
                {
                    ExpansionException x = new ExpansionException (problem);
                    x.equation = source.text;
                    throw x;
                }
                result.put (((Term) e.lhs).name, e);
            }
        }
        return result;
    }

    /**
        @return Each defined quantity mapped to the names of the fields its formula refers to.
    **/
    public Map<String,Set<String>> requirements ()
    {
        Map<String,Set<String>> result = new LinkedHashMap<String,Set<String>> ();
        for (Map.Entry<String,Equality> r : relations ().entrySet ())
        {
            Set<String> fields = new LinkedHashSet<String> ();
            collectTerms (r.getValue ().rhs, fields, false);
            result.put (r.getKey (), fields);
        }
        return result;
    }

    public List<String> order (Collection<String> known)
    {
        return EvaluationOrder.sort (known, requirements (), maxRounds);
    }
}
