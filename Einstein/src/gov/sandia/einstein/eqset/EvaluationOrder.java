/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

/**
    Orders named quantities so that each one comes after everything it requires.
    Works in rounds. Each round takes every remaining quantity whose requirements are all
    satisfied by the known names plus those ordered in earlier rounds, in the iteration order
    of the requirements map. A round that makes no progress, or exceeding the round limit,
    ends the sort with a CyclicDependencyException.
**/
public class EvaluationOrder
{
    private static Logger logger = Logger.getLogger (EvaluationOrder.class);

    public static final int DEFAULT_ROUNDS = 1000;

    public static List<String> sort (Collection<String> known, Map<String,? extends Collection<String>> requirements)
    {
        return sort (known, requirements, DEFAULT_ROUNDS);
    }

    /**
        @param known Names that are already available. These are never emitted, even if they also appear as keys of requirements.
        @param requirements For each quantity to be ordered, the names it depends on.
        @param maxRounds Limit on the number of rounds.
        @return Each quantity in requirements, minus the known ones, exactly once.
    **/
    public static List<String> sort (Collection<String> known, Map<String,? extends Collection<String>> requirements, int maxRounds)
    {
        Set<String> satisfied = new HashSet<String> (known);
        Set<String> remaining = new LinkedHashSet<String> ();
        for (String q : requirements.keySet ()) if (! satisfied.contains (q)) remaining.add (q);

        List<String> result = new ArrayList<String> ();
        int rounds = 0;
        while (! remaining.isEmpty ())
        {
            if (rounds >= maxRounds) throw stuck (satisfied, remaining, requirements, rounds);
            rounds++;

            List<String> batch = new ArrayList<String> ();
            for (String q : remaining)
            {
                if (satisfied.containsAll (requires (requirements, q))) batch.add (q);
            }
            if (batch.isEmpty ()) throw stuck (satisfied, remaining, requirements, rounds);

            if (logger.isDebugEnabled ()) logger.debug ("round " + rounds + ": " + batch);
            result   .addAll    (batch);
            satisfied.addAll    (batch);
            remaining.removeAll (batch);
        }
        return result;
    }

    protected static Collection<String> requires (Map<String,? extends Collection<String>> requirements, String q)
    {
        Collection<String> result = requirements.get (q);
        if (result == null) return Collections.emptySet ();
        return result;
    }

    protected static CyclicDependencyException stuck (Set<String> satisfied, Set<String> remaining, Map<String,? extends Collection<String>> requirements, int rounds)
    {
        Map<String,Set<String>> unmet    = new LinkedHashMap<String,Set<String>> ();
        Map<String,Set<String>> subgraph = new LinkedHashMap<String,Set<String>> ();
        for (String q : remaining)
        {
            Set<String> waiting = new LinkedHashSet<String> ();
            Set<String> edges   = new LinkedHashSet<String> ();
            for (String r : requires (requirements, q))
            {
                if (satisfied.contains (r)) continue;
                waiting.add (r);
                if (remaining.contains (r)) edges.add (r);
            }
            unmet   .put (q, waiting);
            subgraph.put (q, edges);
        }
        List<Set<String>> cycles = new StronglyConnected<String> (subgraph).cycles ();
        CyclicDependencyException e = new CyclicDependencyException (unmet, cycles, rounds);
        logger.error (e.getMessage ());
        return e;
    }
}
