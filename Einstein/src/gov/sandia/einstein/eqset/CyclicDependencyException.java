/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

/**
    Some quantities could never be scheduled because their requirements were not satisfied.
    Carries each stuck quantity with the requirements it was still waiting on, and any exact
    dependency cycles among the stuck quantities.
**/
@SuppressWarnings("serial")
public class CyclicDependencyException extends RuntimeException
{
    public Map<String,Set<String>> unmet;
    public List<Set<String>>       cycles;
    public int                     rounds;

    public CyclicDependencyException (Map<String,Set<String>> unmet, List<Set<String>> cycles, int rounds)
    {
        super (describe (unmet, cycles, rounds));
        this.unmet  = unmet;
        this.cycles = cycles;
        this.rounds = rounds;
    }

    protected static String describe (Map<String,Set<String>> unmet, List<Set<String>> cycles, int rounds)
    {
        StringBuilder result = new StringBuilder ("Could not order dependencies after " + rounds + " rounds.");
        for (Entry<String,Set<String>> e : unmet.entrySet ())
        {
            result.append ("\n  " + e.getKey () + " waits on " + e.getValue ());
        }
        for (Set<String> c : cycles)
        {
            result.append ("\n  cycle: " + c);
        }
        return result.toString ();
    }
}
