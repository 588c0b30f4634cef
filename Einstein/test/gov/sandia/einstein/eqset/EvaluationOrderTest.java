/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class EvaluationOrderTest
{
    /**
        Builds a requirements map from pairs of name and comma-separated dependencies.
    **/
    protected static Map<String,Set<String>> requirements (String... pairs)
    {
        Map<String,Set<String>> result = new LinkedHashMap<String,Set<String>> ();
        for (int i = 0; i < pairs.length; i += 2)
        {
            Set<String> r = new HashSet<String> ();
            if (! pairs[i+1].isEmpty ()) r.addAll (Arrays.asList (pairs[i+1].split (",")));
            result.put (pairs[i], r);
        }
        return result;
    }

    protected static List<String> known (String... names)
    {
        return Arrays.asList (names);
    }

    @Test
    public void testSort ()
    {
        assertEquals (Arrays.asList ("p", "T"),      EvaluationOrder.sort (known ("u0", "u1"), requirements ("p", "u0,u1", "T", "p")));
        assertEquals (Arrays.asList ("c", "b", "d"), EvaluationOrder.sort (known ("a"), requirements ("c", "a", "b", "a", "d", "b,c")));
        assertEquals (Arrays.asList ("x", "y"),      EvaluationOrder.sort (known (), requirements ("y", "x", "x", "")));
        assertTrue (EvaluationOrder.sort (known ("a"), requirements ()).isEmpty ());
    }

    @Test
    public void testKnownNotEmitted ()
    {
        List<String> order = EvaluationOrder.sort (known ("a"), requirements ("a", "b", "b", ""));
        assertEquals (Arrays.asList ("b"), order);
    }

    @Test
    public void testNullRequirements ()
    {
        Map<String,Set<String>> r = new LinkedHashMap<String,Set<String>> ();
        r.put ("a", null);
        assertEquals (Arrays.asList ("a"), EvaluationOrder.sort (Collections.<String>emptySet (), r));
    }

    @Test
    public void testCycle ()
    {
        try
        {
            EvaluationOrder.sort (known ("z"), requirements ("q", "z", "a", "b", "b", "a"));
            fail ("Expected cycle");
        }
        catch (CyclicDependencyException e)
        {
            assertEquals (1, e.cycles.size ());
            assertEquals (new HashSet<String> (Arrays.asList ("a", "b")), e.cycles.get (0));
            assertEquals (2, e.unmet.size ());
            assertEquals (2, e.rounds);
        }

        try
        {
            EvaluationOrder.sort (known (), requirements ("a", "a"));
            fail ("Expected self-loop");
        }
        catch (CyclicDependencyException e)
        {
            assertEquals (1, e.cycles.size ());
        }
    }

    @Test
    public void testMissing ()
    {
        try
        {
            EvaluationOrder.sort (known (), requirements ("p", "q"));
            fail ("Expected unmet requirement");
        }
        catch (CyclicDependencyException e)
        {
            assertTrue (e.cycles.isEmpty ());
            assertEquals (Collections.singleton ("q"), e.unmet.get ("p"));
        }
    }

    @Test
    public void testRoundLimit ()
    {
        Map<String,Set<String>> chain = requirements ("e", "d", "d", "c", "c", "b", "b", "a", "a", "");
        assertEquals (Arrays.asList ("a", "b", "c", "d", "e"), EvaluationOrder.sort (known (), chain));
        try
        {
            EvaluationOrder.sort (known (), chain, 3);
            fail ("Expected round limit");
        }
        catch (CyclicDependencyException e)
        {
            assertEquals (3, e.rounds);
            assertEquals (2, e.unmet.size ());
            assertTrue (e.cycles.isEmpty ());
        }
    }
}
