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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

import gov.sandia.einstein.expand.Equation;
import gov.sandia.einstein.expand.ExpansionException;
import gov.sandia.einstein.language.ParseException;
import gov.sandia.einstein.language.SymbolTable;

public class ConstituentRelationsTest
{
    SymbolTable symbols = new SymbolTable ("gama", "R");

    protected ConstituentRelations relations (String... texts) throws ParseException
    {
        ConstituentRelations result = new ConstituentRelations ();
        for (String t : texts) result.add (new Equation (t, 2, symbols));
        return result;
    }

    @Test
    public void testOrder () throws ParseException
    {
        ConstituentRelations r = relations
        (
            "T = p/(rho*R)",
            "Eq(u_i, rhou_i/rho)",
            "p = (gama-1)*(rhoE - rho*u_j**2/2)"
        );

        Map<String,Set<String>> requirements = r.requirements ();
        assertEquals (4, requirements.size ());
        assertEquals (new HashSet<String> (Arrays.asList ("rhoE", "rho", "u0", "u1")), requirements.get ("p"));
        assertEquals (new HashSet<String> (Arrays.asList ("p", "rho")), requirements.get ("T"));

        List<String> order = r.order (Arrays.asList ("rho", "rhou0", "rhou1", "rhoE"));
        assertEquals (Arrays.asList ("u0", "u1", "p", "T"), order);
    }

    @Test
    public void testCycle () throws ParseException
    {
        ConstituentRelations r = relations ("a = 2*b", "b = a + c");
        try
        {
            r.order (Arrays.asList ("c"));
            fail ("Expected cycle");
        }
        catch (CyclicDependencyException e)
        {
            assertEquals (1, e.cycles.size ());
        }
    }

    @Test
    public void testBadRelation () throws ParseException
    {
        // Last entry in each row is the relation that should be blamed.
        String[][] cases =
        {
            {"Eq(2*a, b)"},
            {"Eq(R, b)"},
            {"a = b", "a = c"},
            {"Eq(u_i, v_i)", "u1 = 2"},
        };
        for (String[] c : cases)
        {
            String blamed = c[c.length - 1];
            try
            {
                relations (c).relations ();
                fail ("Expected failure for " + Arrays.toString (c));
            }
            catch (ExpansionException e)
            {
                assertEquals (blamed, e.equation);
                assertTrue (e.getMessage (), e.getMessage ().endsWith (" in equation: " + blamed));
            }
        }
    }
}
