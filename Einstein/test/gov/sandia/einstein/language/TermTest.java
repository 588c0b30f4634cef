/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class TermTest
{
    @Test
    public void testFromName () throws ParseException
    {
        SymbolTable symbols = new SymbolTable ("c");
        Term tau = Term.fromName ("tau_i_j", symbols);
        assertEquals ("tau", tau.base);
        assertEquals (Arrays.asList (new Index ("i"), new Index ("j")), tau.indices);
        assertTrue (tau.isField ());
        assertTrue (tau.isIndexed ());

        Term c = Term.fromName ("c_j", symbols);
        assertTrue (c.constant);
        assertFalse (c.coordinate);
    }

    @Test(expected = ParseException.class)
    public void testNumericIndex () throws ParseException
    {
        Term.fromName ("u_1", new SymbolTable ());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testIndicesImmutable () throws ParseException
    {
        Term.fromName ("u_i", new SymbolTable ()).indices.add (new Index ("k"));
    }

    @Test
    public void testExpand () throws ParseException
    {
        SymbolTable symbols = new SymbolTable ();
        Term tau = Term.fromName ("tau_i_j", symbols);
        Term element = tau.expand (new int[] {0, 1});
        assertEquals ("tau01", element.name);
        assertFalse (element.isIndexed ());
        assertTrue (element.isField ());

        Term x = Term.fromName ("x_j", symbols);
        Term x1 = x.expand (new int[] {1});
        assertEquals ("x1", x1.name);
        assertTrue (x1.coordinate);
        assertEquals (Term.fromName ("x1", symbols), x1);
    }

    @Test
    public void testEquality () throws ParseException
    {
        SymbolTable symbols = new SymbolTable ("Re");
        assertEquals (Term.fromName ("u_i", symbols), Term.fromName ("u_i", symbols));
        assertEquals (Term.fromName ("u_i", symbols).hashCode (), Term.fromName ("u_i", symbols).hashCode ());
        assertNotEquals (Term.fromName ("u_i", symbols), Term.fromName ("u_j", symbols));
        assertNotEquals (new Term ("Re", true, false), new Term ("Re", false, false));
    }
}
