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

import org.junit.Test;

import gov.sandia.einstein.language.ParseException;
import gov.sandia.einstein.language.SymbolTable;

public class ConstantTableTest
{
    @Test
    public void testOrder () throws ParseException
    {
        SymbolTable symbols = new SymbolTable ();
        ConstantTable table = new ConstantTable (symbols);
        table.addInput ("gama");
        table.addInput ("R");
        table.define ("cp", "gama*R/(gama-1)");
        table.define ("cv", "cp/gama");
        table.define ("half", "0.5");

        assertTrue (symbols.isConstant ("cp", "cp"));
        assertEquals (Arrays.asList ("cp", "half", "cv"), table.order ());
        assertEquals ("cv = cp*gama^(-1)", table.definitions.get ("cv").render ());
    }

    @Test
    public void testUndeclared () throws ParseException
    {
        ConstantTable table = new ConstantTable (new SymbolTable ());
        table.addInput ("gama");
        table.define ("k", "gama*z");
        try
        {
            table.order ();
            fail ("Expected unmet requirement");
        }
        catch (CyclicDependencyException e)
        {
            assertEquals (Collections.singleton ("z"), e.unmet.get ("k"));
        }
    }
}
