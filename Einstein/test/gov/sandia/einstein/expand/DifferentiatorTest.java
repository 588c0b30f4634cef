/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.ParseException;
import gov.sandia.einstein.language.SymbolTable;
import gov.sandia.einstein.language.Term;

public class DifferentiatorTest
{
    SymbolTable symbols = new SymbolTable ("Re", "gama");

    protected String d (String expression, String direction) throws ParseException
    {
        Operator e = Operator.parse (expression, symbols);
        Operator x = Operator.parse (direction, symbols);
        return Differentiator.differentiate (e, x).render ();
    }

    @Test
    public void testRules () throws ParseException
    {
        String[] cases =
        {
            // expression     direction  result
            "Re",             "x0",      "0",
            "3",              "x0",      "0",
            "x0",             "x0",      "1",
            "x1",             "x0",      "0",
            "t",              "x0",      "0",
            "rho",            "x0",      "Der(rho, x0)",
            "rho",            "t",       "Der(rho, t)",
            "x0*x0",          "x0",      "x0+x0",
            "rho*u0",         "x0",      "Der(rho, x0)*u0+rho*Der(u0, x0)",
            "Re*u0",          "x1",      "Re*Der(u0, x1)",
            "-p",             "x0",      "-Der(p, x0)",
            "u0^2",           "x0",      "2*u0*Der(u0, x0)",
            "x0^x0",          "x0",      "x0^x0*(log(x0)+x0*x0^(-1))",
            "Der(u0,x0)",     "x1",      "Der(u0, x0, x1)",
            "log(p)",         "x0",      "Der(log(p), x0)",
            "log(Re)",        "x0",      "0",
        };
        for (int i = 0; i < cases.length; i += 3)
        {
            assertEquals (cases[i] + " by " + cases[i+1], cases[i+2], d (cases[i], cases[i+1]));
        }
    }

    @Test
    public void testDirection () throws ParseException
    {
        String[] bad = {"rho", "Re", "x_j", "2"};
        for (String direction : bad)
        {
            try
            {
                d ("u0", direction);
                fail ("Expected failure for direction " + direction);
            }
            catch (ExpansionException e)
            {
            }
        }
    }

    @Test
    public void testDependsOn () throws ParseException
    {
        Term x0 = new Term ("x0", false, true);
        assertTrue  (Differentiator.dependsOn (Operator.parse ("Re*rho", symbols), x0));
        assertTrue  (Differentiator.dependsOn (Operator.parse ("2*x0",   symbols), x0));
        assertFalse (Differentiator.dependsOn (Operator.parse ("Re*x1",  symbols), x0));
    }
}
