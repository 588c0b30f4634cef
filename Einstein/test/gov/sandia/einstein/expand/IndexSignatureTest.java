/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.ParseException;
import gov.sandia.einstein.language.SymbolTable;

public class IndexSignatureTest
{
    SymbolTable symbols = new SymbolTable ("Re");

    protected String signature (String expression) throws ParseException
    {
        List<Index> indices = IndexSignature.of (Operator.parse (expression, symbols));
        List<String> names = new ArrayList<String> ();
        for (Index i : indices) names.add (i.name);
        return String.join (",", names);
    }

    @Test
    public void testSignatures () throws ParseException
    {
        String[] cases =
        {
            "3",                              "",
            "Re",                             "",
            "u_i",                            "i",
            "tau_i_j",                        "i,j",
            "tau_i_i",                        "",
            "u_i*v_i",                        "",
            "u_i*v_j",                        "i,j",
            "a_k*tau_i_j*b_k",                "i,j",
            "-u_i",                           "i",
            "Der(u_i,x_j)+Der(u_j,x_i)",      "i,j",
            "Der(u_i,x_i)",                   "",
            "Der(rho,t)",                     "",
            "Conservative(rho*u_j,x_j)",      "",
            "Conservative(rhou_i*u_j,x_j)",   "i",
            "KD(i,j)",                        "i,j",
            "LC(i,j,k)*u_j*v_k",              "i",
            "u_j**2",                         "",
            "Re**2",                          "",
            "log(p_i)",                       "i",
        };
        for (int i = 0; i < cases.length; i += 2)
        {
            assertEquals (cases[i], cases[i+1], signature (cases[i]));
        }
    }

    @Test
    public void testErrors () throws ParseException
    {
        Object[] cases =
        {
            "u_i*v_i*w_i",   IndexMismatchException.class,
            "u_i + v_j",     IndexMismatchException.class,
            "u_i + 1",       IndexMismatchException.class,
            "tau_i_i_i",     IndexMismatchException.class,
            "u_i**3",        UnsupportedPowerException.class,
            "a**u_i",        UnsupportedPowerException.class,
            "a**(u_i*u_i)",  UnsupportedPowerException.class,
        };
        for (int i = 0; i < cases.length; i += 2)
        {
            String expression = (String) cases[i];
            Operator op = Operator.parse (expression, symbols);
            try
            {
                IndexSignature.of (op);
                fail ("Expected failure for " + expression);
            }
            catch (ExpansionException e)
            {
                assertEquals (expression, cases[i+1], e.getClass ());
            }
        }
    }

    @Test
    public void testRemoveRepeated ()
    {
        Index i = new Index ("i");
        Index j = new Index ("j");
        Index k = new Index ("k");
        List<Index> in = new ArrayList<Index> ();
        in.add (j);
        in.add (i);
        in.add (k);
        in.add (i);
        List<Index> out = IndexSignature.removeRepeated (in);
        assertEquals (2, out.size ());
        assertEquals (j, out.get (0));
        assertEquals (k, out.get (1));
    }
}
