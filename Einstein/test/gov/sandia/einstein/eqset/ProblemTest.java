/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import gov.sandia.einstein.db.MNode;
import gov.sandia.einstein.db.MVolatile;
import gov.sandia.einstein.db.Schema;

public class ProblemTest
{
    public static final String DOCUMENT = String.join ("\n",
        "N2A.schema=3",
        "ndim:2",
        "constants",
        " R",
        " Re",
        " cp:gama*R/(gama-1)",
        " gama:1.4",
        "substitutions",
        " 0:Eq(tau_i_j, (Der(u_i,x_j) + Der(u_j,x_i))/Re)",
        "equations",
        " mass:Eq(Der(rho,t), -Conservative(rho*u_j,x_j))",
        " momentum:Eq(Der(rhou_i,t), -Conservative(rhou_i*u_j,x_j) + Der(tau_i_j,x_j))",
        "relations",
        " 0:Eq(u_i, rhou_i/rho)",
        " 1:p = (gama-1)*(rhoE - rho*u_j**2/2)",
        "known",
        " rho",
        " rhou0",
        " rhou1",
        " rhoE",
        ""
    );

    public static MNode load (String text) throws IOException
    {
        MNode doc = new MVolatile ();
        Schema.readAll (doc, new StringReader (text));
        return doc;
    }

    @Test
    public void testLoad () throws IOException
    {
        Problem problem = new Problem (load (DOCUMENT));
        assertEquals (2, problem.ndim);
        assertEquals (EvaluationOrder.DEFAULT_ROUNDS, problem.maxRounds);
        assertEquals ("x", problem.symbols.coordinate);
        assertTrue (problem.symbols.constants.containsAll (Arrays.asList ("R", "Re", "cp", "gama")));
        assertEquals (2, problem.constants.inputs.size ());
        assertEquals (2, problem.constants.definitions.size ());
        assertEquals (1, problem.substitutions.size ());
        assertEquals (4, problem.known.size ());

        assertEquals (3, problem.equations.expanded ().size ());
        assertTrue (problem.equations.failures ().isEmpty ());
        assertEquals (3, problem.relations.expanded ().size ());

        assertEquals (Arrays.asList ("u0", "u1", "p"), problem.relations.order (problem.known));
        assertEquals (Arrays.asList ("gama", "cp"),    problem.constants.order ());
    }

    @Test
    public void testOverrides () throws IOException
    {
        MNode doc = load (DOCUMENT);
        doc.set ("3", "ndim");
        doc.set ("5", "maxRounds");
        Problem problem = new Problem (doc);
        assertEquals (3, problem.ndim);
        assertEquals (5, problem.relations.maxRounds);
        assertEquals (4, problem.equations.expanded ().size ());
        assertEquals (4, problem.relations.expanded ().size ());
    }

    @Test
    public void testParseFailures () throws IOException
    {
        MNode doc = load (String.join ("\n",
            "N2A.schema=3",
            "ndim:2",
            "constants",
            " gama:1.4",
            " cv:gama*(",
            "substitutions",
            " 0:Eq(q_i, -k*Der(T,x_i))",
            " 1:Eq(w_i, ",
            "equations",
            " good:Eq(a_i, b_i)",
            " bad:Eq(c_i, d_i +)",
            "relations",
            " 0:Eq(p, rho*u_j*u_j)",
            " 1:Eq(e, rho u)",
            "known",
            " rho",
            " u0",
            " u1",
            ""
        ));
        Problem problem = new Problem (doc);

        assertEquals (Arrays.asList ("constants.cv", "substitutions.1", "equations.bad", "relations.1"), new ArrayList<String> (problem.parseFailures.keySet ()));

        // Everything else still loads.
        assertEquals (1, problem.equations.equations.size ());
        assertEquals ("[a0 = b0, a1 = b1]", problem.equations.expanded ().toString ());
        assertTrue (problem.equations.failures ().isEmpty ());
        assertEquals (1, problem.substitutions.size ());
        assertEquals (1, problem.constants.definitions.size ());
        assertEquals (Arrays.asList ("p"), problem.relations.order (problem.known));
    }

    @Test
    public void testBadNumbers () throws IOException
    {
        String[][] cases =
        {
            {"ndim",      "abc"},
            {"maxRounds", "many"},
            {"ndim",      "3x"},
        };
        for (String[] c : cases)
        {
            MNode doc = load (DOCUMENT);
            doc.set (c[1], c[0]);
            try
            {
                new Problem (doc);
                fail ("Expected rejection of " + c[0] + "=" + c[1]);
            }
            catch (IllegalArgumentException e)
            {
                assertTrue (e.getMessage (), e.getMessage ().startsWith (c[0] + " "));
                assertTrue (e.getMessage (), e.getMessage ().contains (c[1]));
            }
        }
    }
}
