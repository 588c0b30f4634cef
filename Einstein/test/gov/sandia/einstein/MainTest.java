/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;

import org.junit.Test;

import gov.sandia.einstein.db.MNode;
import gov.sandia.einstein.eqset.ProblemTest;

public class MainTest
{
    @Test
    public void testRun () throws IOException
    {
        assertEquals (0, Main.run (ProblemTest.load (ProblemTest.DOCUMENT)));
    }

    @Test
    public void testFailures () throws IOException
    {
        MNode doc = ProblemTest.load (ProblemTest.DOCUMENT);
        doc.set ("Eq(s, u_i)", "equations", "bad");
        assertEquals (1, Main.run (doc));

        doc = ProblemTest.load (ProblemTest.DOCUMENT);
        doc.set ("a = b + 1", "relations", "2");
        doc.set ("b = 2*a", "relations", "3");
        assertEquals (1, Main.run (doc));

        doc = ProblemTest.load (ProblemTest.DOCUMENT);
        doc.set ("Eq(u_, 1)", "equations", "bad");
        assertEquals (1, Main.run (doc));
    }

    @Test
    public void testParseFailureKeepsGoing () throws IOException
    {
        MNode doc = ProblemTest.load (ProblemTest.DOCUMENT);
        doc.set ("Eq(c_i, d_i +)", "equations", "bad");

        PrintStream out = System.out;
        PrintStream err = System.err;
        ByteArrayOutputStream stdout = new ByteArrayOutputStream ();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream ();
        int exitCode;
        try
        {
            System.setOut (new PrintStream (stdout, true));
            System.setErr (new PrintStream (stderr, true));
            exitCode = Main.run (doc);
        }
        finally
        {
            System.setOut (out);
            System.setErr (err);
        }

        assertEquals (1, exitCode);
        String printed = stdout.toString ();
        assertTrue (printed, printed.contains ("equations: Eq(Der(rho,t), -Conservative(rho*u_j,x_j))"));
        assertTrue (printed, printed.contains ("constant order: [gama, cp]"));
        assertTrue (printed, printed.contains ("relation order: [u0, u1, p]"));
        assertTrue (stderr.toString (), stderr.toString ().contains ("equations.bad failed to parse:"));
    }

    @Test
    public void testBadNumber () throws IOException
    {
        MNode doc = ProblemTest.load (ProblemTest.DOCUMENT);
        doc.set ("abc", "ndim");
        assertEquals (1, Main.run (doc));

        doc = ProblemTest.load (ProblemTest.DOCUMENT);
        doc.set ("abc", "maxRounds");
        assertEquals (1, Main.run (doc));
    }
}
