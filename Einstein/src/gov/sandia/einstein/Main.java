/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map.Entry;

import org.apache.log4j.Logger;

import gov.sandia.einstein.db.MNode;
import gov.sandia.einstein.db.MVolatile;
import gov.sandia.einstein.db.Schema;
import gov.sandia.einstein.eqset.ConstantTable;
import gov.sandia.einstein.eqset.CyclicDependencyException;
import gov.sandia.einstein.eqset.Equality;
import gov.sandia.einstein.eqset.EquationSet;
import gov.sandia.einstein.eqset.Problem;
import gov.sandia.einstein.expand.Equation;
import gov.sandia.einstein.expand.ExpansionException;
import gov.sandia.einstein.language.ParseException;

/**
    Command-line runner. Loads a problem document, expands every equation, and prints the
    scalar equations followed by the evaluation order of constants and constituent relations.
    <pre>
    -param=file    load problem document
    key.path=value override or add a single entry
    </pre>
**/
public class Main
{
    private static Logger logger = Logger.getLogger (Main.class);

    public static void main (String[] args)
    {
        MNode record = new MVolatile ();
        for (String arg : args)
        {
            if (arg.startsWith ("-param="))
            {
                if (! processParamFile (arg.substring (7), record)) System.exit (1);
            }
            else if (! arg.startsWith ("-"))
            {
                String[] pieces = arg.split ("=", 2);
                String keys = pieces[0];
                String value = "";
                if (pieces.length == 2) value = pieces[1];
                record.set (value, keys.split ("\\."));
            }
            else
            {
                System.err.println ("Unknown option: " + arg);
                System.exit (1);
            }
        }

        int exitCode = run (record);
        if (exitCode != 0) System.exit (exitCode);
    }

    public static boolean processParamFile (String fileName, MNode record)
    {
        Path file = Paths.get (fileName);
        try (BufferedReader reader = Files.newBufferedReader (file))
        {
            Schema.readAll (record, reader);
            return true;
        }
        catch (IOException e)
        {
            System.err.println ("Failed to read problem file " + file + ": " + e.getMessage ());
            return false;
        }
    }

    /**
        @return Exit code. 0 if every equation expanded and every order was found.
    **/
    public static int run (MNode record)
    {
        Problem problem;
        try
        {
            problem = new Problem (record);
        }
        catch (IllegalArgumentException e)
        {
            System.err.println (e.getMessage ());
            return 1;
        }

        int exitCode = 0;
        exitCode |= reportParseFailures (problem);
        exitCode |= report (problem.equations);
        exitCode |= report (problem.relations);

        try
        {
            ConstantTable constants = problem.constants;
            List<String> order = constants.order ();
            if (! order.isEmpty ()) System.out.println ("constant order: " + order);
        }
        catch (CyclicDependencyException e)
        {
            System.err.println (e.getMessage ());
            exitCode = 1;
        }

        if (! problem.relations.equations.isEmpty ())
        {
            try
            {
                System.out.println ("relation order: " + problem.relations.order (problem.known));
            }
            catch (CyclicDependencyException | ExpansionException e)
            {
                System.err.println (e.getMessage ());
                exitCode = 1;
            }
        }

        logger.info ("finished with exit code " + exitCode);
        return exitCode;
    }

    protected static int reportParseFailures (Problem problem)
    {
        if (problem.parseFailures.isEmpty ()) return 0;
        for (Entry<String,ParseException> f : problem.parseFailures.entrySet ())
        {
            System.err.println (f.getKey () + " failed to parse:");
            f.getValue ().print (System.err);
        }
        return 1;
    }

    protected static int report (EquationSet set)
    {
        for (Equation e : set.equations)
        {
            List<Equality> expanded = set.expanded (e);
            if (expanded.isEmpty ()) continue;
            System.out.println (set.name + ": " + e.text);
            for (Equality q : expanded) System.out.println ("  " + q);
        }
        if (set.failures ().isEmpty ()) return 0;
        for (Entry<Equation,ExpansionException> f : set.failures ().entrySet ())
        {
            System.err.println (set.name + " failed: " + f.getValue ().getMessage ());
        }
        return 1;
    }
}
