/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import java.io.PrintStream;

@SuppressWarnings("serial")
public class ParseException extends Exception
{
    public String line = "";
    public int column = -1;

    public ParseException (String message)
    {
        super (message);
    }

    public ParseException (String message, String line, int column)
    {
        super (message);
        this.line   = line;
        this.column = column;
    }

    /**
        Shows the message followed by the offending line, with a caret under the column where parsing failed.
    **/
    public void print (PrintStream ps)
    {
        ps.println (getMessage ());
        if (column < 0) return;
        ps.println (line);
        for (int i = 0; i < column; i++) ps.print (" ");
        ps.println ("^");
    }
}
