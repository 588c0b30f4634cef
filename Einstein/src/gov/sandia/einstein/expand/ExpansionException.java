/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

/**
    A semantic failure while expanding one equation. Aborts that equation only.
**/
@SuppressWarnings("serial")
public class ExpansionException extends RuntimeException
{
    public String equation;  // Text of the equation being expanded, if known.

    public ExpansionException (String message)
    {
        super (message);
    }

    public ExpansionException (String message, Throwable cause)
    {
        super (message, cause);
    }

    public String getMessage ()
    {
        String message = super.getMessage ();
        if (equation == null) return message;
        return message + " in equation: " + equation;
    }
}
