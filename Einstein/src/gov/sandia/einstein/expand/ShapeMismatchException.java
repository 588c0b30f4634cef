/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

/**
    The two sides of an equation expand to arrays of different rank.
**/
@SuppressWarnings("serial")
public class ShapeMismatchException extends ExpansionException
{
    public ShapeMismatchException (String message)
    {
        super (message);
    }
}
