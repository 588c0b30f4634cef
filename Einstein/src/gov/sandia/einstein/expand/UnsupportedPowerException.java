/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

/**
    A power whose base carries free indices and whose exponent is anything other than 2, or whose exponent itself carries indices.
**/
@SuppressWarnings("serial")
public class UnsupportedPowerException extends ExpansionException
{
    public UnsupportedPowerException (String message)
    {
        super (message);
    }
}
