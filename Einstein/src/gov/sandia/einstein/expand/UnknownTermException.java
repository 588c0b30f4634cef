/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

/**
    A sub-expression was needed before it was materialized. Indicates an internal ordering problem rather than bad input.
**/
@SuppressWarnings("serial")
public class UnknownTermException extends ExpansionException
{
    public UnknownTermException (String message)
    {
        super (message);
    }
}
