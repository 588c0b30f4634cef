/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

/**
    Index symbols do not balance: a symbol occurs more than twice in a product, or the addends of a sum (or the two sides of an equation) carry different free indices.
**/
@SuppressWarnings("serial")
public class IndexMismatchException extends ExpansionException
{
    public IndexMismatchException (String message)
    {
        super (message);
    }
}
