/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

/**
    A visitor for Operator which replaces the current node with a rewritten tree.
**/
public class Transformer
{
    /**
        @return The replacement Operator, or null if no action was taken. When null is
        returned, the Operator recurses into its operands and then returns itself.
    **/
    public Operator transform (Operator op)
    {
        return null;
    }
}
