/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.function;

import gov.sandia.einstein.language.Function;
import gov.sandia.einstein.language.Operator;

/**
    Any function the expansion does not interpret, such as log(p) or a user-supplied closure.
    Its arguments are expanded, but the function itself passes through unchanged.
**/
public class PlainFunction extends Function
{
    public String name;

    public PlainFunction (String name, Operator... operands)
    {
        this.name     = name;
        this.operands = operands;
    }

    public String name ()
    {
        return name;
    }

    public String toString ()
    {
        return name;
    }
}
