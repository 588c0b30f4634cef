/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
    Names that control how the parser classifies terms.
    A term is constant if its written name or its base name is listed in constants.
    A term is a coordinate if its base is the coordinate symbol (x, or x0, x1, ... once indexed)
    or the time symbol. Every other term is a field.
**/
public class SymbolTable
{
    public Set<String> constants  = new LinkedHashSet<String> ();
    public String      coordinate = "x";
    public String      time       = "t";

    public SymbolTable ()
    {
    }

    public SymbolTable (String coordinate, String time, Collection<String> constants)
    {
        this.coordinate = coordinate;
        this.time       = time;
        this.constants.addAll (constants);
    }

    public SymbolTable (String... constants)
    {
        for (String c : constants) this.constants.add (c);
    }

    public boolean isConstant (String name, String base)
    {
        return constants.contains (name)  ||  constants.contains (base);
    }

    public boolean isCoordinate (String base)
    {
        if (base.equals (time)) return true;
        if (! base.startsWith (coordinate)) return false;
        String suffix = base.substring (coordinate.length ());
        for (int i = 0; i < suffix.length (); i++)
        {
            if (! Character.isDigit (suffix.charAt (i))) return false;
        }
        return true;  // Includes the case of an empty suffix, that is, base equals coordinate.
    }
}
