/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
    A named leaf value, possibly carrying index symbols. The written form tau_i_j has base "tau"
    and indices [i, j]. The index list is fixed at construction and never re-derived from the name.
    An element of an indexed term is a scalar term whose name is the base followed by the concrete
    index values, for example tau01.
**/
public class Term extends Operator
{
    public final String      name;
    public final String      base;
    public final List<Index> indices;  // unmodifiable; empty for a scalar
    public final boolean     constant;
    public final boolean     coordinate;

    public Term (String base, List<Index> indices, boolean constant, boolean coordinate)
    {
        this.base       = base;
        this.indices    = Collections.unmodifiableList (new ArrayList<Index> (indices));
        this.constant   = constant;
        this.coordinate = coordinate;

        StringBuilder n = new StringBuilder (base);
        for (Index i : indices) n.append ("_" + i.name);
        name = n.toString ();
    }

    public Term (String name, boolean constant, boolean coordinate)
    {
        this (name, Collections.<Index>emptyList (), constant, coordinate);
    }

    /**
        Splits a written name into base and index symbols, then classifies it with the given symbol table.
        @throws ParseException if any part between underscores is empty or is not a symbol.
    **/
    public static Term fromName (String name, SymbolTable symbols) throws ParseException
    {
        String[] pieces = name.split ("_", -1);
        String base = pieces[0];
        if (base.isEmpty ()) throw new ParseException ("Term has empty base name: " + name);
        List<Index> indices = new ArrayList<Index> ();
        for (int p = 1; p < pieces.length; p++)
        {
            String piece = pieces[p];
            if (piece.isEmpty ()  ||  ! Character.isLetter (piece.charAt (0))) throw new ParseException ("Index must be a symbol starting with a letter: " + name);
            indices.add (new Index (piece));
        }
        boolean constant   = symbols.isConstant (name, base);
        boolean coordinate = ! constant  &&  symbols.isCoordinate (base);
        return new Term (base, indices, constant, coordinate);
    }

    public boolean isField ()
    {
        return ! constant  &&  ! coordinate;
    }

    public boolean isIndexed ()
    {
        return ! indices.isEmpty ();
    }

    /**
        Produces the scalar element of this term at the given index values.
        @param values One entry per index, in the order of the indices list.
    **/
    public Term expand (int[] values)
    {
        if (values.length != indices.size ()) throw new IllegalArgumentException ("Term " + name + " has " + indices.size () + " indices but received " + values.length + " values");
        if (values.length == 0) return this;
        StringBuilder n = new StringBuilder (base);
        for (int v : values) n.append (v);
        return new Term (n.toString (), constant, coordinate);
    }

    public String toString ()
    {
        return name;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Term)) return false;
        Term t = (Term) that;
        return name.equals (t.name)  &&  constant == t.constant  &&  coordinate == t.coordinate;
    }

    public int hashCode ()
    {
        int result = name.hashCode ();
        if (constant)   result = result * 31 + 1;
        if (coordinate) result = result * 31 + 2;
        return result;
    }
}
