/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.LinkedHashMap;
import java.util.Map;

import gov.sandia.einstein.language.Operator;

/**
    Dictionary from sub-expression to its materialized array, for the duration of a single equation.
    Keys compare by structure, so every occurrence of the same term or function shares one entry.
**/
public class ExpansionContext
{
    public int                         ndim;
    public Map<Operator,Materialized>  dictionary = new LinkedHashMap<Operator,Materialized> ();
    protected int                      nextArray;

    public ExpansionContext (int ndim)
    {
        this.ndim = ndim;
    }

    public String nextName ()
    {
        return "Arr" + nextArray++;
    }

    public boolean contains (Operator op)
    {
        return dictionary.containsKey (op);
    }

    public void put (Operator op, Materialized m)
    {
        dictionary.put (op, m);
    }

    public Materialized get (Operator op)
    {
        Materialized result = dictionary.get (op);
        if (result == null) throw new UnknownTermException ("No array has been materialized for " + op.render ());
        return result;
    }
}
