/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.db;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.TreeMap;

/**
    In-memory MNode. Holds problem documents once they are read, and collects command-line overrides.
    Children are created on first use and kept in M collation order.
**/
public class MVolatile extends MNode
{
    protected String                    key = "";
    protected String                    value;  // null means undefined
    protected TreeMap<String,MVolatile> children;

    public MVolatile ()
    {
    }

    protected MVolatile (String key, String value)
    {
        this.key   = key;
        this.value = value;
    }

    public String key ()
    {
        return key;
    }

    protected MNode getChild (String key)
    {
        if (children == null) return null;
        return children.get (key);
    }

    public int size ()
    {
        if (children == null) return 0;
        return children.size ();
    }

    public boolean data ()
    {
        return value != null;
    }

    public String getOrDefault (String defaultValue)
    {
        if (value == null  ||  value.isEmpty ()) return defaultValue;
        return value;
    }

    public void set (String value)
    {
        this.value = value;
    }

    public MNode set (String value, String key)
    {
        if (children == null) children = new TreeMap<String,MVolatile> (comparator);
        MVolatile child = children.get (key);
        if (child == null) children.put (key, new MVolatile (key, value));
        else               child.value = value;
        return children.get (key);
    }

    /**
        Walks a copy of the child list, so callers may add nodes while iterating.
    **/
    public Iterator<MNode> iterator ()
    {
        if (children == null) return super.iterator ();
        return new ArrayList<MNode> (children.values ()).iterator ();
    }
}
