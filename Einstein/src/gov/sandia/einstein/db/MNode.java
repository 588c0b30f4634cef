/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.db;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;

/**
    Hierarchical key-value tree. Problem documents are stored in this form.
    A node may have a value, children, or both. A node whose value was never set is "undefined",
    which reads back as "" but can be distinguished with data().
    Children iterate in M collation order: numeric keys first in numeric order, then other keys alphabetically.
**/
public class MNode implements Iterable<MNode>
{
    public String key ()
    {
        return "";
    }

    /**
        Returns the child indicated by the given key, or null if it doesn't exist.
    **/
    protected MNode getChild (String key)
    {
        return null;
    }

    /**
        Returns a child node from arbitrary depth, or null if any part of the path doesn't exist.
        With no keys, returns this node.
    **/
    public MNode child (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) return null;
            result = c;
        }
        return result;
    }

    /**
        Retrieves a child node from arbitrary depth, creating any missing nodes along the way.
    **/
    public MNode childOrCreate (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) c = result.set (null, key);
            result = c;
        }
        return result;
    }

    /**
        Convenience method for iterating over a sub-node that may not exist.
        The returned value is not attached to any tree, and should only be used for iteration.
    **/
    public MNode childOrEmpty (String... keys)
    {
        MNode result = child (keys);
        if (result == null) return new MNode ();
        return result;
    }

    /**
        @return The number of children we have.
    **/
    public int size ()
    {
        return 0;
    }

    public boolean isEmpty ()
    {
        return size () == 0;
    }

    /**
        Indicates whether this node is defined, as opposed to set to "".
    **/
    public boolean data ()
    {
        return false;
    }

    /**
        @return This node's value, with "" as default
    **/
    public String get ()
    {
        return getOrDefault ("");
    }

    /**
        Digs down tree as far as possible to retrieve value; returns "" if node does not exist.
    **/
    public String get (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return "";
        return c.get ();
    }

    /**
        Returns this node's value, or the given default if node is undefined or set to "".
        This is the only get*() function that needs to be overridden by subclasses.
    **/
    public String getOrDefault (String defaultValue)
    {
        return defaultValue;
    }

    public String getOrDefault (String defaultValue, String... keys)
    {
        String value = get (keys);
        if (value.isEmpty ()) return defaultValue;
        return value;
    }

    /**
        Parses the value at the given path as an integer. A value written as a float is rounded.
        @throws NumberFormatException if the value is present but is not a number.
    **/
    public int getOrDefault (int defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        if (isInteger (value)) return Integer.parseInt (value);
        return (int) Math.round (Double.parseDouble (value));
    }

    protected static boolean isInteger (String value)
    {
        int start = value.startsWith ("-") ? 1 : 0;
        if (start >= value.length ()) return false;
        for (int i = start; i < value.length (); i++)
        {
            if (! Character.isDigit (value.charAt (i))) return false;
        }
        return value.length () - start < 10;
    }

    /**
        Sets this node's own value. Passing null makes this node undefined.
    **/
    public void set (String value)
    {
    }

    /**
        Sets value of the child node specified by key, creating the child if needed.
        @return The child node on which the value was set.
    **/
    public MNode set (String value, String key)
    {
        return new MNode ();
    }

    /**
        Creates all children necessary to set value
    **/
    public MNode set (String value, String... keys)
    {
        MNode result = childOrCreate (keys);
        result.set (value);
        return result;
    }

    public Iterator<MNode> iterator ()
    {
        return Collections.emptyIterator ();
    }

    /**
        M collation: numbers sort before strings, numbers compare by value, strings compare lexically.
    **/
    public static int compare (String A, String B)
    {
        if (A.equals (B)) return 0;
        Double Avalue = toNumber (A);
        Double Bvalue = toNumber (B);
        if (Avalue == null)
        {
            if (Bvalue == null) return A.compareTo (B);
            return 1;  // string > number
        }
        if (Bvalue == null) return -1;  // number < string
        return (int) Math.signum (Avalue - Bvalue);
    }

    protected static Double toNumber (String value)
    {
        if (value.isEmpty ()) return null;
        char c = value.charAt (0);
        if (! Character.isDigit (c)  &&  c != '-'  &&  c != '.') return null;
        try
        {
            return Double.valueOf (value);
        }
        catch (NumberFormatException e)
        {
            return null;
        }
    }

    public static class MOrder implements Comparator<String>
    {
        public int compare (String A, String B)
        {
            return MNode.compare (A, B);
        }
    }
    public static MOrder comparator = new MOrder ();

    public String toString ()
    {
        StringWriter writer = new StringWriter ();
        try
        {
            Schema.latest ().write (this, writer, "");
        }
        catch (IOException e)
        {
            throw new RuntimeException (e);  // StringWriter does not actually throw
        }
        return writer.toString ();
    }
}
