/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.eqset;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
    Tarjan's algorithm for the strongly connected components of a directed graph.
    The graph maps each node to the nodes it points at. Nodes that only appear as
    targets are treated as having no outgoing edges.
**/
public class StronglyConnected<T>
{
    protected Map<T,? extends Collection<T>> graph;
    protected Set<T>                         visited    = new LinkedHashSet<T> ();
    protected Deque<T>                       stack      = new ArrayDeque<T> ();
    protected Map<T,Integer>                 lowLink    = new HashMap<T,Integer> ();
    protected List<Set<T>>                   components = new ArrayList<Set<T>> ();
    protected int                            pre;

    public StronglyConnected (Map<T,? extends Collection<T>> graph)
    {
        this.graph = graph;
        for (T node : graph.keySet ())
        {
            if (! visited.contains (node)) search (node);
        }
    }

    public List<Set<T>> components ()
    {
        return components;
    }

    /**
        A cycle is a component with more than one node, or a single node that points at itself.
    **/
    public List<Set<T>> cycles ()
    {
        List<Set<T>> result = new ArrayList<Set<T>> ();
        for (Set<T> c : components)
        {
            if (c.size () > 1)
            {
                result.add (c);
            }
            else
            {
                T node = c.iterator ().next ();
                if (successors (node).contains (node)) result.add (c);
            }
        }
        return result;
    }

    protected Collection<T> successors (T node)
    {
        Collection<T> result = graph.get (node);
        if (result == null) return Collections.emptySet ();
        return result;
    }

    protected void search (T node)
    {
        visited.add (node);
        lowLink.put (node, pre++);
        int min = lowLink.get (node);
        stack.push (node);
        for (T n : successors (node))
        {
            if (! visited.contains (n)) search (n);
            int low = lowLink.get (n);
            if (low < min) min = low;
        }
        if (min < lowLink.get (node))
        {
            lowLink.put (node, min);
            return;
        }

        Set<T> component = new LinkedHashSet<T> ();
        T w;
        do
        {
            w = stack.pop ();
            component.add (w);
            lowLink.put (w, Integer.MAX_VALUE);  // finished; never lowers another node's link
        }
        while (! w.equals (node));
        components.add (component);
    }
}
