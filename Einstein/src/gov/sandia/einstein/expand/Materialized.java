/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.type.Tensor;

/**
    An expression expanded into an explicit array, along with the index symbol that labels each axis.
**/
public class Materialized
{
    public String      name;     // Written name for terms, or a placeholder such as Arr0 for functions. Null for intermediate results.
    public List<Index> indices;  // one per axis of array
    public Tensor      array;

    public Materialized (String name, List<Index> indices, Tensor array)
    {
        if (indices.size () != array.rank ()) throw new IllegalArgumentException ("Array of rank " + array.rank () + " labeled with " + indices);
        this.name    = name;
        this.indices = Collections.unmodifiableList (new ArrayList<Index> (indices));
        this.array   = array;
    }

    public Materialized (List<Index> indices, Tensor array)
    {
        this (null, indices, array);
    }

    public String toString ()
    {
        return name + indices + " = " + array;
    }
}
