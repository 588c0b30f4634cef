/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.type;

import gov.sandia.einstein.language.Operator;

/**
    Dense N-dimensional array of scalar expressions. Every axis has length ndim.
    Elements are stored in row-major order, so the last axis varies fastest.
    A rank-0 tensor holds exactly one element.
**/
public class Tensor
{
    protected Operator[] data;
    protected int        ndim;
    protected int        rank;

    public Tensor (int ndim, int rank)
    {
        if (ndim < 1) throw new IllegalArgumentException ("ndim must be at least 1");
        if (rank < 0) throw new IllegalArgumentException ("rank may not be negative");
        this.ndim = ndim;
        this.rank = rank;
        int size = 1;
        for (int r = 0; r < rank; r++) size *= ndim;
        data = new Operator[size];
    }

    public static Tensor scalar (int ndim, Operator value)
    {
        Tensor result = new Tensor (ndim, 0);
        result.data[0] = value;
        return result;
    }

    public int ndim ()
    {
        return ndim;
    }

    public int rank ()
    {
        return rank;
    }

    public int size ()
    {
        return data.length;
    }

    public int offset (int[] index)
    {
        if (index.length != rank) throw new IllegalArgumentException ("Expected " + rank + " coordinates but received " + index.length);
        int result = 0;
        for (int i : index)
        {
            if (i < 0  ||  i >= ndim) throw new IndexOutOfBoundsException ("Coordinate " + i + " outside [0," + ndim + ")");
            result = result * ndim + i;
        }
        return result;
    }

    /**
        Converts a flat position back into one coordinate per axis.
    **/
    public int[] index (int offset)
    {
        int[] result = new int[rank];
        for (int r = rank - 1; r >= 0; r--)
        {
            result[r] = offset % ndim;
            offset   /= ndim;
        }
        return result;
    }

    public Operator get (int... index)
    {
        return data[offset (index)];
    }

    public Operator get ()
    {
        return data[0];
    }

    public Operator getFlat (int offset)
    {
        return data[offset];
    }

    public void set (Operator value, int... index)
    {
        data[offset (index)] = value;
    }

    public void setFlat (int offset, Operator value)
    {
        data[offset] = value;
    }

    /**
        @param order For each axis of the result, the axis of this tensor that supplies it.
    **/
    public Tensor permute (int[] order)
    {
        if (order.length != rank) throw new IllegalArgumentException ("Permutation must name every axis");
        Tensor result = new Tensor (ndim, rank);
        int[] source = new int[rank];
        for (int i = 0; i < data.length; i++)
        {
            int[] target = result.index (i);
            for (int r = 0; r < rank; r++) source[order[r]] = target[r];
            result.data[i] = get (source);
        }
        return result;
    }

    public Tensor transpose ()
    {
        if (rank != 2) throw new IllegalArgumentException ("transpose requires rank 2, not " + rank);
        return permute (new int[] {1, 0});
    }

    /**
        @return A tensor of the same shape whose elements are deep copies of these.
    **/
    public Tensor copy ()
    {
        Tensor result = new Tensor (ndim, rank);
        for (int i = 0; i < data.length; i++) result.data[i] = data[i].deepCopy ();
        return result;
    }

    /**
        Simplifies every element in place.
    **/
    public Tensor simplify ()
    {
        for (int i = 0; i < data.length; i++) data[i] = data[i].simplify ();
        return this;
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ("[");
        for (int i = 0; i < data.length; i++)
        {
            if (i > 0) result.append (", ");
            result.append (data[i] == null ? "null" : data[i].render ());
        }
        result.append ("]");
        return result.toString ();
    }
}
