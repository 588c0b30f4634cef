/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.einstein.language.Constant;
import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Operator;
import gov.sandia.einstein.language.operator.Add;
import gov.sandia.einstein.language.operator.Multiply;
import gov.sandia.einstein.language.operator.Negate;
import gov.sandia.einstein.language.operator.Power;
import gov.sandia.einstein.language.type.Tensor;

/**
    Array operations that implement index notation: outer products, summation over
    repeated index pairs, and elementwise sums. Every result is a fresh tensor whose
    elements are simplified.
**/
public class Contraction
{
    /**
        Sums over every pair of axes labeled by a symbol that appears in raw but not in outer.
        @param outer The free indices that must survive.
        @param raw Label of each axis of t.
        @return Tensor whose axes are labeled by raw with the summed pairs removed.
    **/
    public static Tensor contract (List<Index> outer, List<Index> raw, Tensor t)
    {
        List<Index> labels = new ArrayList<Index> (raw);
        while (true)
        {
            int p = -1;
            int q = -1;
            for (int a = 0; a < labels.size ()  &&  p < 0; a++)
            {
                Index s = labels.get (a);
                if (outer.contains (s)) continue;
                for (int b = a + 1; b < labels.size (); b++)
                {
                    if (labels.get (b).equals (s))
                    {
                        p = a;
                        q = b;
                        break;
                    }
                }
                if (p < 0) throw new IndexMismatchException ("Index " + s + " occurs once in " + raw + " but is not free in " + outer);
            }
            if (p < 0) break;
            t = trace (t, p, q);
            labels.remove (q);
            labels.remove (p);
        }
        return t;
    }

    /**
        Sums along the diagonal of axes p and q, reducing rank by 2.
    **/
    public static Tensor trace (Tensor t, int p, int q)
    {
        int ndim = t.ndim ();
        int rank = t.rank ();
        Tensor result = new Tensor (ndim, rank - 2);
        int[] source = new int[rank];
        for (int i = 0; i < result.size (); i++)
        {
            int[] target = result.index (i);
            int s = 0;
            for (int r = 0; r < rank; r++) if (r != p  &&  r != q) source[r] = target[s++];

            Operator[] terms = new Operator[ndim];
            for (int k = 0; k < ndim; k++)
            {
                source[p] = k;
                source[q] = k;
                terms[k] = t.get (source).deepCopy ();
            }
            result.setFlat (i, new Add (terms).simplify ());
        }
        return result;
    }

    /**
        Tensor product. The axes of a come first, followed by the axes of b.
    **/
    public static Tensor outer (Tensor a, Tensor b)
    {
        Tensor result = new Tensor (a.ndim (), a.rank () + b.rank ());
        int bs = b.size ();
        for (int i = 0; i < a.size (); i++)
        {
            for (int j = 0; j < bs; j++)
            {
                result.setFlat (i * bs + j, new Multiply (a.getFlat (i).deepCopy (), b.getFlat (j).deepCopy ()).simplify ());
            }
        }
        return result;
    }

    /**
        Elementwise sum of two tensors with the same shape and the same axis labels.
    **/
    public static Tensor add (Tensor a, Tensor b)
    {
        if (a.rank () != b.rank ()) throw new IndexMismatchException ("Cannot add arrays of rank " + a.rank () + " and " + b.rank ());
        Tensor result = new Tensor (a.ndim (), a.rank ());
        for (int i = 0; i < a.size (); i++)
        {
            result.setFlat (i, new Add (a.getFlat (i).deepCopy (), b.getFlat (i).deepCopy ()).simplify ());
        }
        return result;
    }

    /**
        Adds b to a after putting b's axes in the order of a's labels.
        Identical order adds directly. A rank-2 addend with reversed labels is transposed first.
        Any other arrangement is rejected.
    **/
    public static Tensor add (List<Index> aIndices, Tensor a, List<Index> bIndices, Tensor b)
    {
        if (aIndices.equals (bIndices)) return add (a, b);
        if (aIndices.size () == 2  &&  bIndices.size () == 2  &&  aIndices.get (0).equals (bIndices.get (1))  &&  aIndices.get (1).equals (bIndices.get (0)))
        {
            return add (a, b.transpose ());
        }
        throw new IndexMismatchException ("Unresolved index order in sum: " + aIndices + " versus " + bIndices);
    }

    public static Tensor negate (Tensor t)
    {
        Tensor result = new Tensor (t.ndim (), t.rank ());
        for (int i = 0; i < t.size (); i++) result.setFlat (i, new Negate (t.getFlat (i).deepCopy ()).simplify ());
        return result;
    }

    /**
        Squares every element and sums them all, producing a rank-0 tensor.
    **/
    public static Tensor selfContract (Tensor t)
    {
        Operator[] terms = new Operator[t.size ()];
        for (int i = 0; i < t.size (); i++) terms[i] = new Power (t.getFlat (i).deepCopy (), new Constant (2)).simplify ();
        return Tensor.scalar (t.ndim (), new Add (terms).simplify ());
    }
}
