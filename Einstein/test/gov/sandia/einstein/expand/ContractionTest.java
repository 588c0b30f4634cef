/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.expand;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import gov.sandia.einstein.language.Index;
import gov.sandia.einstein.language.Term;
import gov.sandia.einstein.language.type.Tensor;

public class ContractionTest
{
    Index i = new Index ("i");
    Index j = new Index ("j");
    Index k = new Index ("k");

    /**
        Builds a tensor whose elements are terms named base followed by the coordinates of each element.
    **/
    protected static Tensor terms (String base, int ndim, int rank)
    {
        Tensor result = new Tensor (ndim, rank);
        for (int n = 0; n < result.size (); n++)
        {
            StringBuilder name = new StringBuilder (base);
            for (int c : result.index (n)) name.append (c);
            result.setFlat (n, new Term (name.toString (), false, false));
        }
        return result;
    }

    @Test
    public void testLayout ()
    {
        Tensor t = terms ("m", 3, 2);
        assertEquals (9, t.size ());
        assertEquals ("m12", t.get (1, 2).render ());
        assertEquals (5, t.offset (new int[] {1, 2}));
        assertEquals ("m21", t.transpose ().get (1, 2).render ());
    }

    @Test
    public void testOuter ()
    {
        Tensor t = Contraction.outer (terms ("a", 2, 1), terms ("b", 2, 1));
        assertEquals (2, t.rank ());
        assertEquals ("a0*b1", t.get (0, 1).render ());
        assertEquals ("a1*b0", t.get (1, 0).render ());
    }

    @Test
    public void testTrace ()
    {
        Tensor t = Contraction.contract (Collections.<Index>emptyList (), Arrays.asList (i, i), terms ("m", 3, 2));
        assertEquals (0, t.rank ());
        assertEquals ("m00+m11+m22", t.get ().render ());

        // Sum over the middle and last axes, leaving the first.
        t = Contraction.contract (Arrays.asList (i), Arrays.asList (i, j, j), terms ("c", 2, 3));
        assertEquals (1, t.rank ());
        assertEquals ("c100+c111", t.get (1).render ());
    }

    @Test
    public void testAdd ()
    {
        List<Index> ij = Arrays.asList (i, j);
        List<Index> ji = Arrays.asList (j, i);
        Tensor t = Contraction.add (ij, terms ("a", 2, 2), ij, terms ("b", 2, 2));
        assertEquals ("a01+b01", t.get (0, 1).render ());

        t = Contraction.add (ij, terms ("a", 2, 2), ji, terms ("b", 2, 2));
        assertEquals ("a01+b10", t.get (0, 1).render ());
    }

    @Test(expected = IndexMismatchException.class)
    public void testAddRank3Mismatch ()
    {
        Contraction.add (Arrays.asList (i, j, k), terms ("a", 2, 3), Arrays.asList (k, j, i), terms ("b", 2, 3));
    }

    @Test
    public void testSelfContract ()
    {
        Tensor t = Contraction.selfContract (terms ("a", 3, 1));
        assertEquals ("a0^2+a1^2+a2^2", t.get ().render ());
    }

    @Test
    public void testPermute ()
    {
        // Result axis 0 comes from source axis 2, and so on.
        Tensor t = terms ("c", 3, 3).permute (new int[] {2, 0, 1});
        assertEquals ("c120", t.get (0, 1, 2).render ());
    }
}
