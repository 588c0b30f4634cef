/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language.function;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class SymbolValueTest
{
    @Test
    public void testKroneckerDelta ()
    {
        for (int i = 0; i < 3; i++)
        {
            for (int j = 0; j < 3; j++) assertEquals (i == j ? 1 : 0, KroneckerDelta.value (i, j));
        }
    }

    @Test
    public void testLeviCivita ()
    {
        int[][] even = {{0, 1, 2}, {1, 2, 0}, {2, 0, 1}};
        int[][] odd  = {{0, 2, 1}, {2, 1, 0}, {1, 0, 2}};
        for (int[] p : even) assertEquals ( 1, LeviCivita.value (p[0], p[1], p[2]));
        for (int[] p : odd)  assertEquals (-1, LeviCivita.value (p[0], p[1], p[2]));

        int zeros = 0;
        for (int i = 0; i < 3; i++)
        {
            for (int j = 0; j < 3; j++)
            {
                for (int k = 0; k < 3; k++)
                {
                    if (LeviCivita.value (i, j, k) == 0) zeros++;
                }
            }
        }
        assertEquals (21, zeros);
    }
}
