package edu.mcmaster.braggfit;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class HklMaskTest {

    @Test
    public void keepsVoxelsNearTheReflection() {
        final double twoPi = 2.0 * Math.PI;
        final VoxelGrid grid = VoxelGrid.centeredOn(new double[]{twoPi, 0.0, 0.0}, 0.5, 5, new int[125]);
        final boolean[] mask = HklMask.build(grid, MatrixUtils.createRealIdentityMatrix(3),
                                             new double[]{1.0, 0.0, 0.0}, 0.1);
        int n = 0;
        for (boolean b : mask)
            if (b) n++;
        // |dq| < 0.2 pi keeps offsets of 0 and +-0.5 on each axis
        assertEquals(27, n);
        assertTrue(mask[grid.centerIndex()]);
        assertFalse(mask[grid.index(0, 2, 2)]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void singularUbIsRejected() {
        final RealMatrix ub = MatrixUtils.createRealMatrix(new double[][]{{1, 0, 0}, {0, 1, 0}, {1, 0, 0}});
        HklMask.build(SyntheticPeaks.strongPeak(), ub, new double[]{1.0, 1.0, 1.0}, 0.5);
    }

    @Test
    public void allKeepsEverything() {
        for (boolean b : HklMask.all(SyntheticPeaks.strongPeak()))
            assertTrue(b);
    }
}
