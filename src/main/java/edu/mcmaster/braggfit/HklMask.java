package edu.mcmaster.braggfit;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.Arrays;

/**
 * Restricts fitting to voxels that index close to one reflection, so
 * neighbouring reflections inside the box do not leak into the profile.
 */
public final class HklMask {

    private HklMask() {
    }

    /**
     * Voxels whose fractional HKL, {@code UB^-1 Q / 2 pi}, lies strictly
     * within {@code frac} of {@code hkl} along every axis.
     *
     * @throws IllegalArgumentException if {@code ub} is not invertible
     */
    public static boolean[] build(final VoxelGrid grid,
                                  final RealMatrix ub,
                                  final double[] hkl,
                                  final double frac)
    {
        assert(hkl.length == 3 && frac > 0.0);
        final RealMatrix ubInv;
        try {
            ubInv = MatrixUtils.inverse(ub);
        } catch (SingularMatrixException ex) {
            throw new IllegalArgumentException("UB matrix is singular", ex);
        }
        final double twoPi = 2.0 * Math.PI;
        boolean[] mask = new boolean[grid.size()];
        for (int idx = 0; idx < mask.length; idx++) {
            final RealVector h = ubInv.operate(MatrixUtils.createRealVector(grid.q(idx)));
            boolean inside = true;
            for (int a = 0; a < 3 && inside; a++) {
                inside = Math.abs(h.getEntry(a) / twoPi - hkl[a]) < frac;
            }
            mask[idx] = inside;
        }
        return mask;
    }

    /** No restriction. */
    public static boolean[] all(final VoxelGrid grid) {
        boolean[] mask = new boolean[grid.size()];
        Arrays.fill(mask, true);
        return mask;
    }
}
