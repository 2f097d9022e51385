package edu.mcmaster.braggfit;

/**
 * Combines the fitted TOF and angular profiles into one model over the
 * voxel grid.
 */
public final class ProfileComposer {

    private ProfileComposer() {
    }

    /**
     * {@code Y(v) = tof(t(v)) * angular(polar(v), azimuthal(v))}, backgrounds
     * excluded, scaled so its maximum is 1. Invalid voxels are zero.
     *
     * @throws DegenerateFitException if the product vanishes everywhere
     */
    public static double[] compose(final VoxelGrid grid,
                                   final VoxelCoordinates coords,
                                   final TofProfileModel tof,
                                   final AngularProfileModel angular)
        throws DegenerateFitException
    {
        assert(coords.size() == grid.size());
        double[] y = new double[grid.size()];
        double max = 0.0;
        for (int idx = 0; idx < y.length; idx++) {
            if (!coords.isValid(idx))
                continue;
            final double v = tof.peakProfile(coords.tof(idx))
                             * angular.peakValue(coords.polar(idx), coords.azimuthal(idx));
            y[idx] = Math.max(v, 0.0);
            max = Math.max(max, y[idx]);
        }
        if (!(max > 0.0))
            throw new DegenerateFitException("Composed profile is zero everywhere");
        for (int idx = 0; idx < y.length; idx++)
            y[idx] /= max;
        return y;
    }
}
