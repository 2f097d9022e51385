package edu.mcmaster.braggfit;

/**
 * Per-voxel (TOF, polar, azimuthal) coordinates of a {@link VoxelGrid} for
 * one peak geometry. Voxels at |Q| = 0 are flagged invalid and carry zeros.
 */
public final class VoxelCoordinates {

    private final double[] tof;
    private final double[] polar;
    private final double[] azimuthal;
    private final double[] radius;
    private final boolean[] valid;

    VoxelCoordinates(final double[] tof,
                     final double[] polar,
                     final double[] azimuthal,
                     final double[] radius,
                     final boolean[] valid)
    {
        assert(tof.length == polar.length && polar.length == azimuthal.length &&
               azimuthal.length == radius.length && radius.length == valid.length);
        this.tof = tof;
        this.polar = polar;
        this.azimuthal = azimuthal;
        this.radius = radius;
        this.valid = valid;
    }

    public int size() {
        return this.tof.length;
    }

    public double tof(final int idx) {
        return this.tof[idx];
    }

    public double polar(final int idx) {
        return this.polar[idx];
    }

    public double azimuthal(final int idx) {
        return this.azimuthal[idx];
    }

    public double radius(final int idx) {
        return this.radius[idx];
    }

    public boolean isValid(final int idx) {
        return this.valid[idx];
    }

    public int countValid() {
        int n = 0;
        for (boolean v : this.valid)
            if (v) n++;
        return n;
    }
}
