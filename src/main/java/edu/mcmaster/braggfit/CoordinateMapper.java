package edu.mcmaster.braggfit;

/**
 * Maps reciprocal-space voxels to the instrument frame of one peak:
 * time-of-flight, polar angle (from +Qz) and azimuthal angle (atan2(Qy, Qx)).
 */
public class CoordinateMapper {

    // voxels closer than this to the origin have no direction
    static final double MIN_RADIUS = 1.0e-12;

    private final InstrumentConstants constants;

    public CoordinateMapper(final InstrumentConstants constants) {
        if (constants == null)
            throw new NullPointerException("constants");
        this.constants = constants;
    }

    /**
     * TOF = K (L1 + L2) sin(half angle) / |Q| for every voxel of the grid.
     *
     * @throws GeometryException if the peak's geometry leaves TOF undefined
     */
    public VoxelCoordinates map(final VoxelGrid grid, final PeakGeometry geometry)
        throws GeometryException
    {
        final double pixelFactor = pixelFactor(geometry);
        final int n = grid.size();
        double[] tof = new double[n];
        double[] polar = new double[n];
        double[] azimuthal = new double[n];
        double[] radius = new double[n];
        boolean[] valid = new boolean[n];

        for (int k = 0; k < grid.nz(); k++) {
            final double z = grid.qz(k);
            for (int j = 0; j < grid.ny(); j++) {
                final double y = grid.qy(j);
                for (int i = 0; i < grid.nx(); i++) {
                    final double x = grid.qx(i);
                    final int idx = grid.index(i, j, k);
                    final double hxy = Math.hypot(x, y);
                    final double r = Math.hypot(hxy, z);
                    radius[idx] = r;
                    if (r < MIN_RADIUS) {
                        continue;
                    }
                    polar[idx] = Math.atan2(hxy, z);
                    azimuthal[idx] = Math.atan2(y, x);
                    tof[idx] = pixelFactor / r;
                    valid[idx] = true;
                }
            }
        }
        return new VoxelCoordinates(tof, polar, azimuthal, radius, valid);
    }

    /** TOF in microseconds of a voxel at distance {@code radius} from the origin. */
    public double tofAt(final PeakGeometry geometry, final double radius) throws GeometryException {
        if (radius < MIN_RADIUS)
            throw new GeometryException("TOF is undefined at |Q| = 0");
        return pixelFactor(geometry) / radius;
    }

    /** Polar and azimuthal angles of a Q vector. */
    public static double[] toAngles(final double[] q) {
        final double hxy = Math.hypot(q[0], q[1]);
        return new double[]{Math.atan2(hxy, q[2]), Math.atan2(q[1], q[0])};
    }

    /** Inverse of the angular part of the mapping. */
    public static double[] toQ(final double polar, final double azimuthal, final double radius) {
        final double s = Math.sin(polar);
        return new double[]{
            radius * s * Math.cos(azimuthal),
            radius * s * Math.sin(azimuthal),
            radius * Math.cos(polar)
        };
    }

    private double pixelFactor(final PeakGeometry geometry) throws GeometryException {
        final double half = geometry.scatteringHalfAngle();
        final double sin = Math.sin(half);
        if (!Double.isFinite(half) || !(sin > 0.0))
            throw new GeometryException("Peak " + geometry.peakNumber()
                                        + ": TOF is undefined for scattering half-angle " + half);
        final double flightPath = geometry.flightPath();
        if (!(flightPath > 0.0) || Double.isInfinite(flightPath))
            throw new GeometryException("Peak " + geometry.peakNumber()
                                        + ": flight path must be positive, was " + flightPath);
        return this.constants.tofConstant() * flightPath * sin;
    }
}
