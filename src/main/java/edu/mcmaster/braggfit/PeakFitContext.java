package edu.mcmaster.braggfit;

/**
 * Working state of one peak while it moves through the integration
 * stages. Owned by a single fit; never shared between threads.
 */
class PeakFitContext {

    public final PeakGeometry geometry;
    public final VoxelGrid grid;
    public final boolean[] qMask;

    public VoxelCoordinates coords;
    public SignalMask mask;
    public TofProfileModel tof;
    public double forceIntensity = Double.NaN;
    public boolean needsBorrowedShape;
    public AngularProfileModel angular;
    public double[] yJoint;
    public ScalingResult scaling;

    PeakFitContext(final PeakGeometry geometry, final VoxelGrid grid, final boolean[] qMask) {
        assert(qMask == null || grid == null || qMask.length == grid.size());
        this.geometry = geometry;
        this.grid = grid;
        this.qMask = qMask;
    }

    public double ppLambda() {
        return this.mask == null ? Double.NaN : this.mask.ppLambda();
    }

    public boolean isForced() {
        return this.angular != null && this.angular.isForced();
    }

    public boolean hasInvalidCovariance() {
        return this.angular != null && !this.angular.isPositiveDefinite();
    }
}
