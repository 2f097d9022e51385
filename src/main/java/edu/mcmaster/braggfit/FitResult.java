package edu.mcmaster.braggfit;

/**
 * Integration outcome of one peak. Failed peaks carry their status, a
 * message, zero intensity and unit sigma, plus whatever intermediate
 * models were reached before the failure.
 */
public final class FitResult {

    private final int peakNumber;
    private final PeakStatus status;
    private final String message;
    private final double intensity;
    private final double sigma;
    private final double ppLambda;
    private final boolean forced;
    private final boolean invalidCovariance;
    private final boolean needsBorrowedShape;
    private final SignalMask mask;
    private final TofProfileModel tofModel;
    private final AngularProfileModel angularModel;
    private final ScalingResult scaling;

    private FitResult(final PeakFitContext ctx,
                      final PeakStatus status,
                      final String message,
                      final double intensity,
                      final double sigma)
    {
        this.peakNumber = ctx.geometry.peakNumber();
        this.status = status;
        this.message = message;
        this.intensity = intensity;
        this.sigma = sigma;
        this.ppLambda = ctx.ppLambda();
        this.forced = ctx.isForced();
        this.invalidCovariance = ctx.hasInvalidCovariance();
        this.needsBorrowedShape = ctx.needsBorrowedShape;
        this.mask = ctx.mask;
        this.tofModel = ctx.tof;
        this.angularModel = ctx.angular;
        this.scaling = ctx.scaling;
    }

    static FitResult completed(final PeakFitContext ctx, final PeakStatus status, final String message) {
        return new FitResult(ctx, status, message, ctx.scaling.getIntensity(), ctx.scaling.getSigma());
    }

    static FitResult failed(final PeakFitContext ctx, final FitException ex) {
        return new FitResult(ctx, ex.status(), ex.getMessage(), 0.0, 1.0);
    }

    /*----------- Public Interface ------------------*/

    public int getPeakNumber() {
        return this.peakNumber;
    }

    public PeakStatus getStatus() {
        return this.status;
    }

    public boolean hasStatus(final PeakStatus s) {
        return this.status == s;
    }

    /** Reason for a failure or a BADPEAK status; {@code null} otherwise. */
    public String getMessage() {
        return this.message;
    }

    public double getIntensity() {
        return this.intensity;
    }

    public double getSigma() {
        return this.sigma;
    }

    public double getPpLambda() {
        return this.ppLambda;
    }

    public boolean isForced() {
        return this.forced;
    }

    /** The angular fit ended with a covariance that is not positive-definite. */
    public boolean hasInvalidCovariance() {
        return this.invalidCovariance;
    }

    /** The peak was weak or near the detector edge. */
    public boolean needsBorrowedShape() {
        return this.needsBorrowedShape;
    }

    public boolean hasScaling() {
        return this.scaling != null;
    }

    public double getA1() {
        return this.scaling == null ? 0.0 : this.scaling.getA1();
    }

    public double getA0() {
        return this.scaling == null ? 0.0 : this.scaling.getA0();
    }

    public double getScalingChiSquared() {
        return this.scaling == null ? Double.NaN : this.scaling.getReducedChiSquared();
    }

    public double getDQ() {
        return this.scaling == null ? Double.NaN : this.scaling.getDQ();
    }

    /** Flat voxel index of the refined centre, or -1 without a scaling fit. */
    public int getCenterIndex() {
        return this.scaling == null ? -1 : this.scaling.getCenterIndex();
    }

    public double[] getCenterQ() {
        return this.scaling == null ? null : this.scaling.getCenterQ();
    }

    /** Scaled model {@code A1 * Y + A0} over the grid, or {@code null}. */
    public double[] getComposedModel() {
        return this.scaling == null ? null : this.scaling.getFitted();
    }

    public SignalMask getMask() {
        return this.mask;
    }

    public TofProfileModel getTofModel() {
        return this.tofModel;
    }

    public AngularProfileModel getAngularModel() {
        return this.angularModel;
    }

    public ScalingResult getScaling() {
        return this.scaling;
    }

    /** Converged, fitted freely, strong, with a usable covariance. */
    public boolean isStrongPeakCandidate() {
        return this.status == PeakStatus.CONVERGED
               && this.angularModel != null
               && !this.forced
               && !this.needsBorrowedShape
               && this.angularModel.isPositiveDefinite();
    }

    @Override
    public String toString() {
        return "FitResult[peak=" + peakNumber + ", status=" + status + ", I=" + intensity
               + ", sigma=" + sigma + (message == null ? "" : ", " + message) + "]";
    }
}
