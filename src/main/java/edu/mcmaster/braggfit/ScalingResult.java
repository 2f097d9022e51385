package edu.mcmaster.braggfit;

/**
 * Outcome of scaling the composed profile to the measured counts, and the
 * intensity integrated from it.
 */
public final class ScalingResult {

    private final double a1;
    private final double a0;
    private final double reducedChiSquared;
    private final double[] fitted;
    private final int centerIndex;
    private final double[] centerQ;
    private final double dQ;
    private final double intensity;
    private final double sigma;
    private final double bgEvents;
    private final int peakVoxels;

    ScalingResult(final double a1,
                  final double a0,
                  final double reducedChiSquared,
                  final double[] fitted,
                  final int centerIndex,
                  final double[] centerQ,
                  final double dQ,
                  final double intensity,
                  final double sigma,
                  final double bgEvents,
                  final int peakVoxels)
    {
        this.a1 = a1;
        this.a0 = a0;
        this.reducedChiSquared = reducedChiSquared;
        this.fitted = fitted;
        this.centerIndex = centerIndex;
        this.centerQ = centerQ.clone();
        this.dQ = dQ;
        this.intensity = intensity;
        this.sigma = sigma;
        this.bgEvents = bgEvents;
        this.peakVoxels = peakVoxels;
    }

    public double getA1() {
        return this.a1;
    }

    public double getA0() {
        return this.a0;
    }

    public double getReducedChiSquared() {
        return this.reducedChiSquared;
    }

    /** {@code A1 * Y + A0} over the whole grid. */
    public double[] getFitted() {
        return this.fitted.clone();
    }

    public int getCenterIndex() {
        return this.centerIndex;
    }

    public double[] getCenterQ() {
        return this.centerQ.clone();
    }

    /** Distance between the refined centre and the nominal Q. */
    public double getDQ() {
        return this.dQ;
    }

    public double getIntensity() {
        return this.intensity;
    }

    public double getSigma() {
        return this.sigma;
    }

    public double getBackgroundEvents() {
        return this.bgEvents;
    }

    public int getPeakVoxels() {
        return this.peakVoxels;
    }
}
