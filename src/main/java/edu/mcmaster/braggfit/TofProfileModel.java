package edu.mcmaster.braggfit;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Fitted time-of-flight profile of one peak. Between bin centres the fitted
 * curve is linearly interpolated; outside them it is zero.
 */
public final class TofProfileModel {

    private final double[] params;
    private final double[] errors;
    private final int bgOrder;
    private final double reducedChiSquared;
    private final double[] tPoints;
    private final double[] fitted;
    private final double[] background;
    private final PolynomialSplineFunction fitInterpolant;
    private final PolynomialSplineFunction peakInterpolant;

    private final double intensity;
    private final double sigma;
    private final double tStart;
    private final double tStop;

    TofProfileModel(final double[] params,
                    final double[] errors,
                    final int bgOrder,
                    final double reducedChiSquared,
                    final double[] tPoints,
                    final double[] fitted,
                    final double[] background,
                    final double[] integration)
    {
        assert(params.length == IkedaCarpenterModel.NICCPARAMS + bgOrder + 1);
        assert(tPoints.length == fitted.length && fitted.length == background.length);
        assert(integration.length == 4);
        this.params = params.clone();
        this.errors = errors.clone();
        this.bgOrder = bgOrder;
        this.reducedChiSquared = reducedChiSquared;
        this.tPoints = tPoints.clone();
        this.fitted = fitted.clone();
        this.background = background.clone();

        double[] peak = new double[fitted.length];
        for (int i = 0; i < peak.length; i++)
            peak[i] = fitted[i] - background[i];
        LinearInterpolator interpolator = new LinearInterpolator();
        this.fitInterpolant = interpolator.interpolate(this.tPoints, this.fitted);
        this.peakInterpolant = interpolator.interpolate(this.tPoints, peak);

        this.intensity = integration[0];
        this.sigma = integration[1];
        this.tStart = integration[2];
        this.tStop = integration[3];
    }

    /*----------- Public Interface ------------------*/

    /** Fitted curve including background; zero outside the histogram. */
    public double evaluate(final double t) {
        return this.fitInterpolant.isValidPoint(t) ? this.fitInterpolant.value(t) : 0.0;
    }

    /** Fitted curve minus background; zero outside the histogram. */
    public double peakProfile(final double t) {
        return this.peakInterpolant.isValidPoint(t) ? this.peakInterpolant.value(t) : 0.0;
    }

    public double[] getParameterArray() {
        return this.params.clone();
    }

    public double[] getErrors() {
        return this.errors.clone();
    }

    public double getA() {
        return this.params[IkedaCarpenterModel.A];
    }

    public double getB() {
        return this.params[IkedaCarpenterModel.B];
    }

    public double getR() {
        return this.params[IkedaCarpenterModel.R];
    }

    public double getT0() {
        return this.params[IkedaCarpenterModel.T0];
    }

    public double getScale() {
        return this.params[IkedaCarpenterModel.SCALE];
    }

    public double getHatWidth() {
        return this.params[IkedaCarpenterModel.HATWIDTH];
    }

    public double getKConv() {
        return this.params[IkedaCarpenterModel.KCONV];
    }

    /** Background coefficients, constant term first. */
    public double[] getBackgroundCoefficients() {
        double[] bg = new double[this.bgOrder + 1];
        System.arraycopy(this.params, IkedaCarpenterModel.NICCPARAMS, bg, 0, bg.length);
        return bg;
    }

    public double getReducedChiSquared() {
        return this.reducedChiSquared;
    }

    public double[] getTimes() {
        return this.tPoints.clone();
    }

    public double[] getFitted() {
        return this.fitted.clone();
    }

    public double[] getBackground() {
        return this.background.clone();
    }

    public double tMin() {
        return this.tPoints[0];
    }

    public double tMax() {
        return this.tPoints[this.tPoints.length - 1];
    }

    /** Integrated intensity of the one-dimensional profile. */
    public double getIntensity() {
        return this.intensity;
    }

    public double getSigma() {
        return this.sigma;
    }

    public double getIntegrationStart() {
        return this.tStart;
    }

    public double getIntegrationStop() {
        return this.tStop;
    }
}
