package edu.mcmaster.braggfit;

/**
 * Fitted angular shape of one peak on the detector: a bivariate Gaussian
 * over (polar, azimuthal). When the fitted covariance is not
 * positive-definite the model evaluates to zero everywhere.
 */
public final class AngularProfileModel {

    public static final int NPARAMS = 7;

    public static final int AMPLITUDE = 0;
    public static final int MU_POLAR = 1;
    public static final int MU_AZIMUTHAL = 2;
    public static final int SIGMA_POLAR = 3;
    public static final int SIGMA_AZIMUTHAL = 4;
    public static final int RHO = 5;
    public static final int BACKGROUND = 6;

    private final double[] paramArray;
    private final double[] errors;
    private final double reducedChiSquared;
    private final boolean forced;
    private final boolean positiveDefinite;

    AngularProfileModel(final double[] params,
                        final double[] errors,
                        final double reducedChiSquared,
                        final boolean forced)
    {
        assert(params.length == NPARAMS && errors.length == NPARAMS);
        this.paramArray = params.clone();
        this.errors = errors.clone();
        this.reducedChiSquared = reducedChiSquared;
        this.forced = forced;
        this.positiveDefinite = BivariateGaussianModel.isPositiveDefinite(
            params[SIGMA_POLAR], params[SIGMA_AZIMUTHAL], params[RHO]);
    }

    /*----------- Public Interface ------------------*/

    /** Gaussian plus background. */
    public double evaluate(final double polar, final double azimuthal) {
        if (!this.positiveDefinite)
            return 0.0;
        return BivariateGaussianModel.gaussian(this.paramArray, polar, azimuthal) + getBackground();
    }

    /** Gaussian without background. */
    public double peakValue(final double polar, final double azimuthal) {
        if (!this.positiveDefinite)
            return 0.0;
        return BivariateGaussianModel.gaussian(this.paramArray, polar, azimuthal);
    }

    public boolean isPositiveDefinite() {
        return this.positiveDefinite;
    }

    /** True when the widths were borrowed from a strong peak. */
    public boolean isForced() {
        return this.forced;
    }

    public double[] getParameterArray() {
        return this.paramArray.clone();
    }

    public double[] getErrors() {
        return this.errors.clone();
    }

    public double getReducedChiSquared() {
        return this.reducedChiSquared;
    }

    public double getAmplitude() {
        return this.paramArray[AMPLITUDE];
    }

    public double getMuPolar() {
        return this.paramArray[MU_POLAR];
    }

    public double getMuAzimuthal() {
        return this.paramArray[MU_AZIMUTHAL];
    }

    public double getSigmaPolar() {
        return this.paramArray[SIGMA_POLAR];
    }

    public double getSigmaAzimuthal() {
        return this.paramArray[SIGMA_AZIMUTHAL];
    }

    public double getRho() {
        return this.paramArray[RHO];
    }

    public double getBackground() {
        return this.paramArray[BACKGROUND];
    }

    /** Shape record for the strong-peak library, azimuth folded into [-pi, pi). */
    public StrongPeakEntry toEntry() {
        return new StrongPeakEntry(BivariateGaussianModel.wrap(getMuAzimuthal()), getMuPolar(),
                                   getSigmaPolar(), getSigmaAzimuthal(), getRho());
    }
}
