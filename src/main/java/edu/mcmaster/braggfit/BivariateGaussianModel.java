package edu.mcmaster.braggfit;

/**
 * Correlated two-dimensional Gaussian over (polar, azimuthal) plus a flat
 * background. Parameter order follows the index constants of
 * {@link AngularProfileModel}.
 */
public class BivariateGaussianModel implements CurveModel {

    private static final String[] NAMES = {
        "Amplitude", "MuPolar", "MuAzimuthal", "SigmaPolar", "SigmaAzimuthal", "Rho", "Background"
    };

    private final ParameterBounds bounds;

    public BivariateGaussianModel(final ParameterBounds bounds) {
        if (bounds.size() != AngularProfileModel.NPARAMS)
            throw new IllegalArgumentException("bounds must cover " + AngularProfileModel.NPARAMS + " parameters");
        this.bounds = bounds;
    }

    /**
     * {@code coordinates[0]} holds polar angles, {@code coordinates[1]}
     * azimuthal angles.
     */
    @Override
    public double[] evaluate(final double[] params, final double[][] coordinates) {
        final double[] polar = coordinates[0];
        final double[] azimuthal = coordinates[1];
        double[] out = new double[polar.length];
        if (!isPositiveDefinite(params[AngularProfileModel.SIGMA_POLAR],
                                params[AngularProfileModel.SIGMA_AZIMUTHAL],
                                params[AngularProfileModel.RHO]))
            return out;
        for (int i = 0; i < out.length; i++)
            out[i] = gaussian(params, polar[i], azimuthal[i]) + params[AngularProfileModel.BACKGROUND];
        return out;
    }

    @Override
    public ParameterBounds parameterBounds() {
        return this.bounds;
    }

    @Override
    public String[] parameterNames() {
        return NAMES.clone();
    }

    /*----------- Static helpers ------------------*/

    /** Covariance {@code [[sp^2, rho sp sa], [rho sp sa, sa^2]]} is positive-definite. */
    public static boolean isPositiveDefinite(final double sigmaPolar, final double sigmaAzimuthal, final double rho) {
        return sigmaPolar > 0.0 && sigmaAzimuthal > 0.0 && Math.abs(rho) < 1.0
               && Double.isFinite(sigmaPolar) && Double.isFinite(sigmaAzimuthal);
    }

    /**
     * Gaussian part only; the caller checks positive-definiteness. The
     * azimuthal offset is taken modulo 2 pi.
     */
    static double gaussian(final double[] params, final double polar, final double azimuthal) {
        final double sp = params[AngularProfileModel.SIGMA_POLAR];
        final double sa = params[AngularProfileModel.SIGMA_AZIMUTHAL];
        final double rho = params[AngularProfileModel.RHO];
        final double x = (polar - params[AngularProfileModel.MU_POLAR]) / sp;
        final double y = wrap(azimuthal - params[AngularProfileModel.MU_AZIMUTHAL]) / sa;
        final double q = (x * x - 2.0 * rho * x * y + y * y) / (1.0 - rho * rho);
        return params[AngularProfileModel.AMPLITUDE] * Math.exp(-0.5 * q);
    }

    /** Angle difference folded into [-pi, pi). */
    static double wrap(final double d) {
        return d - 2.0 * Math.PI * Math.floor((d + Math.PI) / (2.0 * Math.PI));
    }
}
