package edu.mcmaster.braggfit;

/**
 * {@code A1 * Y + A0} with {@code A1 >= 0}; {@code coordinates[0]} holds the
 * composed profile.
 */
public class LinearScalingModel implements CurveModel {

    public static final int A1 = 0;
    public static final int A0 = 1;

    private static final String[] NAMES = {"A1", "A0"};
    private static final ParameterBounds BOUNDS = new ParameterBounds(
        new double[]{0.0, Double.NEGATIVE_INFINITY},
        new double[]{Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY});

    @Override
    public double[] evaluate(final double[] params, final double[][] coordinates) {
        final double[] y = coordinates[0];
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++)
            out[i] = params[A1] * y[i] + params[A0];
        return out;
    }

    @Override
    public ParameterBounds parameterBounds() {
        return BOUNDS;
    }

    @Override
    public String[] parameterNames() {
        return NAMES.clone();
    }
}
