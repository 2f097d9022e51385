package edu.mcmaster.braggfit;

/**
 * A parametric model fitted by {@link LeastSquaresSolver}. Implementations
 * evaluate the whole coordinate set at once so that models needing the full
 * grid (e.g. a convolution) can be expressed.
 */
public interface CurveModel {

    /**
     * @param params      model parameters, in the order of {@link #parameterNames()}
     * @param coordinates {@code coordinates[d][i]} is dimension {@code d} of point {@code i}
     * @return model value at every point
     */
    double[] evaluate(double[] params, double[][] coordinates);

    ParameterBounds parameterBounds();

    String[] parameterNames();
}
