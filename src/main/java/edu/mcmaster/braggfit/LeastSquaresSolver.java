package edu.mcmaster.braggfit;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Bounded weighted nonlinear least squares for any {@link CurveModel}.
 * A fresh optimizer is created for every call so one solver instance may be
 * shared between threads.
 */
public class LeastSquaresSolver {

    private static final Logger logger = LoggerFactory.getLogger(LeastSquaresSolver.class);

    // relative step of the forward-difference Jacobian
    private static final double STEP = 1.0e-8;
    private static final double SINGULARITY_THRESHOLD = 1.0e-14;

    private final int maxIterations;
    private final int maxEvaluations;

    public LeastSquaresSolver(final int maxIterations, final int maxEvaluations) {
        assert(maxIterations > 0 && maxEvaluations > 0);
        this.maxIterations = maxIterations;
        this.maxEvaluations = maxEvaluations;
    }

    public LeastSquaresSolver(final IntegrationSettings settings) {
        this(settings.maxIterations(), settings.maxEvaluations());
    }

    /**
     * Fits {@code model} to {@code observed}.
     *
     * @param start       initial parameters; clamped into the model's bounds
     * @param coordinates {@code coordinates[d][i]}, see {@link CurveModel#evaluate}
     * @param weights     per-point weights (1/variance), or {@code null} for unweighted
     */
    public FitOutcome fit(final CurveModel model,
                          final double[] start,
                          final double[][] coordinates,
                          final double[] observed,
                          final double[] weights)
        throws DegenerateFitException, FitConvergenceException
    {
        final ParameterBounds bounds = model.parameterBounds();
        final int nParams = start.length;
        final int nPoints = observed.length;
        if (bounds.size() != nParams)
            throw new IllegalArgumentException("model has " + bounds.size() + " bounded parameters, start has " + nParams);
        if (weights != null && weights.length != nPoints)
            throw new IllegalArgumentException("weights and observations differ in length");
        if (nPoints <= nParams)
            throw new DegenerateFitException("Cannot fit " + nParams + " parameters to " + nPoints + " points");

        final MultivariateJacobianFunction function = new MultivariateJacobianFunction() {
            @Override
            public Pair<RealVector, RealMatrix> value(final RealVector point) {
                final double[] p = point.toArray();
                final double[] f0 = model.evaluate(p, coordinates);
                final double[][] jacobian = new double[nPoints][nParams];
                for (int j = 0; j < nParams; j++) {
                    final double saved = p[j];
                    double h = STEP * Math.max(Math.abs(saved), 1.0);
                    if (saved + h > bounds.upper(j))
                        h = -h;
                    p[j] = saved + h;
                    final double[] f1 = model.evaluate(p, coordinates);
                    p[j] = saved;
                    for (int i = 0; i < nPoints; i++)
                        jacobian[i][j] = (f1[i] - f0[i]) / h;
                }
                return new Pair<RealVector, RealMatrix>(new ArrayRealVector(f0, false),
                                                        new Array2DRowRealMatrix(jacobian, false));
            }
        };

        double[] w = weights;
        if (w == null) {
            w = new double[nPoints];
            Arrays.fill(w, 1.0);
        }

        final LeastSquaresProblem problem = new LeastSquaresBuilder()
            .start(bounds.clamp(start))
            .model(function)
            .target(observed)
            .weight(new DiagonalMatrix(w))
            .parameterValidator(bounds)
            .maxIterations(this.maxIterations)
            .maxEvaluations(this.maxEvaluations)
            .lazyEvaluation(false)
            .build();

        final LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = new LevenbergMarquardtOptimizer().optimize(problem);
        } catch (MathIllegalStateException ex) {
            throw new FitConvergenceException("Solver failed: " + ex.getMessage(), ex);
        }

        final double[] params = optimum.getPoint().toArray();
        for (double p : params) {
            if (!Double.isFinite(p))
                throw new FitConvergenceException("Solver returned non-finite parameters " + Arrays.toString(params));
        }

        final double cost = optimum.getCost();
        final double reducedChiSquared = cost * cost / (nPoints - nParams);

        double[] errors = new double[nParams];
        try {
            errors = optimum.getSigma(SINGULARITY_THRESHOLD).toArray();
        } catch (SingularMatrixException ex) {
            logger.debug("Singular covariance, parameter errors unavailable: {}", ex.getMessage());
            Arrays.fill(errors, Double.NaN);
        }

        logger.debug("{} converged after {} iterations ({} evaluations), chi2/dof={}",
                     model.getClass().getSimpleName(), optimum.getIterations(),
                     optimum.getEvaluations(), reducedChiSquared);

        return new FitOutcome(model.parameterNames(), params, errors, reducedChiSquared,
                              optimum.getIterations(), optimum.getEvaluations());
    }
}
