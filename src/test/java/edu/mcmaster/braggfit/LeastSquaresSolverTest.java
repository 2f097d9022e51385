package edu.mcmaster.braggfit;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LeastSquaresSolverTest {

    private final LeastSquaresSolver solver = new LeastSquaresSolver(1000, 10000);

    // exponential decay a * exp(-k x)
    private static final class Decay implements CurveModel {
        private final ParameterBounds bounds;

        Decay(final ParameterBounds bounds) {
            this.bounds = bounds;
        }

        @Override
        public double[] evaluate(final double[] params, final double[][] coordinates) {
            double[] out = new double[coordinates[0].length];
            for (int i = 0; i < out.length; i++)
                out[i] = params[0] * Math.exp(-params[1] * coordinates[0][i]);
            return out;
        }

        @Override
        public ParameterBounds parameterBounds() {
            return this.bounds;
        }

        @Override
        public String[] parameterNames() {
            return new String[]{"a", "k"};
        }
    }

    private static double[] xs(final int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++)
            x[i] = 0.25 * i;
        return x;
    }

    @Test
    public void fitsNonlinearModel() throws Exception {
        final double[] x = xs(40);
        final Decay model = new Decay(ParameterBounds.unbounded(2));
        final double[] y = model.evaluate(new double[]{12.0, 0.7}, new double[][]{x});

        final FitOutcome fit = solver.fit(model, new double[]{5.0, 0.2}, new double[][]{x}, y, null);
        assertEquals(12.0, fit.getParameter("a"), 1e-6);
        assertEquals(0.7, fit.getParameter("k"), 1e-6);
        assertTrue(fit.getReducedChiSquared() < 1e-12);
        assertTrue(fit.getIterations() > 0);
        assertEquals(2, fit.getErrors().length);
    }

    @Test
    public void keepsParametersInsideBounds() throws Exception {
        final double[] x = xs(40);
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++)
            y[i] = 5.0 - 2.0 * x[i];

        final FitOutcome fit = solver.fit(new LinearScalingModel(), new double[]{1.0, 0.0},
                                          new double[][]{x}, y, null);
        assertTrue(fit.getParameter("A1") >= 0.0);
        assertTrue(new LinearScalingModel().parameterBounds().contains(fit.getParameters()));
    }

    @Test
    public void startIsClampedIntoBounds() throws Exception {
        final double[] x = xs(20);
        final Decay model = new Decay(new ParameterBounds(new double[]{0.0, 0.1}, new double[]{100.0, 2.0}));
        final double[] y = model.evaluate(new double[]{3.0, 0.5}, new double[][]{x});
        final FitOutcome fit = solver.fit(model, new double[]{500.0, -4.0}, new double[][]{x}, y, null);
        assertEquals(3.0, fit.getParameter(0), 1e-5);
        assertEquals(0.5, fit.getParameter(1), 1e-5);
    }

    @Test
    public void weightsScaleChiSquared() throws Exception {
        final double[] x = xs(10);
        double[] y = new double[x.length];
        double[] w = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 1.0 + x[i] + (i % 2 == 0 ? 0.1 : -0.1);
            w[i] = 4.0;
        }
        final FitOutcome plain = solver.fit(new LinearScalingModel(), new double[]{1.0, 1.0},
                                            new double[][]{x}, y, null);
        final FitOutcome weighted = solver.fit(new LinearScalingModel(), new double[]{1.0, 1.0},
                                               new double[][]{x}, y, w);
        assertEquals(4.0 * plain.getReducedChiSquared(), weighted.getReducedChiSquared(), 1e-9);
    }

    @Test(expected = DegenerateFitException.class)
    public void needsMorePointsThanParameters() throws Exception {
        solver.fit(new LinearScalingModel(), new double[]{1.0, 0.0},
                   new double[][]{{0.0, 1.0}}, new double[]{1.0, 2.0}, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void boundsMustMatchStart() throws Exception {
        solver.fit(new LinearScalingModel(), new double[]{1.0},
                   new double[][]{xs(5)}, new double[5], null);
    }
}
