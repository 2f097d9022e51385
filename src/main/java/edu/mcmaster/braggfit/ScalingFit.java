package edu.mcmaster.braggfit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scales the composed profile to the counts around its maximum and
 * integrates the scaled model.
 */
public class ScalingFit {

    private static final Logger logger = LoggerFactory.getLogger(ScalingFit.class);

    private final IntegrationSettings settings;
    private final LeastSquaresSolver solver;

    public ScalingFit(final IntegrationSettings settings) {
        this.settings = settings;
        this.solver = new LeastSquaresSolver(settings);
    }

    /*----------- Public Interface ------------------*/

    /**
     * Fits {@code A1 * Y + A0} to the counts in the cube of
     * {@code scalingNeighborhood} voxels around the maximum of {@code yJoint},
     * restricted to signal voxels when any lie inside the cube.
     *
     * @param yJoint composed profile, normalised to a maximum of 1
     * @param qMask  voxels eligible as background, or {@code null} for all
     */
    public ScalingResult fit(final VoxelGrid grid,
                             final double[] yJoint,
                             final SignalMask mask,
                             final boolean[] qMask,
                             final PeakGeometry geometry)
        throws FitException
    {
        assert(yJoint.length == grid.size() && mask.size() == grid.size());
        final int peakIdx = argmax(yJoint);
        final int[] c = grid.voxel(peakIdx);
        final int s = this.settings.scalingNeighborhood();

        int nCube = 0;
        int nSignal = 0;
        boolean[] cube = new boolean[grid.size()];
        for (int k = Math.max(0, c[2] - s); k <= Math.min(grid.nz() - 1, c[2] + s); k++) {
            for (int j = Math.max(0, c[1] - s); j <= Math.min(grid.ny() - 1, c[1] + s); j++) {
                for (int i = Math.max(0, c[0] - s); i <= Math.min(grid.nx() - 1, c[0] + s); i++) {
                    final int idx = grid.index(i, j, k);
                    cube[idx] = true;
                    nCube++;
                    if (mask.isSignal(idx))
                        nSignal++;
                }
            }
        }
        final boolean useMask = nSignal > 0;
        final int n = useMask ? nSignal : nCube;
        double[] y = new double[n];
        double[] counts = new double[n];
        int m = 0;
        for (int idx = 0; idx < cube.length; idx++) {
            if (cube[idx] && (!useMask || mask.isSignal(idx))) {
                y[m] = yJoint[idx];
                counts[m] = grid.count(idx);
                m++;
            }
        }

        final FitOutcome outcome = this.solver.fit(new LinearScalingModel(), seed(y, counts),
                                                   new double[][]{y}, counts, null);
        final double a1 = outcome.getParameter(LinearScalingModel.A1);
        final double a0 = outcome.getParameter(LinearScalingModel.A0);
        final double chi2 = outcome.getReducedChiSquared();

        double[] fitted = new double[grid.size()];
        for (int idx = 0; idx < fitted.length; idx++)
            fitted[idx] = a1 * yJoint[idx] + a0;

        final double[] centerQ = grid.q(peakIdx);
        final double[] q0 = geometry.nominalQ();
        final double dQ = Math.sqrt(sq(centerQ[0] - q0[0]) + sq(centerQ[1] - q0[1]) + sq(centerQ[2] - q0[2]));

        int peakVoxels = 0;
        double intensity = 0.0;
        for (int idx = 0; idx < yJoint.length; idx++) {
            if (yJoint[idx] > this.settings.fracStop()) {
                intensity += a1 * yJoint[idx];
                peakVoxels++;
            }
        }
        final double bgEvents = backgroundEvents(grid, mask, qMask, peakVoxels);
        final double sigma = Math.sqrt(Math.max(intensity + 2.0 * bgEvents + chi2, 0.0));

        logger.debug("Peak {}: A1={}, A0={}, chi2={} over {} voxels, I={} +/- {}",
                     geometry.peakNumber(), a1, a0, chi2, n, intensity, sigma);
        return new ScalingResult(a1, a0, chi2, fitted, peakIdx, centerQ, dQ,
                                 intensity, sigma, bgEvents, peakVoxels);
    }

    /**
     * Expected background events over {@code nVoxels} voxels: the mean count
     * of non-signal voxels inside {@code qMask} whose smoothed count is
     * positive, times {@code nVoxels}.
     */
    public static double backgroundEvents(final VoxelGrid grid,
                                          final SignalMask mask,
                                          final boolean[] qMask,
                                          final int nVoxels)
    {
        long sum = 0;
        int n = 0;
        for (int idx = 0; idx < grid.size(); idx++) {
            if (mask.isSignal(idx) || (qMask != null && !qMask[idx]) || !(mask.smoothedCount(idx) > 0.0))
                continue;
            sum += grid.count(idx);
            n++;
        }
        return n == 0 ? 0.0 : ((double) sum) / n * nVoxels;
    }

    /* ---------- Private Interface ----------------*/

    // ordinary least squares, with the slope clipped at zero
    private static double[] seed(final double[] y, final double[] counts) {
        double my = 0.0;
        double mc = 0.0;
        for (int i = 0; i < y.length; i++) {
            my += y[i];
            mc += counts[i];
        }
        my /= y.length;
        mc /= y.length;
        double cov = 0.0;
        double var = 0.0;
        for (int i = 0; i < y.length; i++) {
            cov += (y[i] - my) * (counts[i] - mc);
            var += (y[i] - my) * (y[i] - my);
        }
        final double a1 = var > 0.0 ? Math.max(cov / var, 0.0) : 0.0;
        return new double[]{a1, mc - a1 * my};
    }

    private static int argmax(final double[] v) {
        int best = 0;
        for (int i = 1; i < v.length; i++)
            if (v[i] > v[best]) best = i;
        return best;
    }

    private static double sq(final double x) {
        return x * x;
    }
}
