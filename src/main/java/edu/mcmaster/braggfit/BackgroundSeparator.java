package edu.mcmaster.braggfit;

import org.apache.commons.math3.special.Gamma;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a voxel grid into signal and background using Poisson statistics
 * on neighbourhood-averaged counts.
 */
public class BackgroundSeparator {

    private static final Logger logger = LoggerFactory.getLogger(BackgroundSeparator.class);

    // step of the Poisson-mode search
    private static final double LAMBDA_GROWTH = 1.05;
    private static final double MIN_LAMBDA = 1.0e-3;
    private static final double POISSON_SEED = 0.1;
    // candidate levels closer than this are treated as one
    private static final double CANDIDATE_SPACING = 0.001;
    private static final double PPL_FRAC_STEP = 0.4;

    /**
     * Scores a trial background level, typically by fitting the TOF profile
     * of the candidate mask and returning its reduced chi-squared.
     */
    public interface LambdaScorer {
        double score(SignalMask candidate) throws FitException;
    }

    private final IntegrationSettings settings;
    private final LeastSquaresSolver solver;

    public BackgroundSeparator(final IntegrationSettings settings) {
        this.settings = settings;
        this.solver = new LeastSquaresSolver(settings);
    }

    // -------------------------------------------------
    // Public Interface
    //--------------------------------------------------

    /** Mask for a known background level. */
    public SignalMask separate(final VoxelGrid grid, final double ppLambda) {
        final double[] smoothed = smooth(grid, this.settings.neighborhood());
        return buildMask(grid, smoothed, ppLambda, null);
    }

    /**
     * Poisson mode: start from the most probable count of a Poisson fit to
     * the non-zero voxels and raise the level by 5% until at least one
     * event falls outside the mask.
     */
    public SignalMask separate(final VoxelGrid grid) {
        final double[] smoothed = smooth(grid, this.settings.neighborhood());
        final long allEvents = grid.totalCounts();
        if (allEvents == 0) {
            logger.debug("Grid holds no events, signal mask is empty");
            return buildMask(grid, smoothed, 0.0, null);
        }
        double ppLambda = Math.max(estimatePoissonLambda(grid), MIN_LAMBDA);
        SignalMask mask = buildMask(grid, smoothed, ppLambda, null);
        while (mask.signalEvents(grid) >= allEvents) {
            ppLambda *= LAMBDA_GROWTH;
            mask = buildMask(grid, smoothed, ppLambda, null);
        }
        logger.debug("Poisson background level {} keeps {} signal voxels", ppLambda, mask.signalCount());
        return mask;
    }

    /**
     * Optimised mode: try every distinct smoothed count inside
     * [pplminFrac, pplmaxFrac] times the predicted background and keep the
     * level whose score is closest to 1. When no level can be scored the
     * lower fraction is relaxed; as a last resort the Poisson mode is used.
     *
     * @param qMask voxels to consider, or {@code null} for all
     */
    public SignalMask separate(final VoxelGrid grid, final boolean[] qMask, final LambdaScorer scorer) {
        assert(qMask == null || qMask.length == grid.size());
        if (grid.totalCounts() == 0) {
            logger.debug("Grid holds no events, signal mask is empty");
            return buildMask(grid, smooth(grid, this.settings.neighborhood()), 0.0, qMask);
        }
        final double[] smoothed = smooth(grid, this.settings.neighborhood());
        final double meanBG = meanBackground(grid, smoothed, qMask);
        if (Double.isNaN(meanBG)) {
            logger.warn("No background voxels outside the peak region, using Poisson background");
            return restrict(separate(grid), grid, qMask);
        }

        double pplmin = this.settings.pplminFrac();
        while (pplmin >= 0.0) {
            SignalMask best = searchCandidates(grid, smoothed, qMask, scorer, meanBG, pplmin);
            if (best != null)
                return best;
            pplmin -= PPL_FRAC_STEP;
        }
        logger.warn("No background level could be scored, using Poisson background");
        return restrict(separate(grid), grid, qMask);
    }

    /**
     * Box average over {@code n x n x n} neighbours with mirrored edges.
     */
    public static double[] smooth(final VoxelGrid grid, final int n) {
        final int nx = grid.nx();
        final int ny = grid.ny();
        final int nz = grid.nz();
        final int lo = -(n / 2);
        final int hi = n - 1 - (n / 2);
        final double norm = 1.0 / (n * n * n);
        double[] out = new double[grid.size()];
        for (int k = 0; k < nz; k++) {
            for (int j = 0; j < ny; j++) {
                for (int i = 0; i < nx; i++) {
                    double sum = 0.0;
                    for (int dk = lo; dk <= hi; dk++) {
                        final int kk = reflect(k + dk, nz);
                        for (int dj = lo; dj <= hi; dj++) {
                            final int jj = reflect(j + dj, ny);
                            for (int di = lo; di <= hi; di++) {
                                sum += grid.count(reflect(i + di, nx), jj, kk);
                            }
                        }
                    }
                    out[grid.index(i, j, k)] = sum * norm;
                }
            }
        }
        return out;
    }

    /**
     * Most probable background count: least-squares fit of a scaled Poisson
     * distribution to the histogram of non-zero voxel counts.
     */
    public double estimatePoissonLambda(final VoxelGrid grid) {
        int maxCount = 0;
        long nonZero = 0;
        long sum = 0;
        for (int i = 0; i < grid.size(); i++) {
            final int c = grid.count(i);
            if (c > 0) {
                maxCount = Math.max(maxCount, c);
                nonZero++;
                sum += c;
            }
        }
        if (nonZero == 0)
            return 0.0;

        final double[] k = new double[maxCount];
        final double[] hist = new double[maxCount];
        for (int i = 0; i < maxCount; i++)
            k[i] = i + 1;
        for (int i = 0; i < grid.size(); i++) {
            final int c = grid.count(i);
            if (c > 0)
                hist[c - 1] += 1.0;
        }

        final double mean = ((double) sum) / nonZero;
        if (maxCount < 2)
            return mean;
        try {
            FitOutcome fit = this.solver.fit(new ScaledPoissonModel(hist), new double[]{POISSON_SEED},
                                             new double[][]{k}, hist, null);
            return fit.getParameter(0);
        } catch (FitException ex) {
            logger.debug("Poisson fit of the count histogram failed ({}), using the mean count", ex.getMessage());
            return mean;
        }
    }

    /**
     * Mean count of the voxels outside the central peak cube whose smoothed
     * count is non-zero; NaN when there are none.
     */
    double meanBackground(final VoxelGrid grid, final double[] smoothed, final boolean[] qMask) {
        final int dP = this.settings.peakMaskSize();
        final int cx = grid.nx() / 2;
        final int cy = grid.ny() / 2;
        final int cz = grid.nz() / 2;
        long sum = 0;
        long n = 0;
        for (int k = 0; k < grid.nz(); k++) {
            for (int j = 0; j < grid.ny(); j++) {
                for (int i = 0; i < grid.nx(); i++) {
                    final boolean inPeak = i >= cx - dP && i < cx + dP &&
                                           j >= cy - dP && j < cy + dP &&
                                           k >= cz - dP && k < cz + dP;
                    final int idx = grid.index(i, j, k);
                    if (inPeak || (qMask != null && !qMask[idx]) || !(smoothed[idx] > 0.0))
                        continue;
                    sum += grid.count(idx);
                    n++;
                }
            }
        }
        return n == 0 ? Double.NaN : ((double) sum) / n;
    }

    // -----------------------------------------------
    // Private Interface
    // -----------------------------------------------

    private SignalMask searchCandidates(final VoxelGrid grid,
                                        final double[] smoothed,
                                        final boolean[] qMask,
                                        final LambdaScorer scorer,
                                        final double meanBG,
                                        final double pplminFrac)
    {
        final double predicted = 0.98 * meanBG * 1.96;
        final double minppl = pplminFrac * predicted;
        final double maxppl = this.settings.pplmaxFrac() * predicted;

        List<Double> candidates = new ArrayList<>();
        double[] levels = smoothed.clone();
        Arrays.sort(levels);
        for (int i = 1; i < levels.length; i++) {
            if (levels[i] - levels[i - 1] > CANDIDATE_SPACING && levels[i] > minppl && levels[i] < maxppl)
                candidates.add(levels[i]);
        }
        if (candidates.isEmpty()) {
            logger.warn("Cannot find a suitable background level in ({}, {}); consider adjusting pplminFrac or pplmaxFrac",
                        minppl, maxppl);
            candidates.add(meanBG * 1.96);
        }

        double bestScore = Double.POSITIVE_INFINITY;
        SignalMask best = null;
        int oldSignalCount = -1;
        for (double ppLambda : candidates) {
            final SignalMask candidate = buildMask(grid, smoothed, ppLambda, qMask);
            // nothing new removed
            if (candidate.signalCount() == oldSignalCount)
                continue;
            oldSignalCount = candidate.signalCount();
            final double score;
            try {
                score = scorer.score(candidate);
            } catch (FitException ex) {
                logger.debug("Background level {} could not be scored: {}", ppLambda, ex.getMessage());
                break;
            }
            final double distance = Math.abs(score - 1.0);
            if (distance < bestScore) {
                bestScore = distance;
                best = candidate;
            }
        }
        if (best != null)
            logger.debug("Accepted background level {} ({} signal voxels)", best.ppLambda(), best.signalCount());
        return best;
    }

    private SignalMask buildMask(final VoxelGrid grid,
                                 final double[] smoothed,
                                 final double ppLambda,
                                 final boolean[] qMask)
    {
        final double lambda = Math.max(ppLambda, 0.0);
        final int n = this.settings.neighborhood();
        final double window = Math.pow(2 * n + 1, 3);
        final double threshold = lambda + this.settings.zBG() * Math.sqrt(lambda / window);
        boolean[] mask = new boolean[grid.size()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = grid.count(i) > 0 && smoothed[i] > threshold && (qMask == null || qMask[i]);
        }
        return new SignalMask(mask, smoothed, lambda, threshold);
    }

    private SignalMask restrict(final SignalMask mask, final VoxelGrid grid, final boolean[] qMask) {
        if (qMask == null)
            return mask;
        double[] smoothed = new double[grid.size()];
        boolean[] out = new boolean[grid.size()];
        for (int i = 0; i < out.length; i++) {
            smoothed[i] = mask.smoothedCount(i);
            out[i] = mask.isSignal(i) && qMask[i];
        }
        return new SignalMask(out, smoothed, mask.ppLambda(), mask.thresholdAt(0));
    }

    private static int reflect(int i, final int n) {
        if (n == 1)
            return 0;
        while (i < 0 || i >= n) {
            if (i < 0)
                i = -i - 1;
            if (i >= n)
                i = 2 * n - i - 1;
        }
        return i;
    }

    /**
     * Poisson distribution over k scaled to best match the histogram; the
     * scale has a closed form so the only free parameter is lambda.
     */
    static final class ScaledPoissonModel implements CurveModel {

        private static final String[] NAMES = {"lambda"};
        private static final ParameterBounds BOUNDS = new ParameterBounds(
            new double[]{1.0e-6}, new double[]{Double.POSITIVE_INFINITY});

        private final double[] hist;

        ScaledPoissonModel(final double[] hist) {
            this.hist = hist;
        }

        @Override
        public double[] evaluate(final double[] params, final double[][] coordinates) {
            final double lambda = params[0];
            final double[] k = coordinates[0];
            double[] pmf = new double[k.length];
            double dotHist = 0.0;
            double dotSelf = 0.0;
            for (int i = 0; i < k.length; i++) {
                pmf[i] = Math.exp(k[i] * Math.log(lambda) - lambda - Gamma.logGamma(k[i] + 1.0));
                dotHist += pmf[i] * this.hist[i];
                dotSelf += pmf[i] * pmf[i];
            }
            final double scale = dotSelf > 0.0 ? dotHist / dotSelf : 0.0;
            for (int i = 0; i < k.length; i++)
                pmf[i] *= scale;
            return pmf;
        }

        @Override
        public ParameterBounds parameterBounds() {
            return BOUNDS;
        }

        @Override
        public String[] parameterNames() {
            return NAMES;
        }
    }
}
