package edu.mcmaster.braggfit;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Builds the time-of-flight histogram of a peak's signal voxels and fits it
 * with an {@link IkedaCarpenterModel}.
 */
public class TofProfileFitter {

    private static final Logger logger = LoggerFactory.getLogger(TofProfileFitter.class);

    private static final double NEUTRON_MASS = 1.674929e-27; // kg
    private static final double JOULES_PER_EV = 1.60218e-19;

    private static final int MAX_SEED_BINS = 5;
    // bins at each end used to seed the background polynomial
    private static final int BG_SEED_BINS = 15;
    private static final double HATWIDTH_SEED = 0.5;
    private static final double KCONV_SEED = 120.0;
    private static final double MAX_T0 = 1.0e10;
    // background levels leaving fewer TOF bins than this are not scored
    static final int MIN_SCORING_BINS = 10;

    private final InstrumentConstants constants;
    private final IntegrationSettings settings;
    private final CoordinateMapper mapper;
    private final LeastSquaresSolver solver;

    public TofProfileFitter(final InstrumentConstants constants, final IntegrationSettings settings) {
        this.constants = constants;
        this.settings = settings;
        this.mapper = new CoordinateMapper(constants);
        this.solver = new LeastSquaresSolver(settings);
    }

    // -------------------------------------------------
    // Public Interface
    //--------------------------------------------------

    /**
     * Histogram of signal voxels inside {@code qMask}. The window is the
     * TOF range of the box corners intersected with
     * {@code T +/- dtSpread * T}; the bin width is the TOF step between the
     * box centre and its diagonal neighbour.
     */
    public TofHistogram histogram(final VoxelGrid grid,
                                  final VoxelCoordinates coords,
                                  final SignalMask mask,
                                  final boolean[] qMask,
                                  final PeakGeometry geometry)
        throws FitException
    {
        if (mask.isEmpty())
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": signal mask is empty");

        final double tofPeak = geometry.nominalTof(this.constants);
        double cornerMin = Double.POSITIVE_INFINITY;
        double cornerMax = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < 8; c++) {
            final double x = (c & 1) == 0 ? grid.min(0) : grid.max(0);
            final double y = (c & 2) == 0 ? grid.min(1) : grid.max(1);
            final double z = (c & 4) == 0 ? grid.min(2) : grid.max(2);
            final double t = this.mapper.tofAt(geometry, Math.sqrt(x * x + y * y + z * z));
            cornerMin = Math.min(cornerMin, t);
            cornerMax = Math.max(cornerMax, t);
        }
        final double dt = this.settings.dtSpread() * tofPeak;
        final double tLo = Math.max(cornerMin, tofPeak - dt);
        final double tHi = Math.min(cornerMax, tofPeak + dt);
        if (!(tHi > tLo))
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": empty TOF window");

        final double binWidth = binWidth(grid, geometry);
        final int nBins = (int) Math.floor((tHi - tLo) / binWidth);
        if (nBins < 1)
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": TOF window narrower than one bin");

        double[] counts = new double[nBins];
        for (int idx = 0; idx < grid.size(); idx++) {
            if (!coords.isValid(idx) || !mask.isSignal(idx) || (qMask != null && !qMask[idx]))
                continue;
            final double t = coords.tof(idx);
            if (t < tLo || t > tHi)
                continue;
            final int b = Math.min((int) ((t - tLo) / binWidth), nBins - 1);
            counts[b] += grid.count(idx);
        }
        logger.debug("Peak {}: TOF histogram of {} bins ({} us wide) over [{}, {}]",
                     geometry.peakNumber(), nBins, binWidth, tLo, tHi);
        return new TofHistogram(tLo, binWidth, counts);
    }

    /**
     * Fits the histogram and integrates the one-dimensional profile.
     *
     * @param bgEvents background events under the peak, subtracted from the
     *                 integrated intensity
     */
    public TofProfileModel fit(final TofHistogram hist, final PeakGeometry geometry, final double bgEvents)
        throws FitException
    {
        final int order = this.settings.bgPolyOrder();
        final int nParams = IkedaCarpenterModel.NICCPARAMS + order + 1;
        if (hist.nonEmptyBins() < nParams + 1)
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": " + hist.nonEmptyBins()
                                             + " non-empty TOF bins cannot constrain " + nParams + " parameters");

        final double[] t = hist.getTimes();
        final double[] y = hist.getCounts();
        double[] seed = initialGuess(hist, geometry, seedBackground(t, y, order));
        final ParameterBounds bounds = constraints(seed, order);
        final IkedaCarpenterModel model = new IkedaCarpenterModel(order, bounds);

        double[] weights = new double[y.length];
        for (int i = 0; i < y.length; i++)
            weights[i] = 1.0 / Math.max(y[i], 1.0);

        final FitOutcome outcome = this.solver.fit(model, seed, new double[][]{t}, y, weights);
        final double[] params = outcome.getParameters();
        final double[] fitted = model.evaluate(params, new double[][]{t});
        double[] background = new double[t.length];
        for (int i = 0; i < t.length; i++)
            background[i] = model.background(params, t[i]);

        final double[] integration = integrate(t, fitted, background, this.settings.fracStop(),
                                               bgEvents, outcome.getReducedChiSquared());
        if (logger.isDebugEnabled())
            logger.debug("Peak {}: TOF fit{}", geometry.peakNumber(), outcome.parameterTable());
        return new TofProfileModel(params, outcome.getErrors(), order, outcome.getReducedChiSquared(),
                                   t, fitted, background, integration);
    }

    /**
     * Scores a background level by the reduced chi-squared of the TOF fit
     * to the voxels it leaves as signal. A level that leaves fewer than
     * {@link #MIN_SCORING_BINS} non-empty TOF bins is degenerate, which ends
     * the background search.
     */
    public BackgroundSeparator.LambdaScorer scorer(final VoxelGrid grid,
                                                   final VoxelCoordinates coords,
                                                   final boolean[] qMask,
                                                   final PeakGeometry geometry)
    {
        return new BackgroundSeparator.LambdaScorer() {
            @Override
            public double score(final SignalMask candidate) throws FitException {
                final TofHistogram hist = histogram(grid, coords, candidate, qMask, geometry);
                if (hist.nonEmptyBins() < MIN_SCORING_BINS)
                    throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": only "
                                                     + hist.nonEmptyBins() + " TOF bins left to score");
                return fit(hist, geometry, 0.0).getReducedChiSquared();
            }
        };
    }

    /** Time in microseconds for a neutron of {@code energy} eV to travel {@code flightPath} m. */
    public static double t0Shift(final double energy, final double flightPath) {
        final double joules = energy * JOULES_PER_EV;
        return flightPath * Math.sqrt(NEUTRON_MASS / 2.0 / joules) * 1.0e6;
    }

    /**
     * Rectangular integration over the bins where the background-free fit
     * exceeds {@code fracStop} of its maximum.
     *
     * @return {intensity, sigma, tStart, tStop}
     */
    public static double[] integrate(final double[] t,
                                     final double[] fitted,
                                     final double[] background,
                                     final double fracStop,
                                     final double bgEvents,
                                     final double varFit)
    {
        final int n = t.length;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++)
            max = Math.max(max, fitted[i] - background[i]);

        int iStart = -1;
        int iStop = -1;
        if (max > 0.0) {
            for (int i = 0; i < n; i++) {
                if ((fitted[i] - background[i]) / max > fracStop) {
                    if (iStart < 0)
                        iStart = i;
                    iStop = i;
                }
            }
        }
        if (iStart < 0) {
            logger.warn("No bin of the TOF profile rises above {} of its maximum", fracStop);
            return new double[]{0.0, 1.0, t[0], t[n - 1]};
        }

        double sum = 0.0;
        for (int i = iStart; i <= iStop; i++)
            sum += fitted[i] - background[i];
        final double intensity = sum - bgEvents;
        final double sigma = Math.sqrt(Math.max(intensity + 2.0 * bgEvents + varFit, 0.0));
        return new double[]{intensity, sigma, t[iStart], t[iStop]};
    }

    // -----------------------------------------------
    // Package Interface
    // -----------------------------------------------

    /**
     * Seed parameters. A, B and R come from the moderator at the peak
     * energy; T0 places the pulse maximum on the strongest bins; Scale
     * matches the pulse height to the background-subtracted data.
     */
    double[] initialGuess(final TofHistogram hist, final PeakGeometry geometry, final double[] bgSeed) {
        final int order = bgSeed.length - 1;
        final double energy = geometry.energy();
        final double[] t = hist.getTimes();
        final double[] y = hist.getCounts();

        double[] seed = new double[IkedaCarpenterModel.NICCPARAMS + order + 1];
        seed[IkedaCarpenterModel.A] = this.constants.moderatorValue("A", energy);
        seed[IkedaCarpenterModel.B] = this.constants.moderatorValue("B", energy);
        seed[IkedaCarpenterModel.R] = this.constants.moderatorValue("R", energy);
        seed[IkedaCarpenterModel.HATWIDTH] = HATWIDTH_SEED;
        seed[IkedaCarpenterModel.KCONV] = KCONV_SEED;
        seed[IkedaCarpenterModel.SCALE] = 1.0;
        System.arraycopy(bgSeed, 0, seed, IkedaCarpenterModel.NICCPARAMS, bgSeed.length);

        final double moderatorT0 = this.constants.moderatorValue("T0", energy)
                                   + t0Shift(energy, geometry.flightPath());

        // mean TOF of the strongest bins
        int positive = 0;
        for (double v : y)
            if (v > 0.0) positive++;
        final int nTop = Math.max(1, Math.min(MAX_SEED_BINS, positive));
        boolean[] taken = new boolean[y.length];
        double tTop = 0.0;
        for (int n = 0; n < nTop; n++) {
            int best = -1;
            for (int i = 0; i < y.length; i++) {
                if (!taken[i] && (best < 0 || y[i] > y[best]))
                    best = i;
            }
            taken[best] = true;
            tTop += t[best];
        }
        tTop /= nTop;

        final IkedaCarpenterModel unbounded = new IkedaCarpenterModel(order, ParameterBounds.unbounded(seed.length));
        seed[IkedaCarpenterModel.T0] = tTop;
        final int rise = argmax(unbounded.peak(seed, t));
        seed[IkedaCarpenterModel.T0] = Math.max(tTop - (t[rise] - tTop), 0.0);

        final double[] pulse = unbounded.peak(seed, t);
        final double pulseMax = pulse[argmax(pulse)];
        double dataMax = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < t.length; i++)
            dataMax = Math.max(dataMax, y[i] - unbounded.background(seed, t[i]));
        seed[IkedaCarpenterModel.SCALE] = pulseMax > 0.0 && dataMax > 0.0
                                          ? dataMax / pulseMax
                                          : hist.totalCounts();

        logger.debug("Peak {}: seed T0={} (moderator estimate {}), scale={}", geometry.peakNumber(),
                     seed[IkedaCarpenterModel.T0], moderatorT0, seed[IkedaCarpenterModel.SCALE]);
        return seed;
    }

    /**
     * Bounds for the configured constraint scheme. Instrument overrides
     * carrying a third value replace the matching seed entry.
     */
    ParameterBounds constraints(final double[] seed, final int order) {
        final int n = IkedaCarpenterModel.NICCPARAMS + order + 1;
        double[] lo = new double[n];
        double[] hi = new double[n];
        Arrays.fill(lo, Double.NEGATIVE_INFINITY);
        Arrays.fill(hi, Double.POSITIVE_INFINITY);

        switch (this.settings.constraintScheme()) {
            case 0:
                Arrays.fill(lo, 0, IkedaCarpenterModel.NICCPARAMS, 0.0);
                hi[IkedaCarpenterModel.R] = 1.0;
                break;
            case 1:
                for (int p : new int[]{IkedaCarpenterModel.A, IkedaCarpenterModel.B, IkedaCarpenterModel.R}) {
                    lo[p] = Math.min(0.5 * seed[p], 1.5 * seed[p]);
                    hi[p] = Math.max(0.5 * seed[p], 1.5 * seed[p]);
                }
                set(lo, hi, IkedaCarpenterModel.T0, 0.0, MAX_T0);
                set(lo, hi, IkedaCarpenterModel.SCALE, 0.0, Double.POSITIVE_INFINITY);
                set(lo, hi, IkedaCarpenterModel.HATWIDTH, 0.0, 5.0);
                set(lo, hi, IkedaCarpenterModel.KCONV, 100.0, 140.0);
                for (int p = 0; p < IkedaCarpenterModel.NICCPARAMS; p++) {
                    final String key = InstrumentConstants.ICC_CONSTRAINT_KEYS[p];
                    if (!this.constants.hasIccConstraint(key))
                        continue;
                    final double[] c = this.constants.iccConstraint(key);
                    set(lo, hi, p, c[0], c[1]);
                    if (c.length == 3)
                        seed[p] = c[2];
                }
                break;
            case 2:
                set(lo, hi, IkedaCarpenterModel.A, 1.0e-4, 1.0);
                set(lo, hi, IkedaCarpenterModel.B, 0.005, 1.5);
                set(lo, hi, IkedaCarpenterModel.R, 0.0, 1.0);
                set(lo, hi, IkedaCarpenterModel.T0, 0.0, MAX_T0);
                set(lo, hi, IkedaCarpenterModel.SCALE, 0.0, 1.0e10);
                set(lo, hi, IkedaCarpenterModel.HATWIDTH, 0.0, 5.0);
                set(lo, hi, IkedaCarpenterModel.KCONV, 100.0, 140.0);
                break;
            default:
                throw new ConfigurationException("Unknown constraint scheme " + this.settings.constraintScheme());
        }
        set(lo, hi, n - 1, -1.0, 1.0);
        return new ParameterBounds(lo, hi);
    }

    /** Polynomial through the outer bins, constant term first. */
    static double[] seedBackground(final double[] t, final double[] y, final int order) {
        final WeightedObservedPoints points = new WeightedObservedPoints();
        for (int i = 0; i < t.length; i++) {
            if (i < BG_SEED_BINS || i >= t.length - BG_SEED_BINS)
                points.add(t[i], y[i]);
        }
        try {
            return PolynomialCurveFitter.create(order).withMaxIterations(1000).fit(points.toList());
        } catch (MathIllegalStateException ex) {
            logger.debug("Background polynomial seed failed ({}), starting from zero", ex.getMessage());
            return new double[order + 1];
        }
    }

    // -----------------------------------------------
    // Private Interface
    // -----------------------------------------------

    private double binWidth(final VoxelGrid grid, final PeakGeometry geometry) throws GeometryException {
        final int ci = grid.nx() / 2;
        final int cj = grid.ny() / 2;
        final int ck = grid.nz() / 2;
        final double min = this.settings.minDtBinWidth();
        final double max = this.settings.maxDtBinWidth();
        if (ci + 1 >= grid.nx() || cj + 1 >= grid.ny() || ck + 1 >= grid.nz())
            return min;
        final double rC = norm(grid.qx(ci), grid.qy(cj), grid.qz(ck));
        final double rD = norm(grid.qx(ci + 1), grid.qy(cj + 1), grid.qz(ck + 1));
        final double width = Math.abs(this.mapper.tofAt(geometry, rD) - this.mapper.tofAt(geometry, rC));
        return Math.min(max, Math.max(min, width));
    }

    private static double norm(final double x, final double y, final double z) {
        return Math.sqrt(x * x + y * y + z * z);
    }

    private static int argmax(final double[] v) {
        int best = 0;
        for (int i = 1; i < v.length; i++)
            if (v[i] > v[best]) best = i;
        return best;
    }

    private static void set(final double[] lo, final double[] hi, final int idx, final double l, final double h) {
        lo[idx] = l;
        hi[idx] = h;
    }
}
