package edu.mcmaster.braggfit;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits the detector-plane shape of a peak with a bivariate Gaussian.
 * Weak peaks and peaks near the detector edge borrow their widths and
 * correlation from the nearest strong peak.
 */
public class AngularProfileFitter {

    private static final Logger logger = LoggerFactory.getLogger(AngularProfileFitter.class);

    // empirical seed widths (rad) against mean polar and mean azimuthal angle
    private static final PolynomialFunction POLAR_WIDTH =
        new PolynomialFunction(new double[]{-0.00012078, 0.00185031, 0.0002208, 0.00173264});
    private static final PolynomialFunction AZIMUTHAL_WIDTH =
        new PolynomialFunction(new double[]{0.00143871, -0.00049977, 0.00012506});

    private static final double MIN_WIDTH_SEED = 1.0e-4;
    private static final double MAX_WIDTH = 0.02;

    private final InstrumentConstants constants;
    private final IntegrationSettings settings;
    private final LeastSquaresSolver solver;

    public AngularProfileFitter(final InstrumentConstants constants, final IntegrationSettings settings) {
        this.constants = constants;
        this.settings = settings;
        this.solver = new LeastSquaresSolver(settings);
    }

    // -------------------------------------------------
    // Public Interface
    //--------------------------------------------------

    /**
     * Histogram of signal voxels inside {@code qMask}, spanning the central
     * {@code fracBoxToHistogram} of the angular extent of all valid voxels.
     * Azimuthal angles are unwrapped around the peak's nominal azimuth.
     */
    public AngularHistogram histogram(final VoxelGrid grid,
                                      final VoxelCoordinates coords,
                                      final SignalMask mask,
                                      final boolean[] qMask,
                                      final PeakGeometry geometry)
        throws DegenerateFitException
    {
        if (mask.isEmpty())
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": signal mask is empty");
        final double reference = CoordinateMapper.toAngles(geometry.nominalQ())[1];

        double pMin = Double.POSITIVE_INFINITY;
        double pMax = Double.NEGATIVE_INFINITY;
        double aMin = Double.POSITIVE_INFINITY;
        double aMax = Double.NEGATIVE_INFINITY;
        for (int idx = 0; idx < grid.size(); idx++) {
            if (!coords.isValid(idx))
                continue;
            final double p = coords.polar(idx);
            final double a = reference + BivariateGaussianModel.wrap(coords.azimuthal(idx) - reference);
            pMin = Math.min(pMin, p);
            pMax = Math.max(pMax, p);
            aMin = Math.min(aMin, a);
            aMax = Math.max(aMax, a);
        }
        if (!(pMax > pMin) || !(aMax > aMin))
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": voxels span no angular range");

        final double frac = this.settings.fracBoxToHistogram();
        final double pMid = 0.5 * (pMin + pMax);
        final double pHalf = 0.5 * frac * (pMax - pMin);
        final double aMid = 0.5 * (aMin + aMax);
        final double aHalf = 0.5 * frac * (aMax - aMin);
        final int nTheta = this.settings.nTheta();
        final int nPhi = this.settings.nPhi();
        final double pStep = 2.0 * pHalf / nTheta;
        final double aStep = 2.0 * aHalf / nPhi;

        double[] counts = new double[nTheta * nPhi];
        for (int idx = 0; idx < grid.size(); idx++) {
            if (!coords.isValid(idx) || !mask.isSignal(idx) || (qMask != null && !qMask[idx]))
                continue;
            final double p = coords.polar(idx);
            final double a = reference + BivariateGaussianModel.wrap(coords.azimuthal(idx) - reference);
            if (p < pMid - pHalf || p > pMid + pHalf || a < aMid - aHalf || a > aMid + aHalf)
                continue;
            final int it = Math.min((int) ((p - (pMid - pHalf)) / pStep), nTheta - 1);
            final int ip = Math.min((int) ((a - (aMid - aHalf)) / aStep), nPhi - 1);
            counts[it * nPhi + ip] += grid.count(idx);
        }
        AngularHistogram hist = new AngularHistogram(pMid - pHalf, pMid + pHalf, nTheta,
                                                     aMid - aHalf, aMid + aHalf, nPhi, counts);
        if (hist.totalCounts() <= 0.0)
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": angular histogram is empty");
        return hist;
    }

    /**
     * True when the peak is too weak, or too close to the detector edge, to
     * determine its own shape. Ignores the library.
     */
    public boolean needsBorrowedShape(final PeakGeometry geometry, final double intensity) {
        final int edge = this.settings.edgeCutoff();
        final boolean nearEdge = geometry.row() < edge
                                 || geometry.row() >= this.constants.detectorRows() - edge
                                 || geometry.column() < edge
                                 || geometry.column() >= this.constants.detectorColumns() - edge;
        return intensity < this.settings.forceCutoff() || nearEdge;
    }

    /**
     * Whether to use the forced fit, i.e. the peak needs a borrowed shape
     * and one is available.
     *
     * @param library strong peaks to borrow from, or {@code null} to never borrow
     */
    public boolean shouldForce(final PeakGeometry geometry, final double intensity, final StrongPeakLibrary library) {
        if (library == null || !needsBorrowedShape(geometry, intensity))
            return false;
        if (library.isEmpty()) {
            logger.warn("Peak {}: no strong peak to borrow a shape from, fitting freely", geometry.peakNumber());
            return false;
        }
        return true;
    }

    /**
     * Histograms and fits one peak, choosing the forced branch through
     * {@link #shouldForce}.
     *
     * @param intensity intensity estimate used for the force decision
     */
    public AngularProfileModel fit(final VoxelGrid grid,
                                   final VoxelCoordinates coords,
                                   final SignalMask mask,
                                   final boolean[] qMask,
                                   final PeakGeometry geometry,
                                   final double intensity,
                                   final StrongPeakLibrary library)
        throws FitException
    {
        final AngularHistogram hist = histogram(grid, coords, mask, qMask, geometry);
        if (shouldForce(geometry, intensity, library)) {
            final double[] angles = CoordinateMapper.toAngles(geometry.nominalQ());
            final StrongPeakEntry entry = library.nearest(angles[1], angles[0]).get();
            logger.debug("Peak {}: forced angular fit using {}", geometry.peakNumber(), entry);
            return fitForced(hist, geometry, entry);
        }
        return fitFree(hist, geometry);
    }

    public AngularProfileModel fitFree(final AngularHistogram hist, final PeakGeometry geometry)
        throws FitException
    {
        double[] seed = centreSeed(hist);
        final double[] mean = hist.weightedMean();
        seed[AngularProfileModel.SIGMA_POLAR] = widthSeed(POLAR_WIDTH.value(mean[0]));
        seed[AngularProfileModel.SIGMA_AZIMUTHAL] = widthSeed(AZIMUTHAL_WIDTH.value(mean[1]));

        double[][] b = centreBounds(hist, seed);
        setBounds(b, AngularProfileModel.SIGMA_POLAR, 0.0, MAX_WIDTH);
        setBounds(b, AngularProfileModel.SIGMA_AZIMUTHAL, 0.0, MAX_WIDTH);
        setBounds(b, AngularProfileModel.RHO, -1.0, 1.0);
        return solve(hist, geometry, seed, new ParameterBounds(b[0], b[1]), false);
    }

    public AngularProfileModel fitForced(final AngularHistogram hist,
                                         final PeakGeometry geometry,
                                         final StrongPeakEntry entry)
        throws FitException
    {
        double[] seed = centreSeed(hist);
        seed[AngularProfileModel.SIGMA_POLAR] = entry.sigmaPolar();
        seed[AngularProfileModel.SIGMA_AZIMUTHAL] = entry.sigmaAzimuthal();
        seed[AngularProfileModel.RHO] = entry.rho();

        final double tol = this.settings.forceTolerance();
        double[][] b = centreBounds(hist, seed);
        for (int p : new int[]{AngularProfileModel.SIGMA_POLAR, AngularProfileModel.SIGMA_AZIMUTHAL}) {
            final double v = seed[p];
            setBounds(b, p, Math.max(0.0, v - tol * Math.abs(v)), v + tol * Math.abs(v));
        }
        final double rho = entry.rho();
        setBounds(b, AngularProfileModel.RHO,
                  Math.max(-1.0, rho - tol * Math.abs(rho)), Math.min(1.0, rho + tol * Math.abs(rho)));
        return solve(hist, geometry, seed, new ParameterBounds(b[0], b[1]), true);
    }

    // -----------------------------------------------
    // Private Interface
    // -----------------------------------------------

    private AngularProfileModel solve(final AngularHistogram hist,
                                      final PeakGeometry geometry,
                                      final double[] seed,
                                      final ParameterBounds bounds,
                                      final boolean forced)
        throws FitException
    {
        final double[] h = hist.getCounts();
        double[] weights = new double[h.length];
        for (int i = 0; i < h.length; i++)
            weights[i] = 1.0 / Math.max(h[i], 1.0);

        final FitOutcome outcome = this.solver.fit(new BivariateGaussianModel(bounds), seed,
                                                   hist.coordinates(), h, weights);
        AngularProfileModel model = new AngularProfileModel(outcome.getParameters(), outcome.getErrors(),
                                                            outcome.getReducedChiSquared(), forced);
        if (!model.isPositiveDefinite())
            logger.warn("Peak {}: angular covariance is not positive-definite (sp={}, sa={}, rho={}), model is zero",
                        geometry.peakNumber(), model.getSigmaPolar(), model.getSigmaAzimuthal(), model.getRho());
        return model;
    }

    // amplitude and centre at the fullest bin
    private static double[] centreSeed(final AngularHistogram hist) {
        final int best = hist.argmax();
        double[] seed = new double[AngularProfileModel.NPARAMS];
        seed[AngularProfileModel.AMPLITUDE] = hist.getCounts()[best];
        seed[AngularProfileModel.MU_POLAR] = hist.polarCenter(best / hist.nPhi());
        seed[AngularProfileModel.MU_AZIMUTHAL] = hist.azimuthalCenter(best % hist.nPhi());
        seed[AngularProfileModel.BACKGROUND] = 0.0;
        return seed;
    }

    private double[][] centreBounds(final AngularHistogram hist, final double[] seed) {
        double[][] b = new double[2][AngularProfileModel.NPARAMS];
        setBounds(b, AngularProfileModel.AMPLITUDE, 0.0, Double.POSITIVE_INFINITY);
        setBounds(b, AngularProfileModel.BACKGROUND, 0.0, Double.POSITIVE_INFINITY);
        final double dp = this.settings.dth() * hist.polarStep();
        final double da = this.settings.dph() * hist.azimuthalStep();
        setBounds(b, AngularProfileModel.MU_POLAR,
                  seed[AngularProfileModel.MU_POLAR] - dp, seed[AngularProfileModel.MU_POLAR] + dp);
        setBounds(b, AngularProfileModel.MU_AZIMUTHAL,
                  seed[AngularProfileModel.MU_AZIMUTHAL] - da, seed[AngularProfileModel.MU_AZIMUTHAL] + da);
        return b;
    }

    private static double widthSeed(final double w) {
        return Math.min(MAX_WIDTH, Math.max(MIN_WIDTH_SEED, Math.abs(w)));
    }

    private static void setBounds(final double[][] b, final int idx, final double lo, final double hi) {
        b[0][idx] = lo;
        b[1][idx] = hi;
    }
}
