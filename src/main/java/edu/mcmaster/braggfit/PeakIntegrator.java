package edu.mcmaster.braggfit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Integrates peaks by profile fitting: background separation, TOF fit,
 * angular fit, composition, and a linear scaling fit to the counts.
 *
 * <p>A per-peak failure never aborts a batch; the peak is reported with a
 * failure status. Configuration errors do abort it.</p>
 */
public class PeakIntegrator {

    private static final Logger logger = LoggerFactory.getLogger(PeakIntegrator.class);

    private final IntegrationSettings settings;
    private final CoordinateMapper mapper;
    private final BackgroundSeparator separator;
    private final TofProfileFitter tofFitter;
    private final AngularProfileFitter angularFitter;
    private final ScalingFit scalingFit;

    public PeakIntegrator(final InstrumentConstants constants, final IntegrationSettings settings) {
        this.settings = settings;
        this.mapper = new CoordinateMapper(constants);
        this.separator = new BackgroundSeparator(settings);
        this.tofFitter = new TofProfileFitter(constants, settings);
        this.angularFitter = new AngularProfileFitter(constants, settings);
        this.scalingFit = new ScalingFit(settings);
    }

    // -------------------------------------------------
    // Public Interface
    //--------------------------------------------------

    public FitResult integrate(final VoxelGrid grid,
                               final PeakGeometry geometry,
                               final StrongPeakLibrary library)
    {
        return integrate(grid, geometry, null, library);
    }

    /**
     * Integrates one peak.
     *
     * @param qMask   voxels to consider, or {@code null} for all
     * @param library strong-peak shapes for weak peaks, or {@code null} to
     *                fit every peak freely
     */
    public FitResult integrate(final VoxelGrid grid,
                               final PeakGeometry geometry,
                               final boolean[] qMask,
                               final StrongPeakLibrary library)
    {
        final PeakFitContext ctx = new PeakFitContext(geometry, grid, qMask);
        try {
            return run(ctx, library);
        } catch (FitException ex) {
            logger.warn("Peak {} failed ({}): {}", geometry.peakNumber(), ex.status(), ex.getMessage());
            return FitResult.failed(ctx, ex);
        }
    }

    /**
     * Integrates a batch in two passes. The first fits every peak freely;
     * the strong ones among them form the library the second pass lends to
     * weak and edge peaks. Results are in input order.
     */
    public List<FitResult> integrateAll(final List<PeakGeometry> peaks, final VoxelGridSource source) {
        logger.info("Integrating {} peaks on {} threads", peaks.size(), this.settings.threads());
        List<FitResult> results = runBatch(peaks, source, null);

        StrongPeakLibrary.Builder builder = StrongPeakLibrary.builder();
        for (FitResult r : results)
            builder.add(r);
        final StrongPeakLibrary library = builder.build();
        logger.info("Strong-peak library holds {} shapes", library.size());

        List<PeakGeometry> weak = new ArrayList<PeakGeometry>();
        List<Integer> weakIdx = new ArrayList<Integer>();
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i).needsBorrowedShape()) {
                weak.add(peaks.get(i));
                weakIdx.add(i);
            }
        }
        if (!weak.isEmpty()) {
            if (library.isEmpty()) {
                logger.warn("No strong peaks to lend shapes to {} weak peaks; keeping their free fits", weak.size());
            } else {
                List<FitResult> refits = runBatch(weak, source, library);
                for (int i = 0; i < refits.size(); i++)
                    results.set(weakIdx.get(i), refits.get(i));
            }
        }
        logStats(results);
        return results;
    }

    /** Single pass against a library built elsewhere. */
    public List<FitResult> integrateAll(final List<PeakGeometry> peaks,
                                        final VoxelGridSource source,
                                        final StrongPeakLibrary library)
    {
        logger.info("Integrating {} peaks against {} strong-peak shapes", peaks.size(), library.size());
        List<FitResult> results = runBatch(peaks, source, library);
        logStats(results);
        return results;
    }

    // -----------------------------------------------
    // Private Interface
    // -----------------------------------------------

    private FitResult run(final PeakFitContext ctx, final StrongPeakLibrary library) throws FitException {
        final PeakGeometry geometry = ctx.geometry;
        final VoxelGrid grid = ctx.grid;
        if (geometry.hasHkl()) {
            final double[] hkl = geometry.hkl();
            if (hkl[0] == 0.0 && hkl[1] == 0.0 && hkl[2] == 0.0)
                throw new DegenerateFitException("Peak " + geometry.peakNumber() + " is indexed as (0,0,0)");
        }
        logger.debug("Fitting {}", geometry);

        ctx.coords = this.mapper.map(grid, geometry);
        ctx.mask = this.separator.separate(grid, ctx.qMask,
                                           this.tofFitter.scorer(grid, ctx.coords, ctx.qMask, geometry));
        if (ctx.mask.isEmpty())
            throw new DegenerateFitException("Peak " + geometry.peakNumber() + ": no signal voxels");
        logger.debug("Peak {}: pp_lambda={}, {} signal voxels", geometry.peakNumber(),
                     ctx.mask.ppLambda(), ctx.mask.signalCount());

        final double bgEvents = ScalingFit.backgroundEvents(grid, ctx.mask, ctx.qMask, ctx.mask.signalCount());
        final TofHistogram hist = this.tofFitter.histogram(grid, ctx.coords, ctx.mask, ctx.qMask, geometry);
        ctx.tof = this.tofFitter.fit(hist, geometry, bgEvents);

        ctx.forceIntensity = geometry.hasPriorIntensity()
                             ? geometry.priorIntensity()
                             : ctx.mask.signalEvents(grid);
        ctx.needsBorrowedShape = this.angularFitter.needsBorrowedShape(geometry, ctx.forceIntensity);
        ctx.angular = this.angularFitter.fit(grid, ctx.coords, ctx.mask, ctx.qMask, geometry,
                                             ctx.forceIntensity, library);

        ctx.yJoint = ProfileComposer.compose(grid, ctx.coords, ctx.tof, ctx.angular);
        ctx.scaling = this.scalingFit.fit(grid, ctx.yJoint, ctx.mask, ctx.qMask, geometry);

        if (ctx.scaling.getDQ() > this.settings.maxCenterShift()) {
            final String msg = "refined centre moved " + ctx.scaling.getDQ() + " from the nominal Q";
            logger.warn("Peak {}: {}", geometry.peakNumber(), msg);
            return FitResult.completed(ctx, PeakStatus.BADPEAK, msg);
        }
        return FitResult.completed(ctx, PeakStatus.CONVERGED, null);
    }

    private FitResult integrate(final VoxelGridSource source,
                                final PeakGeometry geometry,
                                final StrongPeakLibrary library)
    {
        final VoxelGrid grid;
        try {
            grid = source.gridFor(geometry);
        } catch (FitException ex) {
            logger.warn("Peak {}: no voxel grid ({})", geometry.peakNumber(), ex.getMessage());
            return FitResult.failed(new PeakFitContext(geometry, null, null), ex);
        }
        return integrate(grid, geometry, source.qMaskFor(geometry, grid), library);
    }

    private List<FitResult> runBatch(final List<PeakGeometry> peaks,
                                     final VoxelGridSource source,
                                     final StrongPeakLibrary library)
    {
        if (peaks.isEmpty())
            return new ArrayList<FitResult>();
        final int nThreads = Math.min(this.settings.threads(), peaks.size());
        final ExecutorService pool = Executors.newFixedThreadPool(nThreads);
        try {
            List<Future<FitResult>> futures = new ArrayList<Future<FitResult>>(peaks.size());
            for (final PeakGeometry geometry : peaks) {
                futures.add(pool.submit(new Callable<FitResult>() {
                    @Override
                    public FitResult call() {
                        return integrate(source, geometry, library);
                    }
                }));
            }
            List<FitResult> results = new ArrayList<FitResult>(peaks.size());
            for (Future<FitResult> f : futures)
                results.add(await(f));
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static FitResult await(final Future<FitResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while integrating peaks", ex);
        } catch (ExecutionException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new IllegalStateException("Peak integration failed", cause);
        }
    }

    private static void logStats(final List<FitResult> results) {
        final int[] stats = Util.fitStats(results);
        logger.info("Integrated {} peaks: {} converged, {} bad, {} unconverged, {} degenerate, {} errors",
                    results.size(), stats[0], stats[1], stats[2], stats[3], stats[4]);
    }
}
