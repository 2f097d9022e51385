package edu.mcmaster.braggfit;

import ij.ImagePlus;
import ij.ImageStack;
import ij.gui.Overlay;
import ij.gui.PointRoi;
import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.List;

public class Util {

    /**
     * Counts per status: {converged, bad, unconverged, degenerate, error, total}.
     */
    public static int[] fitStats(final List<FitResult> results) {
        assert(results != null);
        int numConverged = 0;
        int numBad = 0;
        int numUnconverged = 0;
        int numDegenerate = 0;
        int numError = 0;
        for (FitResult r : results) {
            switch (r.getStatus()) {
                case CONVERGED:   numConverged++; break;
                case BADPEAK:     numBad++; break;
                case UNCONVERGED: numUnconverged++; break;
                case DEGENERATE:  numDegenerate++; break;
                default:          numError++; break;
            }
        }
        return new int[]{numConverged, numBad, numUnconverged, numDegenerate, numError, results.size()};
    }

    /** Converged results with {@code I / sigma} of at least {@code minIOverSigma}. */
    public static List<FitResult> getIntegrated(final List<FitResult> results, final double minIOverSigma) {
        assert(results != null);
        List<FitResult> integrated = new ArrayList<FitResult>();
        for (FitResult r : results) {
            if (r.hasStatus(PeakStatus.CONVERGED) &&
                r.getSigma() > 0.0 &&
                r.getIntensity() / r.getSigma() >= minIOverSigma)
                integrated.add(r);
        }
        return integrated;
    }

    /** One slice per Qz plane, Qx along the image width. */
    public static ImageStack toImageStack(final VoxelGrid grid) {
        double[] counts = new double[grid.size()];
        for (int idx = 0; idx < counts.length; idx++)
            counts[idx] = grid.count(idx);
        return toImageStack(counts, grid);
    }

    public static ImageStack toImageStack(final double[] values, final VoxelGrid grid) {
        assert(values.length == grid.size());
        ImageStack stack = new ImageStack(grid.nx(), grid.ny());
        for (int k = 0; k < grid.nz(); k++) {
            FloatProcessor fp = new FloatProcessor(grid.nx(), grid.ny());
            for (int j = 0; j < grid.ny(); j++) {
                for (int i = 0; i < grid.nx(); i++) {
                    fp.setf(i, j, (float) values[grid.index(i, j, k)]);
                }
            }
            stack.addSlice("Qz=" + grid.qz(k), fp);
        }
        return stack;
    }

    /** Counts minus the scaled model. */
    public static ImageStack toResidualStack(final VoxelGrid grid, final double[] model) {
        assert(model.length == grid.size());
        double[] residual = new double[grid.size()];
        for (int idx = 0; idx < residual.length; idx++)
            residual[idx] = grid.count(idx) - model[idx];
        return toImageStack(residual, grid);
    }

    public static ImagePlus toImagePlus(final String title, final ImageStack stack) {
        ImagePlus imp = new ImagePlus(title, stack);
        imp.setDimensions(1, stack.getSize(), 1);
        return imp;
    }

    /** Marks the refined centre of {@code result} on its Qz slice. */
    public static void addCenterRoi(ImagePlus imp, final FitResult result, final VoxelGrid grid) {
        assert(imp != null && result != null);
        Overlay overlay = imp.getOverlay() == null ? new Overlay() : imp.getOverlay();
        if (result.getCenterIndex() >= 0) {
            final int[] v = grid.voxel(result.getCenterIndex());
            final PointRoi pt = new PointRoi(v[0] + 0.5, v[1] + 0.5);
            pt.setPosition(v[2] + 1);
            pt.setName("peak " + result.getPeakNumber());
            overlay.add(pt);
        }
        imp.setOverlay(overlay);
    }
}
