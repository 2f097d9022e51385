package edu.mcmaster.braggfit;

import ij.ImagePlus;
import ij.ImageStack;
import ij.gui.Roi;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class UtilTest {

    private static List<FitResult> results() {
        return Arrays.asList(
            SyntheticPeaks.converged(1, 500.0, 10.0, SyntheticPeaks.angular(0.5, 0.2, 0.002, 0.002, 0.0, false), false),
            SyntheticPeaks.converged(2, 30.0, 10.0, SyntheticPeaks.angular(0.5, 0.2, 0.002, 0.002, 0.0, false), false),
            SyntheticPeaks.failed(3, new DegenerateFitException("no signal")),
            SyntheticPeaks.failed(4, new FitConvergenceException("too many evaluations")),
            SyntheticPeaks.failed(5, new GeometryException("half angle is zero")),
            SyntheticPeaks.failed(6, new FitException("unreadable")));
    }

    @Test
    public void countsStatuses() {
        assertArrayEquals(new int[]{2, 1, 1, 1, 1, 6}, Util.fitStats(results()));
    }

    @Test
    public void filtersByIOverSigma() {
        final List<FitResult> integrated = Util.getIntegrated(results(), 5.0);
        assertEquals(1, integrated.size());
        assertEquals(1, integrated.get(0).getPeakNumber());
        assertEquals(2, Util.getIntegrated(results(), 0.0).size());
    }

    @Test
    public void oneSlicePerQzPlane() {
        int[] counts = new int[4 * 3 * 2];
        counts[(1 * 3 + 2) * 4 + 3] = 9;
        final VoxelGrid grid = new VoxelGrid(counts, 4, 3, 2,
                                             new double[]{0.0, 0.0, 1.0}, new double[]{0.3, 0.2, 1.1});
        final ImageStack stack = Util.toImageStack(grid);
        assertEquals(4, stack.getWidth());
        assertEquals(3, stack.getHeight());
        assertEquals(2, stack.getSize());
        assertEquals(9.0f, stack.getProcessor(2).getf(3, 2), 0.0f);
        assertEquals(0.0f, stack.getProcessor(1).getf(3, 2), 0.0f);

        double[] model = new double[counts.length];
        Arrays.fill(model, 1.0);
        assertEquals(8.0f, Util.toResidualStack(grid, model).getProcessor(2).getf(3, 2), 1e-6f);
    }

    @Test
    public void marksRefinedCentre() {
        final VoxelGrid grid = new VoxelGrid(new int[5 * 5 * 4], 5, 5, 4,
                                             new double[]{1.0, 1.0, 1.0}, new double[]{1.4, 1.4, 1.3});
        PeakFitContext ctx = new PeakFitContext(SyntheticPeaks.geometry(7, 100, 100), grid, null);
        ctx.scaling = new ScalingResult(2.0, 0.0, 1.0, new double[grid.size()], grid.index(3, 1, 2),
                                        grid.q(grid.index(3, 1, 2)), 0.0, 100.0, 10.0, 0.0, 1);
        final FitResult result = FitResult.completed(ctx, PeakStatus.CONVERGED, null);

        final ImagePlus imp = Util.toImagePlus("peak 7", Util.toImageStack(grid));
        assertEquals(4, imp.getNSlices());
        assertNull(imp.getOverlay());
        Util.addCenterRoi(imp, result, grid);
        Util.addCenterRoi(imp, SyntheticPeaks.failed(8, new DegenerateFitException("empty")), grid);

        assertEquals(1, imp.getOverlay().size());
        final Roi roi = imp.getOverlay().get(0);
        assertEquals("peak 7", roi.getName());
        assertEquals(3, roi.getPosition());
    }
}
