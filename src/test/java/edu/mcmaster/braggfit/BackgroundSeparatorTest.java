package edu.mcmaster.braggfit;

import org.junit.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BackgroundSeparatorTest {

    private final IntegrationSettings settings = SyntheticPeaks.settings();
    private final BackgroundSeparator separator = new BackgroundSeparator(settings);

    @Test
    public void emptyGridGivesEmptyMask() {
        final VoxelGrid grid = SyntheticPeaks.grid(new int[SyntheticPeaks.N * SyntheticPeaks.N * SyntheticPeaks.N]);
        SignalMask mask = separator.separate(grid);
        assertTrue(mask.isEmpty());
        assertEquals(0.0, mask.ppLambda(), 0.0);

        mask = separator.separate(grid, null, new BackgroundSeparator.LambdaScorer() {
            @Override
            public double score(final SignalMask candidate) throws FitException {
                throw new AssertionError("nothing to score on an empty grid");
            }
        });
        assertTrue(mask.isEmpty());
    }

    @Test
    public void fixedLevelSelectsByThreshold() {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        final SignalMask mask = separator.separate(grid, 2.0);
        final double threshold = 2.0 + settings.zBG() * Math.sqrt(2.0 / Math.pow(2 * settings.neighborhood() + 1, 3));
        assertEquals(threshold, mask.thresholdAt(0), 1e-12);

        final double[] smoothed = BackgroundSeparator.smooth(grid, settings.neighborhood());
        for (int idx = 0; idx < grid.size(); idx++) {
            final boolean expected = grid.count(idx) > 0 && smoothed[idx] > threshold;
            assertEquals("voxel " + idx, expected, mask.isSignal(idx));
        }
        assertTrue(mask.isSignal(grid.index(SyntheticPeaks.CENTER, SyntheticPeaks.CENTER, SyntheticPeaks.CENTER)));
        assertFalse(mask.isSignal(0));
    }

    @Test
    public void poissonModeLeavesSomeEventsOut() {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        final SignalMask mask = separator.separate(grid);
        assertFalse(mask.isEmpty());
        assertTrue(mask.signalEvents(grid) < grid.totalCounts());
        assertTrue(mask.isSignal(grid.index(SyntheticPeaks.CENTER, SyntheticPeaks.CENTER, SyntheticPeaks.CENTER)));
    }

    @Test
    public void poissonLevelOfFlatBackground() {
        final Random rng = new Random(7L);
        int[] counts = new int[SyntheticPeaks.N * SyntheticPeaks.N * SyntheticPeaks.N];
        for (int i = 0; i < counts.length; i++)
            counts[i] = SyntheticPeaks.poisson(rng, 3.0);
        assertEquals(3.0, separator.estimatePoissonLambda(SyntheticPeaks.grid(counts)), 0.5);
    }

    @Test
    public void optimisedLevelStaysInCandidateRange() {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        final double[] smoothed = BackgroundSeparator.smooth(grid, settings.neighborhood());
        final double predicted = 0.98 * separator.meanBackground(grid, smoothed, null) * 1.96;

        // prefers the largest signal region
        final SignalMask mask = separator.separate(grid, null, new BackgroundSeparator.LambdaScorer() {
            @Override
            public double score(final SignalMask candidate) {
                return 1.0 + 1.0 / candidate.signalCount();
            }
        });
        assertTrue(mask.ppLambda() > settings.pplminFrac() * predicted);
        assertTrue(mask.ppLambda() < settings.pplmaxFrac() * predicted);
        assertFalse(mask.isEmpty());
    }

    @Test
    public void unscorableLevelsFallBackToPoissonMode() {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        final SignalMask mask = separator.separate(grid, null, new BackgroundSeparator.LambdaScorer() {
            @Override
            public double score(final SignalMask candidate) throws FitException {
                throw new DegenerateFitException("too few bins");
            }
        });
        final SignalMask poisson = separator.separate(grid);
        assertEquals(poisson.ppLambda(), mask.ppLambda(), 1e-12);
        assertEquals(poisson.signalCount(), mask.signalCount());
    }

    @Test
    public void qMaskRestrictsSignal() {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        boolean[] qMask = new boolean[grid.size()];
        for (int k = 0; k < grid.nz(); k++)
            for (int j = 0; j < grid.ny(); j++)
                for (int i = 0; i < SyntheticPeaks.CENTER; i++)
                    qMask[grid.index(i, j, k)] = true;

        final SignalMask mask = separator.separate(grid, qMask, new BackgroundSeparator.LambdaScorer() {
            @Override
            public double score(final SignalMask candidate) {
                return 1.0;
            }
        });
        assertFalse(mask.isEmpty());
        for (int idx = 0; idx < grid.size(); idx++)
            if (mask.isSignal(idx)) assertTrue(qMask[idx]);
    }

    @Test
    public void smoothingAveragesTheNeighbourhood() {
        final double[] center = {1.0, 1.0, 1.0};
        int[] counts = new int[125];
        Arrays.fill(counts, 3);
        for (double v : BackgroundSeparator.smooth(VoxelGrid.centeredOn(center, 0.1, 5, counts), 3))
            assertEquals(3.0, v, 1e-12);

        int[] spike = new int[125];
        spike[(2 * 5 + 2) * 5 + 2] = 27;
        final VoxelGrid grid = VoxelGrid.centeredOn(center, 0.1, 5, spike);
        final double[] smoothed = BackgroundSeparator.smooth(grid, 3);
        assertEquals(1.0, smoothed[grid.index(2, 2, 2)], 1e-12);
        assertEquals(1.0, smoothed[grid.index(1, 3, 2)], 1e-12);
        assertEquals(0.0, smoothed[grid.index(0, 2, 2)], 1e-12);
    }
}
