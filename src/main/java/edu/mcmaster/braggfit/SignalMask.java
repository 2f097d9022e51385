package edu.mcmaster.braggfit;

/**
 * Voxels classified as peak signal. A voxel is signal when it holds events
 * and its neighbourhood-averaged count exceeds
 * {@code ppLambda + zBG * sqrt(ppLambda / (2n + 1)^3)}.
 */
public final class SignalMask {

    private final boolean[] mask;
    private final double[] smoothed;
    private final double ppLambda;
    private final double threshold;
    private final int signalCount;

    SignalMask(final boolean[] mask, final double[] smoothed,
               final double ppLambda, final double threshold)
    {
        assert(mask.length == smoothed.length);
        assert(threshold >= 0.0);
        this.mask = mask;
        this.smoothed = smoothed;
        this.ppLambda = ppLambda;
        this.threshold = threshold;
        int n = 0;
        for (boolean b : mask)
            if (b) n++;
        this.signalCount = n;
    }

    /** Background level that separates signal from background voxels. */
    public double ppLambda() {
        return this.ppLambda;
    }

    public double thresholdAt(final int idx) {
        assert(idx >= 0 && idx < mask.length);
        return this.threshold;
    }

    public double smoothedCount(final int idx) {
        return this.smoothed[idx];
    }

    public boolean isSignal(final int idx) {
        return this.mask[idx];
    }

    public int size() {
        return this.mask.length;
    }

    public int signalCount() {
        return this.signalCount;
    }

    public boolean isEmpty() {
        return this.signalCount == 0;
    }

    public boolean[] toArray() {
        return this.mask.clone();
    }

    /** Sum of raw counts over signal voxels. */
    public long signalEvents(final VoxelGrid grid) {
        assert(grid.size() == mask.length);
        long total = 0;
        for (int i = 0; i < mask.length; i++)
            if (mask[i]) total += grid.count(i);
        return total;
    }
}
