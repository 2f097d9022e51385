package edu.mcmaster.braggfit;

/**
 * Event-weighted histogram of voxel TOF values on a uniform grid of bin
 * centres.
 */
public final class TofHistogram {

    private final double[] tPoints;
    private final double[] counts;
    private final double binWidth;

    public TofHistogram(final double tMin, final double binWidth, final double[] counts) {
        if (!(binWidth > 0.0))
            throw new IllegalArgumentException("bin width must be positive");
        if (counts.length == 0)
            throw new IllegalArgumentException("histogram needs at least one bin");
        this.binWidth = binWidth;
        this.counts = counts.clone();
        this.tPoints = new double[counts.length];
        for (int i = 0; i < counts.length; i++)
            this.tPoints[i] = tMin + (i + 0.5) * binWidth;
    }

    public int size() {
        return this.counts.length;
    }

    /** Bin centres. */
    public double[] getTimes() {
        return this.tPoints.clone();
    }

    public double time(final int i) {
        return this.tPoints[i];
    }

    public double[] getCounts() {
        return this.counts.clone();
    }

    public double count(final int i) {
        return this.counts[i];
    }

    public double binWidth() {
        return this.binWidth;
    }

    public double tMin() {
        return this.tPoints[0] - 0.5 * this.binWidth;
    }

    public double tMax() {
        return this.tPoints[this.tPoints.length - 1] + 0.5 * this.binWidth;
    }

    public int nonEmptyBins() {
        int n = 0;
        for (double c : this.counts)
            if (c > 0.0) n++;
        return n;
    }

    public double totalCounts() {
        double total = 0.0;
        for (double c : this.counts)
            total += c;
        return total;
    }
}
