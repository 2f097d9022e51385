package edu.mcmaster.braggfit;

/**
 * Event counts binned over (polar, azimuthal). Bin {@code (it, ip)} is
 * stored at {@code it * nPhi + ip}.
 */
public final class AngularHistogram {

    private final double polarMin;
    private final double polarStep;
    private final double azimuthalMin;
    private final double azimuthalStep;
    private final int nTheta;
    private final int nPhi;
    private final double[] counts;

    public AngularHistogram(final double polarMin, final double polarMax, final int nTheta,
                            final double azimuthalMin, final double azimuthalMax, final int nPhi,
                            final double[] counts)
    {
        if (nTheta < 1 || nPhi < 1 || counts.length != nTheta * nPhi)
            throw new IllegalArgumentException("counts must hold nTheta*nPhi values");
        if (!(polarMax > polarMin) || !(azimuthalMax > azimuthalMin))
            throw new IllegalArgumentException("angular ranges must be non-empty");
        this.polarMin = polarMin;
        this.polarStep = (polarMax - polarMin) / nTheta;
        this.azimuthalMin = azimuthalMin;
        this.azimuthalStep = (azimuthalMax - azimuthalMin) / nPhi;
        this.nTheta = nTheta;
        this.nPhi = nPhi;
        this.counts = counts.clone();
    }

    public int nTheta() {
        return this.nTheta;
    }

    public int nPhi() {
        return this.nPhi;
    }

    public int size() {
        return this.counts.length;
    }

    public double polarStep() {
        return this.polarStep;
    }

    public double azimuthalStep() {
        return this.azimuthalStep;
    }

    public double polarCenter(final int it) {
        return this.polarMin + (it + 0.5) * this.polarStep;
    }

    public double azimuthalCenter(final int ip) {
        return this.azimuthalMin + (ip + 0.5) * this.azimuthalStep;
    }

    public double count(final int it, final int ip) {
        return this.counts[it * this.nPhi + ip];
    }

    public double[] getCounts() {
        return this.counts.clone();
    }

    public double totalCounts() {
        double total = 0.0;
        for (double c : this.counts)
            total += c;
        return total;
    }

    /** Flat index of the fullest bin; the first one on ties. */
    public int argmax() {
        int best = 0;
        for (int i = 1; i < this.counts.length; i++)
            if (this.counts[i] > this.counts[best]) best = i;
        return best;
    }

    /** Bin centres as {@code {polar[], azimuthal[]}} in storage order. */
    public double[][] coordinates() {
        double[] polar = new double[this.counts.length];
        double[] azimuthal = new double[this.counts.length];
        for (int it = 0; it < this.nTheta; it++) {
            for (int ip = 0; ip < this.nPhi; ip++) {
                polar[it * this.nPhi + ip] = polarCenter(it);
                azimuthal[it * this.nPhi + ip] = azimuthalCenter(ip);
            }
        }
        return new double[][]{polar, azimuthal};
    }

    /** Count-weighted mean of {polar, azimuthal}. */
    public double[] weightedMean() {
        double sp = 0.0;
        double sa = 0.0;
        double total = 0.0;
        for (int it = 0; it < this.nTheta; it++) {
            for (int ip = 0; ip < this.nPhi; ip++) {
                final double c = count(it, ip);
                sp += c * polarCenter(it);
                sa += c * azimuthalCenter(ip);
                total += c;
            }
        }
        if (total == 0.0)
            return new double[]{Double.NaN, Double.NaN};
        return new double[]{sp / total, sa / total};
    }
}
