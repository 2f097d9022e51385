package edu.mcmaster.braggfit;

import java.util.Arrays;

/**
 * Per-peak instrument geometry supplied by peak prediction: flight paths
 * (m), scattering half-angle (rad), nominal Q (1/Angstrom, 2*pi convention),
 * and the detector pixel the peak lands on.
 */
public final class PeakGeometry {

    private final int peakNumber;
    private final double l1;
    private final double l2;
    private final double scatteringHalfAngle;
    private final double[] q0;
    private final int row;
    private final int column;
    private final double[] hkl;
    private final double priorIntensity;

    public PeakGeometry(final int peakNumber,
                        final double l1,
                        final double l2,
                        final double scatteringHalfAngle,
                        final double[] q0,
                        final int row,
                        final int column)
    {
        this(peakNumber, l1, l2, scatteringHalfAngle, q0, row, column, null, Double.NaN);
    }

    private PeakGeometry(final int peakNumber,
                         final double l1,
                         final double l2,
                         final double scatteringHalfAngle,
                         final double[] q0,
                         final int row,
                         final int column,
                         final double[] hkl,
                         final double priorIntensity)
    {
        if (q0 == null || q0.length != 3)
            throw new IllegalArgumentException("nominal Q must be a 3-vector");
        if (hkl != null && hkl.length != 3)
            throw new IllegalArgumentException("hkl must be a 3-vector");
        this.peakNumber = peakNumber;
        this.l1 = l1;
        this.l2 = l2;
        this.scatteringHalfAngle = scatteringHalfAngle;
        this.q0 = q0.clone();
        this.row = row;
        this.column = column;
        this.hkl = hkl == null ? null : hkl.clone();
        this.priorIntensity = priorIntensity;
    }

    public PeakGeometry withHkl(final double h, final double k, final double l) {
        return new PeakGeometry(peakNumber, l1, l2, scatteringHalfAngle, q0, row, column,
                                new double[]{h, k, l}, priorIntensity);
    }

    /** Intensity estimate from an earlier integration, used to pick the forced fit. */
    public PeakGeometry withPriorIntensity(final double intensity) {
        return new PeakGeometry(peakNumber, l1, l2, scatteringHalfAngle, q0, row, column,
                                hkl, intensity);
    }

    /*----------- Public Interface ------------------*/

    public int peakNumber() {
        return this.peakNumber;
    }

    public double l1() {
        return this.l1;
    }

    public double l2() {
        return this.l2;
    }

    public double flightPath() {
        return this.l1 + this.l2;
    }

    public double scatteringHalfAngle() {
        return this.scatteringHalfAngle;
    }

    public double[] nominalQ() {
        return this.q0.clone();
    }

    public double nominalQNorm() {
        return Math.sqrt(q0[0] * q0[0] + q0[1] * q0[1] + q0[2] * q0[2]);
    }

    public int row() {
        return this.row;
    }

    public int column() {
        return this.column;
    }

    public boolean hasHkl() {
        return this.hkl != null;
    }

    public double[] hkl() {
        return this.hkl == null ? null : this.hkl.clone();
    }

    public boolean hasPriorIntensity() {
        return !Double.isNaN(this.priorIntensity);
    }

    public double priorIntensity() {
        return this.priorIntensity;
    }

    /** Wavelength in Angstrom from Bragg's law, lambda = 4 pi sin(theta) / |Q|. */
    public double wavelength() {
        return 4.0 * Math.PI * Math.sin(this.scatteringHalfAngle) / nominalQNorm();
    }

    /** Neutron energy in eV. */
    public double energy() {
        final double lambda = wavelength();
        return 81.804 / (lambda * lambda) / 1000.0;
    }

    /** Nominal time-of-flight in microseconds. */
    public double nominalTof(final InstrumentConstants constants) {
        return constants.tofConstant() * flightPath() * Math.sin(this.scatteringHalfAngle) / nominalQNorm();
    }

    @Override
    public String toString() {
        return "Peak " + peakNumber + " Q=" + Arrays.toString(q0) + " row=" + row + " col=" + column;
    }
}
