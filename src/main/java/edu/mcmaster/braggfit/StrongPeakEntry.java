package edu.mcmaster.braggfit;

/**
 * Angular shape of a well-measured peak, lent to weak peaks near it on the
 * detector.
 */
public final class StrongPeakEntry {

    private final double azimuthal;
    private final double polar;
    private final double sigmaPolar;
    private final double sigmaAzimuthal;
    private final double rho;

    public StrongPeakEntry(final double azimuthal,
                           final double polar,
                           final double sigmaPolar,
                           final double sigmaAzimuthal,
                           final double rho)
    {
        this.azimuthal = azimuthal;
        this.polar = polar;
        this.sigmaPolar = sigmaPolar;
        this.sigmaAzimuthal = sigmaAzimuthal;
        this.rho = rho;
    }

    public double azimuthal() {
        return this.azimuthal;
    }

    public double polar() {
        return this.polar;
    }

    public double sigmaPolar() {
        return this.sigmaPolar;
    }

    public double sigmaAzimuthal() {
        return this.sigmaAzimuthal;
    }

    public double rho() {
        return this.rho;
    }

    /** Squared angular distance; azimuths are compared across the +-pi seam. */
    public double sqDist(final double otherAzimuthal, final double otherPolar) {
        final double da = BivariateGaussianModel.wrap(this.azimuthal - otherAzimuthal);
        final double dp = this.polar - otherPolar;
        return da * da + dp * dp;
    }

    @Override
    public String toString() {
        return "StrongPeakEntry[az=" + azimuthal + ", polar=" + polar + ", sp=" + sigmaPolar
               + ", sa=" + sigmaAzimuthal + ", rho=" + rho + "]";
    }
}
