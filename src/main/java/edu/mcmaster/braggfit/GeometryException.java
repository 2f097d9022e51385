package edu.mcmaster.braggfit;

/**
 * Raised for peak geometries where time-of-flight is undefined, e.g. a zero
 * scattering angle or a zero nominal Q.
 */
public class GeometryException extends FitException {

    private static final long serialVersionUID = 1L;

    public GeometryException(String message) {
        super(message);
    }

    @Override
    public PeakStatus status() {
        return PeakStatus.BADPEAK;
    }
}
