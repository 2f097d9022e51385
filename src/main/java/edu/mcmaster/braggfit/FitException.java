package edu.mcmaster.braggfit;

/**
 * Base class for failures that invalidate the fit of a single peak.
 * The batch keeps going when one of these is raised; the peak is reported
 * as unintegrated.
 */
public class FitException extends Exception {

    private static final long serialVersionUID = 1L;

    public FitException(String message) {
        super(message);
    }

    public FitException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Status recorded on the {@link FitResult} of a peak failing this way. */
    public PeakStatus status() {
        return PeakStatus.ERROR;
    }
}
