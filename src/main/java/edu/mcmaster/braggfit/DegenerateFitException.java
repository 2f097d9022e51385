package edu.mcmaster.braggfit;

/**
 * Raised when there is not enough signal to fit: an empty signal mask,
 * a histogram with fewer populated bins than free parameters, or an
 * all-zero composed model.
 */
public class DegenerateFitException extends FitException {

    private static final long serialVersionUID = 1L;

    public DegenerateFitException(String message) {
        super(message);
    }

    @Override
    public PeakStatus status() {
        return PeakStatus.DEGENERATE;
    }
}
