package edu.mcmaster.braggfit;

/**
 * Raised when the nonlinear solver gives up or produces non-finite
 * parameters. Not retried.
 */
public class FitConvergenceException extends FitException {

    private static final long serialVersionUID = 1L;

    public FitConvergenceException(String message) {
        super(message);
    }

    public FitConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public PeakStatus status() {
        return PeakStatus.UNCONVERGED;
    }
}
