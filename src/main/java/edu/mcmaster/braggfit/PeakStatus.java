package edu.mcmaster.braggfit;

public enum PeakStatus {
    // fitted and integrated
    CONVERGED,
    // not enough signal to fit
    DEGENERATE,
    // solver gave up
    UNCONVERGED,
    // bad geometry, or the fitted centre drifted too far from the prediction
    BADPEAK,
    ERROR
}
