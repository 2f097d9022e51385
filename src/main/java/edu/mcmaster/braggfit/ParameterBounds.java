package edu.mcmaster.braggfit;

import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;

/**
 * Box constraints on model parameters. The solver clamps every trial point
 * into the box.
 */
public final class ParameterBounds implements ParameterValidator {

    private final double[] lower;
    private final double[] upper;

    public ParameterBounds(final double[] lower, final double[] upper) {
        if (lower.length != upper.length)
            throw new IllegalArgumentException("lower and upper bounds differ in length");
        for (int i = 0; i < lower.length; i++) {
            if (lower[i] > upper[i])
                throw new IllegalArgumentException("lower bound exceeds upper bound for parameter " + i
                                                   + ": " + lower[i] + " > " + upper[i]);
        }
        this.lower = lower.clone();
        this.upper = upper.clone();
    }

    public static ParameterBounds unbounded(final int n) {
        double[] lo = new double[n];
        double[] hi = new double[n];
        Arrays.fill(lo, Double.NEGATIVE_INFINITY);
        Arrays.fill(hi, Double.POSITIVE_INFINITY);
        return new ParameterBounds(lo, hi);
    }

    public int size() {
        return this.lower.length;
    }

    public double lower(final int idx) {
        return this.lower[idx];
    }

    public double upper(final int idx) {
        return this.upper[idx];
    }

    public boolean contains(final double[] params) {
        assert(params.length == lower.length);
        for (int i = 0; i < params.length; i++) {
            if (params[i] < lower[i] || params[i] > upper[i])
                return false;
        }
        return true;
    }

    public double clamp(final int idx, final double value) {
        return Math.max(this.lower[idx], Math.min(this.upper[idx], value));
    }

    public double[] clamp(final double[] params) {
        assert(params.length == lower.length);
        double[] out = new double[params.length];
        for (int i = 0; i < params.length; i++)
            out[i] = clamp(i, params[i]);
        return out;
    }

    @Override
    public RealVector validate(final RealVector params) {
        RealVector out = params.copy();
        for (int i = 0; i < lower.length; i++)
            out.setEntry(i, clamp(i, params.getEntry(i)));
        return out;
    }

    @Override
    public String toString() {
        return "ParameterBounds[lower=" + Arrays.toString(lower) + ", upper=" + Arrays.toString(upper) + "]";
    }
}
