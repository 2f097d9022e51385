package edu.mcmaster.braggfit;

import java.util.Arrays;

/**
 * Fitted parameters, their standard errors and the reduced chi-squared of
 * one solver call.
 */
public final class FitOutcome {

    private final String[] names;
    private final double[] params;
    private final double[] errors;
    private final double reducedChiSquared;
    private final int iterations;
    private final int evaluations;

    FitOutcome(final String[] names,
               final double[] params,
               final double[] errors,
               final double reducedChiSquared,
               final int iterations,
               final int evaluations)
    {
        assert(names.length == params.length && params.length == errors.length);
        this.names = names.clone();
        this.params = params.clone();
        this.errors = errors.clone();
        this.reducedChiSquared = reducedChiSquared;
        this.iterations = iterations;
        this.evaluations = evaluations;
    }

    public double[] getParameters() {
        return this.params.clone();
    }

    public double getParameter(final int idx) {
        return this.params[idx];
    }

    public double getParameter(final String name) {
        return this.params[indexOf(name)];
    }

    public double[] getErrors() {
        return this.errors.clone();
    }

    public double getError(final String name) {
        return this.errors[indexOf(name)];
    }

    public String[] getNames() {
        return this.names.clone();
    }

    public double getReducedChiSquared() {
        return this.reducedChiSquared;
    }

    public int getIterations() {
        return this.iterations;
    }

    public int getEvaluations() {
        return this.evaluations;
    }

    private int indexOf(final String name) {
        for (int i = 0; i < names.length; i++) {
            if (names[i].equals(name))
                return i;
        }
        throw new IllegalArgumentException("No parameter named " + name + " in " + Arrays.toString(names));
    }

    /** One line per parameter: name, value, error. */
    public String parameterTable() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < names.length; i++) {
            sb.append(String.format("%-12s %14.6g %14.6g%n", names[i], params[i], errors[i]));
        }
        sb.append(String.format("%-12s %14.6g%n", "chi2/dof", reducedChiSquared));
        return sb.toString();
    }
}
