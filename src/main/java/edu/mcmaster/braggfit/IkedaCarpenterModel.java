package edu.mcmaster.braggfit;

/**
 * Ikeda-Carpenter moderator pulse convolved with the instrument response,
 * scaled, plus a polynomial background in TOF.
 *
 * <p>Parameters are {A, B, R, T0, Scale, HatWidth, KConv, bg0 .. bgN} with
 * the background coefficients in ascending order. The response is a top-hat
 * of half-width HatWidth bins convolved with a causal exponential
 * {@code exp(-KConv * dt / 1000)} (KConv in 1/ms, dt in microseconds),
 * normalised to unit area. The model is only defined on a uniform TOF grid,
 * which is how histograms are built.</p>
 */
public class IkedaCarpenterModel implements CurveModel {

    public static final int A = 0;
    public static final int B = 1;
    public static final int R = 2;
    public static final int T0 = 3;
    public static final int SCALE = 4;
    public static final int HATWIDTH = 5;
    public static final int KCONV = 6;
    public static final int NICCPARAMS = 7;

    private static final String[] ICC_NAMES = {"A", "B", "R", "T0", "Scale", "HatWidth", "KConv"};

    // exponential tail is cut where it falls below this
    private static final double TAIL_CUTOFF = 1.0e-6;

    private final int bgOrder;
    private final ParameterBounds bounds;
    private final String[] names;

    public IkedaCarpenterModel(final int bgOrder, final ParameterBounds bounds) {
        assert(bgOrder >= 0);
        if (bounds.size() != NICCPARAMS + bgOrder + 1)
            throw new IllegalArgumentException("bounds must cover " + (NICCPARAMS + bgOrder + 1) + " parameters");
        this.bgOrder = bgOrder;
        this.bounds = bounds;
        this.names = new String[NICCPARAMS + bgOrder + 1];
        System.arraycopy(ICC_NAMES, 0, this.names, 0, NICCPARAMS);
        for (int i = 0; i <= bgOrder; i++)
            this.names[NICCPARAMS + i] = "bg" + i;
    }

    public int bgOrder() {
        return this.bgOrder;
    }

    /*----------- Public Interface ------------------*/

    @Override
    public double[] evaluate(final double[] params, final double[][] coordinates) {
        final double[] t = coordinates[0];
        double[] out = peak(params, t);
        for (int i = 0; i < t.length; i++)
            out[i] += background(params, t[i]);
        return out;
    }

    @Override
    public ParameterBounds parameterBounds() {
        return this.bounds;
    }

    @Override
    public String[] parameterNames() {
        return this.names.clone();
    }

    /** Scaled, convolved pulse without background on a uniform grid. */
    public double[] peak(final double[] params, final double[] t) {
        final int n = t.length;
        double[] ic = new double[n];
        for (int i = 0; i < n; i++)
            ic[i] = ikedaCarpenter(t[i] - params[T0], params[A], params[B], params[R]);
        if (n < 2)
            return scale(ic, params[SCALE]);

        final double dt = t[1] - t[0];
        final double[] kernel = response(params[HATWIDTH], params[KCONV], dt, n);
        final int origin = hatTaps(params[HATWIDTH]);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int m = 0; m < kernel.length; m++) {
                final int src = i - (m - origin);
                if (src >= 0 && src < n)
                    sum += kernel[m] * ic[src];
            }
            out[i] = params[SCALE] * sum;
        }
        return out;
    }

    /** Polynomial background at {@code t}. */
    public double background(final double[] params, final double t) {
        double bg = 0.0;
        for (int i = this.bgOrder; i >= 0; i--)
            bg = bg * t + params[NICCPARAMS + i];
        return bg;
    }

    /**
     * Ikeda-Carpenter function at time {@code t} after emission; zero for
     * {@code t <= 0}.
     */
    public static double ikedaCarpenter(final double t, final double alpha, double beta, final double r) {
        if (!(t > 0.0) || !(alpha > 0.0))
            return 0.0;
        if (Math.abs(alpha - beta) < 1.0e-9 * alpha)
            beta = alpha * (1.0 - 1.0e-6);
        final double at = alpha * t;
        final double d = alpha - beta;
        final double fast = (1.0 - r) * at * at * Math.exp(-at);
        final double slow = 2.0 * r * alpha * alpha * beta / (d * d * d)
                            * (Math.exp(-beta * t) - Math.exp(-at) * (1.0 + d * t + 0.5 * d * d * t * t));
        return 0.5 * alpha * (fast + slow);
    }

    /* ---------- Private Interface ----------------*/

    private static int hatTaps(final double hatWidth) {
        return (int) Math.ceil(Math.max(hatWidth, 0.0) + 0.5);
    }

    // top-hat with fractional edge taps, then the exponential tail
    private static double[] response(final double hatWidth, final double kConv, final double dt, final int n) {
        final int h = hatTaps(hatWidth);
        double[] hat = new double[2 * h + 1];
        for (int m = -h; m <= h; m++)
            hat[m + h] = Math.min(1.0, Math.max(0.0, hatWidth + 0.5 - Math.abs(m)));
        if (hat[h] == 0.0)
            hat[h] = 1.0;

        final double decay = kConv * dt / 1000.0;
        final int tail = decay > 0.0 ? (int) Math.min(n, Math.ceil(-Math.log(TAIL_CUTOFF) / decay)) : n;
        double[] exp = new double[tail + 1];
        for (int m = 0; m <= tail; m++)
            exp[m] = Math.exp(-decay * m);

        double[] kernel = new double[hat.length + exp.length - 1];
        for (int a = 0; a < hat.length; a++) {
            for (int b = 0; b < exp.length; b++) {
                kernel[a + b] += hat[a] * exp[b];
            }
        }
        double total = 0.0;
        for (double v : kernel)
            total += v;
        for (int i = 0; i < kernel.length; i++)
            kernel[i] /= total;
        return kernel;
    }

    private static double[] scale(final double[] v, final double s) {
        for (int i = 0; i < v.length; i++)
            v[i] *= s;
        return v;
    }
}
