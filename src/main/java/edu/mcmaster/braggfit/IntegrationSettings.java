package edu.mcmaster.braggfit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;

/**
 * Tunables for one reduction run. Immutable; build with {@link Builder} or
 * overlay a JSON object on the defaults with {@link #fromJson(InputStream)}.
 */
public final class IntegrationSettings {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    // TOF histogram
    private final double dtSpread;
    private final double minDtBinWidth;
    private final double maxDtBinWidth;
    private final int bgPolyOrder;
    private final int constraintScheme;

    // background separation
    private final double zBG;
    private final int neighborhood;
    private final double pplminFrac;
    private final double pplmaxFrac;
    private final int peakMaskSize;

    // angular fit
    private final int nTheta;
    private final int nPhi;
    private final double fracBoxToHistogram;
    private final int dth;
    private final int dph;
    private final double forceCutoff;
    private final int edgeCutoff;
    private final double forceTolerance;

    // scaling and integration
    private final int scalingNeighborhood;
    private final double fracStop;
    private final double maxCenterShift;

    // solver
    private final int maxIterations;
    private final int maxEvaluations;

    private final int threads;

    private IntegrationSettings(Builder b) {
        this.dtSpread = b.dtSpread;
        this.minDtBinWidth = b.minDtBinWidth;
        this.maxDtBinWidth = b.maxDtBinWidth;
        this.bgPolyOrder = b.bgPolyOrder;
        this.constraintScheme = b.constraintScheme;
        this.zBG = b.zBG;
        this.neighborhood = b.neighborhood;
        this.pplminFrac = b.pplminFrac;
        this.pplmaxFrac = b.pplmaxFrac;
        this.peakMaskSize = b.peakMaskSize;
        this.nTheta = b.nTheta;
        this.nPhi = b.nPhi;
        this.fracBoxToHistogram = b.fracBoxToHistogram;
        this.dth = b.dth;
        this.dph = b.dph;
        this.forceCutoff = b.forceCutoff;
        this.edgeCutoff = b.edgeCutoff;
        this.forceTolerance = b.forceTolerance;
        this.scalingNeighborhood = b.scalingNeighborhood;
        this.fracStop = b.fracStop;
        this.maxCenterShift = b.maxCenterShift;
        this.maxIterations = b.maxIterations;
        this.maxEvaluations = b.maxEvaluations;
        this.threads = b.threads;
    }

    public static IntegrationSettings defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.dtSpread = this.dtSpread;
        b.minDtBinWidth = this.minDtBinWidth;
        b.maxDtBinWidth = this.maxDtBinWidth;
        b.bgPolyOrder = this.bgPolyOrder;
        b.constraintScheme = this.constraintScheme;
        b.zBG = this.zBG;
        b.neighborhood = this.neighborhood;
        b.pplminFrac = this.pplminFrac;
        b.pplmaxFrac = this.pplmaxFrac;
        b.peakMaskSize = this.peakMaskSize;
        b.nTheta = this.nTheta;
        b.nPhi = this.nPhi;
        b.fracBoxToHistogram = this.fracBoxToHistogram;
        b.dth = this.dth;
        b.dph = this.dph;
        b.forceCutoff = this.forceCutoff;
        b.edgeCutoff = this.edgeCutoff;
        b.forceTolerance = this.forceTolerance;
        b.scalingNeighborhood = this.scalingNeighborhood;
        b.fracStop = this.fracStop;
        b.maxCenterShift = this.maxCenterShift;
        b.maxIterations = this.maxIterations;
        b.maxEvaluations = this.maxEvaluations;
        b.threads = this.threads;
        return b;
    }

    /**
     * Reads a JSON object whose keys are the names of the settings; absent
     * keys keep their default value, unknown keys are rejected.
     */
    public static IntegrationSettings fromJson(final InputStream in) {
        final JsonNode root;
        try {
            root = JSON_MAPPER.readTree(in);
        } catch (IOException ex) {
            throw new ConfigurationException("Cannot parse integration settings: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject())
            throw new ConfigurationException("Integration settings must be a JSON object");

        Builder b = new Builder();
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            final String key = names.next();
            final JsonNode v = root.get(key);
            if (!v.isNumber())
                throw new ConfigurationException("Setting '" + key + "' must be a number");
            switch (key) {
                case "dtSpread": b.dtSpread(v.asDouble()); break;
                case "minDtBinWidth": b.minDtBinWidth(v.asDouble()); break;
                case "maxDtBinWidth": b.maxDtBinWidth(v.asDouble()); break;
                case "bgPolyOrder": b.bgPolyOrder(v.asInt()); break;
                case "constraintScheme": b.constraintScheme(v.asInt()); break;
                case "zBG": b.zBG(v.asDouble()); break;
                case "neighborhood": b.neighborhood(v.asInt()); break;
                case "pplminFrac": b.pplminFrac(v.asDouble()); break;
                case "pplmaxFrac": b.pplmaxFrac(v.asDouble()); break;
                case "peakMaskSize": b.peakMaskSize(v.asInt()); break;
                case "nTheta": b.nTheta(v.asInt()); break;
                case "nPhi": b.nPhi(v.asInt()); break;
                case "fracBoxToHistogram": b.fracBoxToHistogram(v.asDouble()); break;
                case "dth": b.dth(v.asInt()); break;
                case "dph": b.dph(v.asInt()); break;
                case "forceCutoff": b.forceCutoff(v.asDouble()); break;
                case "edgeCutoff": b.edgeCutoff(v.asInt()); break;
                case "forceTolerance": b.forceTolerance(v.asDouble()); break;
                case "scalingNeighborhood": b.scalingNeighborhood(v.asInt()); break;
                case "fracStop": b.fracStop(v.asDouble()); break;
                case "maxCenterShift": b.maxCenterShift(v.asDouble()); break;
                case "maxIterations": b.maxIterations(v.asInt()); break;
                case "maxEvaluations": b.maxEvaluations(v.asInt()); break;
                case "threads": b.threads(v.asInt()); break;
                default:
                    throw new ConfigurationException("Unknown integration setting '" + key + "'");
            }
        }
        return b.build();
    }

    public double dtSpread() { return this.dtSpread; }
    public double minDtBinWidth() { return this.minDtBinWidth; }
    public double maxDtBinWidth() { return this.maxDtBinWidth; }
    public int bgPolyOrder() { return this.bgPolyOrder; }
    public int constraintScheme() { return this.constraintScheme; }
    public double zBG() { return this.zBG; }
    public int neighborhood() { return this.neighborhood; }
    public double pplminFrac() { return this.pplminFrac; }
    public double pplmaxFrac() { return this.pplmaxFrac; }
    public int peakMaskSize() { return this.peakMaskSize; }
    public int nTheta() { return this.nTheta; }
    public int nPhi() { return this.nPhi; }
    public double fracBoxToHistogram() { return this.fracBoxToHistogram; }
    public int dth() { return this.dth; }
    public int dph() { return this.dph; }
    public double forceCutoff() { return this.forceCutoff; }
    public int edgeCutoff() { return this.edgeCutoff; }
    public double forceTolerance() { return this.forceTolerance; }
    public int scalingNeighborhood() { return this.scalingNeighborhood; }
    public double fracStop() { return this.fracStop; }
    public double maxCenterShift() { return this.maxCenterShift; }
    public int maxIterations() { return this.maxIterations; }
    public int maxEvaluations() { return this.maxEvaluations; }
    public int threads() { return this.threads; }

    public static final class Builder {
        private double dtSpread = 0.03;
        private double minDtBinWidth = 1.0;
        private double maxDtBinWidth = 50.0;
        private int bgPolyOrder = 1;
        private int constraintScheme = 1;
        private double zBG = 1.96;
        private int neighborhood = 3;
        private double pplminFrac = 0.8;
        private double pplmaxFrac = 1.5;
        private int peakMaskSize = 5;
        private int nTheta = 50;
        private int nPhi = 50;
        private double fracBoxToHistogram = 1.0;
        private int dth = 10;
        private int dph = 10;
        private double forceCutoff = 250.0;
        private int edgeCutoff = 3;
        private double forceTolerance = 0.1;
        private int scalingNeighborhood = 8;
        private double fracStop = 0.01;
        private double maxCenterShift = 0.1;
        private int maxIterations = 1000;
        private int maxEvaluations = 10000;
        private int threads = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        public Builder dtSpread(double v) { this.dtSpread = v; return this; }
        public Builder minDtBinWidth(double v) { this.minDtBinWidth = v; return this; }
        public Builder maxDtBinWidth(double v) { this.maxDtBinWidth = v; return this; }
        public Builder bgPolyOrder(int v) { this.bgPolyOrder = v; return this; }
        public Builder constraintScheme(int v) { this.constraintScheme = v; return this; }
        public Builder zBG(double v) { this.zBG = v; return this; }
        public Builder neighborhood(int v) { this.neighborhood = v; return this; }
        public Builder pplminFrac(double v) { this.pplminFrac = v; return this; }
        public Builder pplmaxFrac(double v) { this.pplmaxFrac = v; return this; }
        public Builder peakMaskSize(int v) { this.peakMaskSize = v; return this; }
        public Builder nTheta(int v) { this.nTheta = v; return this; }
        public Builder nPhi(int v) { this.nPhi = v; return this; }
        public Builder fracBoxToHistogram(double v) { this.fracBoxToHistogram = v; return this; }
        public Builder dth(int v) { this.dth = v; return this; }
        public Builder dph(int v) { this.dph = v; return this; }
        public Builder forceCutoff(double v) { this.forceCutoff = v; return this; }
        public Builder edgeCutoff(int v) { this.edgeCutoff = v; return this; }
        public Builder forceTolerance(double v) { this.forceTolerance = v; return this; }
        public Builder scalingNeighborhood(int v) { this.scalingNeighborhood = v; return this; }
        public Builder fracStop(double v) { this.fracStop = v; return this; }
        public Builder maxCenterShift(double v) { this.maxCenterShift = v; return this; }
        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder maxEvaluations(int v) { this.maxEvaluations = v; return this; }
        public Builder threads(int v) { this.threads = v; return this; }

        public IntegrationSettings build() {
            check(this.dtSpread > 0.0, "dtSpread");
            check(this.minDtBinWidth > 0.0 && this.maxDtBinWidth >= this.minDtBinWidth, "minDtBinWidth/maxDtBinWidth");
            check(this.bgPolyOrder >= 0, "bgPolyOrder");
            check(this.constraintScheme >= 0 && this.constraintScheme <= 2, "constraintScheme");
            check(this.zBG >= 0.0, "zBG");
            check(this.neighborhood >= 1, "neighborhood");
            check(this.pplminFrac >= 0.0 && this.pplmaxFrac > this.pplminFrac, "pplminFrac/pplmaxFrac");
            check(this.peakMaskSize >= 0, "peakMaskSize");
            check(this.nTheta >= 2 && this.nPhi >= 2, "nTheta/nPhi");
            check(this.fracBoxToHistogram > 0.0 && this.fracBoxToHistogram <= 1.0, "fracBoxToHistogram");
            check(this.dth >= 0 && this.dph >= 0, "dth/dph");
            check(this.forceCutoff >= 0.0, "forceCutoff");
            check(this.edgeCutoff >= 0, "edgeCutoff");
            check(this.forceTolerance >= 0.0, "forceTolerance");
            check(this.scalingNeighborhood >= 1, "scalingNeighborhood");
            check(this.fracStop >= 0.0 && this.fracStop < 1.0, "fracStop");
            check(this.maxCenterShift > 0.0, "maxCenterShift");
            check(this.maxIterations > 0 && this.maxEvaluations > 0, "maxIterations/maxEvaluations");
            check(this.threads > 0, "threads");
            return new IntegrationSettings(this);
        }

        private static void check(boolean ok, String name) {
            if (!ok)
                throw new ConfigurationException("Invalid value for setting '" + name + "'");
        }
    }
}
