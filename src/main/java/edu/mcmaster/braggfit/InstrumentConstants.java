package edu.mcmaster.braggfit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable instrument description used by the coordinate mapping and the
 * time-of-flight fit: the TOF conversion constant, the detector size, the
 * Pade coefficients describing moderator emission and optional bounds for
 * the Ikeda-Carpenter parameters.
 *
 * <p>Instances are read from JSON:</p>
 * <pre>
 * {
 *   "name": "EXAMPLE",
 *   "tofConstant": 3176.507,
 *   "detectorRows": 256,
 *   "detectorColumns": 256,
 *   "moderator": { "A": [..10..], "B": [..10..], "R": [..10..], "T0": [..10..] },
 *   "iccConstraints": { "iccKConv": [100, 140, 120] }
 * }
 * </pre>
 *
 * <p>The only bundled instrument, {@code EXAMPLE}, carries illustrative
 * moderator coefficients that are not calibrated against any real
 * moderator. Production runs load their own constants with
 * {@link #load(Path)}.</p>
 */
public final class InstrumentConstants {

    public static final double DEFAULT_TOF_CONSTANT = 3176.507;
    public static final int DEFAULT_DETECTOR_SIZE = 256;
    public static final int NPADE = 10;

    public static final String[] MODERATOR_KEYS = {"A", "B", "R", "T0"};
    public static final String[] ICC_CONSTRAINT_KEYS = {
        "iccA", "iccB", "iccR", "iccT0", "iccScale0", "iccHatWidth", "iccKConv"
    };

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final String name;
    private final double tofConstant;
    private final int detectorRows;
    private final int detectorColumns;
    private final Map<String, double[]> moderator;
    private final Map<String, double[]> iccConstraints;

    public InstrumentConstants(final String name,
                               final double tofConstant,
                               final int detectorRows,
                               final int detectorColumns,
                               final Map<String, double[]> moderator,
                               final Map<String, double[]> iccConstraints)
    {
        if (!(tofConstant > 0.0) || Double.isInfinite(tofConstant))
            throw new ConfigurationException("tofConstant must be positive, was " + tofConstant);
        if (detectorRows <= 0 || detectorColumns <= 0)
            throw new ConfigurationException("detectorRows and detectorColumns must be positive");
        if (moderator == null)
            throw new ConfigurationException("Instrument " + name + " is missing the 'moderator' coefficients");

        Map<String, double[]> mod = new LinkedHashMap<>();
        for (String key : MODERATOR_KEYS) {
            double[] c = moderator.get(key);
            if (c == null)
                throw new ConfigurationException("Instrument " + name + " is missing moderator coefficients 'moderator." + key + "'");
            if (c.length != NPADE)
                throw new ConfigurationException("moderator." + key + " needs " + NPADE + " Pade coefficients, found " + c.length);
            mod.put(key, c.clone());
        }

        Map<String, double[]> icc = new LinkedHashMap<>();
        if (iccConstraints != null) {
            for (Map.Entry<String, double[]> e : iccConstraints.entrySet()) {
                if (!Arrays.asList(ICC_CONSTRAINT_KEYS).contains(e.getKey()))
                    throw new ConfigurationException("Unknown ICC constraint '" + e.getKey() + "'");
                double[] v = e.getValue();
                if (v == null || v.length < 2 || v.length > 3 || v[0] > v[1])
                    throw new ConfigurationException("ICC constraint '" + e.getKey()
                                                     + "' must be [lower, upper] or [lower, upper, initial]");
                icc.put(e.getKey(), v.clone());
            }
        }

        this.name = name;
        this.tofConstant = tofConstant;
        this.detectorRows = detectorRows;
        this.detectorColumns = detectorColumns;
        this.moderator = Collections.unmodifiableMap(mod);
        this.iccConstraints = Collections.unmodifiableMap(icc);
    }

    /* ---------- Loading ----------------*/

    public static InstrumentConstants fromJson(final InputStream in) {
        final JsonNode root;
        try {
            root = JSON_MAPPER.readTree(in);
        } catch (IOException ex) {
            throw new ConfigurationException("Cannot parse instrument constants: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject())
            throw new ConfigurationException("Instrument constants must be a JSON object");

        final String name = root.path("name").asText("UNKNOWN");
        final double tofConstant = root.path("tofConstant").asDouble(DEFAULT_TOF_CONSTANT);
        final int rows = root.path("detectorRows").asInt(DEFAULT_DETECTOR_SIZE);
        final int cols = root.path("detectorColumns").asInt(DEFAULT_DETECTOR_SIZE);

        final JsonNode modNode = root.get("moderator");
        if (modNode == null || !modNode.isObject())
            throw new ConfigurationException("Instrument " + name + " is missing the 'moderator' coefficients");
        Map<String, double[]> moderator = new LinkedHashMap<>();
        for (String key : MODERATOR_KEYS) {
            JsonNode c = modNode.get(key);
            if (c == null)
                throw new ConfigurationException("Instrument " + name + " is missing moderator coefficients 'moderator." + key + "'");
            moderator.put(key, toArray(c, "moderator." + key));
        }

        Map<String, double[]> icc = new LinkedHashMap<>();
        JsonNode iccNode = root.get("iccConstraints");
        if (iccNode != null) {
            Iterator<Map.Entry<String, JsonNode>> it = iccNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                icc.put(e.getKey(), toArray(e.getValue(), e.getKey()));
            }
        }
        return new InstrumentConstants(name, tofConstant, rows, cols, moderator, icc);
    }

    public static InstrumentConstants load(final Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        } catch (IOException ex) {
            throw new ConfigurationException("Cannot read instrument constants from " + path, ex);
        }
    }

    /**
     * Loads a bundled instrument, {@code instruments/<name>.json} on the
     * classpath. {@code EXAMPLE} is uncalibrated and only fit for demos and
     * tests.
     */
    public static InstrumentConstants forInstrument(final String instrument) {
        final String resource = "instruments/" + instrument + ".json";
        InputStream in = InstrumentConstants.class.getClassLoader().getResourceAsStream(resource);
        if (in == null)
            throw new ConfigurationException("No bundled constants for instrument " + instrument);
        try (InputStream stream = in) {
            return fromJson(stream);
        } catch (IOException ex) {
            throw new ConfigurationException("Cannot read " + resource, ex);
        }
    }

    private static double[] toArray(final JsonNode node, final String key) {
        if (!node.isArray())
            throw new ConfigurationException("'" + key + "' must be an array of numbers");
        double[] out = new double[node.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode v = node.get(i);
            if (!v.isNumber())
                throw new ConfigurationException("'" + key + "' must be an array of numbers");
            out[i] = v.asDouble();
        }
        return out;
    }

    /* ---------- Moderator ----------------*/

    /**
     * Fourth order Pade approximant of moderator emission at energy {@code x} (eV).
     */
    public static double pade(final double[] c, final double x) {
        assert(c.length == NPADE);
        final double num = 1.0 + c[2] * x + c[3] * x * x + Math.pow(x / c[4], c[5]);
        final double den = 1.0 + c[6] * x + c[7] * x * x + Math.pow(x / c[8], c[9]);
        return c[0] * Math.pow(x, c[1]) * num / den;
    }

    public double moderatorValue(final String key, final double energy) {
        double[] c = this.moderator.get(key);
        if (c == null)
            throw new ConfigurationException("No moderator coefficients for '" + key + "'");
        return pade(c, energy);
    }

    /* ---------- Accessors ----------------*/

    public String name() {
        return this.name;
    }

    public double tofConstant() {
        return this.tofConstant;
    }

    public int detectorRows() {
        return this.detectorRows;
    }

    public int detectorColumns() {
        return this.detectorColumns;
    }

    public double[] moderatorCoefficients(final String key) {
        double[] c = this.moderator.get(key);
        return c == null ? null : c.clone();
    }

    public boolean hasIccConstraint(final String key) {
        return this.iccConstraints.containsKey(key);
    }

    public double[] iccConstraint(final String key) {
        double[] c = this.iccConstraints.get(key);
        return c == null ? null : c.clone();
    }
}
