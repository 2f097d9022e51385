package edu.mcmaster.braggfit;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class InstrumentConstantsTest {

    private static final String PADE = "[1.0, 0.0, 0.0, 0.0, 1.0, 1.0, 0.0, 0.0, 1.0, 1.0]";

    private static InputStream json(final String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void loadsBundledInstrument() {
        final InstrumentConstants example = InstrumentConstants.forInstrument("EXAMPLE");
        assertEquals("EXAMPLE", example.name());
        assertEquals(3176.507, example.tofConstant(), 0.0);
        assertEquals(256, example.detectorRows());
        assertEquals(256, example.detectorColumns());
        assertEquals(InstrumentConstants.NPADE, example.moderatorCoefficients("A").length);
        assertTrue(example.hasIccConstraint("iccKConv"));
        assertArrayEquals(new double[]{100.0, 140.0, 120.0}, example.iccConstraint("iccKConv"), 0.0);
        assertFalse(example.hasIccConstraint("iccA"));
        assertNull(example.iccConstraint("iccA"));
    }

    @Test
    public void padeApproximant() {
        // numerator and denominator cancel
        assertEquals(0.05, InstrumentConstants.pade(
            new double[]{0.05, 0.0, 0.0, 0.0, 1.0, 1.0, 0.0, 0.0, 1.0, 1.0}, 0.3), 1e-15);
        // c0 x^c1 (1 + c2 x) / (1 + c6 x), with the power terms cancelling
        final double[] c = {2.0, 0.5, 1.0, 0.0, 1.0, 1.0, 3.0, 0.0, 1.0, 1.0};
        final double x = 0.04;
        final double expected = 2.0 * Math.sqrt(x) * (1.0 + x + x) / (1.0 + 3.0 * x + x);
        assertEquals(expected, InstrumentConstants.pade(c, x), 1e-12);
        assertEquals(0.05, SyntheticPeaks.instrument().moderatorValue("A", 0.02), 1e-15);
    }

    @Test
    public void defaultsFillMissingScalars() {
        final InstrumentConstants c = InstrumentConstants.fromJson(json(
            "{\"moderator\": {\"A\": " + PADE + ", \"B\": " + PADE + ", \"R\": " + PADE + ", \"T0\": " + PADE + "}}"));
        assertEquals(InstrumentConstants.DEFAULT_TOF_CONSTANT, c.tofConstant(), 0.0);
        assertEquals(InstrumentConstants.DEFAULT_DETECTOR_SIZE, c.detectorRows());
        assertFalse(c.hasIccConstraint("iccKConv"));
    }

    @Test(expected = ConfigurationException.class)
    public void missingModeratorIsFatal() {
        InstrumentConstants.fromJson(json("{\"name\": \"X\", \"tofConstant\": 3176.507}"));
    }

    @Test(expected = ConfigurationException.class)
    public void missingModeratorKeyIsFatal() {
        InstrumentConstants.fromJson(json(
            "{\"moderator\": {\"A\": " + PADE + ", \"B\": " + PADE + ", \"R\": " + PADE + "}}"));
    }

    @Test(expected = ConfigurationException.class)
    public void shortPadeIsFatal() {
        InstrumentConstants.fromJson(json(
            "{\"moderator\": {\"A\": [1, 2, 3], \"B\": " + PADE + ", \"R\": " + PADE + ", \"T0\": " + PADE + "}}"));
    }

    @Test(expected = ConfigurationException.class)
    public void unknownConstraintIsFatal() {
        InstrumentConstants.fromJson(json(
            "{\"moderator\": {\"A\": " + PADE + ", \"B\": " + PADE + ", \"R\": " + PADE + ", \"T0\": " + PADE + "},"
            + " \"iccConstraints\": {\"iccWidth\": [0, 1]}}"));
    }

    @Test(expected = ConfigurationException.class)
    public void malformedJsonIsFatal() {
        InstrumentConstants.fromJson(json("{\"moderator\": "));
    }

    @Test(expected = ConfigurationException.class)
    public void unknownInstrumentIsFatal() {
        InstrumentConstants.forInstrument("NOSUCH");
    }

    @Test(expected = ConfigurationException.class)
    public void realInstrumentsAreNotBundled() {
        InstrumentConstants.forInstrument("MANDI");
    }
}
