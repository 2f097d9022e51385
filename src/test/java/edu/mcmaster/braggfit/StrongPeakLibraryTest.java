package edu.mcmaster.braggfit;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class StrongPeakLibraryTest {

    @Test
    public void nearestByAngularDistance() {
        final StrongPeakEntry a = new StrongPeakEntry(0.1, 0.5, 0.002, 0.002, 0.0);
        final StrongPeakEntry b = new StrongPeakEntry(0.4, 0.9, 0.003, 0.001, 0.2);
        final StrongPeakLibrary library = StrongPeakLibrary.builder().add(a).add(b).build();

        assertEquals(2, library.size());
        assertSame(a, library.nearest(0.12, 0.52).get());
        assertSame(b, library.nearest(0.38, 0.85).get());
    }

    @Test
    public void firstEntryWinsATie() {
        final StrongPeakEntry a = new StrongPeakEntry(0.0, 0.5, 0.002, 0.002, 0.0);
        final StrongPeakEntry b = new StrongPeakEntry(0.2, 0.5, 0.003, 0.003, 0.0);
        final StrongPeakLibrary library = StrongPeakLibrary.builder().add(a).add(b).build();
        assertSame(a, library.nearest(0.1, 0.5).get());
    }

    @Test
    public void nearestAcrossTheAzimuthSeam() {
        // fitted centre unwrapped past +pi
        final FitResult seam = SyntheticPeaks.converged(1, 500.0, 20.0,
            SyntheticPeaks.angular(0.9, Math.PI + 0.002, 0.002, 0.002, 0.0, false), false);
        final StrongPeakEntry far = new StrongPeakEntry(2.5, 0.9, 0.003, 0.003, 0.0);
        final StrongPeakLibrary library = StrongPeakLibrary.builder().add(far).add(seam).build();

        final StrongPeakEntry stored = library.entries().get(1);
        assertTrue(stored.azimuthal() >= -Math.PI && stored.azimuthal() < Math.PI);
        assertEquals(-Math.PI + 0.002, stored.azimuthal(), 1e-12);

        assertEquals(0.002, stored.sigmaPolar(), 0.0);
        assertSame(stored, library.nearest(-Math.PI + 0.01, 0.9).get());
        assertSame(stored, library.nearest(Math.PI - 0.01, 0.9).get());
        assertEquals(0.0001, far.sqDist(2.5 - 2.0 * Math.PI, 0.91), 1e-12);
    }

    @Test
    public void emptyLibraryHasNoNearest() {
        assertTrue(StrongPeakLibrary.empty().isEmpty());
        assertFalse(StrongPeakLibrary.empty().nearest(0.0, 0.0).isPresent());
    }

    @Test(expected = NullPointerException.class)
    public void rejectsNullEntry() {
        StrongPeakLibrary.builder().add((StrongPeakEntry) null);
    }

    @Test
    public void keepsOnlyStrongFreeFits() {
        final FitResult strong = SyntheticPeaks.converged(1, 500.0, 20.0,
            SyntheticPeaks.angular(0.55, 0.25, 0.002, 0.0016, 0.3, false), false);
        final FitResult weak = SyntheticPeaks.converged(2, 50.0, 10.0,
            SyntheticPeaks.angular(0.56, 0.26, 0.002, 0.0016, 0.3, false), true);
        final FitResult forced = SyntheticPeaks.converged(3, 500.0, 20.0,
            SyntheticPeaks.angular(0.57, 0.27, 0.002, 0.0016, 0.3, true), false);
        final FitResult singular = SyntheticPeaks.converged(4, 500.0, 20.0,
            SyntheticPeaks.angular(0.58, 0.28, 0.0, 0.0016, 0.3, false), false);
        final FitResult failed = SyntheticPeaks.failed(5, new DegenerateFitException("no signal"));

        final StrongPeakLibrary library = StrongPeakLibrary.builder()
            .add(strong).add(weak).add(forced).add(singular).add(failed)
            .build();
        assertEquals(1, library.size());
        final StrongPeakEntry e = library.entries().get(0);
        assertEquals(0.25, e.azimuthal(), 0.0);
        assertEquals(0.55, e.polar(), 0.0);
        assertEquals(0.002, e.sigmaPolar(), 0.0);
        assertEquals(0.0016, e.sigmaAzimuthal(), 0.0);
        assertEquals(0.3, e.rho(), 0.0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void entriesAreReadOnly() {
        StrongPeakLibrary.builder().add(new StrongPeakEntry(0, 0, 1, 1, 0)).build()
            .entries().clear();
    }
}
