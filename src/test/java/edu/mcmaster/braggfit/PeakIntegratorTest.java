package edu.mcmaster.braggfit;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PeakIntegratorTest {

    private final InstrumentConstants constants = SyntheticPeaks.instrument();
    private final IntegrationSettings settings = SyntheticPeaks.settings();
    private final PeakIntegrator integrator = new PeakIntegrator(constants, settings);

    // serves prepared grids; a peak without one has no events
    private static final class MapSource implements VoxelGridSource {
        private final Map<Integer, VoxelGrid> grids = new HashMap<Integer, VoxelGrid>();

        MapSource put(final int peakNumber, final VoxelGrid grid) {
            this.grids.put(peakNumber, grid);
            return this;
        }

        @Override
        public VoxelGrid gridFor(final PeakGeometry geometry) throws FitException {
            final VoxelGrid grid = this.grids.get(geometry.peakNumber());
            if (grid == null)
                throw new DegenerateFitException("no events near peak " + geometry.peakNumber());
            return grid;
        }

        @Override
        public boolean[] qMaskFor(final PeakGeometry geometry, final VoxelGrid grid) {
            return null;
        }
    }

    private static VoxelGrid emptyGrid() {
        return SyntheticPeaks.grid(new int[SyntheticPeaks.N * SyntheticPeaks.N * SyntheticPeaks.N]);
    }

    @Test
    public void integratesStrongPeak() {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        final FitResult r = integrator.integrate(grid, SyntheticPeaks.geometry(1, 100, 100), null);

        assertEquals(r.toString(), PeakStatus.CONVERGED, r.getStatus());
        final double events = SyntheticPeaks.blobEvents(200.0, 2.0);
        assertTrue("I=" + r.getIntensity(), r.getIntensity() > 0.5 * events);
        assertTrue("I=" + r.getIntensity(), r.getIntensity() < 1.5 * events);
        assertTrue(r.getSigma() > 0.0);
        assertTrue(r.getA1() >= 0.0);
        assertTrue(r.getDQ() < settings.maxCenterShift());
        assertFalse(r.isForced());
        assertFalse(r.needsBorrowedShape());
        assertTrue(r.isStrongPeakCandidate());
        assertTrue(r.getPpLambda() > 0.0);

        final int[] v = grid.voxel(r.getCenterIndex());
        for (int a = 0; a < 3; a++)
            assertTrue(Math.abs(v[a] - SyntheticPeaks.CENTER) <= 2);
        assertEquals(grid.size(), r.getComposedModel().length);
    }

    @Test
    public void isolatedPeakWithoutBackground() throws Exception {
        final VoxelGrid grid = SyntheticPeaks.grid(SyntheticPeaks.blob(1000.0, 2.0, 0.0, 0L));
        final PeakGeometry geometry = SyntheticPeaks.geometry(5, 100, 100);
        final FitResult r = integrator.integrate(grid, geometry, null);
        assertEquals(r.toString(), PeakStatus.CONVERGED, r.getStatus());

        // every voxel within two sigma is signal, nearly every empty voxel is not
        final SignalMask mask = r.getMask();
        final int c = SyntheticPeaks.CENTER;
        int inside = 0;
        int empty = 0;
        int emptyKept = 0;
        for (int idx = 0; idx < grid.size(); idx++) {
            final int[] v = grid.voxel(idx);
            final int r2 = (v[0] - c) * (v[0] - c) + (v[1] - c) * (v[1] - c) + (v[2] - c) * (v[2] - c);
            if (r2 <= 16) {
                inside++;
                assertTrue("voxel " + idx, mask.isSignal(idx));
            }
            if (grid.count(idx) == 0) {
                empty++;
                if (mask.isSignal(idx))
                    emptyKept++;
            }
        }
        assertEquals(257, inside);
        assertTrue(empty > 0);
        assertTrue(emptyKept + " of " + empty, emptyKept < 0.05 * empty);

        // angular centre within one histogram bin of the blob centre
        final VoxelCoordinates coords = new CoordinateMapper(constants).map(grid, geometry);
        final AngularHistogram hist = new AngularProfileFitter(constants, settings)
            .histogram(grid, coords, mask, null, geometry);
        final double[] angles = CoordinateMapper.toAngles(grid.q(grid.index(c, c, c)));
        final AngularProfileModel angular = r.getAngularModel();
        assertEquals(angles[0], angular.getMuPolar(), hist.polarStep());
        assertEquals(angles[1], angular.getMuAzimuthal(), hist.azimuthalStep());
    }

    @Test
    public void unindexedReflectionIsDegenerate() {
        final FitResult r = integrator.integrate(SyntheticPeaks.strongPeak(),
                                                 SyntheticPeaks.geometry(2, 100, 100).withHkl(0, 0, 0), null);
        assertEquals(PeakStatus.DEGENERATE, r.getStatus());
        assertEquals(0.0, r.getIntensity(), 0.0);
        assertEquals(1.0, r.getSigma(), 0.0);
        assertFalse(r.hasScaling());
    }

    @Test
    public void emptyGridIsDegenerate() {
        final FitResult r = integrator.integrate(emptyGrid(), SyntheticPeaks.geometry(3, 100, 100), null);
        assertEquals(PeakStatus.DEGENERATE, r.getStatus());
        assertEquals(0.0, r.getIntensity(), 0.0);
        assertEquals(1.0, r.getSigma(), 0.0);
    }

    @Test
    public void badGeometryIsReported() {
        final PeakGeometry flat = new PeakGeometry(4, 9.5, 0.5, 0.0, SyntheticPeaks.Q0, 100, 100);
        final FitResult r = integrator.integrate(SyntheticPeaks.strongPeak(), flat, null);
        assertEquals(PeakStatus.BADPEAK, r.getStatus());
        assertEquals(0.0, r.getIntensity(), 0.0);
    }

    @Test
    public void batchLendsStrongShapesToEdgePeaks() {
        final VoxelGrid strong = SyntheticPeaks.strongPeak();
        final MapSource source = new MapSource()
            .put(1, strong)
            .put(2, strong)
            .put(4, emptyGrid());
        final List<PeakGeometry> peaks = Arrays.asList(
            SyntheticPeaks.geometry(1, 100, 100),
            SyntheticPeaks.geometry(2, 1, 100),
            SyntheticPeaks.geometry(3, 100, 100),
            SyntheticPeaks.geometry(4, 100, 100));

        final List<FitResult> results = integrator.integrateAll(peaks, source);
        assertEquals(4, results.size());
        for (int i = 0; i < results.size(); i++)
            assertEquals(i + 1, results.get(i).getPeakNumber());

        assertEquals(PeakStatus.CONVERGED, results.get(0).getStatus());
        assertFalse(results.get(0).isForced());

        final FitResult edge = results.get(1);
        assertTrue(edge.needsBorrowedShape());
        assertTrue(edge.toString(), edge.isForced());
        final AngularProfileModel borrowed = results.get(0).getAngularModel();
        final double tol = settings.forceTolerance();
        assertTrue(Math.abs(edge.getAngularModel().getSigmaPolar() - borrowed.getSigmaPolar())
                   <= tol * borrowed.getSigmaPolar() + 1e-12);

        assertEquals(PeakStatus.DEGENERATE, results.get(2).getStatus());
        assertEquals(PeakStatus.DEGENERATE, results.get(3).getStatus());
        assertEquals(0.0, results.get(3).getIntensity(), 0.0);
    }

    @Test
    public void emptyLibraryKeepsFreeFits() {
        final MapSource source = new MapSource().put(2, SyntheticPeaks.strongPeak());
        final List<FitResult> results = integrator.integrateAll(
            Arrays.asList(SyntheticPeaks.geometry(2, 1, 100)), source, StrongPeakLibrary.empty());
        assertEquals(1, results.size());
        assertTrue(results.get(0).needsBorrowedShape());
        assertFalse(results.get(0).isForced());
    }

    @Test
    public void emptyBatch() {
        assertTrue(integrator.integrateAll(new ArrayList<PeakGeometry>(), new MapSource()).isEmpty());
    }

    @Test(expected = ConfigurationException.class)
    public void configurationErrorsAbortTheBatch() {
        final VoxelGridSource broken = new VoxelGridSource() {
            @Override
            public VoxelGrid gridFor(final PeakGeometry geometry) {
                throw new ConfigurationException("event file is missing the bank layout");
            }

            @Override
            public boolean[] qMaskFor(final PeakGeometry geometry, final VoxelGrid grid) {
                return null;
            }
        };
        integrator.integrateAll(Arrays.asList(SyntheticPeaks.geometry(1, 100, 100)), broken);
    }
}
