package edu.mcmaster.braggfit;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CoordinateMapperTest {

    private final CoordinateMapper mapper = new CoordinateMapper(SyntheticPeaks.instrument());

    @Test
    public void tofFollowsInverseRadius() throws Exception {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        final PeakGeometry geometry = SyntheticPeaks.geometry(1, 100, 100);
        final VoxelCoordinates coords = mapper.map(grid, geometry);

        final double factor = 3176.507 * 10.0 * Math.sin(0.5);
        for (int idx = 0; idx < grid.size(); idx += 97) {
            final double[] q = grid.q(idx);
            final double r = Math.sqrt(q[0] * q[0] + q[1] * q[1] + q[2] * q[2]);
            assertTrue(coords.isValid(idx));
            assertEquals(factor / r, coords.tof(idx), 1e-9 * factor / r);
            assertEquals(r, coords.radius(idx), 1e-12);
        }
        assertEquals(grid.size(), coords.countValid());
    }

    @Test
    public void anglesRoundTrip() throws Exception {
        final VoxelGrid grid = SyntheticPeaks.strongPeak();
        final VoxelCoordinates coords = mapper.map(grid, SyntheticPeaks.geometry(1, 100, 100));
        for (int idx = 0; idx < grid.size(); idx += 131) {
            final double[] q = grid.q(idx);
            final double[] back = CoordinateMapper.toQ(coords.polar(idx), coords.azimuthal(idx), coords.radius(idx));
            for (int a = 0; a < 3; a++)
                assertEquals(q[a], back[a], 1e-12);
        }
    }

    @Test
    public void polarIsMeasuredFromQz() {
        final double[] angles = CoordinateMapper.toAngles(new double[]{0.0, 1.0, 0.0});
        assertEquals(0.5 * Math.PI, angles[0], 1e-12);
        assertEquals(0.5 * Math.PI, angles[1], 1e-12);
        assertEquals(0.0, CoordinateMapper.toAngles(new double[]{0.0, 0.0, 2.0})[0], 1e-12);
    }

    @Test
    public void zeroHalfAngleIsAGeometryError() {
        final PeakGeometry flat = new PeakGeometry(7, 9.5, 0.5, 0.0, SyntheticPeaks.Q0, 100, 100);
        try {
            mapper.map(SyntheticPeaks.strongPeak(), flat);
            fail("expected a GeometryException");
        } catch (GeometryException ex) {
            assertEquals(PeakStatus.BADPEAK, ex.status());
        }
    }

    @Test(expected = GeometryException.class)
    public void tofAtOriginIsUndefined() throws Exception {
        mapper.tofAt(SyntheticPeaks.geometry(1, 100, 100), 0.0);
    }

    @Test
    public void voxelAtOriginIsInvalid() throws Exception {
        final VoxelGrid grid = VoxelGrid.centeredOn(new double[]{0.0, 0.0, 0.0}, 1.0, 3, new int[27]);
        final VoxelCoordinates coords = mapper.map(grid, SyntheticPeaks.geometry(1, 100, 100));
        assertFalse(coords.isValid(grid.centerIndex()));
        assertEquals(0.0, coords.tof(grid.centerIndex()), 0.0);
        assertEquals(26, coords.countValid());
    }
}
