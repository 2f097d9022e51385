package edu.mcmaster.braggfit;

import java.util.Arrays;

/**
 * Binned event counts over a regular (Qx, Qy, Qz) box around one peak.
 * Axis coordinates are evenly spaced from min to max inclusive. The x index
 * runs fastest: {@code idx = (k * ny + j) * nx + i}.
 */
public final class VoxelGrid {

    private final int nx;
    private final int ny;
    private final int nz;
    private final double[] min;
    private final double[] max;
    private final int[] counts;

    public VoxelGrid(final int[] counts,
                     final int nx, final int ny, final int nz,
                     final double[] min, final double[] max)
    {
        if (nx < 1 || ny < 1 || nz < 1)
            throw new IllegalArgumentException("grid dimensions must be positive");
        if (counts == null || counts.length != nx * ny * nz)
            throw new IllegalArgumentException("counts must hold nx*ny*nz values");
        if (min == null || max == null || min.length != 3 || max.length != 3)
            throw new IllegalArgumentException("axis bounds must be 3-vectors");
        for (int c : counts) {
            if (c < 0)
                throw new IllegalArgumentException("counts must be non-negative");
        }
        this.nx = nx;
        this.ny = ny;
        this.nz = nz;
        this.min = min.clone();
        this.max = max.clone();
        this.counts = counts.clone();
    }

    /** Grid of {@code n} voxels per side and spacing {@code dq} centred on {@code center}. */
    public static VoxelGrid centeredOn(final double[] center, final double dq,
                                       final int n, final int[] counts) {
        final double half = 0.5 * dq * (n - 1);
        double[] lo = new double[3];
        double[] hi = new double[3];
        for (int a = 0; a < 3; a++) {
            lo[a] = center[a] - half;
            hi[a] = center[a] + half;
        }
        return new VoxelGrid(counts, n, n, n, lo, hi);
    }

    /*----------- Public Interface ------------------*/

    public int nx() {
        return this.nx;
    }

    public int ny() {
        return this.ny;
    }

    public int nz() {
        return this.nz;
    }

    public int size() {
        return this.counts.length;
    }

    public int index(final int i, final int j, final int k) {
        assert(i >= 0 && i < nx && j >= 0 && j < ny && k >= 0 && k < nz);
        return (k * this.ny + j) * this.nx + i;
    }

    /** Inverse of {@link #index}: {i, j, k}. */
    public int[] voxel(final int idx) {
        final int i = idx % this.nx;
        final int j = (idx / this.nx) % this.ny;
        final int k = idx / (this.nx * this.ny);
        return new int[]{i, j, k};
    }

    public int count(final int idx) {
        return this.counts[idx];
    }

    public int count(final int i, final int j, final int k) {
        return this.counts[index(i, j, k)];
    }

    public int[] getCounts() {
        return this.counts.clone();
    }

    public long totalCounts() {
        long total = 0;
        for (int c : this.counts)
            total += c;
        return total;
    }

    public double spacing(final int axis) {
        final int n = dim(axis);
        return n > 1 ? (this.max[axis] - this.min[axis]) / (n - 1) : 0.0;
    }

    public double axisValue(final int axis, final int i) {
        return this.min[axis] + i * spacing(axis);
    }

    public double qx(final int i) {
        return axisValue(0, i);
    }

    public double qy(final int j) {
        return axisValue(1, j);
    }

    public double qz(final int k) {
        return axisValue(2, k);
    }

    /** Q vector at the voxel with flat index {@code idx}. */
    public double[] q(final int idx) {
        int[] v = voxel(idx);
        return new double[]{qx(v[0]), qy(v[1]), qz(v[2])};
    }

    public int dim(final int axis) {
        switch (axis) {
            case 0: return this.nx;
            case 1: return this.ny;
            case 2: return this.nz;
            default: throw new IllegalArgumentException("axis must be 0, 1 or 2");
        }
    }

    public double min(final int axis) {
        return this.min[axis];
    }

    public double max(final int axis) {
        return this.max[axis];
    }

    public int centerIndex() {
        return index(this.nx / 2, this.ny / 2, this.nz / 2);
    }

    @Override
    public String toString() {
        return "VoxelGrid[" + nx + "x" + ny + "x" + nz + ", min=" + Arrays.toString(min)
               + ", max=" + Arrays.toString(max) + "]";
    }
}
