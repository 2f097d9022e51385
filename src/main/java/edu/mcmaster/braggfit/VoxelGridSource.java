package edu.mcmaster.braggfit;

/**
 * Supplies the binned counts around a peak, e.g. from an event file reader.
 */
public interface VoxelGridSource {

    VoxelGrid gridFor(PeakGeometry geometry) throws FitException;

    /** Voxels to consider for {@code geometry}; {@code null} means all. */
    boolean[] qMaskFor(PeakGeometry geometry, VoxelGrid grid);
}
