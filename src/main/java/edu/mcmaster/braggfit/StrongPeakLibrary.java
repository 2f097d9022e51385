package edu.mcmaster.braggfit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of strong-peak shapes. Built once, before the weak
 * peaks are fitted, so concurrent fits read the same entries.
 */
public final class StrongPeakLibrary {

    private static final StrongPeakLibrary EMPTY = new StrongPeakLibrary(new ArrayList<StrongPeakEntry>());

    private final List<StrongPeakEntry> entries;

    private StrongPeakLibrary(final List<StrongPeakEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<StrongPeakEntry>(entries));
    }

    public static StrongPeakLibrary empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /*----------- Public Interface ------------------*/

    public int size() {
        return this.entries.size();
    }

    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    public List<StrongPeakEntry> entries() {
        return this.entries;
    }

    /**
     * Entry closest in (azimuthal, polar); the earliest added entry wins a
     * tie.
     */
    public Optional<StrongPeakEntry> nearest(final double azimuthal, final double polar) {
        StrongPeakEntry best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (StrongPeakEntry e : this.entries) {
            final double dist = e.sqDist(azimuthal, polar);
            if (dist < bestDist) {
                bestDist = dist;
                best = e;
            }
        }
        return Optional.ofNullable(best);
    }

    public static final class Builder {

        private final List<StrongPeakEntry> entries = new ArrayList<StrongPeakEntry>();

        private Builder() {
        }

        public Builder add(final StrongPeakEntry entry) {
            if (entry == null)
                throw new NullPointerException("entry");
            this.entries.add(entry);
            return this;
        }

        /**
         * Adds the angular shape of {@code result} if it was fitted freely,
         * converged and has a positive-definite covariance.
         */
        public Builder add(final FitResult result) {
            if (result.isStrongPeakCandidate())
                this.entries.add(result.getAngularModel().toEntry());
            return this;
        }

        public int size() {
            return this.entries.size();
        }

        public StrongPeakLibrary build() {
            return new StrongPeakLibrary(this.entries);
        }
    }
}
