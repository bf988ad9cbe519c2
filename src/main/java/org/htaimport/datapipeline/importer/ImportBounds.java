package org.htaimport.datapipeline.importer;

import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;

/**
 * Effective time range of one import run: the caller's requested range intersected
 * with the source's observed extent.
 *
 * @param lowerBound first timestamp to import (unix ms, inclusive)
 * @param upperBound end of the range (unix ms, exclusive)
 */
public record ImportBounds(long lowerBound, long upperBound) {

    /**
     * Clamps the requested range to the source extent.
     * <p>
     * The upper bound is derived from the inclusive source maximum, hence the {@code + 1}.
     * A requested bound of 0 means unbounded on that side.
     *
     * @param requestedMin requested lower bound in unix ms, 0 for unbounded
     * @param requestedMax requested upper bound in unix ms (exclusive), 0 for unbounded
     * @param stats        extent of the source metric
     * @return the effective bounds
     */
    public static ImportBounds clamp(long requestedMin, long requestedMax, SourceRangeStats stats) {
        long lower = Math.max(requestedMin, stats.minTimestamp());
        long sourceEnd = stats.maxTimestamp() == Long.MAX_VALUE ? Long.MAX_VALUE : stats.maxTimestamp() + 1;
        long upper = requestedMax != 0 ? Math.min(requestedMax, sourceEnd) : sourceEnd;
        return new ImportBounds(lower, upper);
    }

    /**
     * @return true if no timestamp lies within the bounds
     */
    public boolean isEmpty() {
        return lowerBound >= upperBound;
    }
}
