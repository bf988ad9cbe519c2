package org.htaimport.datapipeline.api.resources.source;

/**
 * Row count and timestamp extent of a source metric's full row set.
 * <p>
 * Produced once per import run and never mutated. Independent of any
 * caller-supplied bounds.
 *
 * @param minTimestamp smallest timestamp in the table (unix ms, inclusive)
 * @param maxTimestamp largest timestamp in the table (unix ms, inclusive)
 * @param count        number of rows, always positive
 */
public record SourceRangeStats(long minTimestamp, long maxTimestamp, long count) {

    public SourceRangeStats {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, was " + count);
        }
        if (minTimestamp > maxTimestamp) {
            throw new IllegalArgumentException(
                String.format("minTimestamp (%d) cannot be greater than maxTimestamp (%d)", minTimestamp, maxTimestamp)
            );
        }
    }

    /**
     * Average spacing between consecutive samples across the whole table.
     *
     * @return mean inter-sample interval in milliseconds
     */
    public double averageInterval() {
        return (double) (maxTimestamp - minTimestamp) / count;
    }
}
