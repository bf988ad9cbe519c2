package org.htaimport.datapipeline.importer;

/**
 * Parameters of a single-metric import run.
 *
 * @param sourceMetric      source table name
 * @param destinationMetric destination metric name
 * @param minTimestamp      requested lower bound in unix ms, 0 for unbounded
 * @param maxTimestamp      requested upper bound in unix ms (exclusive), 0 for unbounded
 * @param maxRowsPerQuery   row cap of a single chunk query
 */
public record ImportRequest(
    String sourceMetric,
    String destinationMetric,
    long minTimestamp,
    long maxTimestamp,
    long maxRowsPerQuery
) {

    /** Default row cap for a single chunk query. */
    public static final long DEFAULT_MAX_ROWS_PER_QUERY = 20_000_000L;

    public ImportRequest {
        if (sourceMetric == null || sourceMetric.isBlank()) {
            throw new IllegalArgumentException("sourceMetric must not be blank");
        }
        if (destinationMetric == null || destinationMetric.isBlank()) {
            throw new IllegalArgumentException("destinationMetric must not be blank");
        }
        if (minTimestamp < 0 || maxTimestamp < 0) {
            throw new IllegalArgumentException("timestamps must be non-negative");
        }
        if (maxRowsPerQuery <= 0) {
            throw new IllegalArgumentException("maxRowsPerQuery must be positive, was " + maxRowsPerQuery);
        }
    }

    /**
     * Derives the source table name from a destination metric name when no explicit
     * import name is given: dots become underscores.
     *
     * @param destinationMetric destination metric name, e.g. {@code foo.bar}
     * @return the default source name, e.g. {@code foo_bar}
     */
    public static String defaultSourceName(String destinationMetric) {
        return destinationMetric.replace('.', '_');
    }
}
