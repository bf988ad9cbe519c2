package org.htaimport.datapipeline.api.resources.source;

import org.htaimport.datapipeline.api.resources.CheckedConsumer;

/**
 * Read capability on the relational source store.
 * <p>
 * Each metric lives in its own table with a {@code timestamp} column (unix milliseconds)
 * and a {@code value} column. Implementations own a single connection for their whole
 * lifetime and are not thread-safe.
 * <p>
 * Implements {@link AutoCloseable} to enable try-with-resources pattern for
 * automatic connection cleanup.
 */
public interface ISourceReader extends AutoCloseable {

    /**
     * Runs the aggregate {@code COUNT/MIN/MAX} query over the metric's full row set.
     *
     * @param metric source metric (table) name
     * @return the stats of the row set
     * @throws SourceQueryException if the query fails or the metric has no rows
     */
    SourceRangeStats queryRangeStats(String metric) throws SourceQueryException;

    /**
     * Streams the rows with {@code lowerInclusive <= timestamp < upperExclusive},
     * ordered ascending by timestamp and truncated after {@code rowLimit} rows.
     * <p>
     * Rows are handed to {@code handler} in result order while the result set is open,
     * so memory use does not depend on the number of rows.
     *
     * @param metric         source metric (table) name
     * @param lowerInclusive lower time bound in unix ms
     * @param upperExclusive upper time bound in unix ms
     * @param rowLimit       maximum number of rows to return
     * @param handler        receives each row
     * @return number of rows handed to {@code handler}
     * @throws SourceQueryException if the query fails or the handler throws
     */
    long queryRange(String metric, long lowerInclusive, long upperExclusive, long rowLimit,
                    CheckedConsumer<SourceRow> handler) throws SourceQueryException;

    /**
     * Returns the smallest and largest value stored for the metric.
     *
     * @param metric source metric (table) name
     * @return the value range
     * @throws SourceQueryException if the query fails or the metric has no rows
     */
    ValueRange queryValueRange(String metric) throws SourceQueryException;

    @Override
    void close();
}
