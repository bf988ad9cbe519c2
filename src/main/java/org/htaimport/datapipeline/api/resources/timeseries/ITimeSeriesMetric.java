package org.htaimport.datapipeline.api.resources.timeseries;

/**
 * Write handle on one metric of the destination store.
 * <p>
 * Inserts are buffered; their order within a flush epoch is preserved. {@link #flush()}
 * is the durability checkpoint: anything inserted before it is queryable afterwards.
 * A handle is owned by a single writer.
 */
public interface ITimeSeriesMetric extends AutoCloseable {

    String getName();

    /**
     * Buffers a sample for appending.
     *
     * @param sample the sample; its timestamp must be strictly after every previously
     *               inserted sample of this metric
     * @throws TimeSeriesStoreException if the sample is out of order or cannot be buffered
     */
    void insert(Sample sample);

    /**
     * Makes all buffered inserts durable and queryable.
     *
     * @throws TimeSeriesStoreException if the write fails
     */
    void flush();

    /**
     * Flushes pending inserts and releases the handle.
     */
    @Override
    void close();
}
