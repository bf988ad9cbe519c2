package org.htaimport.datapipeline.api.resources.timeseries;

/**
 * Registry of metrics in the destination time-series store.
 */
public interface ITimeSeriesDirectory extends AutoCloseable {

    /**
     * Returns a write handle for {@code name}, creating the metric on first reference.
     *
     * @param name destination metric name
     * @return an open handle
     * @throws TimeSeriesStoreException if the metric cannot be created or is read-only
     */
    ITimeSeriesMetric openOrCreate(String name);

    @Override
    void close();
}
