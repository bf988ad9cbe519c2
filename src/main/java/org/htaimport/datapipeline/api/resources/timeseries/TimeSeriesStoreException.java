package org.htaimport.datapipeline.api.resources.timeseries;

/**
 * Thrown when the destination time-series store cannot open, write or flush a metric.
 * <p>
 * This is a RuntimeException because store failures indicate storage or
 * configuration problems that the import loop cannot recover from.
 */
public class TimeSeriesStoreException extends RuntimeException {

    public TimeSeriesStoreException(String message) {
        super(message);
    }

    public TimeSeriesStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
