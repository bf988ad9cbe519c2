package org.htaimport.datapipeline.api.resources.timeseries;

import java.util.concurrent.TimeUnit;

/**
 * A single point in destination time representation.
 *
 * @param timestamp nanoseconds since the unix epoch
 * @param value     sample value
 */
public record Sample(long timestamp, double value) {

    /**
     * Converts a source timestamp in unix milliseconds to destination time.
     * Saturates at {@link Long#MAX_VALUE} instead of overflowing.
     *
     * @param millis unix milliseconds
     * @return nanoseconds since the unix epoch
     */
    public static long toTimePoint(long millis) {
        return TimeUnit.MILLISECONDS.toNanos(millis);
    }
}
