package org.htaimport.datapipeline.api.resources.timeseries;

import com.typesafe.config.Config;

/**
 * Per-metric settings of the destination store.
 * <p>
 * Interval values are nanoseconds. {@code intervalMin} is the width of the finest
 * aggregation level, every next level is {@code intervalFactor} times wider, up to
 * {@code intervalMax}.
 *
 * @param name           metric name
 * @param mode           {@code RW} or {@code R}
 * @param intervalMin    finest aggregation interval in ns
 * @param intervalMax    coarsest aggregation interval in ns
 * @param intervalFactor ratio between adjacent aggregation levels
 */
public record MetricSettings(String name, String mode, long intervalMin, long intervalMax, int intervalFactor) {

    /** Upper limit for the coarsest aggregation interval: 30 days in ns. */
    public static final double MAX_INTERVAL_LIMIT = 2.592e15;

    public MetricSettings {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name must not be blank");
        }
        if (!"RW".equals(mode) && !"R".equals(mode)) {
            throw new IllegalArgumentException("mode must be RW or R, was " + mode);
        }
        if (intervalMin <= 0) {
            throw new IllegalArgumentException("intervalMin must be positive, was " + intervalMin);
        }
        if (intervalFactor < 2) {
            throw new IllegalArgumentException("intervalFactor must be at least 2, was " + intervalFactor);
        }
        if (intervalMax < intervalMin) {
            throw new IllegalArgumentException(
                String.format("intervalMax (%d) cannot be smaller than intervalMin (%d)", intervalMax, intervalMin));
        }
    }

    public boolean isWritable() {
        return "RW".equals(mode);
    }

    /**
     * Largest {@code intervalMin * intervalFactor^k} whose next step would reach 30 days.
     *
     * @param intervalMin    finest interval in ns
     * @param intervalFactor level ratio
     * @return default coarsest interval in ns
     */
    public static long defaultIntervalMax(long intervalMin, int intervalFactor) {
        long interval = intervalMin;
        while ((double) interval * intervalFactor < MAX_INTERVAL_LIMIT) {
            interval *= intervalFactor;
        }
        return interval;
    }

    /**
     * Reads settings for {@code name}, taking missing keys from {@code defaults}.
     *
     * @param name     metric name
     * @param entry    metric entry (may be empty)
     * @param defaults fallback values ({@code mode}, {@code intervalMin}, {@code intervalFactor},
     *                 optionally {@code intervalMax})
     * @return the resolved settings
     */
    public static MetricSettings fromConfig(String name, Config entry, Config defaults) {
        Config merged = entry.withFallback(defaults);
        long intervalMin = merged.getLong("intervalMin");
        int intervalFactor = merged.getInt("intervalFactor");
        long intervalMax = merged.hasPath("intervalMax")
            ? merged.getLong("intervalMax")
            : defaultIntervalMax(intervalMin, intervalFactor);
        return new MetricSettings(name, merged.getString("mode"), intervalMin, intervalMax, intervalFactor);
    }
}
