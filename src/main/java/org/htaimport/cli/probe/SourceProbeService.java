package org.htaimport.cli.probe;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.htaimport.datapipeline.api.resources.source.ISourceReader;
import org.htaimport.datapipeline.api.resources.source.SourceQueryException;
import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;
import org.htaimport.datapipeline.api.resources.source.ValueRange;
import org.htaimport.datapipeline.importer.RangeProber;

/**
 * Inspects a source metric without importing it and flags data that looks wrong.
 * <p>
 * Checks:
 * <ul>
 *   <li>Max age: the newest timestamp must lie in the past, no further back than {@code maxAge}</li>
 *   <li>Interval: the average interval must be within a factor of 1.5 of {@code 1 / samplingRate}</li>
 *   <li>Values (optional): {@code -1e9 < min < max < 1e9}</li>
 * </ul>
 */
public class SourceProbeService {

    static final double INTERVAL_TOLERANCE = 1.5;
    static final double VALUE_LIMIT = 1e9;

    private final ISourceReader source;
    private final RangeProber prober;

    public SourceProbeService(ISourceReader source) {
        this.source = source;
        this.prober = new RangeProber(source);
    }

    /**
     * Probes {@code metric}.
     *
     * @param metric       source metric name
     * @param samplingRate expected samples per second, or null to skip the interval check
     * @param maxAge       accepted age of the newest sample, or null to skip the age check
     * @param checkValues  whether to query and check the value range
     * @param now          reference time for the age check
     * @return the report
     * @throws SourceQueryException if a query fails or the metric is empty
     */
    public ProbeReport probe(String metric, Double samplingRate, Duration maxAge, boolean checkValues, Instant now)
            throws SourceQueryException {
        SourceRangeStats stats = prober.probe(metric);
        List<String> findings = new ArrayList<>();

        if (maxAge != null) {
            Duration age = Duration.between(Instant.ofEpochMilli(stats.maxTimestamp()), now);
            if (age.isNegative() || age.isZero() || age.compareTo(maxAge) >= 0) {
                findings.add(String.format("suspicious max time: newest sample is %s old (limit %s)", age, maxAge));
            }
        }

        if (samplingRate != null) {
            double expectedInterval = 1000.0 / samplingRate;
            double averageInterval = stats.averageInterval();
            if (!(expectedInterval / INTERVAL_TOLERANCE < averageInterval
                    && averageInterval < expectedInterval * INTERVAL_TOLERANCE)) {
                findings.add(String.format("suspicious interval: average %.3f ms, expected %.3f ms",
                    averageInterval, expectedInterval));
            }
        }

        ValueRange valueRange = null;
        if (checkValues) {
            valueRange = source.queryValueRange(metric);
            if (!(-VALUE_LIMIT < valueRange.min() && valueRange.min() < valueRange.max() && valueRange.max() < VALUE_LIMIT)) {
                findings.add(String.format("suspicious value range: %s to %s", valueRange.min(), valueRange.max()));
            }
        }

        return new ProbeReport(metric, stats, valueRange, List.copyOf(findings));
    }
}
