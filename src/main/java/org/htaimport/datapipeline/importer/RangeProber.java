package org.htaimport.datapipeline.importer;

import org.htaimport.datapipeline.api.resources.source.ISourceReader;
import org.htaimport.datapipeline.api.resources.source.SourceQueryException;
import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Establishes the row count and timestamp extent of a source metric.
 */
public class RangeProber {

    private static final Logger log = LoggerFactory.getLogger(RangeProber.class);

    private final ISourceReader source;

    public RangeProber(ISourceReader source) {
        this.source = source;
    }

    /**
     * Runs the aggregate query for {@code sourceMetric}.
     *
     * @param sourceMetric source table name
     * @return count and min/max timestamp of the full row set
     * @throws SourceQueryException if the query fails or the metric is empty
     */
    public SourceRangeStats probe(String sourceMetric) throws SourceQueryException {
        SourceRangeStats stats = source.queryRangeStats(sourceMetric);
        log.debug("Source metric {}: {} rows in [{}, {}]",
            sourceMetric, stats.count(), stats.minTimestamp(), stats.maxTimestamp());
        return stats;
    }
}
