package org.htaimport.cli.probe;

import java.util.List;

import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;
import org.htaimport.datapipeline.api.resources.source.ValueRange;

/**
 * Result of probing one source metric before an import.
 *
 * @param metric     source metric name
 * @param stats      row count and timestamp extent
 * @param valueRange value extent, null unless value checks were requested
 * @param findings   human-readable descriptions of suspicious properties, empty if none
 */
public record ProbeReport(String metric, SourceRangeStats stats, ValueRange valueRange, List<String> findings) {

    public boolean isSuspicious() {
        return !findings.isEmpty();
    }
}
