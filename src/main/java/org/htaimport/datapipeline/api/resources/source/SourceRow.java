package org.htaimport.datapipeline.api.resources.source;

/**
 * A single row returned by a range query against the source store.
 *
 * @param timestampMillis raw source timestamp in unix milliseconds
 * @param value           sample value
 */
public record SourceRow(long timestampMillis, double value) {
}
