package org.htaimport.datapipeline.importer;

import java.time.Duration;

/**
 * Outcome of an import run.
 *
 * @param acceptedRows rows inserted into the destination
 * @param droppedRows  rows dropped for a duplicate or backwards timestamp
 * @param rowsRead     rows returned by the source, accepted or not
 * @param chunkQueries range queries issued
 * @param elapsed      wall time of the run
 * @param cancelled    true if the run stopped on a cancellation request
 */
public record ImportResult(
    long acceptedRows,
    long droppedRows,
    long rowsRead,
    long chunkQueries,
    Duration elapsed,
    boolean cancelled
) {
}
