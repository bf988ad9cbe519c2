package org.htaimport.datapipeline.importer;

/**
 * Time window of a single chunk query, {@code [currentTimestamp, nextTimestamp)}.
 *
 * @param currentTimestamp window start (unix ms, inclusive)
 * @param nextTimestamp    window end (unix ms, exclusive)
 */
public record ChunkWindow(long currentTimestamp, long nextTimestamp) {

    /**
     * Opens a window of nominal width {@code chunkTimedelta} at {@code currentTimestamp},
     * cut at {@code upperBound}.
     *
     * @param currentTimestamp window start
     * @param chunkTimedelta   nominal width, positive
     * @param upperBound       exclusive end of the import range
     * @return the window
     */
    public static ChunkWindow open(long currentTimestamp, long chunkTimedelta, long upperBound) {
        long next = upperBound - currentTimestamp <= chunkTimedelta
            ? upperBound
            : currentTimestamp + chunkTimedelta;
        return new ChunkWindow(currentTimestamp, next);
    }
}
