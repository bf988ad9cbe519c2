package org.htaimport.datapipeline.importer;

/**
 * Timestamp of the most recently accepted sample of an import run.
 * <p>
 * Starts at {@link Long#MIN_VALUE}, so the first row is always accepted. Only moves
 * forward; every accepted timestamp is strictly greater than all earlier ones.
 */
public class MonotonicityCursor {

    private long previousAcceptedTime = Long.MIN_VALUE;

    /**
     * Accepts {@code time} if it lies strictly after the previously accepted time.
     *
     * @param time candidate timestamp in destination representation
     * @return true if accepted, false if the timestamp is a duplicate or goes backwards
     */
    public boolean tryAdvance(long time) {
        if (time <= previousAcceptedTime) {
            return false;
        }
        previousAcceptedTime = time;
        return true;
    }

    public long getPreviousAcceptedTime() {
        return previousAcceptedTime;
    }
}
