package org.htaimport.datapipeline.importer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request for a running import.
 * <p>
 * Set from another thread (typically a shutdown hook); the import loop polls it once
 * per chunk and stops after flushing what it already accepted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
