package org.htaimport.datapipeline.importer;

import java.time.Duration;

import org.htaimport.datapipeline.api.resources.source.ISourceReader;
import org.htaimport.datapipeline.api.resources.source.SourceQueryException;
import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;
import org.htaimport.datapipeline.api.resources.source.SourceRow;
import org.htaimport.datapipeline.api.resources.timeseries.ITimeSeriesDirectory;
import org.htaimport.datapipeline.api.resources.timeseries.ITimeSeriesMetric;
import org.htaimport.datapipeline.api.resources.timeseries.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams one source metric into a destination metric in bounded time windows.
 * <p>
 * <strong>Window sizing:</strong> the nominal window width is half the time span that
 * would hold {@code maxRowsPerQuery} rows at the source's average density. The estimate
 * may over- or undershoot for irregular data; it only affects the number of queries.
 * <p>
 * <strong>Advancement:</strong> after a non-empty chunk the next window starts one
 * millisecond after the last row actually returned, not at the nominal window end. A
 * query cut off by the row cap therefore never skips the rows between the cut and the
 * window end. Empty chunks advance by the nominal width.
 * <p>
 * <strong>Monotonicity:</strong> a row is inserted only if its timestamp lies strictly
 * after the last inserted one. Duplicates and backwards timestamps are dropped and logged.
 * <p>
 * Single-threaded: one query at a time, rows are processed and flushed before the next
 * query is issued. The source reader and the destination metric are owned exclusively
 * for the duration of {@link #run}.
 */
public class ChunkedImporter {

    private static final Logger log = LoggerFactory.getLogger(ChunkedImporter.class);

    private final ISourceReader source;
    private final ITimeSeriesDirectory destination;
    private final RangeProber prober;

    public ChunkedImporter(ISourceReader source, ITimeSeriesDirectory destination) {
        this.source = source;
        this.destination = destination;
        this.prober = new RangeProber(source);
    }

    /**
     * Computes the nominal chunk width.
     *
     * @param stats           extent of the whole source metric
     * @param maxRowsPerQuery row cap of a single query
     * @return window width in ms, at least 1
     */
    static long chunkTimedelta(SourceRangeStats stats, long maxRowsPerQuery) {
        double samplingInterval = stats.averageInterval();
        long delta = (long) (samplingInterval * maxRowsPerQuery / 2);
        return Math.max(1L, delta);
    }

    /**
     * Imports {@code request.sourceMetric()} into {@code request.destinationMetric()}.
     *
     * @param request      what to import
     * @param cancellation polled once per chunk
     * @return counts and timing of the run
     * @throws SourceQueryException if the probe or any chunk query fails; the run is aborted
     */
    public ImportResult run(ImportRequest request, CancellationToken cancellation) throws SourceQueryException {
        final long startNanos = System.nanoTime();
        final String out = request.destinationMetric();

        SourceRangeStats stats = prober.probe(request.sourceMetric());
        ImportBounds bounds = ImportBounds.clamp(request.minTimestamp(), request.maxTimestamp(), stats);
        long chunkTimedelta = chunkTimedelta(stats, request.maxRowsPerQuery());

        log.info("[{}] starting import from {} using a chunk time of {}", out, request.sourceMetric(), chunkTimedelta);
        if (bounds.isEmpty()) {
            log.info("[{}] requested range [{}, {}) lies outside source range [{}, {}], nothing to import",
                out, request.minTimestamp(), request.maxTimestamp(), stats.minTimestamp(), stats.maxTimestamp());
        }

        ChunkProcessor processor = new ChunkProcessor();
        boolean cancelled = false;
        try (ITimeSeriesMetric metric = destination.openOrCreate(out)) {
            long currentTimestamp = bounds.lowerBound();

            while (currentTimestamp < bounds.upperBound()) {
                if (cancellation.isCancelled()) {
                    metric.flush();
                    cancelled = true;
                    log.warn("[{}] import cancelled at {} after {} rows", out, currentTimestamp, processor.accepted);
                    break;
                }

                ChunkWindow window = ChunkWindow.open(currentTimestamp, chunkTimedelta, bounds.upperBound());
                processor.beginChunk();
                long returned = source.queryRange(request.sourceMetric(),
                    window.currentTimestamp(), window.nextTimestamp(), request.maxRowsPerQuery(), row -> processor.accept(metric, row));
                processor.queries++;

                if (returned == 0) {
                    currentTimestamp = window.nextTimestamp();
                    continue;
                }

                metric.flush();
                if (returned >= request.maxRowsPerQuery()) {
                    log.debug("[{}] chunk [{}, {}) hit the row cap of {}", out,
                        window.currentTimestamp(), window.nextTimestamp(), request.maxRowsPerQuery());
                }
                log.info("[{}] {} rows completed.", out, processor.read);

                if (processor.lastRawTimestamp < currentTimestamp) {
                    throw new SourceQueryException(request.sourceMetric(), String.format(
                        "Source returned timestamp %d before window start %d", processor.lastRawTimestamp, currentTimestamp));
                }
                currentTimestamp = processor.lastRawTimestamp + 1;
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        if (!cancelled) {
            log.info("[{}] completed import of {} rows in {} ms", out, processor.accepted, elapsed.toMillis());
        }
        if (processor.dropped > 0) {
            log.warn("[{}] dropped {} rows with non-monotonic timestamps", out, processor.dropped);
        }
        return new ImportResult(processor.accepted, processor.dropped, processor.read, processor.queries, elapsed, cancelled);
    }

    /**
     * Per-run row handler: applies the monotonicity filter and tracks counters.
     */
    private static final class ChunkProcessor {

        private final MonotonicityCursor cursor = new MonotonicityCursor();

        private long accepted;
        private long dropped;
        private long read;
        private long queries;
        private long lastRawTimestamp;

        void beginChunk() {
            lastRawTimestamp = Long.MIN_VALUE;
        }

        void accept(ITimeSeriesMetric metric, SourceRow row) {
            read++;
            lastRawTimestamp = row.timestampMillis();
            long time = Sample.toTimePoint(row.timestampMillis());
            if (!cursor.tryAdvance(time)) {
                dropped++;
                log.warn("[{}] Skipping non-monotonous timestamp {}", metric.getName(), time);
                return;
            }
            metric.insert(new Sample(time, row.value()));
            accepted++;
        }
    }
}
