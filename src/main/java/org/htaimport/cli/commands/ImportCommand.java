package org.htaimport.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.htaimport.cli.CommandLineInterface;
import org.htaimport.datapipeline.api.resources.source.ISourceReader;
import org.htaimport.datapipeline.api.resources.source.SourceQueryException;
import org.htaimport.datapipeline.api.resources.timeseries.TimeSeriesStoreException;
import org.htaimport.datapipeline.importer.CancellationToken;
import org.htaimport.datapipeline.importer.ChunkedImporter;
import org.htaimport.datapipeline.importer.ImportRequest;
import org.htaimport.datapipeline.importer.ImportResult;
import org.htaimport.datapipeline.resources.source.JdbcSourceReader;
import org.htaimport.datapipeline.resources.timeseries.H2TimeSeriesDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that imports one metric from the dataheap source database into HTA.
 * <p>
 * An interrupt (Ctrl-C) does not kill the import mid-chunk: the shutdown hook requests
 * cancellation and waits until the importer has flushed and stopped.
 */
@Command(
    name = "import",
    description = "Import a single metric from the source database into the HTA store"
)
public class ImportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImportCommand.class);

    static final int EXIT_CANCELLED = 130;
    private static final long SHUTDOWN_WAIT_SECONDS = 60;

    @Option(
        names = {"-m", "--metric"},
        description = "Name of the HTA metric to import into"
    )
    private String metric;

    @Option(
        names = {"--import-metric"},
        description = "Name of the source metric (default: --metric with '.' replaced by '_')"
    )
    private String importMetric;

    @Option(
        names = {"--max-rows-per-query", "--mysql-chunk-size"},
        description = "Row cap of a single chunk query (default: importer.maxRowsPerQuery)"
    )
    private Long maxRowsPerQuery;

    @Option(
        names = {"--min-timestamp"},
        description = "Minimal timestamp to import, in unix-ms (default: 0, unbounded)"
    )
    private long minTimestamp = 0;

    @Option(
        names = {"--max-timestamp"},
        description = "Maximal timestamp to import (exclusive), in unix-ms (default: 0, unbounded)"
    )
    private long maxTimestamp = 0;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (metric == null || metric.isBlank()) {
            err.println("Error: Missing argument for import metric");
            spec.commandLine().usage(out);
            return 1;
        }

        final Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        final ImportRequest request;
        try {
            request = new ImportRequest(
                importMetric != null ? importMetric : ImportRequest.defaultSourceName(metric),
                metric,
                minTimestamp,
                maxTimestamp,
                maxRowsPerQuery != null ? maxRowsPerQuery : config.getLong("importer.maxRowsPerQuery"));
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        CancellationToken cancellation = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            log.warn("Caught interrupt, requesting stop.");
            cancellation.cancel();
            try {
                finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "import-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try (ISourceReader source = JdbcSourceReader.connect(config.getConfig("import"));
             H2TimeSeriesDirectory directory = new H2TimeSeriesDirectory(scopedDestinationConfig(config, metric))) {

            ImportResult result = new ChunkedImporter(source, directory).run(request, cancellation);

            out.printf("[%s] imported %,d rows (%,d dropped) in %,d chunk queries, %.3f s%n",
                metric, result.acceptedRows(), result.droppedRows(), result.chunkQueries(),
                result.elapsed().toMillis() / 1000.0);
            return result.cancelled() ? EXIT_CANCELLED : 0;

        } catch (SourceQueryException e) {
            log.error("[{}] Import failed: {}", metric, e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (TimeSeriesStoreException | ConfigException | IllegalArgumentException e) {
            log.error("[{}] Import failed: {}", metric, e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    /**
     * Narrows the {@code destination.metrics} list to the entry of the metric being imported.
     *
     * @param config application config
     * @param metric destination metric name
     * @return the {@code destination} block with at most one metric entry
     */
    static Config scopedDestinationConfig(Config config, String metric) {
        Config destination = config.getConfig("destination");
        if (!destination.hasPath("metrics")) {
            return destination;
        }
        return destination.getConfigList("metrics").stream()
            .filter(entry -> metric.equals(entry.getString("name")))
            .findFirst()
            .map(entry -> destination.withValue("metrics",
                ConfigValueFactory.fromIterable(List.of(entry.root().unwrapped()))))
            .orElse(destination);
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down, the hook is running
            log.debug("Shutdown in progress, keeping hook: {}", e.getMessage());
        }
    }
}
