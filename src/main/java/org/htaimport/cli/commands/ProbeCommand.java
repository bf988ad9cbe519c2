package org.htaimport.cli.commands;

import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.htaimport.cli.CommandLineInterface;
import org.htaimport.cli.probe.ProbeReport;
import org.htaimport.cli.probe.SourceProbeService;
import org.htaimport.datapipeline.api.resources.source.ISourceReader;
import org.htaimport.datapipeline.api.resources.source.SourceQueryException;
import org.htaimport.datapipeline.importer.ImportRequest;
import org.htaimport.datapipeline.resources.source.JdbcSourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that inspects source metrics without importing them (dry run).
 * <p>
 * Prints row count, time range and average interval per metric and flags
 * suspicious data before an import is started.
 */
@Command(
    name = "probe",
    description = "Inspect source metrics and flag suspicious data without importing"
)
public class ProbeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProbeCommand.class);

    @Option(
        names = {"-m", "--metric"},
        required = true,
        description = "HTA metric name(s) to probe; repeat for several metrics"
    )
    private String[] metrics;

    @Option(
        names = {"--import-metric"},
        description = "Source metric name, only valid with a single --metric"
    )
    private String importMetric;

    @Option(
        names = {"--sampling-rate"},
        defaultValue = "1",
        description = "Expected samples per second (default: ${DEFAULT-VALUE})"
    )
    private double samplingRate;

    @Option(
        names = {"--check-interval"},
        negatable = true,
        defaultValue = "true",
        fallbackValue = "true",
        description = "Check the average interval against --sampling-rate (default: ${DEFAULT-VALUE})"
    )
    private boolean checkInterval;

    @Option(
        names = {"--check-max-age"},
        defaultValue = "8h",
        converter = MaxAgeConverter.class,
        description = "Newest sample must be younger than this, e.g. 8h, 30m, 2d, or 'no' (default: ${DEFAULT-VALUE})"
    )
    private Duration maxAge;

    @Option(
        names = {"--check-values"},
        description = "Also check the value range"
    )
    private boolean checkValues;

    @Option(
        names = {"--fail-on-suspicious"},
        description = "Exit with status 1 if any metric looks suspicious"
    )
    private boolean failOnSuspicious;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (importMetric != null && metrics.length > 1) {
            err.println("Error: --import-metric can only be used with a single --metric");
            return 1;
        }

        try {
            Config config = parent.getConfig();
            int suspicious = 0;
            long total = 0;

            try (ISourceReader source = JdbcSourceReader.connect(config.getConfig("import"))) {
                SourceProbeService service = new SourceProbeService(source);
                for (String metric : metrics) {
                    String sourceName = importMetric != null ? importMetric : ImportRequest.defaultSourceName(metric);
                    ProbeReport report = service.probe(sourceName,
                        checkInterval ? samplingRate : null, maxAge, checkValues, Instant.now());
                    print(out, metric, report);
                    total += report.stats().count();
                    if (report.isSuspicious()) {
                        suspicious++;
                    }
                }
            }

            out.printf(Locale.ROOT, "Total: %,14d entries in %d metrics, %d suspicious%n", total, metrics.length, suspicious);
            return failOnSuspicious && suspicious > 0 ? 1 : 0;

        } catch (SourceQueryException e) {
            log.error("Probe failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void print(PrintWriter out, String metric, ProbeReport report) {
        out.printf(Locale.ROOT, "%-30s <== %-30s with %,14d entries%n", metric, report.metric(), report.stats().count());
        out.printf(Locale.ROOT, "        time range %s - %s, avg interval %.3f ms%n",
            Instant.ofEpochMilli(report.stats().minTimestamp()),
            Instant.ofEpochMilli(report.stats().maxTimestamp()),
            report.stats().averageInterval());
        if (report.valueRange() != null) {
            out.printf(Locale.ROOT, "        value range %s to %s%n", report.valueRange().min(), report.valueRange().max());
        }
        for (String finding : report.findings()) {
            out.println("        " + finding);
        }
        out.println();
    }

    /**
     * Parses durations like {@code 90s}, {@code 30m}, {@code 8h}, {@code 2d}; {@code no},
     * {@code false} and {@code not} disable the check.
     */
    public static class MaxAgeConverter implements ITypeConverter<Duration> {

        @Override
        public Duration convert(String value) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            if (v.equals("no") || v.equals("false") || v.equals("not")) {
                return null;
            }
            if (v.length() < 2) {
                throw new IllegalArgumentException("Invalid duration: " + value);
            }
            long amount = Long.parseLong(v.substring(0, v.length() - 1));
            return switch (v.charAt(v.length() - 1)) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                default -> throw new IllegalArgumentException("Invalid duration unit in: " + value);
            };
        }
    }
}
