package org.htaimport.datapipeline.resources.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;

import org.htaimport.datapipeline.api.resources.timeseries.ITimeSeriesMetric;
import org.htaimport.datapipeline.api.resources.timeseries.MetricSettings;
import org.htaimport.datapipeline.api.resources.timeseries.Sample;
import org.htaimport.datapipeline.api.resources.timeseries.TimeSeriesStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Integration tests for the H2-backed destination store.
 */
@Tag("integration")
class H2TimeSeriesDirectoryTest {

    @TempDir
    Path tempDir;

    private H2TimeSeriesDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new H2TimeSeriesDirectory(config());
    }

    @AfterEach
    void tearDown() {
        if (directory != null) {
            directory.close();
        }
    }

    private Config config() {
        String jdbcUrl = "jdbc:h2:file:" + tempDir.resolve("hta").toAbsolutePath().toString().replace('\\', '/');
        return ConfigFactory.parseString("""
            jdbcUrl = "%s"
            batchSize = 2
            defaults { mode = "RW", intervalMin = 40000000000, intervalFactor = 10 }
            metrics = [
              { name = "custom", intervalMin = 1000000000, intervalFactor = 4 }
              { name = "frozen", mode = "R" }
            ]
            """.formatted(jdbcUrl));
    }

    @Test
    void openOrCreate_registersUnknownMetricWithDefaults() {
        // given: fresh store
        assertThat(directory.getSettings("cpu.load")).isEmpty();

        // when
        try (ITimeSeriesMetric metric = directory.openOrCreate("cpu.load")) {
            assertThat(metric.getName()).isEqualTo("cpu.load");
        }

        // then
        assertThat(directory.getSettings("cpu.load")).contains(
            new MetricSettings("cpu.load", "RW", 40_000_000_000L, 400_000_000_000_000L, 10));
    }

    @Test
    void openOrCreate_usesMetricEntryOverDefaults() {
        directory.openOrCreate("custom").close();

        MetricSettings settings = directory.getSettings("custom").orElseThrow();
        assertThat(settings.intervalMin()).isEqualTo(1_000_000_000L);
        assertThat(settings.intervalFactor()).isEqualTo(4);
        assertThat(settings.intervalMax()).isEqualTo(MetricSettings.defaultIntervalMax(1_000_000_000L, 4));
    }

    @Test
    void openOrCreate_rejectsReadOnlyMetric() {
        assertThatThrownBy(() -> directory.openOrCreate("frozen"))
            .isInstanceOf(TimeSeriesStoreException.class)
            .hasMessageContaining("read-only");

        // the failed open must not leave the name locked
        assertThatThrownBy(() -> directory.openOrCreate("frozen"))
            .hasMessageContaining("read-only");
    }

    @Test
    void openOrCreate_rejectsSecondWriter() {
        try (ITimeSeriesMetric ignored = directory.openOrCreate("cpu.load")) {
            assertThatThrownBy(() -> directory.openOrCreate("cpu.load"))
                .isInstanceOf(TimeSeriesStoreException.class)
                .hasMessageContaining("already open");
        }

        directory.openOrCreate("cpu.load").close();
    }

    @Test
    void insert_becomesVisibleOnlyAfterFlush() {
        try (ITimeSeriesMetric metric = directory.openOrCreate("cpu.load")) {
            metric.insert(new Sample(1_000, 1.0));
            metric.insert(new Sample(2_000, 2.0));
            metric.insert(new Sample(3_000, 3.0));

            // batchSize 2 executed one batch, but nothing is committed yet
            assertThat(directory.readSamples("cpu.load")).isEmpty();

            metric.flush();

            assertThat(directory.readSamples("cpu.load")).containsExactly(
                new Sample(1_000, 1.0), new Sample(2_000, 2.0), new Sample(3_000, 3.0));
        }
    }

    @Test
    void close_flushesPendingSamples() {
        ITimeSeriesMetric metric = directory.openOrCreate("cpu.load");
        metric.insert(new Sample(1_000, 1.0));

        metric.close();

        assertThat(directory.readSamples("cpu.load")).containsExactly(new Sample(1_000, 1.0));
        assertThatThrownBy(() -> metric.insert(new Sample(2_000, 2.0)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void insert_rejectsTimestampNotAfterLast() {
        try (ITimeSeriesMetric metric = directory.openOrCreate("cpu.load")) {
            metric.insert(new Sample(2_000, 1.0));

            assertThatThrownBy(() -> metric.insert(new Sample(2_000, 2.0)))
                .isInstanceOf(TimeSeriesStoreException.class)
                .hasMessageContaining("Non-monotonic");
            assertThatThrownBy(() -> metric.insert(new Sample(1_000, 2.0)))
                .isInstanceOf(TimeSeriesStoreException.class);
        }

        assertThat(directory.readSamples("cpu.load")).containsExactly(new Sample(2_000, 1.0));
    }

    @Test
    void reopen_continuesAfterStoredTail() {
        try (ITimeSeriesMetric metric = directory.openOrCreate("cpu.load")) {
            metric.insert(new Sample(1_000, 1.0));
            metric.insert(new Sample(2_000, 2.0));
        }
        directory.close();

        directory = new H2TimeSeriesDirectory(config());
        try (ITimeSeriesMetric metric = directory.openOrCreate("cpu.load")) {
            assertThatThrownBy(() -> metric.insert(new Sample(2_000, 9.0)))
                .isInstanceOf(TimeSeriesStoreException.class);
            metric.insert(new Sample(3_000, 3.0));
        }

        assertThat(directory.readSamples("cpu.load")).extracting(Sample::timestamp)
            .containsExactly(1_000L, 2_000L, 3_000L);
        assertThat(directory.readSamples("cpu.load", 2_000, 3_000)).containsExactly(new Sample(2_000, 2.0));
    }

    @Test
    void metricsAreIsolated() {
        try (ITimeSeriesMetric a = directory.openOrCreate("a");
             ITimeSeriesMetric b = directory.openOrCreate("b")) {
            a.insert(new Sample(5_000, 1.0));
            b.insert(new Sample(1_000, 2.0));
        }

        assertThat(directory.readSamples("a")).containsExactly(new Sample(5_000, 1.0));
        assertThat(directory.count("a")).isEqualTo(1);
        assertThat(directory.count("unknown")).isZero();
        assertThat(directory.readSamples("b")).containsExactly(new Sample(1_000, 2.0));
    }
}
