package org.htaimport.cli.probe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import org.htaimport.datapipeline.api.resources.source.ISourceReader;
import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;
import org.htaimport.datapipeline.api.resources.source.ValueRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class SourceProbeServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ISourceReader source;

    private SourceProbeService service;

    @BeforeEach
    void setUp() {
        service = new SourceProbeService(source);
    }

    private void givenStats(Instant newest, long count, long intervalMs) throws Exception {
        long max = newest.toEpochMilli();
        long min = max - count * intervalMs;
        when(source.queryRangeStats("cpu_load")).thenReturn(new SourceRangeStats(min, max, count));
    }

    @Test
    void healthyMetricHasNoFindings() throws Exception {
        givenStats(NOW.minusSeconds(60), 3_600, 1_000);

        ProbeReport report = service.probe("cpu_load", 1.0, Duration.ofHours(8), false, NOW);

        assertThat(report.isSuspicious()).isFalse();
        assertThat(report.valueRange()).isNull();
        assertThat(report.stats().count()).isEqualTo(3_600);
        verify(source, never()).queryValueRange(anyString());
    }

    @Test
    void staleMetricIsFlagged() throws Exception {
        givenStats(NOW.minus(Duration.ofHours(9)), 100, 1_000);

        ProbeReport report = service.probe("cpu_load", 1.0, Duration.ofHours(8), false, NOW);

        assertThat(report.findings()).singleElement().asString().startsWith("suspicious max time");
    }

    @Test
    void futureTimestampIsFlagged() throws Exception {
        givenStats(NOW.plusSeconds(10), 100, 1_000);

        ProbeReport report = service.probe("cpu_load", null, Duration.ofHours(8), false, NOW);

        assertThat(report.isSuspicious()).isTrue();
    }

    @Test
    void disabledAgeCheckIgnoresStaleData() throws Exception {
        givenStats(NOW.minus(Duration.ofDays(300)), 100, 1_000);

        ProbeReport report = service.probe("cpu_load", 1.0, null, false, NOW);

        assertThat(report.isSuspicious()).isFalse();
    }

    @Test
    void intervalOutsideToleranceIsFlagged() throws Exception {
        givenStats(NOW.minusSeconds(1), 100, 2_000);

        ProbeReport report = service.probe("cpu_load", 1.0, null, false, NOW);

        assertThat(report.findings()).singleElement().asString().startsWith("suspicious interval");
    }

    @Test
    void intervalCheckHonoursSamplingRate() throws Exception {
        givenStats(NOW.minusSeconds(1), 100, 100);

        assertThat(service.probe("cpu_load", 10.0, null, false, NOW).isSuspicious()).isFalse();
        assertThat(service.probe("cpu_load", 1.0, null, false, NOW).isSuspicious()).isTrue();
    }

    @Test
    void valueRangeIsCheckedOnRequest() throws Exception {
        givenStats(NOW.minusSeconds(1), 100, 1_000);
        when(source.queryValueRange("cpu_load")).thenReturn(new ValueRange(-2e9, 5.0));

        ProbeReport report = service.probe("cpu_load", null, null, true, NOW);

        assertThat(report.valueRange()).isEqualTo(new ValueRange(-2e9, 5.0));
        assertThat(report.findings()).singleElement().asString().startsWith("suspicious value range");
    }

    @Test
    void constantValuesAreFlagged() throws Exception {
        givenStats(NOW.minusSeconds(1), 100, 1_000);
        when(source.queryValueRange("cpu_load")).thenReturn(new ValueRange(3.0, 3.0));

        assertThat(service.probe("cpu_load", null, null, true, NOW).isSuspicious()).isTrue();
    }
}
