package org.htaimport.datapipeline.resources.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.htaimport.datapipeline.api.resources.source.SourceQueryException;
import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;
import org.htaimport.datapipeline.api.resources.source.SourceRow;
import org.htaimport.datapipeline.api.resources.source.ValueRange;
import org.htaimport.test.utils.SourceDatabaseFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

/**
 * Integration tests for JdbcSourceReader against an in-memory H2 database.
 */
@Tag("integration")
class JdbcSourceReaderTest {

    private SourceDatabaseFixture fixture;
    private JdbcSourceReader reader;

    @BeforeEach
    void setUp() throws Exception {
        fixture = SourceDatabaseFixture.create();
        fixture.createMetric("cpu_load", 500, 100, 300, 200, 400);
        reader = JdbcSourceReader.connect(fixture.readerConfig());
    }

    @AfterEach
    void tearDown() {
        if (reader != null) {
            reader.close();
        }
    }

    @Test
    void queryRangeStats_returnsCountAndExtent() throws Exception {
        SourceRangeStats stats = reader.queryRangeStats("cpu_load");

        assertThat(stats).isEqualTo(new SourceRangeStats(100, 500, 5));
        assertThat(stats.averageInterval()).isEqualTo(80.0);
    }

    @Test
    void queryRangeStats_isRepeatable() throws Exception {
        assertThat(reader.queryRangeStats("cpu_load")).isEqualTo(reader.queryRangeStats("cpu_load"));
    }

    @Test
    void queryRangeStats_failsOnEmptyMetric() throws Exception {
        fixture.createMetric("empty_metric");

        assertThatThrownBy(() -> reader.queryRangeStats("empty_metric"))
            .isInstanceOf(SourceQueryException.class)
            .hasMessageContaining("no rows");
    }

    @Test
    void queryRangeStats_failsOnUnknownMetric() {
        assertThatThrownBy(() -> reader.queryRangeStats("does_not_exist"))
            .isInstanceOf(SourceQueryException.class)
            .hasMessageContaining("does_not_exist")
            .hasCauseInstanceOf(java.sql.SQLException.class);
    }

    @Test
    void queryRangeStats_rejectsMalformedIdentifier() {
        assertThatThrownBy(() -> reader.queryRangeStats("cpu\"; DROP TABLE x; --"))
            .isInstanceOf(SourceQueryException.class)
            .hasMessageContaining("Malformed identifier");
        assertThatThrownBy(() -> reader.queryRangeStats(" "))
            .isInstanceOf(SourceQueryException.class);
    }

    @Test
    void queryRange_returnsRowsInWindowAscending() throws Exception {
        List<SourceRow> rows = new ArrayList<>();

        long returned = reader.queryRange("cpu_load", 200, 500, 100, rows::add);

        assertThat(returned).isEqualTo(3);
        assertThat(rows).containsExactly(
            new SourceRow(200, 4.0),
            new SourceRow(300, 3.0),
            new SourceRow(400, 5.0));
    }

    @Test
    void queryRange_isTruncatedAtRowLimit() throws Exception {
        List<SourceRow> rows = new ArrayList<>();

        long returned = reader.queryRange("cpu_load", 0, 1_000, 2, rows::add);

        assertThat(returned).isEqualTo(2);
        assertThat(rows).extracting(SourceRow::timestampMillis).containsExactly(100L, 200L);
    }

    @Test
    void queryRange_emptyWindowReturnsNothing() throws Exception {
        List<SourceRow> rows = new ArrayList<>();

        assertThat(reader.queryRange("cpu_load", 101, 200, 10, rows::add)).isZero();
        assertThat(rows).isEmpty();
    }

    @Test
    void queryRange_wrapsHandlerFailure() {
        assertThatThrownBy(() -> reader.queryRange("cpu_load", 0, 1_000, 10, row -> {
                throw new java.io.IOException("disk full");
            }))
            .isInstanceOf(SourceQueryException.class)
            .hasMessageContaining("disk full");
    }

    @Test
    void queryValueRange_returnsMinAndMax() throws Exception {
        assertThat(reader.queryValueRange("cpu_load")).isEqualTo(new ValueRange(1.0, 5.0));
    }

    @Test
    void connect_failsWithoutMatchingDriver() {
        var config = ConfigFactory.parseString("""
            jdbcUrl = "jdbc:unknown-driver://localhost/db"
            user = "sa"
            password = ""
            """);

        assertThatThrownBy(() -> JdbcSourceReader.connect(config))
            .isInstanceOf(SourceQueryException.class)
            .hasMessageContaining("Failed to connect");
    }
}
