package org.htaimport.datapipeline.resources.timeseries;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.htaimport.datapipeline.api.resources.timeseries.ITimeSeriesDirectory;
import org.htaimport.datapipeline.api.resources.timeseries.ITimeSeriesMetric;
import org.htaimport.datapipeline.api.resources.timeseries.MetricSettings;
import org.htaimport.datapipeline.api.resources.timeseries.Sample;
import org.htaimport.datapipeline.api.resources.timeseries.TimeSeriesStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Time-series directory backed by an H2 database, using HikariCP for connection pooling.
 * <p>
 * Metrics are registered in {@code hta_metrics} together with their aggregation settings,
 * points are appended to {@code hta_samples}. Every open metric gets a dedicated connection
 * with auto-commit disabled, so {@link ITimeSeriesMetric#flush()} maps to a commit.
 * <p>
 * Configuration (the {@code destination} block):
 * <pre>
 * destination {
 *   jdbcUrl = "jdbc:h2:file:./data/hta"
 *   username = "sa"
 *   password = ""
 *   maxPoolSize = 4
 *   batchSize = 10000
 *   defaults { mode = "RW", intervalMin = 40000000000, intervalFactor = 10 }
 *   metrics = [ { name = "cpu.load", intervalFactor = 4 } ]
 * }
 * </pre>
 */
public class H2TimeSeriesDirectory implements ITimeSeriesDirectory {

    private static final Logger log = LoggerFactory.getLogger(H2TimeSeriesDirectory.class);

    private final HikariDataSource dataSource;
    private final Config defaults;
    private final Map<String, Config> metricConfigs = new HashMap<>();
    private final Set<String> openMetrics = ConcurrentHashMap.newKeySet();
    private final int batchSize;

    public H2TimeSeriesDirectory(Config options) {
        final String jdbcUrl = options.getString("jdbcUrl");
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        this.batchSize = options.hasPath("batchSize") ? options.getInt("batchSize") : 10_000;
        this.defaults = options.hasPath("defaults")
            ? options.getConfig("defaults")
            : ConfigFactory.parseString("mode = RW, intervalMin = 40000000000, intervalFactor = 10");
        if (options.hasPath("metrics")) {
            for (Config entry : options.getConfigList("metrics")) {
                metricConfigs.put(entry.getString("name"), entry);
            }
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName("hta-destination");

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                throw new TimeSeriesStoreException(String.format(
                    "Cannot open destination store: file already in use by another process. URL=%s", jdbcUrl), e);
            }
            throw new TimeSeriesStoreException(String.format(
                "Failed to initialize destination store %s: %s: %s", jdbcUrl, cause.getClass().getSimpleName(), causeMsg), e);
        }

        createTables();
        log.debug("Destination store {} ready (pool max={}, batchSize={})",
            jdbcUrl, hikariConfig.getMaximumPoolSize(), batchSize);
    }

    private void createTables() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS hta_metrics ("
                + "name VARCHAR(255) PRIMARY KEY, "
                + "mode VARCHAR(2) NOT NULL, "
                + "interval_min BIGINT NOT NULL, "
                + "interval_max BIGINT NOT NULL, "
                + "interval_factor INT NOT NULL)");
            stmt.execute("CREATE TABLE IF NOT EXISTS hta_samples ("
                + "metric VARCHAR(255) NOT NULL, "
                + "time_ns BIGINT NOT NULL, "
                + "sample_value DOUBLE PRECISION NOT NULL, "
                + "PRIMARY KEY (metric, time_ns))");
        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to create destination tables: " + e.getMessage(), e);
        }
    }

    @Override
    public ITimeSeriesMetric openOrCreate(String name) {
        if (!openMetrics.add(name)) {
            throw new TimeSeriesStoreException("Metric " + name + " is already open for writing");
        }
        try {
            MetricSettings settings = registerIfAbsent(name);
            if (!settings.isWritable()) {
                throw new TimeSeriesStoreException("Metric " + name + " is read-only (mode " + settings.mode() + ")");
            }

            Connection connection = dataSource.getConnection();
            try {
                connection.setAutoCommit(false);
                long lastTime = queryLastTime(connection, name);
                return new H2TimeSeriesMetric(settings, connection, lastTime, batchSize, () -> openMetrics.remove(name));
            } catch (SQLException | RuntimeException e) {
                connection.close();
                throw e;
            }
        } catch (SQLException e) {
            openMetrics.remove(name);
            throw new TimeSeriesStoreException("Failed to open metric " + name + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            openMetrics.remove(name);
            throw e;
        }
    }

    private MetricSettings registerIfAbsent(String name) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            Optional<MetricSettings> existing = readSettings(conn, name);
            if (existing.isPresent()) {
                return existing.get();
            }

            MetricSettings settings = MetricSettings.fromConfig(name,
                metricConfigs.getOrDefault(name, ConfigFactory.empty()), defaults);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO hta_metrics (name, mode, interval_min, interval_max, interval_factor) VALUES (?, ?, ?, ?, ?)")) {
                stmt.setString(1, settings.name());
                stmt.setString(2, settings.mode());
                stmt.setLong(3, settings.intervalMin());
                stmt.setLong(4, settings.intervalMax());
                stmt.setInt(5, settings.intervalFactor());
                stmt.executeUpdate();
            }
            log.info("Created metric {} (intervalMin={}, intervalMax={}, intervalFactor={})",
                name, settings.intervalMin(), settings.intervalMax(), settings.intervalFactor());
            return settings;
        }
    }

    private Optional<MetricSettings> readSettings(Connection conn, String name) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT mode, interval_min, interval_max, interval_factor FROM hta_metrics WHERE name = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new MetricSettings(name, rs.getString(1), rs.getLong(2), rs.getLong(3), rs.getInt(4)));
            }
        }
    }

    private long queryLastTime(Connection conn, String name) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT MAX(time_ns) FROM hta_samples WHERE metric = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long last = rs.getLong(1);
                return rs.wasNull() ? Long.MIN_VALUE : last;
            }
        }
    }

    /**
     * Returns the registered settings of a metric.
     *
     * @param name metric name
     * @return the settings, or empty if the metric was never created
     */
    public Optional<MetricSettings> getSettings(String name) {
        try (Connection conn = dataSource.getConnection()) {
            return readSettings(conn, name);
        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to read settings of metric " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads the flushed samples of a metric in {@code [fromInclusive, toExclusive)}, ascending.
     *
     * @param name          metric name
     * @param fromInclusive lower bound in ns
     * @param toExclusive   upper bound in ns
     * @return the samples
     */
    public List<Sample> readSamples(String name, long fromInclusive, long toExclusive) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT time_ns, sample_value FROM hta_samples WHERE metric = ? AND time_ns >= ? AND time_ns < ? ORDER BY time_ns")) {
            stmt.setString(1, name);
            stmt.setLong(2, fromInclusive);
            stmt.setLong(3, toExclusive);
            List<Sample> samples = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    samples.add(new Sample(rs.getLong(1), rs.getDouble(2)));
                }
            }
            return samples;
        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to read samples of metric " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads all flushed samples of a metric, ascending.
     *
     * @param name metric name
     * @return the samples
     */
    public List<Sample> readSamples(String name) {
        return readSamples(name, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    /**
     * Counts the flushed samples of a metric.
     *
     * @param name metric name
     * @return number of stored samples, 0 for an unknown metric
     */
    public long count(String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM hta_samples WHERE metric = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to count samples of metric " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!openMetrics.isEmpty()) {
            log.warn("Closing destination store with open metrics: {}", openMetrics);
        }
        if (!dataSource.isClosed()) {
            dataSource.close();
        }
    }
}
