package org.htaimport.datapipeline.resources.timeseries;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import org.htaimport.datapipeline.api.resources.timeseries.ITimeSeriesMetric;
import org.htaimport.datapipeline.api.resources.timeseries.MetricSettings;
import org.htaimport.datapipeline.api.resources.timeseries.Sample;
import org.htaimport.datapipeline.api.resources.timeseries.TimeSeriesStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write handle on one metric of an {@link H2TimeSeriesDirectory}.
 * <p>
 * Holds a dedicated connection with auto-commit disabled. Inserts are added to a JDBC
 * batch that is executed every {@code batchSize} rows; nothing becomes visible to other
 * connections before {@link #flush()} commits.
 */
public class H2TimeSeriesMetric implements ITimeSeriesMetric {

    private static final Logger log = LoggerFactory.getLogger(H2TimeSeriesMetric.class);

    private final MetricSettings settings;
    private final Connection connection;
    private final PreparedStatement insertStmt;
    private final int batchSize;
    private final Runnable onClose;

    private long lastTime;
    private int batched = 0;
    private long pending = 0;
    private boolean closed = false;

    H2TimeSeriesMetric(MetricSettings settings, Connection connection, long lastTime,
                       int batchSize, Runnable onClose) throws SQLException {
        this.settings = settings;
        this.connection = connection;
        this.lastTime = lastTime;
        this.batchSize = batchSize;
        this.onClose = onClose;
        this.insertStmt = connection.prepareStatement(
            "INSERT INTO hta_samples (metric, time_ns, sample_value) VALUES (?, ?, ?)");
    }

    @Override
    public String getName() {
        return settings.name();
    }

    public MetricSettings getSettings() {
        return settings;
    }

    @Override
    public void insert(Sample sample) {
        ensureNotClosed();
        if (sample.timestamp() <= lastTime) {
            throw new TimeSeriesStoreException(String.format(
                "Non-monotonic insert into metric %s: %d is not after %d", settings.name(), sample.timestamp(), lastTime));
        }
        try {
            insertStmt.setString(1, settings.name());
            insertStmt.setLong(2, sample.timestamp());
            insertStmt.setDouble(3, sample.value());
            insertStmt.addBatch();
            batched++;
            pending++;
            if (batched >= batchSize) {
                insertStmt.executeBatch();
                batched = 0;
            }
        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to insert into metric " + settings.name() + ": " + e.getMessage(), e);
        }
        lastTime = sample.timestamp();
    }

    @Override
    public void flush() {
        ensureNotClosed();
        try {
            if (batched > 0) {
                insertStmt.executeBatch();
                batched = 0;
            }
            connection.commit();
        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to flush metric " + settings.name() + ": " + e.getMessage(), e);
        }
        if (pending > 0) {
            log.debug("Flushed {} samples to metric {}", pending, settings.name());
        }
        pending = 0;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            flush();
        } finally {
            closed = true;
            try {
                insertStmt.close();
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to release connection of metric {}: {}", settings.name(), e.getMessage());
            }
            onClose.run();
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Metric " + settings.name() + " is closed");
        }
    }
}
