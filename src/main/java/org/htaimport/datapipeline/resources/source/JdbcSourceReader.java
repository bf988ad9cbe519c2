package org.htaimport.datapipeline.resources.source;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import org.htaimport.datapipeline.api.resources.CheckedConsumer;
import org.htaimport.datapipeline.api.resources.source.ISourceReader;
import org.htaimport.datapipeline.api.resources.source.SourceQueryException;
import org.htaimport.datapipeline.api.resources.source.SourceRangeStats;
import org.htaimport.datapipeline.api.resources.source.SourceRow;
import org.htaimport.datapipeline.api.resources.source.ValueRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * JDBC reader for a dataheap source database.
 * <p>
 * Opens one exclusive connection via {@link DriverManager} and keeps it for the whole
 * import run. There is no pooling: the importer issues exactly one query at a time.
 * <p>
 * Configuration (the {@code import} block):
 * <pre>
 * import {
 *   jdbcUrl = "jdbc:mysql://127.0.0.1:3306/db"
 *   user = "admin"
 *   password = "admin"
 *   identifierQuote = "`"
 *   fetchSize = 10000
 * }
 * </pre>
 */
public class JdbcSourceReader implements ISourceReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcSourceReader.class);

    private static final String TIMESTAMP_COLUMN = "timestamp";
    private static final String VALUE_COLUMN = "value";

    private final Connection connection;
    private final String quote;
    private final int fetchSize;
    private boolean closed = false;

    /**
     * Wraps an already open connection.
     *
     * @param connection      connection owned by this reader from now on
     * @param identifierQuote quote used around table and column names
     * @param fetchSize       JDBC fetch size hint, 0 leaves the driver default
     */
    public JdbcSourceReader(Connection connection, String identifierQuote, int fetchSize) {
        this.connection = connection;
        this.quote = identifierQuote;
        this.fetchSize = fetchSize;
    }

    /**
     * Connects to the source described by the {@code import} config block.
     *
     * @param options the {@code import} config block
     * @return a connected reader
     * @throws SourceQueryException if the connection cannot be established
     */
    public static JdbcSourceReader connect(Config options) throws SourceQueryException {
        final String jdbcUrl = options.getString("jdbcUrl");
        final String user = options.getString("user");
        final String password = options.getString("password");
        final String identifierQuote = options.hasPath("identifierQuote") ? options.getString("identifierQuote") : "`";
        final int fetchSize = options.hasPath("fetchSize") ? options.getInt("fetchSize") : 0;

        try {
            Connection connection = DriverManager.getConnection(jdbcUrl, user, password);
            log.debug("Connected to source database {} as {}", jdbcUrl, user);
            return new JdbcSourceReader(connection, identifierQuote, fetchSize);
        } catch (SQLException e) {
            throw new SourceQueryException(null,
                String.format("Failed to connect to source database %s as %s: %s", jdbcUrl, user, e.getMessage()), e);
        }
    }

    @Override
    public SourceRangeStats queryRangeStats(String metric) throws SourceQueryException {
        ensureNotClosed();
        final String ts = quoteIdentifier(metric, TIMESTAMP_COLUMN);
        final String sql = "SELECT COUNT(" + ts + "), MIN(" + ts + "), MAX(" + ts + ") FROM "
            + quoteIdentifier(metric, metric);

        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new SourceQueryException(metric, "Aggregate query returned no row for metric " + metric);
            }
            long count = rs.getLong(1);
            if (count == 0) {
                throw new SourceQueryException(metric, "Metric " + metric + " has no rows");
            }
            return new SourceRangeStats(rs.getLong(2), rs.getLong(3), count);
        } catch (SQLException e) {
            throw new SourceQueryException(metric,
                "Failed to query range stats of metric " + metric + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long queryRange(String metric, long lowerInclusive, long upperExclusive, long rowLimit,
                           CheckedConsumer<SourceRow> handler) throws SourceQueryException {
        ensureNotClosed();
        final String ts = quoteIdentifier(metric, TIMESTAMP_COLUMN);
        final String sql = "SELECT " + ts + ", " + quoteIdentifier(metric, VALUE_COLUMN)
            + " FROM " + quoteIdentifier(metric, metric)
            + " WHERE " + ts + " >= ? AND " + ts + " < ?"
            + " ORDER BY " + ts + " ASC LIMIT ?";

        long rows = 0;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, lowerInclusive);
            stmt.setLong(2, upperExclusive);
            stmt.setLong(3, rowLimit);
            if (fetchSize > 0) {
                stmt.setFetchSize(fetchSize);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    handler.accept(new SourceRow(rs.getLong(1), rs.getDouble(2)));
                    rows++;
                }
            }
        } catch (SourceQueryException e) {
            throw e;
        } catch (SQLException e) {
            throw new SourceQueryException(metric,
                String.format("Range query [%d, %d) on metric %s failed: %s",
                    lowerInclusive, upperExclusive, metric, e.getMessage()), e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new SourceQueryException(metric,
                String.format("Processing rows of [%d, %d) on metric %s failed: %s",
                    lowerInclusive, upperExclusive, metric, e.getMessage()), e);
        }
        return rows;
    }

    @Override
    public ValueRange queryValueRange(String metric) throws SourceQueryException {
        ensureNotClosed();
        final String value = quoteIdentifier(metric, VALUE_COLUMN);
        final String sql = "SELECT COUNT(" + value + "), MIN(" + value + "), MAX(" + value + ") FROM "
            + quoteIdentifier(metric, metric);

        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next() || rs.getLong(1) == 0) {
                throw new SourceQueryException(metric, "Metric " + metric + " has no rows");
            }
            return new ValueRange(rs.getDouble(2), rs.getDouble(3));
        } catch (SQLException e) {
            throw new SourceQueryException(metric,
                "Failed to query value range of metric " + metric + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close source connection: {}", e.getMessage());
        }
    }

    private String quoteIdentifier(String metric, String identifier) throws SourceQueryException {
        if (identifier == null || identifier.isBlank()) {
            throw new SourceQueryException(metric, "Metric name must not be blank");
        }
        if (!quote.isEmpty() && identifier.contains(quote)) {
            throw new SourceQueryException(metric, "Malformed identifier: " + identifier);
        }
        return quote + identifier + quote;
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Source reader is closed");
        }
    }
}
