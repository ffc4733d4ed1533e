package com.healthgate.probes;

import com.healthgate.health.ProbeResult;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import javax.sql.DataSource;

/**
 * Relational store probe: borrows one connection from the pool, runs a validation query
 * ({@code SELECT 1} by default) and gives the connection back.
 * <p>
 * The pool is owned by the caller; this check never closes the {@link DataSource}.
 */
public final class JdbcHealthCheck extends BlockingHealthCheck {

    /** Default validation query. */
    public static final String DEFAULT_VALIDATION_QUERY = "SELECT 1";

    /** Default JDBC query timeout (2 seconds). */
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(2);

    private final DataSource dataSource;
    private final String validationQuery;
    private final Duration queryTimeout;

    public JdbcHealthCheck(DataSource dataSource) {
        this(dataSource, DEFAULT_VALIDATION_QUERY, DEFAULT_QUERY_TIMEOUT);
    }

    /**
     * @param dataSource      pool to borrow the connection from
     * @param validationQuery read-only query that returns at least one row
     * @param queryTimeout    driver-side statement timeout, rounded up to whole seconds
     */
    public JdbcHealthCheck(DataSource dataSource, String validationQuery, Duration queryTimeout) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (validationQuery == null || validationQuery.isBlank()) {
            throw new IllegalArgumentException("validationQuery must not be null or blank");
        }
        if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("queryTimeout must be positive");
        }
        this.dataSource = dataSource;
        this.validationQuery = validationQuery;
        this.queryTimeout = queryTimeout;
    }

    @Override
    protected ProbeResult probe() {
        try (Connection connection = dataSource.getConnection()) {
            return validate(connection);
        } catch (SQLException e) {
            return ProbeResult.unhealthy("connection failed: " + describe(e));
        }
    }

    private ProbeResult validate(Connection connection) {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(timeoutSeconds());
            try (ResultSet rows = statement.executeQuery(validationQuery)) {
                return rows.next()
                        ? ProbeResult.healthy()
                        : ProbeResult.unhealthy("validation query returned no rows");
            }
        } catch (SQLException e) {
            return ProbeResult.unhealthy("query failed: " + describe(e));
        }
    }

    private int timeoutSeconds() {
        long seconds = queryTimeout.toSeconds();
        if (queryTimeout.toNanosPart() > 0 || seconds == 0) {
            seconds++;
        }
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }

    public String validationQuery() {
        return validationQuery;
    }
}
