package com.healthgate.probes;

import com.healthgate.health.ProbeResult;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * Cache store probe: sends one {@code PING} over a connection from the shared
 * {@link RedisConnectionFactory} and expects {@code PONG}. Read-only; no keys are touched.
 */
public final class RedisHealthCheck extends BlockingHealthCheck {

    static final String PONG = "PONG";

    private final RedisConnectionFactory connectionFactory;

    public RedisHealthCheck(RedisConnectionFactory connectionFactory) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory must not be null");
        }
        this.connectionFactory = connectionFactory;
    }

    @Override
    protected ProbeResult probe() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            String reply = connection.ping();
            return PONG.equalsIgnoreCase(reply)
                    ? ProbeResult.healthy()
                    : ProbeResult.unhealthy("unexpected PING reply: " + reply);
        } catch (DataAccessException e) {
            return ProbeResult.unhealthy("connection failed: " + describe(e.getMostSpecificCause()));
        }
    }
}
