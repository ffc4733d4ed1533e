package com.healthgate.healthservice.config;

import com.healthgate.health.CheckKind;
import com.healthgate.health.HealthCheck;
import com.healthgate.health.HealthCheckerBuilder;
import com.healthgate.probes.HealthChecks;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.web.client.RestClient;

/**
 * Decides which checks this service registers.
 *
 * <ul>
 *   <li>{@value #PROCESS_CHECK} (liveness): always
 *   <li>{@value #DATABASE_CHECK} (readiness): when a {@link DataSource} is available
 *   <li>{@value #CACHE_CHECK} (readiness): when a {@link RedisConnectionFactory} is available
 *   <li>one check per entry of {@code healthgate.health.http}
 * </ul>
 *
 * <p>This is a POJO (no Spring annotations) so it can be exercised without a Spring context; the
 * backend handles are owned by the Spring context, never by the checks.
 */
public class HealthCheckRegistrar {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistrar.class);

    public static final String PROCESS_CHECK = "process";
    public static final String DATABASE_CHECK = "database";
    public static final String CACHE_CHECK = "cache";

    private final HealthProperties properties;

    public HealthCheckRegistrar(HealthProperties properties) {
        this.properties = properties;
    }

    /**
     * Registers the checks into the builder.
     *
     * @param builder checker builder
     * @param dataSource relational pool, or null when the service has none
     * @param redisConnectionFactory cache connection factory, or null when the service has none
     * @param restClient client for HTTP dependencies
     * @return the same builder
     */
    public HealthCheckerBuilder register(
            HealthCheckerBuilder builder,
            DataSource dataSource,
            RedisConnectionFactory redisConnectionFactory,
            RestClient restClient) {
        add(builder, PROCESS_CHECK, CheckKind.LIVENESS, HealthChecks.alive());
        if (dataSource != null) {
            add(builder, DATABASE_CHECK, CheckKind.READINESS, HealthChecks.jdbc(dataSource));
        }
        if (redisConnectionFactory != null) {
            add(builder, CACHE_CHECK, CheckKind.READINESS, HealthChecks.redis(redisConnectionFactory));
        }
        for (Map.Entry<String, HealthProperties.HttpDependency> entry :
                properties.http().entrySet().stream().sorted(Map.Entry.comparingByKey()).toList()) {
            HealthProperties.HttpDependency dependency = entry.getValue();
            add(builder, entry.getKey(), dependency.kind(),
                    HealthChecks.http(restClient, dependency.url(), dependency.expectedStatus()));
        }
        return builder;
    }

    private void add(HealthCheckerBuilder builder, String name, CheckKind kind, HealthCheck check) {
        builder.add(name, kind, properties.timeoutFor(name), check);
        log.info("Registered health check '{}' ({})", name, kind);
    }
}
