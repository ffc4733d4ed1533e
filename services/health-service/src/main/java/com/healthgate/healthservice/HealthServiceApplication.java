package com.healthgate.healthservice;

import com.healthgate.healthservice.config.HealthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * HealthGate health service, a Spring Boot application that mounts the aggregated health
 * routes next to its own dependencies.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Full, liveness and readiness routes under {@code healthgate.health.base-path}
 *   <li>Readiness checks for the configured {@code DataSource}, Redis and HTTP dependencies
 *   <li>Correlation ID propagation into probe threads (HTTP filter + MDC)
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Actuator metrics and Prometheus endpoint
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(HealthProperties.class)
public class HealthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(HealthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HealthServiceApplication.class, args);
        log.info("HealthGate health service started successfully");
    }
}
