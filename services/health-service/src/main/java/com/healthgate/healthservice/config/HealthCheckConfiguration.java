package com.healthgate.healthservice.config;

import com.healthgate.health.HealthChecker;
import com.healthgate.health.HealthCheckerBuilder;
import com.healthgate.health.HealthEndpoint;
import com.healthgate.health.HealthReporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Builds the single {@link HealthChecker} of this service and the {@link HealthEndpoint} that
 * the routes render through.
 *
 * <p>The checker is an explicitly constructed, immutable bean. Backend handles are optional:
 * a service without a database or cache simply registers fewer checks.
 */
@Configuration
public class HealthCheckConfiguration {

    /**
     * Pool the checks run on, separate from request threads.
     *
     * <p>The pool never queues: a check either starts on an idle or fresh thread right away or is
     * rejected once {@code probeMaxPoolSize} threads are busy. A per-check timeout starts counting
     * at launch, so a queued check would spend its budget waiting behind checks stuck on a hung
     * backend.
     */
    @Bean
    public ThreadPoolTaskExecutor healthProbeExecutor(HealthProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("health-probe-");
        executor.setCorePoolSize(properties.probePoolSize());
        executor.setMaxPoolSize(properties.probeMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setDaemon(true);
        return executor;
    }

    @Bean
    public HealthChecker healthChecker(
            HealthProperties properties,
            ThreadPoolTaskExecutor healthProbeExecutor,
            ObjectProvider<DataSource> dataSource,
            ObjectProvider<RedisConnectionFactory> redisConnectionFactory,
            ObjectProvider<MeterRegistry> meterRegistry,
            ObjectProvider<Tracer> tracer,
            RestClient.Builder restClientBuilder) {
        HealthCheckerBuilder builder = HealthChecker.builder().executor(healthProbeExecutor);
        meterRegistry.ifAvailable(builder::meterRegistry);
        tracer.ifAvailable(builder::tracer);

        new HealthCheckRegistrar(properties).register(
                builder,
                dataSource.getIfAvailable(),
                redisConnectionFactory.getIfAvailable(),
                restClientBuilder.build());
        return builder.build(properties.toCheckerConfig());
    }

    @Bean
    public HealthEndpoint aggregatedHealthEndpoint(HealthChecker healthChecker, HealthProperties properties) {
        return new HealthEndpoint(
                healthChecker, new HealthReporter(properties.serviceName(), properties.serviceVersion()));
    }
}
