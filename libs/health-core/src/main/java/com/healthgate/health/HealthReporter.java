package com.healthgate.health;

import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link HealthReport} into a {@link HealthResponse} for one {@link ReportMode}.
 * Pure transform; keeps nothing between calls.
 */
public final class HealthReporter {

    private final String serviceName;
    private final String serviceVersion;

    /**
     * @param serviceName    name reported in every body
     * @param serviceVersion version reported in every body (nullable)
     */
    public HealthReporter(String serviceName, String serviceVersion) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.serviceName = serviceName;
        this.serviceVersion = serviceVersion;
    }

    public HealthResponse render(HealthReport report, ReportMode mode) {
        if (report == null) {
            throw new IllegalArgumentException("report must not be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        List<HealthResponseBody.CheckEntry> entries = report.outcomes().stream()
                .map(HealthReporter::toEntry)
                .toList();
        var body = new HealthResponseBody(
                lower(report.status()),
                serviceName,
                serviceVersion,
                report.generatedAt().toString(),
                entries);
        return new HealthResponse(mode.httpStatus(report.status()), body);
    }

    private static HealthResponseBody.CheckEntry toEntry(CheckOutcome outcome) {
        boolean healthy = outcome.status() == CheckStatus.HEALTHY;
        return new HealthResponseBody.CheckEntry(
                outcome.name(),
                lower(outcome.kind()),
                lower(outcome.status()),
                outcome.reason(),
                healthy ? outcome.message() : null,
                outcome.latencyMs());
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
