package com.healthgate.health;

/**
 * A rendered report: the HTTP status code and the body to serialize.
 *
 * @param httpStatus 200 or 503
 * @param body       structured body, always well-formed
 */
public record HealthResponse(int httpStatus, HealthResponseBody body) {

    public static final int OK = 200;

    public static final int SERVICE_UNAVAILABLE = 503;

    public HealthResponse {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
    }

    public boolean isAvailable() {
        return httpStatus == OK;
    }
}
