package com.healthgate.probes;

import com.healthgate.health.ProbeResult;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;

/**
 * Downstream HTTP probe: one {@code GET} to the dependency's health URL, healthy when the
 * response status equals the expected status. The response body is ignored.
 */
public final class HttpHealthCheck extends BlockingHealthCheck {

    private final RestClient restClient;
    private final URI uri;
    private final int expectedStatus;

    /**
     * @param restClient     shared client, configured with connect/read timeouts by the caller
     * @param uri            absolute URL to probe
     * @param expectedStatus status code that counts as healthy (usually 200)
     */
    public HttpHealthCheck(RestClient restClient, URI uri, int expectedStatus) {
        if (restClient == null) {
            throw new IllegalArgumentException("restClient must not be null");
        }
        if (uri == null || !uri.isAbsolute()) {
            throw new IllegalArgumentException("uri must be an absolute URI");
        }
        if (expectedStatus < 100 || expectedStatus > 599) {
            throw new IllegalArgumentException("expectedStatus must be a valid HTTP status code");
        }
        this.restClient = restClient;
        this.uri = uri;
        this.expectedStatus = expectedStatus;
    }

    @Override
    protected ProbeResult probe() {
        HttpStatusCode status;
        try {
            status = restClient.get()
                    .uri(uri)
                    .exchange((request, response) -> response.getStatusCode());
        } catch (RestClientException e) {
            return ProbeResult.unhealthy("request failed: " + describe(e.getMostSpecificCause()));
        }
        if (status.value() == expectedStatus) {
            return ProbeResult.healthy("HTTP " + status.value() + " OK");
        }
        return ProbeResult.unhealthy("expected status " + expectedStatus + ", got " + status.value());
    }

    public URI uri() {
        return uri;
    }
}
