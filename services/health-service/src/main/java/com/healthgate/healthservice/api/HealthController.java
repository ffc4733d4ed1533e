package com.healthgate.healthservice.api;

import com.healthgate.health.HealthEndpoint;
import com.healthgate.health.HealthResponse;
import com.healthgate.health.HealthResponseBody;
import com.healthgate.health.ReportMode;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The three health routes. Each call is a fresh point-in-time sample of the shared checker.
 *
 * <ul>
 *   <li>{@code GET {base}}: every check; 503 only when unhealthy
 *   <li>{@code GET {base}/live}: liveness checks; for process supervisors
 *   <li>{@code GET {base}/ready}: readiness checks; for traffic routers
 * </ul>
 *
 * <p>Bodies are well-formed reports for every status code, including 503.
 */
@RestController
@RequestMapping(
        path = "${healthgate.health.base-path:/health}",
        produces = MediaType.APPLICATION_JSON_VALUE)
public class HealthController {

    private final HealthEndpoint endpoint;

    public HealthController(HealthEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    @GetMapping
    public ResponseEntity<HealthResponseBody> full() {
        return toEntity(endpoint.respond(ReportMode.FULL));
    }

    @GetMapping("/live")
    public ResponseEntity<HealthResponseBody> liveness() {
        return toEntity(endpoint.respond(ReportMode.LIVENESS));
    }

    @GetMapping("/ready")
    public ResponseEntity<HealthResponseBody> readiness() {
        return toEntity(endpoint.respond(ReportMode.READINESS));
    }

    private static ResponseEntity<HealthResponseBody> toEntity(HealthResponse response) {
        return ResponseEntity.status(response.httpStatus())
                .cacheControl(CacheControl.noStore())
                .body(response.body());
    }
}
