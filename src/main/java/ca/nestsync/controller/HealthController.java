package ca.nestsync.controller;

import ca.nestsync.service.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Public health and info endpoints for load balancers and monitoring.
 *
 * {@code GET /health} answers 200 when every dependency check passes and 503 otherwise:
 * <pre>
 * {
 *   "status": "healthy",
 *   "service": "NestSync",
 *   "version": "1.0.0",
 *   "environment": "development",
 *   "timestamp": "2025-10-02T10:30:00Z",
 *   "checks": { "database": "healthy", "redis": "healthy" }
 * }
 * </pre>
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final HealthService healthService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = healthService.health();
        HttpStatus status = HealthService.HEALTHY.equals(health.get("status"))
                ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/api/info")
    public Map<String, Object> info() {
        return healthService.info();
    }
}
