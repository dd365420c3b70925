package com.volunteermedia.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness probes. Public, outside /api.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int DB_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;

    @GetMapping({"/health", "/healthz"})
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    /**
     * GET /ready
     *
     * 200 when the database answers, 503 otherwise.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, String>> ready() {
        Map<String, String> body = new LinkedHashMap<>();
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(DB_TIMEOUT_SECONDS)) {
                body.put("status", "ready");
                body.put("database", "ok");
                return ResponseEntity.ok(body);
            }
            log.warn("Readiness check failed: database connection is not valid");
        } catch (SQLException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
        }
        body.put("status", "not ready");
        body.put("database", "unavailable");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
