/**
 * =============================================================================
 * HEALTH CONTROLLER
 * =============================================================================
 * Root banner plus health check endpoints for Kubernetes/Docker orchestration.
 * =============================================================================
 */
package com.example.usersapi.controller;

import com.example.usersapi.response.ApiResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);
    private static final String SERVICE_NAME = "users-api";

    private final DataSource dataSource;
    private final String version;

    public HealthController(DataSource dataSource, @Value("${app.version:0.1.0}") String version) {
        this.dataSource = dataSource;
        this.version = version;
    }

    @GetMapping("/")
    public ResponseEntity<ApiResponse<Map<String, Object>>> root() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", SERVICE_NAME);
        info.put("version", version);
        return ResponseEntity.ok(ApiResponse.success("Users API is running!", info));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", SERVICE_NAME);
        response.put("version", version);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        Map<String, Object> response = new LinkedHashMap<>();
        Map<String, Boolean> checks = new LinkedHashMap<>();

        boolean dbHealthy = false;
        try (Connection conn = dataSource.getConnection()) {
            dbHealthy = conn.isValid(5);
        } catch (SQLException e) {
            logger.warn("Readiness check - database unavailable: {}", e.getMessage());
        }
        checks.put("database", dbHealthy);

        response.put("status", dbHealthy ? "ready" : "not_ready");
        response.put("checks", checks);

        if (dbHealthy) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
