package com.flagship.token_ledger.health;

import com.flagship.token_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness and readiness endpoint.
 *
 * Reports DOWN (503) when the ledger store is unreachable, since no ledger call can
 * succeed without it. Otherwise reports whether the ledger has been created yet.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final LedgerService ledgerService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());

        if (!storeReachable()) {
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        body.put("status", "UP");
        body.put("database", "UP");
        body.put("ledger", ledgerService.isCreated() ? "CREATED" : "NOT_CREATED");
        return ResponseEntity.ok(body);
    }

    private boolean storeReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Ledger store unreachable: {}", e.getMessage());
            return false;
        }
    }
}
