package com.sparagne.budget_ledger.health;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
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
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 *
 * The database is only checked when the JPA store is active; the in-memory
 * store has nothing to probe.
 */
@RestController
public class HealthController {

    private final ObjectProvider<DataSource> dataSource;
    private final String storeType;

    public HealthController(ObjectProvider<DataSource> dataSource,
                            @Value("${ledger.store:jpa}") String storeType) {
        this.dataSource = dataSource;
        this.storeType = storeType;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("store", storeType);

        if (!"jpa".equals(storeType)) {
            return ResponseEntity.ok(response);
        }

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        DataSource source = dataSource.getIfAvailable();
        if (source == null) {
            return false;
        }
        try (Connection connection = source.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
