package com.acme.learnlite.health;

import com.acme.learnlite.db.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final SqlClient sql;

    @Value("${app.version:v1.0}")
    private String version;

    public HealthController(SqlClient sql) {
        this.sql = sql;
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp;
        try {
            databaseUp = !sql.query("SELECT 1 AS ok", List.of()).isEmpty();
        } catch (DataAccessException e) {
            log.warn("database health check failed: {}", e.getMessage());
            databaseUp = false;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", databaseUp);
        body.put("status", databaseUp ? "ok" : "degraded");
        body.put("database", databaseUp ? "up" : "down");
        body.put("version", version);
        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
