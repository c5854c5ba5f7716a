package com.myfinancehub.ledger.health;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated health endpoint. Reports DOWN with 503 when the ledger database does not answer.
 */
@RestController
public class HealthzController {

    private static final Logger log = LoggerFactory.getLogger(HealthzController.class);

    private final JdbcTemplate jdbcTemplate;

    public HealthzController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> healthz() {
        Map<String, String> body = new LinkedHashMap<>();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            body.put("status", "UP");
            body.put("storage", "UP");
            return ResponseEntity.ok(body);
        } catch (DataAccessException ex) {
            log.warn("Health check: storage probe failed: {}", ex.getMessage());
            body.put("status", "DOWN");
            body.put("storage", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
