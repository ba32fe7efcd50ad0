package org.whiteelephant.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.service.play.stream.PlayEventNotifier;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Santé du process : base joignable et listener de notifications vivant.
 * Un notifier en échec dégrade le temps réel sans casser les actions de jeu.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final JdbcTemplate jdbc;
    private final PlayEventNotifier notifier;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean dbUp = pingDatabase();
        PlayEventNotifier.Status notifierStatus = notifier.getStatus();
        boolean healthy = dbUp && notifierStatus == PlayEventNotifier.Status.RUNNING;

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", healthy ? "Healthy" : "Degraded");
        out.put("database", dbUp ? "UP" : "DOWN");
        out.put("notifier", notifierStatus.name());
        if (notifier.getLastFailure() != null) out.put("notifierError", notifier.getLastFailure());
        out.put("notifierRestarts", notifier.restartCount());
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(out);
    }

    private boolean pingDatabase() {
        try {
            Integer one = jdbc.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Health check: database unreachable: {}", e.getMessage());
            return false;
        }
    }
}
