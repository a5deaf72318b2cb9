package com.alfacon.weather.config;

import com.alfacon.weather.model.ConnectivityReport;
import com.alfacon.weather.model.RunSummary;
import com.alfacon.weather.output.LatestRunHolder;
import com.alfacon.weather.scheduler.RelayScheduler;
import com.alfacon.weather.service.ConnectivityCheckService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class RelayController {

    private final RelayScheduler scheduler;
    private final LatestRunHolder latestRunHolder;
    private final ConnectivityCheckService connectivityCheck;

    // ── Run triggers ──────────────────────────────────────────────────────────

    @PostMapping("/relay/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (!scheduler.triggerInBackground()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "busy"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    // ── Status ────────────────────────────────────────────────────────────────

    /**
     * Most recent run summary.
     *
     * GET /relay/status -> 200 with the summary, 204 before the first run.
     */
    @GetMapping("/relay/status")
    public ResponseEntity<RunSummary> status() {
        return latestRunHolder.latest()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Live check of platform token, sample device reachability and the weather API.
     */
    @GetMapping("/relay/connectivity")
    public ResponseEntity<?> connectivity() {
        try {
            ConnectivityReport report = connectivityCheck.check();
            return ResponseEntity.ok(report);
        } catch (RelayConfigurationException e) {
            log.error("Connectivity check refused: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Connectivity check failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
