package com.owldoor.geocoder.config;

import com.owldoor.geocoder.exception.ConfigurationException;
import com.owldoor.geocoder.model.GeocodeJob;
import com.owldoor.geocoder.service.BatchProcessor;
import com.owldoor.geocoder.service.provider.GeocodingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class GeocodeController {

    private final BatchProcessor batchProcessor;

    // ── Job triggers ──────────────────────────────────────────────────────────

    /**
     * Start a geocoding run in the background.
     *
     * POST /geocode/jobs
     * {"input":"agents.csv","output":"out.csv","provider":"mapbox","apiKey":"...",
     *  "columns":{"addressColumn":"full_address"},"resume":true,"chunkSize":1000}
     */
    @PostMapping("/geocode/jobs")
    public ResponseEntity<Map<String, String>> submit(@RequestBody GeocodeJob job) {
        if (batchProcessor.isBusy()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A run is already in progress"));
        }
        try {
            GeocodingProvider provider = GeocodingProvider.fromId(job.getProvider());
            if (provider.isKeyRequired() && (job.getApiKey() == null || job.getApiKey().isBlank())) {
                throw new ConfigurationException("An API key is required for provider '" + provider.getId() + "'");
            }
        } catch (ConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        if (!batchProcessor.start(job, task -> new Thread(task, "geocode-run").start())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A run is already in progress"));
        }
        log.info("Accepted geocoding job for {}", job.getInput());
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "input", String.valueOf(job.getInput())));
    }

    @GetMapping("/geocode/status")
    public ResponseEntity<?> status() {
        return batchProcessor.getLastRun()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of("state", batchProcessor.getState())));
    }

    @GetMapping("/geocode/providers")
    public ResponseEntity<List<Map<String, Object>>> providers() {
        return ResponseEntity.ok(Arrays.stream(GeocodingProvider.values())
                .map(p -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("id", p.getId());
                    m.put("name", p.getDisplayName());
                    m.put("keyRequired", p.isKeyRequired());
                    m.put("rateLimit", p.getDefaultRateLimit().describe());
                    return m;
                })
                .toList());
    }
}
