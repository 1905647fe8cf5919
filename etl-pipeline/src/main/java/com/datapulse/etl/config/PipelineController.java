package com.datapulse.etl.config;

import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.geo.GeocodingClient;
import com.datapulse.etl.model.Domain;
import com.datapulse.etl.output.PersistenceException;
import com.datapulse.etl.service.AnalyticsQueryService;
import com.datapulse.etl.service.PipelineRunner;
import com.datapulse.etl.service.RunOptions;
import com.datapulse.etl.service.StorageReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineRunner pipelineRunner;
    private final AnalyticsQueryService analyticsQueryService;
    private final GeocodingClient geocodingClient;
    private final StorageReportService storageReportService;

    // ── Pipeline triggers ─────────────────────────────────────────────────────

    /**
     * Start a run in the background.
     *
     * POST /pipeline/run?domains=books,quotes&maxQuotePages=5&limitCategories=3
     * POST /pipeline/run?test=true   (2 categories, 2 quote pages)
     */
    @PostMapping("/pipeline/run")
    public ResponseEntity<Map<String, Object>> run(
            @RequestParam(required = false) List<String> domains,
            @RequestParam(required = false) Integer maxQuotePages,
            @RequestParam(required = false) Integer limitCategories,
            @RequestParam(defaultValue = "false") boolean test) {
        Set<Domain> selected;
        try {
            selected = parseDomains(domains);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        RunOptions options = test
                ? RunOptions.testMode(selected)
                : RunOptions.builder()
                        .domains(selected)
                        .maxQuotePages(maxQuotePages)
                        .limitCategories(limitCategories)
                        .build();

        if (!pipelineRunner.startAsync(options)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A pipeline run is already in progress"));
        }
        log.info("Pipeline run accepted: domains={}, test={}", selected, test);
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "domains", selected, "test", test));
    }

    @PostMapping("/pipeline/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        if (!pipelineRunner.cancel()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "No pipeline run in progress"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "cancelling"));
    }

    @GetMapping("/pipeline/runs/last")
    public ResponseEntity<?> lastRun() {
        return pipelineRunner.lastReport()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("service", "datapulse-etl");
        status.put("version", "1.0.0");
        status.put("running", pipelineRunner.isRunning());
        status.put("lastBatchId", pipelineRunner.lastReport().map(r -> r.batchId()).orElse(null));
        status.put("geocoding", geocodingClient.getStats());
        return ResponseEntity.ok(status);
    }

    // ── Analytics API ─────────────────────────────────────────────────────────

    @GetMapping("/analytics/categories")
    public ResponseEntity<?> categories() {
        return query("category stats", analyticsQueryService::categoryStats);
    }

    @GetMapping("/analytics/authors/top")
    public ResponseEntity<?> topAuthors(@RequestParam(defaultValue = "10") int limit) {
        return query("top authors", () -> analyticsQueryService.topAuthors(limit));
    }

    @GetMapping("/analytics/books/top-by-price")
    public ResponseEntity<?> topBooksByPrice(@RequestParam(defaultValue = "3") int perCategory) {
        return query("top books", () -> analyticsQueryService.topBooksByPrice(perCategory));
    }

    @GetMapping("/analytics/librairies/geolocated")
    public ResponseEntity<?> geolocatedLibrairies() {
        return query("geolocated librairies", analyticsQueryService::geolocatedLibrairies);
    }

    @GetMapping("/analytics/quality")
    public ResponseEntity<?> dataQuality() {
        return query("data quality", analyticsQueryService::dataQuality);
    }

    /** Gold layer counts plus bucket sizes; an unreachable object store only blanks the latter. */
    @GetMapping("/analytics/dashboard")
    public ResponseEntity<?> dashboard() {
        return query("dashboard", () -> {
            Map<String, Object> dashboard = new LinkedHashMap<>(analyticsQueryService.dashboard());
            dashboard.put("storage", storageSummary());
            return dashboard;
        });
    }

    @GetMapping("/analytics/storage")
    public ResponseEntity<?> storage() {
        return query("storage", storageReportService::bucketStats);
    }

    // ── Geocoding ─────────────────────────────────────────────────────────────

    /**
     * Nearest address to a point.
     *
     * GET /geocoding/reverse?lat=48.8556&lon=2.3589
     */
    @GetMapping("/geocoding/reverse")
    public ResponseEntity<?> reverseGeocode(@RequestParam double lat, @RequestParam double lon) {
        if (lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            return ResponseEntity.badRequest().body(Map.of("error", "Coordinates out of range"));
        }
        return geocodingClient.reverseGeocode(lat, lon, CancellationToken.none())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    private ResponseEntity<?> query(String name, Supplier<?> query) {
        try {
            return ResponseEntity.ok(query.get());
        } catch (Exception e) {
            log.error("Analytics query '{}' failed: {}", name, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    private Object storageSummary() {
        try {
            return storageReportService.bucketStats();
        } catch (PersistenceException e) {
            log.warn("Object store unavailable for dashboard: {}", e.getMessage());
            return Map.of("error", e.getMessage());
        }
    }

    static Set<Domain> parseDomains(List<String> domains) {
        if (domains == null || domains.isEmpty()) {
            return EnumSet.allOf(Domain.class);
        }
        Set<Domain> selected = EnumSet.noneOf(Domain.class);
        for (String value : domains) {
            String name = value.trim().toUpperCase(Locale.ROOT);
            try {
                selected.add(Domain.valueOf(name));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown domain '" + value + "', expected books, quotes or librairies");
            }
        }
        return selected;
    }
}
