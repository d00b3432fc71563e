package com.todayatsg.backend.controller;

import com.todayatsg.backend.config.ScrapingConfig;
import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.event.EventRepository;
import com.todayatsg.backend.ingestion.IngestionRunService;
import com.todayatsg.backend.model.dto.IngestionRunStatus;
import com.todayatsg.backend.model.dto.SourceInfo;
import com.todayatsg.backend.model.dto.SourceRunReport;
import com.todayatsg.backend.model.enums.EventSource;
import com.todayatsg.backend.scraping.SourceConfigService;
import com.todayatsg.backend.scraping.parser.SourceParserRegistry;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin endpoints for triggering and inspecting ingestion runs.
 */
@RestController
@RequestMapping("/api/admin/ingestion")
@RequiredArgsConstructor
@Validated
@Slf4j
public class IngestionController {

    private final IngestionRunService runService;
    private final SourceConfigService sourceConfigService;
    private final SourceParserRegistry parserRegistry;
    private final ScrapingConfig scrapingConfig;
    private final EventRepository eventRepository;

    @PostMapping("/runs")
    public ResponseEntity<Map<String, Object>> startRun(
            @RequestParam(required = false) @Min(1) @Max(5000) Integer maxEventsPerSource) {
        IngestionRunStatus run = runService.startAllSources(IngestionRunService.TRIGGER_MANUAL, maxEventsPerSource);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(summary(run));
    }

    @PostMapping("/runs/{sourceId}")
    public ResponseEntity<Map<String, Object>> startSourceRun(
            @PathVariable String sourceId,
            @RequestParam(required = false) @Min(1) @Max(5000) Integer maxEvents) {
        IngestionRunStatus run = runService.startSource(sourceId, IngestionRunService.TRIGGER_MANUAL, maxEvents);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(summary(run));
    }

    @GetMapping("/runs")
    public ResponseEntity<Map<String, Object>> listRuns() {
        List<Map<String, Object>> runs = runService.listRuns().stream().map(this::summary).toList();
        return ResponseEntity.ok(Map.of("runs", runs, "count", runs.size()));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<IngestionRunStatus> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(runService.getRun(runId));
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelRun(@PathVariable String runId) {
        return ResponseEntity.ok(summary(runService.cancel(runId)));
    }

    @GetMapping("/sources")
    public ResponseEntity<Map<String, Object>> listSources() {
        List<SourceInfo> sources = sourceConfigService.getAllSources().stream().map(this::toInfo).toList();
        return ResponseEntity.ok(Map.of("sources", sources, "count", sources.size()));
    }

    /**
     * Dry run of one source: fetches and processes a few events without storing them
     */
    @PostMapping("/sources/{sourceId}/test")
    public ResponseEntity<SourceRunReport> testSource(
            @PathVariable String sourceId,
            @RequestParam(defaultValue = "5") @Min(1) @Max(50) int limit) {
        log.info("Testing source {} with limit {}", sourceId, limit);
        return ResponseEntity.ok(runService.testSource(sourceId, limit));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Long> eventsBySource = new LinkedHashMap<>();
        for (Object[] row : eventRepository.countBySourceGroupedByScrapedFrom(EventSource.SCRAPED)) {
            eventsBySource.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        List<IngestionRunStatus> runs = runService.listRuns();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("timestamp", LocalDateTime.now());
        body.put("activeRun", runService.hasActiveRun());
        body.put("lastRun", runs.isEmpty() ? null : summary(runs.get(0)));
        body.put("activeEvents", eventRepository.countByIsActive(true));
        body.put("scrapedEventsBySource", eventsBySource);
        body.put("registeredParsers", parserRegistry.sourceIds());
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> summary(IngestionRunStatus run) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", run.getRunId());
        body.put("trigger", run.getTrigger());
        body.put("status", run.getStatus());
        body.put("startedAt", run.getStartedAt());
        body.put("completedAt", run.getCompletedAt());
        body.put("sources", run.getSources().keySet());
        body.put("inserted", run.getTotalInserted());
        body.put("updated", run.getTotalUpdated());
        body.put("duplicates", run.getTotalDuplicates());
        body.put("recordErrors", run.getTotalRecordErrors());
        body.put("failedSources", run.getFailedSources());
        return body;
    }

    private SourceInfo toInfo(SourceDefinition source) {
        return new SourceInfo(
                source.getId(),
                source.getName(),
                source.getBaseUrl(),
                source.isEnabled(),
                parserRegistry.hasParser(source.getId()),
                source.effectiveRequestsPerMinute(scrapingConfig),
                source.effectiveTimeoutSeconds(scrapingConfig),
                source.effectiveRespectRobots(scrapingConfig),
                source.isJavascript(),
                source.getMaxEvents(),
                source.getListingUrls());
    }
}
