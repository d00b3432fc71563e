package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.exception.RunNotFoundException;
import com.todayatsg.backend.exception.SourceBusyException;
import com.todayatsg.backend.model.dto.IngestionRunStatus;
import com.todayatsg.backend.model.dto.SourceRunReport;
import com.todayatsg.backend.scraping.SourceConfigService;
import com.todayatsg.backend.scraping.parser.SourceParserRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Starts ingestion runs and keeps their status for the admin API.
 * <p>
 * Sources of a run are submitted to the ingestion executor, whose pool size bounds how
 * many sources are scraped at once. A source belongs to at most one run at a time: it is
 * claimed when the run starts and released when its pipeline ends. Cancelling a run stops
 * sources that have not started and makes running ones stop at their next page.
 */
@Service
@Slf4j
public class IngestionRunService {

    public static final String TRIGGER_MANUAL = "MANUAL";
    public static final String TRIGGER_DAILY = "SCHEDULED_DAILY";
    public static final String TRIGGER_WEEKLY = "SCHEDULED_WEEKLY";
    public static final String TRIGGER_STARTUP = "STARTUP";

    private final SourceIngestionPipeline pipeline;
    private final SourceConfigService sourceConfigService;
    private final SourceParserRegistry parserRegistry;
    private final IngestionProperties properties;
    private final Executor ingestionExecutor;

    private final Map<String, IngestionRunStatus> runs = new ConcurrentHashMap<>();
    private final Set<String> activeSources = ConcurrentHashMap.newKeySet();

    public IngestionRunService(SourceIngestionPipeline pipeline,
                               SourceConfigService sourceConfigService,
                               SourceParserRegistry parserRegistry,
                               IngestionProperties properties,
                               @Qualifier("ingestionTaskExecutor") Executor ingestionExecutor) {
        this.pipeline = pipeline;
        this.sourceConfigService = sourceConfigService;
        this.parserRegistry = parserRegistry;
        this.properties = properties;
        this.ingestionExecutor = ingestionExecutor;
    }

    /**
     * Start a run over every enabled source that has a parser. Sources still running in
     * another run are left out.
     *
     * @throws SourceBusyException when every eligible source is already running
     */
    public IngestionRunStatus startAllSources(String trigger, Integer maxEventsPerSource) {
        List<SourceDefinition> eligible = new ArrayList<>();
        for (SourceDefinition source : sourceConfigService.getEnabledSources()) {
            if (parserRegistry.hasParser(source.getId())) {
                eligible.add(source);
            } else {
                log.warn("Source {} is enabled but has no parser, leaving it out", source.getId());
            }
        }

        List<SourceDefinition> claimed = new ArrayList<>();
        for (SourceDefinition source : eligible) {
            if (activeSources.add(source.getId())) {
                claimed.add(source);
            } else {
                log.warn("Source {} is still running in another run, leaving it out", source.getId());
            }
        }
        if (!eligible.isEmpty() && claimed.isEmpty()) {
            throw new SourceBusyException("Every source is already running in another run");
        }
        return start(trigger, claimed, maxEventsPerSource);
    }

    /**
     * Start a run over a single source, enabled or not
     *
     * @throws SourceBusyException when the source is already running in another run
     */
    public IngestionRunStatus startSource(String sourceId, String trigger, Integer maxEvents) {
        SourceDefinition source = sourceConfigService.getSource(sourceId);
        parserRegistry.getParser(source.getId());
        if (!activeSources.add(source.getId())) {
            throw new SourceBusyException("Source " + source.getId() + " is already running in another run");
        }
        return start(trigger, List.of(source), maxEvents);
    }

    /**
     * Run a source without writing anything and wait for the result
     */
    public SourceRunReport testSource(String sourceId, int limit) {
        SourceDefinition source = sourceConfigService.getSource(sourceId);
        SourceRunReport report = new SourceRunReport(source.getId(), source.getName(), true);
        pipeline.run(source, Math.max(1, limit), true, report, () -> false);
        return report;
    }

    public IngestionRunStatus getRun(String runId) {
        IngestionRunStatus run = runs.get(runId);
        if (run == null) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    /**
     * Runs, newest first
     */
    public List<IngestionRunStatus> listRuns() {
        List<IngestionRunStatus> list = new ArrayList<>(runs.values());
        list.sort(Comparator.comparing(IngestionRunStatus::getStartedAt).reversed());
        return list;
    }

    public IngestionRunStatus cancel(String runId) {
        IngestionRunStatus run = getRun(runId);
        if (!run.getStatus().isTerminal()) {
            run.requestCancel();
            log.info("🛑 Cancellation requested for run {}", runId);
        }
        return run;
    }

    public boolean hasActiveRun() {
        return runs.values().stream().anyMatch(run -> !run.getStatus().isTerminal());
    }

    public boolean isSourceActive(String sourceId) {
        return activeSources.contains(sourceId);
    }

    private IngestionRunStatus start(String trigger, List<SourceDefinition> sources, Integer maxEventsOverride) {
        int maxEvents = maxEventsOverride != null && maxEventsOverride > 0
                ? maxEventsOverride
                : properties.getMaxEventsPerSource();

        List<SourceRunReport> reports = new ArrayList<>();
        for (SourceDefinition source : sources) {
            reports.add(new SourceRunReport(source.getId(), source.getName(), false));
        }
        IngestionRunStatus run = new IngestionRunStatus(UUID.randomUUID().toString(), trigger, maxEvents, reports);
        runs.put(run.getRunId(), run);
        trimHistory();

        log.info("🚀 Starting {} run {} over {} sources (max {} events each)", trigger, run.getRunId(),
                sources.size(), maxEvents);

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (SourceDefinition source : sources) {
            SourceRunReport report = run.getSources().get(source.getId());
            try {
                futures.add(CompletableFuture.runAsync(() -> runSource(run, source, report), ingestionExecutor));
            } catch (RejectedExecutionException e) {
                log.error("❌ Ingestion queue is full, source {} not started in run {}", source.getId(), run.getRunId());
                activeSources.remove(source.getId());
                report.fail("Ingestion queue is full");
            }
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> {
                    run.finish();
                    log.info("🎯 Run {} finished with {}: {} inserted, {} updated, {} duplicates, {} record errors, {} failed sources",
                            run.getRunId(), run.getStatus(), run.getTotalInserted(), run.getTotalUpdated(),
                            run.getTotalDuplicates(), run.getTotalRecordErrors(), run.getFailedSources());
                });
        return run;
    }

    private void runSource(IngestionRunStatus run, SourceDefinition source, SourceRunReport report) {
        try {
            if (run.isCancelRequested()) {
                report.skip("Cancelled before start");
                return;
            }
            pipeline.run(source, run.getMaxEventsPerSource(), false, report, run::isCancelRequested);
        } catch (RuntimeException e) {
            log.error("❌ Source {} aborted in run {}: {}", source.getId(), run.getRunId(), e.getMessage(), e);
            report.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            activeSources.remove(source.getId());
        }
    }

    private void trimHistory() {
        int limit = Math.max(1, properties.getRunHistorySize());
        if (runs.size() <= limit) return;
        runs.values().stream()
                .filter(run -> run.getStatus().isTerminal())
                .sorted(Comparator.comparing(IngestionRunStatus::getStartedAt))
                .limit(runs.size() - limit)
                .map(IngestionRunStatus::getRunId)
                .toList()
                .forEach(runs::remove);
    }
}
