package com.todayatsg.backend.model.dto;

import com.todayatsg.backend.model.enums.PipelineStage;
import com.todayatsg.backend.model.enums.RunStatus;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import lombok.Getter;

/**
 * One ingestion run over one or more sources.
 * <p>
 * The source map is filled before any source starts and never changes shape afterwards;
 * only the reports inside it are mutated.
 */
@Getter
public class IngestionRunStatus {

    private final String runId;
    private final String trigger; // MANUAL, SCHEDULED_DAILY, SCHEDULED_WEEKLY, STARTUP
    private final int maxEventsPerSource;
    private final LocalDateTime startedAt;
    private final Map<String, SourceRunReport> sources;

    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile LocalDateTime completedAt;
    private volatile boolean cancelRequested;

    public IngestionRunStatus(String runId, String trigger, int maxEventsPerSource, List<SourceRunReport> reports) {
        this.runId = runId;
        this.trigger = trigger;
        this.maxEventsPerSource = maxEventsPerSource;
        this.startedAt = LocalDateTime.now();
        Map<String, SourceRunReport> bySource = new LinkedHashMap<>();
        for (SourceRunReport report : reports) {
            bySource.put(report.getSourceId(), report);
        }
        this.sources = Collections.unmodifiableMap(bySource);
    }

    public void requestCancel() {
        cancelRequested = true;
    }

    /**
     * Derive the final status from the per-source outcomes
     */
    public void finish() {
        Collection<SourceRunReport> reports = sources.values();
        long failed = reports.stream().filter(r -> r.getStage() == PipelineStage.FAILED).count();

        if (cancelRequested) {
            status = RunStatus.CANCELLED;
        } else if (!reports.isEmpty() && failed == reports.size()) {
            status = RunStatus.FAILED;
        } else if (failed > 0) {
            status = RunStatus.COMPLETED_WITH_ERRORS;
        } else {
            status = RunStatus.COMPLETED;
        }
        completedAt = LocalDateTime.now();
    }

    public int getTotalInserted() {
        return sum(SourceRunReport::getInserted);
    }

    public int getTotalUpdated() {
        return sum(SourceRunReport::getUpdated);
    }

    public int getTotalDuplicates() {
        return sum(SourceRunReport::getDuplicates);
    }

    public int getTotalRecordErrors() {
        return sum(SourceRunReport::getRecordErrors);
    }

    public long getFailedSources() {
        return sources.values().stream().filter(r -> r.getStage() == PipelineStage.FAILED).count();
    }

    private int sum(ToIntFunction<SourceRunReport> counter) {
        return sources.values().stream().mapToInt(counter).sum();
    }
}
