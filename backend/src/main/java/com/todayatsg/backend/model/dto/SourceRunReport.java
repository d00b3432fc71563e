package com.todayatsg.backend.model.dto;

import com.todayatsg.backend.model.enums.PipelineStage;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Statistics for one source within a run. Written by the single thread running that
 * source and read concurrently by the admin API.
 */
@Getter
public class SourceRunReport {

    private static final int MAX_RECORDED_ERRORS = 50;
    private static final int MAX_SAMPLE_EVENTS = 20;

    private final String sourceId;
    private final String sourceName;
    private final boolean dryRun;

    private volatile PipelineStage stage = PipelineStage.PENDING;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime completedAt;
    @Setter
    private volatile String failureReason;

    private volatile int pagesFetched;
    private volatile int pagesFailed;
    private volatile int candidatesFound;
    private volatile int eventsProcessed;
    private volatile int malformedRecords;
    private volatile int fetchErrors;
    private volatile int parseErrors;
    private volatile int validationErrors;
    private volatile int geocodeErrors;
    private volatile int persistenceErrors;
    private volatile int unexpectedErrors;
    private volatile int duplicates;
    private volatile int inserted;
    private volatile int updated;

    private final List<String> errors = new ArrayList<>();
    private final List<NormalizedEvent> sampleEvents = new ArrayList<>();

    public SourceRunReport(String sourceId, String sourceName, boolean dryRun) {
        this.sourceId = sourceId;
        this.sourceName = sourceName;
        this.dryRun = dryRun;
    }

    public void start() {
        startedAt = LocalDateTime.now();
        stage = PipelineStage.FETCHING;
    }

    public void enter(PipelineStage next) {
        stage = next;
    }

    public void complete() {
        stage = PipelineStage.PERSISTED;
        completedAt = LocalDateTime.now();
    }

    public void fail(String reason) {
        stage = PipelineStage.FAILED;
        failureReason = reason;
        completedAt = LocalDateTime.now();
        addError(reason);
    }

    public void skip(String reason) {
        stage = PipelineStage.SKIPPED;
        failureReason = reason;
        completedAt = LocalDateTime.now();
    }

    public void recordPageFetched() {
        pagesFetched++;
    }

    public void recordFetchError(String url, String message) {
        pagesFailed++;
        fetchErrors++;
        addError("fetch " + url + ": " + message);
    }

    public void recordParseError(String url, String message) {
        pagesFailed++;
        parseErrors++;
        addError("parse " + url + ": " + message);
    }

    public void recordCandidates(int found, int malformed) {
        candidatesFound += found;
        malformedRecords += malformed;
    }

    public void recordProcessed() {
        eventsProcessed++;
    }

    public void recordValidationError(String message) {
        validationErrors++;
        addError("validation: " + message);
    }

    public void recordGeocodeError(String message) {
        geocodeErrors++;
        addError("geocode: " + message);
    }

    public void recordPersistenceError(String message) {
        persistenceErrors++;
        addError("persistence: " + message);
    }

    public void recordUnexpectedError(String message) {
        unexpectedErrors++;
        addError("unexpected: " + message);
    }

    public void recordDuplicate() {
        duplicates++;
    }

    public void recordWrite(WriteOutcome outcome) {
        if (outcome.isInserted()) {
            inserted++;
        } else {
            updated++;
        }
    }

    public synchronized void addSample(NormalizedEvent event) {
        if (sampleEvents.size() < MAX_SAMPLE_EVENTS) {
            sampleEvents.add(event);
        }
    }

    public synchronized List<String> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized List<NormalizedEvent> getSampleEvents() {
        return List.copyOf(sampleEvents);
    }

    public int getRecordErrors() {
        return malformedRecords + validationErrors + geocodeErrors + persistenceErrors + unexpectedErrors;
    }

    public boolean isFinished() {
        return stage == PipelineStage.PERSISTED || stage == PipelineStage.FAILED || stage == PipelineStage.SKIPPED;
    }

    public Double getDurationSeconds() {
        if (startedAt == null) return null;
        LocalDateTime end = completedAt != null ? completedAt : LocalDateTime.now();
        return Duration.between(startedAt, end).toMillis() / 1000.0;
    }

    private synchronized void addError(String message) {
        if (errors.size() < MAX_RECORDED_ERRORS) {
            errors.add(message);
        }
    }
}
