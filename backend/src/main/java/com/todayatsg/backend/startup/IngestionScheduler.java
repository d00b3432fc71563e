package com.todayatsg.backend.startup;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.ingestion.IngestionRunService;
import com.todayatsg.backend.model.dto.IngestionRunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Triggers ingestion runs on the daily and weekly schedules, and optionally once
 * after startup. A trigger is skipped while another run is still going.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionScheduler {

    private final IngestionRunService runService;
    private final IngestionProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    @Async("generalTaskExecutor")
    public void onApplicationReady() {
        if (!properties.getStartup().isRunOnReady()) {
            log.info("🔕 Startup ingestion disabled via configuration");
            return;
        }

        int delay = properties.getStartup().getDelaySeconds();
        log.info("🚀 Application ready, starting ingestion in {} seconds...", delay);
        try {
            Thread.sleep(delay * 1000L);
            trigger(IngestionRunService.TRIGGER_STARTUP, properties.getMaxEventsPerSource());
        } catch (InterruptedException e) {
            log.error("❌ Startup ingestion interrupted: {}", e.getMessage());
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Morning and evening refresh of all sources
     */
    @Scheduled(cron = "${ingestion.schedule.daily-cron:0 0 7,19 * * *}",
            zone = "${ingestion.schedule.zone:Asia/Singapore}")
    public void dailyRun() {
        if (!properties.getSchedule().isEnabled()) return;
        log.info("⏰ Daily ingestion triggered");
        trigger(IngestionRunService.TRIGGER_DAILY, properties.getMaxEventsPerSource());
    }

    /**
     * Weekly run with a larger per-source cap
     */
    @Scheduled(cron = "${ingestion.schedule.weekly-cron:0 0 5 * * MON}",
            zone = "${ingestion.schedule.zone:Asia/Singapore}")
    public void weeklyRun() {
        if (!properties.getSchedule().isEnabled()) return;
        log.info("⏰ Weekly comprehensive ingestion triggered");
        trigger(IngestionRunService.TRIGGER_WEEKLY, properties.getComprehensiveMaxEventsPerSource());
    }

    /**
     * Start a run unless one is active. Never throws, so a failing trigger cannot take the scheduler down.
     */
    boolean trigger(String trigger, int maxEventsPerSource) {
        if (runService.hasActiveRun()) {
            log.info("⏳ Skipping {} ingestion - a run is still in progress", trigger);
            return false;
        }
        try {
            IngestionRunStatus run = runService.startAllSources(trigger, maxEventsPerSource);
            log.info("📅 {} ingestion started as run {}", trigger, run.getRunId());
            return true;
        } catch (RuntimeException e) {
            log.error("❌ Could not start {} ingestion: {}", trigger, e.getMessage(), e);
            return false;
        }
    }
}
