package com.todayatsg.backend.startup;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.event.EventRepository;
import com.todayatsg.backend.model.enums.EventSource;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Nightly housekeeping. Events are archived (made inactive), never deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventMaintenanceJob {

    private final EventRepository eventRepository;
    private final IngestionProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${ingestion.schedule.cleanup-cron:0 0 2 * * *}",
            zone = "${ingestion.schedule.zone:Asia/Singapore}")
    public void scheduledCleanup() {
        if (!properties.getSchedule().isEnabled()) return;
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("❌ Event cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Archive scraped events nobody approved in time, and events long in the past
     *
     * @return number of events archived
     */
    @Transactional
    public int cleanup() {
        // Row timestamps are written in the JVM zone; event dates are Singapore dates
        LocalDateTime now = LocalDateTime.now();
        IngestionProperties.Cleanup settings = properties.getCleanup();

        int unapproved = eventRepository.archiveUnapprovedCreatedBefore(
                EventSource.SCRAPED, now.minusDays(settings.getUnapprovedScrapedMaxAgeDays()), now);
        int old = eventRepository.archiveDatedBefore(
                LocalDate.now(clock).minusDays(settings.getArchiveAfterDays()), now);

        log.info("🧹 Cleanup archived {} stale unapproved scraped events and {} past events", unapproved, old);
        return unapproved + old;
    }
}
