package com.todayatsg.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ingestion")
@Data
public class IngestionProperties {

    private int maxConcurrentSources = 3;
    private int maxEventsPerSource = 500;
    private int comprehensiveMaxEventsPerSource = 1000;
    private int runHistorySize = 50;

    // Deduplication
    private double titleSimilarityThreshold = 0.8;
    private double nearVenueKm = 0.5;

    // Accepted event date window, relative to today
    private int maxPastDays = 1;
    private int maxFutureDays = 730;

    private boolean autoApproveScraped = true;

    private BoundingBox boundingBox = new BoundingBox();
    private Schedule schedule = new Schedule();
    private Cleanup cleanup = new Cleanup();
    private Startup startup = new Startup();

    /**
     * Inclusive latitude/longitude box that every stored coordinate must fall in.
     */
    @Data
    public static class BoundingBox {
        private double minLatitude = 1.0;
        private double maxLatitude = 1.5;
        private double minLongitude = 103.5;
        private double maxLongitude = 104.1;

        public boolean contains(double latitude, double longitude) {
            return latitude >= minLatitude && latitude <= maxLatitude
                    && longitude >= minLongitude && longitude <= maxLongitude;
        }
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private String zone = "Asia/Singapore";
        private String dailyCron = "0 0 7,19 * * *";
        private String weeklyCron = "0 0 5 * * MON";
        private String cleanupCron = "0 0 2 * * *";
    }

    @Data
    public static class Cleanup {
        private int unapprovedScrapedMaxAgeDays = 30;
        private int archiveAfterDays = 365;
    }

    @Data
    public static class Startup {
        private boolean runOnReady = false;
        private int delaySeconds = 30;
    }
}
