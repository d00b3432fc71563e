package com.todayatsg.backend.config;

import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * HTTP-level settings shared by every source fetch.
 */
@Component
@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    private String userAgent = "TodayAtSG Bot 1.0 (+https://todayatsg.com/robots)";

    // Defaults applied when a source does not override them
    private int defaultTimeout = 30;
    private int defaultRequestsPerMinute = 30;
    private boolean respectRobotsTxt = true;

    // Shared retry policy
    private int maxRetries = 3;
    private long retryInitialDelayMillis = 2000;
    private double retryBackoffMultiplier = 2.0;

    private Map<String, String> defaultHeaders = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5",
            "Accept-Encoding", "gzip, deflate",
            "DNT", "1"
    );
}
