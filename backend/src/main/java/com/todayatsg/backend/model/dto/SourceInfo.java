package com.todayatsg.backend.model.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the configured-sources listing
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceInfo {
    private String id;
    private String name;
    private String baseUrl;
    private boolean enabled;
    private boolean parserRegistered;
    private int requestsPerMinute;
    private int timeoutSeconds;
    private boolean respectRobotsTxt;
    private boolean javascript;
    private Integer maxEvents;
    private List<String> listingUrls;
}
