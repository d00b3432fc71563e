package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.model.enums.EventSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Initial approval state of a newly stored event
 */
@Component
@RequiredArgsConstructor
public class ApprovalPolicy {

    private final IngestionProperties properties;

    public boolean isApprovedOnCreate(EventSource source) {
        return switch (source) {
            case ADMIN -> true;
            case SCRAPED -> properties.isAutoApproveScraped();
            case USER_SUBMISSION -> false;
        };
    }
}
