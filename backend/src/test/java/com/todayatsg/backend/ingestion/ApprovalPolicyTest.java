package com.todayatsg.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.model.enums.EventSource;
import org.junit.jupiter.api.Test;

class ApprovalPolicyTest {

    @Test
    void scrapedAndAdminEventsAreApproved() {
        ApprovalPolicy policy = new ApprovalPolicy(new IngestionProperties());

        assertThat(policy.isApprovedOnCreate(EventSource.SCRAPED)).isTrue();
        assertThat(policy.isApprovedOnCreate(EventSource.ADMIN)).isTrue();
        assertThat(policy.isApprovedOnCreate(EventSource.USER_SUBMISSION)).isFalse();
    }

    @Test
    void scrapedEventsCanBeHeldForModeration() {
        IngestionProperties properties = new IngestionProperties();
        properties.setAutoApproveScraped(false);

        assertThat(new ApprovalPolicy(properties).isApprovedOnCreate(EventSource.SCRAPED)).isFalse();
    }
}
