package com.todayatsg.backend.scraping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.exception.UnknownSourceException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class SourceConfigServiceTest {

    @Test
    void loadsEverySourceFromTheBundledFile() {
        SourceConfigService service = new SourceConfigService(new ClassPathResource("sources.yml"));
        service.loadConfigurations();

        assertThat(service.getAllSources()).extracting(SourceDefinition::getId)
                .containsExactly("visitsingapore", "eventbrite", "marinabaysands", "sunteccity", "community_centres");
        assertThat(service.getEnabledSources()).hasSize(5);

        SourceDefinition eventbrite = service.getSource("EventBrite");
        assertThat(eventbrite.getMaxEvents()).isEqualTo(300);
        assertThat(eventbrite.getListingUrls().get(0))
                .isEqualTo("https://www.eventbrite.sg/d/singapore--singapore/events/");

        SourceDefinition communityCentres = service.getSource("community_centres");
        assertThat(communityCentres.getDefaultCategory()).isEqualTo("family");
        assertThat(communityCentres.getDefaultTags()).contains("community");
        assertThat(communityCentres.getListingUrls()).hasSizeGreaterThan(1);
    }

    @Test
    void unknownSourceIdFails() {
        SourceConfigService service = new SourceConfigService(new ClassPathResource("sources.yml"));
        service.loadConfigurations();

        assertThatThrownBy(() -> service.getSource("meetup"))
                .isInstanceOf(UnknownSourceException.class)
                .hasMessageContaining("meetup");
        assertThat(service.findSource(null)).isEmpty();
    }

    @Test
    void sourceWithoutBaseUrlIsRejected() {
        SourceConfigService service = new SourceConfigService(new ClassPathResource("sources-without-base-url.yml"));

        assertThatThrownBy(service::loadConfigurations)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void missingFileIsAStartupError() {
        SourceConfigService service = new SourceConfigService(new ClassPathResource("no-such-file.yml"));

        assertThatThrownBy(service::loadConfigurations)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to load");
    }
}
