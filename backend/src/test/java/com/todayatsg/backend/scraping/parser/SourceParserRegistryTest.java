package com.todayatsg.backend.scraping.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.todayatsg.backend.exception.UnknownSourceException;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceParserRegistryTest {

    private final JsonLdEventExtractor jsonLd = new JsonLdEventExtractor(new ObjectMapper());

    @Test
    void resolvesParsersBySourceIdIgnoringCase() {
        SourceParserRegistry registry = new SourceParserRegistry(List.of(
                new VisitSingaporeParser(jsonLd), new EventbriteParser(jsonLd), new CommunityCentreParser(jsonLd)));

        assertThat(registry.getParser("EventBrite")).isInstanceOf(EventbriteParser.class);
        assertThat(registry.hasParser("community_centres")).isTrue();
        assertThat(registry.sourceIds()).containsExactly("community_centres", "eventbrite", "visitsingapore");
    }

    @Test
    void unknownSourceIsRejected() {
        SourceParserRegistry registry = new SourceParserRegistry(List.of(new VisitSingaporeParser(jsonLd)));

        assertThatThrownBy(() -> registry.getParser("meetup")).isInstanceOf(UnknownSourceException.class);
        assertThat(registry.hasParser(null)).isFalse();
    }

    @Test
    void duplicateSourceIdsFailAtStartup() {
        assertThatThrownBy(() -> new SourceParserRegistry(List.of(
                new VisitSingaporeParser(jsonLd), new VisitSingaporeParser(jsonLd))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("visitsingapore");
    }
}
