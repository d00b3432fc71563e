package com.todayatsg.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.todayatsg.backend.config.ClockConfig;
import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.exception.ValidationException;
import com.todayatsg.backend.model.dto.NormalizedEvent;
import com.todayatsg.backend.model.dto.ScrapeCandidate;
import com.todayatsg.backend.model.enums.EventCategory;
import com.todayatsg.backend.model.enums.EventSource;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventNormalizerTest {

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(ZonedDateTime.of(2024, 7, 15, 9, 0, 0, 0, ClockConfig.SINGAPORE).toInstant(),
                ClockConfig.SINGAPORE);
        normalizer = new EventNormalizer(new SingaporeDateTimeParser(), new CategoryMapper(),
                new TagDeriver(new SingaporeLandmarks()), new IngestionProperties(), clock);
    }

    @Test
    void producesCanonicalEvent() {
        ScrapeCandidate candidate = candidate("  Jazz   Night ", "Sat, 3 Aug 2024, 7:30 PM", "Esplanade Outdoor Theatre");
        candidate.setCategoryHint("Music");
        candidate.setPriceInfo("S$25 - S$40");
        candidate.getTagHints().add("Live & Loud");

        NormalizedEvent event = normalizer.normalize(candidate);

        assertThat(event.getTitle()).isEqualTo("Jazz Night");
        assertThat(event.getSource()).isEqualTo(EventSource.SCRAPED);
        assertThat(event.getDate()).isEqualTo(LocalDate.of(2024, 8, 3));
        assertThat(event.getTime()).isEqualTo(LocalTime.of(19, 30));
        assertThat(event.getStartsAt()).isEqualTo(ZonedDateTime.of(2024, 8, 3, 19, 30, 0, 0, ClockConfig.SINGAPORE));
        assertThat(event.getCategory()).isEqualTo(EventCategory.CONCERTS);
        assertThat(event.getLocation()).isEqualTo("Esplanade Outdoor Theatre");
        assertThat(event.getExternalId()).hasSize(16);
        assertThat(event.getTags()).contains("live-and-loud", "evening", "weekend", "esplanade");
    }

    @Test
    void missingTimeFallsBackToCategoryDefault() {
        ScrapeCandidate candidate = candidate("Craft Beer Tasting", "10 Aug 2024", "Clarke Quay");
        candidate.setCategoryHint("food");

        NormalizedEvent event = normalizer.normalize(candidate);

        assertThat(event.getTime()).isEqualTo(EventCategory.FOOD.getDefaultStartTime());
    }

    @Test
    void unknownCategoryBecomesUncategorized() {
        ScrapeCandidate candidate = candidate("Xyzzy", "10 Aug 2024", "Bugis");
        candidate.setCategoryHint("qwerty");

        assertThat(normalizer.normalize(candidate).getCategory()).isEqualTo(EventCategory.UNCATEGORIZED);
    }

    @Test
    void missingDateIsNamedInValidationError() {
        ScrapeCandidate candidate = candidate("Mystery Pop-up", null, "Bugis");

        assertThatThrownBy(() -> normalizer.normalize(candidate))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getInvalidFields()).containsExactly("date"));
    }

    @Test
    void everyInvalidFieldIsListed() {
        ScrapeCandidate candidate = candidate("   ", "whenever", null);

        assertThatThrownBy(() -> normalizer.normalize(candidate))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getInvalidFields())
                        .containsExactly("title", "date", "location"));
    }

    @Test
    void datesOutsideTheWindowAreRejected() {
        assertThatThrownBy(() -> normalizer.normalize(candidate("Old Fair", "1 Jan 2020", "Bugis")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("date");
        assertThatThrownBy(() -> normalizer.normalize(candidate("Far Future Expo", "1 Jan 2030", "Bugis")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void ongoingRangeThatStartedEarlierIsAccepted() {
        NormalizedEvent event = normalizer.normalize(candidate("Summer Exhibition", "1 Jul - 30 Aug 2024", "National Gallery"));

        assertThat(event.getDate()).isEqualTo(LocalDate.of(2024, 7, 1));
        assertThat(event.getEndDate()).isEqualTo(LocalDate.of(2024, 8, 30));
    }

    @Test
    void longFieldsAreTruncated() {
        ScrapeCandidate candidate = candidate("Word ".repeat(100), "10 Aug 2024", "Bugis");
        candidate.setDescription("x".repeat(3000));
        candidate.setExternalUrl("https://example.sg/" + "a".repeat(600));

        NormalizedEvent event = normalizer.normalize(candidate);

        assertThat(event.getTitle()).hasSizeLessThanOrEqualTo(EventNormalizer.MAX_TITLE).endsWith("...");
        assertThat(event.getDescription()).hasSize(EventNormalizer.MAX_DESCRIPTION);
        assertThat(event.getShortDescription()).hasSize(EventNormalizer.MAX_SHORT_DESCRIPTION);
        assertThat(event.getExternalUrl()).isNull();
    }

    @Test
    void externalIdIsStableAndPrefersTheSourceId() {
        NormalizedEvent first = normalizer.normalize(candidate("Jazz Night", "3 Aug 2024", "Esplanade"));
        NormalizedEvent second = normalizer.normalize(candidate("Jazz Night", "3 Aug 2024", "Esplanade"));
        ScrapeCandidate withId = candidate("Jazz Night", "3 Aug 2024", "Esplanade");
        withId.setExternalId("eb-123");

        assertThat(first.getExternalId()).isEqualTo(second.getExternalId());
        assertThat(normalizer.normalize(withId).getExternalId()).isEqualTo("eb-123");
    }

    private static ScrapeCandidate candidate(String title, String date, String venue) {
        ScrapeCandidate candidate = new ScrapeCandidate();
        candidate.setSourceId("visitsingapore");
        candidate.setTitle(title);
        candidate.setDateText(date);
        candidate.setVenue(venue);
        candidate.setLocationText(venue);
        return candidate;
    }
}
