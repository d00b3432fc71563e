package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.config.ClockConfig;
import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.exception.ValidationException;
import com.todayatsg.backend.model.dto.NormalizedEvent;
import com.todayatsg.backend.model.dto.ScrapeCandidate;
import com.todayatsg.backend.model.enums.EventCategory;
import com.todayatsg.backend.model.enums.EventSource;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * Turns a raw candidate into a canonical event, or rejects it naming every bad field.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventNormalizer {

    public static final int MAX_TITLE = 255;
    public static final int MAX_SHORT_DESCRIPTION = 500;
    public static final int MAX_DESCRIPTION = 2000;
    public static final int MAX_LOCATION = 255;
    public static final int MAX_ADDRESS = 500;
    public static final int MAX_PRICE = 200;
    public static final int MAX_AGE = 50;
    public static final int MAX_URL = 500;
    public static final int MAX_EXTERNAL_ID = 100;

    private final SingaporeDateTimeParser dateTimeParser;
    private final CategoryMapper categoryMapper;
    private final TagDeriver tagDeriver;
    private final IngestionProperties properties;
    private final Clock clock;

    public NormalizedEvent normalize(ScrapeCandidate candidate) {
        LocalDate today = LocalDate.now(clock);
        List<String> invalid = new ArrayList<>();

        String title = clean(candidate.getTitle());
        if (title == null) {
            invalid.add("title");
        }

        // Date and time, preferring a full ISO timestamp when the source gave one
        LocalDate date = null;
        LocalTime time = null;
        Optional<LocalDateTime> iso = dateTimeParser.parseIsoDateTime(candidate.getDateText());
        if (iso.isPresent()) {
            date = iso.get().toLocalDate();
            time = iso.get().toLocalTime();
        } else {
            date = dateTimeParser.parseDate(candidate.getDateText(), today).orElse(null);
        }
        if (date == null) {
            invalid.add("date");
        }

        LocalDate endDate = null;
        LocalTime endTime = null;
        Optional<LocalDateTime> isoEnd = dateTimeParser.parseIsoDateTime(candidate.getEndDateText());
        if (isoEnd.isPresent()) {
            endDate = isoEnd.get().toLocalDate();
            endTime = isoEnd.get().toLocalTime();
        } else if (candidate.getEndDateText() != null) {
            endDate = dateTimeParser.parseDate(candidate.getEndDateText(), today).orElse(null);
        } else {
            endDate = dateTimeParser.parseRangeEnd(candidate.getDateText(), today).orElse(null);
        }
        if (date != null && endDate != null && endDate.isBefore(date)) {
            endDate = null;
            endTime = null;
        }

        if (date != null) {
            LocalDate lastDay = endDate != null ? endDate : date;
            if (lastDay.isBefore(today.minusDays(properties.getMaxPastDays()))
                    || date.isAfter(today.plusDays(properties.getMaxFutureDays()))) {
                invalid.add("date");
            }
        }

        String venue = truncate(clean(candidate.getVenue()), MAX_LOCATION);
        String address = truncate(clean(candidate.getAddress()), MAX_ADDRESS);
        String location = truncate(firstNonNull(clean(candidate.getLocationText()), venue, address), MAX_LOCATION);
        if (location == null) {
            invalid.add("location");
        }

        if (!invalid.isEmpty()) {
            throw new ValidationException(invalid, "Invalid " + invalid + " for '"
                    + (title != null ? truncate(title, 80) : "<untitled>") + "' from " + candidate.getSourceId());
        }

        String description = truncate(clean(candidate.getDescription()), MAX_DESCRIPTION);
        EventCategory category = categoryMapper.map(candidate.getCategoryHint(), title, description, venue);

        if (time == null) {
            time = parseTime(candidate).orElse(category.getDefaultStartTime());
        }

        NormalizedEvent event = NormalizedEvent.builder()
                .sourceId(candidate.getSourceId())
                .source(EventSource.SCRAPED)
                .title(truncate(title, MAX_TITLE))
                .description(description)
                .shortDescription(truncate(description, MAX_SHORT_DESCRIPTION))
                .date(date)
                .time(time)
                .endDate(endDate)
                .endTime(endTime)
                .startsAt(ZonedDateTime.of(date, time, ClockConfig.SINGAPORE))
                .location(location)
                .venue(venue)
                .address(address)
                .latitude(candidate.getLatitude())
                .longitude(candidate.getLongitude())
                .category(category)
                .priceInfo(truncate(clean(candidate.getPriceInfo()), MAX_PRICE))
                .ageRestrictions(truncate(clean(candidate.getAgeRestrictions()), MAX_AGE))
                .externalUrl(limitUrl(candidate.getExternalUrl()))
                .imageUrl(limitUrl(candidate.getImageUrl()))
                .build();

        event.setExternalId(externalId(candidate, event));
        event.setTags(tagDeriver.derive(event, candidate.getTagHints()));

        log.debug("Normalized '{}' on {} {} as {}", event.getTitle(), date, time, category.getSlug());
        return event;
    }

    /**
     * The source's own id when it has one, else the first 16 hex digits of
     * md5("source|title|date|venue")
     */
    static String externalId(ScrapeCandidate candidate, NormalizedEvent event) {
        String own = clean(candidate.getExternalId());
        if (own != null) {
            return own.length() > MAX_EXTERNAL_ID ? own.substring(0, MAX_EXTERNAL_ID) : own;
        }
        String key = String.join("|",
                String.valueOf(event.getSourceId()),
                event.getTitle(),
                String.valueOf(event.getDate()),
                event.getVenue() == null ? "" : event.getVenue());
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)).substring(0, 16);
    }

    private Optional<LocalTime> parseTime(ScrapeCandidate candidate) {
        Optional<LocalTime> fromTimeText = dateTimeParser.parseTime(candidate.getTimeText());
        return fromTimeText.isPresent() ? fromTimeText : dateTimeParser.parseTimeInDateText(candidate.getDateText());
    }

    static String clean(String text) {
        if (text == null) return null;
        String cleaned = text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Cut at a word boundary where possible and mark the cut with "..."
     */
    static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        String cut = text.substring(0, maxLength - 3);
        int space = cut.lastIndexOf(' ');
        if (space > maxLength / 2) {
            cut = cut.substring(0, space);
        }
        return cut.trim() + "...";
    }

    private static String limitUrl(String url) {
        String cleaned = clean(url);
        return cleaned == null || cleaned.length() > MAX_URL ? null : cleaned;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) return value;
        }
        return null;
    }
}
