package com.todayatsg.backend.model.dto;

import com.todayatsg.backend.model.enums.EventCategory;
import com.todayatsg.backend.model.enums.EventSource;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event in canonical form: trimmed, typed and categorised. Coordinates are filled in
 * by the geolocation step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedEvent {
    private String sourceId;
    private String externalId;
    @Builder.Default
    private EventSource source = EventSource.SCRAPED;

    private String title;
    private String description;
    private String shortDescription;

    private LocalDate date;
    private LocalTime time;
    private LocalDate endDate;
    private LocalTime endTime;
    private ZonedDateTime startsAt; // Asia/Singapore

    private String location;
    private String venue;
    private String address;
    private Double latitude;
    private Double longitude;

    private EventCategory category;
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String priceInfo;
    private String ageRestrictions;
    private String externalUrl;
    private String imageUrl;
}
