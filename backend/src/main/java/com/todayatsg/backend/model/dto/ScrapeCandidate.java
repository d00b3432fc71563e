package com.todayatsg.backend.model.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw event record as a parser found it. Every field is source text; nothing is validated yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeCandidate {
    private String sourceId;
    private String externalId;
    private String title;
    private String description;
    private String dateText;
    private String timeText;
    private String endDateText;
    private String locationText;
    private String venue;
    private String address;
    private Double latitude;
    private Double longitude;
    private String categoryHint;
    @Builder.Default
    private List<String> tagHints = new ArrayList<>();
    private String priceInfo;
    private String ageRestrictions;
    private String externalUrl;
    private String imageUrl;
}
