package com.todayatsg.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A coordinate pair inside the Singapore bounding box, with how it was obtained.
 */
@Getter
@ToString
@AllArgsConstructor
public class GeoPoint {
    private final double latitude;
    private final double longitude;
    private final String resolvedBy; // "coordinates" or "landmark:<name>"
}
