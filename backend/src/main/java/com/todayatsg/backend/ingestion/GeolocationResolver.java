package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.exception.GeocodeException;
import com.todayatsg.backend.model.dto.GeoPoint;
import com.todayatsg.backend.model.dto.NormalizedEvent;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assigns every event a point inside the Singapore bounding box.
 * <p>
 * Coordinates supplied by the source are used when they fall inside the box; otherwise
 * the venue, location and address are matched against the landmark table. No external
 * geocoding service is called.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeolocationResolver {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private final IngestionProperties properties;
    private final SingaporeLandmarks landmarks;

    public GeoPoint resolve(String venue, String location, String address, Double latitude, Double longitude) {
        if (latitude != null && longitude != null) {
            if (isWithinBounds(latitude, longitude)) {
                return new GeoPoint(latitude, longitude, "coordinates");
            }
            log.debug("Ignoring out-of-bounds coordinates ({}, {}) for '{}'", latitude, longitude, location);
        }

        Optional<SingaporeLandmarks.Match> match = landmarks.match(venue, location, address);
        if (match.isPresent()) {
            SingaporeLandmarks.Landmark landmark = match.get().getLandmark();
            return new GeoPoint(landmark.getLatitude(), landmark.getLongitude(), "landmark:" + landmark.getName());
        }

        throw new GeocodeException("Cannot resolve a Singapore location for '"
                + firstNonBlank(venue, location, address) + "'");
    }

    /**
     * Resolve and store the point on the event
     */
    public GeoPoint resolve(NormalizedEvent event) {
        GeoPoint point = resolve(event.getVenue(), event.getLocation(), event.getAddress(),
                event.getLatitude(), event.getLongitude());
        event.setLatitude(point.getLatitude());
        event.setLongitude(point.getLongitude());
        return point;
    }

    public boolean isWithinBounds(double latitude, double longitude) {
        return properties.getBoundingBox().contains(latitude, longitude);
    }

    public SingaporeLandmarks.Landmark nearestLandmark(double latitude, double longitude) {
        return landmarks.nearest(latitude, longitude);
    }

    /**
     * Great-circle distance in kilometres
     */
    public static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value;
        }
        return "";
    }
}
