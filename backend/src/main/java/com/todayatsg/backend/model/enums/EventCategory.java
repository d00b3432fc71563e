package com.todayatsg.backend.model.enums;

import java.time.LocalTime;
import java.util.List;
import lombok.Getter;

/**
 * The fixed category set. Order matters: keyword scans stop at the first match.
 */
@Getter
public enum EventCategory {
    CONCERTS("concerts", "Concerts", LocalTime.of(20, 0),
            List.of("concert", "music", "band", "singer", "acoustic", "live music", "gig", "orchestra")),
    SPORTS("sports", "Sports", LocalTime.of(18, 0),
            List.of("sports", "football", "basketball", "tennis", "marathon", "race", "gym", "fitness", "run ")),
    FESTIVALS("festivals", "Festivals", LocalTime.of(19, 0),
            List.of("festival", "celebration", "cultural", "heritage", "tradition", "parade", "fair")),
    EXHIBITIONS("exhibitions", "Exhibitions", LocalTime.of(19, 0),
            List.of("exhibition", "museum", "gallery", "art ", "display", "showcase", "expo")),
    WORKSHOPS("workshops", "Workshops", LocalTime.of(14, 0),
            List.of("workshop", "class", "training", "learn", "course", "tutorial", "seminar")),
    FAMILY("family", "Family", LocalTime.of(10, 0),
            List.of("family", "kids", "children", "playground", "zoo", "aquarium", "theme park")),
    FOOD("food", "Food & Drink", LocalTime.of(19, 0),
            List.of("food", "dining", "restaurant", "cuisine", "cooking", "tasting", "buffet", "brunch")),
    NIGHTLIFE("nightlife", "Nightlife", LocalTime.of(22, 0),
            List.of("bar", "club", "pub", "nightlife", "party", "dj")),
    THEATRE("theatre", "Theatre", LocalTime.of(20, 0),
            List.of("theatre", "theater", "play", "drama", "musical", "performance", "show")),
    BUSINESS("business", "Business", LocalTime.of(9, 0),
            List.of("conference", "networking", "business", "corporate", "meeting", "summit")),
    UNCATEGORIZED("uncategorized", "Uncategorized", LocalTime.of(19, 0), List.of());

    private final String slug;
    private final String displayName;
    private final LocalTime defaultStartTime;
    private final List<String> keywords;

    EventCategory(String slug, String displayName, LocalTime defaultStartTime, List<String> keywords) {
        this.slug = slug;
        this.displayName = displayName;
        this.defaultStartTime = defaultStartTime;
        this.keywords = keywords;
    }

    /**
     * Find category by slug or display name (case-insensitive)
     */
    public static EventCategory fromName(String name) {
        if (name == null) return null;
        String normalized = name.trim().toLowerCase();
        for (EventCategory category : values()) {
            if (category.slug.equals(normalized) || category.displayName.equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        return null;
    }
}
