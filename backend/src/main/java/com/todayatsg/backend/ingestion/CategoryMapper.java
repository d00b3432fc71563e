package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.model.enums.EventCategory;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps free-text category hints onto the fixed category set.
 * <p>
 * Order: exact name, alias table, keyword scan over the listing text, fuzzy name match,
 * then {@link EventCategory#UNCATEGORIZED}.
 */
@Component
public class CategoryMapper {

    private static final double FUZZY_THRESHOLD = 0.8;

    private static final Map<String, EventCategory> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("music", EventCategory.CONCERTS);
        ALIASES.put("concert", EventCategory.CONCERTS);
        ALIASES.put("gig", EventCategory.CONCERTS);
        ALIASES.put("gigs", EventCategory.CONCERTS);
        ALIASES.put("live music", EventCategory.CONCERTS);
        ALIASES.put("art", EventCategory.EXHIBITIONS);
        ALIASES.put("arts", EventCategory.EXHIBITIONS);
        ALIASES.put("arts design", EventCategory.EXHIBITIONS);
        ALIASES.put("visualarts", EventCategory.EXHIBITIONS);
        ALIASES.put("exhibition", EventCategory.EXHIBITIONS);
        ALIASES.put("museum", EventCategory.EXHIBITIONS);
        ALIASES.put("screening", EventCategory.EXHIBITIONS);
        ALIASES.put("film", EventCategory.EXHIBITIONS);
        ALIASES.put("festival", EventCategory.FESTIVALS);
        ALIASES.put("culture", EventCategory.FESTIVALS);
        ALIASES.put("heritage", EventCategory.FESTIVALS);
        ALIASES.put("dining", EventCategory.FOOD);
        ALIASES.put("food drink", EventCategory.FOOD);
        ALIASES.put("food and drink", EventCategory.FOOD);
        ALIASES.put("food beverage", EventCategory.FOOD);
        ALIASES.put("fitness", EventCategory.SPORTS);
        ALIASES.put("sport", EventCategory.SPORTS);
        ALIASES.put("sports fitness", EventCategory.SPORTS);
        ALIASES.put("health", EventCategory.WORKSHOPS);
        ALIASES.put("education", EventCategory.WORKSHOPS);
        ALIASES.put("class", EventCategory.WORKSHOPS);
        ALIASES.put("classes", EventCategory.WORKSHOPS);
        ALIASES.put("course", EventCategory.WORKSHOPS);
        ALIASES.put("courses", EventCategory.WORKSHOPS);
        ALIASES.put("programmes", EventCategory.WORKSHOPS);
        ALIASES.put("networking", EventCategory.BUSINESS);
        ALIASES.put("conference", EventCategory.BUSINESS);
        ALIASES.put("science tech", EventCategory.BUSINESS);
        ALIASES.put("theater", EventCategory.THEATRE);
        ALIASES.put("performing arts", EventCategory.THEATRE);
        ALIASES.put("comedy", EventCategory.THEATRE);
        ALIASES.put("dance", EventCategory.THEATRE);
        ALIASES.put("literary", EventCategory.THEATRE);
        ALIASES.put("kids", EventCategory.FAMILY);
        ALIASES.put("childrens", EventCategory.FAMILY);
        ALIASES.put("family friendly", EventCategory.FAMILY);
        ALIASES.put("party", EventCategory.NIGHTLIFE);
        ALIASES.put("social", EventCategory.NIGHTLIFE);
    }

    public EventCategory map(String hint, String title, String description, String venue) {
        String normalizedHint = simplify(hint);

        if (!normalizedHint.isEmpty()) {
            EventCategory exact = EventCategory.fromName(normalizedHint);
            if (exact == null) exact = EventCategory.fromName(hint);
            if (exact != null) return exact;

            EventCategory alias = ALIASES.get(normalizedHint);
            if (alias != null) return alias;
        }

        EventCategory byKeyword = scanKeywords(String.join(" ",
                nullToEmpty(hint), nullToEmpty(title), nullToEmpty(description), nullToEmpty(venue)));
        if (byKeyword != null) return byKeyword;

        if (!normalizedHint.isEmpty()) {
            for (EventCategory category : EventCategory.values()) {
                if (category == EventCategory.UNCATEGORIZED) continue;
                if (TitleSimilarity.similarity(normalizedHint, category.getSlug()) >= FUZZY_THRESHOLD
                        || TitleSimilarity.similarity(normalizedHint, category.getDisplayName()) >= FUZZY_THRESHOLD) {
                    return category;
                }
            }
        }
        return EventCategory.UNCATEGORIZED;
    }

    // Most keyword hits wins; ties go to the earlier category
    private EventCategory scanKeywords(String text) {
        String haystack = " " + text.toLowerCase(Locale.ROOT) + " ";
        EventCategory best = null;
        int bestScore = 0;
        for (EventCategory category : EventCategory.values()) {
            int score = 0;
            for (String keyword : category.getKeywords()) {
                if (haystack.contains(keyword)) score++;
            }
            if (score > bestScore) {
                bestScore = score;
                best = category;
            }
        }
        return best;
    }

    private static String simplify(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
