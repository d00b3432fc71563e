package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.model.dto.DedupDecision;
import com.todayatsg.backend.model.dto.NormalizedEvent;
import com.todayatsg.backend.model.entity.Event;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a normalized event is already stored.
 * <p>
 * Same normalized title on the same date is a duplicate outright. Otherwise a title
 * similarity at or above the threshold counts as a duplicate when the venues are the
 * same or near each other. A score exactly on the threshold is a duplicate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventDeduplicator {

    private static final int MIN_VENUE_CONTAINMENT = 4;

    private final IngestionProperties properties;

    /**
     * @param candidate the incoming event
     * @param window    active events stored for the candidate's date
     */
    public DedupDecision decide(NormalizedEvent candidate, List<Event> window) {
        String title = TitleSimilarity.normalize(candidate.getTitle());

        for (Event existing : window) {
            if (candidate.getDate().equals(existing.getDate())
                    && title.equals(TitleSimilarity.normalize(existing.getTitle()))) {
                log.debug("'{}' is an exact duplicate of event {}", candidate.getTitle(), existing.getId());
                return DedupDecision.duplicateOf(existing.getId(), "exact title");
            }
        }

        Event best = null;
        double bestScore = 0.0;
        for (Event existing : window) {
            if (!candidate.getDate().equals(existing.getDate())) continue;
            double score = TitleSimilarity.ratio(title, TitleSimilarity.normalize(existing.getTitle()));
            if (score >= properties.getTitleSimilarityThreshold() && score > bestScore && isNearVenue(candidate, existing)) {
                best = existing;
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("'{}' matches event {} ('{}') with similarity {}", candidate.getTitle(), best.getId(),
                    best.getTitle(), String.format("%.2f", bestScore));
            return DedupDecision.duplicateOf(best.getId(), String.format("similar title %.2f", bestScore));
        }
        return DedupDecision.newEvent();
    }

    /**
     * Same or near venue: matching venue/location names (equal, or one containing the other),
     * or both points known and within the configured distance
     */
    public boolean isNearVenue(NormalizedEvent candidate, Event existing) {
        List<String> ours = List.of(
                TitleSimilarity.normalize(candidate.getVenue()), TitleSimilarity.normalize(candidate.getLocation()));
        List<String> theirs = List.of(
                TitleSimilarity.normalize(existing.getVenue()), TitleSimilarity.normalize(existing.getLocation()));
        for (String a : ours) {
            for (String b : theirs) {
                if (a.isEmpty() || b.isEmpty()) continue;
                if (a.equals(b)) return true;
                if (Math.min(a.length(), b.length()) >= MIN_VENUE_CONTAINMENT && (a.contains(b) || b.contains(a))) {
                    return true;
                }
            }
        }

        if (candidate.getLatitude() != null && candidate.getLongitude() != null
                && existing.getLatitude() != null && existing.getLongitude() != null) {
            double km = GeolocationResolver.haversineKm(candidate.getLatitude(), candidate.getLongitude(),
                    existing.getLatitude().doubleValue(), existing.getLongitude().doubleValue());
            return km <= properties.getNearVenueKm();
        }
        return false;
    }

    /**
     * Key that identifies the same listing seen twice within one run
     */
    public static String runKey(NormalizedEvent event) {
        return event.getDate() + "|" + TitleSimilarity.normalize(event.getTitle());
    }
}
