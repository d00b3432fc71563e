package com.todayatsg.backend.event;

import com.todayatsg.backend.model.entity.Event;
import jakarta.persistence.EntityNotFoundException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps Event.averageRating and Event.reviewCount in step with the review table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RatingAggregateService {

    private final EventRepository eventRepository;
    private final ReviewRepository reviewRepository;

    /**
     * Recompute the rating aggregate of one event from its reviews
     */
    @Transactional
    public Event refresh(Long eventId) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new EntityNotFoundException("Event not found: " + eventId));

        long count = reviewRepository.countByEventId(eventId);
        Double average = count > 0 ? reviewRepository.averageRatingForEvent(eventId) : null;

        event.setReviewCount((int) count);
        event.setAverageRating(average == null ? null
                : BigDecimal.valueOf(average).setScale(2, RoundingMode.HALF_UP));

        log.debug("Refreshed rating for event {}: {} reviews, average {}", eventId, count, event.getAverageRating());
        return eventRepository.save(event);
    }
}
