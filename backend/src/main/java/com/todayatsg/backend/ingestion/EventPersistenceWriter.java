package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.event.CategoryRepository;
import com.todayatsg.backend.event.EventRepository;
import com.todayatsg.backend.event.TagRepository;
import com.todayatsg.backend.exception.PersistenceException;
import com.todayatsg.backend.model.dto.NormalizedEvent;
import com.todayatsg.backend.model.dto.WriteOutcome;
import com.todayatsg.backend.model.entity.Category;
import com.todayatsg.backend.model.entity.Event;
import com.todayatsg.backend.model.entity.Tag;
import com.todayatsg.backend.model.enums.EventCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Upserts normalized events, one transaction per event.
 * <p>
 * A scraped event is keyed by (scrapedFrom, externalId): an existing row with that key is
 * updated in place, otherwise a row is inserted. Approval is decided only on insert, so a
 * moderator's later decision survives re-scraping.
 * <p>
 * Categories and tags are shared by every source pipeline, so they are created in their own
 * short transactions before the event is written. When two pipelines create the same tag at
 * once the loser re-reads the winner's row.
 */
@Service
@Slf4j
public class EventPersistenceWriter {

    private final EventRepository eventRepository;
    private final CategoryRepository categoryRepository;
    private final TagRepository tagRepository;
    private final ApprovalPolicy approvalPolicy;
    private final TransactionTemplate transactionTemplate;

    public EventPersistenceWriter(EventRepository eventRepository,
                                  CategoryRepository categoryRepository,
                                  TagRepository tagRepository,
                                  ApprovalPolicy approvalPolicy,
                                  PlatformTransactionManager transactionManager) {
        this.eventRepository = eventRepository;
        this.categoryRepository = categoryRepository;
        this.tagRepository = tagRepository;
        this.approvalPolicy = approvalPolicy;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public WriteOutcome write(NormalizedEvent normalized) {
        try {
            ensureCategory(normalized.getCategory());
            for (String slug : normalized.getTags()) {
                ensureTag(slug);
            }
            WriteOutcome outcome;
            try {
                outcome = transactionTemplate.execute(status -> upsert(normalized));
            } catch (DataIntegrityViolationException e) {
                // Another pipeline committed a shared row first; its row is visible now
                log.debug("Retrying '{}' after conflict: {}", normalized.getTitle(), e.getMostSpecificCause().getMessage());
                outcome = transactionTemplate.execute(status -> upsert(normalized));
            }
            log.debug("{} event {} '{}'", outcome.getAction(), outcome.getEventId(), normalized.getTitle());
            return outcome;
        } catch (DataAccessException | TransactionException e) {
            log.warn("Failed to store '{}' from {}: {}", normalized.getTitle(), normalized.getSourceId(),
                    e.getMostSpecificCause().getMessage());
            throw new PersistenceException("Could not store '" + normalized.getTitle() + "': "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private WriteOutcome upsert(NormalizedEvent normalized) {
        Optional<Event> existing = normalized.getSourceId() != null && normalized.getExternalId() != null
                ? eventRepository.findByScrapedFromAndExternalId(normalized.getSourceId(), normalized.getExternalId())
                : Optional.empty();

        Event event;
        WriteOutcome.Action action;
        if (existing.isPresent()) {
            event = existing.get();
            action = WriteOutcome.Action.UPDATED;
        } else {
            event = Event.builder().build();
            event.setSource(normalized.getSource());
            event.setScrapedFrom(normalized.getSourceId());
            event.setExternalId(normalized.getExternalId());
            event.setIsApproved(approvalPolicy.isApprovedOnCreate(normalized.getSource()));
            event.setIsActive(true);
            action = WriteOutcome.Action.INSERTED;
        }

        apply(normalized, event);
        Event saved = eventRepository.saveAndFlush(event);
        return new WriteOutcome(action, saved.getId());
    }

    private void apply(NormalizedEvent normalized, Event event) {
        event.setTitle(normalized.getTitle());
        event.setDescription(normalized.getDescription());
        event.setShortDescription(normalized.getShortDescription());
        event.setDate(normalized.getDate());
        event.setTime(normalized.getTime());
        event.setEndDate(normalized.getEndDate());
        event.setEndTime(normalized.getEndTime());
        event.setLocation(normalized.getLocation());
        event.setVenue(normalized.getVenue());
        event.setAddress(normalized.getAddress());
        event.setLatitude(coordinate(normalized.getLatitude()));
        event.setLongitude(coordinate(normalized.getLongitude()));
        event.setPriceInfo(normalized.getPriceInfo());
        event.setAgeRestrictions(normalized.getAgeRestrictions());
        event.setExternalUrl(normalized.getExternalUrl());
        event.setImageUrl(normalized.getImageUrl());
        event.setCategory(category(normalized.getCategory()));
        event.setTags(tags(normalized));
        event.setLastScraped(LocalDateTime.now());
    }

    private void ensureCategory(EventCategory category) {
        EventCategory value = orUncategorized(category);
        if (categoryRepository.findBySlug(value.getSlug()).isPresent()) return;
        try {
            transactionTemplate.executeWithoutResult(status -> categoryRepository.saveAndFlush(newCategory(value)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Category {} was created concurrently", value.getSlug());
        }
    }

    private void ensureTag(String slug) {
        if (tagRepository.findBySlug(slug).isPresent()) return;
        try {
            transactionTemplate.executeWithoutResult(status -> tagRepository.saveAndFlush(newTag(slug)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Tag {} was created concurrently", slug);
        }
    }

    private Category category(EventCategory category) {
        EventCategory value = orUncategorized(category);
        return categoryRepository.findBySlug(value.getSlug())
                .orElseGet(() -> categoryRepository.save(newCategory(value)));
    }

    private Set<Tag> tags(NormalizedEvent normalized) {
        Set<Tag> tags = new LinkedHashSet<>();
        for (String slug : normalized.getTags()) {
            tags.add(tagRepository.findBySlug(slug).orElseGet(() -> tagRepository.save(newTag(slug))));
        }
        return tags;
    }

    private static EventCategory orUncategorized(EventCategory category) {
        return category != null ? category : EventCategory.UNCATEGORIZED;
    }

    private static Category newCategory(EventCategory value) {
        return Category.builder()
                .name(value.getDisplayName())
                .slug(value.getSlug())
                .sortOrder(value.ordinal())
                .build();
    }

    private static Tag newTag(String slug) {
        return Tag.builder()
                .slug(slug)
                .name(displayName(slug))
                .build();
    }

    private static BigDecimal coordinate(Double value) {
        return value == null ? null : BigDecimal.valueOf(value).setScale(8, RoundingMode.HALF_UP);
    }

    private static String displayName(String slug) {
        StringBuilder name = new StringBuilder();
        for (String word : slug.split("-")) {
            if (word.isEmpty()) continue;
            if (name.length() > 0) name.append(' ');
            name.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return name.toString();
    }
}
