package com.todayatsg.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.event.CategoryRepository;
import com.todayatsg.backend.event.EventRepository;
import com.todayatsg.backend.event.TagRepository;
import com.todayatsg.backend.exception.PersistenceException;
import com.todayatsg.backend.model.dto.NormalizedEvent;
import com.todayatsg.backend.model.dto.WriteOutcome;
import com.todayatsg.backend.model.entity.Event;
import com.todayatsg.backend.model.entity.Tag;
import com.todayatsg.backend.model.enums.EventCategory;
import com.todayatsg.backend.model.enums.EventSource;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@DataJpaTest
@Import({EventPersistenceWriter.class, ApprovalPolicy.class, IngestionProperties.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class EventPersistenceWriterTest {

    @Autowired
    private EventPersistenceWriter writer;

    @Autowired
    private EventRepository eventRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private TagRepository tagRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void cleanDatabase() {
        eventRepository.deleteAll();
        tagRepository.deleteAll();
        categoryRepository.deleteAll();
    }

    @Test
    void insertsNewScrapedEvent() {
        WriteOutcome outcome = writer.write(jazzNight("Jazz Night"));

        assertThat(outcome.getAction()).isEqualTo(WriteOutcome.Action.INSERTED);
        inTransaction(() -> {
            Event stored = eventRepository.findById(outcome.getEventId()).orElseThrow();
            assertThat(stored.getTitle()).isEqualTo("Jazz Night");
            assertThat(stored.getSource()).isEqualTo(EventSource.SCRAPED);
            assertThat(stored.getScrapedFrom()).isEqualTo("visitsingapore");
            assertThat(stored.getExternalId()).isEqualTo("abc123");
            assertThat(stored.getIsApproved()).isTrue();
            assertThat(stored.getIsActive()).isTrue();
            assertThat(stored.getLatitude()).isEqualByComparingTo(new BigDecimal("1.2897"));
            assertThat(stored.getLongitude().scale()).isEqualTo(8);
            assertThat(stored.getCategory().getSlug()).isEqualTo("concerts");
            assertThat(stored.getTags()).extracting(Tag::getSlug).containsExactlyInAnyOrder("evening", "live-music");
            assertThat(stored.getLastScraped()).isNotNull();
        });
    }

    @Test
    void sameListingIsUpdatedInPlace() {
        WriteOutcome first = writer.write(jazzNight("Jazz Night"));
        Event moderated = eventRepository.findById(first.getEventId()).orElseThrow();
        moderated.setIsApproved(false);
        eventRepository.save(moderated);

        WriteOutcome second = writer.write(jazzNight("Jazz Night (Encore)"));

        assertThat(second.getAction()).isEqualTo(WriteOutcome.Action.UPDATED);
        assertThat(second.getEventId()).isEqualTo(first.getEventId());
        assertThat(eventRepository.count()).isEqualTo(1);
        Event stored = eventRepository.findById(first.getEventId()).orElseThrow();
        assertThat(stored.getTitle()).isEqualTo("Jazz Night (Encore)");
        assertThat(stored.getIsApproved()).isFalse();
    }

    @Test
    void categoriesAndTagsAreShared() {
        writer.write(jazzNight("Jazz Night"));
        NormalizedEvent other = jazzNight("Blues Evening");
        other.setExternalId("def456");
        writer.write(other);

        assertThat(eventRepository.count()).isEqualTo(2);
        assertThat(categoryRepository.count()).isEqualTo(1);
        assertThat(tagRepository.count()).isEqualTo(2);
        assertThat(tagRepository.findBySlug("live-music")).get().extracting(Tag::getName).isEqualTo("Live Music");
    }

    @Test
    void missingCategoryIsStoredAsUncategorized() {
        NormalizedEvent event = jazzNight("Jazz Night");
        event.setCategory(null);

        WriteOutcome outcome = writer.write(event);

        inTransaction(() -> assertThat(eventRepository.findById(outcome.getEventId()).orElseThrow()
                .getCategory().getSlug()).isEqualTo("uncategorized"));
    }

    @Test
    void databaseFailureBecomesPersistenceException() {
        NormalizedEvent broken = jazzNight("Jazz Night");
        broken.setLocation(null);

        assertThatThrownBy(() -> writer.write(broken))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("Jazz Night");
        assertThat(eventRepository.count()).isZero();
    }

    @Test
    void concurrentWritersShareANewTag() throws Exception {
        int rounds = 20;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < rounds; round++) {
                CyclicBarrier barrier = new CyclicBarrier(2);
                String tag = "harbour-round-" + round;
                List<Future<WriteOutcome>> writes = new ArrayList<>();
                for (String sourceId : List.of("visitsingapore", "eventbrite")) {
                    NormalizedEvent event = jazzNight("Jazz Night " + sourceId + " " + round);
                    event.setSourceId(sourceId);
                    event.setExternalId(sourceId + "-" + round);
                    event.setTags(new ArrayList<>(List.of("evening", tag)));
                    writes.add(pool.submit(() -> {
                        barrier.await(5, TimeUnit.SECONDS);
                        return writer.write(event);
                    }));
                }
                for (Future<WriteOutcome> write : writes) {
                    assertThat(write.get(10, TimeUnit.SECONDS).getAction()).isEqualTo(WriteOutcome.Action.INSERTED);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(eventRepository.count()).isEqualTo(2L * rounds);
        assertThat(tagRepository.count()).isEqualTo(rounds + 1L);
        assertThat(categoryRepository.count()).isEqualTo(1);
    }

    private void inTransaction(Runnable assertions) {
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> assertions.run());
    }

    private static NormalizedEvent jazzNight(String title) {
        return NormalizedEvent.builder()
                .sourceId("visitsingapore")
                .externalId("abc123")
                .title(title)
                .date(LocalDate.of(2030, 8, 3))
                .time(LocalTime.of(19, 30))
                .location("Esplanade Outdoor Theatre")
                .venue("Esplanade Outdoor Theatre")
                .latitude(1.2897)
                .longitude(103.8555)
                .category(EventCategory.CONCERTS)
                .tags(new ArrayList<>(List.of("evening", "live-music")))
                .build();
    }
}
