package com.todayatsg.backend.event;

import com.todayatsg.backend.model.entity.Event;
import com.todayatsg.backend.model.enums.EventSource;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface EventRepository extends JpaRepository<Event, Long> {

    // Upsert key for scraped events
    Optional<Event> findByScrapedFromAndExternalId(String scrapedFrom, String externalId);

    // Dedup window: every active event on a given day
    @Query("SELECT e FROM Event e WHERE e.date = :date AND e.isActive = true")
    List<Event> findActiveOnDate(@Param("date") LocalDate date);

    long countByIsActive(Boolean isActive);

    @Query("SELECT e.scrapedFrom, COUNT(e) FROM Event e WHERE e.source = :source GROUP BY e.scrapedFrom")
    List<Object[]> countBySourceGroupedByScrapedFrom(@Param("source") EventSource source);

    // Maintenance: archive rather than delete
    @Modifying
    @Query("UPDATE Event e SET e.isActive = false, e.updatedAt = :now "
            + "WHERE e.source = :source AND e.isApproved = false AND e.isActive = true AND e.createdAt < :cutoff")
    int archiveUnapprovedCreatedBefore(@Param("source") EventSource source,
                                       @Param("cutoff") LocalDateTime cutoff,
                                       @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE Event e SET e.isActive = false, e.updatedAt = :now WHERE e.isActive = true AND e.date < :cutoff")
    int archiveDatedBefore(@Param("cutoff") LocalDate cutoff, @Param("now") LocalDateTime now);
}
