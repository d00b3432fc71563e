package com.todayatsg.backend.event;

import com.todayatsg.backend.model.entity.Review;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ReviewRepository extends JpaRepository<Review, Long> {

    Optional<Review> findByUserIdAndEventId(Long userId, Long eventId);

    long countByEventId(Long eventId);

    @Query("SELECT AVG(r.rating) FROM Review r WHERE r.event.id = :eventId")
    Double averageRatingForEvent(@Param("eventId") Long eventId);
}
