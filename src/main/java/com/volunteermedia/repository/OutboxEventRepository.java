package com.volunteermedia.repository;

import com.volunteermedia.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for notification outbox rows.
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Oldest unpublished events first, at most {@code limit} of them.
     */
    @Query(value = "SELECT * FROM outbox_events WHERE published = false ORDER BY created_at ASC LIMIT ?1",
           nativeQuery = true)
    List<OutboxEvent> findUnpublishedEventsWithLimit(int limit);

    /**
     * Unpublished events older than {@code before}; anything here is stuck.
     */
    List<OutboxEvent> findByPublishedFalseAndCreatedAtBefore(Instant before);

    long countByPublishedFalse();
}
