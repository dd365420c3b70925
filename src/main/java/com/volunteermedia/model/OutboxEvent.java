package com.volunteermedia.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TRANSACTIONAL OUTBOX
 * ====================
 *
 * Notification events (announcement published, group update posted) are written here
 * in the same transaction as the announcement/update row itself. The request never
 * talks to Kafka, SMTP or GroupMe directly.
 *
 * LIFECYCLE:
 * ----------
 * 1. Service saves the business row and an OutboxEvent (published = false)
 * 2. OutboxEventPublisher polls unpublished rows in creation order
 * 3. Each row is sent to {@code topic} keyed by {@code messageKey}
 * 4. On success the row is marked published; on failure retryCount/lastError are updated
 *    and the row is picked up again on the next poll
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_outbox_published", columnList = "published"),
           @Index(name = "idx_outbox_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Unique id of the event; consumers use it for de-duplication.
     */
    @Column(nullable = false, length = 64)
    private String eventId;

    /**
     * Event class simple name, e.g. "AnnouncementPublished".
     */
    @Column(nullable = false, length = 100)
    private String eventType;

    @Column(nullable = false, length = 20000)
    private String payload;

    @Column(nullable = false, length = 200)
    private String topic;

    /**
     * Kafka record key; the group id for group-scoped events so they stay ordered per group.
     */
    @Column(length = 64)
    private String messageKey;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(length = 2000)
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}
