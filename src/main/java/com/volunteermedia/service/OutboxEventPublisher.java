package com.volunteermedia.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.volunteermedia.event.AnnouncementPublished;
import com.volunteermedia.event.GroupUpdatePosted;
import com.volunteermedia.model.OutboxEvent;
import com.volunteermedia.producer.EventProducer;
import com.volunteermedia.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * Polls the outbox table and hands unpublished events to Kafka.
 *
 * HOW IT WORKS:
 * -------------
 * 1. Every 500ms, load up to BATCH_SIZE unpublished events (oldest first)
 * 2. For each event: rebuild the record from its JSON payload and send it
 * 3. Wait for the broker ack, then mark the row published
 * 4. On failure, bump retryCount, store the error and move on; the next poll retries it
 *
 * A single instance is assumed. Running several replicas would need a lock around
 * {@link #publishEvents()} (e.g. ShedLock) to avoid double sends; consumers are idempotent
 * so a duplicate costs one skipped message, not a duplicate email.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;

    private static final int BATCH_SIZE = 50;
    private static final int MAX_RETRY_COUNT = 10; // Escalate log level after this many failures
    private static final long SEND_TIMEOUT_SECONDS = 10;
    private static final Duration STUCK_AFTER = Duration.ofMinutes(5);
    private static final int STUCK_REPORT_LIMIT = 10;
    private static final int MAX_ERROR_LENGTH = 2000;

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:500}")
    @Transactional
    public void publishEvents() {
        try {
            List<OutboxEvent> events = outboxEventRepository.findUnpublishedEventsWithLimit(BATCH_SIZE);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());

            for (OutboxEvent event : events) {
                try {
                    publishEvent(event);
                } catch (Exception e) {
                    handlePublishError(event, e);
                }
            }

        } catch (Exception e) {
            log.error("Error in outbox event publisher", e);
        }
    }

    void publishEvent(OutboxEvent outboxEvent) throws Exception {
        switch (outboxEvent.getEventType()) {
            case "AnnouncementPublished" -> eventProducer
                    .publishAnnouncement(objectMapper.readValue(outboxEvent.getPayload(), AnnouncementPublished.class))
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            case "GroupUpdatePosted" -> eventProducer
                    .publishGroupUpdate(objectMapper.readValue(outboxEvent.getPayload(), GroupUpdatePosted.class))
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            default ->
                throw new IllegalArgumentException("Unknown event type: " + outboxEvent.getEventType());
        }

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now());
        outboxEvent.setLastError(null);
        outboxEventRepository.save(outboxEvent);

        log.info("Published outbox event: {} (type: {})", outboxEvent.getEventId(), outboxEvent.getEventType());
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(truncate(e.getMessage()));
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Outbox event {} has failed {} times. Manual intervention may be required. Error: {}",
                      event.getEventId(), event.getRetryCount(), e.getMessage());
        } else {
            log.warn("Failed to publish outbox event {} (attempt {}): {}",
                     event.getEventId(), event.getRetryCount(), e.getMessage());
        }
    }

    /**
     * Logs unpublished rows older than {@link #STUCK_AFTER}. Only the oldest few are listed.
     */
    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        try {
            List<OutboxEvent> stuck = outboxEventRepository
                    .findByPublishedFalseAndCreatedAtBefore(Instant.now().minus(STUCK_AFTER));
            if (stuck.isEmpty()) {
                log.debug("Outbox backlog: {}", outboxEventRepository.countByPublishedFalse());
                return;
            }

            log.error("{} notification events unpublished for more than {} minutes",
                      stuck.size(), STUCK_AFTER.toMinutes());
            stuck.stream().limit(STUCK_REPORT_LIMIT).forEach(event ->
                    log.error("Stuck outbox event {} ({}) created {} after {} attempts: {}",
                              event.getEventId(), event.getEventType(), event.getCreatedAt(),
                              event.getRetryCount(), event.getLastError()));
        } catch (Exception e) {
            log.error("Outbox monitor failed", e);
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
