package com.volunteermedia.producer;

import com.volunteermedia.config.KafkaTopics;
import com.volunteermedia.event.AnnouncementPublished;
import com.volunteermedia.event.GroupUpdatePosted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Sends notification events to Kafka.
 *
 * Only the outbox publisher calls this; request handlers write outbox rows instead.
 * The returned future completes when the broker acknowledges the record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public CompletableFuture<SendResult<String, Object>> publishAnnouncement(AnnouncementPublished event) {
        String key = event.siteWide() ? "site" : String.valueOf(event.groupId());
        log.info("Publishing AnnouncementPublished event: {} (announcement {})", event.eventId(), event.announcementId());
        return send(KafkaTopics.ANNOUNCEMENT_PUBLISHED, key, event, event.eventId());
    }

    public CompletableFuture<SendResult<String, Object>> publishGroupUpdate(GroupUpdatePosted event) {
        log.info("Publishing GroupUpdatePosted event: {} (update {})", event.eventId(), event.updateId());
        return send(KafkaTopics.GROUP_UPDATE_POSTED, String.valueOf(event.groupId()), event, event.eventId());
    }

    private CompletableFuture<SendResult<String, Object>> send(String topic, String key, Object event, String eventId) {
        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish event {} to {}", eventId, topic, ex);
            } else {
                log.debug("Published event {} to {} partition {}",
                        eventId, topic, result.getRecordMetadata().partition());
            }
        });

        return future;
    }
}
