package com.volunteermedia.consumer;

import com.volunteermedia.config.KafkaTopics;
import com.volunteermedia.event.AnnouncementPublished;
import com.volunteermedia.event.GroupUpdatePosted;
import com.volunteermedia.notification.NotificationService;
import com.volunteermedia.service.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Delivers announcements and group updates to email and GroupMe.
 *
 * IDEMPOTENCY:
 * ============
 * Email and GroupMe are claimed separately (consumer names "email" and "groupme"), so a
 * redelivery after a GroupMe failure does not email everybody a second time. A claim is
 * released when its channel throws, which lets the container's retry run that channel again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationConsumer {

    static final String EMAIL_CHANNEL = "email";
    static final String GROUPME_CHANNEL = "groupme";

    private final IdempotencyService idempotencyService;
    private final NotificationService notificationService;

    @KafkaListener(
            topics = KafkaTopics.ANNOUNCEMENT_PUBLISHED,
            groupId = "${app.notifications.consumer-group:volunteer-media-notifications}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onAnnouncement(AnnouncementPublished event) {
        log.info("Received AnnouncementPublished event {} (announcement {})", event.eventId(), event.announcementId());
        String type = AnnouncementPublished.class.getSimpleName();

        if (event.sendEmail()) {
            deliver(type, event.eventId(), EMAIL_CHANNEL, () -> notificationService.emailAnnouncement(event));
        }
        if (event.sendGroupme()) {
            deliver(type, event.eventId(), GROUPME_CHANNEL, () -> notificationService.postAnnouncementToGroupMe(event));
        }
    }

    @KafkaListener(
            topics = KafkaTopics.GROUP_UPDATE_POSTED,
            groupId = "${app.notifications.consumer-group:volunteer-media-notifications}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onGroupUpdate(GroupUpdatePosted event) {
        log.info("Received GroupUpdatePosted event {} (group {}, update {})",
                event.eventId(), event.groupId(), event.updateId());
        String type = GroupUpdatePosted.class.getSimpleName();

        if (event.sendEmail()) {
            deliver(type, event.eventId(), EMAIL_CHANNEL, () -> notificationService.emailGroupUpdate(event));
        }
        if (event.sendGroupme()) {
            deliver(type, event.eventId(), GROUPME_CHANNEL, () -> notificationService.postGroupUpdateToGroupMe(event));
        }
    }

    private void deliver(String eventType, String eventId, String channel, Supplier<Integer> delivery) {
        if (!idempotencyService.tryAcquire(eventType, eventId, channel)) {
            return;
        }
        try {
            int delivered = delivery.get();
            log.info("Delivered {} {} via {} to {} recipients", eventType, eventId, channel, delivered);
        } catch (RuntimeException e) {
            idempotencyService.release(eventType, eventId, channel);
            throw e;
        }
    }
}
