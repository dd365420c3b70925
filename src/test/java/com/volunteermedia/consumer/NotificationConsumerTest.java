package com.volunteermedia.consumer;

import com.volunteermedia.event.AnnouncementPublished;
import com.volunteermedia.event.GroupUpdatePosted;
import com.volunteermedia.notification.NotificationService;
import com.volunteermedia.service.IdempotencyService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationConsumerTest {

    @Mock
    private IdempotencyService idempotencyService;
    @Mock
    private NotificationService notificationService;

    @InjectMocks
    private NotificationConsumer consumer;

    private static final AnnouncementPublished ANNOUNCEMENT = new AnnouncementPublished(
            "evt-1", 5L, null, "Adoption day", "Saturday at noon", true, true, null);

    @Test
    void duplicateEmailDeliveryIsSkipped() {
        when(idempotencyService.tryAcquire("AnnouncementPublished", "evt-1", "email")).thenReturn(false);
        when(idempotencyService.tryAcquire("AnnouncementPublished", "evt-1", "groupme")).thenReturn(true);
        when(notificationService.postAnnouncementToGroupMe(ANNOUNCEMENT)).thenReturn(2);

        consumer.onAnnouncement(ANNOUNCEMENT);

        verify(notificationService, never()).emailAnnouncement(any());
        verify(notificationService).postAnnouncementToGroupMe(ANNOUNCEMENT);
    }

    @Test
    void failedChannelReleasesItsClaim() {
        GroupUpdatePosted update = new GroupUpdatePosted("evt-2", 9L, 4L, "Walk schedule", "New slots",
                false, true, null);
        when(idempotencyService.tryAcquire("GroupUpdatePosted", "evt-2", "groupme")).thenReturn(true);
        when(notificationService.postGroupUpdateToGroupMe(update)).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> consumer.onGroupUpdate(update)).hasMessage("db down");

        verify(idempotencyService).release("GroupUpdatePosted", "evt-2", "groupme");
        verify(notificationService, never()).emailGroupUpdate(any());
    }

    @Test
    void channelsNotRequestedAreNotClaimed() {
        AnnouncementPublished emailOnly = new AnnouncementPublished(
                "evt-3", 6L, null, "Closed Monday", "Holiday", true, false, null);
        when(idempotencyService.tryAcquire("AnnouncementPublished", "evt-3", "email")).thenReturn(true);

        consumer.onAnnouncement(emailOnly);

        verify(notificationService).emailAnnouncement(emailOnly);
        verify(idempotencyService, never()).tryAcquire("AnnouncementPublished", "evt-3", "groupme");
        verify(notificationService, never()).postAnnouncementToGroupMe(any());
    }
}
