package com.volunteermedia.event;

import java.time.Instant;

/**
 * Event published when an announcement is created with email or GroupMe delivery requested.
 *
 * {@code groupId} is null for site-wide announcements; in that case GroupMe posts go to
 * every group with an enabled bot.
 */
public record AnnouncementPublished(
    String eventId,
    Long announcementId,
    Long groupId,
    String title,
    String content,
    boolean sendEmail,
    boolean sendGroupme,
    Instant timestamp
) {
    public AnnouncementPublished {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title cannot be null or empty");
        }
        if (content == null) {
            content = "";
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean siteWide() {
        return groupId == null;
    }
}
