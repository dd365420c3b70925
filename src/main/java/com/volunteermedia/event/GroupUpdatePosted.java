package com.volunteermedia.event;

import java.time.Instant;

/**
 * Event published when a post on a group board asks for email or GroupMe delivery.
 */
public record GroupUpdatePosted(
    String eventId,
    Long updateId,
    Long groupId,
    String title,
    String content,
    boolean sendEmail,
    boolean sendGroupme,
    Instant timestamp
) {
    public GroupUpdatePosted {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (groupId == null) {
            throw new IllegalArgumentException("Group ID cannot be null");
        }
        if (content == null) {
            content = "";
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
