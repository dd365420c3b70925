package com.volunteermedia.config;

/**
 * Kafka topic names for notification events.
 */
public class KafkaTopics {

    // Site-wide or group announcement created with email/GroupMe delivery requested
    public static final String ANNOUNCEMENT_PUBLISHED = "volunteer.announcement.published";

    // Post on a group board created with delivery requested
    public static final String GROUP_UPDATE_POSTED = "volunteer.group-update.posted";

    private KafkaTopics() {
    }
}
