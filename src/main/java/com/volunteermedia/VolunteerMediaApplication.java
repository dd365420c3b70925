package com.volunteermedia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Volunteer media portal back end.
 *
 * Serves the REST API behind the volunteer single-page app:
 * - Users, groups and group membership (site admins and group admins)
 * - Animal profiles with status tracking, tags, photos and protocol documents
 * - Comments and structured session notes
 * - Site settings, announcements and group updates
 *
 * Request flow:
 * SPA -> REST API -> PostgreSQL (business rows + outbox) -> Outbox Publisher -> Kafka -> Notification consumers
 *
 * Email and GroupMe delivery never runs on the request thread. Announcements and group
 * updates only write an outbox row; the consumers fan the message out later.
 */
@SpringBootApplication
@EnableScheduling  // Outbox publisher and stuck-event monitor
public class VolunteerMediaApplication {

    public static void main(String[] args) {
        SpringApplication.run(VolunteerMediaApplication.class, args);
    }
}
