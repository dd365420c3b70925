package com.volunteermedia.service;

import com.volunteermedia.config.KafkaTopics;
import com.volunteermedia.event.AnnouncementPublished;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Announcement;
import com.volunteermedia.model.GroupUpdate;
import com.volunteermedia.repository.AnnouncementRepository;
import com.volunteermedia.repository.GroupUpdateRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Announcements.
 *
 * SITE-WIDE vs GROUP:
 * ===================
 * Site-wide announcements (site admins) are stored in announcements and shown on every
 * dashboard. Group announcements (group admins) are stored as a post on the group board
 * so they show up in the group's feed, and are delivered with the announcement format.
 *
 * Delivery is never done here: when email or GroupMe is requested an AnnouncementPublished
 * event is written to the outbox in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnnouncementService {

    private final AnnouncementRepository announcementRepository;
    private final GroupUpdateRepository groupUpdateRepository;
    private final GroupService groupService;
    private final GroupAccessService groupAccessService;
    private final OutboxService outboxService;

    @Transactional(readOnly = true)
    public List<Announcement> latestAnnouncements() {
        return announcementRepository.findTop10ByDeletedAtIsNullOrderByCreatedAtDesc();
    }

    @Transactional
    public Announcement createAnnouncement(Long adminId, String title, String content,
                                           boolean sendEmail, boolean sendGroupme) {
        Announcement announcement = new Announcement();
        announcement.setUserId(adminId);
        announcement.setTitle(title.trim());
        announcement.setContent(content.trim());
        announcement.setSendEmail(sendEmail);
        announcement.setSendGroupme(sendGroupme);
        Announcement saved = announcementRepository.save(announcement);

        if (sendEmail || sendGroupme) {
            String eventId = UUID.randomUUID().toString();
            AnnouncementPublished event = new AnnouncementPublished(eventId, saved.getId(), null,
                    saved.getTitle(), saved.getContent(), sendEmail, sendGroupme, Instant.now());
            outboxService.enqueue(event, eventId, KafkaTopics.ANNOUNCEMENT_PUBLISHED, "site");
        }

        log.info("Admin {} created announcement {} (email={}, groupme={})",
                adminId, saved.getId(), sendEmail, sendGroupme);
        return saved;
    }

    @Transactional
    public void deleteAnnouncement(Long adminId, Long announcementId) {
        Announcement announcement = announcementRepository.findByIdAndDeletedAtIsNull(announcementId)
                .orElseThrow(() -> new NotFoundException("Announcement not found"));
        announcement.setDeletedAt(Instant.now());
        announcementRepository.save(announcement);
        log.info("Admin {} deleted announcement {}", adminId, announcementId);
    }

    /**
     * Group admin announcement: a board post plus announcement-style delivery to the group.
     */
    @Transactional
    public GroupUpdate createGroupAnnouncement(AuthenticatedUser user, Long groupId, String title, String content,
                                               boolean sendEmail, boolean sendGroupme) {
        groupAccessService.requireModerator(user, groupId);
        groupService.getActiveGroup(groupId);

        GroupUpdate post = new GroupUpdate();
        post.setGroupId(groupId);
        post.setUserId(user.userId());
        post.setTitle(title.trim());
        post.setContent(content.trim());
        post.setSendEmail(sendEmail);
        post.setSendGroupme(sendGroupme);
        GroupUpdate saved = groupUpdateRepository.save(post);

        if (sendEmail || sendGroupme) {
            String eventId = UUID.randomUUID().toString();
            AnnouncementPublished event = new AnnouncementPublished(eventId, saved.getId(), groupId,
                    saved.getTitle(), saved.getContent(), sendEmail, sendGroupme, Instant.now());
            outboxService.enqueue(event, eventId, KafkaTopics.ANNOUNCEMENT_PUBLISHED, String.valueOf(groupId));
        }

        log.info("User {} posted announcement {} to group {}", user.userId(), saved.getId(), groupId);
        return saved;
    }
}
