package com.volunteermedia.notification;

import com.volunteermedia.event.AnnouncementPublished;
import com.volunteermedia.event.GroupUpdatePosted;
import com.volunteermedia.model.Group;
import com.volunteermedia.model.User;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Fans a notification event out to its recipients.
 *
 * DELIVERY RULES:
 * ===============
 * Email:   every active user with email notifications enabled. Group-scoped events only
 *          go to members of that group.
 * GroupMe: the event's group bot, or for site-wide announcements every group with an
 *          enabled bot.
 *
 * A failing recipient is logged and skipped; the rest still receive the message.
 * Each method returns the number of successful deliveries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final EmailService emailService;
    private final GroupMeService groupMeService;
    private final UserRepository userRepository;
    private final GroupRepository groupRepository;

    @Transactional(readOnly = true)
    public int emailAnnouncement(AnnouncementPublished event) {
        return sendEmails(recipients(event.groupId()), event.title(), event.content());
    }

    @Transactional(readOnly = true)
    public int emailGroupUpdate(GroupUpdatePosted event) {
        return sendEmails(recipients(event.groupId()), event.title(), event.content());
    }

    @Transactional(readOnly = true)
    public int postAnnouncementToGroupMe(AnnouncementPublished event) {
        List<Group> targets = event.siteWide()
                ? groupRepository.findByGroupmeEnabledTrueAndDeletedAtIsNull()
                : groupRepository.findByIdAndDeletedAtIsNull(event.groupId()).stream().toList();

        int sent = 0;
        for (Group group : targets) {
            if (postToGroup(group, true, event.title(), event.content())) {
                sent++;
            }
        }
        log.info("Posted announcement {} to {}/{} GroupMe groups", event.announcementId(), sent, targets.size());
        return sent;
    }

    @Transactional(readOnly = true)
    public int postGroupUpdateToGroupMe(GroupUpdatePosted event) {
        return groupRepository.findByIdAndDeletedAtIsNull(event.groupId())
                .map(group -> postToGroup(group, false, event.title(), event.content()) ? 1 : 0)
                .orElseGet(() -> {
                    log.warn("Group {} not found for update {}, skipping GroupMe", event.groupId(), event.updateId());
                    return 0;
                });
    }

    private List<User> recipients(Long groupId) {
        return groupId == null
                ? userRepository.findByEmailNotificationsEnabledTrueAndDeletedAtIsNull()
                : userRepository.findNotificationRecipientsInGroup(groupId);
    }

    private int sendEmails(List<User> users, String title, String content) {
        if (!emailService.isConfigured()) {
            log.warn("Email not configured; skipping {} notification emails for \"{}\"", users.size(), title);
            return 0;
        }

        log.info("Sending notification emails to {} users", users.size());
        int sent = 0;
        for (User user : users) {
            try {
                emailService.sendAnnouncementEmail(user.getEmail(), title, content);
                sent++;
            } catch (EmailDeliveryException e) {
                log.error("Failed to send notification email to user {}: {}", user.getId(), e.getMessage());
            }
        }
        log.info("Sent {}/{} notification emails", sent, users.size());
        return sent;
    }

    private boolean postToGroup(Group group, boolean announcement, String title, String content) {
        if (!group.isGroupmeReady()) {
            log.info("GroupMe not enabled for group {} ({}), skipping", group.getId(), group.getName());
            return false;
        }
        try {
            if (announcement) {
                groupMeService.sendAnnouncement(group.getGroupmeBotId(), title, content);
            } else {
                groupMeService.sendUpdate(group.getGroupmeBotId(), title, content);
            }
            log.info("Sent GroupMe message to group {} ({})", group.getId(), group.getName());
            return true;
        } catch (GroupMeDeliveryException e) {
            log.error("Failed to send GroupMe message to group {}: {}", group.getId(), e.getMessage());
            return false;
        }
    }
}
