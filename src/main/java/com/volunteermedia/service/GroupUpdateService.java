package com.volunteermedia.service;

import com.volunteermedia.config.KafkaTopics;
import com.volunteermedia.event.GroupUpdatePosted;
import com.volunteermedia.model.GroupUpdate;
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
 * Posts on a group's board. Any member may post; delivery goes through the outbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupUpdateService {

    private final GroupUpdateRepository groupUpdateRepository;
    private final GroupService groupService;
    private final GroupAccessService groupAccessService;
    private final OutboxService outboxService;

    @Transactional(readOnly = true)
    public List<GroupUpdate> listUpdates(AuthenticatedUser user, Long groupId) {
        groupAccessService.requireAccess(user, groupId);
        return groupUpdateRepository.findByGroupIdAndDeletedAtIsNullOrderByCreatedAtDesc(groupId);
    }

    @Transactional
    public GroupUpdate createUpdate(AuthenticatedUser user, Long groupId, String title, String content,
                                    String imageUrl, boolean sendEmail, boolean sendGroupme) {
        groupAccessService.requireAccess(user, groupId);
        groupService.getActiveGroup(groupId);

        GroupUpdate update = new GroupUpdate();
        update.setGroupId(groupId);
        update.setUserId(user.userId());
        update.setTitle(title.trim());
        update.setContent(content.trim());
        update.setImageUrl(imageUrl);
        update.setSendEmail(sendEmail);
        update.setSendGroupme(sendGroupme);
        GroupUpdate saved = groupUpdateRepository.save(update);

        if (sendEmail || sendGroupme) {
            String eventId = UUID.randomUUID().toString();
            GroupUpdatePosted event = new GroupUpdatePosted(eventId, saved.getId(), groupId,
                    saved.getTitle(), saved.getContent(), sendEmail, sendGroupme, Instant.now());
            outboxService.enqueue(event, eventId, KafkaTopics.GROUP_UPDATE_POSTED, String.valueOf(groupId));
        }

        log.info("User {} posted update {} to group {}", user.userId(), saved.getId(), groupId);
        return saved;
    }
}
