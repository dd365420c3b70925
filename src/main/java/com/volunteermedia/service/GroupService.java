package com.volunteermedia.service;

import com.volunteermedia.config.RedisConfig;
import com.volunteermedia.dto.GroupRequest;
import com.volunteermedia.dto.GroupSettingsRequest;
import com.volunteermedia.dto.MemberView;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ConflictException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Group;
import com.volunteermedia.model.User;
import com.volunteermedia.model.UserGroup;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.repository.UserGroupRepository;
import com.volunteermedia.repository.UserRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Groups and group membership.
 *
 * Site admins create, edit and delete groups. Group admins manage their group's members
 * and a subset of its settings (description, hero image, protocols flag, GroupMe bot).
 *
 * CACHING:
 * ========
 * {@link #getActiveGroup(Long)} is cached in the {@code groups} region (10 min) and evicted
 * by every write to that group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupService {

    private static final Pattern GROUPME_BOT_ID = Pattern.compile("^[0-9a-fA-F]{26}$");

    private final GroupRepository groupRepository;
    private final UserGroupRepository userGroupRepository;
    private final UserRepository userRepository;
    private final GroupAccessService groupAccessService;
    private final CommentTagService commentTagService;

    @Transactional(readOnly = true)
    public List<Group> listGroups(AuthenticatedUser user) {
        return user.admin()
                ? groupRepository.findByDeletedAtIsNullOrderByNameAsc()
                : groupRepository.findGroupsForUser(user.userId());
    }

    @Cacheable(cacheNames = RedisConfig.GROUPS_CACHE, key = "#groupId")
    @Transactional(readOnly = true)
    public Group getActiveGroup(Long groupId) {
        return groupRepository.findByIdAndDeletedAtIsNull(groupId)
                .orElseThrow(() -> new NotFoundException("Group not found"));
    }

    @Transactional(readOnly = true)
    public Group getGroup(AuthenticatedUser user, Long groupId) {
        Group group = groupRepository.findByIdAndDeletedAtIsNull(groupId)
                .orElseThrow(() -> new NotFoundException("Group not found"));
        groupAccessService.requireAccess(user, groupId);
        return group;
    }

    @Transactional(readOnly = true)
    public Map<String, Object> membership(AuthenticatedUser user, Long groupId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", user.userId());
        body.put("group_id", groupId);
        body.put("is_member", groupAccessService.isMember(user.userId(), groupId));
        body.put("is_group_admin", groupAccessService.isGroupAdmin(user.userId(), groupId));
        body.put("is_site_admin", user.admin());
        return body;
    }

    // ==================== SITE ADMIN ====================

    @Transactional(readOnly = true)
    public List<Group> listAllGroups() {
        return groupRepository.findByDeletedAtIsNullOrderByNameAsc();
    }

    @Transactional
    public Group createGroup(GroupRequest request) {
        String name = request.getName().trim();
        if (groupRepository.existsByNameIgnoreCaseAndDeletedAtIsNull(name)) {
            throw new ConflictException("Group name already exists");
        }
        validateBotId(request.getGroupmeBotId());

        Group group = new Group();
        group.setName(name);
        applyRequest(group, request);

        Group saved = groupRepository.save(group);
        commentTagService.ensureSystemTags(saved.getId());
        log.info("Created group {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    @CacheEvict(cacheNames = RedisConfig.GROUPS_CACHE, key = "#groupId")
    @Transactional
    public Group updateGroup(Long groupId, GroupRequest request) {
        Group group = requireGroup(groupId);
        String name = request.getName().trim();
        if (groupRepository.existsByNameIgnoreCaseAndDeletedAtIsNullAndIdNot(name, groupId)) {
            throw new ConflictException("Group name already exists");
        }
        validateBotId(request.getGroupmeBotId());

        group.setName(name);
        applyRequest(group, request);
        return groupRepository.save(group);
    }

    @CacheEvict(cacheNames = RedisConfig.GROUPS_CACHE, key = "#groupId")
    @Transactional
    public void deleteGroup(Long groupId) {
        Group group = requireGroup(groupId);
        group.setDeletedAt(Instant.now());
        groupRepository.save(group);
        log.info("Deleted group {} ({})", groupId, group.getName());
    }

    @Transactional
    public void addUserToGroup(Long groupId, Long userId) {
        requireGroup(groupId);
        requireUser(userId);
        if (!userGroupRepository.existsByUserIdAndGroupId(userId, groupId)) {
            userGroupRepository.save(new UserGroup(userId, groupId, false));
        }
    }

    @Transactional
    public void removeUserFromGroup(Long groupId, Long userId) {
        requireGroup(groupId);
        requireUser(userId);
        userGroupRepository.findByUserIdAndGroupId(userId, groupId).ifPresent(userGroupRepository::delete);
    }

    // ==================== GROUP ADMIN ====================

    /**
     * Contact details follow each member's privacy flags unless the viewer moderates the group
     * or is looking at themselves.
     */
    @Transactional(readOnly = true)
    public List<MemberView> listMembers(AuthenticatedUser viewer, Long groupId) {
        requireGroup(groupId);
        groupAccessService.requireAccess(viewer, groupId);
        boolean moderator = groupAccessService.canModerate(viewer, groupId);

        return userGroupRepository.findActiveMembers(groupId).stream()
                .map(membership -> toMemberView(membership, moderator || viewer.userId().equals(membership.getUserId())))
                .toList();
    }

    @Transactional
    public void addMember(AuthenticatedUser caller, Long groupId, Long userId) {
        requireGroup(groupId);
        groupAccessService.requireModerator(caller, groupId);
        requireUser(userId);
        if (userGroupRepository.existsByUserIdAndGroupId(userId, groupId)) {
            throw new ConflictException("User is already a member of this group");
        }
        userGroupRepository.save(new UserGroup(userId, groupId, false));
        log.info("User {} added user {} to group {}", caller.userId(), userId, groupId);
    }

    @Transactional
    public void removeMember(AuthenticatedUser caller, Long groupId, Long userId) {
        requireGroup(groupId);
        groupAccessService.requireModerator(caller, groupId);
        UserGroup membership = userGroupRepository.findByUserIdAndGroupId(userId, groupId)
                .orElseThrow(() -> new NotFoundException("User is not a member of this group"));
        userGroupRepository.delete(membership);
        log.info("User {} removed user {} from group {}", caller.userId(), userId, groupId);
    }

    @Transactional
    public void promoteMember(AuthenticatedUser caller, Long groupId, Long userId) {
        requireGroup(groupId);
        groupAccessService.requireModerator(caller, groupId);
        UserGroup membership = userGroupRepository.findByUserIdAndGroupId(userId, groupId)
                .orElseThrow(() -> new NotFoundException("User is not a member of this group"));
        if (membership.isGroupAdmin()) {
            throw new ConflictException("User is already a group admin");
        }
        membership.setGroupAdmin(true);
        userGroupRepository.save(membership);
        log.info("User {} promoted user {} to group admin of {}", caller.userId(), userId, groupId);
    }

    @Transactional
    public void demoteMember(AuthenticatedUser caller, Long groupId, Long userId) {
        requireGroup(groupId);
        groupAccessService.requireModerator(caller, groupId);
        UserGroup membership = userGroupRepository.findByUserIdAndGroupId(userId, groupId)
                .filter(UserGroup::isGroupAdmin)
                .orElseThrow(() -> new NotFoundException("User is not a group admin"));
        membership.setGroupAdmin(false);
        userGroupRepository.save(membership);
        log.info("User {} demoted user {} from group admin of {}", caller.userId(), userId, groupId);
    }

    @CacheEvict(cacheNames = RedisConfig.GROUPS_CACHE, key = "#groupId")
    @Transactional
    public Group updateSettings(AuthenticatedUser caller, Long groupId, GroupSettingsRequest request) {
        Group group = requireGroup(groupId);
        groupAccessService.requireModerator(caller, groupId);

        if (request.getDescription() != null) {
            group.setDescription(request.getDescription());
        }
        if (request.getHeroImageUrl() != null) {
            group.setHeroImageUrl(request.getHeroImageUrl().isBlank()
                    ? Group.DEFAULT_HERO_IMAGE : request.getHeroImageUrl());
        }
        if (request.getHasProtocols() != null) {
            group.setHasProtocols(request.getHasProtocols());
        }
        if (request.getGroupmeBotId() != null) {
            validateBotId(request.getGroupmeBotId());
            group.setGroupmeBotId(request.getGroupmeBotId().trim());
        }
        if (request.getGroupmeEnabled() != null) {
            group.setGroupmeEnabled(request.getGroupmeEnabled());
        }
        return groupRepository.save(group);
    }

    static void validateBotId(String botId) {
        if (botId != null && !botId.isBlank() && !GROUPME_BOT_ID.matcher(botId.trim()).matches()) {
            throw new BadRequestException("Invalid GroupMe bot ID. Must be a 26-character hexadecimal string.");
        }
    }

    private void applyRequest(Group group, GroupRequest request) {
        group.setDescription(request.getDescription());
        group.setImageUrl(request.getImageUrl());
        group.setHeroImageUrl(request.getHeroImageUrl() == null || request.getHeroImageUrl().isBlank()
                ? Group.DEFAULT_HERO_IMAGE : request.getHeroImageUrl());
        group.setHasProtocols(request.isHasProtocols());
        group.setGroupmeBotId(request.getGroupmeBotId() == null ? null : request.getGroupmeBotId().trim());
        group.setGroupmeEnabled(request.isGroupmeEnabled());
    }

    private MemberView toMemberView(UserGroup membership, boolean privileged) {
        User user = membership.getUser();
        return MemberView.builder()
                .userId(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .email(privileged || !user.isHideEmail() ? user.getEmail() : null)
                .phoneNumber(privileged || !user.isHidePhoneNumber() ? user.getPhoneNumber() : null)
                .groupAdmin(membership.isGroupAdmin())
                .siteAdmin(user.isAdmin())
                .joinedAt(membership.getCreatedAt())
                .build();
    }

    private Group requireGroup(Long groupId) {
        return groupRepository.findByIdAndDeletedAtIsNull(groupId)
                .orElseThrow(() -> new NotFoundException("Group not found"));
    }

    private User requireUser(Long userId) {
        return userRepository.findByIdAndDeletedAtIsNull(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }
}
