package com.volunteermedia.service;

import com.volunteermedia.dto.AccountView;
import com.volunteermedia.dto.ProfileUpdateRequest;
import com.volunteermedia.dto.UserProfileView;
import com.volunteermedia.exception.ConflictException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.User;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.repository.UserGroupRepository;
import com.volunteermedia.repository.UserRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Self-service account operations for the signed-in user, plus the public volunteer profile.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final UserRepository userRepository;
    private final GroupRepository groupRepository;
    private final UserGroupRepository userGroupRepository;
    private final AnimalCommentRepository commentRepository;
    private final GroupAccessService groupAccessService;

    @Transactional(readOnly = true)
    public AccountView getCurrentUser(Long userId) {
        User user = requireUser(userId);
        return new AccountView(user,
                groupRepository.findGroupsForUser(userId),
                userGroupRepository.existsByUserIdAndGroupAdminTrue(userId));
    }

    @Transactional(readOnly = true)
    public Map<String, Object> getEmailPreferences(Long userId) {
        return preferences(requireUser(userId));
    }

    @Transactional
    public Map<String, Object> updateEmailPreferences(Long userId, Boolean emailNotificationsEnabled,
                                                      Boolean showLengthOfStay) {
        User user = requireUser(userId);
        if (emailNotificationsEnabled != null) {
            user.setEmailNotificationsEnabled(emailNotificationsEnabled);
        }
        if (showLengthOfStay != null) {
            user.setShowLengthOfStay(showLengthOfStay);
        }
        userRepository.save(user);
        return preferences(user);
    }

    @Transactional(readOnly = true)
    public Long getDefaultGroup(Long userId) {
        return requireUser(userId).getDefaultGroupId();
    }

    @Transactional
    public Long setDefaultGroup(AuthenticatedUser caller, Long groupId) {
        groupRepository.findByIdAndDeletedAtIsNull(groupId)
                .orElseThrow(() -> new NotFoundException("Group not found"));
        if (!groupAccessService.isMember(caller.userId(), groupId)) {
            throw new ForbiddenException("You are not a member of this group");
        }
        User user = requireUser(caller.userId());
        user.setDefaultGroupId(groupId);
        userRepository.save(user);
        return groupId;
    }

    @Transactional
    public User updateProfile(Long userId, ProfileUpdateRequest request) {
        User user = requireUser(userId);

        String email = request.getEmail().trim();
        if (userRepository.existsByEmailIgnoreCaseAndIdNot(email, userId)) {
            throw new ConflictException("Email already in use");
        }

        user.setEmail(email);
        user.setFirstName(request.getFirstName());
        user.setLastName(request.getLastName());
        user.setPhoneNumber(request.getPhoneNumber());
        if (request.getHideEmail() != null) {
            user.setHideEmail(request.getHideEmail());
        }
        if (request.getHidePhoneNumber() != null) {
            user.setHidePhoneNumber(request.getHidePhoneNumber());
        }

        User saved = userRepository.save(user);
        log.info("User {} updated their profile", userId);
        return saved;
    }

    /**
     * Contact details honour the user's privacy flags unless the viewer is a site admin
     * or the user themselves.
     */
    @Transactional(readOnly = true)
    public UserProfileView getUserProfile(AuthenticatedUser viewer, Long userId) {
        User user = requireUser(userId);
        boolean privileged = viewer.admin() || viewer.userId().equals(userId);

        return UserProfileView.builder()
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .email(privileged || !user.isHideEmail() ? user.getEmail() : null)
                .phoneNumber(privileged || !user.isHidePhoneNumber() ? user.getPhoneNumber() : null)
                .createdAt(user.getCreatedAt())
                .lastLogin(user.getLastLogin())
                .groups(groupRepository.findGroupsForUser(userId))
                .commentCount(commentRepository.countByUserIdAndDeletedAtIsNull(userId))
                .recentComments(commentRepository.findTop10ByUserIdAndDeletedAtIsNullOrderByCreatedAtDesc(userId))
                .build();
    }

    private User requireUser(Long userId) {
        return userRepository.findByIdAndDeletedAtIsNull(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    private static Map<String, Object> preferences(User user) {
        Map<String, Object> prefs = new LinkedHashMap<>();
        prefs.put("email_notifications_enabled", user.isEmailNotificationsEnabled());
        prefs.put("show_length_of_stay", user.isShowLengthOfStay());
        return prefs;
    }
}
