package com.volunteermedia.service;

import com.volunteermedia.dto.AccountView;
import com.volunteermedia.dto.CreateUserRequest;
import com.volunteermedia.dto.UpdateUserRequest;
import com.volunteermedia.dto.UserCreatedResponse;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ConflictException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Group;
import com.volunteermedia.model.User;
import com.volunteermedia.model.UserGroup;
import com.volunteermedia.notification.EmailDeliveryException;
import com.volunteermedia.notification.EmailService;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.repository.UserGroupRepository;
import com.volunteermedia.repository.UserRepository;
import com.volunteermedia.security.AuditLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Site-admin management of user accounts. Every change is written to the audit log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserAdminService {

    static final int MIN_PASSWORD_LENGTH = 8;

    private final UserRepository userRepository;
    private final GroupRepository groupRepository;
    private final UserGroupRepository userGroupRepository;
    private final AuthService authService;
    private final EmailService emailService;
    private final AuditLogger auditLogger;

    @Transactional(readOnly = true)
    public List<AccountView> listUsers() {
        return userRepository.findByDeletedAtIsNullOrderByUsernameAsc().stream()
                .map(this::view)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<User> listDeletedUsers() {
        return userRepository.findByDeletedAtIsNotNullOrderByDeletedAtDesc();
    }

    /**
     * Create an account with either a password set by the admin or an emailed setup link.
     * A setup email that cannot be delivered does not roll the user back; the response then
     * carries a warning instead of a message.
     */
    @Transactional
    public UserCreatedResponse createUser(Long adminId, CreateUserRequest request) {
        String password = request.getPassword();
        boolean hasPassword = password != null && !password.isEmpty();

        if (!hasPassword && !request.isSendSetupEmail()) {
            throw new BadRequestException("Either password must be provided or send_setup_email must be true");
        }
        if (hasPassword && password.length() < MIN_PASSWORD_LENGTH) {
            throw new BadRequestException("Password must be at least 8 characters");
        }
        if (userRepository.existsByUsernameIgnoreCase(request.getUsername())
                || userRepository.existsByEmailIgnoreCase(request.getEmail())) {
            throw new ConflictException("Username or email already exists");
        }
        if (!hasPassword && !emailService.isConfigured()) {
            throw new BadRequestException("Email service is not configured. Please provide a password instead.");
        }

        User user = new User();
        user.setUsername(request.getUsername().trim());
        user.setEmail(request.getEmail().trim());
        user.setFirstName(request.getFirstName());
        user.setLastName(request.getLastName());
        user.setPhoneNumber(request.getPhoneNumber());
        user.setAdmin(request.isAdmin());
        user.setEmailNotificationsEnabled(true);

        String setupToken = null;
        if (hasPassword) {
            user.setPassword(authService.hashPassword(password));
        } else {
            user.setPassword(authService.placeholderPasswordHash());
            setupToken = authService.issueSetupToken(user);
        }

        User saved = userRepository.save(user);
        replaceMemberships(saved.getId(), request.getGroupIds());
        auditLogger.adminAction(adminId, "create_user", saved.getId());

        AccountView view = view(saved);
        if (setupToken == null) {
            return new UserCreatedResponse(view, "User created successfully", null);
        }

        try {
            emailService.sendPasswordSetupEmail(saved.getEmail(), saved.getUsername(), setupToken);
            return new UserCreatedResponse(view,
                    "User created successfully. Password setup email sent to " + saved.getEmail(), null);
        } catch (EmailDeliveryException e) {
            log.error("Failed to send setup email to new user {}: {}", saved.getId(), e.getMessage());
            return new UserCreatedResponse(view, null,
                    "User created successfully, but the setup email could not be sent. "
                            + "Use 'Resend invitation' to try again, or set a temporary password.");
        }
    }

    @Transactional
    public AccountView updateUser(Long adminId, Long userId, UpdateUserRequest request) {
        User user = requireActive(userId);

        if (request.getUsername() != null && !request.getUsername().equalsIgnoreCase(user.getUsername())) {
            if (userRepository.existsByUsernameIgnoreCase(request.getUsername())) {
                throw new ConflictException("Username already exists");
            }
            user.setUsername(request.getUsername().trim());
        }
        if (request.getEmail() != null) {
            if (userRepository.existsByEmailIgnoreCaseAndIdNot(request.getEmail(), userId)) {
                throw new ConflictException("Email already in use");
            }
            user.setEmail(request.getEmail().trim());
        }
        if (request.getFirstName() != null) {
            user.setFirstName(request.getFirstName());
        }
        if (request.getLastName() != null) {
            user.setLastName(request.getLastName());
        }
        if (request.getPhoneNumber() != null) {
            user.setPhoneNumber(request.getPhoneNumber());
        }
        if (request.getAdmin() != null) {
            if (!request.getAdmin() && adminId.equals(userId)) {
                throw new BadRequestException("You cannot remove your own admin access");
            }
            user.setAdmin(request.getAdmin());
        }

        User saved = userRepository.save(user);
        if (request.getGroupIds() != null) {
            replaceMemberships(userId, request.getGroupIds());
        }
        auditLogger.adminAction(adminId, "update_user", userId);
        return view(saved);
    }

    @Transactional
    public void deleteUser(Long adminId, Long userId) {
        if (adminId.equals(userId)) {
            throw new BadRequestException("You cannot delete your own account");
        }
        User user = requireActive(userId);
        user.setDeletedAt(Instant.now());
        userRepository.save(user);
        auditLogger.adminAction(adminId, "delete_user", userId);
    }

    @Transactional
    public User restoreUser(Long adminId, Long userId) {
        User user = userRepository.findById(userId)
                .filter(u -> u.getDeletedAt() != null)
                .orElseThrow(() -> new NotFoundException("User not found"));
        user.setDeletedAt(null);
        User saved = userRepository.save(user);
        auditLogger.adminAction(adminId, "restore_user", userId);
        return saved;
    }

    @Transactional
    public User promote(Long adminId, Long userId) {
        User user = requireActive(userId);
        if (user.isAdmin()) {
            throw new BadRequestException("User is already admin");
        }
        user.setAdmin(true);
        auditLogger.adminAction(adminId, "promote_user", userId);
        return userRepository.save(user);
    }

    @Transactional
    public User demote(Long adminId, Long userId) {
        if (adminId.equals(userId)) {
            throw new BadRequestException("You cannot demote yourself");
        }
        User user = requireActive(userId);
        if (!user.isAdmin()) {
            throw new BadRequestException("User is not admin");
        }
        user.setAdmin(false);
        auditLogger.adminAction(adminId, "demote_user", userId);
        return userRepository.save(user);
    }

    @Transactional
    public void resetPassword(Long adminId, Long userId, String newPassword) {
        if (newPassword == null || newPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new BadRequestException("Password must be at least 8 characters");
        }
        User user = requireActive(userId);
        user.setPassword(authService.hashPassword(newPassword));
        user.setRequiresPasswordSetup(false);
        user.setSetupToken(null);
        user.setSetupTokenLookup(null);
        user.setSetupTokenExpiry(null);
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        userRepository.save(user);
        auditLogger.adminAction(adminId, "reset_password", userId);
    }

    /**
     * Issue a fresh setup link. Only for users who never completed setup.
     */
    @Transactional
    public void resendInvitation(Long adminId, Long userId) {
        User user = requireActive(userId);
        if (!user.isRequiresPasswordSetup()) {
            throw new BadRequestException("User has already set up their password");
        }
        if (!emailService.isConfigured()) {
            throw new BadRequestException("Email service is not configured");
        }
        String token = authService.issueSetupToken(user);
        userRepository.save(user);
        emailService.sendPasswordSetupEmail(user.getEmail(), user.getUsername(), token);
        auditLogger.adminAction(adminId, "resend_invitation", userId);
    }

    @Transactional
    public User unlock(Long adminId, Long userId) {
        User user = requireActive(userId);
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        auditLogger.adminAction(adminId, "unlock_user", userId);
        return userRepository.save(user);
    }

    /**
     * Make the user's memberships exactly {@code groupIds}. Unknown or deleted groups are ignored;
     * groups the user stays in keep their group-admin flag.
     */
    void replaceMemberships(Long userId, Collection<Long> groupIds) {
        Set<Long> wanted = new LinkedHashSet<>();
        if (groupIds != null) {
            for (Long groupId : groupIds) {
                if (groupId != null && groupRepository.findByIdAndDeletedAtIsNull(groupId).isPresent()) {
                    wanted.add(groupId);
                }
            }
        }

        Map<Long, UserGroup> current = userGroupRepository.findByUserId(userId).stream()
                .collect(Collectors.toMap(UserGroup::getGroupId, Function.identity()));

        Set<Long> removed = new HashSet<>(current.keySet());
        removed.removeAll(wanted);
        for (Long groupId : removed) {
            userGroupRepository.delete(current.get(groupId));
        }
        for (Long groupId : wanted) {
            if (!current.containsKey(groupId)) {
                userGroupRepository.save(new UserGroup(userId, groupId, false));
            }
        }
    }

    private AccountView view(User user) {
        List<Group> groups = groupRepository.findGroupsForUser(user.getId());
        return new AccountView(user, groups, userGroupRepository.existsByUserIdAndGroupAdminTrue(user.getId()));
    }

    private User requireActive(Long userId) {
        return userRepository.findByIdAndDeletedAtIsNull(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }
}
