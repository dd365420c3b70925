package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.UnauthorizedException;
import com.volunteermedia.model.User;
import com.volunteermedia.notification.EmailDeliveryException;
import com.volunteermedia.notification.EmailService;
import com.volunteermedia.repository.UserRepository;
import com.volunteermedia.security.AuditLogger;
import com.volunteermedia.security.JwtService;
import com.volunteermedia.security.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Login, account lockout, password reset and first-time password setup.
 *
 * LOCKOUT:
 * ========
 * Each wrong password increments {@code failedLoginAttempts}. The fifth failure locks the
 * account for 30 minutes. A lock that has run out is cleared (counter included) before the
 * password is checked again. A successful login clears both.
 *
 * ONE-TIME TOKENS:
 * ================
 * Reset and setup tokens are 64 hex chars. Only their BCrypt hash is stored, plus the first
 * 16 chars in clear so the row can be found without scanning every hash.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    public static final int MAX_FAILED_LOGIN_ATTEMPTS = 5;
    public static final Duration LOCKOUT_DURATION = Duration.ofMinutes(30);
    public static final Duration RESET_TOKEN_TTL = Duration.ofHours(1);
    public static final Duration SETUP_TOKEN_TTL = Duration.ofHours(24);

    static final String RESET_REQUESTED_MESSAGE = "If the email exists, a password reset link will be sent";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final EmailService emailService;
    private final AuditLogger auditLogger;

    public record LoginResult(String token, User user, Instant lastLogin) {
    }

    /**
     * @throws UnauthorizedException for unknown users and wrong passwords
     * @throws ForbiddenException    for locked accounts and accounts still awaiting password setup
     */
    @Transactional(noRollbackFor = {UnauthorizedException.class, ForbiddenException.class})
    public LoginResult login(String username, String password, String clientIp) {
        Instant now = Instant.now();

        User user = userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull(username)
                .orElseThrow(() -> {
                    auditLogger.loginFailed(username, "unknown_user", clientIp);
                    return new UnauthorizedException("Invalid credentials");
                });

        if (user.isLocked(now)) {
            auditLogger.loginFailed(username, "account_locked", clientIp);
            long minutes = Duration.between(now, user.getLockedUntil()).toMinutes();
            throw new ForbiddenException("Account is locked due to too many failed login attempts",
                    lockDetails(user.getLockedUntil(), minutes + 1));
        }

        if (user.isRequiresPasswordSetup()) {
            auditLogger.loginFailed(username, "password_setup_required", clientIp);
            throw new ForbiddenException("Please complete your account setup using the link sent to your email");
        }

        if (user.getLockedUntil() != null) {
            // Lock has run out
            user.setLockedUntil(null);
            user.setFailedLoginAttempts(0);
        }

        if (!passwordEncoder.matches(password, user.getPassword())) {
            int attempts = user.getFailedLoginAttempts() + 1;
            user.setFailedLoginAttempts(attempts);

            if (attempts >= MAX_FAILED_LOGIN_ATTEMPTS) {
                Instant lockedUntil = now.plus(LOCKOUT_DURATION);
                user.setLockedUntil(lockedUntil);
                userRepository.save(user);
                auditLogger.accountLocked(user.getId(), user.getUsername(), attempts);
                throw new ForbiddenException(
                        "Account has been locked due to too many failed login attempts. "
                                + "Please try again in 30 minutes or reset your password.",
                        lockDetails(lockedUntil, LOCKOUT_DURATION.toMinutes()));
            }

            userRepository.save(user);
            auditLogger.loginFailed(username, "invalid_password", clientIp);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("attempts_remaining", MAX_FAILED_LOGIN_ATTEMPTS - attempts);
            throw new UnauthorizedException("Invalid credentials", details);
        }

        Instant previousLogin = user.getLastLogin();
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        user.setLastLogin(now);
        userRepository.save(user);

        auditLogger.loginSucceeded(user.getId(), user.getUsername(), clientIp);
        return new LoginResult(jwtService.generateToken(user.getId(), user.isAdmin()), user, previousLogin);
    }

    /**
     * Always answers the same way so the endpoint cannot be used to probe for addresses.
     */
    @Transactional
    public String requestPasswordReset(String email) {
        Optional<User> found = userRepository.findByEmailIgnoreCaseAndDeletedAtIsNull(email);
        auditLogger.passwordResetRequested(email, found.isPresent());

        if (found.isEmpty()) {
            return RESET_REQUESTED_MESSAGE;
        }
        if (!emailService.isConfigured()) {
            log.warn("Password reset requested but email is not configured");
            return RESET_REQUESTED_MESSAGE;
        }

        User user = found.get();
        String token = SecureTokens.generate();
        user.setResetToken(passwordEncoder.encode(token));
        user.setResetTokenLookup(SecureTokens.lookupPrefix(token));
        user.setResetTokenExpiry(Instant.now().plus(RESET_TOKEN_TTL));
        userRepository.save(user);

        try {
            emailService.sendPasswordResetEmail(user.getEmail(), user.getUsername(), token);
        } catch (EmailDeliveryException e) {
            log.error("Failed to send password reset email to user {}: {}", user.getId(), e.getMessage());
        }
        return RESET_REQUESTED_MESSAGE;
    }

    @Transactional
    public void resetPassword(String token, String newPassword) {
        User user = findByResetToken(token)
                .orElseThrow(() -> new BadRequestException("Invalid or expired reset token"));

        user.setPassword(passwordEncoder.encode(newPassword));
        user.setResetToken(null);
        user.setResetTokenLookup(null);
        user.setResetTokenExpiry(null);
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        userRepository.save(user);

        auditLogger.passwordResetCompleted(user.getId());
    }

    /**
     * Completes an invitation and logs the user in.
     */
    @Transactional
    public LoginResult setupPassword(String token, String password) {
        User user = findBySetupToken(token)
                .orElseThrow(() -> new BadRequestException("Invalid or expired setup token"));
        if (!user.isRequiresPasswordSetup()) {
            throw new BadRequestException(
                    "This account has already been set up. Please use the password reset flow instead.");
        }

        Instant now = Instant.now();
        user.setPassword(passwordEncoder.encode(password));
        user.setRequiresPasswordSetup(false);
        user.setSetupToken(null);
        user.setSetupTokenLookup(null);
        user.setSetupTokenExpiry(null);
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        user.setLastLogin(now);
        userRepository.save(user);

        auditLogger.passwordSetupCompleted(user.getId());
        return new LoginResult(jwtService.generateToken(user.getId(), user.isAdmin()), user, null);
    }

    /**
     * Give the user a fresh 24h setup token and return it in clear (for the invitation email).
     * The caller saves the user.
     */
    public String issueSetupToken(User user) {
        String token = SecureTokens.generate();
        user.setSetupToken(passwordEncoder.encode(token));
        user.setSetupTokenLookup(SecureTokens.lookupPrefix(token));
        user.setSetupTokenExpiry(Instant.now().plus(SETUP_TOKEN_TTL));
        user.setRequiresPasswordSetup(true);
        return token;
    }

    /**
     * A random, never-disclosed password for invited users until they complete setup.
     */
    public String placeholderPasswordHash() {
        return passwordEncoder.encode(SecureTokens.generate());
    }

    public String hashPassword(String rawPassword) {
        return passwordEncoder.encode(rawPassword);
    }

    private Optional<User> findByResetToken(String token) {
        String lookup = SecureTokens.lookupPrefix(token);
        if (lookup == null) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        return userRepository.findByResetTokenLookupAndDeletedAtIsNull(lookup).stream()
                .filter(u -> u.getResetToken() != null && passwordEncoder.matches(token, u.getResetToken()))
                .filter(u -> u.getResetTokenExpiry() != null && u.getResetTokenExpiry().isAfter(now))
                .findFirst();
    }

    private Optional<User> findBySetupToken(String token) {
        String lookup = SecureTokens.lookupPrefix(token);
        if (lookup == null) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        return userRepository.findBySetupTokenLookupAndDeletedAtIsNull(lookup).stream()
                .filter(u -> u.getSetupToken() != null && passwordEncoder.matches(token, u.getSetupToken()))
                .filter(u -> u.getSetupTokenExpiry() != null && u.getSetupTokenExpiry().isAfter(now))
                .findFirst();
    }

    private static Map<String, Object> lockDetails(Instant lockedUntil, long retryInMinutes) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("locked_until", lockedUntil);
        details.put("retry_in_mins", retryInMinutes);
        return details;
    }
}
