package com.volunteermedia.service;

import com.volunteermedia.exception.ApiException;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.UnauthorizedException;
import com.volunteermedia.model.User;
import com.volunteermedia.notification.EmailService;
import com.volunteermedia.repository.UserRepository;
import com.volunteermedia.security.AuditLogger;
import com.volunteermedia.security.JwtService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private JwtService jwtService;
    @Mock
    private EmailService emailService;
    @Mock
    private AuditLogger auditLogger;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, passwordEncoder, jwtService, emailService, auditLogger);
    }

    private User user(String username) {
        User user = new User();
        user.setId(7L);
        user.setUsername(username);
        user.setEmail(username + "@example.org");
        user.setPassword("hash");
        return user;
    }

    @Test
    void loginReturnsTokenAndPreviousLastLogin() {
        User user = user("sarah");
        Instant previous = Instant.parse("2026-01-01T10:00:00Z");
        user.setLastLogin(previous);
        user.setFailedLoginAttempts(2);
        when(userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull("Sarah")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret123", "hash")).thenReturn(true);
        when(jwtService.generateToken(7L, false)).thenReturn("jwt");

        AuthService.LoginResult result = authService.login("Sarah", "secret123", "10.0.0.1");

        assertThat(result.token()).isEqualTo("jwt");
        assertThat(result.lastLogin()).isEqualTo(previous);
        assertThat(user.getFailedLoginAttempts()).isZero();
        assertThat(user.getLastLogin()).isAfter(previous);
        verify(auditLogger).loginSucceeded(7L, "sarah", "10.0.0.1");
    }

    @Test
    void unknownUserIsUnauthorized() {
        when(userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login("ghost", "whatever", "ip"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid credentials");
    }

    @Test
    void wrongPasswordReportsAttemptsRemaining() {
        User user = user("mike");
        user.setFailedLoginAttempts(1);
        when(userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull("mike")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login("mike", "wrong", "ip"))
                .isInstanceOf(UnauthorizedException.class)
                .satisfies(e -> assertThat(((ApiException) e).getDetails()).containsEntry("attempts_remaining", 3));
        assertThat(user.getFailedLoginAttempts()).isEqualTo(2);
        verify(userRepository).save(user);
    }

    @Test
    void fifthFailureLocksTheAccount() {
        User user = user("jake");
        user.setFailedLoginAttempts(4);
        when(userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull("jake")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login("jake", "wrong", "ip"))
                .isInstanceOf(ForbiddenException.class)
                .hasMessageStartingWith("Account has been locked")
                .satisfies(e -> assertThat(((ApiException) e).getDetails())
                        .containsKey("locked_until")
                        .containsEntry("retry_in_mins", 30L));
        assertThat(user.getLockedUntil()).isAfter(Instant.now().plus(Duration.ofMinutes(29)));
        verify(auditLogger).accountLocked(7L, "jake", 5);
    }

    @Test
    void lockedAccountIsRejectedBeforePasswordCheck() {
        User user = user("lisa");
        user.setLockedUntil(Instant.now().plus(Duration.ofMinutes(10)));
        when(userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull("lisa")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.login("lisa", "secret123", "ip"))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Account is locked due to too many failed login attempts");
        verify(passwordEncoder, never()).matches(anyString(), anyString());
    }

    @Test
    void expiredLockIsClearedBeforePasswordCheck() {
        User user = user("lisa");
        user.setFailedLoginAttempts(5);
        user.setLockedUntil(Instant.now().minus(Duration.ofMinutes(1)));
        when(userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull("lisa")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login("lisa", "wrong", "ip"))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(user.getFailedLoginAttempts()).isEqualTo(1);
        assertThat(user.getLockedUntil()).isNull();
    }

    @Test
    void invitedUserMustCompleteSetupFirst() {
        User user = user("newbie");
        user.setRequiresPasswordSetup(true);
        when(userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull("newbie")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.login("newbie", "x", "ip"))
                .isInstanceOf(ForbiddenException.class)
                .hasMessageContaining("complete your account setup");
    }

    @Test
    void resetRequestForUnknownEmailGivesTheSameAnswer() {
        when(userRepository.findByEmailIgnoreCaseAndDeletedAtIsNull("nobody@example.org")).thenReturn(Optional.empty());

        String message = authService.requestPasswordReset("nobody@example.org");

        assertThat(message).isEqualTo(AuthService.RESET_REQUESTED_MESSAGE);
        verify(userRepository, never()).save(any());
    }

    @Test
    void resetRequestStoresHashedTokenAndSendsEmail() {
        User user = user("sarah");
        when(userRepository.findByEmailIgnoreCaseAndDeletedAtIsNull("sarah@example.org")).thenReturn(Optional.of(user));
        when(emailService.isConfigured()).thenReturn(true);
        when(passwordEncoder.encode(anyString())).thenReturn("token-hash");

        authService.requestPasswordReset("sarah@example.org");

        assertThat(user.getResetToken()).isEqualTo("token-hash");
        assertThat(user.getResetTokenLookup()).hasSize(16);
        assertThat(user.getResetTokenExpiry()).isAfter(Instant.now().plus(Duration.ofMinutes(59)));
        verify(emailService).sendPasswordResetEmail(eq("sarah@example.org"), eq("sarah"), anyString());
    }

    @Test
    void resetWithUnknownTokenFails() {
        String token = "a".repeat(64);
        when(userRepository.findByResetTokenLookupAndDeletedAtIsNull("a".repeat(16))).thenReturn(List.of());

        assertThatThrownBy(() -> authService.resetPassword(token, "newpassword"))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Invalid or expired reset token");
    }

    @Test
    void resetClearsTokenAndLock() {
        String token = "b".repeat(64);
        User user = user("mike");
        user.setResetToken("stored-hash");
        user.setResetTokenExpiry(Instant.now().plus(Duration.ofMinutes(30)));
        user.setLockedUntil(Instant.now().plus(Duration.ofMinutes(20)));
        user.setFailedLoginAttempts(5);
        when(userRepository.findByResetTokenLookupAndDeletedAtIsNull("b".repeat(16))).thenReturn(List.of(user));
        when(passwordEncoder.matches(token, "stored-hash")).thenReturn(true);
        when(passwordEncoder.encode("newpassword")).thenReturn("new-hash");

        authService.resetPassword(token, "newpassword");

        assertThat(user.getPassword()).isEqualTo("new-hash");
        assertThat(user.getResetToken()).isNull();
        assertThat(user.getLockedUntil()).isNull();
        assertThat(user.getFailedLoginAttempts()).isZero();
        verify(auditLogger).passwordResetCompleted(7L);
    }

    @Test
    void expiredSetupTokenIsRejected() {
        String token = "c".repeat(64);
        User user = user("newbie");
        user.setRequiresPasswordSetup(true);
        user.setSetupToken("setup-hash");
        user.setSetupTokenExpiry(Instant.now().minus(Duration.ofHours(1)));
        when(userRepository.findBySetupTokenLookupAndDeletedAtIsNull("c".repeat(16))).thenReturn(List.of(user));
        when(passwordEncoder.matches(token, "setup-hash")).thenReturn(true);

        assertThatThrownBy(() -> authService.setupPassword(token, "password1"))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Invalid or expired setup token");
    }

    @Test
    void setupCompletesInvitationAndLogsIn() {
        String token = "d".repeat(64);
        User user = user("newbie");
        user.setRequiresPasswordSetup(true);
        user.setSetupToken("setup-hash");
        user.setSetupTokenExpiry(Instant.now().plus(Duration.ofHours(2)));
        when(userRepository.findBySetupTokenLookupAndDeletedAtIsNull("d".repeat(16))).thenReturn(List.of(user));
        when(passwordEncoder.matches(token, "setup-hash")).thenReturn(true);
        when(passwordEncoder.encode("password1")).thenReturn("pw-hash");
        when(jwtService.generateToken(7L, false)).thenReturn("jwt");

        AuthService.LoginResult result = authService.setupPassword(token, "password1");

        assertThat(result.token()).isEqualTo("jwt");
        assertThat(user.isRequiresPasswordSetup()).isFalse();
        assertThat(user.getSetupToken()).isNull();
        assertThat(user.getPassword()).isEqualTo("pw-hash");
    }
}
