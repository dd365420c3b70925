package com.volunteermedia.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Security event trail on the dedicated {@code AUDIT} logger
 * (routed to its own appender in logback-spring.xml).
 */
@Component
public class AuditLogger {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    public void loginSucceeded(Long userId, String username, String clientIp) {
        AUDIT.info("event=login_success user_id={} username={} ip={}", userId, username, clientIp);
    }

    public void loginFailed(String username, String reason, String clientIp) {
        AUDIT.warn("event=login_failure username={} reason={} ip={}", username, reason, clientIp);
    }

    public void accountLocked(Long userId, String username, int attempts) {
        AUDIT.warn("event=account_locked user_id={} username={} failed_attempts={}", userId, username, attempts);
    }

    public void passwordResetRequested(String email, boolean userFound) {
        AUDIT.info("event=password_reset_requested email={} user_found={}", email, userFound);
    }

    public void passwordResetCompleted(Long userId) {
        AUDIT.info("event=password_reset_completed user_id={}", userId);
    }

    public void passwordSetupCompleted(Long userId) {
        AUDIT.info("event=password_setup_completed user_id={}", userId);
    }

    public void adminAction(Long adminId, String action, Long targetUserId) {
        AUDIT.info("event=admin_action admin_id={} action={} target_user_id={}", adminId, action, targetUserId);
    }
}
