package com.volunteermedia.controller;

import com.volunteermedia.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public authentication endpoints: login, password reset and first-time password setup.
 * All four are rate limited per client IP.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    /**
     * POST /api/login
     *
     * Response:
     * {
     *   "token": "eyJ...",
     *   "user": { ... },
     *   "last_login": "2024-05-01T10:00:00Z"   // previous login, null the first time
     * }
     */
    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest request,
                                                     HttpServletRequest httpRequest) {
        AuthService.LoginResult result = authService.login(
                request.getUsername(), request.getPassword(), httpRequest.getRemoteAddr());
        return ResponseEntity.ok(loginBody(result));
    }

    @PostMapping("/request-password-reset")
    public ResponseEntity<Map<String, String>> requestPasswordReset(@Valid @RequestBody PasswordResetRequest request) {
        String message = authService.requestPasswordReset(request.getEmail());
        return ResponseEntity.ok(Map.of("message", message));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<Map<String, String>> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request.getToken(), request.getNewPassword());
        return ResponseEntity.ok(Map.of("message", "Password has been reset successfully"));
    }

    @PostMapping("/setup-password")
    public ResponseEntity<Map<String, Object>> setupPassword(@Valid @RequestBody SetupPasswordRequest request) {
        AuthService.LoginResult result = authService.setupPassword(request.getToken(), request.getPassword());
        Map<String, Object> body = loginBody(result);
        body.put("message", "Password set successfully");
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> loginBody(AuthService.LoginResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", result.token());
        body.put("user", result.user());
        body.put("last_login", result.lastLogin());
        return body;
    }

    // ==================== DTOs ====================

    @Data
    public static class LoginRequest {
        @NotBlank(message = "Username is required")
        private String username;

        @NotBlank(message = "Password is required")
        private String password;
    }

    @Data
    public static class PasswordResetRequest {
        @NotBlank(message = "Email is required")
        @Email(message = "Invalid email address")
        private String email;
    }

    @Data
    public static class ResetPasswordRequest {
        @NotBlank(message = "Token is required")
        private String token;

        @NotBlank(message = "New password is required")
        @Size(min = 8, message = "Password must be at least 8 characters")
        private String newPassword;
    }

    @Data
    public static class SetupPasswordRequest {
        @NotBlank(message = "Token is required")
        private String token;

        @NotBlank(message = "Password is required")
        @Size(min = 8, message = "Password must be at least 8 characters")
        private String password;
    }
}
