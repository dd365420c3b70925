package com.volunteermedia.controller;

import com.volunteermedia.dto.AccountView;
import com.volunteermedia.dto.CreateUserRequest;
import com.volunteermedia.dto.UpdateUserRequest;
import com.volunteermedia.dto.UserCreatedResponse;
import com.volunteermedia.model.User;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.UserAdminService;
import jakarta.validation.Valid;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Site-admin user management. The auth interceptor rejects non-admins on /api/admin/**.
 */
@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
public class UserAdminController {

    private final UserAdminService userAdminService;

    @GetMapping
    public ResponseEntity<List<AccountView>> listUsers() {
        return ResponseEntity.ok(userAdminService.listUsers());
    }

    @GetMapping("/deleted")
    public ResponseEntity<List<User>> listDeletedUsers() {
        return ResponseEntity.ok(userAdminService.listDeletedUsers());
    }

    /**
     * POST /api/admin/users
     *
     * Either {@code password} or {@code send_setup_email: true} is required. With the setup
     * email the user picks their own password from the emailed link.
     */
    @PostMapping
    public ResponseEntity<UserCreatedResponse> createUser(@CurrentUser AuthenticatedUser admin,
                                                          @Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userAdminService.createUser(admin.userId(), request));
    }

    @PutMapping("/{userId}")
    public ResponseEntity<AccountView> updateUser(@CurrentUser AuthenticatedUser admin,
                                                  @PathVariable Long userId,
                                                  @Valid @RequestBody UpdateUserRequest request) {
        return ResponseEntity.ok(userAdminService.updateUser(admin.userId(), userId, request));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Map<String, String>> deleteUser(@CurrentUser AuthenticatedUser admin,
                                                          @PathVariable Long userId) {
        userAdminService.deleteUser(admin.userId(), userId);
        return ResponseEntity.ok(Map.of("message", "User deleted successfully"));
    }

    @PostMapping("/{userId}/restore")
    public ResponseEntity<User> restoreUser(@CurrentUser AuthenticatedUser admin, @PathVariable Long userId) {
        return ResponseEntity.ok(userAdminService.restoreUser(admin.userId(), userId));
    }

    @PostMapping("/{userId}/promote")
    public ResponseEntity<User> promote(@CurrentUser AuthenticatedUser admin, @PathVariable Long userId) {
        return ResponseEntity.ok(userAdminService.promote(admin.userId(), userId));
    }

    @PostMapping("/{userId}/demote")
    public ResponseEntity<User> demote(@CurrentUser AuthenticatedUser admin, @PathVariable Long userId) {
        return ResponseEntity.ok(userAdminService.demote(admin.userId(), userId));
    }

    @PostMapping("/{userId}/reset-password")
    public ResponseEntity<Map<String, String>> resetPassword(@CurrentUser AuthenticatedUser admin,
                                                             @PathVariable Long userId,
                                                             @RequestBody AdminPasswordRequest request) {
        userAdminService.resetPassword(admin.userId(), userId, request.getNewPassword());
        return ResponseEntity.ok(Map.of("message", "Password reset successfully"));
    }

    @PostMapping("/{userId}/resend-invitation")
    public ResponseEntity<Map<String, String>> resendInvitation(@CurrentUser AuthenticatedUser admin,
                                                                @PathVariable Long userId) {
        userAdminService.resendInvitation(admin.userId(), userId);
        return ResponseEntity.ok(Map.of("message", "Invitation email sent successfully"));
    }

    @PostMapping("/{userId}/unlock")
    public ResponseEntity<User> unlock(@CurrentUser AuthenticatedUser admin, @PathVariable Long userId) {
        return ResponseEntity.ok(userAdminService.unlock(admin.userId(), userId));
    }

    // ==================== DTOs ====================

    @Data
    public static class AdminPasswordRequest {
        private String newPassword;
    }
}
