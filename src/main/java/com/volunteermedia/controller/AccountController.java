package com.volunteermedia.controller;

import com.volunteermedia.dto.AccountView;
import com.volunteermedia.dto.ProfileUpdateRequest;
import com.volunteermedia.dto.UserProfileView;
import com.volunteermedia.model.User;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.AccountService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

/**
 * The signed-in user's own account: profile, preferences, default group.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @GetMapping("/me")
    public ResponseEntity<AccountView> me(@CurrentUser AuthenticatedUser user) {
        return ResponseEntity.ok(accountService.getCurrentUser(user.userId()));
    }

    @PutMapping("/me/profile")
    public ResponseEntity<User> updateProfile(@CurrentUser AuthenticatedUser user,
                                              @Valid @RequestBody ProfileUpdateRequest request) {
        return ResponseEntity.ok(accountService.updateProfile(user.userId(), request));
    }

    @GetMapping("/email-preferences")
    public ResponseEntity<Map<String, Object>> emailPreferences(@CurrentUser AuthenticatedUser user) {
        return ResponseEntity.ok(accountService.getEmailPreferences(user.userId()));
    }

    @PutMapping("/email-preferences")
    public ResponseEntity<Map<String, Object>> updateEmailPreferences(@CurrentUser AuthenticatedUser user,
                                                                      @RequestBody EmailPreferencesRequest request) {
        return ResponseEntity.ok(accountService.updateEmailPreferences(
                user.userId(), request.getEmailNotificationsEnabled(), request.getShowLengthOfStay()));
    }

    @GetMapping("/default-group")
    public ResponseEntity<Map<String, Long>> defaultGroup(@CurrentUser AuthenticatedUser user) {
        return ResponseEntity.ok(Collections.singletonMap("default_group_id",
                accountService.getDefaultGroup(user.userId())));
    }

    @PutMapping("/default-group")
    public ResponseEntity<Map<String, Long>> setDefaultGroup(@CurrentUser AuthenticatedUser user,
                                                             @Valid @RequestBody DefaultGroupRequest request) {
        Long groupId = accountService.setDefaultGroup(user, request.getGroupId());
        return ResponseEntity.ok(Collections.singletonMap("default_group_id", groupId));
    }

    @GetMapping("/users/{userId}/profile")
    public ResponseEntity<UserProfileView> userProfile(@CurrentUser AuthenticatedUser user,
                                                       @PathVariable Long userId) {
        return ResponseEntity.ok(accountService.getUserProfile(user, userId));
    }

    // ==================== DTOs ====================

    @Data
    public static class EmailPreferencesRequest {
        private Boolean emailNotificationsEnabled;
        private Boolean showLengthOfStay;
    }

    @Data
    public static class DefaultGroupRequest {
        @NotNull(message = "group_id is required")
        private Long groupId;
    }
}
