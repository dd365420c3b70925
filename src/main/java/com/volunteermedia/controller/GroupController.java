package com.volunteermedia.controller;

import com.volunteermedia.dto.GroupSettingsRequest;
import com.volunteermedia.dto.MemberView;
import com.volunteermedia.model.Group;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.GroupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
 * Group reads for members and member management for group admins.
 *
 * The admins/{userId} routes are kept for older clients; they promote and demote
 * exactly like members/{userId}/promote and /demote.
 */
@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;

    @GetMapping
    public ResponseEntity<List<Group>> listGroups(@CurrentUser AuthenticatedUser user) {
        return ResponseEntity.ok(groupService.listGroups(user));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Group> getGroup(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(groupService.getGroup(user, id));
    }

    @GetMapping("/{id}/membership")
    public ResponseEntity<Map<String, Object>> membership(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(groupService.membership(user, id));
    }

    @GetMapping("/{id}/members")
    public ResponseEntity<List<MemberView>> listMembers(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(groupService.listMembers(user, id));
    }

    @PostMapping("/{id}/members/{userId}")
    public ResponseEntity<Map<String, String>> addMember(@CurrentUser AuthenticatedUser user,
                                                         @PathVariable Long id,
                                                         @PathVariable Long userId) {
        groupService.addMember(user, id, userId);
        return ResponseEntity.ok(Map.of("message", "Member added successfully"));
    }

    @DeleteMapping("/{id}/members/{userId}")
    public ResponseEntity<Map<String, String>> removeMember(@CurrentUser AuthenticatedUser user,
                                                            @PathVariable Long id,
                                                            @PathVariable Long userId) {
        groupService.removeMember(user, id, userId);
        return ResponseEntity.ok(Map.of("message", "Member removed successfully"));
    }

    @PostMapping({"/{id}/members/{userId}/promote", "/{id}/admins/{userId}"})
    public ResponseEntity<Map<String, String>> promoteMember(@CurrentUser AuthenticatedUser user,
                                                             @PathVariable Long id,
                                                             @PathVariable Long userId) {
        groupService.promoteMember(user, id, userId);
        return ResponseEntity.ok(Map.of("message", "User promoted to group admin"));
    }

    @PostMapping("/{id}/members/{userId}/demote")
    public ResponseEntity<Map<String, String>> demoteMember(@CurrentUser AuthenticatedUser user,
                                                            @PathVariable Long id,
                                                            @PathVariable Long userId) {
        groupService.demoteMember(user, id, userId);
        return ResponseEntity.ok(Map.of("message", "Group admin access removed"));
    }

    @DeleteMapping("/{id}/admins/{userId}")
    public ResponseEntity<Map<String, String>> removeGroupAdmin(@CurrentUser AuthenticatedUser user,
                                                                @PathVariable Long id,
                                                                @PathVariable Long userId) {
        return demoteMember(user, id, userId);
    }

    /**
     * PUT /api/groups/{id}/settings
     *
     * {
     *   "description": "Dog walkers and handlers",
     *   "groupme_bot_id": "0123456789abcdef0123456789",
     *   "groupme_enabled": true
     * }
     */
    @PutMapping("/{id}/settings")
    public ResponseEntity<Group> updateSettings(@CurrentUser AuthenticatedUser user,
                                                @PathVariable Long id,
                                                @Valid @RequestBody GroupSettingsRequest request) {
        return ResponseEntity.ok(groupService.updateSettings(user, id, request));
    }
}
