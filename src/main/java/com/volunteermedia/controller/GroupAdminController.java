package com.volunteermedia.controller;

import com.volunteermedia.dto.GroupRequest;
import com.volunteermedia.model.Group;
import com.volunteermedia.service.GroupService;
import com.volunteermedia.service.ImageService;
import jakarta.validation.Valid;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

/**
 * Site-admin group management.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class GroupAdminController {

    private final GroupService groupService;
    private final ImageService imageService;

    @GetMapping("/groups")
    public ResponseEntity<List<Group>> listGroups() {
        return ResponseEntity.ok(groupService.listAllGroups());
    }

    @GetMapping("/groups/{groupId}")
    public ResponseEntity<Group> getGroup(@PathVariable Long groupId) {
        return ResponseEntity.ok(groupService.getActiveGroup(groupId));
    }

    /**
     * POST /api/admin/groups
     *
     * {
     *   "name": "dogs",
     *   "description": "Dog walkers and handlers",
     *   "has_protocols": true
     * }
     */
    @PostMapping("/groups")
    public ResponseEntity<Group> createGroup(@Valid @RequestBody GroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(groupService.createGroup(request));
    }

    @PutMapping("/groups/{groupId}")
    public ResponseEntity<Group> updateGroup(@PathVariable Long groupId, @Valid @RequestBody GroupRequest request) {
        return ResponseEntity.ok(groupService.updateGroup(groupId, request));
    }

    @DeleteMapping("/groups/{groupId}")
    public ResponseEntity<Map<String, String>> deleteGroup(@PathVariable Long groupId) {
        groupService.deleteGroup(groupId);
        return ResponseEntity.ok(Map.of("message", "Group deleted successfully"));
    }

    @PostMapping("/groups/{groupId}/users/{userId}")
    public ResponseEntity<Map<String, String>> addUserToGroup(@PathVariable Long groupId, @PathVariable Long userId) {
        groupService.addUserToGroup(groupId, userId);
        return ResponseEntity.ok(Map.of("message", "User added to group"));
    }

    @DeleteMapping("/groups/{groupId}/users/{userId}")
    public ResponseEntity<Map<String, String>> removeUserFromGroup(@PathVariable Long groupId,
                                                                   @PathVariable Long userId) {
        groupService.removeUserFromGroup(groupId, userId);
        return ResponseEntity.ok(Map.of("message", "User removed from group"));
    }

    @PostMapping("/groups/upload-image")
    public ResponseEntity<Map<String, String>> uploadGroupImage(@RequestParam("image") MultipartFile image) {
        return ResponseEntity.ok(Map.of("url", imageService.uploadImage(image)));
    }

    @PostMapping("/upload-hero-image")
    public ResponseEntity<Map<String, String>> uploadHeroImage(@RequestParam("image") MultipartFile image) {
        return ResponseEntity.ok(Map.of("url", imageService.uploadHeroImage(image)));
    }
}
