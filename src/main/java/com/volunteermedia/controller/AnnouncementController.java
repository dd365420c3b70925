package com.volunteermedia.controller;

import com.volunteermedia.model.Announcement;
import com.volunteermedia.model.GroupUpdate;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.AnnouncementService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * ANNOUNCEMENTS
 * =============
 *
 * POST /api/admin/announcements
 *
 * Request:
 * {
 *   "title": "Holiday schedule",
 *   "content": "The shelter closes at noon on Friday.",
 *   "send_email": true,
 *   "send_groupme": false
 * }
 *
 * Email and GroupMe delivery happens asynchronously through the outbox; the response
 * does not wait for it.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnnouncementController {

    private final AnnouncementService announcementService;

    @GetMapping("/announcements")
    public ResponseEntity<List<Announcement>> latestAnnouncements() {
        return ResponseEntity.ok(announcementService.latestAnnouncements());
    }

    @PostMapping("/admin/announcements")
    public ResponseEntity<Announcement> createAnnouncement(@CurrentUser AuthenticatedUser admin,
                                                           @Valid @RequestBody AnnouncementRequest request) {
        Announcement announcement = announcementService.createAnnouncement(admin.userId(),
                request.getTitle(), request.getContent(), request.isSendEmail(), request.isSendGroupme());
        return ResponseEntity.status(HttpStatus.CREATED).body(announcement);
    }

    @DeleteMapping("/admin/announcements/{announcementId}")
    public ResponseEntity<Map<String, String>> deleteAnnouncement(@CurrentUser AuthenticatedUser admin,
                                                                  @PathVariable Long announcementId) {
        announcementService.deleteAnnouncement(admin.userId(), announcementId);
        return ResponseEntity.ok(Map.of("message", "Announcement deleted successfully"));
    }

    @PostMapping("/groups/{id}/announcements")
    public ResponseEntity<GroupUpdate> createGroupAnnouncement(@CurrentUser AuthenticatedUser user,
                                                               @PathVariable Long id,
                                                               @Valid @RequestBody AnnouncementRequest request) {
        GroupUpdate post = announcementService.createGroupAnnouncement(user, id,
                request.getTitle(), request.getContent(), request.isSendEmail(), request.isSendGroupme());
        return ResponseEntity.status(HttpStatus.CREATED).body(post);
    }

    // ==================== DTOs ====================

    @Data
    public static class AnnouncementRequest {

        @NotBlank(message = "Title is required")
        @Size(min = 2, max = 200, message = "Title must be between 2 and 200 characters")
        private String title;

        @NotBlank(message = "Content is required")
        @Size(min = 10, message = "Content must be at least 10 characters")
        private String content;

        private boolean sendEmail;

        private boolean sendGroupme;
    }
}
