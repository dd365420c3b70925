package com.volunteermedia.controller;

import com.volunteermedia.model.GroupUpdate;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.GroupUpdateService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Group message board.
 */
@RestController
@RequestMapping("/api/groups/{id}/updates")
@RequiredArgsConstructor
public class GroupUpdateController {

    private final GroupUpdateService groupUpdateService;

    @GetMapping
    public ResponseEntity<List<GroupUpdate>> listUpdates(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(groupUpdateService.listUpdates(user, id));
    }

    @PostMapping
    public ResponseEntity<GroupUpdate> createUpdate(@CurrentUser AuthenticatedUser user,
                                                    @PathVariable Long id,
                                                    @Valid @RequestBody GroupUpdateRequest request) {
        GroupUpdate update = groupUpdateService.createUpdate(user, id, request.getTitle(), request.getContent(),
                request.getImageUrl(), request.isSendEmail(), request.isSendGroupme());
        return ResponseEntity.status(HttpStatus.CREATED).body(update);
    }

    // ==================== DTOs ====================

    @Data
    public static class GroupUpdateRequest {

        @NotBlank(message = "Title is required")
        @Size(max = 200, message = "Title must be 200 characters or less")
        private String title;

        @NotBlank(message = "Content is required")
        private String content;

        @Size(max = 500, message = "Image URL must be 500 characters or less")
        private String imageUrl;

        private boolean sendEmail;

        private boolean sendGroupme;
    }
}
