package com.volunteermedia.controller;

import com.volunteermedia.model.AnimalTag;
import com.volunteermedia.model.CommentTag;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.AnimalTagService;
import com.volunteermedia.service.CommentTagService;
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
 * Animal tags (behavior / walker status badges) and comment tags, both per group.
 */
@RestController
@RequestMapping("/api/groups/{id}")
@RequiredArgsConstructor
public class TagController {

    private final AnimalTagService animalTagService;
    private final CommentTagService commentTagService;

    // ==================== ANIMAL TAGS ====================

    @GetMapping("/animal-tags")
    public ResponseEntity<List<AnimalTag>> listAnimalTags(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(animalTagService.listTags(user, id));
    }

    @PostMapping("/animal-tags")
    public ResponseEntity<AnimalTag> createAnimalTag(@CurrentUser AuthenticatedUser user,
                                                     @PathVariable Long id,
                                                     @RequestBody TagRequest request) {
        AnimalTag tag = animalTagService.createTag(user, id, request.getName(), request.getCategory(), request.getColor());
        return ResponseEntity.status(HttpStatus.CREATED).body(tag);
    }

    @PutMapping("/animal-tags/{tagId}")
    public ResponseEntity<AnimalTag> updateAnimalTag(@CurrentUser AuthenticatedUser user,
                                                     @PathVariable Long id,
                                                     @PathVariable Long tagId,
                                                     @RequestBody TagRequest request) {
        return ResponseEntity.ok(animalTagService.updateTag(user, id, tagId,
                request.getName(), request.getCategory(), request.getColor()));
    }

    @DeleteMapping("/animal-tags/{tagId}")
    public ResponseEntity<Map<String, String>> deleteAnimalTag(@CurrentUser AuthenticatedUser user,
                                                               @PathVariable Long id,
                                                               @PathVariable Long tagId) {
        animalTagService.deleteTag(user, id, tagId);
        return ResponseEntity.ok(Map.of("message", "Tag deleted successfully"));
    }

    // ==================== COMMENT TAGS ====================

    @GetMapping("/comment-tags")
    public ResponseEntity<List<CommentTag>> listCommentTags(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(commentTagService.listTags(user, id));
    }

    @PostMapping("/comment-tags")
    public ResponseEntity<CommentTag> createCommentTag(@CurrentUser AuthenticatedUser user,
                                                       @PathVariable Long id,
                                                       @RequestBody TagRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(commentTagService.createTag(user, id, request.getName(), request.getColor()));
    }

    @DeleteMapping("/comment-tags/{tagId}")
    public ResponseEntity<Map<String, String>> deleteCommentTag(@CurrentUser AuthenticatedUser user,
                                                                @PathVariable Long id,
                                                                @PathVariable Long tagId) {
        commentTagService.deleteTag(user, id, tagId);
        return ResponseEntity.ok(Map.of("message", "Tag deleted successfully"));
    }

    // ==================== DTOs ====================

    /**
     * Shared body for both tag kinds; comment tags ignore {@code category}.
     */
    @Data
    public static class TagRequest {
        private String name;
        private String category;
        private String color;
    }
}
