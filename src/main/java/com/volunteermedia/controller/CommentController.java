package com.volunteermedia.controller;

import com.volunteermedia.dto.CommentRequest;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.CommentHistory;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.CommentService;
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

import java.util.List;
import java.util.Map;

/**
 * COMMENTS AND SESSION NOTES
 * ==========================
 *
 * A comment carries text and/or an image, optional comment tags, and optional structured
 * session metadata (goal, outcome, notes, rating, start time, duration).
 *
 * GET /api/groups/{id}/animals/{animalId}/comments?limit=10&offset=0&order=desc&tags=behavior,medical
 *
 * Response:
 * {
 *   "comments": [...],
 *   "total": 42,
 *   "limit": 10,
 *   "offset": 0,
 *   "hasMore": true
 * }
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CommentController {

    private final CommentService commentService;

    @GetMapping("/groups/{id}/animals/{animalId}/comments")
    public ResponseEntity<Map<String, Object>> listComments(@CurrentUser AuthenticatedUser user,
                                                            @PathVariable Long id,
                                                            @PathVariable Long animalId,
                                                            @RequestParam(required = false) Integer limit,
                                                            @RequestParam(required = false) Integer offset,
                                                            @RequestParam(required = false) String order,
                                                            @RequestParam(required = false) String tags) {
        return ResponseEntity.ok(commentService.listComments(user, id, animalId, limit, offset, order, tags));
    }

    @PostMapping("/groups/{id}/animals/{animalId}/comments")
    public ResponseEntity<AnimalComment> createComment(@CurrentUser AuthenticatedUser user,
                                                       @PathVariable Long id,
                                                       @PathVariable Long animalId,
                                                       @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(commentService.createComment(user, id, animalId, request));
    }

    @PutMapping("/groups/{id}/animals/{animalId}/comments/{commentId}")
    public ResponseEntity<AnimalComment> updateComment(@CurrentUser AuthenticatedUser user,
                                                       @PathVariable Long id,
                                                       @PathVariable Long animalId,
                                                       @PathVariable Long commentId,
                                                       @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.ok(commentService.updateComment(user, id, animalId, commentId, request));
    }

    @DeleteMapping("/groups/{id}/animals/{animalId}/comments/{commentId}")
    public ResponseEntity<Map<String, String>> deleteComment(@CurrentUser AuthenticatedUser user,
                                                             @PathVariable Long id,
                                                             @PathVariable Long animalId,
                                                             @PathVariable Long commentId) {
        commentService.deleteComment(user, id, animalId, commentId);
        return ResponseEntity.ok(Map.of("message", "Comment deleted successfully"));
    }

    @GetMapping("/groups/{id}/animals/{animalId}/comments/{commentId}/history")
    public ResponseEntity<List<CommentHistory>> commentHistory(@CurrentUser AuthenticatedUser user,
                                                               @PathVariable Long id,
                                                               @PathVariable Long animalId,
                                                               @PathVariable Long commentId) {
        return ResponseEntity.ok(commentService.commentHistory(user, id, animalId, commentId));
    }

    @GetMapping("/groups/{id}/latest-comments")
    public ResponseEntity<List<AnimalComment>> latestComments(@CurrentUser AuthenticatedUser user,
                                                              @PathVariable Long id,
                                                              @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(commentService.latestComments(user, id, limit));
    }

    @GetMapping("/groups/{id}/deleted-comments")
    public ResponseEntity<List<AnimalComment>> deletedComments(@CurrentUser AuthenticatedUser user,
                                                               @PathVariable Long id) {
        return ResponseEntity.ok(commentService.deletedComments(user, id));
    }

    @GetMapping("/admin/deleted-comments")
    public ResponseEntity<List<AnimalComment>> allDeletedComments() {
        return ResponseEntity.ok(commentService.allDeletedComments());
    }
}
