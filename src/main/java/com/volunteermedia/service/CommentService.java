package com.volunteermedia.service;

import com.volunteermedia.dto.CommentRequest;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.CommentHistory;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.CommentHistoryRepository;
import com.volunteermedia.repository.CommentTagRepository;
import com.volunteermedia.repository.OffsetPageRequest;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Comments and session notes on animals.
 *
 * Metadata is validated and escaped before it is stored. Editing keeps the previous
 * version in comment_history; deleting is a soft delete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentService {

    static final int DEFAULT_PAGE_SIZE = 10;
    static final int DEFAULT_LATEST_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final AnimalCommentRepository commentRepository;
    private final CommentHistoryRepository historyRepository;
    private final CommentTagRepository commentTagRepository;
    private final AnimalRepository animalRepository;
    private final GroupAccessService groupAccessService;

    @Transactional(readOnly = true)
    public Map<String, Object> listComments(AuthenticatedUser user, Long groupId, Long animalId,
                                            Integer limit, Integer offset, String order, String tags) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);

        int pageSize = clampLimit(limit, DEFAULT_PAGE_SIZE);
        int start = offset == null || offset < 0 ? 0 : offset;
        Sort.Direction direction = "asc".equalsIgnoreCase(order) ? Sort.Direction.ASC : Sort.Direction.DESC;
        OffsetPageRequest page = new OffsetPageRequest(start, pageSize, Sort.by(direction, "createdAt"));

        List<String> tagNames = splitCsv(tags);
        Page<AnimalComment> comments = tagNames.isEmpty()
                ? commentRepository.findActiveByAnimal(animalId, page)
                : commentRepository.findActiveByAnimalAndTags(animalId, tagNames, page);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("comments", comments.getContent());
        body.put("total", comments.getTotalElements());
        body.put("limit", pageSize);
        body.put("offset", start);
        body.put("hasMore", start + comments.getNumberOfElements() < comments.getTotalElements());
        return body;
    }

    @Transactional
    public AnimalComment createComment(AuthenticatedUser user, Long groupId, Long animalId, CommentRequest request) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);
        requireContent(request);

        AnimalComment comment = new AnimalComment();
        comment.setAnimalId(animalId);
        comment.setUserId(user.userId());
        comment.setContent(request.getContent() == null ? "" : request.getContent().trim());
        comment.setImageUrl(request.getImageUrl());
        comment.setMetadata(SessionMetadataValidator.sanitize(request.getMetadata()));
        applyTags(comment, groupId, request.getTagIds());

        AnimalComment saved = commentRepository.save(comment);
        log.debug("User {} commented on animal {} (comment {})", user.userId(), animalId, saved.getId());
        return saved;
    }

    @Transactional
    public AnimalComment updateComment(AuthenticatedUser user, Long groupId, Long animalId, Long commentId,
                                       CommentRequest request) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);
        AnimalComment comment = requireComment(animalId, commentId);

        if (!comment.getUserId().equals(user.userId())) {
            throw new ForbiddenException("You can only edit your own comments");
        }
        requireContent(request);

        CommentHistory history = new CommentHistory();
        history.setCommentId(comment.getId());
        history.setContent(comment.getContent());
        history.setImageUrl(comment.getImageUrl());
        history.setMetadata(comment.getMetadata());
        history.setEditedBy(user.userId());
        historyRepository.save(history);

        comment.setContent(request.getContent() == null ? "" : request.getContent().trim());
        comment.setImageUrl(request.getImageUrl());
        comment.setMetadata(SessionMetadataValidator.sanitize(request.getMetadata()));
        applyTags(comment, groupId, request.getTagIds());

        return commentRepository.save(comment);
    }

    @Transactional
    public void deleteComment(AuthenticatedUser user, Long groupId, Long animalId, Long commentId) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);
        AnimalComment comment = requireComment(animalId, commentId);

        if (!comment.getUserId().equals(user.userId()) && !groupAccessService.canModerate(user, groupId)) {
            throw new ForbiddenException("You can only delete your own comments");
        }

        comment.setDeletedAt(Instant.now());
        commentRepository.save(comment);
        log.info("User {} deleted comment {} on animal {}", user.userId(), commentId, animalId);
    }

    @Transactional(readOnly = true)
    public List<CommentHistory> commentHistory(AuthenticatedUser user, Long groupId, Long animalId, Long commentId) {
        groupAccessService.requireModerator(user, groupId);
        requireAnimal(groupId, animalId);
        commentRepository.findById(commentId)
                .filter(c -> c.getAnimalId().equals(animalId))
                .orElseThrow(() -> new NotFoundException("Comment not found"));
        return historyRepository.findByCommentIdOrderByCreatedAtDesc(commentId);
    }

    @Transactional(readOnly = true)
    public List<AnimalComment> latestComments(AuthenticatedUser user, Long groupId, Integer limit) {
        groupAccessService.requireAccess(user, groupId);
        List<AnimalComment> comments = commentRepository.findLatestInGroup(groupId,
                PageRequest.of(0, clampLimit(limit, DEFAULT_LATEST_LIMIT)));
        return attachAnimals(comments);
    }

    @Transactional(readOnly = true)
    public List<AnimalComment> deletedComments(AuthenticatedUser user, Long groupId) {
        groupAccessService.requireModerator(user, groupId);
        return attachAnimals(commentRepository.findDeletedInGroup(groupId));
    }

    @Transactional(readOnly = true)
    public List<AnimalComment> allDeletedComments() {
        return attachAnimals(commentRepository.findByDeletedAtIsNotNullOrderByDeletedAtDesc());
    }

    // ==================== HELPERS ====================

    private List<AnimalComment> attachAnimals(List<AnimalComment> comments) {
        Map<Long, Animal> animals = animalRepository.findAllById(
                        comments.stream().map(AnimalComment::getAnimalId).distinct().collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Animal::getId, Function.identity()));
        comments.forEach(c -> c.setAnimal(animals.get(c.getAnimalId())));
        return comments;
    }

    private void applyTags(AnimalComment comment, Long groupId, List<Long> tagIds) {
        comment.getTags().clear();
        if (tagIds != null && !tagIds.isEmpty()) {
            comment.getTags().addAll(commentTagRepository.findByGroupIdAndIdInAndDeletedAtIsNull(groupId, tagIds));
        }
    }

    private static void requireContent(CommentRequest request) {
        boolean hasContent = request.getContent() != null && !request.getContent().isBlank();
        boolean hasImage = request.getImageUrl() != null && !request.getImageUrl().isBlank();
        if (!hasContent && !hasImage) {
            throw new BadRequestException("Content or image is required");
        }
    }

    static int clampLimit(Integer limit, int defaultLimit) {
        if (limit == null || limit <= 0) {
            return defaultLimit;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public static List<String> splitCsv(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private void requireAnimal(Long groupId, Long animalId) {
        animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(animalId, groupId)
                .orElseThrow(() -> new NotFoundException("Animal not found"));
    }

    private AnimalComment requireComment(Long animalId, Long commentId) {
        return commentRepository.findByIdAndAnimalIdAndDeletedAtIsNull(commentId, animalId)
                .orElseThrow(() -> new NotFoundException("Comment not found"));
    }
}
