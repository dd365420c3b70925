package com.volunteermedia.service;

import com.volunteermedia.dto.ActivityItem;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.GroupUpdate;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.GroupUpdateRepository;
import com.volunteermedia.repository.OffsetPageRequest;
import com.volunteermedia.security.AuthenticatedUser;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.volunteermedia.repository.CommentSpecifications.active;
import static com.volunteermedia.repository.CommentSpecifications.createdFrom;
import static com.volunteermedia.repository.CommentSpecifications.createdTo;
import static com.volunteermedia.repository.CommentSpecifications.forAnimal;
import static com.volunteermedia.repository.CommentSpecifications.inGroup;
import static com.volunteermedia.repository.CommentSpecifications.taggedWithAny;
import static com.volunteermedia.repository.CommentSpecifications.withRating;
import static com.volunteermedia.repository.CommentSpecifications.withRatingBetween;

/**
 * Group activity feed: board posts and comments merged newest first.
 *
 * MERGING:
 * ========
 * Each source is queried for its newest (offset + limit) rows, which is enough to cut the
 * requested window out of the merged list. {@code total} is the sum of both source counts.
 *
 * Animal, tag and rating filters only narrow the comments; posts are filtered by date only.
 * Rating "poor" means a session rated 1 or 2.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityFeedService {

    static final int DEFAULT_LIMIT = 20;

    private final AnimalCommentRepository commentRepository;
    private final GroupUpdateRepository groupUpdateRepository;
    private final AnimalRepository animalRepository;
    private final GroupAccessService groupAccessService;

    /**
     * Feed query parameters as they arrive on the request; all optional.
     */
    public record FeedQuery(String type, Long animalId, String tags, String rating,
                            String from, String to, Integer limit, Integer offset) {
    }

    @Transactional(readOnly = true)
    public Map<String, Object> getFeed(AuthenticatedUser user, Long groupId, FeedQuery query) {
        groupAccessService.requireAccess(user, groupId);

        int limit = CommentService.clampLimit(query.limit(), DEFAULT_LIMIT);
        int offset = query.offset() == null || query.offset() < 0 ? 0 : query.offset();
        Instant from = parseTimestamp(query.from());
        Instant to = parseTimestamp(query.to());
        String type = query.type() == null || query.type().isBlank() ? "all" : query.type().trim().toLowerCase();

        OffsetPageRequest window = new OffsetPageRequest(0, offset + limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        List<ActivityItem> items = new ArrayList<>();
        long total = 0;

        if ("all".equals(type) || "announcements".equals(type)) {
            Page<GroupUpdate> posts = groupUpdateRepository.findAll(postsInGroup(groupId, from, to), window);
            total += posts.getTotalElements();
            posts.forEach(p -> items.add(fromPost(p)));
        }

        if ("all".equals(type) || "comments".equals(type)) {
            Specification<AnimalComment> spec = Specification.where(active())
                    .and(inGroup(groupId))
                    .and(forAnimal(query.animalId()))
                    .and(taggedWithAny(CommentService.splitCsv(query.tags())))
                    .and(ratingFilter(query.rating()))
                    .and(createdFrom(from))
                    .and(createdTo(to));
            Page<AnimalComment> comments = commentRepository.findAll(spec, window);
            total += comments.getTotalElements();

            Map<Long, Animal> animals = animalRepository.findAllById(comments.stream()
                            .map(AnimalComment::getAnimalId).distinct().collect(Collectors.toList()))
                    .stream()
                    .collect(Collectors.toMap(Animal::getId, Function.identity()));
            comments.forEach(c -> items.add(fromComment(c, animals.get(c.getAnimalId()))));
        }

        List<ActivityItem> page = items.stream()
                .sorted(Comparator.comparing(ActivityItem::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .skip(offset)
                .limit(limit)
                .collect(Collectors.toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("items", page);
        body.put("total", total);
        body.put("limit", limit);
        body.put("offset", offset);
        body.put("hasMore", offset + page.size() < total);
        return body;
    }

    static Specification<AnimalComment> ratingFilter(String rating) {
        if (rating == null || rating.isBlank()) {
            return null;
        }
        if ("poor".equalsIgnoreCase(rating.trim())) {
            return withRatingBetween(1, 2);
        }
        try {
            return withRating(Integer.parseInt(rating.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring unrecognised rating filter '{}'", rating);
            return null;
        }
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable feed date '{}'", raw);
            return null;
        }
    }

    private static Specification<GroupUpdate> postsInGroup(Long groupId, Instant from, Instant to) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("groupId"), groupId));
            predicates.add(cb.isNull(root.get("deletedAt")));
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("createdAt"), to));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static ActivityItem fromPost(GroupUpdate post) {
        return ActivityItem.builder()
                .id(post.getId())
                .type(ActivityItem.TYPE_ANNOUNCEMENT)
                .createdAt(post.getCreatedAt())
                .userId(post.getUserId())
                .user(post.getUser())
                .content(post.getContent())
                .title(post.getTitle())
                .imageUrl(post.getImageUrl())
                .build();
    }

    private static ActivityItem fromComment(AnimalComment comment, Animal animal) {
        return ActivityItem.builder()
                .id(comment.getId())
                .type(ActivityItem.TYPE_COMMENT)
                .createdAt(comment.getCreatedAt())
                .userId(comment.getUserId())
                .user(comment.getUser())
                .content(comment.getContent())
                .imageUrl(comment.getImageUrl())
                .animalId(comment.getAnimalId())
                .animal(animal)
                .tags(comment.getTags())
                .metadata(comment.getMetadata())
                .build();
    }
}
