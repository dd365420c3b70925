package com.volunteermedia.service;

import com.volunteermedia.dto.ActivityItem;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.GroupUpdate;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.GroupUpdateRepository;
import com.volunteermedia.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActivityFeedServiceTest {

    private static final AuthenticatedUser MEMBER = new AuthenticatedUser(5L, false);

    @Mock
    private AnimalCommentRepository commentRepository;
    @Mock
    private GroupUpdateRepository groupUpdateRepository;
    @Mock
    private AnimalRepository animalRepository;
    @Mock
    private GroupAccessService groupAccessService;

    private ActivityFeedService feedService;

    @BeforeEach
    void setUp() {
        feedService = new ActivityFeedService(commentRepository, groupUpdateRepository, animalRepository,
                groupAccessService);
    }

    private static GroupUpdate post(long id, String createdAt) {
        GroupUpdate post = new GroupUpdate();
        post.setId(id);
        post.setGroupId(2L);
        post.setTitle("Update " + id);
        post.setContent("content");
        post.setCreatedAt(Instant.parse(createdAt));
        return post;
    }

    private static AnimalComment comment(long id, String createdAt) {
        AnimalComment comment = new AnimalComment();
        comment.setId(id);
        comment.setAnimalId(10L);
        comment.setContent("note " + id);
        comment.setCreatedAt(Instant.parse(createdAt));
        return comment;
    }

    @Test
    @SuppressWarnings("unchecked")
    void mergesPostsAndCommentsNewestFirst() {
        when(groupUpdateRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(post(1, "2026-05-03T10:00:00Z"), post(2, "2026-05-01T10:00:00Z"))));
        when(commentRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(comment(7, "2026-05-04T10:00:00Z"), comment(8, "2026-05-02T10:00:00Z"))));

        Map<String, Object> feed = feedService.getFeed(MEMBER, 2L,
                new ActivityFeedService.FeedQuery(null, null, null, null, null, null, 3, 0));

        List<ActivityItem> items = (List<ActivityItem>) feed.get("items");
        assertThat(items).extracting(ActivityItem::getId).containsExactly(7L, 1L, 8L);
        assertThat(items).extracting(ActivityItem::getType)
                .containsExactly(ActivityItem.TYPE_COMMENT, ActivityItem.TYPE_ANNOUNCEMENT, ActivityItem.TYPE_COMMENT);
        assertThat(feed).containsEntry("total", 4L).containsEntry("limit", 3).containsEntry("hasMore", true);
    }

    @Test
    @SuppressWarnings("unchecked")
    void offsetSkipsIntoTheMergedList() {
        when(groupUpdateRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(post(1, "2026-05-03T10:00:00Z"))));
        when(commentRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(comment(7, "2026-05-04T10:00:00Z"))));

        Map<String, Object> feed = feedService.getFeed(MEMBER, 2L,
                new ActivityFeedService.FeedQuery("all", null, null, null, null, null, 10, 1));

        List<ActivityItem> items = (List<ActivityItem>) feed.get("items");
        assertThat(items).extracting(ActivityItem::getId).containsExactly(1L);
        assertThat(feed).containsEntry("hasMore", false);
    }

    @Test
    @SuppressWarnings("unchecked")
    void commentsOnlySkipsPosts() {
        when(commentRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        feedService.getFeed(MEMBER, 2L,
                new ActivityFeedService.FeedQuery("comments", 10L, "medical", "poor", null, null, null, null));

        verify(groupUpdateRepository, never()).findAll(any(Specification.class), any(Pageable.class));
    }

    @Test
    void ratingFilterUnderstandsPoorAndNumbers() {
        assertThat(ActivityFeedService.ratingFilter("poor")).isNotNull();
        assertThat(ActivityFeedService.ratingFilter("4")).isNotNull();
        assertThat(ActivityFeedService.ratingFilter("great")).isNull();
        assertThat(ActivityFeedService.ratingFilter(null)).isNull();
    }

    @Test
    void timestampsAreRfc3339() {
        assertThat(ActivityFeedService.parseTimestamp("2026-05-01T10:00:00+02:00"))
                .isEqualTo(Instant.parse("2026-05-01T08:00:00Z"));
        assertThat(ActivityFeedService.parseTimestamp("yesterday")).isNull();
    }
}
