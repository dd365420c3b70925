package com.volunteermedia.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.CommentTag;
import com.volunteermedia.model.SessionMetadata;
import com.volunteermedia.model.User;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * One entry of a group's activity feed: a board post ("announcement") or a comment.
 * Comment-only fields are left out of the JSON for posts, and the title for comments.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActivityItem {

    public static final String TYPE_ANNOUNCEMENT = "announcement";
    public static final String TYPE_COMMENT = "comment";

    Long id;
    String type;
    Instant createdAt;
    Long userId;
    User user;
    String content;
    String title;
    String imageUrl;
    Long animalId;
    Animal animal;
    Set<CommentTag> tags;
    SessionMetadata metadata;
}
