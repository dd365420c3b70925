package com.volunteermedia.dto;

import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.Group;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Public profile of a volunteer. {@code email} and {@code phoneNumber} are null when the
 * user hides them from the viewer.
 */
@Value
@Builder
public class UserProfileView {
    Long id;
    String username;
    String firstName;
    String lastName;
    String email;
    String phoneNumber;
    Instant createdAt;
    Instant lastLogin;
    List<Group> groups;
    long commentCount;
    List<AnimalComment> recentComments;
}
