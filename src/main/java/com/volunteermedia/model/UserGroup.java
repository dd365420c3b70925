package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.io.Serializable;
import java.time.Instant;

/**
 * Group membership. The composite key (userId, groupId) makes a user a member at most once;
 * {@code groupAdmin} grants moderation rights within that one group.
 */
@Entity
@Table(name = "user_groups",
       indexes = @Index(name = "idx_user_groups_group", columnList = "groupId"))
@IdClass(UserGroup.Key.class)
@Data
@NoArgsConstructor
public class UserGroup {

    @Id
    private Long userId;

    @Id
    private Long groupId;

    @JsonProperty("is_group_admin")
    @Column(nullable = false)
    private boolean groupAdmin;

    private Instant createdAt;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "userId", insertable = false, updatable = false)
    private User user;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "groupId", insertable = false, updatable = false)
    private Group group;

    public UserGroup(Long userId, Long groupId, boolean groupAdmin) {
        this.userId = userId;
        this.groupId = groupId;
        this.groupAdmin = groupAdmin;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private Long userId;
        private Long groupId;
    }
}
