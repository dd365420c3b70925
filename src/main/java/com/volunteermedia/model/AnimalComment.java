package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A volunteer's note on an animal. When {@code metadata} is present the comment is a session note.
 */
@Entity
@Table(name = "animal_comments",
       indexes = {
           @Index(name = "idx_comments_animal_created", columnList = "animalId, createdAt"),
           @Index(name = "idx_comments_user", columnList = "userId")
       })
@Data
@NoArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class AnimalComment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long animalId;

    @Column(nullable = false)
    private Long userId;

    @Column(length = 10000)
    private String content;

    @Column(length = 500)
    private String imageUrl;

    @Convert(converter = SessionMetadataConverter.class)
    @Column(length = 10000)
    private SessionMetadata metadata;

    // Copy of metadata.sessionRating so feeds can filter on it in SQL
    @JsonIgnore
    private Integer sessionRating;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "animal_comment_tags",
               joinColumns = @JoinColumn(name = "animal_comment_id"),
               inverseJoinColumns = @JoinColumn(name = "comment_tag_id"))
    private Set<CommentTag> tags = new HashSet<>();

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne
    @JoinColumn(name = "userId", insertable = false, updatable = false)
    private User user;

    // Filled in for cross-animal listings (latest comments, deleted comments)
    @Transient
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Animal animal;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        sessionRating = metadata != null ? metadata.getSessionRating() : null;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        sessionRating = metadata != null ? metadata.getSessionRating() : null;
    }
}
