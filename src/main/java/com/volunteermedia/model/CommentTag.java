package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Group-scoped label for comments. System tags ("behavior", "medical") are created
 * with every group and cannot be deleted.
 */
@Entity
@Table(name = "comment_tags",
       uniqueConstraints = @UniqueConstraint(name = "uk_comment_tag_group_name", columnNames = {"group_id", "name"}))
@Data
@NoArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class CommentTag {

    public static final String DEFAULT_COLOR = "#6b7280";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false)
    private Long groupId;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(length = 20)
    private String color = DEFAULT_COLOR;

    @JsonProperty("is_system")
    private boolean system;

    private Instant createdAt;

    private Instant updatedAt;

    @JsonIgnore
    private Instant deletedAt;

    public CommentTag(Long groupId, String name, String color, boolean system) {
        this.groupId = groupId;
        this.name = name;
        this.color = color;
        this.system = system;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (color == null || color.isBlank()) {
            color = DEFAULT_COLOR;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
