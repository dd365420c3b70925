package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Snapshot of a comment taken just before an edit.
 */
@Entity
@Table(name = "comment_histories",
       indexes = @Index(name = "idx_comment_history_comment", columnList = "commentId"))
@Data
@NoArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class CommentHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long commentId;

    @Column(length = 10000)
    private String content;

    @Column(length = 500)
    private String imageUrl;

    @Convert(converter = SessionMetadataConverter.class)
    @Column(length = 10000)
    private SessionMetadata metadata;

    @Column(nullable = false)
    private Long editedBy;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne
    @JoinColumn(name = "editedBy", insertable = false, updatable = false)
    private User editor;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
