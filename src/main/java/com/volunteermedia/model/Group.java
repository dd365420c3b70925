package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A volunteer group (e.g. "dogs", "cats", "modsquad").
 * Animals, protocols, tags and updates are all scoped to a group.
 */
@Entity
@Table(name = "volunteer_groups")
@Data
@NoArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class Group {

    public static final String DEFAULT_HERO_IMAGE = "/default-hero.svg";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    @Column(length = 500)
    private String imageUrl;

    @Column(length = 500)
    private String heroImageUrl;

    private boolean hasProtocols;

    // GroupMe bot for outgoing group posts; 26 hex chars when set
    @Column(length = 26)
    private String groupmeBotId;

    private boolean groupmeEnabled;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @JsonIgnore
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (heroImageUrl == null || heroImageUrl.isBlank()) {
            heroImageUrl = DEFAULT_HERO_IMAGE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @JsonIgnore
    public boolean isGroupmeReady() {
        return groupmeEnabled && groupmeBotId != null && !groupmeBotId.isBlank();
    }
}
