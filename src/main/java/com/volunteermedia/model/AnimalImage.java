package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Photo metadata. {@code animalId} is null for images uploaded outside an animal gallery
 * (comment attachments, group images, hero images). The bytes are in {@link StoredFile}.
 */
@Entity
@Table(name = "animal_images",
       indexes = {
           @Index(name = "idx_animal_images_animal", columnList = "animalId"),
           @Index(name = "idx_animal_images_file", columnList = "fileId")
       })
@Data
@NoArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class AnimalImage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long animalId;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false, length = 500)
    private String imageUrl;

    @JsonIgnore
    @Column(nullable = false, length = 36)
    private String fileId;

    @Column(length = 50)
    private String mimeType;

    @Column(length = 500)
    private String caption;

    @JsonProperty("is_profile_picture")
    private boolean profilePicture;

    private int width;

    private int height;

    private long fileSize;

    @Column(length = 20)
    private String storageProvider = StoredFile.PROVIDER;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne
    @JoinColumn(name = "userId", insertable = false, updatable = false)
    private User user;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
