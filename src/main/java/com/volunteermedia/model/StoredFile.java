package com.volunteermedia.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Binary content stored in the database, addressed by UUID.
 * Images are served from /api/images/{id}, protocol documents from /api/documents/{id}.
 */
@Entity
@Table(name = "stored_files")
@Data
@NoArgsConstructor
public class StoredFile {

    public static final String PROVIDER = "postgres";

    public enum Kind {
        IMAGE,
        DOCUMENT
    }

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Kind kind;

    @Column(nullable = false, length = 100)
    private String contentType;

    @Column(length = 255)
    private String fileName;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Column(nullable = false, length = 26214400)
    private byte[] data;

    private long size;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
