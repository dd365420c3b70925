package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

/**
 * An animal tracked by a volunteer group.
 *
 * STATUS DATES:
 * =============
 * Each status carries its own start date (foster, quarantine, archived). Changing the
 * status resets the dates of the other statuses; see AnimalService#applyStatusChange.
 *
 * The protocol document bytes live in {@link StoredFile}; this row only keeps its
 * URL and descriptive metadata.
 */
@Entity
@Table(name = "animals",
       indexes = {
           @Index(name = "idx_animals_group_status", columnList = "groupId, status"),
           @Index(name = "idx_animals_deleted_at", columnList = "deletedAt")
       })
@Data
@NoArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class Animal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long groupId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String species;

    @Column(length = 100)
    private String breed;

    private Integer age;

    private LocalDate estimatedBirthDate;

    @Column(length = 5000)
    private String description;

    @Column(length = 5000)
    private String trainerNotes;

    @Column(length = 500)
    private String imageUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AnimalStatus status = AnimalStatus.AVAILABLE;

    private Instant arrivalDate;

    private Instant fosterStartDate;

    private Instant quarantineStartDate;

    private Instant archivedDate;

    private Instant lastStatusChange;

    private int returnCount;

    @JsonProperty("is_returned")
    private boolean returned;

    @Column(length = 500)
    private String protocolDocumentUrl;

    @Column(length = 255)
    private String protocolDocumentName;

    @Column(length = 100)
    private String protocolDocumentType;

    private Long protocolDocumentSize;

    private Long protocolDocumentUserId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "animal_animal_tags",
               joinColumns = @JoinColumn(name = "animal_id"),
               inverseJoinColumns = @JoinColumn(name = "animal_tag_id"))
    private Set<AnimalTag> tags = new HashSet<>();

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

    // ==================== DERIVED VALUES ====================

    public long getLengthOfStayDays() {
        return AnimalTimeline.daysSince(arrivalDate, Instant.now());
    }

    public long getCurrentStatusDays() {
        return AnimalTimeline.daysSince(lastStatusChange, Instant.now());
    }

    public LocalDate getQuarantineEndDate() {
        return AnimalTimeline.quarantineEndDate(AnimalTimeline.toDate(quarantineStartDate));
    }

    public AnimalTimeline.AgeDisplay getAgeDisplay() {
        return AnimalTimeline.ageDisplay(estimatedBirthDate, age, LocalDate.now(ZoneOffset.UTC));
    }
}
