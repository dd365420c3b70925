package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A volunteer or administrator account.
 *
 * Credentials and one-time tokens never leave the server: the password hash,
 * reset/setup token hashes and their lookup prefixes are all {@link JsonIgnore}d.
 * Soft-deleted users keep their row (and their comments) with {@code deletedAt} set.
 */
@Entity
@Table(name = "users",
       indexes = {
           @Index(name = "idx_users_reset_token_lookup", columnList = "resetTokenLookup"),
           @Index(name = "idx_users_setup_token_lookup", columnList = "setupTokenLookup"),
           @Index(name = "idx_users_deleted_at", columnList = "deletedAt")
       })
@Data
@NoArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    private String firstName;

    private String lastName;

    @Column(nullable = false, unique = true)
    private String email;

    @JsonIgnore
    @Column(nullable = false)
    private String password;

    @JsonProperty("is_admin")
    @Column(nullable = false)
    private boolean admin;

    private String phoneNumber;

    private boolean hideEmail;

    private boolean hidePhoneNumber;

    private Long defaultGroupId;

    @JsonIgnore
    private int failedLoginAttempts;

    private Instant lockedUntil;

    private Instant lastLogin;

    @JsonIgnore
    private String resetToken;

    @JsonIgnore
    private Instant resetTokenExpiry;

    @JsonIgnore
    @Column(length = 16)
    private String resetTokenLookup;

    @JsonIgnore
    private String setupToken;

    @JsonIgnore
    private Instant setupTokenExpiry;

    @JsonIgnore
    @Column(length = 16)
    private String setupTokenLookup;

    private boolean requiresPasswordSetup;

    private boolean emailNotificationsEnabled;

    private boolean showLengthOfStay;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @JsonIgnore
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

    @JsonIgnore
    public boolean isLocked(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }
}
