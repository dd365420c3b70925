package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "site_settings")
@Data
@NoArgsConstructor
public class SiteSetting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonProperty("key")
    @Column(name = "setting_key", nullable = false, unique = true, length = 100)
    private String key;

    @JsonProperty("value")
    @Column(name = "setting_value", length = 500)
    private String value;

    private Instant createdAt;

    private Instant updatedAt;

    public SiteSetting(String key, String value) {
        this.key = key;
        this.value = value;
    }

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
