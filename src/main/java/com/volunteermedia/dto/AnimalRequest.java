package com.volunteermedia.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Create/update body for an animal. On the group endpoints every field is written as sent
 * (name required); the admin update only applies the fields that are present.
 */
@Data
public class AnimalRequest {

    @Size(max = 100, message = "Name must be 100 characters or less")
    private String name;

    @Size(max = 100, message = "Species must be 100 characters or less")
    private String species;

    @Size(max = 100, message = "Breed must be 100 characters or less")
    private String breed;

    @Min(value = 0, message = "Age cannot be negative")
    private Integer age;

    private LocalDate estimatedBirthDate;

    @Size(max = 5000, message = "Description must be 5000 characters or less")
    private String description;

    @Size(max = 5000, message = "Trainer notes must be 5000 characters or less")
    private String trainerNotes;

    @Size(max = 500, message = "Image URL must be 500 characters or less")
    private String imageUrl;

    private String status;

    private Long groupId;

    private Instant quarantineStartDate;

    @JsonProperty("is_returned")
    private Boolean returned;
}
