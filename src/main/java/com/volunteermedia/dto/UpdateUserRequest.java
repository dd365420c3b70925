package com.volunteermedia.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Admin user update. Absent fields are left unchanged; a present {@code groupIds}
 * replaces the memberships.
 */
@Data
public class UpdateUserRequest {

    @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters")
    private String username;

    @Email(message = "Invalid email address")
    private String email;

    @Size(max = 100, message = "First name must be 100 characters or less")
    private String firstName;

    @Size(max = 100, message = "Last name must be 100 characters or less")
    private String lastName;

    @Size(max = 20, message = "Phone number must be 20 characters or less")
    private String phoneNumber;

    @JsonProperty("is_admin")
    private Boolean admin;

    private List<Long> groupIds;
}
