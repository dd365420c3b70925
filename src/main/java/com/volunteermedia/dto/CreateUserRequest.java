package com.volunteermedia.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Admin user creation. Either {@code password} or {@code sendSetupEmail} must be given.
 */
@Data
public class CreateUserRequest {

    @NotBlank(message = "Username is required")
    @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email address")
    private String email;

    private String password;

    @Size(max = 100, message = "First name must be 100 characters or less")
    private String firstName;

    @Size(max = 100, message = "Last name must be 100 characters or less")
    private String lastName;

    @Size(max = 20, message = "Phone number must be 20 characters or less")
    private String phoneNumber;

    @JsonProperty("is_admin")
    private boolean admin;

    private List<Long> groupIds;

    private boolean sendSetupEmail;
}
