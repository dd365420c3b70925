package com.volunteermedia.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ProfileUpdateRequest {

    @Size(max = 100, message = "First name must be 100 characters or less")
    private String firstName;

    @Size(max = 100, message = "Last name must be 100 characters or less")
    private String lastName;

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email address")
    private String email;

    @Size(max = 20, message = "Phone number must be 20 characters or less")
    private String phoneNumber;

    private Boolean hideEmail;

    private Boolean hidePhoneNumber;
}
