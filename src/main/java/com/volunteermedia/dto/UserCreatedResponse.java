package com.volunteermedia.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of an admin user creation. Exactly one of {@code message} and {@code warning} is set;
 * a warning means the user exists but the setup email could not be delivered.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserCreatedResponse(AccountView user, String message, String warning) {
}
