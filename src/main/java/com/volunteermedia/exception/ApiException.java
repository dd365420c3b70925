package com.volunteermedia.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for failures that map to a specific HTTP status.
 *
 * The message becomes the {@code error} field of the JSON body. Extra fields
 * (e.g. {@code attempts_remaining} on a failed login) are carried in {@link #getDetails()}.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final Map<String, Object> details;

    protected ApiException(HttpStatus status, String message) {
        this(status, message, Collections.emptyMap());
    }

    protected ApiException(HttpStatus status, String message, Map<String, Object> details) {
        super(message);
        this.status = status;
        this.details = details == null ? Collections.emptyMap() : new LinkedHashMap<>(details);
    }
}
