package com.volunteermedia.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ForbiddenException extends ApiException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }

    public ForbiddenException(String message, Map<String, Object> details) {
        super(HttpStatus.FORBIDDEN, message, details);
    }
}
