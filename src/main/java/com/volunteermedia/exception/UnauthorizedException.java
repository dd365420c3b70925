package com.volunteermedia.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class UnauthorizedException extends ApiException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Map<String, Object> details) {
        super(HttpStatus.UNAUTHORIZED, message, details);
    }
}
