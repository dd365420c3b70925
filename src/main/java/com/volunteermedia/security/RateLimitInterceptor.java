package com.volunteermedia.security;

import com.volunteermedia.exception.TooManyRequestsException;
import com.volunteermedia.service.RateLimitService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Duration;

/**
 * Per-IP limit on the unauthenticated credential endpoints (login, password reset, setup).
 * Keyed on the servlet remote address; forwarded headers are applied by the container only for
 * trusted proxies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimitService rateLimitService;

    @Value("${app.rate-limit.auth.requests:5}")
    private int maxRequests;

    @Value("${app.rate-limit.auth.window:1m}")
    private Duration window;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }
        String clientIp = request.getRemoteAddr();
        if (rateLimitService.isLimited("auth:" + clientIp, maxRequests, window)) {
            log.warn("Rate limit exceeded for {} on {}", clientIp, request.getRequestURI());
            throw new TooManyRequestsException("Too many requests. Please try again later.");
        }
        return true;
    }
}
