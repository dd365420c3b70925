package com.volunteermedia.security;

import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Bearer-token gate for the protected API.
 *
 * Registered for /api/** minus the public endpoints (see WebConfig). Paths under
 * /api/admin/ additionally require the site-admin claim.
 */
@Component
@RequiredArgsConstructor
public class AuthInterceptor implements HandlerInterceptor {

    public static final String CURRENT_USER_ATTRIBUTE = AuthInterceptor.class.getName() + ".currentUser";
    private static final String BEARER = "Bearer";

    private final JwtService jwtService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            throw new UnauthorizedException("Authorization header required");
        }

        String[] parts = header.trim().split("\\s+");
        if (parts.length != 2 || !BEARER.equalsIgnoreCase(parts[0])) {
            throw new UnauthorizedException("Invalid authorization format");
        }

        AuthenticatedUser user = jwtService.parseToken(parts[1]);

        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (path.startsWith("/api/admin/") && !user.admin()) {
            throw new ForbiddenException("Admin access required");
        }

        request.setAttribute(CURRENT_USER_ATTRIBUTE, user);
        MDC.put("userId", String.valueOf(user.userId()));
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        MDC.remove("userId");
    }
}
