package com.volunteermedia.config;

import com.volunteermedia.security.AuthInterceptor;
import com.volunteermedia.security.CurrentUserArgumentResolver;
import com.volunteermedia.security.RateLimitInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * MVC wiring: CORS, the auth and rate-limit interceptors, and {@code @CurrentUser} injection.
 *
 * PUBLIC ENDPOINTS:
 * =================
 * Everything under /api requires a bearer token except the paths in {@link #PUBLIC_API_PATHS}.
 * Health probes live outside /api and are always public.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    static final String[] PUBLIC_API_PATHS = {
            "/api/login",
            "/api/request-password-reset",
            "/api/reset-password",
            "/api/setup-password",
            "/api/settings",
            "/api/images/**"
    };

    static final String[] RATE_LIMITED_PATHS = {
            "/api/login",
            "/api/request-password-reset",
            "/api/reset-password",
            "/api/setup-password"
    };

    private final AuthInterceptor authInterceptor;
    private final RateLimitInterceptor rateLimitInterceptor;
    private final CurrentUserArgumentResolver currentUserArgumentResolver;

    @Value("${app.cors.allowed-origins:http://localhost:5173,http://localhost:3000}")
    private String allowedOrigins;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitInterceptor)
                .addPathPatterns(RATE_LIMITED_PATHS);
        registry.addInterceptor(authInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns(PUBLIC_API_PATHS);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(currentUserArgumentResolver);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(allowedOrigins.split("\\s*,\\s*"))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", "X-Request-ID")
                .exposedHeaders("X-Request-ID", "Content-Disposition")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
