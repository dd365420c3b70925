package com.volunteermedia.controller;

import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.SeedService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * POST /api/admin/seed-database
 *
 * Loads demo volunteers, animals and session notes. Refuses with 409 when other users
 * already exist unless {@code "force": true} is sent.
 */
@RestController
@RequiredArgsConstructor
public class SeedController {

    private final SeedService seedService;

    @PostMapping("/api/admin/seed-database")
    public ResponseEntity<Map<String, Object>> seedDatabase(@CurrentUser AuthenticatedUser admin,
                                                            @RequestBody(required = false) SeedRequest request) {
        boolean force = request != null && request.isForce();
        return ResponseEntity.ok(seedService.seedDemoData(admin.userId(), force));
    }

    // ==================== DTOs ====================

    @Data
    public static class SeedRequest {
        private boolean force;
    }
}
