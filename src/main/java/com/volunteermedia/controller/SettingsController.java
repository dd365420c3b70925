package com.volunteermedia.controller;

import com.volunteermedia.model.SiteSetting;
import com.volunteermedia.service.SiteSettingService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Site branding. Reads are public so the login page can show the site name.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SettingsController {

    private final SiteSettingService siteSettingService;

    @GetMapping("/settings")
    public ResponseEntity<Map<String, String>> getSettings() {
        return ResponseEntity.ok(siteSettingService.getAll());
    }

    /**
     * PUT /api/admin/settings/site_name
     *
     * { "value": "MyHAWS" }
     */
    @PutMapping("/admin/settings/{key}")
    public ResponseEntity<SiteSetting> updateSetting(@PathVariable String key, @RequestBody SettingRequest request) {
        return ResponseEntity.ok(siteSettingService.update(key, request.getValue()));
    }

    // ==================== DTOs ====================

    @Data
    public static class SettingRequest {
        private String value;
    }
}
