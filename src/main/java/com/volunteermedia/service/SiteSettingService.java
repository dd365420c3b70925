package com.volunteermedia.service;

import com.volunteermedia.config.RedisConfig;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.model.SiteSetting;
import com.volunteermedia.repository.SiteSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Public key/value settings (site name, description, hero image).
 *
 * CACHING:
 * ========
 * The whole map is cached under one key in the {@code siteSettings} region (5 min TTL).
 * Every write evicts it, so an admin edit is visible on the next read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteSettingService {

    public static final String SITE_NAME = "site_name";
    public static final String SITE_SHORT_NAME = "site_short_name";
    public static final String SITE_DESCRIPTION = "site_description";
    public static final String HERO_IMAGE_URL = "hero_image_url";

    public static final String DEFAULT_SITE_NAME = "MyHAWS";

    static final int MAX_VALUE_LENGTH = 500;

    private static final Map<String, Rule> RULES = Map.of(
            SITE_NAME, new Rule(true, 100),
            SITE_SHORT_NAME, new Rule(true, 50),
            SITE_DESCRIPTION, new Rule(false, 500),
            HERO_IMAGE_URL, new Rule(false, 500)
    );

    private final SiteSettingRepository siteSettingRepository;

    public static Map<String, String> defaults() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(SITE_NAME, DEFAULT_SITE_NAME);
        defaults.put(SITE_SHORT_NAME, DEFAULT_SITE_NAME);
        defaults.put(SITE_DESCRIPTION, "MyHAWS Volunteer Portal - Internal volunteer management system");
        defaults.put(HERO_IMAGE_URL, "");
        return defaults;
    }

    @Cacheable(cacheNames = RedisConfig.SITE_SETTINGS_CACHE, key = "'all'")
    @Transactional(readOnly = true)
    public Map<String, String> getAll() {
        Map<String, String> settings = new TreeMap<>();
        for (SiteSetting setting : siteSettingRepository.findAll()) {
            settings.put(setting.getKey(), setting.getValue() != null ? setting.getValue() : "");
        }
        log.debug("Loaded {} site settings from database", settings.size());
        return settings;
    }

    /**
     * Create or replace a setting.
     *
     * @throws BadRequestException if the value breaks the key's rule
     */
    @CacheEvict(cacheNames = RedisConfig.SITE_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public SiteSetting update(String key, String value) {
        String normalized = value != null ? value : "";
        validate(key, normalized);

        SiteSetting setting = siteSettingRepository.findByKey(key)
                .orElseGet(() -> new SiteSetting(key, normalized));
        setting.setValue(normalized);

        SiteSetting saved = siteSettingRepository.save(setting);
        log.info("Updated site setting {}", key);
        return saved;
    }

    /**
     * Insert any missing default rows. Existing values are left untouched.
     */
    @CacheEvict(cacheNames = RedisConfig.SITE_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public int ensureDefaults() {
        int created = 0;
        for (Map.Entry<String, String> entry : defaults().entrySet()) {
            if (siteSettingRepository.findByKey(entry.getKey()).isEmpty()) {
                siteSettingRepository.save(new SiteSetting(entry.getKey(), entry.getValue()));
                created++;
            }
        }
        if (created > 0) {
            log.info("Created {} default site settings", created);
        }
        return created;
    }

    static void validate(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new BadRequestException("setting key is required");
        }
        Rule rule = RULES.getOrDefault(key, new Rule(false, MAX_VALUE_LENGTH));
        if (rule.required() && value.trim().isEmpty()) {
            throw new BadRequestException(key + " is required");
        }
        if (value.length() > rule.maxLength()) {
            throw new BadRequestException(key + " must be " + rule.maxLength() + " characters or less");
        }
    }

    private record Rule(boolean required, int maxLength) {
    }
}
