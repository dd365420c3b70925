package com.volunteermedia.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.impl.LaissezFaireSubTypeValidator;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis configuration for caching, idempotency and rate limiting.
 *
 * CACHE REGIONS:
 * ==============
 * - siteSettings: the public key/value settings map (TTL: 5 min, evicted on every write)
 * - groups: single group lookups used by access checks (TTL: 10 min, evicted on group writes)
 *
 * Idempotency keys (7 days) and rate-limit counters (1 min windows) are written directly
 * through StringRedisTemplate and carry their own TTLs.
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisConfig {

    public static final String SITE_SETTINGS_CACHE = "siteSettings";
    public static final String GROUPS_CACHE = "groups";

    // Not a bean; the web layer keeps Boot's snake_case ObjectMapper
    private ObjectMapper cacheObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.activateDefaultTyping(LaissezFaireSubTypeValidator.instance,
                ObjectMapper.DefaultTyping.NON_FINAL, JsonTypeInfo.As.PROPERTY);
        return mapper;
    }

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        GenericJackson2JsonRedisSerializer valueSerializer =
                new GenericJackson2JsonRedisSerializer(cacheObjectMapper());

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(5))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(valueSerializer));

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();

        cacheConfigurations.put(SITE_SETTINGS_CACHE, defaultConfig
            .entryTtl(Duration.ofMinutes(5))
            .prefixCacheNameWith("settings:"));

        cacheConfigurations.put(GROUPS_CACHE, defaultConfig
            .entryTtl(Duration.ofMinutes(10))
            .prefixCacheNameWith("group:"));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaultConfig)
            .withInitialCacheConfigurations(cacheConfigurations)
            .transactionAware()
            .build();

        log.info("Configured RedisCacheManager with regions: siteSettings (5m), groups (10m)");
        return cacheManager;
    }
}
