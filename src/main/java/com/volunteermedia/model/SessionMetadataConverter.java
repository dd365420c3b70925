package com.volunteermedia.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link SessionMetadata} as a snake_case JSON document.
 */
@Converter
public class SessionMetadataConverter implements AttributeConverter<SessionMetadata, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    @Override
    public String convertToDatabaseColumn(SessionMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session metadata", e);
        }
    }

    @Override
    public SessionMetadata convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, SessionMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read session metadata", e);
        }
    }
}
