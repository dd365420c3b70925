package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TagCategory {
    BEHAVIOR("behavior"),
    WALKER_STATUS("walker_status");

    private final String value;

    TagCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TagCategory fromValue(String raw) {
        for (TagCategory category : values()) {
            if (category.value.equalsIgnoreCase(raw)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Invalid category: " + raw);
    }
}
