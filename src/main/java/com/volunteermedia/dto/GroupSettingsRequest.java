package com.volunteermedia.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Settings a group admin may change on their own group. Absent fields are left unchanged.
 */
@Data
public class GroupSettingsRequest {

    @Size(max = 500, message = "Description must be 500 characters or less")
    private String description;

    @Size(max = 500, message = "Hero image URL must be 500 characters or less")
    private String heroImageUrl;

    private Boolean hasProtocols;

    private String groupmeBotId;

    private Boolean groupmeEnabled;
}
