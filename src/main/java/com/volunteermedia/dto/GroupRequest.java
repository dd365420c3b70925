package com.volunteermedia.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class GroupRequest {

    @NotBlank(message = "Name is required")
    @Size(min = 2, max = 100, message = "Name must be between 2 and 100 characters")
    private String name;

    @Size(max = 500, message = "Description must be 500 characters or less")
    private String description;

    @Size(max = 500, message = "Image URL must be 500 characters or less")
    private String imageUrl;

    @Size(max = 500, message = "Hero image URL must be 500 characters or less")
    private String heroImageUrl;

    private boolean hasProtocols;

    private String groupmeBotId;

    private boolean groupmeEnabled;
}
