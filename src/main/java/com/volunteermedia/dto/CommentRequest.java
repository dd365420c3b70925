package com.volunteermedia.dto;

import com.volunteermedia.model.SessionMetadata;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class CommentRequest {

    @Size(max = 10000, message = "Content must be 10000 characters or less")
    private String content;

    @Size(max = 500, message = "Image URL must be 500 characters or less")
    private String imageUrl;

    private List<Long> tagIds;

    private SessionMetadata metadata;
}
