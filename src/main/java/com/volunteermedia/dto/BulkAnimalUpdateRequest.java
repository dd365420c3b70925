package com.volunteermedia.dto;

import lombok.Data;

import java.util.List;

/**
 * At least one of groupId and status must be set.
 */
@Data
public class BulkAnimalUpdateRequest {

    private List<Long> animalIds;

    private Long groupId;

    private String status;
}
