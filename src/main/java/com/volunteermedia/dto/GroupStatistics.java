package com.volunteermedia.dto;

import java.time.Instant;

public record GroupStatistics(Long groupId, String groupName, long userCount, long animalCount,
                              long commentCount, Instant lastActivity) {
}
