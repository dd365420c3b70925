package com.volunteermedia.dto;

import java.time.Instant;

public record UserStatistics(Long userId, String username, long commentCount, Instant lastActive,
                             long animalsInteracted) {
}
