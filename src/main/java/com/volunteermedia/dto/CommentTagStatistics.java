package com.volunteermedia.dto;

import java.time.Instant;

public record CommentTagStatistics(Long tagId, String tagName, String color, long commentCount, Instant lastUsed) {
}
