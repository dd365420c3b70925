package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured part of a session note. Stored as JSON alongside the comment.
 * Times are "HH:MM" strings as entered by the volunteer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionMetadata {

    private String sessionGoal;

    private String sessionOutcome;

    private String behaviorNotes;

    private String medicalNotes;

    private Integer sessionRating;

    private String otherNotes;

    private String sessionStartTime;

    private String sessionEndTime;
}
