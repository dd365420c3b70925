package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.model.SessionMetadata;
import org.springframework.web.util.HtmlUtils;

import java.util.regex.Pattern;

/**
 * Length/range checks and HTML escaping for structured session notes.
 */
public final class SessionMetadataValidator {

    static final int MAX_GOAL = 200;
    static final int MAX_OUTCOME = 2000;
    static final int MAX_NOTES = 1000;

    private static final Pattern TIME = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    private SessionMetadataValidator() {
    }

    /**
     * Validate {@code metadata} and return a copy whose free-text fields are HTML-escaped.
     *
     * @throws BadRequestException naming the first offending field
     */
    public static SessionMetadata sanitize(SessionMetadata metadata) {
        if (metadata == null) {
            return null;
        }

        if (length(metadata.getSessionGoal()) > MAX_GOAL) {
            throw new BadRequestException("session goal exceeds 200 character limit");
        }
        if (length(metadata.getSessionOutcome()) > MAX_OUTCOME) {
            throw new BadRequestException("session outcome exceeds 2000 character limit");
        }
        if (length(metadata.getBehaviorNotes()) > MAX_NOTES) {
            throw new BadRequestException("behavior notes exceed 1000 character limit");
        }
        if (length(metadata.getMedicalNotes()) > MAX_NOTES) {
            throw new BadRequestException("medical notes exceed 1000 character limit");
        }
        if (length(metadata.getOtherNotes()) > MAX_NOTES) {
            throw new BadRequestException("other notes exceed 1000 character limit");
        }
        Integer rating = metadata.getSessionRating();
        if (rating != null && (rating < 0 || rating > 5)) {
            throw new BadRequestException("session rating must be between 1 and 5 (or 0 for not set)");
        }
        checkTime(metadata.getSessionStartTime(), "session start time");
        checkTime(metadata.getSessionEndTime(), "session end time");

        return SessionMetadata.builder()
                .sessionGoal(escape(metadata.getSessionGoal()))
                .sessionOutcome(escape(metadata.getSessionOutcome()))
                .behaviorNotes(escape(metadata.getBehaviorNotes()))
                .medicalNotes(escape(metadata.getMedicalNotes()))
                .otherNotes(escape(metadata.getOtherNotes()))
                .sessionRating(rating)
                .sessionStartTime(blankToNull(metadata.getSessionStartTime()))
                .sessionEndTime(blankToNull(metadata.getSessionEndTime()))
                .build();
    }

    private static void checkTime(String value, String field) {
        if (value != null && !value.isBlank() && !TIME.matcher(value.trim()).matches()) {
            throw new BadRequestException(field + " must be in HH:MM format");
        }
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }

    private static String escape(String value) {
        return value == null ? null : HtmlUtils.htmlEscape(value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
