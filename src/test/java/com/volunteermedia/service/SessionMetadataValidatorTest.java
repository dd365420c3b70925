package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.model.SessionMetadata;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionMetadataValidatorTest {

    @Test
    void escapesFreeTextAndTrimsTimes() {
        SessionMetadata input = SessionMetadata.builder()
                .sessionGoal("Loose leash <b>walking</b>")
                .behaviorNotes("Pulled toward \"other dogs\"")
                .sessionRating(4)
                .sessionStartTime(" 09:30 ")
                .sessionEndTime("")
                .build();

        SessionMetadata result = SessionMetadataValidator.sanitize(input);

        assertThat(result.getSessionGoal()).isEqualTo("Loose leash &lt;b&gt;walking&lt;/b&gt;");
        assertThat(result.getBehaviorNotes()).isEqualTo("Pulled toward &quot;other dogs&quot;");
        assertThat(result.getSessionRating()).isEqualTo(4);
        assertThat(result.getSessionStartTime()).isEqualTo("09:30");
        assertThat(result.getSessionEndTime()).isNull();
        assertThat(input.getSessionGoal()).contains("<b>");
    }

    @Test
    void nullMetadataStaysNull() {
        assertThat(SessionMetadataValidator.sanitize(null)).isNull();
    }

    @Test
    void rejectsOverlongFields() {
        SessionMetadata goal = SessionMetadata.builder().sessionGoal("g".repeat(201)).build();
        assertThatThrownBy(() -> SessionMetadataValidator.sanitize(goal))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("session goal exceeds 200 character limit");

        SessionMetadata outcome = SessionMetadata.builder().sessionOutcome("o".repeat(2001)).build();
        assertThatThrownBy(() -> SessionMetadataValidator.sanitize(outcome))
                .hasMessage("session outcome exceeds 2000 character limit");

        SessionMetadata medical = SessionMetadata.builder().medicalNotes("m".repeat(1001)).build();
        assertThatThrownBy(() -> SessionMetadataValidator.sanitize(medical))
                .hasMessage("medical notes exceed 1000 character limit");
    }

    @Test
    void ratingZeroMeansNotSet() {
        SessionMetadata unset = SessionMetadata.builder().sessionRating(0).build();
        assertThat(SessionMetadataValidator.sanitize(unset).getSessionRating()).isZero();

        SessionMetadata bad = SessionMetadata.builder().sessionRating(6).build();
        assertThatThrownBy(() -> SessionMetadataValidator.sanitize(bad))
                .hasMessage("session rating must be between 1 and 5 (or 0 for not set)");
    }

    @Test
    void rejectsMalformedTimes() {
        SessionMetadata start = SessionMetadata.builder().sessionStartTime("9:30am").build();
        assertThatThrownBy(() -> SessionMetadataValidator.sanitize(start))
                .hasMessage("session start time must be in HH:MM format");

        SessionMetadata end = SessionMetadata.builder().sessionEndTime("24:00").build();
        assertThatThrownBy(() -> SessionMetadataValidator.sanitize(end))
                .hasMessage("session end time must be in HH:MM format");
    }
}
