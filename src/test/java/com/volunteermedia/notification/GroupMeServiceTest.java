package com.volunteermedia.notification;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GroupMeServiceTest {

    private static final String API = "https://api.groupme.com/v3/bots/post";
    private static final String BOT = "0123456789abcdef0123456789";

    private final RestTemplate restTemplate = mock(RestTemplate.class);
    private final GroupMeService groupMeService = new GroupMeService(restTemplate, API);

    @Test
    void shortTextIsUntouched() {
        assertThat(GroupMeService.truncate("hello", 10)).isEqualTo("hello");
    }

    @Test
    void longTextIsCutWithEllipsis() {
        String result = GroupMeService.truncate("a".repeat(1200), GroupMeService.MAX_MESSAGE_LENGTH);

        assertThat(result).hasSize(1000).endsWith("...");
    }

    @Test
    void truncationNeverSplitsASurrogatePair() {
        // cut point falls right after the high surrogate of the emoji
        String text = "abcd😀xyz";

        assertThat(GroupMeService.truncate(text, 8)).isEqualTo("abcd...");
    }

    @Test
    void announcementsArePrefixed() {
        assertThat(GroupMeService.formatAnnouncement("Title", "Body")).isEqualTo("📢 Title\n\nBody");
    }

    @Test
    @SuppressWarnings("unchecked")
    void postsBotIdAndText() {
        when(restTemplate.postForEntity(eq(API), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.status(HttpStatus.CREATED).body(""));

        groupMeService.sendUpdate(BOT, "Walk schedule", "New times posted");

        ArgumentCaptor<HttpEntity<Map<String, String>>> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForEntity(eq(API), request.capture(), eq(String.class));
        assertThat(request.getValue().getBody())
                .containsEntry("bot_id", BOT)
                .containsEntry("text", "Walk schedule\n\nNew times posted");
    }

    @Test
    void unexpectedStatusIsADeliveryFailure() {
        when(restTemplate.postForEntity(eq(API), any(HttpEntity.class), eq(String.class)))
                .thenReturn(new ResponseEntity<>("", HttpStatus.ACCEPTED));

        assertThatThrownBy(() -> groupMeService.sendMessage(BOT, "hi"))
                .isInstanceOf(GroupMeDeliveryException.class)
                .hasMessage("GroupMe API error: status 202");
    }

    @Test
    void serverErrorIsADeliveryFailure() {
        when(restTemplate.postForEntity(eq(API), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> groupMeService.sendMessage(BOT, "hi"))
                .isInstanceOf(GroupMeDeliveryException.class)
                .hasMessage("GroupMe API error: status 502");
    }

    @Test
    void missingBotIdFailsWithoutCallingTheApi() {
        assertThatThrownBy(() -> groupMeService.sendMessage(" ", "hi"))
                .isInstanceOf(GroupMeDeliveryException.class)
                .hasMessage("bot ID is required");
        verifyNoInteractions(restTemplate);
    }
}
