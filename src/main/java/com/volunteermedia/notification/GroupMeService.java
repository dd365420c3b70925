package com.volunteermedia.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts messages to GroupMe group chats through the bot API.
 */
@Service
@Slf4j
public class GroupMeService {

    static final int MAX_MESSAGE_LENGTH = 1000;
    private static final String ELLIPSIS = "...";

    private final RestTemplate restTemplate;
    private final String apiUrl;

    public GroupMeService(RestTemplate restTemplate,
                          @Value("${app.groupme.api-url:https://api.groupme.com/v3/bots/post}") String apiUrl) {
        this.restTemplate = restTemplate;
        this.apiUrl = apiUrl;
    }

    /**
     * @throws GroupMeDeliveryException on a missing bot id or text, or when the API does not answer 200/201
     */
    public void sendMessage(String botId, String text) {
        if (botId == null || botId.isBlank()) {
            throw new GroupMeDeliveryException("bot ID is required");
        }
        if (text == null || text.isEmpty()) {
            throw new GroupMeDeliveryException("message text is required");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("bot_id", botId);
        payload.put("text", truncate(text, MAX_MESSAGE_LENGTH));

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(apiUrl, new HttpEntity<>(payload, headers), String.class);
            int status = response.getStatusCode().value();
            if (status != HttpStatus.OK.value() && status != HttpStatus.CREATED.value()) {
                throw new GroupMeDeliveryException("GroupMe API error: status " + status);
            }
        } catch (RestClientResponseException e) {
            throw new GroupMeDeliveryException("GroupMe API error: status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new GroupMeDeliveryException("failed to send GroupMe message: " + e.getMessage(), e);
        }
    }

    public void sendAnnouncement(String botId, String title, String content) {
        sendMessage(botId, formatAnnouncement(title, content));
    }

    public void sendUpdate(String botId, String title, String content) {
        sendMessage(botId, formatUpdate(title, content));
    }

    static String formatAnnouncement(String title, String content) {
        return "📢 " + title + "\n\n" + content;
    }

    static String formatUpdate(String title, String content) {
        return title + "\n\n" + content;
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, maxLength);
        }
        int end = maxLength - ELLIPSIS.length();
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + ELLIPSIS;
    }
}
