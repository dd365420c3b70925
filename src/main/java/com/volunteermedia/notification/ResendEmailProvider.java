package com.volunteermedia.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivery through the Resend HTTP API.
 */
@Slf4j
public class ResendEmailProvider implements EmailProvider {

    static final String DEFAULT_API_URL = "https://api.resend.com/emails";

    private final RestTemplate restTemplate;
    private final String apiUrl;
    private final String apiKey;
    private final String fromAddress;
    private final String fromName;

    public ResendEmailProvider(RestTemplate restTemplate, String apiUrl, String apiKey,
                               String fromAddress, String fromName) {
        this.restTemplate = restTemplate;
        this.apiUrl = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
        this.apiKey = apiKey;
        this.fromAddress = fromAddress;
        this.fromName = fromName;
    }

    @Override
    public void sendEmail(String to, String subject, String htmlBody) {
        if (!isConfigured()) {
            throw new EmailDeliveryException("Resend provider is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", fromName != null && !fromName.isBlank()
                ? String.format("%s <%s>", fromName, fromAddress)
                : fromAddress);
        payload.put("to", List.of(to));
        payload.put("subject", subject);
        payload.put("html", htmlBody);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(payload, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new EmailDeliveryException("Resend API error: status " + response.getStatusCode().value());
            }
            log.debug("Sent email via Resend to {}", to);
        } catch (RestClientResponseException e) {
            throw new EmailDeliveryException("Resend API error: status " + e.getStatusCode().value()
                    + ", body: " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new EmailDeliveryException("failed to send request to Resend: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && fromAddress != null && !fromAddress.isBlank();
    }

    @Override
    public String name() {
        return "resend";
    }
}
