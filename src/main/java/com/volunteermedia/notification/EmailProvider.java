package com.volunteermedia.notification;

/**
 * Outbound email transport. One implementation is active, chosen by {@code app.email.provider}.
 */
public interface EmailProvider {

    /**
     * @throws EmailDeliveryException if the provider rejects or cannot deliver the message
     */
    void sendEmail(String to, String subject, String htmlBody);

    boolean isConfigured();

    String name();
}
