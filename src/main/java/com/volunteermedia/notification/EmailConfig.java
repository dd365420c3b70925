package com.volunteermedia.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.web.client.RestTemplate;

/**
 * Chooses the email transport from {@code app.email.provider} (smtp | resend).
 * Any other value fails startup.
 */
@Configuration
@Slf4j
public class EmailConfig {

    @Bean
    public EmailProvider emailProvider(@Value("${app.email.provider:smtp}") String provider,
                                       @Value("${app.email.from-address:}") String fromAddress,
                                       @Value("${app.email.from-name:}") String fromName,
                                       @Value("${app.email.resend.api-key:}") String resendApiKey,
                                       @Value("${app.email.resend.api-url:" + ResendEmailProvider.DEFAULT_API_URL + "}") String resendApiUrl,
                                       ObjectProvider<JavaMailSender> mailSender,
                                       RestTemplate restTemplate) {
        EmailProvider emailProvider = switch (provider.trim().toLowerCase()) {
            case "smtp", "" -> new SmtpEmailProvider(mailSender.getIfAvailable(), fromAddress, fromName);
            case "resend" -> new ResendEmailProvider(restTemplate, resendApiUrl, resendApiKey, fromAddress, fromName);
            default -> throw new IllegalStateException("unsupported email provider: " + provider);
        };

        if (emailProvider.isConfigured()) {
            log.info("Email provider: {}", emailProvider.name());
        } else {
            log.warn("Email provider {} is not fully configured; emails will not be sent", emailProvider.name());
        }
        return emailProvider;
    }
}
