package com.volunteermedia.notification;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * SMTP delivery through Spring's {@link JavaMailSender} (configured by {@code spring.mail.*}).
 */
@Slf4j
public class SmtpEmailProvider implements EmailProvider {

    private final JavaMailSender mailSender;
    private final String fromAddress;
    private final String fromName;

    public SmtpEmailProvider(JavaMailSender mailSender, String fromAddress, String fromName) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
        this.fromName = fromName;
    }

    @Override
    public void sendEmail(String to, String subject, String htmlBody) {
        if (!isConfigured()) {
            throw new EmailDeliveryException("SMTP provider is not configured");
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            if (fromName != null && !fromName.isBlank()) {
                helper.setFrom(fromAddress, fromName);
            } else {
                helper.setFrom(fromAddress);
            }
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(htmlBody, true);
            mailSender.send(message);
            log.debug("Sent email via SMTP to {}", to);
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            throw new EmailDeliveryException("failed to send email via SMTP: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConfigured() {
        return mailSender != null && fromAddress != null && !fromAddress.isBlank();
    }

    @Override
    public String name() {
        return "smtp";
    }
}
