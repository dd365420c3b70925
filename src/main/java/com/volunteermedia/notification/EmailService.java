package com.volunteermedia.notification;

import com.volunteermedia.service.SiteSettingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Builds and sends the application's emails (password reset, account setup, announcements)
 * through the active {@link EmailProvider}.
 *
 * The site name shown in subjects and footers comes from the cached site settings, so a
 * rename by an admin applies to the next email without a restart.
 */
@Service
@Slf4j
public class EmailService {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

    private final EmailProvider provider;
    private final SiteSettingService siteSettingService;
    private final boolean enabled;
    private final String frontendUrl;

    public EmailService(EmailProvider provider,
                        SiteSettingService siteSettingService,
                        @Value("${app.email.enabled:true}") boolean enabled,
                        @Value("${app.frontend-url:http://localhost:5173}") String frontendUrl) {
        this.provider = provider;
        this.siteSettingService = siteSettingService;
        this.enabled = enabled;
        this.frontendUrl = frontendUrl;
    }

    public boolean isConfigured() {
        return enabled && provider.isConfigured();
    }

    public static boolean isValidEmail(String address) {
        return address != null && EMAIL_PATTERN.matcher(address).matches();
    }

    /**
     * @throws EmailDeliveryException when email is disabled or unconfigured, the address is invalid,
     *                                or the provider fails
     */
    public void sendEmail(String to, String subject, String htmlBody) {
        if (!enabled) {
            log.warn("Email disabled (app.email.enabled=false); not sending \"{}\"", subject);
            throw new EmailDeliveryException("email service is disabled");
        }
        if (!provider.isConfigured()) {
            throw new EmailDeliveryException("email service is not configured");
        }
        if (!isValidEmail(to)) {
            throw new EmailDeliveryException("invalid email address");
        }
        provider.sendEmail(to, subject, htmlBody);
    }

    public void sendPasswordResetEmail(String to, String username, String resetToken) {
        String siteName = siteName();
        String link = EmailTemplates.link(frontendUrl, "/reset-password", resetToken);
        sendEmail(to, EmailTemplates.passwordResetSubject(siteName),
                EmailTemplates.passwordResetBody(siteName, username, link));
    }

    public void sendPasswordSetupEmail(String to, String username, String setupToken) {
        String siteName = siteName();
        String link = EmailTemplates.link(frontendUrl, "/setup-password", setupToken);
        sendEmail(to, EmailTemplates.passwordSetupSubject(siteName),
                EmailTemplates.passwordSetupBody(siteName, username, link));
    }

    public void sendAnnouncementEmail(String to, String title, String content) {
        String siteName = siteName();
        sendEmail(to, EmailTemplates.announcementSubject(siteName, title),
                EmailTemplates.announcementBody(siteName, title, content));
    }

    private String siteName() {
        try {
            String name = siteSettingService.getAll().get(SiteSettingService.SITE_NAME);
            return name == null || name.isBlank() ? SiteSettingService.DEFAULT_SITE_NAME : name;
        } catch (RuntimeException e) {
            log.warn("Could not load site name for email, using default: {}", e.getMessage());
            return SiteSettingService.DEFAULT_SITE_NAME;
        }
    }
}
