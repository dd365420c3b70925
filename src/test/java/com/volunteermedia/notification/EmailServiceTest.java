package com.volunteermedia.notification;

import com.volunteermedia.service.SiteSettingService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailServiceTest {

    @Mock
    private EmailProvider provider;
    @Mock
    private SiteSettingService siteSettingService;

    private EmailService emailService(boolean enabled) {
        return new EmailService(provider, siteSettingService, enabled, "https://volunteers.example.org");
    }

    @Test
    void disabledEmailSendsNothing() {
        EmailService emailService = emailService(false);

        assertThat(emailService.isConfigured()).isFalse();
        assertThatThrownBy(() -> emailService.sendEmail("casey@example.org", "Hello", "<p>Hi</p>"))
                .isInstanceOf(EmailDeliveryException.class)
                .hasMessage("email service is disabled");
        verifyNoInteractions(provider);
    }

    @Test
    void invalidAddressIsRejectedBeforeTheProvider() {
        when(provider.isConfigured()).thenReturn(true);

        assertThatThrownBy(() -> emailService(true).sendEmail("not-an-address", "Hello", "<p>Hi</p>"))
                .isInstanceOf(EmailDeliveryException.class)
                .hasMessage("invalid email address");
    }

    @Test
    void unconfiguredProviderIsReported() {
        when(provider.isConfigured()).thenReturn(false);

        assertThatThrownBy(() -> emailService(true).sendEmail("casey@example.org", "Hello", "<p>Hi</p>"))
                .hasMessage("email service is not configured");
    }

    @Test
    void announcementUsesSiteNameFromSettings() {
        when(provider.isConfigured()).thenReturn(true);
        when(siteSettingService.getAll()).thenReturn(Map.of(SiteSettingService.SITE_NAME, "Paws Portal"));

        emailService(true).sendAnnouncementEmail("casey@example.org", "Adoption day", "Saturday at noon");

        ArgumentCaptor<String> subject = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(provider).sendEmail(eq("casey@example.org"), subject.capture(), body.capture());
        assertThat(subject.getValue()).contains("Paws Portal").contains("Adoption day");
        assertThat(body.getValue()).contains("Saturday at noon");
    }

    @Test
    void blankSiteNameFallsBackToDefault() {
        when(provider.isConfigured()).thenReturn(true);
        when(siteSettingService.getAll()).thenReturn(Map.of(SiteSettingService.SITE_NAME, ""));

        emailService(true).sendPasswordResetEmail("casey@example.org", "casey", "tok123");

        ArgumentCaptor<String> subject = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(provider).sendEmail(eq("casey@example.org"), subject.capture(), body.capture());
        assertThat(subject.getValue()).contains(SiteSettingService.DEFAULT_SITE_NAME);
        assertThat(body.getValue()).contains("https://volunteers.example.org/reset-password");
    }

    @Test
    void validatesAddresses() {
        assertThat(EmailService.isValidEmail("casey.o+walks@shelter.example.org")).isTrue();
        assertThat(EmailService.isValidEmail("casey@localhost")).isFalse();
        assertThat(EmailService.isValidEmail(null)).isFalse();
    }
}
