package dev.blogplatform.service;

import dev.blogplatform.config.ResilienceConfig;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailServiceTest {

    private static final String APP_URL = "https://blog.example.com";

    @Mock
    private JavaMailSender mailSender;

    private EmailTemplateService templateService;
    private ResourceBundleMessageSource messageSource;
    private ResilienceConfig resilience;

    @BeforeEach
    void setUp() {
        templateService = spy(new EmailTemplateService());
        messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        messageSource.setFallbackToSystemLocale(false);
        resilience = new ResilienceConfig(10, 2, 5);
    }

    private EmailService emailService(boolean enabled) {
        return new EmailService(mailSender, resilience, messageSource, templateService, enabled,
                "noreply@blog.example.com", "Blog", APP_URL, "Blog Platform API", "en");
    }

    private static MimeMessage blankMessage() {
        return new MimeMessage(Session.getInstance(new Properties()));
    }

    @Test
    @DisplayName("Reset email should link to the reset page with the token")
    @SuppressWarnings("unchecked")
    void resetEmailCarriesLink() throws Exception {
        when(mailSender.createMimeMessage()).thenReturn(blankMessage());

        StepVerifier.create(emailService(true).sendPasswordResetEmail("bob@example.com", "bob", "tok.en.value"))
                .verifyComplete();

        ArgumentCaptor<Map<String, Object>> vars = ArgumentCaptor.forClass(Map.class);
        verify(templateService).render(eq("password-reset"), vars.capture());
        assertThat(vars.getValue())
                .containsEntry("resetLink", APP_URL + "/reset-password?token=tok.en.value")
                .containsEntry("greeting", "Hello bob,");

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(sent.capture());
        assertThat(sent.getValue().getSubject()).isEqualTo("Reset your password");
        assertThat(sent.getValue().getRecipients(Message.RecipientType.TO)[0].toString()).isEqualTo("bob@example.com");
    }

    @Test
    @DisplayName("Welcome email subject should name the application")
    void welcomeEmailSubject() throws Exception {
        when(mailSender.createMimeMessage()).thenReturn(blankMessage());

        StepVerifier.create(emailService(true).sendWelcomeEmail("alice@example.com", "alice"))
                .verifyComplete();

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(sent.capture());
        assertThat(sent.getValue().getSubject()).isEqualTo("Welcome to Blog Platform API");
    }

    @Test
    @DisplayName("Delivery failure should surface as an error for the caller to swallow")
    void deliveryFailureSurfaces() {
        when(mailSender.createMimeMessage()).thenReturn(blankMessage());
        doThrow(new MailSendException("SMTP down")).when(mailSender).send(any(MimeMessage.class));

        StepVerifier.create(emailService(true).sendPasswordChangedNotification("bob@example.com", "bob"))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    @DisplayName("Disabled email should not touch the mail sender")
    void disabledEmailIsNoop() {
        StepVerifier.create(emailService(false).sendWelcomeEmail("alice@example.com", "alice"))
                .verifyComplete();

        verifyNoInteractions(mailSender);
        verify(templateService).render(eq("welcome"), anyMap());
    }
}
