package dev.blogplatform.service;

import dev.blogplatform.config.ResilienceConfig;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.MessageSource;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Year;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Account emails (welcome, password reset, password changed) rendered through
 * {@link EmailTemplateService} and sent with {@link JavaMailSender}.
 * Subjects and body copy come from {@code messages.properties}.
 * <p>
 * Callers treat every send as best-effort and swallow failures themselves.
 * </p>
 */
@Service
@Slf4j
public class EmailService {

    private final JavaMailSender mailSender;
    private final ResilienceConfig resilience;
    private final MessageSource messageSource;
    private final EmailTemplateService templateService;
    private final boolean enabled;
    private final String fromEmail;
    private final String fromName;
    private final String appUrl;
    private final String appName;
    private final Locale locale;

    public EmailService(
            JavaMailSender mailSender,
            ResilienceConfig resilience,
            MessageSource messageSource,
            EmailTemplateService templateService,
            @Value("${app.email.enabled:true}") boolean enabled,
            @Value("${app.email.from:noreply@localhost}") String fromEmail,
            @Value("${app.email.from-name:Blog Platform}") String fromName,
            @Value("${app.url:http://localhost:8080}") String appUrl,
            @Value("${app.name:Blog Platform API}") String appName,
            @Value("${app.email.default-locale:en}") String defaultLocaleTag) {
        this.mailSender = mailSender;
        this.resilience = resilience;
        this.messageSource = messageSource;
        this.templateService = templateService;
        this.enabled = enabled;
        this.fromEmail = fromEmail;
        this.fromName = fromName;
        this.appUrl = appUrl;
        this.appName = appName;
        this.locale = Locale.forLanguageTag(defaultLocaleTag);
        if (!enabled) {
            log.info("Outbound email disabled (app.email.enabled=false)");
        }
    }

    private String msg(String key, Object... args) {
        return messageSource.getMessage(key, args, key, locale);
    }

    public Mono<Void> sendWelcomeEmail(String to, String username) {
        Map<String, Object> vars = baseVars(msg("email.welcome.header"));
        vars.put("greeting", msg("email.greeting", username));
        vars.put("body", msg("email.welcome.body", appName));
        vars.put("ctaUrl", appUrl);
        vars.put("ctaLabel", msg("email.welcome.cta"));
        String html = templateService.render("welcome", vars);
        return sendHtmlEmail(to, msg("email.welcome.subject", appName), html);
    }

    /**
     * The token goes into the reset link only; it is never logged.
     */
    public Mono<Void> sendPasswordResetEmail(String to, String username, String resetToken) {
        String resetLink = appUrl + "/reset-password?token=" + resetToken;
        Map<String, Object> vars = baseVars(msg("email.reset.header"));
        vars.put("greeting", msg("email.greeting", username));
        vars.put("body", msg("email.reset.body"));
        vars.put("resetLink", resetLink);
        vars.put("ctaLabel", msg("email.reset.cta"));
        vars.put("expiryNote", msg("email.reset.expiry"));
        vars.put("ignoreNote", msg("email.reset.ignore"));
        String html = templateService.render("password-reset", vars);
        return sendHtmlEmail(to, msg("email.reset.subject"), html);
    }

    public Mono<Void> sendPasswordChangedNotification(String to, String username) {
        Map<String, Object> vars = baseVars(msg("email.password_changed.header"));
        vars.put("greeting", msg("email.greeting", username));
        vars.put("body", msg("email.password_changed.body"));
        vars.put("warning", msg("email.password_changed.warning"));
        String html = templateService.render("password-changed", vars);
        return sendHtmlEmail(to, msg("email.password_changed.subject"), html);
    }

    private Map<String, Object> baseVars(String headerTitle) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("headerTitle", headerTitle);
        vars.put("appName", appName);
        vars.put("footerCopyright", msg("email.footer.copyright", String.valueOf(Year.now().getValue()), appName));
        return vars;
    }

    private Mono<Void> sendHtmlEmail(String to, String subject, String htmlContent) {
        if (!enabled) {
            log.debug("Email disabled, skipping '{}' to {}", subject, to);
            return Mono.empty();
        }
        return Mono.<Void>fromRunnable(() -> {
                    try {
                        MimeMessage message = mailSender.createMimeMessage();
                        MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
                        helper.setFrom(fromEmail, fromName);
                        helper.setTo(to);
                        helper.setSubject(subject);
                        helper.setText(htmlContent, true);
                        mailSender.send(message);
                        log.debug("HTML email sent to: {}", to);
                    } catch (Exception e) {
                        throw new IllegalStateException("Failed to send email to " + to, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(resilience.getMailTimeout());
    }
}
