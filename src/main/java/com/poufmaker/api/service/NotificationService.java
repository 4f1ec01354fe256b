package com.poufmaker.api.service;

import com.poufmaker.api.config.NotificationProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Outbound email. Sending is best effort: failures are logged and reported as {@code false},
 * never thrown, so they cannot fail or roll back the operation that triggered them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    static final String CONFIRMATION_SUBJECT = "Confirm Your Email - Poufmaker";
    static final String RESET_SUBJECT = "Password Reset Request";

    private final JavaMailSender mailSender;
    private final NotificationProperties properties;

    public boolean sendConfirmationEmail(String to, String confirmationToken) {
        String link = properties.appUrl() + "/api/auth/verify-email?token=" + confirmationToken;
        String html = """
                <div style="font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;">
                  <h2>Welcome to Poufmaker!</h2>
                  <p>Thank you for registering. Please confirm your email address by clicking the link below:</p>
                  <p><a href="%1$s">Confirm Email</a></p>
                  <p>Or copy and paste this link in your browser:</p>
                  <p>%1$s</p>
                  <p>If you didn't create an account, please ignore this email.</p>
                </div>
                """.formatted(link);
        return send(to, CONFIRMATION_SUBJECT, html);
    }

    public boolean sendPasswordResetEmail(String to, String resetToken, Duration validity) {
        String link = properties.appUrl() + "/reset-password?token=" + resetToken;
        String html = """
                <h2>Password Reset Request</h2>
                <p>You have requested to reset your password. Click the link below to proceed:</p>
                <p><a href="%s">Reset Password</a></p>
                <p>This link will expire in %s minutes.</p>
                <p>If you didn't request this, please ignore this email.</p>
                """.formatted(link, validity.toMinutes());
        return send(to, RESET_SUBJECT, html);
    }

    private boolean send(String to, String subject, String html) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.from());
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(html, true);
            mailSender.send(message);
            log.info("Email '{}' sent to {}", subject, to);
            return true;
        } catch (MailException | MessagingException e) {
            log.warn("Failed to send email '{}' to {}: {}", subject, to, e.getMessage());
            return false;
        }
    }
}
