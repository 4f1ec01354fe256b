package com.poufmaker.api.service;

import com.poufmaker.api.config.SecurityProperties;
import com.poufmaker.api.dto.ClientInfo;
import com.poufmaker.api.dto.LoginRequest;
import com.poufmaker.api.dto.LoginResponse;
import com.poufmaker.api.dto.RegisterRequest;
import com.poufmaker.api.dto.ResetPasswordRequest;
import com.poufmaker.api.dto.UserDTO;
import com.poufmaker.api.entity.User;
import com.poufmaker.api.enums.UserRole;
import com.poufmaker.api.exception.InvalidRequestException;
import com.poufmaker.api.exception.ResourceNotFoundException;
import com.poufmaker.api.exception.UnauthorizedAccessException;
import com.poufmaker.api.repository.UserRepository;
import com.poufmaker.api.security.CredentialService;
import com.poufmaker.api.security.IssuedToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    public static final String INVALID_CREDENTIALS = "Invalid credentials";
    public static final String EMAIL_NOT_CONFIRMED = "Email not confirmed";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final CredentialService credentialService;
    private final LoginAuditService loginAuditService;
    private final NotificationService notificationService;
    private final SecurityProperties securityProperties;

    public UUID register(RegisterRequest request, ClientInfo client) {
        String email = normalizeEmail(request.getEmail());
        UserRole role = request.getRole() != null ? request.getRole() : UserRole.CLIENT;
        if (!role.canSelfRegister()) {
            throw new InvalidRequestException("Role '" + role.getValue() + "' cannot be self-registered");
        }
        if (userRepository.existsByEmail(email)) {
            throw new InvalidRequestException("Email already registered");
        }

        String confirmationToken = UUID.randomUUID().toString();
        User user = User.builder()
                .email(email)
                .fullName(request.getFullName().trim())
                .phoneNumber(request.getPhoneNumber())
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .role(role)
                .emailConfirmed(false)
                .confirmationToken(confirmationToken)
                .build();
        User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent registration of the same email
            throw new InvalidRequestException("Email already registered");
        }
        UUID userId = saved.getId();
        log.info("Registered user {} with role {}", userId, role.getValue());

        audit("registration", userId,
                () -> loginAuditService.recordEvent(userId, client, true, "Registration successful"));

        if (!notificationService.sendConfirmationEmail(email, confirmationToken)) {
            log.warn("User {} registered without a confirmation email", userId);
        }
        return userId;
    }

    public LoginResponse login(LoginRequest request, ClientInfo client) {
        String email = normalizeEmail(request.getEmail());
        User user = userRepository.findByEmail(email).orElseThrow(() -> {
            log.warn("Login attempt for unknown email {}", email);
            return new UnauthorizedAccessException(INVALID_CREDENTIALS);
        });

        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            log.warn("Invalid password for user {}", user.getId());
            audit("failed login", user.getId(),
                    () -> loginAuditService.recordEvent(user.getId(), client, false, "Invalid password"));
            throw new UnauthorizedAccessException(INVALID_CREDENTIALS);
        }
        if (!user.isEmailConfirmed()) {
            audit("failed login", user.getId(),
                    () -> loginAuditService.recordEvent(user.getId(), client, false, EMAIL_NOT_CONFIRMED));
            throw new UnauthorizedAccessException(EMAIL_NOT_CONFIRMED);
        }

        IssuedToken token = credentialService.issue(user.getId(), user.getRole());
        audit("login", user.getId(), () -> loginAuditService.recordLogin(user.getId(), token, client));
        log.info("User {} logged in", user.getId());
        return new LoginResponse(token.value(), UserDTO.fromEntity(user));
    }

    @Transactional
    public void verifyEmail(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidRequestException("Confirmation token is required");
        }
        User user = userRepository.findByConfirmationTokenAndEmailConfirmedFalse(token)
                .orElseThrow(() -> new InvalidRequestException("Invalid or expired confirmation token"));
        user.setEmailConfirmed(true);
        user.setConfirmationToken(null);
        log.info("Email confirmed for user {}", user.getId());
    }

    @Transactional
    public void requestPasswordReset(String rawEmail) {
        String email = normalizeEmail(rawEmail);
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));

        String resetToken = UUID.randomUUID().toString();
        user.setResetPasswordToken(resetToken);
        user.setResetPasswordExpiry(Instant.now().plus(securityProperties.resetTokenTtl()));

        if (!notificationService.sendPasswordResetEmail(email, resetToken, securityProperties.resetTokenTtl())) {
            log.warn("Password reset token issued for user {} but the email was not sent", user.getId());
        }
    }

    @Transactional
    public void resetPassword(ResetPasswordRequest request, ClientInfo client) {
        User user = userRepository.findByResetPasswordTokenAndResetPasswordExpiryAfter(request.getToken(), Instant.now())
                .orElseThrow(() -> new InvalidRequestException("Invalid or expired reset token"));

        user.setPasswordHash(passwordEncoder.encode(request.getNewPassword()));
        user.setResetPasswordToken(null);
        user.setResetPasswordExpiry(null);
        log.info("Password reset for user {}", user.getId());

        audit("password reset", user.getId(),
                () -> loginAuditService.recordEvent(user.getId(), client, true, "Password reset successful"));
    }

    private void audit(String action, UUID userId, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.error("Failed to record {} for user {}", action, userId, e);
        }
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
