package com.poufmaker.api.service;

import com.poufmaker.api.dto.ClientInfo;
import com.poufmaker.api.entity.LoginHistory;
import com.poufmaker.api.entity.UserSession;
import com.poufmaker.api.repository.LoginHistoryRepository;
import com.poufmaker.api.repository.UserRepository;
import com.poufmaker.api.repository.UserSessionRepository;
import com.poufmaker.api.security.IssuedToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Session and login-history records. Each call commits on its own so that a failed
 * audit write never takes the calling operation down with it.
 */
@Service
@RequiredArgsConstructor
public class LoginAuditService {

    private final UserRepository userRepository;
    private final UserSessionRepository userSessionRepository;
    private final LoginHistoryRepository loginHistoryRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordLogin(UUID userId, IssuedToken token, ClientInfo client) {
        userSessionRepository.save(UserSession.builder()
                .userId(userId)
                .tokenId(token.tokenId())
                .expiresAt(token.expiresAt())
                .ipAddress(client.ipAddress())
                .userAgent(client.userAgent())
                .build());

        userRepository.findById(userId).ifPresent(user -> user.setLastLoginDate(Instant.now()));

        loginHistoryRepository.save(entry(userId, client, true, null));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordEvent(UUID userId, ClientInfo client, boolean successful, String reason) {
        loginHistoryRepository.save(entry(userId, client, successful, reason));
    }

    private LoginHistory entry(UUID userId, ClientInfo client, boolean successful, String reason) {
        return LoginHistory.builder()
                .userId(userId)
                .ipAddress(client.ipAddress())
                .userAgent(client.userAgent())
                .successful(successful)
                .failureReason(reason)
                .build();
    }
}
