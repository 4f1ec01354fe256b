package com.poufmaker.api.security;

import com.poufmaker.api.config.SecurityProperties;
import com.poufmaker.api.enums.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies the HS256 bearer tokens handed out at login.
 * <p>
 * Verification fails closed: anything that is not a well-formed, correctly signed,
 * unexpired token with a known role yields {@link Optional#empty()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialService {

    public static final String ROLE_CLAIM = "role";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final SecurityProperties securityProperties;

    public IssuedToken issue(UUID userId, UserRole role) {
        Instant now = Instant.now();
        Instant expiresAt = now.plus(securityProperties.tokenTtl());
        String tokenId = UUID.randomUUID().toString();

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .id(tokenId)
                .subject(userId.toString())
                .issuedAt(now)
                .expiresAt(expiresAt)
                .claim(ROLE_CLAIM, role.getValue())
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();

        String value = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        return new IssuedToken(value, tokenId, expiresAt);
    }

    public Optional<AuthenticatedUser> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Jwt jwt = jwtDecoder.decode(token);
            String subject = jwt.getSubject();
            if (subject == null) {
                return Optional.empty();
            }
            UserRole role = UserRole.fromValue(jwt.getClaimAsString(ROLE_CLAIM));
            return Optional.of(new AuthenticatedUser(UUID.fromString(subject), role));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
