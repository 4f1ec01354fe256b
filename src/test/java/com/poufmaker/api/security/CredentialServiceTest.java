package com.poufmaker.api.security;

import com.poufmaker.api.config.JwtConfig;
import com.poufmaker.api.config.SecurityProperties;
import com.poufmaker.api.enums.UserRole;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";
    private static final String OTHER_SECRET = "another-secret-that-is-also-long-enough-for-hs256";

    private final JwtConfig jwtConfig = new JwtConfig();

    private CredentialService createService(String secret, Duration tokenTtl) {
        SecurityProperties properties = new SecurityProperties(secret, tokenTtl, Duration.ofHours(1));
        SecretKey key = jwtConfig.jwtSigningKey(properties);
        return new CredentialService(jwtConfig.jwtEncoder(key), jwtConfig.jwtDecoder(key), properties);
    }

    @Test
    void issued_token_verifies_to_the_same_principal() {
        CredentialService service = createService(SECRET, Duration.ofHours(24));
        UUID userId = UUID.randomUUID();

        IssuedToken token = service.issue(userId, UserRole.UPHOLSTERER);
        Optional<AuthenticatedUser> principal = service.verify(token.value());

        assertThat(principal).contains(new AuthenticatedUser(userId, UserRole.UPHOLSTERER));
        assertThat(token.tokenId()).isNotBlank();
        assertThat(token.expiresAt()).isAfter(Instant.now().plus(Duration.ofHours(23)));
    }

    @Test
    void tampered_payload_is_rejected() {
        CredentialService service = createService(SECRET, Duration.ofHours(24));
        String[] client = service.issue(UUID.randomUUID(), UserRole.CLIENT).value().split("\\.");
        String[] upholsterer = service.issue(UUID.randomUUID(), UserRole.UPHOLSTERER).value().split("\\.");

        // upholsterer claims under the client token's signature
        String forged = client[0] + "." + upholsterer[1] + "." + client[2];

        assertThat(service.verify(forged)).isEmpty();
    }

    @Test
    void expired_token_is_rejected() {
        SecurityProperties properties = new SecurityProperties(SECRET, Duration.ofHours(1), Duration.ofHours(1));
        SecretKey key = jwtConfig.jwtSigningKey(properties);
        JwtEncoder encoder = jwtConfig.jwtEncoder(key);
        CredentialService service = new CredentialService(encoder, jwtConfig.jwtDecoder(key), properties);

        // well past the decoder's default clock skew
        Instant now = Instant.now();
        String token = encode(encoder, JwtClaimsSet.builder()
                .subject(UUID.randomUUID().toString())
                .issuedAt(now.minus(Duration.ofMinutes(20)))
                .expiresAt(now.minus(Duration.ofMinutes(10)))
                .claim(CredentialService.ROLE_CLAIM, UserRole.CLIENT.getValue())
                .build());

        assertThat(service.verify(token)).isEmpty();
    }

    @Test
    void token_signed_with_another_secret_is_rejected() {
        CredentialService issuer = createService(OTHER_SECRET, Duration.ofHours(24));
        CredentialService verifier = createService(SECRET, Duration.ofHours(24));
        IssuedToken token = issuer.issue(UUID.randomUUID(), UserRole.ADMIN);

        assertThat(verifier.verify(token.value())).isEmpty();
    }

    @Test
    void unknown_role_is_rejected() {
        SecurityProperties properties = new SecurityProperties(SECRET, Duration.ofHours(1), Duration.ofHours(1));
        SecretKey key = jwtConfig.jwtSigningKey(properties);
        JwtEncoder encoder = jwtConfig.jwtEncoder(key);
        CredentialService service = new CredentialService(encoder, jwtConfig.jwtDecoder(key), properties);

        Instant now = Instant.now();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject(UUID.randomUUID().toString())
                .issuedAt(now)
                .expiresAt(now.plus(Duration.ofHours(1)))
                .claim(CredentialService.ROLE_CLAIM, "superuser")
                .build();
        String token = encode(encoder, claims);

        assertThat(service.verify(token)).isEmpty();
    }

    @Test
    void garbage_and_missing_tokens_are_rejected() {
        CredentialService service = createService(SECRET, Duration.ofHours(24));

        assertThat(service.verify("not-a-token")).isEmpty();
        assertThat(service.verify("a.b.c")).isEmpty();
        assertThat(service.verify("")).isEmpty();
        assertThat(service.verify(null)).isEmpty();
    }

    private static String encode(JwtEncoder encoder, JwtClaimsSet claims) {
        return encoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
                .getTokenValue();
    }
}
