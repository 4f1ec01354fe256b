package com.poufmaker.api.security;

import java.time.Instant;

public record IssuedToken(String value, String tokenId, Instant expiresAt) {
}
