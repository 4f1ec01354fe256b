package com.poufmaker.api.security;

import com.poufmaker.api.enums.UserRole;
import com.poufmaker.api.exception.UnauthorizedAccessException;

import java.util.UUID;

/**
 * The principal carried by a verified bearer token.
 */
public record AuthenticatedUser(UUID userId, UserRole role) {

    public static AuthenticatedUser require(AuthenticatedUser principal) {
        if (principal == null) {
            throw new UnauthorizedAccessException("Authorization token required");
        }
        return principal;
    }
}
