package com.openrangelabs.donpetre.mlssync.provider;

import java.time.LocalDateTime;

/**
 * Session or bearer token issued by a provider.
 */
public record AccessToken(String value, LocalDateTime expiresAt) {

    public boolean isValidAt(LocalDateTime instant) {
        return value != null && !value.isBlank() && expiresAt.isAfter(instant);
    }

    @Override
    public String toString() {
        return "AccessToken{expiresAt=" + expiresAt + '}';
    }
}
