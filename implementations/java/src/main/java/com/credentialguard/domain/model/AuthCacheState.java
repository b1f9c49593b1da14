package com.credentialguard.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Snapshot of the advisory authentication cache.
 *
 * <p>Records when the last successful ceremony completed. Informational only:
 * it never allows a read to skip the store's own authentication.
 */
@Value
public class AuthCacheState {

    private static final AuthCacheState EMPTY = new AuthCacheState(null);

    Instant createdAt;

    public static AuthCacheState empty() {
        return EMPTY;
    }

    public static AuthCacheState createdAt(Instant createdAt) {
        return new AuthCacheState(createdAt);
    }

    public Optional<Instant> getCreatedAt() {
        return Optional.ofNullable(createdAt);
    }

    /**
     * Valid while {@code now - createdAt < interval}.
     */
    public boolean isValidAt(Instant now, Duration interval) {
        if (createdAt == null) {
            return false;
        }
        return Duration.between(createdAt, now).compareTo(interval) < 0;
    }
}
