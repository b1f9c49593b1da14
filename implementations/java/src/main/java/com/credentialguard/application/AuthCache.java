package com.credentialguard.application;

import com.credentialguard.domain.model.AuthCacheState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Advisory record of the last successful authentication ceremony.
 *
 * <p>Backed by a single-slot Caffeine cache whose ticker follows the injected
 * {@link Clock}, so expiry is lazy: an entry older than the interval is dropped
 * the next time it is queried. Thread-safe; process-local and never persisted,
 * so a restart always starts empty.
 *
 * <p>Nothing in this class allows skipping the store's own authentication.
 */
public class AuthCache {

    public static final Duration CACHE_INTERVAL = Duration.ofSeconds(3600);

    private static final String SLOT = "last-ceremony";

    private final Clock clock;
    private final Duration interval;
    private final Cache<String, Instant> entries;

    public AuthCache(Clock clock) {
        this(clock, CACHE_INTERVAL);
    }

    AuthCache(Clock clock, Duration interval) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.interval = Objects.requireNonNull(interval, "Interval must not be null");
        this.entries = Caffeine.newBuilder()
            .expireAfterWrite(interval)
            .ticker(() -> toNanos(clock.instant()))
            .executor(Runnable::run)  // run maintenance inline so expiry follows the clock
            .build();
    }

    public void recordSuccess() {
        entries.put(SLOT, clock.instant());
    }

    public AuthCacheState state() {
        Instant createdAt = entries.getIfPresent(SLOT);
        return createdAt == null ? AuthCacheState.empty() : AuthCacheState.createdAt(createdAt);
    }

    public boolean isValid() {
        return state().isValidAt(clock.instant(), interval);
    }

    public void clear() {
        entries.invalidateAll();
    }

    public Duration getInterval() {
        return interval;
    }

    private static long toNanos(Instant instant) {
        return Math.addExact(TimeUnit.SECONDS.toNanos(instant.getEpochSecond()), instant.getNano());
    }
}
