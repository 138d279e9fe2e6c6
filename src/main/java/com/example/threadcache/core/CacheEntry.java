package com.example.threadcache.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public class CacheEntry {
    public final Object value;
    public final Object version;      // opaque tag, compared with equals()
    public final Duration expiresIn;  // null means the entry never expires
    public final Instant createdAt;

    public CacheEntry(Object value, Object version, Duration expiresIn, Instant createdAt) {
        this.value = value;
        this.version = version;
        this.expiresIn = expiresIn;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean isExpired(Instant now) {
        // createdAt + expiresIn <= now, without computing the sum
        return expiresIn != null && Duration.between(createdAt, now).compareTo(expiresIn) >= 0;
    }

    public boolean isMismatched(Object requestedVersion) {
        return version != null && requestedVersion != null && !version.equals(requestedVersion);
    }

    public boolean isValid(Instant now, Object requestedVersion) {
        return !isExpired(now) && !isMismatched(requestedVersion);
    }

    @Override
    public String toString() {
        return "CacheEntry{value=" + value + ", version=" + version
            + ", expiresIn=" + expiresIn + ", createdAt=" + createdAt + '}';
    }
}
