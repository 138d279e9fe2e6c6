package com.example.threadcache.core;

import java.time.Duration;

/**
 * Options of a single cache call.
 *
 * <p>{@code expiresIn} and {@code skipNil} fall back to the cache defaults until set. Setting
 * {@code expiresIn(null)} is an explicit value: the entry never expires, whatever the default.
 * Instances are immutable; every setter returns a copy.
 */
public final class CacheOptions {

    private static final CacheOptions DEFAULTS = new CacheOptions(false, null, false, null, null);

    private final boolean force;
    private final Object version;
    private final boolean expiresInSet;
    private final Duration expiresIn;
    private final Boolean skipNil;

    private CacheOptions(boolean force, Object version, boolean expiresInSet, Duration expiresIn, Boolean skipNil) {
        this.force = force;
        this.version = version;
        this.expiresInSet = expiresInSet;
        this.expiresIn = expiresIn;
        this.skipNil = skipNil;
    }

    public static CacheOptions defaults() {
        return DEFAULTS;
    }

    public static CacheOptions withVersion(Object version) {
        return DEFAULTS.version(version);
    }

    public CacheOptions force(boolean force) {
        return new CacheOptions(force, version, expiresInSet, expiresIn, skipNil);
    }

    public CacheOptions version(Object version) {
        return new CacheOptions(force, version, expiresInSet, expiresIn, skipNil);
    }

    public CacheOptions expiresIn(Duration expiresIn) {
        return new CacheOptions(force, version, true, checkExpiresIn(expiresIn), skipNil);
    }

    public CacheOptions neverExpire() {
        return expiresIn(null);
    }

    public CacheOptions skipNil(boolean skipNil) {
        return new CacheOptions(force, version, expiresInSet, expiresIn, skipNil);
    }

    public boolean isForce() {
        return force;
    }

    public Object getVersion() {
        return version;
    }

    public Duration resolveExpiresIn(Duration fallback) {
        return expiresInSet ? expiresIn : fallback;
    }

    public boolean resolveSkipNil(boolean fallback) {
        return skipNil != null ? skipNil : fallback;
    }

    static Duration checkExpiresIn(Duration expiresIn) {
        if (expiresIn != null && expiresIn.isNegative()) {
            throw new IllegalArgumentException("expiresIn must not be negative: " + expiresIn);
        }
        return expiresIn;
    }

    @Override
    public String toString() {
        return "CacheOptions{force=" + force + ", version=" + version
            + ", expiresIn=" + (expiresInSet ? String.valueOf(expiresIn) : "<default>")
            + ", skipNil=" + (skipNil != null ? skipNil : "<default>") + '}';
    }
}
