package com.example.threadcache.core;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Options of a batch call. Each option is a {@link KeyedOption}; an option left unset resolves to
 * the cache default for every key.
 */
public final class MultiCacheOptions {

    private static final MultiCacheOptions DEFAULTS = new MultiCacheOptions(null, null, null, null);

    private final KeyedOption<Boolean> force;
    private final KeyedOption<Object> version;
    private final KeyedOption<Duration> expiresIn;
    private final KeyedOption<Boolean> skipNil;

    private MultiCacheOptions(
        KeyedOption<Boolean> force,
        KeyedOption<Object> version,
        KeyedOption<Duration> expiresIn,
        KeyedOption<Boolean> skipNil
    ) {
        this.force = force;
        this.version = version;
        this.expiresIn = expiresIn;
        this.skipNil = skipNil;
    }

    public static MultiCacheOptions defaults() {
        return DEFAULTS;
    }

    public MultiCacheOptions force(KeyedOption<Boolean> force) {
        return new MultiCacheOptions(force, version, expiresIn, skipNil);
    }

    public MultiCacheOptions version(KeyedOption<Object> version) {
        return new MultiCacheOptions(force, version, expiresIn, skipNil);
    }

    public MultiCacheOptions expiresIn(KeyedOption<Duration> expiresIn) {
        return new MultiCacheOptions(force, version, expiresIn, skipNil);
    }

    public MultiCacheOptions skipNil(KeyedOption<Boolean> skipNil) {
        return new MultiCacheOptions(force, version, expiresIn, skipNil);
    }

    /** Resolves the options of every key of a call against the cache defaults. */
    Function<String, CacheOptions> bind(List<String> keys, Duration defaultExpiresIn, boolean defaultSkipNil) {
        Function<String, Boolean> forceOf = bind(force, keys, Boolean.FALSE);
        Function<String, Object> versionOf = bind(version, keys, null);
        Function<String, Duration> expiresInOf = bind(expiresIn, keys, defaultExpiresIn);
        Function<String, Boolean> skipNilOf = bind(skipNil, keys, defaultSkipNil);

        return key -> CacheOptions.defaults()
            .force(Boolean.TRUE.equals(forceOf.apply(key)))
            .version(versionOf.apply(key))
            .expiresIn(expiresInOf.apply(key))
            .skipNil(Boolean.TRUE.equals(skipNilOf.apply(key)));
    }

    private static <T> Function<String, T> bind(KeyedOption<T> option, List<String> keys, T fallback) {
        if (option == null) {
            return key -> fallback;
        }
        return option.bind(keys, fallback);
    }
}
