package com.example.threadcache.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings of the application's {@link com.example.threadcache.core.ThreadCache}.
 *
 * <pre>{@code
 * thread-cache:
 *   namespace: thread_cache
 *   expires-in: 60s
 *   never-expire: false      # true = entries have no default expiry, expires-in is ignored
 *   skip-nil: false
 *   release-after-request: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "thread-cache")
public class ThreadCacheProperties {

    private final String namespace;
    private final Duration expiresIn;
    private final boolean neverExpire;
    private final boolean skipNil;
    private final boolean releaseAfterRequest;

    public ThreadCacheProperties(
        @DefaultValue("thread_cache") String namespace,
        @DefaultValue("60s") Duration expiresIn,
        @DefaultValue("false") boolean neverExpire,
        @DefaultValue("false") boolean skipNil,
        @DefaultValue("true") boolean releaseAfterRequest
    ) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("thread-cache.namespace must not be blank");
        }
        if (expiresIn != null && expiresIn.isNegative()) {
            throw new IllegalArgumentException("thread-cache.expires-in must not be negative, got: " + expiresIn);
        }
        this.namespace = namespace;
        this.expiresIn = expiresIn;
        this.neverExpire = neverExpire;
        this.skipNil = skipNil;
        this.releaseAfterRequest = releaseAfterRequest;
    }

    public String getNamespace() {
        return namespace;
    }

    public Duration getExpiresIn() {
        return expiresIn;
    }

    public boolean isNeverExpire() {
        return neverExpire;
    }

    /** Default expiry handed to the cache; {@code null} when entries never expire. */
    public Duration resolveExpiresIn() {
        return neverExpire ? null : expiresIn;
    }

    public boolean isSkipNil() {
        return skipNil;
    }

    public boolean isReleaseAfterRequest() {
        return releaseAfterRequest;
    }
}
