package com.example.threadcache.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "item-backend")
public class ItemBackendProperties {

    private final Duration latency;

    public ItemBackendProperties(@DefaultValue("500ms") Duration latency) {
        if (latency.isNegative()) {
            throw new IllegalArgumentException("item-backend.latency must not be negative, got: " + latency);
        }
        this.latency = latency;
    }

    public Duration getLatency() {
        return latency;
    }
}
