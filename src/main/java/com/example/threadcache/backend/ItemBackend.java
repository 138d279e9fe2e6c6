package com.example.threadcache.backend;

import com.example.threadcache.config.ItemBackendProperties;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Simulated slow source of items, counting how often it is hit. */
@Component
public class ItemBackend {

    private final AtomicLong requestCount = new AtomicLong();
    private final long latencyMillis;

    @Autowired
    public ItemBackend(ItemBackendProperties properties) {
        this(properties.getLatency());
    }

    public ItemBackend(Duration latency) {
        this.latencyMillis = latency.toMillis();
    }

    public String load(String key) {
        requestCount.incrementAndGet();
        if (latencyMillis > 0) {
            try {
                Thread.sleep(latencyMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while loading " + key, e);
            }
        }
        return "value-for-" + key;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }
}
