package com.example.threadcache.config;

import com.example.threadcache.core.ThreadCache;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ThreadCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(ThreadCacheConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Singleton: the cache keeps no state of its own, every call resolves the caller's store.
    @Bean
    public ThreadCache threadCache(ThreadCacheProperties properties, Clock clock) {
        log.info("Thread cache namespace={}, expiresIn={}, skipNil={}",
            properties.getNamespace(), properties.resolveExpiresIn(), properties.isSkipNil());
        return ThreadCache.builder()
            .namespace(properties.getNamespace())
            .expiresIn(properties.resolveExpiresIn())
            .skipNil(properties.isSkipNil())
            .clock(clock)
            .build();
    }
}
