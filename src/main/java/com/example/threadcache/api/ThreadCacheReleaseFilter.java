package com.example.threadcache.api;

import com.example.threadcache.config.ThreadCacheProperties;
import com.example.threadcache.core.ThreadCache;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Scopes the thread cache to one request: servlet containers pool their worker threads, so the
 * store of the worker is released once the request completes, successfully or not.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ThreadCacheReleaseFilter extends OncePerRequestFilter {

    private final ThreadCache threadCache;
    private final boolean releaseAfterRequest;

    public ThreadCacheReleaseFilter(ThreadCache threadCache, ThreadCacheProperties properties) {
        this.threadCache = threadCache;
        this.releaseAfterRequest = properties.isReleaseAfterRequest();
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (releaseAfterRequest) {
                threadCache.release();
            }
        }
    }
}
