package com.example.threadcache.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

import com.example.threadcache.config.ThreadCacheProperties;
import com.example.threadcache.core.ThreadCache;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class ThreadCacheReleaseFilterTest {

    @Mock
    private FilterChain filterChain;

    private final ThreadCache cache = ThreadCache.builder().namespace("filter_test").build();

    @AfterEach
    void tearDown() {
        cache.release();
    }

    private ThreadCacheReleaseFilter filter(boolean releaseAfterRequest) {
        return new ThreadCacheReleaseFilter(cache,
            new ThreadCacheProperties("filter_test", Duration.ofSeconds(60), false, false, releaseAfterRequest));
    }

    private void writeDuringRequest() throws Exception {
        doAnswer(invocation -> {
            cache.write("request-key", "value");
            return null;
        }).when(filterChain).doFilter(any(ServletRequest.class), any(ServletResponse.class));
    }

    @Test
    @DisplayName("Releases the store once the request completes")
    void releasesAfterRequest() throws Exception {
        writeDuringRequest();

        filter(true).doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), filterChain);

        assertThat(cache.exists("request-key")).isFalse();
    }

    @Test
    @DisplayName("Releases the store when the request fails")
    void releasesAfterFailure() throws Exception {
        cache.write("request-key", "value");
        doThrow(new ServletException("boom"))
            .when(filterChain).doFilter(any(ServletRequest.class), any(ServletResponse.class));

        assertThatThrownBy(() -> filter(true)
            .doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), filterChain))
            .isInstanceOf(ServletException.class);

        assertThat(cache.exists("request-key")).isFalse();
    }

    @Test
    @DisplayName("Keeps the store when release is disabled")
    void keepsStoreWhenDisabled() throws Exception {
        writeDuringRequest();

        filter(false).doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), filterChain);

        assertThat(cache.read("request-key")).isEqualTo("value");
    }
}
