package com.example.threadcache.api;

import com.example.threadcache.backend.ItemBackend;
import com.example.threadcache.core.CacheOptions;
import com.example.threadcache.core.KeyedOption;
import com.example.threadcache.core.MultiCacheOptions;
import com.example.threadcache.core.ThreadCache;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ItemController {

    private final ItemBackend backend;
    private final ThreadCache threadCache;

    public ItemController(ItemBackend backend, ThreadCache threadCache) {
        this.backend = backend;
        this.threadCache = threadCache;
    }

    @GetMapping("/item")
    public Object getItem(
        @RequestParam String key,
        @RequestParam(required = false) String version
    ) {
        return threadCache.fetch(key, CacheOptions.withVersion(version), backend::load);
    }

    // Repeated keys hit the backend once per request.
    @GetMapping("/items")
    public Map<String, Object> getItems(
        @RequestParam List<String> keys,
        @RequestParam(required = false) String version
    ) {
        MultiCacheOptions options = MultiCacheOptions.defaults().version(KeyedOption.shared(version));
        return threadCache.fetchMulti(keys, options, backend::load);
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        return Map.of(
            "backendRequests", backend.getRequestCount(),
            "namespace", threadCache.getNamespace()
        );
    }

    @GetMapping("/reset")
    public void reset() {
        backend.resetCount();
    }
}
