package com.example.threadcache.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A key-value cache whose data lives in the calling thread.
 *
 * <p>Each thread owns one store per namespace, so instances are cheap stateless facades and may be
 * shared between threads: every call only sees the store of the thread making it. Two instances
 * with the same namespace share the store of a given thread.
 *
 * <p>Expiry is lazy. An expired entry, or one whose version mismatches the requested version, is
 * deleted when it is next read, fetched, incremented or swept by {@link #cleanup(CacheOptions)}.
 *
 * <p>Values are stored as given, never copied.
 */
public class ThreadCache {

    private static final Logger log = LoggerFactory.getLogger(ThreadCache.class);

    public static final String DEFAULT_NAMESPACE = "thread_cache";
    public static final Duration DEFAULT_EXPIRES_IN = Duration.ofSeconds(60);

    // namespace -> store, confined to the owning thread
    private static final ThreadLocal<Map<String, Map<String, CacheEntry>>> STORES = new ThreadLocal<>();

    private final String namespace;
    private final Duration expiresIn;
    private final boolean skipNil;
    private final Clock clock;

    private ThreadCache(Builder builder) {
        this.namespace = builder.namespace;
        this.expiresIn = builder.expiresIn;
        this.skipNil = builder.skipNil;
        this.clock = builder.clock;

        dataStore();
    }

    public static ThreadCache create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getNamespace() {
        return namespace;
    }

    public Duration getExpiresIn() {
        return expiresIn;
    }

    public boolean isSkipNil() {
        return skipNil;
    }

    public void clear() {
        dataStore().clear();
    }

    /**
     * Drops this namespace's store from the calling thread. Once the thread holds no store at all
     * the thread-local slot is removed too, so pooled threads keep nothing between tasks.
     */
    public void release() {
        Map<String, Map<String, CacheEntry>> stores = STORES.get();
        if (stores == null) {
            return;
        }
        Map<String, CacheEntry> store = stores.remove(namespace);
        if (store != null) {
            log.debug("Released namespace '{}' ({} entries) from thread {}",
                namespace, store.size(), Thread.currentThread().getName());
        }
        if (stores.isEmpty()) {
            STORES.remove();
        }
    }

    /** Whether the calling thread holds a store for this namespace. Never creates one. */
    public boolean isAllocated() {
        Map<String, Map<String, CacheEntry>> stores = STORES.get();
        return stores != null && stores.containsKey(namespace);
    }

    /** Whether the key is present, without checking expiry or version. */
    public boolean exists(String key) {
        return dataStore().containsKey(checkKey(key));
    }

    public Object write(String key, Object value) {
        return write(key, value, CacheOptions.defaults());
    }

    /**
     * Stores a value, replacing any existing entry.
     *
     * @return the value, or {@code null} when the write was skipped because the value is
     *     {@code null} and {@code skipNil} applies
     */
    public Object write(String key, Object value, CacheOptions options) {
        return performWrite(checkKey(key), value, options);
    }

    public Object read(String key) {
        return read(key, CacheOptions.defaults());
    }

    /** Returns the value of a valid entry, or {@code null}. Invalid entries are deleted. */
    public Object read(String key, CacheOptions options) {
        CacheEntry entry = validate(checkKey(key), options.getVersion());
        return entry != null ? entry.value : null;
    }

    public Object fetch(String key, Function<? super String, ?> producer) {
        return fetch(key, CacheOptions.defaults(), producer);
    }

    /**
     * Returns the value of a valid entry, or writes and returns the value the producer computes
     * for the key. With {@code force} the producer always runs.
     */
    public Object fetch(String key, CacheOptions options, Function<? super String, ?> producer) {
        Objects.requireNonNull(producer, "producer");
        return performFetch(checkKey(key), options, producer);
    }

    public boolean delete(String key) {
        return dataStore().remove(checkKey(key)) != null;
    }

    public void writeMulti(Map<String, ?> keysAndValues) {
        writeMulti(keysAndValues, MultiCacheOptions.defaults());
    }

    public void writeMulti(Map<String, ?> keysAndValues, MultiCacheOptions options) {
        List<String> keys = new ArrayList<>(keysAndValues.keySet());
        Function<String, CacheOptions> optionsOf = options.bind(keys, expiresIn, skipNil);

        for (Map.Entry<String, ?> e : keysAndValues.entrySet()) {
            String key = checkKey(e.getKey());
            performWrite(key, e.getValue(), optionsOf.apply(key));
        }
    }

    public Map<String, Object> readMulti(List<String> keys) {
        return readMulti(keys, MultiCacheOptions.defaults());
    }

    /** Reads every key; misses map to {@code null}. The result keeps the order of the keys. */
    public Map<String, Object> readMulti(List<String> keys, MultiCacheOptions options) {
        Function<String, CacheOptions> optionsOf = options.bind(keys, expiresIn, skipNil);

        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            CacheEntry entry = validate(checkKey(key), optionsOf.apply(key).getVersion());
            result.put(key, entry != null ? entry.value : null);
        }
        return result;
    }

    public Map<String, Object> fetchMulti(List<String> keys, Function<? super String, ?> producer) {
        return fetchMulti(keys, MultiCacheOptions.defaults(), producer);
    }

    public Map<String, Object> fetchMulti(
        List<String> keys,
        MultiCacheOptions options,
        Function<? super String, ?> producer
    ) {
        Objects.requireNonNull(producer, "producer");
        Function<String, CacheOptions> optionsOf = options.bind(keys, expiresIn, skipNil);

        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            result.put(key, performFetch(checkKey(key), optionsOf.apply(key), producer));
        }
        return result;
    }

    public List<Boolean> deleteMulti(List<String> keys) {
        List<Boolean> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            result.add(delete(key));
        }
        return result;
    }

    public List<String> deleteMatched(String regex) {
        return deleteMatched(Pattern.compile(regex));
    }

    /** Deletes every key in which the pattern is found and returns them. */
    public List<String> deleteMatched(Pattern pattern) {
        List<String> deleted = new ArrayList<>();
        Iterator<String> it = dataStore().keySet().iterator();
        while (it.hasNext()) {
            String key = it.next();
            if (pattern.matcher(key).find()) {
                it.remove();
                deleted.add(key);
            }
        }
        return deleted;
    }

    public List<String> cleanup() {
        return cleanup(CacheOptions.defaults());
    }

    /** Deletes every expired entry, and every entry mismatching the version, and returns their keys. */
    public List<String> cleanup(CacheOptions options) {
        Instant now = clock.instant();
        Object version = options.getVersion();

        List<String> deleted = new ArrayList<>();
        Iterator<Map.Entry<String, CacheEntry>> it = dataStore().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry> e = it.next();
            if (!e.getValue().isValid(now, version)) {
                it.remove();
                deleted.add(e.getKey());
            }
        }
        if (!deleted.isEmpty()) {
            log.debug("Cleanup removed {} entries from namespace '{}'", deleted.size(), namespace);
        }
        return deleted;
    }

    public long increment(String key) {
        return increment(key, 1, CacheOptions.defaults());
    }

    public long increment(String key, long amount) {
        return increment(key, amount, CacheOptions.defaults());
    }

    /**
     * Adds {@code amount} to the integer value of the key, a missing or invalid entry counting as
     * zero, and rewrites it with the same options.
     *
     * @throws IllegalArgumentException if the current value cannot be read as an integer
     * @throws ArithmeticException if the result does not fit in a long
     */
    public long increment(String key, long amount, CacheOptions options) {
        return performAdd(checkKey(key), amount, false, options);
    }

    public long decrement(String key) {
        return decrement(key, 1, CacheOptions.defaults());
    }

    public long decrement(String key, long amount) {
        return decrement(key, amount, CacheOptions.defaults());
    }

    public long decrement(String key, long amount, CacheOptions options) {
        return performAdd(checkKey(key), amount, true, options);
    }

    // Visible for tests.
    Map<String, CacheEntry> dataStore() {
        Map<String, Map<String, CacheEntry>> stores = STORES.get();
        if (stores == null) {
            stores = new HashMap<>();
            STORES.set(stores);
        }
        return stores.computeIfAbsent(namespace, ns -> new LinkedHashMap<>());
    }

    private Object performWrite(String key, Object value, CacheOptions options) {
        if (value == null && options.resolveSkipNil(skipNil)) {
            return null;
        }
        Duration ttl = CacheOptions.checkExpiresIn(options.resolveExpiresIn(expiresIn));
        dataStore().put(key, new CacheEntry(value, options.getVersion(), ttl, clock.instant()));
        return value;
    }

    private Object performFetch(String key, CacheOptions options, Function<? super String, ?> producer) {
        if (!options.isForce()) {
            CacheEntry entry = validate(key, options.getVersion());
            if (entry != null) {
                return entry.value;
            }
        }
        return performWrite(key, producer.apply(key), options);
    }

    private long performAdd(String key, long amount, boolean subtract, CacheOptions options) {
        CacheEntry entry = validate(key, options.getVersion());
        long current = IntegerValues.toLong(key, entry != null ? entry.value : null);
        long updated;
        try {
            updated = subtract ? Math.subtractExact(current, amount) : Math.addExact(current, amount);
        } catch (ArithmeticException e) {
            throw new ArithmeticException("Counter '" + key + "' overflows: "
                + current + (subtract ? " - " : " + ") + amount);
        }

        performWrite(key, updated, options);
        return updated;
    }

    /** Returns the entry when present and valid; deletes it when present but invalid. */
    private CacheEntry validate(String key, Object version) {
        Map<String, CacheEntry> store = dataStore();
        CacheEntry entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (!entry.isValid(clock.instant(), version)) {
            store.remove(key);
            log.debug("Dropped invalid entry '{}' from namespace '{}'", key, namespace);
            return null;
        }
        return entry;
    }

    private static String checkKey(String key) {
        return Objects.requireNonNull(key, "key");
    }

    public static final class Builder {
        private String namespace = DEFAULT_NAMESPACE;
        private Duration expiresIn = DEFAULT_EXPIRES_IN;
        private boolean skipNil = false;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder namespace(String namespace) {
            if (namespace == null || namespace.isBlank()) {
                throw new IllegalArgumentException("namespace must not be blank");
            }
            this.namespace = namespace;
            return this;
        }

        /** Default time to live of entries; {@code null} keeps entries until deleted. */
        public Builder expiresIn(Duration expiresIn) {
            this.expiresIn = CacheOptions.checkExpiresIn(expiresIn);
            return this;
        }

        public Builder skipNil(boolean skipNil) {
            this.skipNil = skipNil;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ThreadCache build() {
            return new ThreadCache(this);
        }
    }
}
