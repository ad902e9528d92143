package org.aid.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Thread-safe store of fitted results keyed by {@link ModelKey}.
 *
 * Nothing is cached implicitly: callers pass the key and the computation, and
 * decide when entries go stale. Values are expected to be immutable.
 */
public final class ModelCache {

    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    private final ConcurrentMap<ModelKey, Object> entries = new ConcurrentHashMap<>();

    /**
     * Returns the cached value for the key, computing and storing it on a miss.
     * The computation runs at most once per key while the entry is present.
     */
    public <T> T getOrCompute(ModelKey key, Class<T> type, Supplier<? extends T> compute) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(compute, "compute must not be null");

        Object cached = entries.get(key);
        if (cached != null) {
            log.debug("Cache hit for {}", key);
            return type.cast(cached);
        }
        Object value = entries.computeIfAbsent(key, k -> {
            log.debug("Cache miss for {}", k);
            return Objects.requireNonNull(compute.get(), "computed value must not be null");
        });
        return type.cast(value);
    }

    public <T> Optional<T> get(ModelKey key, Class<T> type) {
        Objects.requireNonNull(key, "key must not be null");
        Object v = entries.get(key);
        return v == null ? Optional.empty() : Optional.of(type.cast(v));
    }

    public boolean invalidate(ModelKey key) {
        Objects.requireNonNull(key, "key must not be null");
        return entries.remove(key) != null;
    }

    /**
     * Drops every entry fitted on the data with this fingerprint.
     *
     * @return number of entries removed
     */
    public int invalidateMatrix(String fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        int before = entries.size();
        entries.keySet().removeIf(k -> k.fingerprint().equals(fingerprint));
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("Invalidated {} cached models for matrix {}", removed, fingerprint);
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
