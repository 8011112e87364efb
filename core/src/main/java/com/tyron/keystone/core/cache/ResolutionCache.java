package com.tyron.keystone.core.cache;

import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Time-bounded cache of resolved instances in front of container construction.
 * <p>
 * Callers must not insert types that already live in the singleton store. Expired entries are
 * treated as absent and evicted on read; {@link #invalidateExpired()} sweeps them proactively.
 * Hit and miss counters are observational only.
 */
public final class ResolutionCache {

    private static final Logger LOG = Logger.getLogger(ResolutionCache.class.getName());

    private final Clock clock;
    private final Duration ttl;
    private final Map<Class<?>, Entry> entries = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private volatile boolean enabled;

    private record Entry(Object instance, Instant createdAt) {
    }

    public ResolutionCache(Clock clock, Duration ttl, boolean enabled) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.enabled = enabled;
    }

    public @Nullable Object tryGet(Class<?> type) {
        if (!enabled) {
            misses.incrementAndGet();
            return null;
        }

        Entry entry = entries.get(type);
        if (entry == null) {
            misses.incrementAndGet();
            return null;
        }

        if (isExpired(entry, clock.instant())) {
            entries.remove(type, entry);
            misses.incrementAndGet();
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Evicted expired cache entry for " + type.getName());
            }
            return null;
        }

        hits.incrementAndGet();
        return entry.instance();
    }

    public void put(Class<?> type, Object instance) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
        if (!enabled) {
            return;
        }
        entries.put(type, new Entry(instance, clock.instant()));
    }

    public boolean invalidate(Class<?> type) {
        return entries.remove(type) != null;
    }

    /**
     * Removes every expired entry.
     *
     * @return how many entries were removed
     */
    public int invalidateExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<Class<?>, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (isExpired(it.next().getValue(), now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0 && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Swept " + removed + " expired cache entries");
        }
        return removed;
    }

    /**
     * Disabling drops every entry immediately; while disabled, {@link #put} is a no-op.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            entries.clear();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.createdAt(), now).compareTo(ttl) >= 0;
    }
}
