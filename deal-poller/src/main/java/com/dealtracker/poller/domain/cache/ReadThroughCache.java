package com.dealtracker.poller.domain.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Time-bounded read-through cache with single-flight loading.
 *
 * <p>A value is served while it is younger than the caller's ttl. On a miss the first caller runs
 * the loader on its own thread; concurrent callers for the same key wait on that load and get the
 * same value or the same failure. Failed loads leave nothing behind, so the next caller tries again.
 *
 * <p>An expired entry is dropped when it is next read. Entries nobody reads again are swept on a
 * load, at most once per ttl.
 */
@Slf4j
public class ReadThroughCache<K, V> {

    private final ConcurrentMap<K, CachedValue<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicReference<Instant> lastSweep;

    public ReadThroughCache(Clock clock) {
        this.clock = clock;
        this.lastSweep = new AtomicReference<>(clock.instant());
    }

    public V getOrFetch(K key, Duration ttl, Supplier<V> loader) {
        var cached = entries.get(key);
        if (cached != null) {
            if (cached.isFresh(clock.instant(), ttl)) {
                return cached.value();
            }
            entries.remove(key, cached);
        }

        var pending = new CompletableFuture<V>();
        var existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) {
            return await(existing);
        }

        try {
            // another loader may have finished between the freshness check and the claim
            var latest = entries.get(key);
            if (latest != null && latest.isFresh(clock.instant(), ttl)) {
                pending.complete(latest.value());
                return latest.value();
            }
            var value = loader.get();
            var loadedAt = clock.instant();
            entries.put(key, new CachedValue<>(value, loadedAt));
            pending.complete(value);
            log.debug("cache.loaded: key={}", key);
            sweepExpired(loadedAt, ttl);
            return value;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, pending);
        }
    }

    public int size() {
        return entries.size();
    }

    private void sweepExpired(Instant now, Duration ttl) {
        var last = lastSweep.get();
        if (last.plus(ttl).isAfter(now) || !lastSweep.compareAndSet(last, now)) {
            return;
        }
        var before = entries.size();
        entries.values().removeIf(entry -> !entry.isFresh(now, ttl));
        log.debug("cache.swept: evicted={}, remaining={}", before - entries.size(), entries.size());
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new CompletionException(e.getCause());
        }
    }

    record CachedValue<V>(V value, Instant fetchedAt) {

        boolean isFresh(Instant now, Duration ttl) {
            return fetchedAt.plus(ttl).isAfter(now);
        }
    }
}
