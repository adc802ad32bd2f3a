package com.grantmatcher.matching.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.grantmatcher.common.exception.ErrorKind;
import com.grantmatcher.common.exception.MatchingException;
import com.grantmatcher.matching.config.MatchingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Two-tier get-or-create cache: a process-local Caffeine tier and an optional shared
 * {@link RemoteCacheTier}.
 *
 * <p><strong>Single-flight:</strong> {@link #getOrCreate} runs the factory at most once at a
 * time per key in this process. The first caller for a missing key registers an in-flight
 * computation; concurrent callers for the same key join it and receive the same result. The
 * map of in-flight computations is guarded by one lock, held only for in-memory state
 * transitions and never across the factory or any remote call.
 *
 * <p><strong>Cancellation:</strong> a caller that cancels simply leaves. The computation keeps
 * running for the remaining waiters; when the last waiter leaves before completion the factory
 * subscription is disposed, which abandons the upstream call.
 *
 * <p><strong>Invalidation:</strong> {@code set}, {@code remove}, {@code removeByPattern} and
 * {@code clear} do not start a second factory for a key that is being computed. The running
 * computation stays joinable; its result reaches every waiter but is not stored.
 *
 * <p><strong>Expiry:</strong> absolute expiry is a hard deadline. Sliding expiry extends the
 * entry on every read, never past the absolute expiry or, when none is set, past
 * {@code createdAt + slidingCap}.
 *
 * <p>Values are stored as JSON, so callers never share a mutable cached instance. Remote tier
 * failures are logged and degrade to local-only operation.
 */
public class HybridCacheStore {

    private static final Logger log = LoggerFactory.getLogger(HybridCacheStore.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MatchingProperties.Cache settings;
    private final RemoteCacheTier remoteTier;   // null when disabled

    private final Cache<String, CacheEntry> local;

    private final Object flightLock = new Object();
    private final Map<String, InFlight> inFlight = new HashMap<>();

    private final LongAdder hits      = new LongAdder();
    private final LongAdder misses    = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public HybridCacheStore(ObjectMapper objectMapper,
                            Clock clock,
                            MatchingProperties.Cache settings,
                            RemoteCacheTier remoteTier) {
        this.objectMapper = objectMapper;
        this.clock        = clock;
        this.settings     = settings;
        this.remoteTier   = remoteTier;
        this.local = Caffeine.newBuilder()
            .maximumSize(settings.getMaxEntries())
            .expireAfter(new EntryExpiry())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .evictionListener((String key, CacheEntry entry, RemovalCause cause) -> onEviction(key, cause))
            .build();

        log.info("[CacheStore] initialised. maxEntries={} remoteTier={}",
                 settings.getMaxEntries(), remoteTier != null ? remoteTier.describe() : "disabled");
    }

    // ── get-or-create ───────────────────────────────────────────────────────

    /**
     * Returns the cached value for {@code key}, computing it with {@code factory} on a miss.
     *
     * <p>An error from the factory is delivered to every waiter and nothing is cached.
     * A factory that completes empty yields an empty result, also not cached.
     *
     * @param absoluteExpiry time-to-live from creation; {@code null} uses the default only when
     *                       {@code slidingExpiry} is also {@code null}
     * @param slidingExpiry  idle timeout extended on each read; may be {@code null}
     */
    public <T> Mono<T> getOrCreate(String key,
                                   Class<T> type,
                                   Supplier<Mono<T>> factory,
                                   Duration absoluteExpiry,
                                   Duration slidingExpiry) {
        requireKey(key);
        Objects.requireNonNull(factory, "factory");

        return Mono.defer(() -> {
            T cached = readLocal(key, type);
            if (cached != null) {
                hits.increment();
                log.debug("[CacheStore] HIT key={} tier=local", key);
                return Mono.just(cached);
            }

            InFlight flight;
            String rechecked = null;
            boolean leader = false;
            synchronized (flightLock) {
                flight = inFlight.get(key);
                if (flight == null) {
                    // a leader may have finished between the lock-free read and here
                    CacheEntry entry = local.getIfPresent(key);
                    if (entry != null) {
                        rechecked = entry.payload();
                    } else {
                        flight = new InFlight();
                        inFlight.put(key, flight);
                        leader = true;
                    }
                }
                if (flight != null) {
                    flight.waiters++;
                }
            }

            if (rechecked != null) {
                hits.increment();
                return Mono.just(fromJson(rechecked, type));
            }
            if (leader) {
                start(key, flight, factory, absoluteExpiry, slidingExpiry);
            } else {
                hits.increment();
                log.debug("[CacheStore] JOINED key={} in-flight computation", key);
            }

            InFlight joined = flight;
            return Mono.fromFuture(joined.result, true)
                .map(payload -> fromJson(payload, type))
                .doOnCancel(() -> leave(key, joined));
        });
    }

    private <T> void start(String key, InFlight flight, Supplier<Mono<T>> factory,
                           Duration absoluteExpiry, Duration slidingExpiry) {
        Mono<Optional<Loaded>> load = readRemote(key)
            .map(payload -> {
                hits.increment();
                log.debug("[CacheStore] HIT key={} tier=remote", key);
                return new Loaded(payload, true);
            })
            .switchIfEmpty(Mono.defer(() -> {
                misses.increment();
                log.debug("[CacheStore] MISS key={} computing", key);
                return Mono.defer(factory).map(value -> new Loaded(toJson(value), false));
            }))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());

        flight.computation.update(load.subscribe(
            loaded -> complete(key, flight, loaded.orElse(null), absoluteExpiry, slidingExpiry),
            error -> fail(key, flight, error)
        ));
    }

    private void complete(String key, InFlight flight, Loaded loaded,
                          Duration absoluteExpiry, Duration slidingExpiry) {
        if (loaded == null) {
            synchronized (flightLock) {
                inFlight.remove(key, flight);
            }
            flight.result.complete(null);
            return;
        }

        CacheEntry entry = null;
        synchronized (flightLock) {
            inFlight.remove(key, flight);
            // a set/remove/clear since the computation started marks it stale: waiters still
            // get the result, newer state is not overwritten
            if (!flight.stale) {
                entry = putLocal(key, loaded.payload(), absoluteExpiry, slidingExpiry);
            }
        }
        if (entry != null && !loaded.fromRemote()) {
            writeRemote(entry).subscribe();
        }
        flight.result.complete(loaded.payload());
    }

    private void fail(String key, InFlight flight, Throwable error) {
        synchronized (flightLock) {
            inFlight.remove(key, flight);
        }
        log.debug("[CacheStore] FACTORY_FAILED key={} reason={}", key, error.getMessage());
        flight.result.completeExceptionally(error);
    }

    private void leave(String key, InFlight flight) {
        Disposable abandoned = null;
        synchronized (flightLock) {
            flight.waiters--;
            if (flight.waiters <= 0 && !flight.result.isDone()) {
                inFlight.remove(key, flight);
                abandoned = flight.computation;
            }
        }
        if (abandoned != null) {
            log.debug("[CacheStore] ABANDONED key={} all waiters cancelled", key);
            abandoned.dispose();
            flight.result.completeExceptionally(new CancellationException("All waiters cancelled"));
        }
    }

    // ── plain operations ───────────────────────────────────────────────────

    /**
     * Looks the key up in the local tier, then the remote tier. A remote hit is copied into
     * the local tier with the default expiry policy.
     */
    public <T> Mono<T> get(String key, Class<T> type) {
        requireKey(key);
        return Mono.defer(() -> {
            T cached = readLocal(key, type);
            if (cached != null) {
                hits.increment();
                return Mono.just(cached);
            }
            return readRemote(key)
                .map(payload -> {
                    hits.increment();
                    synchronized (flightLock) {
                        if (!inFlight.containsKey(key) && local.getIfPresent(key) == null) {
                            putLocal(key, payload, null, null);
                        }
                    }
                    return fromJson(payload, type);
                })
                .switchIfEmpty(Mono.fromRunnable(misses::increment));
        });
    }

    public <T> Mono<Void> set(String key, T value, Duration absoluteExpiry, Duration slidingExpiry) {
        requireKey(key);
        Objects.requireNonNull(value, "value");
        return Mono.defer(() -> {
            String payload = toJson(value);
            CacheEntry entry;
            synchronized (flightLock) {
                markStale(key);
                entry = putLocal(key, payload, absoluteExpiry, slidingExpiry);
            }
            log.debug("[CacheStore] SET key={}", key);
            return writeRemote(entry);
        });
    }

    public Mono<Void> remove(String key) {
        requireKey(key);
        return Mono.defer(() -> {
            synchronized (flightLock) {
                markStale(key);
                local.invalidate(key);
            }
            log.debug("[CacheStore] REMOVED key={}", key);
            return remote("remove", key, tier -> tier.remove(key)).then();
        });
    }

    /**
     * Removes every key matching the glob {@code pattern} from both tiers.
     *
     * @return number of keys removed from the local tier
     */
    public Mono<Long> removeByPattern(String pattern) {
        KeyPattern glob = KeyPattern.compile(pattern);
        return Mono.defer(() -> {
            List<String> matched;
            synchronized (flightLock) {
                inFlight.forEach((key, flight) -> {
                    if (glob.matches(key)) {
                        flight.stale = true;
                    }
                });
                matched = local.asMap().keySet().stream()
                    .filter(glob::matches)
                    .collect(Collectors.toList());
                local.invalidateAll(matched);
            }
            log.info("[CacheStore] REMOVED_BY_PATTERN pattern={} localCount={}", pattern, matched.size());
            long removed = matched.size();
            return remote("removeByPattern", pattern, tier -> tier.removeByPattern(pattern))
                .then(Mono.just(removed));
        });
    }

    public Mono<Void> clear() {
        return Mono.defer(() -> {
            synchronized (flightLock) {
                inFlight.values().forEach(flight -> flight.stale = true);
                local.invalidateAll();
            }
            log.warn("[CacheStore] CLEARED all entries");
            return remote("clear", "*", RemoteCacheTier::clear).then();
        });
    }

    /** Caller holds {@code flightLock}. The flight stays registered so new callers keep joining it. */
    private void markStale(String key) {
        InFlight flight = inFlight.get(key);
        if (flight != null) {
            flight.stale = true;
        }
    }

    public CacheStatistics statistics() {
        local.cleanUp();
        return CacheStatistics.of(hits.sum(), misses.sum(), evictions.sum(), local.estimatedSize());
    }

    public boolean remoteTierEnabled() {
        return remoteTier != null;
    }

    // ── local tier ─────────────────────────────────────────────────────────

    private <T> T readLocal(String key, Class<T> type) {
        CacheEntry entry = local.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        try {
            return objectMapper.readValue(entry.payload(), type);
        } catch (JsonProcessingException e) {
            log.warn("[CacheStore] UNREADABLE key={} type={} — dropping entry. reason={}",
                     key, type.getSimpleName(), e.getOriginalMessage());
            local.asMap().remove(key, entry);
            return null;
        }
    }

    private CacheEntry putLocal(String key, String payload, Duration absoluteExpiry, Duration slidingExpiry) {
        Instant now = clock.instant();
        if (absoluteExpiry == null && slidingExpiry == null) {
            absoluteExpiry = settings.getDefaultTtl();
            slidingExpiry  = settings.getDefaultSlidingTtl();
        }
        CacheEntry entry = new CacheEntry(
            key, payload, now,
            absoluteExpiry != null ? now.plus(absoluteExpiry) : null,
            slidingExpiry);
        local.put(key, entry);
        return entry;
    }

    private void onEviction(String key, RemovalCause cause) {
        if (cause == RemovalCause.SIZE || cause == RemovalCause.COLLECTED) {
            evictions.increment();
            log.debug("[CacheStore] EVICTED key={} cause={}", key, cause);
        }
    }

    private final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return nanosUntil(entry.expiryAfterAccess(entry.createdAt(), settings.getSlidingCap()));
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            if (entry.slidingExpiry() == null) {
                return currentDuration;
            }
            return nanosUntil(entry.expiryAfterAccess(clock.instant(), settings.getSlidingCap()));
        }

        private long nanosUntil(Instant deadline) {
            long nanos = Duration.between(clock.instant(), deadline).toNanos();
            return Math.max(0L, nanos);
        }
    }

    // ── remote tier ────────────────────────────────────────────────────────

    private Mono<String> readRemote(String key) {
        return remote("get", key, tier -> tier.get(key));
    }

    private Mono<Void> writeRemote(CacheEntry entry) {
        Duration ttl = Duration.between(clock.instant(),
            entry.expiryAfterAccess(entry.createdAt(), settings.getSlidingCap()));
        return remote("set", entry.key(), tier -> tier.set(entry.key(), entry.payload(), ttl));
    }

    private <R> Mono<R> remote(String operation, String key,
                               Function<RemoteCacheTier, Mono<R>> call) {
        if (remoteTier == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> call.apply(remoteTier))
            .timeout(settings.getRemoteTimeout())
            .onErrorResume(e -> {
                log.warn("[CacheStore] REMOTE_DEGRADED op={} key={} — continuing with local tier. reason={}",
                         operation, key, e.toString());
                return Mono.empty();
            });
    }

    // ── serialization ──────────────────────────────────────────────────────

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MatchingException(ErrorKind.INTERNAL,
                "Cannot serialize cache value of type " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new MatchingException(ErrorKind.INTERNAL,
                "Cannot deserialize cache value as " + type.getSimpleName(), e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
    }

    private record Loaded(String payload, boolean fromRemote) {}

    /** One pending computation; {@code waiters} and {@code stale} are guarded by {@code flightLock}. */
    private static final class InFlight {
        final CompletableFuture<String> result = new CompletableFuture<>();
        final Disposable.Swap computation = Disposables.swap();
        int waiters;
        boolean stale;
    }
}
