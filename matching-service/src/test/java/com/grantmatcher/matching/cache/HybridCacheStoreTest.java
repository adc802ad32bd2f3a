package com.grantmatcher.matching.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.grantmatcher.matching.config.MatchingProperties;
import com.grantmatcher.matching.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HybridCacheStoreTest {

    private static final Duration TEN_MIN = Duration.ofMinutes(10);

    private MutableClock clock;
    private ObjectMapper mapper;
    private MatchingProperties.Cache settings;
    private HybridCacheStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        settings = new MatchingProperties.Cache();
        store = new HybridCacheStore(mapper, clock, settings, null);
    }

    private static Mono<String> counted(AtomicInteger calls, Mono<String> value) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            return value;
        });
    }

    @Nested
    @DisplayName("get-or-create")
    class GetOrCreate {

        @Test
        @DisplayName("miss computes once, second call is a local hit")
        void missThenHit() {
            AtomicInteger calls = new AtomicInteger();

            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.just("v1")), TEN_MIN, null))
                .expectNext("v1").verifyComplete();
            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.just("v2")), TEN_MIN, null))
                .expectNext("v1").verifyComplete();

            assertEquals(1, calls.get());
            CacheStatistics stats = store.statistics();
            assertEquals(1, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(50.0, stats.hitRate(), 1e-9);
            assertEquals(1, stats.currentEntries());
        }

        @Test
        @DisplayName("concurrent callers share one in-flight computation")
        void singleFlight() {
            AtomicInteger calls = new AtomicInteger();
            Sinks.One<String> upstream = Sinks.one();

            CompletableFuture<String> first = store.getOrCreate("k", String.class,
                () -> counted(calls, upstream.asMono()), TEN_MIN, null).toFuture();
            CompletableFuture<String> second = store.getOrCreate("k", String.class,
                () -> counted(calls, upstream.asMono()), TEN_MIN, null).toFuture();

            assertEquals(1, calls.get());
            assertFalse(first.isDone());

            upstream.tryEmitValue("shared");

            assertEquals("shared", first.join());
            assertEquals("shared", second.join());
            assertEquals(1, store.statistics().hits(), "joining an in-flight computation counts as a hit");
            assertEquals(1, store.statistics().misses());
        }

        @Test
        @DisplayName("factory failure reaches the caller and is not cached")
        void failureNotCached() {
            AtomicInteger calls = new AtomicInteger();

            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.error(new IllegalStateException("boom"))), TEN_MIN, null))
                .expectErrorMessage("boom")
                .verify();
            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.just("recovered")), TEN_MIN, null))
                .expectNext("recovered").verifyComplete();

            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("empty factory result completes empty and is not cached")
        void emptyNotCached() {
            AtomicInteger calls = new AtomicInteger();

            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.empty()), TEN_MIN, null))
                .verifyComplete();
            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.just("later")), TEN_MIN, null))
                .expectNext("later").verifyComplete();

            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("computation is abandoned only when the last waiter cancels")
        void lastWaiterCancels() {
            AtomicBoolean upstreamCancelled = new AtomicBoolean();
            AtomicInteger calls = new AtomicInteger();
            Mono<String> hanging = Mono.<String>never().doOnCancel(() -> upstreamCancelled.set(true));

            Disposable a = store.getOrCreate("k", String.class, () -> counted(calls, hanging), TEN_MIN, null)
                .subscribe();
            Disposable b = store.getOrCreate("k", String.class, () -> counted(calls, hanging), TEN_MIN, null)
                .subscribe();

            a.dispose();
            assertFalse(upstreamCancelled.get(), "one remaining waiter keeps the computation alive");

            b.dispose();
            assertTrue(upstreamCancelled.get());

            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.just("fresh")), TEN_MIN, null))
                .expectNext("fresh").verifyComplete();
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("set during a computation wins over the late result")
        void setDetachesInFlight() {
            Sinks.One<String> upstream = Sinks.one();
            CompletableFuture<String> waiter = store.getOrCreate("k", String.class,
                upstream::asMono, TEN_MIN, null).toFuture();

            store.set("k", "newer", TEN_MIN, null).block();
            upstream.tryEmitValue("stale");

            assertEquals("stale", waiter.join());
            assertEquals("newer", store.get("k", String.class).block());
        }

        @Test
        @DisplayName("invalidation during a computation does not start a second factory")
        void invalidationKeepsSingleFlight() {
            String key = "search:matches:p1:abc";
            AtomicInteger calls = new AtomicInteger();
            Sinks.One<String> upstream = Sinks.one();

            CompletableFuture<String> first = store.getOrCreate(key, String.class,
                () -> counted(calls, upstream.asMono()), TEN_MIN, null).toFuture();
            assertEquals(0L, store.removeByPattern("search:matches:p1:*").block());
            CompletableFuture<String> second = store.getOrCreate(key, String.class,
                () -> counted(calls, Mono.just("second")), TEN_MIN, null).toFuture();

            assertEquals(1, calls.get());
            upstream.tryEmitValue("computed");

            assertEquals("computed", first.join());
            assertEquals("computed", second.join());
            assertNull(store.get(key, String.class).block(), "invalidated result is not stored");
        }

        @Test
        @DisplayName("remove and clear during a computation keep callers on the running factory")
        void removeAndClearKeepSingleFlight() {
            AtomicInteger calls = new AtomicInteger();
            Sinks.One<String> upstream = Sinks.one();

            CompletableFuture<String> first = store.getOrCreate("k", String.class,
                () -> counted(calls, upstream.asMono()), TEN_MIN, null).toFuture();
            store.remove("k").block();
            CompletableFuture<String> second = store.getOrCreate("k", String.class,
                () -> counted(calls, Mono.just("other")), TEN_MIN, null).toFuture();
            store.clear().block();
            CompletableFuture<String> third = store.getOrCreate("k", String.class,
                () -> counted(calls, Mono.just("other")), TEN_MIN, null).toFuture();

            upstream.tryEmitValue("v");

            assertEquals(1, calls.get());
            assertEquals("v", first.join());
            assertEquals("v", second.join());
            assertEquals("v", third.join());
            assertEquals(0, store.statistics().currentEntries());

            StepVerifier.create(store.getOrCreate("k", String.class,
                    () -> counted(calls, Mono.just("fresh")), TEN_MIN, null))
                .expectNext("fresh").verifyComplete();
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("cached values are copies, never the factory's instance")
        void valuesAreCopies() {
            Map<String, Integer> original = new HashMap<>(Map.of("a", 1));

            @SuppressWarnings("unchecked")
            Map<String, Integer> cached = store.getOrCreate("m", Map.class,
                () -> Mono.just(original), TEN_MIN, null).block();
            original.put("b", 2);

            @SuppressWarnings("unchecked")
            Map<String, Integer> again = store.get("m", Map.class).block();
            assertNotSame(original, cached);
            assertEquals(Map.of("a", 1), again);
        }

        @Test
        @DisplayName("blank key is rejected")
        void blankKey() {
            assertThrows(IllegalArgumentException.class,
                () -> store.getOrCreate(" ", String.class, () -> Mono.just("x"), TEN_MIN, null));
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("absolute expiry is a hard deadline")
        void absolute() {
            store.set("k", "v", Duration.ofMinutes(10), null).block();

            clock.advance(Duration.ofMinutes(9));
            assertEquals("v", store.get("k", String.class).block());

            clock.advance(Duration.ofMinutes(2));
            assertNull(store.get("k", String.class).block());
        }

        @Test
        @DisplayName("sliding expiry is extended by reads")
        void sliding() {
            store.set("k", "v", null, Duration.ofMinutes(5)).block();

            clock.advance(Duration.ofMinutes(4));
            assertEquals("v", store.get("k", String.class).block());
            clock.advance(Duration.ofMinutes(4));
            assertEquals("v", store.get("k", String.class).block(), "read at 4m pushed expiry to 9m");

            clock.advance(Duration.ofMinutes(6));
            assertNull(store.get("k", String.class).block());
        }

        @Test
        @DisplayName("sliding never extends past the absolute expiry")
        void slidingCappedByAbsolute() {
            store.set("k", "v", Duration.ofMinutes(12), Duration.ofMinutes(5)).block();

            for (int i = 0; i < 2; i++) {
                clock.advance(Duration.ofMinutes(4));
                assertEquals("v", store.get("k", String.class).block());
            }
            clock.advance(Duration.ofMinutes(3));
            assertEquals("v", store.get("k", String.class).block());

            clock.advance(Duration.ofMinutes(2));
            assertNull(store.get("k", String.class).block(), "13m is past the 12m absolute expiry");
        }

        @Test
        @DisplayName("sliding-only entries stop at the sliding cap")
        void slidingCap() {
            settings.setSlidingCap(Duration.ofMinutes(20));
            store = new HybridCacheStore(mapper, clock, settings, null);
            store.set("k", "v", null, Duration.ofMinutes(5)).block();

            for (int i = 0; i < 4; i++) {
                clock.advance(Duration.ofMinutes(4));
                assertEquals("v", store.get("k", String.class).block());
            }
            clock.advance(Duration.ofMinutes(5));
            assertNull(store.get("k", String.class).block(), "20m cap reached despite reads every 4m");
        }
    }

    @Nested
    @DisplayName("removal and statistics")
    class Removal {

        @Test
        @DisplayName("removeByPattern drops only matching keys")
        void removeByPattern() {
            store.set("search:matches:p1:a", "1", TEN_MIN, null).block();
            store.set("search:matches:p1:b", "2", TEN_MIN, null).block();
            store.set("search:matches:p2:a", "3", TEN_MIN, null).block();

            assertEquals(2L, store.removeByPattern("search:matches:p1:*").block());

            assertNull(store.get("search:matches:p1:a", String.class).block());
            assertEquals("3", store.get("search:matches:p2:a", String.class).block());
        }

        @Test
        @DisplayName("remove and clear empty the local tier")
        void removeAndClear() {
            store.set("a", "1", TEN_MIN, null).block();
            store.set("b", "2", TEN_MIN, null).block();

            store.remove("a").block();
            assertNull(store.get("a", String.class).block());

            store.clear().block();
            assertEquals(0, store.statistics().currentEntries());
        }

        @Test
        @DisplayName("size evictions are counted, explicit removals are not")
        void evictionsCounted() {
            settings.setMaxEntries(2);
            store = new HybridCacheStore(mapper, clock, settings, null);

            store.set("a", "1", TEN_MIN, null).block();
            store.set("b", "2", TEN_MIN, null).block();
            store.set("c", "3", TEN_MIN, null).block();
            store.remove("c").block();

            CacheStatistics stats = store.statistics();
            assertEquals(1, stats.evictions());
            assertTrue(stats.currentEntries() <= 2);
        }

        @Test
        @DisplayName("hit rate is zero before any lookup")
        void emptyStatistics() {
            CacheStatistics stats = store.statistics();
            assertEquals(0.0, stats.hitRate());
            assertEquals(0, stats.currentEntries());
        }
    }

    @Nested
    @DisplayName("remote tier")
    class Remote {

        @Test
        @DisplayName("instances sharing a remote tier reuse each other's results")
        void sharedAcrossInstances() {
            InMemoryRemoteTier remote = new InMemoryRemoteTier();
            HybridCacheStore a = new HybridCacheStore(mapper, clock, settings, remote);
            HybridCacheStore b = new HybridCacheStore(mapper, clock, settings, remote);
            AtomicInteger calls = new AtomicInteger();

            assertEquals("v", a.getOrCreate("k", String.class, () -> counted(calls, Mono.just("v")), TEN_MIN, null).block());
            assertEquals("v", b.getOrCreate("k", String.class, () -> counted(calls, Mono.just("x")), TEN_MIN, null).block());

            assertEquals(1, calls.get());
            assertEquals(1, b.statistics().hits());
            assertTrue(b.remoteTierEnabled());
        }

        @Test
        @DisplayName("pattern removal reaches the remote tier")
        void removeByPatternRemote() {
            InMemoryRemoteTier remote = new InMemoryRemoteTier();
            HybridCacheStore a = new HybridCacheStore(mapper, clock, settings, remote);
            a.set("search:matches:p1:a", "1", TEN_MIN, null).block();
            a.set("other", "2", TEN_MIN, null).block();

            a.removeByPattern("search:*").block();

            assertFalse(remote.values.containsKey("search:matches:p1:a"));
            assertTrue(remote.values.containsKey("other"));
        }

        @Test
        @DisplayName("failing remote tier degrades to local-only")
        void failingRemote() {
            HybridCacheStore degraded = new HybridCacheStore(mapper, clock, settings, new FailingRemoteTier());
            AtomicInteger calls = new AtomicInteger();

            assertEquals("v", degraded.getOrCreate("k", String.class, () -> counted(calls, Mono.just("v")), TEN_MIN, null).block());
            assertEquals("v", degraded.getOrCreate("k", String.class, () -> counted(calls, Mono.just("x")), TEN_MIN, null).block());
            assertEquals(1L, degraded.removeByPattern("k*").block(), "local removal still happens");

            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("unresponsive remote tier is cut off by the timeout")
        void hangingRemote() {
            settings.setRemoteTimeout(Duration.ofMillis(50));
            HybridCacheStore slow = new HybridCacheStore(mapper, clock, settings, new HangingRemoteTier());

            String value = slow.getOrCreate("k", String.class, () -> Mono.just("v"), TEN_MIN, null)
                .block(Duration.ofSeconds(5));

            assertEquals("v", value);
        }
    }

    // ── test tiers ──────────────────────────────────────────────────────────

    static class InMemoryRemoteTier implements RemoteCacheTier {
        final Map<String, String> values = new ConcurrentHashMap<>();

        @Override public Mono<String> get(String key) { return Mono.justOrEmpty(values.get(key)); }
        @Override public Mono<Void> set(String key, String payload, Duration ttl) {
            return Mono.fromRunnable(() -> values.put(key, payload));
        }
        @Override public Mono<Void> remove(String key) { return Mono.fromRunnable(() -> values.remove(key)); }
        @Override public Mono<Long> removeByPattern(String glob) {
            KeyPattern p = KeyPattern.compile(glob);
            return Mono.fromSupplier(() -> {
                long before = values.size();
                values.keySet().removeIf(p::matches);
                return before - values.size();
            });
        }
        @Override public Mono<Void> clear() { return Mono.fromRunnable(values::clear); }
        @Override public String describe() { return "in-memory"; }
    }

    static class FailingRemoteTier implements RemoteCacheTier {
        private static <T> Mono<T> down() { return Mono.error(new IllegalStateException("connection refused")); }

        @Override public Mono<String> get(String key) { return down(); }
        @Override public Mono<Void> set(String key, String payload, Duration ttl) { return down(); }
        @Override public Mono<Void> remove(String key) { return down(); }
        @Override public Mono<Long> removeByPattern(String glob) { return down(); }
        @Override public Mono<Void> clear() { return down(); }
        @Override public String describe() { return "failing"; }
    }

    static class HangingRemoteTier extends FailingRemoteTier {
        @Override public Mono<String> get(String key) { return Mono.never(); }
        @Override public Mono<Void> set(String key, String payload, Duration ttl) { return Mono.never(); }
    }
}
