package com.grantmatcher.matching.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window admission control keyed by client identity.
 *
 * <p>Each client owns a time-ordered deque of admitted-request instants. On every check:
 * <ol>
 *   <li>instants older than the longest window are pruned;</li>
 *   <li>the count inside each window is compared to that window's limit;</li>
 *   <li>the request is rejected if <em>any</em> window is full, otherwise recorded and admitted.</li>
 * </ol>
 * Rejected requests are not recorded, so a client that keeps retrying is not locked out longer.
 *
 * <p>Per-client state is only mutated inside {@link ConcurrentHashMap#compute}, which serialises
 * updates for one key without blocking unrelated clients. {@link #evictIdleClients()} drops clients idle longer than the longest window.
 */
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final List<RateWindow> windows;
    private final Duration retention;
    private final Clock clock;
    private final ConcurrentHashMap<String, ClientWindow> clients = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(List<RateWindow> windows, Clock clock) {
        if (windows == null || windows.isEmpty()) {
            throw new IllegalArgumentException("At least one rate window is required");
        }
        this.windows = windows.stream()
            .sorted(Comparator.comparing(RateWindow::length))
            .toList();
        this.retention = this.windows.get(this.windows.size() - 1).length();
        this.clock = clock;
    }

    /**
     * Checks and, when admitted, records one request for {@code clientId}.
     */
    public AdmissionDecision admit(String clientId) {
        Instant now = clock.instant();
        final AdmissionDecision[] decision = {null};
        // compute() serialises updates per key; other clients are untouched
        clients.compute(clientId, (id, existing) -> {
            ClientWindow client = existing != null ? existing : new ClientWindow();
            client.prune(now.minus(retention));
            decision[0] = client.evaluate(now, windows);
            if (decision[0].allowed()) {
                client.record(now);
            }
            return client;
        });
        if (!decision[0].allowed()) {
            log.warn("[RateLimiter] REJECTED clientId={} retryAfterSeconds={}",
                     clientId, decision[0].retryAfterSeconds());
        }
        return decision[0];
    }

    /**
     * Removes clients whose most recent admitted request is older than the longest window.
     *
     * @return number of clients removed
     */
    public int evictIdleClients() {
        Instant cutoff = clock.instant().minus(retention);
        final int[] removed = {0};
        for (String clientId : clients.keySet()) {
            clients.computeIfPresent(clientId, (id, client) -> {
                if (client.idleSince(cutoff)) {
                    removed[0]++;
                    return null;
                }
                return client;
            });
        }
        if (removed[0] > 0) {
            log.debug("[RateLimiter] EVICTED_IDLE count={} remaining={}", removed[0], clients.size());
        }
        return removed[0];
    }

    public int trackedClients() {
        return clients.size();
    }

    /** Only touched from inside a map compute call for its key. */
    private static final class ClientWindow {

        private final Deque<Instant> admitted = new ArrayDeque<>();

        void prune(Instant horizon) {
            while (!admitted.isEmpty() && !admitted.peekFirst().isAfter(horizon)) {
                admitted.pollFirst();
            }
        }

        AdmissionDecision evaluate(Instant now, List<RateWindow> windows) {
            Duration longestWait = null;
            for (RateWindow window : windows) {
                Instant windowStart = now.minus(window.length());
                int count = 0;
                Instant oldestInWindow = null;
                // newest first, stop at the first instant outside the window
                Iterator<Instant> it = admitted.descendingIterator();
                while (it.hasNext()) {
                    Instant t = it.next();
                    if (!t.isAfter(windowStart)) {
                        break;
                    }
                    count++;
                    oldestInWindow = t;
                }
                if (count >= window.maxRequests()) {
                    Duration wait = Duration.between(now, oldestInWindow.plus(window.length()));
                    if (longestWait == null || wait.compareTo(longestWait) > 0) {
                        longestWait = wait;
                    }
                }
            }
            return longestWait == null ? AdmissionDecision.admitted() : AdmissionDecision.rejected(longestWait);
        }

        void record(Instant now) {
            admitted.addLast(now);
        }

        boolean idleSince(Instant cutoff) {
            Instant last = admitted.peekLast();
            return last == null || !last.isAfter(cutoff);
        }
    }
}
