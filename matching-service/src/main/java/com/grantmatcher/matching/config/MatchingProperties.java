package com.grantmatcher.matching.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables under the {@code matching.*} prefix. Defaults here are the production values;
 * {@code application.yml} only restates the ones operators commonly change.
 */
@Data
@ConfigurationProperties(prefix = "matching")
public class MatchingProperties {

    private Search search = new Search();
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Search {
        private int defaultLimit = 20;
        private int maxLimit = 100;
        private double defaultMinSimilarity = 0.6;
        /** Candidate pool = (offset + limit) × overfetchFactor, capped by maxCandidatePool. */
        private int overfetchFactor = 3;
        private int maxCandidatePool = 500;
        private Duration resultTtl = Duration.ofMinutes(15);
        private Duration resultSlidingTtl = Duration.ofMinutes(5);
        private Duration upstreamTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Cache {
        private long maxEntries = 10_000;
        private Duration defaultTtl = Duration.ofMinutes(30);
        private Duration defaultSlidingTtl = Duration.ofMinutes(10);
        private Duration slidingCap = Duration.ofHours(1);
        private boolean remoteEnabled = false;
        private String remoteNamespace = "grantmatcher";
        private Duration remoteTimeout = Duration.ofMillis(500);
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private List<Window> windows = new ArrayList<>(List.of(
            new Window(Duration.ofMinutes(1), 60),
            new Window(Duration.ofMinutes(5), 200)
        ));
        private Duration cleanupInterval = Duration.ofMinutes(10);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Window {
        private Duration length;
        private int maxRequests;
    }
}
