package com.grantmatcher.matching.service;

import com.grantmatcher.common.eligibility.EligibilityFilter;
import com.grantmatcher.common.exception.MatchingException;
import com.grantmatcher.common.model.ApplicantProfile;
import com.grantmatcher.common.model.EligibilityResult;
import com.grantmatcher.common.model.MatchResult;
import com.grantmatcher.common.model.Opportunity;
import com.grantmatcher.common.scoring.ScoreCalculator;
import com.grantmatcher.common.trace.TraceContextUtil;
import com.grantmatcher.matching.cache.HybridCacheStore;
import com.grantmatcher.matching.client.Candidate;
import com.grantmatcher.matching.client.CandidateSearch;
import com.grantmatcher.matching.client.EntityDirectory;
import com.grantmatcher.matching.client.SearchFilters;
import com.grantmatcher.matching.config.MatchingProperties;
import com.grantmatcher.matching.dto.SearchMetadata;
import com.grantmatcher.matching.dto.SearchRequest;
import com.grantmatcher.matching.dto.SearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one match search end to end:
 * <pre>
 *   validate → cache lookup (single-flight) → load profile → candidate search
 *            → score + eligibility → request filters → rank → paginate → cache
 * </pre>
 *
 * <p>Ranking is total: composite score descending, then award amount descending, then
 * opportunity id ascending, so equal inputs always produce the same page.
 *
 * <p>The candidate pool is over-fetched ({@code (offset + limit) × overfetchFactor}, capped) so
 * that results dropped by local filters rarely leave a page short.
 */
@Service
public class MatchingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MatchingOrchestrator.class);

    static final String SEARCH_STRATEGY = "Hybrid (Filters + Vector Similarity)";

    private static final Comparator<MatchResult> RANKING = Comparator
        .comparingDouble(MatchResult::compositeScore).reversed()
        .thenComparing(Comparator.comparingDouble(MatchResult::awardAmount).reversed())
        .thenComparing(MatchResult::opportunityId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final CandidateSearch candidateSearch;
    private final EntityDirectory entityDirectory;
    private final HybridCacheStore cacheStore;
    private final MatchingProperties.Search settings;
    private final Clock clock;

    public MatchingOrchestrator(CandidateSearch candidateSearch,
                                EntityDirectory entityDirectory,
                                HybridCacheStore cacheStore,
                                MatchingProperties properties,
                                Clock clock) {
        this.candidateSearch = candidateSearch;
        this.entityDirectory = entityDirectory;
        this.cacheStore      = cacheStore;
        this.settings        = properties.getSearch();
        this.clock           = clock;
    }

    // ── search ──────────────────────────────────────────────────────────────

    public Mono<SearchResponse> findMatches(SearchRequest request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            long started = clock.millis();
            ResolvedSearch search = resolve(request);
            String key = SearchFingerprint.of(search);
            // set only when this request's factory ran; joiners of an in-flight search report fromCache
            AtomicBoolean computed = new AtomicBoolean(false);

            return cacheStore.getOrCreate(key, RankedMatches.class,
                    () -> {
                        computed.set(true);
                        return compute(search, traceId);
                    },
                    settings.getResultTtl(), settings.getResultSlidingTtl())
                .map(ranked -> {
                    long elapsed = clock.millis() - started;
                    boolean fromCache = !computed.get();
                    TraceContextUtil.withMdc(traceId, () -> log.info(
                        "[Matching] SEARCH_COMPLETE profileId={} returned={} total={} fromCache={} latencyMs={}",
                        search.profileId(), ranked.matches().size(), ranked.totalCount(), fromCache, elapsed));
                    return new SearchResponse(ranked.matches(), ranked.totalCount(),
                        new SearchMetadata(elapsed, fromCache, ranked.searchStrategy(),
                            ranked.candidatesRetrieved(), ranked.eligibleCount()));
                });
        });
    }

    private Mono<RankedMatches> compute(ResolvedSearch search, String traceId) {
        int pool = candidatePool(search);
        SearchFilters filters = new SearchFilters(search.minAwardAmount(), search.maxAwardAmount(),
            search.deadlineAfter(), search.deadlineBefore(), search.requiresEssay());

        return requireProfile(search.profileId())
            .flatMap(profile -> candidateSearch.search(profile, filters, search.minSimilarity(), pool)
                .map(candidates -> rank(profile, candidates, search, clock.instant())))
            .doOnNext(ranked -> TraceContextUtil.withMdc(traceId, () -> log.debug(
                "[Matching] COMPUTED profileId={} pool={} retrieved={} total={} eligible={}",
                search.profileId(), pool, ranked.candidatesRetrieved(), ranked.totalCount(),
                ranked.eligibleCount())));
    }

    int candidatePool(ResolvedSearch search) {
        long wanted = (long) (search.offset() + search.limit()) * settings.getOverfetchFactor();
        return (int) Math.min(settings.getMaxCandidatePool(), Math.max(search.limit(), wanted));
    }

    RankedMatches rank(ApplicantProfile profile, List<Candidate> candidates,
                       ResolvedSearch search, Instant asOf) {
        // same opportunity twice keeps the higher similarity
        Map<String, Candidate> unique = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            if (c.similarity() < search.minSimilarity()) {
                continue;
            }
            unique.merge(c.opportunityId(), c, (a, b) -> b.similarity() > a.similarity() ? b : a);
        }

        List<MatchResult> kept = new ArrayList<>(unique.size());
        for (Candidate c : unique.values()) {
            Opportunity opportunity = c.opportunity();
            if (!passesFilters(opportunity, search)) {
                continue;
            }
            MatchResult result = ScoreCalculator.calculateScore(profile, opportunity, c.similarity(), asOf);
            if (search.eligibleOnly() && !result.meetsAllRequirements()) {
                continue;
            }
            kept.add(result);
        }
        kept.sort(RANKING);

        int eligible = (int) kept.stream().filter(MatchResult::meetsAllRequirements).count();
        int from = Math.min(search.offset(), kept.size());
        int to   = Math.min(from + search.limit(), kept.size());
        return new RankedMatches(kept.subList(from, to), kept.size(), candidates.size(),
            eligible, SEARCH_STRATEGY);
    }

    /**
     * An opportunity without a deadline is open-ended: it passes {@code deadlineAfter} and
     * fails {@code deadlineBefore}.
     */
    static boolean passesFilters(Opportunity opportunity, ResolvedSearch search) {
        double award = opportunity.awardAmount();
        if (search.minAwardAmount() != null && award < search.minAwardAmount()) {
            return false;
        }
        if (search.maxAwardAmount() != null && award > search.maxAwardAmount()) {
            return false;
        }
        Instant deadline = opportunity.deadline();
        if (search.deadlineAfter() != null && deadline != null && deadline.isBefore(search.deadlineAfter())) {
            return false;
        }
        if (search.deadlineBefore() != null && (deadline == null || deadline.isAfter(search.deadlineBefore()))) {
            return false;
        }
        return search.requiresEssay() == null || search.requiresEssay() == opportunity.essayRequired();
    }

    // ── eligibility & invalidation ──────────────────────────────────────────

    /**
     * Evaluates one profile against one opportunity as of now, including the deadline.
     */
    public Mono<EligibilityResult> checkEligibility(String profileId, String opportunityId) {
        return Mono.deferContextual(ctx -> {
            requireId("profileId", profileId);
            requireId("opportunityId", opportunityId);
            String traceId = TraceContextUtil.getTraceId(ctx);

            Mono<Opportunity> opportunity = entityDirectory.findOpportunity(opportunityId)
                .switchIfEmpty(Mono.error(() -> MatchingException.notFound("Opportunity not found: " + opportunityId)));

            return Mono.zip(requireProfile(profileId), opportunity)
                .map(pair -> EligibilityFilter.checkEligibility(pair.getT1(), pair.getT2(), clock.instant()))
                .doOnNext(result -> TraceContextUtil.withMdc(traceId, () -> log.info(
                    "[Matching] ELIGIBILITY_CHECKED profileId={} opportunityId={} meetsAll={} unmet={}",
                    profileId, opportunityId, result.meetsAll(), result.unmetReasons().size())));
        });
    }

    /**
     * Drops every cached search of {@code profileId}, typically after the profile changed.
     *
     * @return number of local entries removed
     */
    public Mono<Long> invalidateProfile(String profileId) {
        return Mono.defer(() -> {
            requireId("profileId", profileId);
            return cacheStore.removeByPattern(SearchFingerprint.profilePattern(profileId.trim()));
        }).doOnNext(removed -> log.info("[Matching] PROFILE_INVALIDATED profileId={} removed={}",
                                        profileId, removed));
    }

    private Mono<ApplicantProfile> requireProfile(String profileId) {
        return entityDirectory.findProfile(profileId)
            .switchIfEmpty(Mono.error(() -> MatchingException.notFound("Profile not found: " + profileId)));
    }

    // ── validation ──────────────────────────────────────────────────────────

    ResolvedSearch resolve(SearchRequest request) {
        if (request == null) {
            throw MatchingException.validation("Request body is required");
        }
        requireId("profileId", request.profileId());

        int limit = request.limit() != null ? request.limit() : settings.getDefaultLimit();
        if (limit < 1 || limit > settings.getMaxLimit()) {
            throw MatchingException.validation("limit must be between 1 and " + settings.getMaxLimit());
        }
        int offset = request.offset() != null ? request.offset() : 0;
        if (offset < 0) {
            throw MatchingException.validation("offset must not be negative");
        }
        double minSimilarity = request.minSimilarity() != null
            ? request.minSimilarity() : settings.getDefaultMinSimilarity();
        if (Double.isNaN(minSimilarity) || minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw MatchingException.validation("minSimilarity must be between 0 and 1");
        }

        Double minAward = request.minAwardAmount();
        Double maxAward = request.maxAwardAmount();
        if ((minAward != null && (minAward.isNaN() || minAward < 0))
                || (maxAward != null && (maxAward.isNaN() || maxAward < 0))) {
            throw MatchingException.validation("Award amounts must be non-negative numbers");
        }
        if (minAward != null && maxAward != null && minAward > maxAward) {
            throw MatchingException.validation("minAwardAmount must not exceed maxAwardAmount");
        }
        if (request.deadlineAfter() != null && request.deadlineBefore() != null
                && request.deadlineAfter().isAfter(request.deadlineBefore())) {
            throw MatchingException.validation("deadlineAfter must not be later than deadlineBefore");
        }

        return new ResolvedSearch(request.profileId().trim(), minAward, maxAward,
            request.deadlineAfter(), request.deadlineBefore(), request.requiresEssay(),
            Boolean.TRUE.equals(request.eligibleOnly()), limit, offset, minSimilarity);
    }

    /** Ids end up inside cache keys and glob patterns, so separators and wildcards are refused. */
    private static void requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw MatchingException.validation(field + " is required");
        }
        if (value.indexOf(':') >= 0 || value.indexOf('*') >= 0 || value.indexOf('?') >= 0) {
            throw MatchingException.validation(field + " must not contain ':', '*' or '?'");
        }
    }
}
