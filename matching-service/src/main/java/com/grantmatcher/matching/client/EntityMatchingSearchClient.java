package com.grantmatcher.matching.client;

import com.grantmatcher.common.exception.MatchingException;
import com.grantmatcher.common.model.ApplicantProfile;
import com.grantmatcher.common.trace.TraceContextUtil;
import com.grantmatcher.matching.client.VectorSearchRequest.AttributeFilter;
import com.grantmatcher.matching.client.VectorSearchRequest.FilterGroup;
import com.grantmatcher.matching.client.VectorSearchResponse.Hit;
import com.grantmatcher.matching.config.MatchingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link CandidateSearch} backed by the entity-matching service ({@code POST /profiles/search}).
 *
 * <p>The profile's own attributes and the request filters are sent as {@code ContainsOrEmpty}
 * and range hints so the remote index can prune early. They are hints only: eligibility and
 * request filters are re-evaluated locally on every candidate.
 *
 * <p>Transport errors, timeouts, non-2xx responses and malformed payloads all surface as
 * {@code UPSTREAM_UNAVAILABLE}. A payload with one unusable hit fails the whole search rather
 * than returning a silently truncated list.
 */
@Component
public class EntityMatchingSearchClient implements CandidateSearch {

    private static final Logger log = LoggerFactory.getLogger(EntityMatchingSearchClient.class);

    static final String SEARCH_PATH = "/profiles/search";

    private final WebClient entityMatchingClient;
    private final Duration timeout;

    public EntityMatchingSearchClient(@Qualifier("entityMatchingWebClient") WebClient entityMatchingClient,
                                      MatchingProperties properties) {
        this.entityMatchingClient = entityMatchingClient;
        this.timeout              = properties.getSearch().getUpstreamTimeout();
    }

    @Override
    public Mono<List<Candidate>> search(ApplicantProfile profile,
                                        SearchFilters filters,
                                        double minSimilarity,
                                        int limit) {
        VectorSearchRequest body = new VectorSearchRequest(
            profile.summary(), buildFilters(profile, filters), minSimilarity, limit);

        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            long started = System.currentTimeMillis();
            return entityMatchingClient.post()
                .uri(SEARCH_PATH)
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(VectorSearchResponse.class)
                .timeout(timeout)
                .map(EntityMatchingSearchClient::toCandidates)
                .defaultIfEmpty(List.of())
                .doOnNext(candidates -> log.info(
                    "[CandidateSearch] RETRIEVED profileId={} candidates={} limit={} latencyMs={} traceId={}",
                    profile.id(), candidates.size(), limit, System.currentTimeMillis() - started, traceId))
                .onErrorMap(e -> !(e instanceof MatchingException), e -> {
                    log.warn("[CandidateSearch] FAILED profileId={} traceId={} reason={}",
                             profile.id(), traceId, e.toString());
                    return MatchingException.upstream("Candidate search is unavailable", e);
                });
        });
    }

    static List<Candidate> toCandidates(VectorSearchResponse response) {
        if (response.results() == null) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>(response.results().size());
        for (Hit hit : response.results()) {
            if (hit == null || hit.profileId() == null || hit.profileId().isBlank()
                    || hit.profile() == null || hit.similarity() == null || hit.similarity().isNaN()) {
                throw MatchingException.upstream("Malformed candidate in search response", null);
            }
            candidates.add(new Candidate(hit.profileId(), hit.similarity(), hit.profile()));
        }
        return candidates;
    }

    static FilterGroup buildFilters(ApplicantProfile profile, SearchFilters filters) {
        List<AttributeFilter> list = new ArrayList<>();
        if (profile.state() != null && !profile.state().isBlank()) {
            list.add(new AttributeFilter("attributes.requiredStates", "ContainsOrEmpty", profile.state()));
        }
        if (profile.major() != null && !profile.major().isBlank()) {
            list.add(new AttributeFilter("attributes.eligibleMajors", "ContainsOrEmpty", profile.major()));
        }
        if (filters.minAwardAmount() != null) {
            list.add(new AttributeFilter("attributes.awardAmount", "GreaterThanOrEqual", filters.minAwardAmount()));
        }
        if (filters.maxAwardAmount() != null) {
            list.add(new AttributeFilter("attributes.awardAmount", "LessThanOrEqual", filters.maxAwardAmount()));
        }
        if (filters.deadlineAfter() != null) {
            list.add(new AttributeFilter("attributes.deadline", "GreaterThanOrEqual", filters.deadlineAfter().toString()));
        }
        if (filters.deadlineBefore() != null) {
            list.add(new AttributeFilter("attributes.deadline", "LessThanOrEqual", filters.deadlineBefore().toString()));
        }
        if (filters.requiresEssay() != null) {
            list.add(new AttributeFilter("attributes.essayRequired", "Equals", filters.requiresEssay()));
        }
        return new FilterGroup("And", list);
    }
}
