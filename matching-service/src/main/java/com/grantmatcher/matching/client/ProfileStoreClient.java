package com.grantmatcher.matching.client;

import com.grantmatcher.common.exception.MatchingException;
import com.grantmatcher.common.model.ApplicantProfile;
import com.grantmatcher.common.model.Opportunity;
import com.grantmatcher.common.trace.TraceContextUtil;
import com.grantmatcher.matching.config.MatchingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link EntityDirectory} over the profile store REST API. 404 completes empty; any other
 * failure is {@code UPSTREAM_UNAVAILABLE}.
 */
@Component
public class ProfileStoreClient implements EntityDirectory {

    private static final Logger log = LoggerFactory.getLogger(ProfileStoreClient.class);

    private final WebClient profileStoreClient;
    private final Duration timeout;

    public ProfileStoreClient(@Qualifier("profileStoreWebClient") WebClient profileStoreClient,
                              MatchingProperties properties) {
        this.profileStoreClient = profileStoreClient;
        this.timeout            = properties.getSearch().getUpstreamTimeout();
    }

    @Override
    public Mono<ApplicantProfile> findProfile(String profileId) {
        return fetch("/api/profiles/{id}", profileId, ApplicantProfile.class);
    }

    @Override
    public Mono<Opportunity> findOpportunity(String opportunityId) {
        return fetch("/api/opportunities/{id}", opportunityId, Opportunity.class);
    }

    private <T> Mono<T> fetch(String path, String id, Class<T> type) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return profileStoreClient.get()
                .uri(path, id)
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .retrieve()
                .bodyToMono(type)
                .timeout(timeout)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.debug("[ProfileStore] NOT_FOUND type={} id={} traceId={}",
                              type.getSimpleName(), id, traceId);
                    return Mono.empty();
                })
                .onErrorMap(e -> !(e instanceof MatchingException), e -> {
                    log.warn("[ProfileStore] FAILED type={} id={} traceId={} reason={}",
                             type.getSimpleName(), id, traceId, e.toString());
                    return MatchingException.upstream("Profile store is unavailable", e);
                });
        });
    }
}
