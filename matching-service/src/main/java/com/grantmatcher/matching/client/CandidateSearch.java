package com.grantmatcher.matching.client;

import com.grantmatcher.common.model.ApplicantProfile;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Semantic candidate retrieval. Implementations return at most {@code limit} candidates whose
 * similarity is at least {@code minSimilarity}, and signal
 * {@link com.grantmatcher.common.exception.ErrorKind#UPSTREAM_UNAVAILABLE} on any failure.
 */
public interface CandidateSearch {

    Mono<List<Candidate>> search(ApplicantProfile profile,
                                 SearchFilters filters,
                                 double minSimilarity,
                                 int limit);
}
