package com.grantmatcher.matching.client;

import com.grantmatcher.common.model.ApplicantProfile;
import com.grantmatcher.common.model.Opportunity;
import reactor.core.publisher.Mono;

/**
 * Read-only lookup of profiles and opportunities by id. An unknown id completes empty.
 */
public interface EntityDirectory {

    Mono<ApplicantProfile> findProfile(String profileId);

    Mono<Opportunity> findOpportunity(String opportunityId);
}
