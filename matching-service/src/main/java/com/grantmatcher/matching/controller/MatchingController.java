package com.grantmatcher.matching.controller;

import com.grantmatcher.common.exception.MatchingException;
import com.grantmatcher.common.model.EligibilityResult;
import com.grantmatcher.matching.dto.ClearCacheResponse;
import com.grantmatcher.matching.dto.EligibilityRequest;
import com.grantmatcher.matching.dto.SearchRequest;
import com.grantmatcher.matching.dto.SearchResponse;
import com.grantmatcher.matching.service.MatchingOrchestrator;
import com.grantmatcher.matching.service.SearchFingerprint;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/matches")
public class MatchingController {

    private final MatchingOrchestrator orchestrator;

    public MatchingController(MatchingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/search")
    public Mono<ResponseEntity<SearchResponse>> search(@RequestBody SearchRequest request) {
        return orchestrator.findMatches(request).map(ResponseEntity::ok);
    }

    @PostMapping("/eligibility")
    public Mono<ResponseEntity<EligibilityResult>> eligibility(@RequestBody EligibilityRequest request) {
        if (request == null) {
            return Mono.error(MatchingException.validation("Request body is required"));
        }
        return orchestrator.checkEligibility(request.profileId(), request.opportunityId())
            .map(ResponseEntity::ok);
    }

    @DeleteMapping("/cache/{profileId}")
    public Mono<ResponseEntity<ClearCacheResponse>> invalidate(@PathVariable String profileId) {
        return orchestrator.invalidateProfile(profileId)
            .map(removed -> ResponseEntity.ok(new ClearCacheResponse(SearchFingerprint.profilePattern(profileId), removed)));
    }
}
