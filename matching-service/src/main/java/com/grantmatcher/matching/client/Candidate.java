package com.grantmatcher.matching.client;

import com.grantmatcher.common.model.Opportunity;

/**
 * One hit from the candidate search: the opportunity and its semantic similarity to the
 * profile, in [0, 1].
 */
public record Candidate(String opportunityId, double similarity, Opportunity opportunity) {}
