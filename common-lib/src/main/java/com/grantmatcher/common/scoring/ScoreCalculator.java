package com.grantmatcher.common.scoring;

import com.grantmatcher.common.eligibility.EligibilityFilter;
import com.grantmatcher.common.model.ApplicantProfile;
import com.grantmatcher.common.model.EligibilityResult;
import com.grantmatcher.common.model.MatchResult;
import com.grantmatcher.common.model.Opportunity;
import com.grantmatcher.common.model.ScoreBreakdown;

import java.time.Duration;
import java.time.Instant;

/**
 * Stateless calculator that turns a profile/opportunity pair plus an externally supplied
 * semantic similarity into a {@link MatchResult}.
 *
 * <p><b>Components</b> (each normalised to [0, 1], then multiplied by its {@link ScoringWeights} weight):
 * <pre>
 *   semantic          = clamp(similarity, 0, 1)
 *   award             = min(1, awardAmount / AWARD_CAP)
 *   complexity        = max(0, 1 − 0.3·essayRequired − 0.3·recommendationRequired)
 *   deadlineProximity = 0.5 if fewer than 30 days remain (or the deadline passed), else 1.0
 *   composite         = semantic + award + complexity + deadlineProximity   (capped at 1.0)
 * </pre>
 *
 * <p>The evaluation instant is an explicit argument: two calls with identical arguments
 * return identical results. Eligibility fields are copied from
 * {@link EligibilityFilter#checkEligibility(ApplicantProfile, Opportunity, Instant)} for
 * the same pair and instant.
 */
public final class ScoreCalculator {

    public static final double AWARD_CAP            = 50_000.0;
    public static final long   DEADLINE_WINDOW_DAYS = 30;

    static final double ESSAY_PENALTY          = 0.3;
    static final double RECOMMENDATION_PENALTY = 0.3;
    static final double NEAR_DEADLINE_FACTOR   = 0.5;

    private ScoreCalculator() {}

    /**
     * @param semanticSimilarity similarity reported by the candidate search; values outside
     *                           [0, 1] are clamped and {@code NaN} counts as 0
     * @param asOf               instant used for the deadline component and the deadline check
     * @return a fully populated match result, never {@code null}
     */
    public static MatchResult calculateScore(ApplicantProfile profile,
                                             Opportunity opportunity,
                                             double semanticSimilarity,
                                             Instant asOf) {
        EligibilityResult eligibility = EligibilityFilter.checkEligibility(profile, opportunity, asOf);
        ScoreBreakdown breakdown = breakdown(opportunity, semanticSimilarity, asOf);

        return new MatchResult(
            opportunity.id(),
            opportunity.name(),
            opportunity.awardAmount(),
            opportunity.deadline(),
            clamp(semanticSimilarity),
            Math.min(1.0, breakdown.total()),
            breakdown,
            eligibility.meetsAll(),
            eligibility.unmetReasons()
        );
    }

    /**
     * Computes the weighted components without touching eligibility.
     */
    public static ScoreBreakdown breakdown(Opportunity opportunity, double semanticSimilarity, Instant asOf) {
        double semantic   = clamp(semanticSimilarity);
        double award      = awardComponent(opportunity.awardAmount());
        double complexity = complexityComponent(opportunity.essayRequired(), opportunity.recommendationRequired());
        double deadline   = deadlineComponent(opportunity.deadline(), asOf);

        return new ScoreBreakdown(
            semantic   * ScoringWeights.SEMANTIC,
            award      * ScoringWeights.AWARD,
            complexity * ScoringWeights.COMPLEXITY,
            deadline   * ScoringWeights.DEADLINE
        );
    }

    static double awardComponent(double awardAmount) {
        if (!(awardAmount > 0.0)) {
            return 0.0;
        }
        return Math.min(1.0, awardAmount / AWARD_CAP);
    }

    static double complexityComponent(boolean essayRequired, boolean recommendationRequired) {
        double value = 1.0;
        if (essayRequired) value -= ESSAY_PENALTY;
        if (recommendationRequired) value -= RECOMMENDATION_PENALTY;
        return Math.max(0.0, value);
    }

    static double deadlineComponent(Instant deadline, Instant asOf) {
        // no deadline or no reference point: treated as far away
        if (deadline == null || asOf == null) {
            return 1.0;
        }
        long daysUntil = Duration.between(asOf, deadline).toDays();
        boolean near = deadline.isBefore(asOf) || daysUntil < DEADLINE_WINDOW_DAYS;
        return near ? NEAR_DEADLINE_FACTOR : 1.0;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
