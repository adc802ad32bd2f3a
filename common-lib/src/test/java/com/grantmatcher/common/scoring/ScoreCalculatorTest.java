package com.grantmatcher.common.scoring;

import com.grantmatcher.common.model.ApplicantProfile;
import com.grantmatcher.common.model.MatchResult;
import com.grantmatcher.common.model.Opportunity;
import com.grantmatcher.common.model.ScoreBreakdown;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoreCalculatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final double EPS = 1e-9;

    private static final ApplicantProfile PROFILE = new ApplicantProfile(
        "p-1", "Ada", 3.8, "CS", "CA", null, null, true, 2026, "robotics and outreach");

    private static Opportunity grant(String id, double award, boolean essay, boolean recommendation,
                                     Instant deadline, Double minScore) {
        return new Opportunity(id, "Grant " + id, "Fund", minScore, null,
            List.of(), List.of(), List.of(), List.of(), false, null, null,
            essay, recommendation, award, deadline, false);
    }

    @Nested
    @DisplayName("components")
    class Components {

        @Test
        @DisplayName("award is normalised by the 50,000 cap and saturates at 1")
        void awardComponent() {
            assertEquals(0.02, ScoreCalculator.awardComponent(1_000), EPS);
            assertEquals(1.0, ScoreCalculator.awardComponent(50_000), EPS);
            assertEquals(1.0, ScoreCalculator.awardComponent(250_000), EPS);
            assertEquals(0.0, ScoreCalculator.awardComponent(-5), EPS);
        }

        @Test
        @DisplayName("essay and recommendation each subtract 0.3")
        void complexityComponent() {
            assertEquals(1.0, ScoreCalculator.complexityComponent(false, false), EPS);
            assertEquals(0.7, ScoreCalculator.complexityComponent(true, false), EPS);
            assertEquals(0.7, ScoreCalculator.complexityComponent(false, true), EPS);
            assertEquals(0.4, ScoreCalculator.complexityComponent(true, true), EPS);
        }

        @Test
        @DisplayName("deadline within 30 days or already passed → 0.5, otherwise 1.0")
        void deadlineComponent() {
            assertEquals(0.5, ScoreCalculator.deadlineComponent(NOW.plus(Duration.ofDays(10)), NOW), EPS);
            assertEquals(0.5, ScoreCalculator.deadlineComponent(NOW.minus(Duration.ofDays(1)), NOW), EPS);
            assertEquals(1.0, ScoreCalculator.deadlineComponent(NOW.plus(Duration.ofDays(30)), NOW), EPS);
            assertEquals(1.0, ScoreCalculator.deadlineComponent(null, NOW), EPS);
        }

        @Test
        @DisplayName("breakdown holds weighted contributions that sum to the composite")
        void breakdownSumsToComposite() {
            Opportunity o = grant("a", 25_000, true, false, NOW.plus(Duration.ofDays(90)), null);

            MatchResult result = ScoreCalculator.calculateScore(PROFILE, o, 0.8, NOW);
            ScoreBreakdown b = result.breakdown();

            assertEquals(0.8 * ScoringWeights.SEMANTIC, b.semantic(), EPS);
            assertEquals(0.5 * ScoringWeights.AWARD, b.award(), EPS);
            assertEquals(0.7 * ScoringWeights.COMPLEXITY, b.complexity(), EPS);
            assertEquals(1.0 * ScoringWeights.DEADLINE, b.deadlineProximity(), EPS);
            assertEquals(b.total(), result.compositeScore(), EPS);
        }
    }

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("weights sum to 1.0")
        void weightsSumToOne() {
            assertEquals(1.0, ScoringWeights.SEMANTIC + ScoringWeights.AWARD
                + ScoringWeights.COMPLEXITY + ScoringWeights.DEADLINE, EPS);
        }

        @Test
        @DisplayName("identical inputs → identical results")
        void deterministic() {
            Opportunity o = grant("a", 12_345, true, true, NOW.plus(Duration.ofDays(5)), 3.0);
            MatchResult first = ScoreCalculator.calculateScore(PROFILE, o, 0.7331, NOW);
            for (int i = 0; i < 100; i++) {
                assertEquals(first, ScoreCalculator.calculateScore(PROFILE, o, 0.7331, NOW),
                    "Scoring must be deterministic on iteration " + i);
            }
        }

        @Test
        @DisplayName("composite stays in [0, 1], including out-of-range similarity")
        void compositeInUnitInterval() {
            Opportunity best = grant("max", 1_000_000, false, false, null, null);
            Opportunity worst = grant("min", 0, true, true, NOW.minus(Duration.ofDays(3)), null);
            double[] similarities = {-1.0, 0.0, 0.5, 1.0, 7.0, Double.NaN};

            for (double s : similarities) {
                double high = ScoreCalculator.calculateScore(PROFILE, best, s, NOW).compositeScore();
                double low = ScoreCalculator.calculateScore(PROFILE, worst, s, NOW).compositeScore();
                assertTrue(high >= 0.0 && high <= 1.0, "high=" + high + " s=" + s);
                assertTrue(low >= 0.0 && low <= 1.0, "low=" + low + " s=" + s);
            }
            assertEquals(1.0, ScoreCalculator.calculateScore(PROFILE, best, 1.0, NOW).compositeScore(), EPS);
        }

        @Test
        @DisplayName("composite is monotonically non-decreasing in similarity")
        void monotonicInSimilarity() {
            Opportunity o = grant("a", 8_000, true, false, NOW.plus(Duration.ofDays(45)), null);
            double previous = -1.0;
            for (int i = 0; i <= 100; i++) {
                double score = ScoreCalculator.calculateScore(PROFILE, o, i / 100.0, NOW).compositeScore();
                assertTrue(score >= previous, "dropped at similarity " + i / 100.0);
                previous = score;
            }
        }

        @Test
        @DisplayName("eligibility is copied, never overridden by a high score")
        void eligibilityCopied() {
            Opportunity unreachable = grant("a", 50_000, false, false, null, 3.9);

            MatchResult result = ScoreCalculator.calculateScore(PROFILE, unreachable, 1.0, NOW);

            assertFalse(result.meetsAllRequirements());
            assertEquals(List.of("Minimum score not met"), result.unmetRequirements());
            assertEquals(1.0, result.compositeScore(), EPS);
        }
    }

    @Test
    @DisplayName("equal similarity → larger award scores higher")
    void largerAwardRanksHigher() {
        Instant far = NOW.plus(Duration.ofDays(120));
        double big = ScoreCalculator.calculateScore(PROFILE, grant("big", 50_000, false, false, far, null), 0.8, NOW)
            .compositeScore();
        double small = ScoreCalculator.calculateScore(PROFILE, grant("small", 1_000, false, false, far, null), 0.8, NOW)
            .compositeScore();

        assertTrue(big > small);
    }
}
