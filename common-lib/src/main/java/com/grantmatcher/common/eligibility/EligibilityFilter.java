package com.grantmatcher.common.eligibility;

import com.grantmatcher.common.model.ApplicantProfile;
import com.grantmatcher.common.model.EligibilityResult;
import com.grantmatcher.common.model.Opportunity;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Stateless eligibility check of an {@link ApplicantProfile} against an {@link Opportunity}.
 *
 * <p><b>Check order</b> (every check runs, none short-circuits):
 * <pre>
 *   1. minimum score            6. gender membership
 *   2. maximum score            7. first-generation flag
 *   3. major membership         8. graduation-year range
 *   4. state membership         9. deadline (only when an evaluation instant is supplied)
 *   5. ethnicity membership
 * </pre>
 * The order is numeric bounds, then categorical sets, then boolean flags, then date bounds,
 * which keeps {@link EligibilityResult#unmetReasons()} stable across calls.
 *
 * <p>An absent bound or an empty restriction list on the opportunity is "unrestricted".
 * A profile value that is missing while the opportunity restricts it counts as unmet.
 */
public final class EligibilityFilter {

    static final String MIN_SCORE_NOT_MET       = "Minimum score not met";
    static final String MAX_SCORE_EXCEEDED      = "Maximum score exceeded";
    static final String FIRST_GEN_REQUIRED      = "First-generation status required";

    private static final DateTimeFormatter DEADLINE_FORMAT =
        DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private EligibilityFilter() {}

    /**
     * Checks every static restriction. The deadline is not considered.
     *
     * @return never {@code null}; {@code meetsAll} is true iff no reason was recorded
     */
    public static EligibilityResult checkEligibility(ApplicantProfile profile, Opportunity opportunity) {
        return checkEligibility(profile, opportunity, null);
    }

    /**
     * Checks every restriction, including whether the deadline has passed as of {@code asOf}.
     *
     * @param asOf evaluation instant; {@code null} skips the deadline check
     */
    public static EligibilityResult checkEligibility(ApplicantProfile profile,
                                                     Opportunity opportunity,
                                                     Instant asOf) {
        List<String> unmet = new ArrayList<>();

        // ── numeric bounds ──────────────────────────────────────────────────
        Double score = profile.score();
        if (opportunity.minScore() != null && (score == null || score < opportunity.minScore())) {
            unmet.add(MIN_SCORE_NOT_MET);
        }
        if (opportunity.maxScore() != null && (score == null || score > opportunity.maxScore())) {
            unmet.add(MAX_SCORE_EXCEEDED);
        }

        // ── categorical sets ────────────────────────────────────────────────
        checkMembership("Major", profile.major(), opportunity.eligibleMajors(), unmet);
        checkMembership("State", profile.state(), opportunity.requiredStates(), unmet);
        checkMembership("Ethnicity", profile.ethnicity(), opportunity.eligibleEthnicities(), unmet);
        checkMembership("Gender", profile.gender(), opportunity.eligibleGenders(), unmet);

        // ── boolean flags ───────────────────────────────────────────────────
        if (opportunity.firstGenerationRequired() && !profile.firstGeneration()) {
            unmet.add(FIRST_GEN_REQUIRED);
        }

        // ── date bounds ─────────────────────────────────────────────────────
        checkGraduationYear(profile.graduationYear(),
            opportunity.minGraduationYear(), opportunity.maxGraduationYear(), unmet);

        if (asOf != null && opportunity.deadline() != null && opportunity.deadline().isBefore(asOf)) {
            unmet.add("Deadline has passed (" + DEADLINE_FORMAT.format(opportunity.deadline()) + ")");
        }

        return EligibilityResult.of(unmet);
    }

    private static void checkMembership(String attribute, String value,
                                        List<String> allowed, List<String> unmet) {
        if (allowed == null || allowed.isEmpty()) {
            return;
        }
        if (value == null || value.isBlank()) {
            unmet.add(attribute + " must be one of: " + String.join(", ", allowed));
            return;
        }
        String candidate = value.trim();
        boolean member = allowed.stream()
            .anyMatch(a -> a.trim().equalsIgnoreCase(candidate));
        if (!member) {
            unmet.add(attribute + " must be one of: " + String.join(", ", allowed));
        }
    }

    private static void checkGraduationYear(Integer year, Integer min, Integer max, List<String> unmet) {
        if (min == null && max == null) {
            return;
        }
        boolean belowMin = min != null && (year == null || year < min);
        boolean aboveMax = max != null && (year == null || year > max);
        if (!belowMin && !aboveMax) {
            return;
        }
        if (min != null && max != null) {
            unmet.add("Graduation year must be between " + min + " and " + max);
        } else if (min != null) {
            unmet.add("Graduation year must be no earlier than " + min);
        } else {
            unmet.add("Graduation year must be no later than " + max);
        }
    }
}
