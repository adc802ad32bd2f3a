package com.grantmatcher.common.scoring;

/**
 * Fixed weight set for the composite match score. The four weights sum to 1.0, so a
 * composite built from components in [0, 1] is itself in [0, 1].
 */
public final class ScoringWeights {

    public static final double SEMANTIC   = 0.6;
    public static final double AWARD      = 0.2;
    public static final double COMPLEXITY = 0.1;
    public static final double DEADLINE   = 0.1;

    private ScoringWeights() {}
}
