package com.codescore.core.metrics;

import com.codescore.core.metrics.thresholds.ThresholdConfig;

/**
 * Four-zone curve that maps a raw statistic to a 0-100 score.
 *
 * <pre>
 * x &lt;= excellent         : 100
 * excellent &lt; x &lt;= good  : 100 - z1 * progress
 * good &lt; x &lt;= acceptable : 100 - z1 - z2 * progress
 * acceptable &lt; x &lt;= poor : 100 - z1 - z2 - z3 * progress
 * x &gt; poor               : tail * exp(-(x - poor) / k)
 * </pre>
 *
 * <p>The curve is non-increasing in {@code x} as long as {@code tail <= 100 - z1 - z2 - z3}.
 *
 * @param z1 points lost across the first zone
 * @param z2 points lost across the second zone
 * @param z3 points lost across the third zone
 * @param tail score just above {@code poor}
 * @param k decay constant of the tail
 *
 * @since 1.0.0
 */
public record ScoringCurve(double z1, double z2, double z3, double tail, double k) {

    public static final ScoringCurve CYCLOMATIC = new ScoringCurve(20, 30, 50, 0, 1);
    public static final ScoringCurve COGNITIVE = new ScoringCurve(20, 35, 30, 15, 15);
    public static final ScoringCurve NESTING = new ScoringCurve(20, 35, 30, 15, 3);
    public static final ScoringCurve FUNCTION_LENGTH = new ScoringCurve(15, 35, 35, 15, 50);
    public static final ScoringCurve FILE_LENGTH = new ScoringCurve(15, 35, 35, 15, 500);
    public static final ScoringCurve PARAMETER_COUNT = new ScoringCurve(15, 35, 35, 15, 3);
    public static final ScoringCurve PERCENTAGE = new ScoringCurve(20, 35, 30, 15, 20);

    public ScoringCurve {
        if (z1 < 0 || z2 < 0 || z3 < 0 || tail < 0 || k <= 0) {
            throw new IllegalArgumentException("Curve parameters must be non-negative and k positive");
        }
        if (z1 + z2 + z3 > 100 || tail > 100 - z1 - z2 - z3) {
            throw new IllegalArgumentException(String.format(
                "Curve would not be monotonic: z1=%s z2=%s z3=%s tail=%s", z1, z2, z3, tail));
        }
    }

    /**
     * Scores a statistic against a threshold quadruple.
     *
     * @param x raw statistic
     * @param t zone boundaries
     * @return score in {@code [0, 100]}, unrounded
     */
    public double score(double x, ThresholdConfig t) {
        if (x <= t.excellent()) {
            return 100.0;
        }
        if (x <= t.good()) {
            return 100.0 - progress(x, t.excellent(), t.good()) * z1;
        }
        if (x <= t.acceptable()) {
            return 100.0 - z1 - progress(x, t.good(), t.acceptable()) * z2;
        }
        if (x <= t.poor()) {
            return Math.max(0.0, 100.0 - z1 - z2 - progress(x, t.acceptable(), t.poor()) * z3);
        }
        return Math.max(0.0, tail * Math.exp(-(x - t.poor()) / k));
    }

    private static double progress(double x, double from, double to) {
        return (x - from) / (to - from);
    }
}
