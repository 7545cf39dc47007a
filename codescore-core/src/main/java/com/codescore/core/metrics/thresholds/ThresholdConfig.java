package com.codescore.core.metrics.thresholds;

/**
 * Zone boundaries for one metric in one language.
 *
 * <p>A statistic at or below {@code excellent} scores 100. The three following zones degrade
 * linearly and anything above {@code poor} falls on an exponential tail.
 *
 * @param excellent upper bound of the full-score zone
 * @param good upper bound of the first degradation zone
 * @param acceptable upper bound of the second degradation zone
 * @param poor upper bound of the third degradation zone
 *
 * @since 1.0.0
 */
public record ThresholdConfig(double excellent, double good, double acceptable, double poor) {

    public ThresholdConfig {
        if (!(excellent < good && good < acceptable && acceptable < poor)) {
            throw new IllegalArgumentException(String.format(
                "Thresholds must be strictly increasing: excellent=%s good=%s acceptable=%s poor=%s",
                excellent, good, acceptable, poor));
        }
    }

    public static ThresholdConfig of(double excellent, double good, double acceptable, double poor) {
        return new ThresholdConfig(excellent, good, acceptable, poor);
    }
}
