package com.mugpunters.backend.service.util;

import com.mugpunters.backend.exception.InvalidInputException;
import com.mugpunters.backend.model.PerformanceCategory;
import com.mugpunters.backend.model.PerformanceGrade;
import com.mugpunters.backend.model.Recommendation;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Side-effect free calculations used to score a report against the market.
 * All returns are expressed in percent.
 */
public final class PerformanceCalculator {

    /**
     * Default half-width, in percent, of the band inside which a "hold" call counts as correct.
     * Pending product-owner confirmation; overridable through
     * {@code reports.evaluation.hold-neutrality-band-pct}.
     */
    public static final double DEFAULT_HOLD_NEUTRALITY_BAND_PCT = 2.0;

    // Lower edges of the grade bands, inclusive
    private static final double GRADE_A = 0.80;
    private static final double GRADE_B = 0.70;
    private static final double GRADE_C = 0.60;
    private static final double GRADE_D = 0.50;

    private static final double EXCELLENT_ABOVE = 10.0;
    private static final double GOOD_FROM = 5.0;
    private static final double POOR_TO = -5.0;
    private static final double TERRIBLE_BELOW = -10.0;

    private PerformanceCalculator() {
    }

    /**
     * Percentage move from {@code originalPrice} to {@code currentPrice}.
     *
     * @throws InvalidInputException if the original price is not positive or the current price is negative
     */
    public static double actualReturnPct(double originalPrice, double currentPrice) {
        requirePositive("original price", originalPrice);
        if (currentPrice < 0 || Double.isNaN(currentPrice)) {
            throw new InvalidInputException("Current price must not be negative: " + currentPrice);
        }
        return (currentPrice - originalPrice) / originalPrice * 100.0;
    }

    /**
     * Return implied by the target price, relative to the price at analysis time.
     */
    public static double predictedReturnPct(double targetPrice, double originalPrice) {
        requirePositive("target price", targetPrice);
        requirePositive("original price", originalPrice);
        return (targetPrice - originalPrice) / originalPrice * 100.0;
    }

    /**
     * Closeness of the actual to the predicted return, normalised by the size of the prediction.
     *
     * @return a value in [0, 1], or {@code null} when there is no non-zero prediction to compare with
     */
    public static Double accuracyScore(double actualReturnPct, Double predictedReturnPct) {
        if (predictedReturnPct == null || predictedReturnPct == 0.0 || predictedReturnPct.isNaN()) {
            return null;
        }
        double accuracy = 1.0 - Math.abs(actualReturnPct - predictedReturnPct) / Math.abs(predictedReturnPct);
        return Math.max(0.0, Math.min(1.0, accuracy));
    }

    public static PerformanceGrade grade(Double accuracy) {
        if (accuracy == null) {
            return null;
        }
        if (accuracy >= GRADE_A) {
            return PerformanceGrade.A;
        } else if (accuracy >= GRADE_B) {
            return PerformanceGrade.B;
        } else if (accuracy >= GRADE_C) {
            return PerformanceGrade.C;
        } else if (accuracy >= GRADE_D) {
            return PerformanceGrade.D;
        }
        return PerformanceGrade.F;
    }

    public static PerformanceCategory category(double performancePct) {
        if (performancePct > EXCELLENT_ABOVE) {
            return PerformanceCategory.EXCELLENT;
        } else if (performancePct >= GOOD_FROM) {
            return PerformanceCategory.GOOD;
        } else if (performancePct > POOR_TO) {
            return PerformanceCategory.NEUTRAL;
        } else if (performancePct >= TERRIBLE_BELOW) {
            return PerformanceCategory.POOR;
        }
        return PerformanceCategory.TERRIBLE;
    }

    /**
     * Whole days elapsed since the analysis, never negative.
     */
    public static int daysSinceAnalysis(LocalDateTime createdAt, LocalDateTime now) {
        long days = Duration.between(createdAt, now).toDays();
        return (int) Math.max(0, days);
    }

    public static boolean recommendationCorrect(Recommendation recommendation, double actualReturnPct) {
        return recommendationCorrect(recommendation, actualReturnPct, DEFAULT_HOLD_NEUTRALITY_BAND_PCT);
    }

    public static boolean recommendationCorrect(Recommendation recommendation, double actualReturnPct,
                                                double holdNeutralityBandPct) {
        if (recommendation == null) {
            return false;
        }
        if (recommendation.isBuyClass()) {
            return actualReturnPct > 0;
        }
        if (recommendation.isSellClass()) {
            return actualReturnPct < 0;
        }
        return Math.abs(actualReturnPct) <= holdNeutralityBandPct;
    }

    public static double outperformance(double actualReturnPct, double benchmarkReturnPct) {
        return actualReturnPct - benchmarkReturnPct;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new InvalidInputException("The " + name + " must be positive: " + value);
        }
    }
}
