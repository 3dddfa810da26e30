/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class ScoreUtil {
    public static final double MIN_SCORE = 1.0;
    public static final double MAX_SCORE = 10.0;
    public static final double NEUTRAL = 5.0;

    private ScoreUtil() {}

    /** Clamps to [1,10]; NaN becomes the neutral score. */
    public static double clampScore(double v) {
        if (Double.isNaN(v)) return NEUTRAL;
        return clamp(v, MIN_SCORE, MAX_SCORE);
    }

    public static double clamp(double v, double lo, double hi) {
        if (v < lo) return lo;
        if (v > hi) return hi;
        return v;
    }

    public static double round1(double v) { return round(v, 1); }

    public static double round2(double v) { return round(v, 2); }

    public static double round(double v, int scale) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return v;
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static String interpret(double score, String context) {
        if (score >= 8) return "Excellent " + context;
        if (score >= 6) return "Good " + context;
        if (score >= 4) return "Moderate " + context;
        return "Limited " + context;
    }

    /** Non-negative sum that sticks at {@link Long#MAX_VALUE} instead of wrapping. */
    public static long saturatedAdd(long total, long n) {
        long sum = total + Math.max(0, n);
        return sum < total ? Long.MAX_VALUE : sum;
    }

    public static boolean sumsToOne(double... weights) {
        double sum = 0;
        for (double w : weights) sum += w;
        return Math.abs(sum - 1.0) < 0.001;
    }
}
