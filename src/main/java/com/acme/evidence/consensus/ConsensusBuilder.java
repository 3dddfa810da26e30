/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.consensus;

import com.acme.evidence.model.ConsensusEstimate;
import com.acme.evidence.model.Enums.ConfidenceLevel;
import com.acme.evidence.model.SourceEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Rolls per-source numeric estimates (prevalence, patient counts) into one consensus value.
 *
 * <p>Each source is weighted by quality tier (3/2/1), recency (x1.5 from {@link #RECENCY_YEAR})
 * and study scale (x1.3 above {@link #LARGE_STUDY_POPULATION}). The consensus is the weighted
 * median with weights expanded to {@code round(weight * 10)} copies. Confidence combines the
 * coefficient of variation of the raw values with the number of high-quality sources.
 */
public class ConsensusBuilder {
    private static final Logger log = LoggerFactory.getLogger(ConsensusBuilder.class);

    public static final int RECENCY_YEAR = 2020;
    public static final double RECENCY_BOOST = 1.5;
    public static final long LARGE_STUDY_POPULATION = 10_000_000L;
    public static final double LARGE_STUDY_BOOST = 1.3;
    private static final double WIDE_SPREAD_RATIO = 10.0;

    private record Weighted(double value, int tier, int copies) {}

    public ConsensusEstimate build(List<SourceEstimate> estimates) {
        if (estimates == null || estimates.isEmpty()) {
            throw new IllegalArgumentException("At least one source estimate is required");
        }
        List<Weighted> usable = new ArrayList<>();
        for (SourceEstimate e : estimates) {
            if (e == null || !Double.isFinite(e.value())) {
                log.warn("Dropping non-finite estimate from source {}", e == null ? "null" : e.sourceId());
                continue;
            }
            int tier = clampTier(e.qualityTier());
            usable.add(new Weighted(e.value(), tier, (int) Math.round(weight(e) * 10)));
        }
        if (usable.isEmpty()) {
            throw new IllegalArgumentException("No finite estimate values among " + estimates.size() + " sources");
        }

        List<Double> raw = new ArrayList<>();
        for (Weighted w : usable) raw.add(w.value());
        Collections.sort(raw);

        double consensus = weightedMedian(usable);
        double simple = median(raw);
        double low = raw.get(0);
        double high = raw.get(raw.size() - 1);
        double cv = coefficientOfVariation(raw);
        int n = usable.size();
        int tier1 = (int) usable.stream().filter(w -> w.tier() == 1).count();
        int highQuality = (int) usable.stream().filter(w -> w.tier() <= 2).count();

        if (n > 1 && low > 0 && high / low > WIDE_SPREAD_RATIO) {
            log.warn("Wide estimate range: {} to {} (>{}x spread)", low, high, (int) WIDE_SPREAD_RATIO);
        }

        ConfidenceLevel confidence;
        String rationale;
        if (n == 1) {
            confidence = tier1 == 1 ? ConfidenceLevel.LOW : ConfidenceLevel.VERY_LOW;
            rationale = tier1 == 1 ? "Single Tier-1 source" : "Single source without Tier-1 quality";
        } else if (cv < 0.3 && highQuality >= 3) {
            confidence = ConfidenceLevel.HIGH;
            rationale = fmt("%d Tier-1/2 sources agree within 30%% CV", highQuality);
        } else if (n >= 3 && cv < 0.5 && tier1 >= 1) {
            confidence = ConfidenceLevel.MODERATE;
            rationale = fmt("Tier-1 source available, %s CV across %d estimates", pct(cv), n);
        } else if (n >= 3 && cv < 1.0) {
            confidence = ConfidenceLevel.LOW_MODERATE;
            rationale = fmt("%d sources with moderate variability (%s CV)", n, pct(cv));
        } else if (n >= 3 || cv < 1.0) {
            confidence = ConfidenceLevel.LOW;
            rationale = n >= 3
                    ? fmt("High variability across %d sources (%s CV)", n, pct(cv))
                    : fmt("Only two sources (%s CV)", pct(cv));
        } else {
            confidence = ConfidenceLevel.VERY_LOW;
            rationale = fmt("Two sources disagree (%s CV)", pct(cv));
        }

        log.debug("Consensus over {} sources: {} (median {}, CV {}) -> {}", n, consensus, simple, cv, confidence);
        return new ConsensusEstimate(consensus, simple, low, high, cv, confidence, rationale, n, tier1, highQuality);
    }

    /** Quality x recency x scale weight of one source. */
    public static double weight(SourceEstimate e) {
        double w = switch (clampTier(e.qualityTier())) {
            case 1 -> 3.0;
            case 2 -> 2.0;
            default -> 1.0;
        };
        if (e.year() != null && e.year() >= RECENCY_YEAR) w *= RECENCY_BOOST;
        if (e.studyPopulation() != null && e.studyPopulation() > LARGE_STUDY_POPULATION) w *= LARGE_STUDY_BOOST;
        return w;
    }

    static int clampTier(int tier) {
        return Math.max(1, Math.min(3, tier));
    }

    private static double weightedMedian(List<Weighted> usable) {
        List<Weighted> sorted = new ArrayList<>(usable);
        sorted.sort((a, b) -> Double.compare(a.value(), b.value()));
        long total = 0;
        for (Weighted w : sorted) total += w.copies();
        if (total == 0) {
            List<Double> values = new ArrayList<>();
            for (Weighted w : sorted) values.add(w.value());
            return median(values);
        }
        if (total % 2 == 1) return valueAt(sorted, total / 2);
        return (valueAt(sorted, total / 2 - 1) + valueAt(sorted, total / 2)) / 2.0;
    }

    /** Value at a position of the expanded multiset without materialising the copies. */
    private static double valueAt(List<Weighted> sorted, long index) {
        long seen = 0;
        for (Weighted w : sorted) {
            seen += w.copies();
            if (index < seen) return w.value();
        }
        return sorted.get(sorted.size() - 1).value();
    }

    private static double median(List<Double> sortedValues) {
        List<Double> v = new ArrayList<>(sortedValues);
        Collections.sort(v);
        int n = v.size();
        if (n % 2 == 1) return v.get(n / 2);
        return (v.get(n / 2 - 1) + v.get(n / 2)) / 2.0;
    }

    /** Sample standard deviation over mean; 0 for one value or a zero mean. */
    static double coefficientOfVariation(List<Double> values) {
        int n = values.size();
        if (n < 2) return 0.0;
        double sum = 0;
        for (double v : values) sum += v;
        double mean = sum / n;
        if (mean == 0) return 0.0;
        double sq = 0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return Math.sqrt(sq / (n - 1)) / Math.abs(mean);
    }

    private static String pct(double cv) {
        return String.format(Locale.ROOT, "%.0f%%", cv * 100);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
