/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.scoring;

import com.acme.evidence.util.ScoreUtil;

/**
 * Weights for the three dimensions and for the sub-factors inside each. Every group
 * must sum to 1.0 (within 0.001).
 */
public record ScoringWeights(
        double clinical, double evidence, double market,
        double responseMagnitude, double endpointQuality, double organBreadth, double safety,
        double sampleSize, double publicationVenue, double durability, double completeness,
        double competitorScarcity, double marketSize, double unmetNeed
) {
    public ScoringWeights {
        requireGroup("dimension", clinical, evidence, market);
        requireGroup("clinical", responseMagnitude, endpointQuality, organBreadth, safety);
        requireGroup("evidence", sampleSize, publicationVenue, durability, completeness);
        requireGroup("market", competitorScarcity, marketSize, unmetNeed);
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(
                0.50, 0.25, 0.25,
                0.50, 0.20, 0.20, 0.10,
                0.40, 0.20, 0.20, 0.20,
                0.40, 0.40, 0.20);
    }

    /** Same sub-factor weights with different dimension weights. */
    public ScoringWeights withDimensions(double clinicalWeight, double evidenceWeight, double marketWeight) {
        return new ScoringWeights(clinicalWeight, evidenceWeight, marketWeight,
                responseMagnitude, endpointQuality, organBreadth, safety,
                sampleSize, publicationVenue, durability, completeness,
                competitorScarcity, marketSize, unmetNeed);
    }

    private static void requireGroup(String group, double... weights) {
        for (double w : weights) {
            if (!Double.isFinite(w) || w < 0) {
                throw new IllegalArgumentException("Invalid " + group + " weight: " + w);
            }
        }
        if (!ScoreUtil.sumsToOne(weights)) {
            double sum = 0;
            for (double w : weights) sum += w;
            throw new IllegalArgumentException(group + " weights must sum to 1.0 but sum to " + sum);
        }
    }
}
