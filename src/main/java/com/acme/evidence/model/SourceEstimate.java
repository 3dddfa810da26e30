/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.model;

/**
 * A single source's estimate of an epidemiological or market quantity
 * (prevalence, first-line failure rate, ...).
 *
 * @param qualityTier 1 (highest) to 3; values outside the range are clamped when weighted
 */
public record SourceEstimate(String sourceId, double value, int qualityTier, Integer year, Long studyPopulation) {
    public static SourceEstimate of(double value, int qualityTier, Integer year) {
        return new SourceEstimate(null, value, qualityTier, year, null);
    }
}
