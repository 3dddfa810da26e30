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

import com.acme.evidence.model.Enums.ConfidenceLevel;

/**
 * Reconciled value over a set of {@link SourceEstimate}s. Never mutated: a changed
 * estimate set produces a new instance.
 */
public record ConsensusEstimate(
        double consensusValue,
        double simpleMedian,
        double rangeLow,
        double rangeHigh,
        double coefficientOfVariation,
        ConfidenceLevel confidence,
        String rationale,
        int sourceCount,
        int tier1Count,
        int highQualityCount
) {}
