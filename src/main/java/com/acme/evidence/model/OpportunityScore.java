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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composite score of one evidence record. Dimension scores keep every sub-factor
 * that fed them so the result can be explained and exported column by column.
 */
public record OpportunityScore(
        RecordSummary record,
        DimensionScore clinical,
        DimensionScore evidence,
        DimensionScore market,
        double overall,
        Map<String, String> explanation,
        List<Finding> findings,
        int rank
) {
    public OpportunityScore {
        explanation = explanation == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(explanation));
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public OpportunityScore withRank(int newRank) {
        return new OpportunityScore(record, clinical, evidence, market, overall, explanation, findings, newRank);
    }

    public List<DimensionScore> dimensions() {
        return List.of(clinical, evidence, market);
    }

    /** Every sub-factor value keyed as {@code dimension.sub_factor}, in scoring order. */
    public Map<String, Double> subFactorValues() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (DimensionScore d : dimensions()) {
            for (SubFactor f : d.subFactors()) out.put(d.name() + "." + f.name(), f.value());
        }
        return out;
    }
}
