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

import com.acme.evidence.model.DimensionScore;
import com.acme.evidence.model.Finding;
import com.acme.evidence.model.OpportunityScore;
import com.acme.evidence.model.RecordSummary;
import com.acme.evidence.model.SubFactor;
import com.acme.evidence.util.ScoreUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects sub-factors, dimension scores, findings and explanation lines for one record,
 * then assembles the {@link OpportunityScore}.
 */
public final class OpportunityScoreBuilder {
    private final Map<String, DimensionScore> dimensions = new LinkedHashMap<>();
    private final Map<String, String> explanation = new LinkedHashMap<>();
    private final List<Finding> findings = new ArrayList<>();

    public void addFinding(Finding f) { if (f != null) findings.add(f); }
    public void addFindings(List<Finding> fs) { if (fs != null) fs.forEach(this::addFinding); }
    public void explain(String key, String text) { explanation.put(key, text); }

    public List<Finding> findings() { return List.copyOf(findings); }

    /** Weighted sum of already-clamped sub-factors, clamped again and rounded to two decimals. */
    public static DimensionScore dimension(String name, double weight, List<SubFactor> subFactors) {
        double sum = 0;
        for (SubFactor f : subFactors) sum += f.value() * f.weight();
        return new DimensionScore(name, ScoreUtil.round2(ScoreUtil.clampScore(sum)), weight, subFactors);
    }

    public static SubFactor subFactor(String name, double value, double weight, String basis) {
        return new SubFactor(name, ScoreUtil.clampScore(value), weight, basis);
    }

    public void putDimension(DimensionScore d) { dimensions.put(d.name(), d); }

    public DimensionScore dimension(String name) { return dimensions.get(name); }

    public OpportunityScore build(RecordSummary summary, double overall) {
        return new OpportunityScore(summary, dimensions.get(ClinicalDimension.ID), dimensions.get(EvidenceQualityDimension.ID),
                dimensions.get(MarketDimension.ID), overall, explanation, findings, 0);
    }
}
