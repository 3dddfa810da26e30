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

import com.acme.evidence.lookup.InstrumentLookupStore;
import com.acme.evidence.lookup.LookupResult;
import com.acme.evidence.model.DimensionScore;
import com.acme.evidence.model.EfficacyEndpoint;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.Finding;
import com.acme.evidence.model.MarketContext;
import com.acme.evidence.model.OpportunityScore;
import com.acme.evidence.model.RecordSummary;
import com.acme.evidence.util.ScoreUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Scores one evidence record on the clinical, evidence-quality and market dimensions and
 * combines them into the overall opportunity score.
 *
 * <p>Scoring is deterministic for a given lookup result: the same record and market context
 * always give the same score.
 */
public class CompositeScorer {
    private static final Logger log = LoggerFactory.getLogger(CompositeScorer.class);

    private final InstrumentLookupStore lookup;
    private final ScoringWeights weights;
    private final List<Dimension> dimensions;

    public CompositeScorer(InstrumentLookupStore lookup) {
        this(lookup, ScoringWeights.defaults());
    }

    public CompositeScorer(InstrumentLookupStore lookup, ScoringWeights weights) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.weights = Objects.requireNonNull(weights, "weights");
        this.dimensions = List.of(new ClinicalDimension(), new EvidenceQualityDimension(), new MarketDimension());
    }

    public ScoringWeights weights() { return weights; }

    public OpportunityScore score(EvidenceRecord record, MarketContext market) {
        Objects.requireNonNull(record, "record");
        List<Finding> inputFindings = new ArrayList<>();
        EvidenceRecord clean = RecordSanitizer.sanitize(record, inputFindings);

        List<String> labels = new ArrayList<>();
        for (EfficacyEndpoint ep : clean.endpoints()) labels.add(ep.name());
        LookupResult instruments = lookup.lookup(clean.disease(), labels);

        ScoringContext ctx = new ScoringContext(clean, instruments, market, weights);
        OpportunityScoreBuilder out = new OpportunityScoreBuilder();
        out.addFindings(inputFindings);

        for (Dimension d : dimensions) {
            DimensionScore ds = d.score(ctx, out);
            out.putDimension(ds);
            out.explain(d.id(), ScoreUtil.interpret(ds.score(), label(d.id())) + fmt(" (%.1f/10)", ds.score()));
        }

        double overall = ScoreUtil.round1(ScoreUtil.clampScore(
                weights.clinical() * out.dimension(ClinicalDimension.ID).score()
                        + weights.evidence() * out.dimension(EvidenceQualityDimension.ID).score()
                        + weights.market() * out.dimension(MarketDimension.ID).score()));
        out.explain("overall", ScoreUtil.interpret(overall, "overall opportunity") + fmt(" (%.1f/10)", overall));

        RecordSummary summary = new RecordSummary(clean.sourceId(), clean.drugName(), clean.disease(),
                clean.mechanismClass(), clean.pathway(),
                clean.sampleSize() == null ? 0 : clean.sampleSize(),
                EndpointSignals.responsePercent(clean),
                EndpointSignals.hasPositiveSignal(clean),
                clean.publication().year());

        log.debug("Scored {} ({} / {}): overall {}", clean.sourceId(), clean.drugName(), clean.disease(), overall);
        return out.build(summary, overall);
    }

    /** Scores every record with the market context of its disease (unknown when absent). */
    public List<OpportunityScore> scoreAll(List<EvidenceRecord> records, Map<String, MarketContext> marketByDisease) {
        List<OpportunityScore> out = new ArrayList<>(records.size());
        for (EvidenceRecord r : records) {
            out.add(score(r, marketFor(r.disease(), marketByDisease)));
        }
        return out;
    }

    /** Market context keyed by disease name, compared case-insensitively. */
    public static MarketContext marketFor(String disease, Map<String, MarketContext> marketByDisease) {
        if (disease == null || marketByDisease == null) return MarketContext.unknown();
        for (Map.Entry<String, MarketContext> e : marketByDisease.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(disease.trim())) return e.getValue();
        }
        return MarketContext.unknown();
    }

    private static String label(String dimensionId) {
        return switch (dimensionId) {
            case ClinicalDimension.ID -> "clinical signal";
            case EvidenceQualityDimension.ID -> "evidence quality";
            case MarketDimension.ID -> "market opportunity";
            default -> dimensionId;
        };
    }

    private static String fmt(String pattern, double v) {
        return String.format(Locale.ROOT, pattern, v);
    }
}
