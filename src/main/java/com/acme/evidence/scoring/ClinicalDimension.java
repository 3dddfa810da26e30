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

import com.acme.evidence.model.CategoryAssignment;
import com.acme.evidence.model.DimensionScore;
import com.acme.evidence.model.EfficacyEndpoint;
import com.acme.evidence.model.Enums.EndpointCategory;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.SafetyEvent;
import com.acme.evidence.model.SubFactor;
import com.acme.evidence.taxonomy.OrganDomain;
import com.acme.evidence.taxonomy.SafetyCategory;
import com.acme.evidence.taxonomy.Taxonomies;
import com.acme.evidence.taxonomy.TaxonomyClassifier;
import com.acme.evidence.util.ScoreUtil;
import com.acme.evidence.util.TextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Clinical signal: response magnitude, endpoint quality, organ-domain breadth and safety.
 */
public final class ClinicalDimension implements Dimension {
    private static final Logger log = LoggerFactory.getLogger(ClinicalDimension.class);

    public static final String ID = "clinical";
    static final double AD_HOC_ENDPOINT_SCORE = 4.0;

    @Override public String id() { return ID; }

    @Override
    public DimensionScore score(ScoringContext ctx, OpportunityScoreBuilder out) {
        ScoringWeights w = ctx.weights;
        List<SubFactor> factors = new ArrayList<>();
        factors.add(responseMagnitude(ctx, w.responseMagnitude()));
        factors.add(endpointQuality(ctx, w.endpointQuality()));
        factors.add(organBreadth(ctx, w.organBreadth()));
        factors.add(safety(ctx, w.safety()));
        return OpportunityScoreBuilder.dimension(ID, w.clinical(), factors);
    }

    static double responseScore(Double pct) {
        if (pct == null) return ScoreUtil.NEUTRAL;
        if (pct > 80) return 10;
        if (pct >= 60) return 8;
        if (pct >= 40) return 6;
        if (pct >= 20) return 4;
        return 2;
    }

    static double organBreadthScore(int domains) {
        if (domains >= 5) return 10;
        return switch (domains) {
            case 4 -> 9;
            case 3 -> 7.5;
            case 2 -> 6;
            case 1 -> 4;
            default -> 3;
        };
    }

    private SubFactor responseMagnitude(ScoringContext ctx, double weight) {
        Double pct = EndpointSignals.responsePercent(ctx.record);
        String basis = pct == null ? "no response data" : String.format(Locale.ROOT, "%.1f%% responders", pct);
        return OpportunityScoreBuilder.subFactor("response_magnitude", responseScore(pct), weight, basis);
    }

    private SubFactor endpointQuality(ScoringContext ctx, double weight) {
        List<EfficacyEndpoint> endpoints = ctx.record.endpoints();
        if (endpoints.isEmpty()) {
            return OpportunityScoreBuilder.subFactor("endpoint_quality", ScoreUtil.NEUTRAL, weight, "no endpoints");
        }
        double sum = 0;
        int adHoc = 0;
        for (EfficacyEndpoint ep : endpoints) {
            double base = instrumentScore(ep.name(), ctx.instruments.instruments());
            if (base == AD_HOC_ENDPOINT_SCORE) adHoc++;
            double s = base;
            if (ep.category() == EndpointCategory.PRIMARY) s += 1.0;
            if (ep.statisticallySignificant()) s += 1.0;
            if (ep.hasPValue()) s += 0.5;
            if (ep.category() == EndpointCategory.EXPLORATORY) s -= 1.0;
            sum += ScoreUtil.clampScore(s);
        }
        String basis = endpoints.size() + " endpoints, " + adHoc + " without a known instrument";
        return OpportunityScoreBuilder.subFactor("endpoint_quality", sum / endpoints.size(), weight, basis);
    }

    /** Best instrument named by the label (either string containing the other), else the generic tier, else ad-hoc. */
    static double instrumentScore(String endpointName, Map<String, Double> instruments) {
        String name = TextUtil.lower(endpointName);
        if (name.isBlank()) return AD_HOC_ENDPOINT_SCORE;
        Double best = null;
        for (Map.Entry<String, Double> e : instruments.entrySet()) {
            String inst = TextUtil.lower(e.getKey());
            if (inst.isBlank()) continue;
            if (name.contains(inst) || inst.contains(name)) {
                if (best == null || e.getValue() > best) best = e.getValue();
            }
        }
        if (best != null) return best;
        Optional<CategoryAssignment<Integer>> generic = TaxonomyClassifier.classify(name, Taxonomies.INSTRUMENT_QUALITY);
        return generic.map(a -> a.category().doubleValue()).orElse(AD_HOC_ENDPOINT_SCORE);
    }

    private SubFactor organBreadth(ScoringContext ctx, double weight) {
        Set<OrganDomain> domains = new LinkedHashSet<>();
        for (EfficacyEndpoint ep : ctx.record.endpoints()) {
            if (!EndpointSignals.isPositive(ep, ctx.record.sampleSize())) continue;
            TaxonomyClassifier.classify(ep.name(), Taxonomies.ORGAN_DOMAINS).ifPresent(a -> domains.add(a.category()));
        }
        String basis = domains.isEmpty() ? "no positive endpoint in a known domain" : "domains " + domains;
        return OpportunityScoreBuilder.subFactor("organ_breadth", organBreadthScore(domains.size()), weight, basis);
    }

    private SubFactor safety(ScoringContext ctx, double weight) {
        EvidenceRecord r = ctx.record;
        Map<SafetyCategory, Long> affected = new LinkedHashMap<>();
        for (SafetyEvent e : r.safetyEvents()) {
            Optional<CategoryAssignment<SafetyCategory>> a = TaxonomyClassifier.classify(e.name(), Taxonomies.SAFETY_SIGNALS);
            if (a.isEmpty()) {
                log.debug("Safety event '{}' matched no category", e.name());
                continue;
            }
            affected.merge(a.get().category(), (long) e.affectedOrOne(), ScoreUtil::saturatedAdd);
        }
        double penalty = 0;
        Integer n = ctx.sampleSize();
        List<String> hits = new ArrayList<>();
        for (Map.Entry<SafetyCategory, Long> e : affected.entrySet()) {
            SafetyCategory c = e.getKey();
            double p = categoryPenalty(c, e.getValue(), n);
            penalty += p;
            hits.add(c.id() + "=" + ScoreUtil.round2(p));
        }
        String basis = hits.isEmpty() ? "no categorised safety signals" : "penalties " + String.join(", ", hits);
        return OpportunityScoreBuilder.subFactor("safety", 10.0 - penalty, weight, basis);
    }

    /** {@code base x (0.5 + 5 x rate)}, factor 1.0 without a sample size; critical categories capped at twice the base. */
    static double categoryPenalty(SafetyCategory c, long affected, Integer sampleSize) {
        double factor;
        if (sampleSize == null || sampleSize <= 0) {
            factor = 1.0;
        } else {
            double rate = ScoreUtil.clamp((double) affected / sampleSize, 0.0, 1.0);
            factor = 0.5 + 5.0 * rate;
        }
        double p = c.basePenalty() * factor;
        if (c.critical()) p = Math.min(p, 2.0 * c.basePenalty());
        return p;
    }
}
