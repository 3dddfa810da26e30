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
import com.acme.evidence.model.EfficacyEndpoint;
import com.acme.evidence.model.Enums.DurabilityClass;
import com.acme.evidence.model.Enums.EndpointCategory;
import com.acme.evidence.model.Enums.VenueType;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.PublicationInfo;
import com.acme.evidence.model.SubFactor;
import com.acme.evidence.taxonomy.Taxonomies;
import com.acme.evidence.taxonomy.TaxonomyClassifier;
import com.acme.evidence.util.ScoreUtil;
import com.acme.evidence.util.TextUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Evidence quality: sample size, publication venue, durability of follow-up and data completeness.
 */
public final class EvidenceQualityDimension implements Dimension {
    public static final String ID = "evidence";
    static final int COMPLETENESS_CHECKS = 10;

    @Override public String id() { return ID; }

    @Override
    public DimensionScore score(ScoringContext ctx, OpportunityScoreBuilder out) {
        ScoringWeights w = ctx.weights;
        EvidenceRecord r = ctx.record;
        List<SubFactor> factors = new ArrayList<>();

        Integer n = ctx.sampleSize();
        factors.add(OpportunityScoreBuilder.subFactor("sample_size", sampleSizeScore(n), w.sampleSize(),
                n == null ? "sample size not reported" : "N=" + n));

        PublicationInfo pub = r.publication();
        factors.add(OpportunityScoreBuilder.subFactor("publication_venue", venueScore(pub), w.publicationVenue(),
                pub.venueType() + (TextUtil.isBlank(pub.journal()) ? "" : " (" + pub.journal() + ")")));

        factors.add(durability(r, w.durability()));

        int points = completenessPoints(r);
        factors.add(OpportunityScoreBuilder.subFactor("completeness", Math.max(1, points), w.completeness(),
                points + "/" + COMPLETENESS_CHECKS + " fields present"));

        return OpportunityScoreBuilder.dimension(ID, w.evidence(), factors);
    }

    static double sampleSizeScore(Integer n) {
        if (n == null) return ScoreUtil.NEUTRAL;
        if (n >= 20) return 10;
        if (n >= 15) return 9;
        if (n >= 10) return 8;
        if (n >= 5) return 6;
        if (n >= 3) return 4;
        if (n >= 2) return 2;
        return 1;
    }

    static double venueScore(PublicationInfo pub) {
        VenueType v = pub.venueType();
        return switch (v) {
            case PEER_REVIEWED -> 10;
            case PREPRINT -> 6;
            case CONFERENCE_ABSTRACT -> 4;
            case OTHER -> 2;
            case UNKNOWN -> TextUtil.isBlank(pub.journal()) ? ScoreUtil.NEUTRAL : 8;
        };
    }

    static Double followUpScore(Double months) {
        if (months == null || months <= 0) return null;
        if (months >= 24) return 10.0;
        if (months >= 12) return 9.0;
        if (months >= 6) return 7.0;
        if (months >= 3) return 5.0;
        if (months >= 1) return 3.0;
        return 2.0;
    }

    private SubFactor durability(EvidenceRecord r, double weight) {
        Double months = TextUtil.parseMonths(r.publication().followUpDuration());
        Double followUp = followUpScore(months);

        DurabilityClass best = null;
        int sustained = 0;
        for (EfficacyEndpoint ep : r.endpoints()) {
            DurabilityClass c = TaxonomyClassifier.classify(ep.timepoint(), Taxonomies.TIMEPOINTS)
                    .map(a -> a.category()).orElse(null);
            if (c == null) continue;
            if (c != DurabilityClass.SHORT_TERM) sustained++;
            if (best == null || c.score() > best.score()) best = c;
        }

        if (followUp == null && best == null) {
            return OpportunityScoreBuilder.subFactor("durability", ScoreUtil.NEUTRAL, weight, "follow-up unknown");
        }
        double base = Math.max(followUp == null ? 0 : followUp, best == null ? 0 : best.score());
        double bonus = Math.min(1.0, 0.5 * Math.max(0, sustained - 1));
        String basis = (months == null ? "no parsable follow-up" : ScoreUtil.round1(months) + " months follow-up")
                + (best == null ? "" : ", best timepoint " + best)
                + (bonus > 0 ? ", +" + bonus + " for " + sustained + " sustained endpoints" : "");
        return OpportunityScoreBuilder.subFactor("durability", base + bonus, weight, basis);
    }

    static int completenessPoints(EvidenceRecord r) {
        int p = 0;
        if (!TextUtil.isBlank(r.drugName())) p++;
        if (!TextUtil.isBlank(r.disease())) p++;
        if (r.sampleSize() != null && r.sampleSize() > 0) p++;
        if (r.publication().year() != null) p++;
        if (r.publication().venueType() != VenueType.UNKNOWN) p++;
        if (!TextUtil.isBlank(r.publication().followUpDuration())) p++;
        if (!r.endpoints().isEmpty()) p++;
        if (r.endpoints().stream().anyMatch(e -> e.category() == EndpointCategory.PRIMARY)) p++;
        if (r.responderPercent() != null || r.endpoints().stream().anyMatch(EfficacyEndpoint::hasQuantitativeResult)) p++;
        if (!TextUtil.isBlank(r.efficacySummary())) p++;
        return p;
    }
}
