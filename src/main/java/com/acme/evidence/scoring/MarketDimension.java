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
import com.acme.evidence.model.MarketContext;
import com.acme.evidence.model.SubFactor;
import com.acme.evidence.util.ScoreUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Market opportunity: competitor scarcity, addressable market size and unmet need.
 */
public final class MarketDimension implements Dimension {
    public static final String ID = "market";

    @Override public String id() { return ID; }

    @Override
    public DimensionScore score(ScoringContext ctx, OpportunityScoreBuilder out) {
        ScoringWeights w = ctx.weights;
        MarketContext m = ctx.market;
        List<SubFactor> factors = new ArrayList<>();

        Integer competitors = m.approvedCompetitorCount();
        factors.add(OpportunityScoreBuilder.subFactor("competitor_scarcity", competitorScore(competitors),
                w.competitorScarcity(), competitors == null ? "competitors unknown" : competitors + " approved competitors"));

        Double size = estimateMarketSize(m);
        factors.add(OpportunityScoreBuilder.subFactor("market_size", marketSizeScore(size), w.marketSize(),
                size == null ? "market size unknown" : formatUsd(size)));
        if (size != null) out.explain("market_size", formatUsd(size));

        Double response = EndpointSignals.responsePercent(ctx.record);
        factors.add(OpportunityScoreBuilder.subFactor("unmet_need", unmetNeedScore(m, response), w.unmetNeed(),
                unmetNeedBasis(m, response)));

        return OpportunityScoreBuilder.dimension(ID, w.market(), factors);
    }

    static double competitorScore(Integer count) {
        if (count == null || count < 0) return ScoreUtil.NEUTRAL;
        if (count == 0) return 10;
        if (count <= 2) return 7;
        if (count <= 5) return 5;
        if (count <= 10) return 3;
        return 1;
    }

    /**
     * Stated market size, else population x annual cost, else population x a price set by
     * prevalence (ultra-rare under 10K patients, rare under 100K).
     */
    public static Double estimateMarketSize(MarketContext m) {
        if (m.marketSizeUsd() != null && m.marketSizeUsd() >= 0) return m.marketSizeUsd();
        Long pop = m.patientPopulation();
        if (pop == null || pop <= 0) return null;
        if (m.annualCostUsd() != null && m.annualCostUsd() > 0) return pop * m.annualCostUsd();
        return pop * prevalenceTierPrice(pop);
    }

    static double prevalenceTierPrice(long population) {
        if (population < 10_000) return 200_000;
        if (population < 100_000) return 75_000;
        return 20_000;
    }

    static double marketSizeScore(Double usd) {
        if (usd == null) return ScoreUtil.NEUTRAL;
        if (usd >= 10e9) return 10;
        if (usd >= 5e9) return 9;
        if (usd >= 1e9) return 8;
        if (usd >= 500e6) return 7;
        if (usd >= 100e6) return 6;
        if (usd >= 50e6) return 5;
        if (usd >= 10e6) return 4;
        return 2;
    }

    static double unmetNeedScore(MarketContext m, Double responsePercent) {
        if (Integer.valueOf(0).equals(m.approvedCompetitorCount()) || Boolean.TRUE.equals(m.unmetNeed())) return 10;
        Double soc = m.standardOfCareResponsePercent();
        if (soc == null || responsePercent == null) return ScoreUtil.NEUTRAL;
        if (responsePercent > soc + 10) return 10;
        if (responsePercent >= soc - 10) return 5;
        return 2;
    }

    private static String unmetNeedBasis(MarketContext m, Double response) {
        if (Integer.valueOf(0).equals(m.approvedCompetitorCount())) return "no approved therapies";
        if (Boolean.TRUE.equals(m.unmetNeed())) return "unmet need flagged";
        if (m.standardOfCareResponsePercent() == null || response == null) return "no comparison to standard of care";
        return String.format(Locale.ROOT, "%.0f%% vs %.0f%% standard of care", response, m.standardOfCareResponsePercent());
    }

    /** {@code $2.5B}, {@code $75M}, {@code $40K}, {@code $900}. */
    public static String formatUsd(double usd) {
        double abs = Math.abs(usd);
        if (abs >= 1e9) return String.format(Locale.ROOT, "$%.1fB", usd / 1e9);
        if (abs >= 1e6) return String.format(Locale.ROOT, "$%.0fM", usd / 1e6);
        if (abs >= 1e3) return String.format(Locale.ROOT, "$%.0fK", usd / 1e3);
        return String.format(Locale.ROOT, "$%.0f", usd);
    }
}
