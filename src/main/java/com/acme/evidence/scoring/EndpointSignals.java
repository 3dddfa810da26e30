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

import com.acme.evidence.model.EfficacyEndpoint;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.Enums.EndpointCategory;
import com.acme.evidence.util.TextUtil;

import java.util.List;

/**
 * Reads efficacy signals off endpoints: responder rates, improvement direction and
 * whether an endpoint counts as positive.
 */
public final class EndpointSignals {
    public static final double POSITIVE_RESPONDER_PERCENT = 30.0;
    public static final double POSITIVE_IMPROVEMENT_PERCENT = 20.0;

    // endpoints where an increase is the improvement; everything else is an activity score
    private static final List<String> INCREASE_IS_GOOD = List.of(
            "acr20", "acr50", "acr70", "acr90",
            "pasi50", "pasi75", "pasi90", "pasi100",
            "easi50", "easi75", "easi90",
            "salt50", "salt75", "salt90",
            "response", "responder", "remission",
            "quality of life", "qol", "sf-36", "sf36", "eq-5d", "eq5d",
            "facit", "well-being", "wellbeing",
            "function", "improvement",
            "iga 0", "iga 1", "clear", "almost clear",
            "regrowth", "hair growth");

    private EndpointSignals() {}

    public static boolean decreaseIsGood(String endpointName) {
        String n = TextUtil.lower(endpointName);
        for (String p : INCREASE_IS_GOOD) {
            if (n.contains(p)) return false;
        }
        return true;
    }

    /** Responder percentage, derived from the count when only a count is reported. */
    public static Double responderPercent(EfficacyEndpoint ep, Integer sampleSize) {
        if (ep.responderPercent() != null) return ep.responderPercent();
        if (ep.respondersCount() != null && sampleSize != null && sampleSize > 0) {
            return Math.min(100.0, 100.0 * ep.respondersCount() / sampleSize);
        }
        return null;
    }

    /**
     * Change from baseline in percent, signed so that a positive value is an improvement.
     * {@code null} when neither a percent change nor an absolute change with a baseline is given.
     */
    public static Double favourableChangePercent(EfficacyEndpoint ep) {
        Double pct = ep.percentChange();
        if (pct == null && ep.absoluteChange() != null && ep.baselineValue() != null && ep.baselineValue() != 0) {
            pct = 100.0 * ep.absoluteChange() / Math.abs(ep.baselineValue());
        }
        if (pct == null) return null;
        return decreaseIsGood(ep.name()) ? -pct : pct;
    }

    public static boolean isPositive(EfficacyEndpoint ep, Integer sampleSize) {
        if (ep.statisticallySignificant()) return true;
        Double pct = responderPercent(ep, sampleSize);
        if (pct != null && pct > POSITIVE_RESPONDER_PERCENT) return true;
        Double change = favourableChangePercent(ep);
        return change != null && change >= POSITIVE_IMPROVEMENT_PERCENT;
    }

    /** Record-level rate, else the primary endpoint's, else the best endpoint's; {@code null} if none. */
    public static Double responsePercent(EvidenceRecord r) {
        if (r.responderPercent() != null) return r.responderPercent();
        Integer n = r.sampleSize();
        for (EfficacyEndpoint ep : r.endpoints()) {
            if (ep.category() == EndpointCategory.PRIMARY) {
                Double pct = responderPercent(ep, n);
                if (pct != null) return pct;
            }
        }
        Double best = null;
        for (EfficacyEndpoint ep : r.endpoints()) {
            Double pct = responderPercent(ep, n);
            if (pct != null && (best == null || pct > best)) best = pct;
        }
        return best;
    }

    public static boolean hasPositiveSignal(EvidenceRecord r) {
        if (r.responderPercent() != null && r.responderPercent() > POSITIVE_RESPONDER_PERCENT) return true;
        for (EfficacyEndpoint ep : r.endpoints()) {
            if (isPositive(ep, r.sampleSize())) return true;
        }
        return false;
    }
}
