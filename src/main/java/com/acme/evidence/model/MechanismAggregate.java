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

import com.acme.evidence.model.Enums.MechanismTier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Roll-up of every scored record sharing a mechanism class, with the tournament outcome.
 * Built fresh on each run.
 *
 * @param compositeScore {@code null} when the mechanism was eliminated before the finals
 */
public record MechanismAggregate(
        String mechanism,
        String pathway,
        int paperCount,
        int uniqueDrugs,
        long totalPatients,
        Double weightedResponseRate,
        double consistencyRate,
        Integer earliestEvidenceYear,
        List<RoundResult> rounds,
        boolean convergenceBonus,
        List<String> convergingMechanisms,
        Map<String, Double> finalTerms,
        Double compositeScore,
        MechanismTier tier,
        int rank,
        List<String> sourceIds
) {
    public MechanismAggregate {
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
        convergingMechanisms = convergingMechanisms == null ? List.of() : List.copyOf(convergingMechanisms);
        finalTerms = finalTerms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(finalTerms));
        sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
    }

    public MechanismAggregate withRank(int newRank) {
        return new MechanismAggregate(mechanism, pathway, paperCount, uniqueDrugs, totalPatients, weightedResponseRate,
                consistencyRate, earliestEvidenceYear, rounds, convergenceBonus, convergingMechanisms, finalTerms,
                compositeScore, tier, newRank, sourceIds);
    }
}
