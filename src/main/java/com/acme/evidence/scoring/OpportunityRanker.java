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

import com.acme.evidence.model.OpportunityScore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Orders scored records: overall desc, then clinical desc, then sample size desc. Ranks start at 1. */
public final class OpportunityRanker {
    static final Comparator<OpportunityScore> ORDER = Comparator
            .comparingDouble(OpportunityScore::overall).reversed()
            .thenComparing(Comparator.comparingDouble((OpportunityScore s) -> s.clinical().score()).reversed())
            .thenComparing(Comparator.comparingInt((OpportunityScore s) -> s.record().patients()).reversed());

    private OpportunityRanker() {}

    public static List<OpportunityScore> rank(List<OpportunityScore> scores) {
        List<OpportunityScore> sorted = new ArrayList<>(scores);
        sorted.sort(ORDER);
        List<OpportunityScore> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) out.add(sorted.get(i).withRank(i + 1));
        return out;
    }
}
