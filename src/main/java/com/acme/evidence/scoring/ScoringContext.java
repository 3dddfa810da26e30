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

import com.acme.evidence.lookup.LookupResult;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.MarketContext;

/** Everything a {@link Dimension} reads while scoring one record. */
public final class ScoringContext {
    public final EvidenceRecord record;
    public final LookupResult instruments;
    public final MarketContext market;
    public final ScoringWeights weights;

    public ScoringContext(EvidenceRecord record, LookupResult instruments, MarketContext market, ScoringWeights weights) {
        this.record = record;
        this.instruments = instruments;
        this.market = market == null ? MarketContext.unknown() : market;
        this.weights = weights;
    }

    /** Sample size when positive, otherwise {@code null}. */
    public Integer sampleSize() {
        Integer n = record.sampleSize();
        return n != null && n > 0 ? n : null;
    }
}
