/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence;

import com.acme.evidence.lookup.CaffeineInstrumentCache;
import com.acme.evidence.lookup.InstrumentFetcher;
import com.acme.evidence.lookup.InstrumentLookupStore;
import com.acme.evidence.lookup.StaticInstrumentTable;
import com.acme.evidence.model.DimensionScore;
import com.acme.evidence.model.EfficacyEndpoint;
import com.acme.evidence.model.Enums.EndpointCategory;
import com.acme.evidence.model.Enums.VenueType;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.MarketContext;
import com.acme.evidence.model.OpportunityScore;
import com.acme.evidence.model.PublicationInfo;
import com.acme.evidence.model.RecordSummary;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Shared fixtures for scoring and ranking tests. */
public final class TestRecords {
    private TestRecords() {}

    /** Single ACR20 primary endpoint, 85% responders, N=60, peer reviewed, 18 months follow-up. */
    public static EvidenceRecord acr20Record() {
        return new EvidenceRecord("PMID:1001", "Upadacitinib", "Rheumatoid arthritis", "JAK inhibitor", "JAK-STAT",
                60, 85.0, null,
                List.of(new EfficacyEndpoint("ACR20", EndpointCategory.PRIMARY, null, 85.0, true, "p<0.001",
                        null, null, null, "week 52")),
                List.of(),
                new PublicationInfo(VenueType.PEER_REVIEWED, 2022, "18 months", "Ann Rheum Dis", "Open-label extension"));
    }

    public static MarketContext favourableMarket() {
        return new MarketContext(0, null, null, 12e9, true, null);
    }

    public static InstrumentLookupStore staticOnlyLookup() {
        return new InstrumentLookupStore(StaticInstrumentTable.defaults(),
                new CaffeineInstrumentCache(Duration.ofDays(90)), InstrumentFetcher.NONE, Clock.systemUTC(),
                Duration.ofDays(90), Duration.ofDays(1), Duration.ofSeconds(5), Runnable::run);
    }

    public static EvidenceRecord record(String sourceId, Integer n, List<EfficacyEndpoint> endpoints) {
        return new EvidenceRecord(sourceId, "Drug " + sourceId, "Rheumatoid arthritis", "JAK inhibitor", "JAK-STAT",
                n, null, null, endpoints, List.of(), PublicationInfo.unknown());
    }

    /** A scored record built directly, for ranking tests that do not need the scorer. */
    public static OpportunityScore scored(String sourceId, String drug, String mechanism, String pathway, int patients,
                                          Double responderPercent, boolean positive, Integer year,
                                          double clinical, double overall) {
        RecordSummary summary = new RecordSummary(sourceId, drug, "Rheumatoid arthritis", mechanism, pathway,
                patients, responderPercent, positive, year);
        return new OpportunityScore(summary,
                new DimensionScore("clinical", clinical, 0.50, List.of()),
                new DimensionScore("evidence", 5.0, 0.25, List.of()),
                new DimensionScore("market", 5.0, 0.25, List.of()),
                overall, Map.of(), List.of(), 0);
    }
}
