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

/**
 * Market intelligence for the disease of a record. Any field may be unknown.
 */
public record MarketContext(
        Integer approvedCompetitorCount,
        Long patientPopulation,
        Double annualCostUsd,
        Double marketSizeUsd,
        Boolean unmetNeed,
        Double standardOfCareResponsePercent
) {
    public static MarketContext unknown() {
        return new MarketContext(null, null, null, null, null, null);
    }
}
