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

import java.util.List;

/**
 * One literature source's structured data for a drug-disease pair, as handed over
 * by the extraction step. Immutable: list arguments are copied.
 */
public record EvidenceRecord(
        String sourceId,
        String drugName,
        String disease,
        String mechanismClass,
        String pathway,
        Integer sampleSize,
        Double responderPercent,
        String efficacySummary,
        List<EfficacyEndpoint> endpoints,
        List<SafetyEvent> safetyEvents,
        PublicationInfo publication
) {
    public EvidenceRecord {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        safetyEvents = safetyEvents == null ? List.of() : List.copyOf(safetyEvents);
        if (publication == null) publication = PublicationInfo.unknown();
    }
}
