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

import com.acme.evidence.model.Enums.EndpointCategory;

/**
 * One efficacy outcome reported by a source. Every numeric field is optional;
 * the extraction step fills in what the paper states.
 */
public record EfficacyEndpoint(
        String name,
        EndpointCategory category,
        Integer respondersCount,
        Double responderPercent,
        boolean statisticallySignificant,
        String pValue,
        Double percentChange,
        Double absoluteChange,
        Double baselineValue,
        String timepoint
) {
    public EfficacyEndpoint {
        if (name == null) name = "";
        if (category == null) category = EndpointCategory.SECONDARY;
    }

    public static EfficacyEndpoint responders(String name, EndpointCategory category, double pct, boolean significant) {
        return new EfficacyEndpoint(name, category, null, pct, significant, null, null, null, null, null);
    }

    public boolean hasPValue() { return pValue != null && !pValue.isBlank(); }

    public boolean hasQuantitativeResult() {
        return responderPercent != null || respondersCount != null || percentChange != null || absoluteChange != null;
    }
}
