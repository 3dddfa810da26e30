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

public record DimensionScore(String name, double score, double weight, List<SubFactor> subFactors) {
    public DimensionScore {
        subFactors = subFactors == null ? List.of() : List.copyOf(subFactors);
    }

    public SubFactor subFactor(String subFactorName) {
        for (SubFactor f : subFactors) {
            if (f.name().equals(subFactorName)) return f;
        }
        return null;
    }
}
