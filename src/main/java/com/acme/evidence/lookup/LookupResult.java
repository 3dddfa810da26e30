/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.lookup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instrument name to quality score (1-10) for one disease, plus the tier that resolved it.
 */
public record LookupResult(Map<String, Double> instruments, ResolutionState resolvedBy) {
    public LookupResult {
        instruments = instruments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(instruments));
    }

    public boolean isEmpty() { return instruments.isEmpty(); }
}
