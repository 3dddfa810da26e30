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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fetched instrument mapping as held by an {@link InstrumentCache}. A {@code negative}
 * entry records a failed or empty fetch and lives for the shorter negative TTL.
 */
public record CachedInstruments(Map<String, Double> instruments, Instant fetchedAt, boolean negative) {
    public CachedInstruments {
        instruments = instruments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(instruments));
    }

    public static CachedInstruments of(Map<String, Double> instruments, Instant fetchedAt) {
        return new CachedInstruments(instruments, fetchedAt, false);
    }

    public static CachedInstruments failed(Instant fetchedAt) {
        return new CachedInstruments(Map.of(), fetchedAt, true);
    }

    public boolean isFresh(Instant now, Duration ttl, Duration negativeTtl) {
        Duration limit = negative ? negativeTtl : ttl;
        return fetchedAt != null && fetchedAt.plus(limit).isAfter(now);
    }
}
