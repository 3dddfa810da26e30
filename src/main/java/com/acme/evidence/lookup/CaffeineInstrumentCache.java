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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * Default {@link InstrumentCache}. Caffeine bounds memory and drops entries after the
 * positive TTL; the store still checks freshness against its own clock.
 */
public class CaffeineInstrumentCache implements InstrumentCache {
    public static final long DEFAULT_MAX_SIZE = 10_000;

    private final Cache<String, CachedInstruments> cache;

    public CaffeineInstrumentCache(Duration ttl) {
        this(ttl, DEFAULT_MAX_SIZE);
    }

    public CaffeineInstrumentCache(Duration ttl, long maxSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .build();
    }

    @Override
    public Optional<CachedInstruments> get(String diseaseKey) {
        return Optional.ofNullable(cache.getIfPresent(diseaseKey));
    }

    @Override
    public void put(String diseaseKey, CachedInstruments entry) {
        cache.put(diseaseKey, entry);
    }

    @Override
    public void invalidate(String diseaseKey) {
        cache.invalidate(diseaseKey);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }
}
