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

import java.util.Optional;

/**
 * Storage behind {@link InstrumentLookupStore}. Keys are normalised disease names.
 * Implementations must be safe for concurrent use; writes are last-writer-wins.
 */
public interface InstrumentCache {
    Optional<CachedInstruments> get(String diseaseKey);

    void put(String diseaseKey, CachedInstruments entry);

    void invalidate(String diseaseKey);

    long size();
}
