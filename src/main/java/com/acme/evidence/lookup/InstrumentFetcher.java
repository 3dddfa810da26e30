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

import java.util.Map;

/**
 * Collaborator that discovers validated instruments for a disease the static table
 * does not cover (in production an LLM or curated service).
 */
@FunctionalInterface
public interface InstrumentFetcher {
    InstrumentFetcher NONE = disease -> Map.of();

    /** Instrument name to quality score 1-10. May throw; the store degrades to an empty mapping. */
    Map<String, Double> fetchInstruments(String disease) throws Exception;
}
