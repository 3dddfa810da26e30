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

import com.acme.evidence.util.TextUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetcher backed by a JSON file of {@code {"disease": {"instrument": score}}}. The file is
 * re-read on every call so edits take effect on the next cache miss.
 */
public class JsonFileInstrumentFetcher implements InstrumentFetcher {
    private static final TypeReference<Map<String, Map<String, Double>>> SHAPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileInstrumentFetcher(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public Map<String, Double> fetchInstruments(String disease) throws IOException {
        if (!Files.isRegularFile(file)) throw new IOException("Instrument file not found: " + file);
        Map<String, Map<String, Double>> all = mapper.readValue(file.toFile(), SHAPE);
        String wanted = TextUtil.normalizeKey(disease);
        for (Map.Entry<String, Map<String, Double>> e : all.entrySet()) {
            if (TextUtil.normalizeKey(e.getKey()).equals(wanted) && e.getValue() != null) {
                return new LinkedHashMap<>(e.getValue());
            }
        }
        return Map.of();
    }
}
