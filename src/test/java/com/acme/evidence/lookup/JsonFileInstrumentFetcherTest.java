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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileInstrumentFetcherTest {

    @TempDir
    Path dir;

    @Test
    void readsInstrumentsForNormalisedDiseaseName() throws Exception {
        Path file = dir.resolve("instruments.json");
        Files.writeString(file, "{\"Hidradenitis Suppurativa\": {\"HiSCR\": 9, \"IHS4\": 8.5}}");

        JsonFileInstrumentFetcher fetcher = new JsonFileInstrumentFetcher(file, new ObjectMapper());

        assertThat(fetcher.fetchInstruments("hidradenitis-suppurativa"))
                .containsEntry("HiSCR", 9.0)
                .containsEntry("IHS4", 8.5);
        assertThat(fetcher.fetchInstruments("Behcet disease")).isEmpty();
    }

    @Test
    void missingFileIsAnError() {
        JsonFileInstrumentFetcher fetcher = new JsonFileInstrumentFetcher(dir.resolve("absent.json"), new ObjectMapper());

        assertThatThrownBy(() -> fetcher.fetchInstruments("Psoriasis")).isInstanceOf(IOException.class);
    }
}
