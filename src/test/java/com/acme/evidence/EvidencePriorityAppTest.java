/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EvidencePriorityAppTest {

    private static final String ACR20_RECORD = "{"
            + "\"source_id\": \"PMID:1001\", \"drug_name\": \"Upadacitinib\", \"disease\": \"Rheumatoid arthritis\","
            + "\"mechanism_class\": \"JAK inhibitor\", \"pathway\": \"JAK-STAT\", \"sample_size\": 60,"
            + "\"responder_percent\": 85.0,"
            + "\"endpoints\": [{\"name\": \"ACR20\", \"category\": \"primary\", \"responder_percent\": 85.0,"
            + "  \"statistically_significant\": true, \"timepoint\": \"week 52\"}],"
            + "\"publication\": {\"venue_type\": \"peer_reviewed\", \"year\": 2022, \"follow_up_duration\": \"18 months\","
            + "  \"journal\": \"Ann Rheum Dis\"}"
            + "}";

    private static final String MARKET = "{\"Rheumatoid arthritis\": {\"approved_competitor_count\": 0,"
            + " \"market_size_usd\": 12000000000, \"unmet_need\": true}}";

    private static final String ESTIMATES = "[{\"disease\": \"Rheumatoid arthritis\", \"metric\": \"prevalence\","
            + " \"estimates\": ["
            + "  {\"source_id\": \"gbd\", \"value\": 204295, \"quality_tier\": 1, \"year\": 2021},"
            + "  {\"source_id\": \"survey\", \"value\": 1285, \"quality_tier\": 3, \"year\": 2015},"
            + "  {\"source_id\": \"clinic\", \"value\": 449, \"quality_tier\": 3}]},"
            + " {\"disease\": \"Psoriasis\", \"metric\": \"prevalence\", \"estimates\": []}]";

    @TempDir
    Path dir;

    private Path records;
    private Path market;
    private Path report;

    @BeforeEach
    void writeInputs() throws Exception {
        records = Files.writeString(dir.resolve("records.json"), "[" + ACR20_RECORD + "]");
        market = Files.writeString(dir.resolve("market.json"), MARKET);
        report = dir.resolve("report.json");
    }

    private static int run(String... args) {
        return new CommandLine(new EvidencePriorityApp()).execute(args);
    }

    @Test
    @DisplayName("scores, ranks and writes the JSON report")
    void writesReport() throws Exception {
        Path estimates = Files.writeString(dir.resolve("estimates.json"), ESTIMATES);

        int code = run("--records", records.toString(), "--market", market.toString(),
                "--estimates", estimates.toString(), "--out", report.toString());

        assertThat(code).isEqualTo(EvidencePriorityApp.EXIT_RANKED);
        JsonNode root = EvidencePriorityApp.MAPPER.readTree(report.toFile());
        assertThat(root.path("summary").path("scored").asInt()).isEqualTo(1);

        JsonNode top = root.path("opportunities").get(0);
        assertThat(top.path("rank").asInt()).isEqualTo(1);
        assertThat(top.path("overall").asDouble()).isEqualTo(9.3);
        assertThat(top.path("clinical").path("score").asDouble()).isEqualTo(8.8);

        JsonNode mechanism = root.path("mechanisms").get(0);
        assertThat(mechanism.path("mechanism").asText()).isEqualTo("JAK inhibitor");
        assertThat(mechanism.path("composite_score").asDouble()).isCloseTo(6.09, within(1e-9));
        assertThat(mechanism.path("tier").asText()).isEqualTo("Tier 2 (Moderate)");

        JsonNode consensus = root.path("consensus").get(0).path("consensus");
        assertThat(consensus.path("consensus_value").asDouble()).isEqualTo(204295.0);
        assertThat(consensus.path("confidence").asText()).isEqualTo("Low");
        assertThat(root.path("consensus").get(1).path("consensus").isNull()).isTrue();
        assertThat(root.path("findings").get(0).path("category").asText()).isEqualTo("CONSENSUS");
    }

    @Test
    void writesCsvExportsWhenAsked() throws Exception {
        Path csv = dir.resolve("csv");

        int code = run("--records", records.toString(), "--market", market.toString(),
                "--out", report.toString(), "--csv-dir", csv.toString());

        assertThat(code).isEqualTo(EvidencePriorityApp.EXIT_RANKED);
        assertThat(csv.resolve("opportunities.csv")).exists();
        assertThat(csv.resolve("mechanisms.csv")).exists();
        assertThat(Files.readAllLines(csv.resolve("findings.csv"))).containsExactly("source_id,severity,category,message");
    }

    @Test
    void nullRecordBecomesAScoringError() throws Exception {
        Path withNull = Files.writeString(dir.resolve("with-null.json"), "[" + ACR20_RECORD + ", null]");

        int code = run("--records", withNull.toString(), "--out", report.toString());

        assertThat(code).isEqualTo(EvidencePriorityApp.EXIT_RANKED);
        JsonNode root = EvidencePriorityApp.MAPPER.readTree(report.toFile());
        assertThat(root.path("summary").path("scored").asInt()).isEqualTo(1);
        assertThat(root.path("summary").path("failed").asInt()).isEqualTo(1);
        JsonNode error = root.path("findings").get(0);
        assertThat(error.path("severity").asText()).isEqualTo("ERROR");
        assertThat(error.path("category").asText()).isEqualTo("SCORING");
        assertThat(error.path("details").path("source_id").asText()).isEqualTo("#2");
    }

    @Test
    void nothingRankedExitsWithOne() throws Exception {
        Path weak = Files.writeString(dir.resolve("weak.json"), "[{\"source_id\": \"PMID:9\", \"drug_name\": \"X\","
                + " \"disease\": \"Psoriasis\", \"mechanism_class\": \"Unknown\", \"sample_size\": 4,"
                + " \"responder_percent\": 10.0}]");

        assertThat(run("--records", weak.toString(), "--out", report.toString()))
                .isEqualTo(EvidencePriorityApp.EXIT_NOTHING_RANKED);
    }

    @Test
    void missingRecordsFileIsAnInputError() {
        assertThat(run("--records", dir.resolve("absent.json").toString(), "--out", report.toString()))
                .isEqualTo(EvidencePriorityApp.EXIT_INPUT_ERROR);
        assertThat(report).doesNotExist();
    }

    @Test
    void weightsThatDoNotSumToOneAreAnInputError() {
        assertThat(run("--records", records.toString(), "--clinical-weight", "0.9", "--out", report.toString()))
                .isEqualTo(EvidencePriorityApp.EXIT_INPUT_ERROR);
    }

    @Test
    void emptyRecordArrayIsAnInputError() throws Exception {
        Path empty = Files.writeString(dir.resolve("empty.json"), "[]");

        assertThat(run("--records", empty.toString(), "--out", report.toString()))
                .isEqualTo(EvidencePriorityApp.EXIT_INPUT_ERROR);
    }
}
