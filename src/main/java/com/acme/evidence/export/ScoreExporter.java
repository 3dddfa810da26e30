/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.export;

import com.acme.evidence.model.Enums.Severity;
import com.acme.evidence.model.Finding;
import com.acme.evidence.model.MechanismAggregate;
import com.acme.evidence.model.OpportunityScore;
import com.acme.evidence.model.RoundResult;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens scores into tabular rows (one column per sub-factor, keyed {@code dimension.sub_factor})
 * and writes them as CSV.
 */
public final class ScoreExporter {
    private static final CsvMapper CSV = new CsvMapper();

    public static final List<String> FINDING_COLUMNS = List.of("source_id", "severity", "category", "message");

    private ScoreExporter() {}

    public static List<Map<String, Object>> opportunityRows(List<OpportunityScore> scores) {
        List<Map<String, Object>> rows = new ArrayList<>(scores.size());
        for (OpportunityScore s : scores) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("rank", s.rank());
            row.put("source_id", s.record().sourceId());
            row.put("drug", s.record().drugName());
            row.put("disease", s.record().disease());
            row.put("mechanism", s.record().mechanismClass());
            row.put("pathway", s.record().pathway());
            row.put("patients", s.record().patients());
            row.put("responder_percent", s.record().responderPercent());
            row.put("positive_signal", s.record().positiveSignal());
            row.put("year", s.record().year());
            row.put("overall", s.overall());
            row.put("clinical", s.clinical().score());
            row.put("evidence", s.evidence().score());
            row.put("market", s.market().score());
            row.putAll(s.subFactorValues());
            row.put("warnings", s.findings().stream().filter(f -> f.severity() != Severity.OK).count());
            rows.add(row);
        }
        return rows;
    }

    public static List<Map<String, Object>> mechanismRows(List<MechanismAggregate> mechanisms) {
        List<Map<String, Object>> rows = new ArrayList<>(mechanisms.size());
        for (MechanismAggregate m : mechanisms) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("rank", m.rank());
            row.put("mechanism", m.mechanism());
            row.put("pathway", m.pathway());
            row.put("tier", m.tier().label());
            row.put("composite_score", m.compositeScore());
            row.put("paper_count", m.paperCount());
            row.put("unique_drugs", m.uniqueDrugs());
            row.put("total_patients", m.totalPatients());
            row.put("weighted_response_rate", m.weightedResponseRate());
            row.put("consistency_rate", m.consistencyRate());
            row.put("earliest_evidence_year", m.earliestEvidenceYear());
            row.put("convergence_bonus", m.convergenceBonus());
            row.put("converging_mechanisms", String.join("; ", m.convergingMechanisms()));
            row.put("failed_round", failedRound(m.rounds()));
            m.finalTerms().forEach((k, v) -> row.put("term." + k, v));
            rows.add(row);
        }
        return rows;
    }

    /** Findings of every score, one row each, for audit of clamped inputs. */
    public static List<Map<String, Object>> findingRows(List<OpportunityScore> scores) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (OpportunityScore s : scores) {
            for (Finding f : s.findings()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("source_id", s.record().sourceId());
                row.put("severity", f.severity().name());
                row.put("category", f.category());
                row.put("message", f.message());
                rows.add(row);
            }
        }
        return rows;
    }

    public static void writeCsv(List<Map<String, Object>> rows, Path file) throws IOException {
        writeCsv(rows, file, List.of());
    }

    public static void writeCsv(List<Map<String, Object>> rows, Path file, List<String> headerColumns) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeCsv(rows, w, headerColumns);
        }
    }

    public static void writeCsv(List<Map<String, Object>> rows, Writer out) throws IOException {
        writeCsv(rows, out, List.of());
    }

    /**
     * Header is {@code headerColumns} followed by the remaining row keys in first-seen order; absent cells
     * stay empty. With no columns at all nothing is written.
     */
    public static void writeCsv(List<Map<String, Object>> rows, Writer out, List<String> headerColumns) throws IOException {
        Set<String> columns = new LinkedHashSet<>(headerColumns);
        for (Map<String, Object> row : rows) columns.addAll(row.keySet());
        if (columns.isEmpty()) {
            out.flush();
            return;
        }
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        for (String c : columns) schema.addColumn(c);
        try (SequenceWriter seq = CSV.writer(schema.build()).writeValues(out)) {
            for (Map<String, Object> row : rows) {
                Map<String, Object> full = new LinkedHashMap<>();
                for (String c : columns) full.put(c, row.get(c));
                seq.write(full);
            }
        }
    }

    private static Integer failedRound(List<RoundResult> rounds) {
        for (RoundResult r : rounds) {
            if (!r.passed()) return r.round();
        }
        return null;
    }
}
