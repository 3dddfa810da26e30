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

import com.acme.evidence.consensus.ConsensusBuilder;
import com.acme.evidence.export.ScoreExporter;
import com.acme.evidence.lookup.CaffeineInstrumentCache;
import com.acme.evidence.lookup.InstrumentFetcher;
import com.acme.evidence.lookup.InstrumentLookupStore;
import com.acme.evidence.lookup.JsonFileInstrumentFetcher;
import com.acme.evidence.lookup.StaticInstrumentTable;
import com.acme.evidence.model.ConsensusEstimate;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.Finding;
import com.acme.evidence.model.MarketContext;
import com.acme.evidence.model.MechanismAggregate;
import com.acme.evidence.model.OpportunityScore;
import com.acme.evidence.model.SourceEstimate;
import com.acme.evidence.scoring.CompositeScorer;
import com.acme.evidence.scoring.OpportunityRanker;
import com.acme.evidence.scoring.ScoringWeights;
import com.acme.evidence.tournament.MechanismTournament;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

@CommandLine.Command(
        name = "evidence-priority",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Scores structured clinical evidence records, ranks mechanisms of action and builds consensus estimates.",
        sortOptions = false,
        defaultValueProvider = CommandLine.PropertiesDefaultProvider.class
)
public class EvidencePriorityApp implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(EvidencePriorityApp.class);

    static final int EXIT_RANKED = 0;
    static final int EXIT_NOTHING_RANKED = 1;
    static final int EXIT_INPUT_ERROR = 2;

    @CommandLine.Option(names = "--records", required = true, description = "JSON array of evidence records (snake_case).")
    private Path records;

    @CommandLine.Option(names = "--estimates", description = "JSON array of {disease, metric, estimates[]} sets for consensus.")
    private Path estimates;

    @CommandLine.Option(names = "--market", description = "JSON object mapping disease name to market context.")
    private Path market;

    @CommandLine.Option(names = "--instruments", description = "JSON file of {disease: {instrument: score}} used when the built-in table has no match.")
    private Path instruments;

    @CommandLine.Option(names = "--out", description = "Output JSON report path. Default: evidence_priority_<timestamp>.json")
    private String out;

    @CommandLine.Option(names = "--csv-dir", description = "Optional directory for opportunities.csv, mechanisms.csv and findings.csv.")
    private Path csvDir;

    @CommandLine.Option(names = "--clinical-weight", defaultValue = "0.50", description = "Clinical dimension weight. Default: ${DEFAULT-VALUE}")
    private double clinicalWeight;

    @CommandLine.Option(names = "--evidence-weight", defaultValue = "0.25", description = "Evidence dimension weight. Default: ${DEFAULT-VALUE}")
    private double evidenceWeight;

    @CommandLine.Option(names = "--market-weight", defaultValue = "0.25", description = "Market dimension weight. Default: ${DEFAULT-VALUE}")
    private double marketWeight;

    @CommandLine.Option(names = "--cache-ttl-days", defaultValue = "90", description = "Instrument cache TTL in days. Default: ${DEFAULT-VALUE}")
    private long cacheTtlDays;

    @CommandLine.Option(names = "--negative-ttl-hours", defaultValue = "24", description = "TTL for failed instrument fetches, in hours. Default: ${DEFAULT-VALUE}")
    private long negativeTtlHours;

    @CommandLine.Option(names = "--fetch-timeout-seconds", defaultValue = "30", description = "Instrument fetch timeout. Default: ${DEFAULT-VALUE}")
    private long fetchTimeoutSeconds;

    @CommandLine.Option(names = "--threads", defaultValue = "4", description = "Worker threads for scoring. Default: ${DEFAULT-VALUE}")
    private int threads;

    /** Input shape for one consensus run. */
    public record EstimateSet(String disease, String metric, List<SourceEstimate> estimates) {}

    static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new EvidencePriorityApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        List<Finding> findings = new ArrayList<>();
        List<EvidenceRecord> input;
        Map<String, MarketContext> markets;
        List<EstimateSet> estimateSets;
        ScoringWeights weights;
        try {
            input = MAPPER.readValue(records.toFile(), new TypeReference<List<EvidenceRecord>>() {});
            markets = market == null ? Map.of()
                    : MAPPER.readValue(market.toFile(), new TypeReference<LinkedHashMap<String, MarketContext>>() {});
            estimateSets = estimates == null ? List.of()
                    : MAPPER.readValue(estimates.toFile(), new TypeReference<List<EstimateSet>>() {});
            weights = ScoringWeights.defaults().withDimensions(clinicalWeight, evidenceWeight, marketWeight);
            if (threads < 1) throw new IllegalArgumentException("--threads must be at least 1");
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot read inputs: {}", e.getMessage());
            System.err.println("Input error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        if (input == null || input.isEmpty()) {
            System.err.println("Input error: no evidence records in " + records);
            return EXIT_INPUT_ERROR;
        }
        log.info("Loaded {} evidence records, {} market contexts, {} estimate sets",
                input.size(), markets.size(), estimateSets.size());

        InstrumentFetcher fetcher = instruments == null
                ? InstrumentFetcher.NONE
                : new JsonFileInstrumentFetcher(instruments, MAPPER);
        Duration ttl = Duration.ofDays(cacheTtlDays);
        InstrumentLookupStore lookup = new InstrumentLookupStore(StaticInstrumentTable.defaults(),
                new CaffeineInstrumentCache(ttl), fetcher, Clock.systemUTC(), ttl,
                Duration.ofHours(negativeTtlHours), Duration.ofSeconds(fetchTimeoutSeconds), ForkJoinPool.commonPool());
        CompositeScorer scorer = new CompositeScorer(lookup, weights);

        List<OpportunityScore> scored = scoreParallel(scorer, input, markets, findings);
        List<OpportunityScore> ranked = OpportunityRanker.rank(scored);
        List<MechanismAggregate> mechanisms = ranked.isEmpty() ? List.of() : new MechanismTournament().rank(ranked);

        List<Map<String, Object>> consensus = new ArrayList<>();
        ConsensusBuilder consensusBuilder = new ConsensusBuilder();
        for (EstimateSet set : estimateSets) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("disease", set.disease());
            o.put("metric", set.metric());
            try {
                ConsensusEstimate c = consensusBuilder.build(set.estimates());
                o.put("consensus", c);
            } catch (IllegalArgumentException e) {
                findings.add(Finding.warn("CONSENSUS", "No consensus for " + set.disease() + "/" + set.metric() + ": " + e.getMessage()));
                o.put("consensus", null);
            }
            consensus.add(o);
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp_utc", Instant.now().toString());
        report.put("tool", Map.of("name", "evidence_priority", "version", "java-1.0.0"));
        report.put("host", Map.of(
                "os", System.getProperty("os.name"),
                "java", System.getProperty("java.version")
        ));
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("records", records.toString());
        inputs.put("estimates", estimates == null ? null : estimates.toString());
        inputs.put("market", market == null ? null : market.toString());
        inputs.put("instruments", instruments == null ? null : instruments.toString());
        report.put("inputs", inputs);
        report.put("weights", weights);
        report.put("summary", summary(input.size(), ranked, mechanisms));
        report.put("opportunities", ranked);
        report.put("mechanisms", mechanisms);
        report.put("consensus", consensus);

        List<Map<String, Object>> findingsOut = new ArrayList<>();
        for (Finding f : findings) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("severity", f.severity().toString());
            o.put("category", f.category());
            o.put("message", f.message());
            if (f.details() != null) o.put("details", f.details());
            findingsOut.add(o);
        }
        report.put("findings", findingsOut);

        String outPath = (out != null && !out.isBlank())
                ? out
                : "evidence_priority_" + Instant.now().toString().replace(":", "").replace(".", "") + ".json";
        MAPPER.writeValue(Path.of(outPath).toFile(), report);

        if (csvDir != null) {
            ScoreExporter.writeCsv(ScoreExporter.opportunityRows(ranked), csvDir.resolve("opportunities.csv"));
            ScoreExporter.writeCsv(ScoreExporter.mechanismRows(mechanisms), csvDir.resolve("mechanisms.csv"));
            ScoreExporter.writeCsv(ScoreExporter.findingRows(ranked), csvDir.resolve("findings.csv"),
                    ScoreExporter.FINDING_COLUMNS);
        }

        System.out.println("\n=== Evidence Priority ===");
        System.out.println("Records scored: " + ranked.size() + " of " + input.size());
        if (!ranked.isEmpty()) {
            OpportunityScore top = ranked.get(0);
            System.out.println("Top opportunity: " + top.record().drugName() + " / " + top.record().disease()
                    + " (" + top.overall() + ")");
        }
        for (MechanismAggregate m : mechanisms) {
            System.out.println("  #" + m.rank() + " " + m.mechanism() + ": " + m.tier()
                    + (m.compositeScore() == null ? "" : " (" + m.compositeScore() + ")"));
        }
        System.out.println("Report: " + outPath + "\n");

        boolean anyRanked = mechanisms.stream().anyMatch(m -> m.tier().ranked());
        return anyRanked ? EXIT_RANKED : EXIT_NOTHING_RANKED;
    }

    private List<OpportunityScore> scoreParallel(CompositeScorer scorer, List<EvidenceRecord> input,
                                                 Map<String, MarketContext> markets, List<Finding> findings)
            throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, input.size()));
        try {
            List<Future<OpportunityScore>> futures = new ArrayList<>(input.size());
            for (EvidenceRecord r : input) {
                futures.add(pool.submit(() -> scorer.score(r, CompositeScorer.marketFor(r.disease(), markets))));
            }
            List<OpportunityScore> out = new ArrayList<>(input.size());
            for (int i = 0; i < futures.size(); i++) {
                EvidenceRecord r = input.get(i);
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    // null array elements are reported by position
                    String id = r == null ? "#" + (i + 1) : String.valueOf(r.sourceId());
                    log.warn("Scoring failed for record {}: {}", id, cause.toString());
                    findings.add(Finding.err("SCORING", "Record '" + id + "' could not be scored: " + cause.getMessage(),
                            Map.of("source_id", id)));
                }
            }
            return out;
        } finally {
            pool.shutdown();
        }
    }

    static Map<String, Object> summary(int records, List<OpportunityScore> ranked, List<MechanismAggregate> mechanisms) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("records", records);
        s.put("scored", ranked.size());
        s.put("failed", records - ranked.size());
        s.put("mechanisms", mechanisms.size());
        s.put("ranked_mechanisms", mechanisms.stream().filter(m -> m.tier().ranked()).count());
        s.put("top_mechanism", mechanisms.isEmpty() ? null : mechanisms.get(0).mechanism());
        return s;
    }
}
