/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.tournament;

import com.acme.evidence.model.Enums.MechanismTier;
import com.acme.evidence.model.MechanismAggregate;
import com.acme.evidence.model.OpportunityScore;
import com.acme.evidence.model.RecordSummary;
import com.acme.evidence.model.RoundResult;
import com.acme.evidence.util.ScoreUtil;
import com.acme.evidence.util.TextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ranks mechanisms of action by the evidence behind them. Scored records are grouped by
 * mechanism class and run through four rounds:
 * <ol>
 *   <li>Signal detection: at least one positive record.</li>
 *   <li>Replication: two independent sources or five patients in total.</li>
 *   <li>Consistency: at least half of the records positive.</li>
 *   <li>Convergence: another surviving mechanism on the same pathway earns a 15% bonus.</li>
 * </ol>
 * Mechanisms failing rounds 1-3 are eliminated with no composite. Survivors get a composite of
 * aggregate clinical strength, evidence volume, mechanism diversity and biological coherence.
 */
public class MechanismTournament {
    private static final Logger log = LoggerFactory.getLogger(MechanismTournament.class);

    public static final String UNCLASSIFIED = "Unclassified";
    public static final double CONVERGENCE_BONUS = 1.15;
    static final int MIN_INDEPENDENT_SOURCES = 2;
    static final int MIN_TOTAL_PATIENTS = 5;
    static final double MIN_CONSISTENCY = 0.5;

    static final double W_CLINICAL = 0.40;
    static final double W_VOLUME = 0.30;
    static final double W_DIVERSITY = 0.20;
    static final double W_COHERENCE = 0.10;

    /** Working state for one mechanism while the rounds run. */
    private static final class Entrant {
        final String mechanism;
        final List<OpportunityScore> scores = new ArrayList<>();
        final List<RoundResult> rounds = new ArrayList<>();
        String pathway;
        int uniqueDrugs;
        long totalPatients;
        int independentSources;
        int positives;
        Double weightedResponse;
        double weightedClinical;
        Integer earliestYear;
        List<String> sourceIds = List.of();
        MechanismTier eliminatedAs;

        Entrant(String mechanism) { this.mechanism = mechanism; }

        double consistency() { return scores.isEmpty() ? 0 : (double) positives / scores.size(); }
        boolean survived() { return eliminatedAs == null; }
    }

    public List<MechanismAggregate> rank(List<OpportunityScore> scores) {
        if (scores == null || scores.isEmpty()) {
            throw new IllegalArgumentException("Cannot rank mechanisms without scored records");
        }

        Map<String, Entrant> entrants = new LinkedHashMap<>();
        for (OpportunityScore s : scores) {
            String mech = TextUtil.isBlank(s.record().mechanismClass()) ? UNCLASSIFIED : s.record().mechanismClass().trim();
            entrants.computeIfAbsent(mech, Entrant::new).scores.add(s);
        }
        for (Entrant e : entrants.values()) {
            summarise(e);
            runGates(e);
        }

        List<MechanismAggregate> out = new ArrayList<>();
        for (Entrant e : entrants.values()) out.add(finals(e, entrants.values()));

        out.sort(ORDER);
        List<MechanismAggregate> ranked = new ArrayList<>(out.size());
        for (int i = 0; i < out.size(); i++) ranked.add(out.get(i).withRank(i + 1));
        log.info("Ranked {} mechanisms from {} records", ranked.size(), scores.size());
        return ranked;
    }

    private static void summarise(Entrant e) {
        Set<String> drugs = new LinkedHashSet<>();
        Set<String> sources = new LinkedHashSet<>();
        Map<String, Integer> pathways = new LinkedHashMap<>();
        double rrSum = 0, rrWeight = 0, clinSum = 0, clinWeight = 0;
        int anonymous = 0;

        for (OpportunityScore s : e.scores) {
            RecordSummary r = s.record();
            if (!TextUtil.isBlank(r.drugName())) drugs.add(TextUtil.lower(r.drugName().trim()));
            if (TextUtil.isBlank(r.sourceId())) anonymous++;
            else sources.add(r.sourceId().trim());
            if (!TextUtil.isBlank(r.pathway())) pathways.merge(r.pathway().trim(), 1, Integer::sum);
            int n = Math.max(0, r.patients());
            e.totalPatients = ScoreUtil.saturatedAdd(e.totalPatients, n);
            double w = Math.max(n, 1);
            if (r.responderPercent() != null) {
                rrSum += r.responderPercent() * w;
                rrWeight += w;
            }
            clinSum += s.clinical().score() * w;
            clinWeight += w;
            if (r.positiveSignal()) e.positives++;
            if (r.year() != null && (e.earliestYear == null || r.year() < e.earliestYear)) e.earliestYear = r.year();
        }

        e.uniqueDrugs = drugs.size();
        e.independentSources = sources.size() + anonymous;
        e.sourceIds = new ArrayList<>(sources);
        e.weightedResponse = rrWeight > 0 ? rrSum / rrWeight : null;
        e.weightedClinical = clinWeight > 0 ? clinSum / clinWeight : ScoreUtil.NEUTRAL;
        // most frequent pathway; equal counts go to the alphabetically first name
        e.pathway = pathways.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey).orElse(null);
    }

    private static void runGates(Entrant e) {
        boolean signal = e.positives >= 1;
        e.rounds.add(new RoundResult(1, "Signal Detection", signal,
                e.positives + " of " + e.scores.size() + " records positive"));
        if (!signal) {
            e.eliminatedAs = MechanismTier.HYPOTHESIS_ONLY;
            return;
        }

        boolean replicated = e.independentSources >= MIN_INDEPENDENT_SOURCES || e.totalPatients >= MIN_TOTAL_PATIENTS;
        e.rounds.add(new RoundResult(2, "Replication", replicated,
                e.independentSources + " independent sources, " + e.totalPatients + " patients"));
        if (!replicated) {
            e.eliminatedAs = MechanismTier.HYPOTHESIS_ONLY;
            return;
        }

        boolean consistent = e.consistency() >= MIN_CONSISTENCY;
        e.rounds.add(new RoundResult(3, "Consistency", consistent,
                String.format(Locale.ROOT, "%.0f%% of records positive", e.consistency() * 100)));
        if (!consistent) e.eliminatedAs = MechanismTier.INCONSISTENT;
    }

    private static MechanismAggregate finals(Entrant e, Iterable<Entrant> all) {
        List<String> converging = new ArrayList<>();
        Map<String, Double> terms = new LinkedHashMap<>();
        Double composite = null;
        MechanismTier tier = e.eliminatedAs;

        if (e.survived()) {
            if (!TextUtil.isBlank(e.pathway)) {
                for (Entrant other : all) {
                    if (other != e && other.survived() && other.pathway != null
                            && other.pathway.equalsIgnoreCase(e.pathway)) {
                        converging.add(other.mechanism);
                    }
                }
            }
            boolean converges = !converging.isEmpty();
            e.rounds.add(new RoundResult(4, "Convergence", true, converges
                    ? "Shares pathway " + e.pathway + " with " + String.join(", ", converging)
                    : "No other surviving mechanism on this pathway"));

            double aggregateClinical = e.weightedResponse == null
                    ? e.weightedClinical
                    : 0.6 * (e.weightedResponse / 10.0) + 0.4 * e.weightedClinical;
            double volume = 2.5 * Math.log10(1 + (double) e.totalPatients * e.scores.size());
            double diversity = (2 + 2 * Math.min(e.uniqueDrugs, 4)) * e.consistency();
            double coherence = converges ? 10 : 5;

            terms.put("aggregate_clinical", ScoreUtil.round2(ScoreUtil.clampScore(aggregateClinical)));
            terms.put("evidence_volume", ScoreUtil.round2(ScoreUtil.clampScore(volume)));
            terms.put("mechanism_diversity", ScoreUtil.round2(ScoreUtil.clampScore(diversity)));
            terms.put("biological_coherence", ScoreUtil.round2(ScoreUtil.clampScore(coherence)));

            double raw = W_CLINICAL * ScoreUtil.clampScore(aggregateClinical)
                    + W_VOLUME * ScoreUtil.clampScore(volume)
                    + W_DIVERSITY * ScoreUtil.clampScore(diversity)
                    + W_COHERENCE * ScoreUtil.clampScore(coherence);
            if (converges) raw *= CONVERGENCE_BONUS;
            composite = ScoreUtil.round2(ScoreUtil.clampScore(raw));
            tier = tierFor(composite);
            log.debug("Mechanism {} composite {} -> {}", e.mechanism, composite, tier);
        } else {
            log.debug("Mechanism {} eliminated as {}", e.mechanism, tier);
        }

        return new MechanismAggregate(e.mechanism, e.pathway, e.scores.size(), e.uniqueDrugs, e.totalPatients,
                e.weightedResponse == null ? null : ScoreUtil.round2(e.weightedResponse),
                ScoreUtil.round2(e.consistency()), e.earliestYear, e.rounds, !converging.isEmpty(), converging,
                terms, composite, tier, 0, e.sourceIds);
    }

    static MechanismTier tierFor(double composite) {
        if (composite >= 8) return MechanismTier.TIER_1;
        if (composite >= 6) return MechanismTier.TIER_2;
        if (composite >= 4) return MechanismTier.TIER_3;
        return MechanismTier.HYPOTHESIS_ONLY;
    }

    // survivors, then Inconsistent, then Hypothesis Only
    private static int bracket(MechanismAggregate m) {
        if (m.compositeScore() != null) return 0;
        return m.tier() == MechanismTier.INCONSISTENT ? 1 : 2;
    }

    static final Comparator<MechanismAggregate> ORDER = Comparator
            .comparingInt(MechanismTournament::bracket)
            .thenComparing(Comparator.comparingDouble(
                    (MechanismAggregate m) -> m.compositeScore() == null ? 0.0 : m.compositeScore()).reversed())
            .thenComparing(Comparator.comparingLong(MechanismAggregate::totalPatients).reversed())
            .thenComparing(MechanismAggregate::earliestEvidenceYear, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(MechanismAggregate::mechanism);
}
