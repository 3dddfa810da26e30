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

import com.acme.evidence.TestRecords;
import com.acme.evidence.model.Enums.MechanismTier;
import com.acme.evidence.model.MechanismAggregate;
import com.acme.evidence.model.OpportunityScore;
import com.acme.evidence.model.RoundResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MechanismTournamentTest {

    private final MechanismTournament tournament = new MechanismTournament();

    private static OpportunityScore jak1() {
        return TestRecords.scored("s1", "Tofacitinib", "JAK inhibitor", "JAK-STAT", 20, 60.0, true, 2018, 7.0, 7.0);
    }

    private static OpportunityScore jak2() {
        return TestRecords.scored("s2", "Baricitinib", "JAK inhibitor", "JAK-STAT", 10, 45.0, true, 2020, 6.0, 6.0);
    }

    private static MechanismAggregate byName(List<MechanismAggregate> ranked, String mechanism) {
        return ranked.stream().filter(m -> m.mechanism().equals(mechanism)).findFirst().orElseThrow();
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> tournament.rank(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tournament.rank(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("elimination rounds")
    class Elimination {

        @Test
        void noPositiveRecordFailsSignalDetection() {
            List<MechanismAggregate> ranked = tournament.rank(List.of(
                    TestRecords.scored("s9", "Abatacept", "CTLA4-Ig", "Costimulation", 30, 20.0, false, 2019, 4.0, 4.0)));

            MechanismAggregate m = ranked.get(0);
            assertThat(m.tier()).isEqualTo(MechanismTier.HYPOTHESIS_ONLY);
            assertThat(m.compositeScore()).isNull();
            assertThat(m.rounds()).extracting(RoundResult::round).containsExactly(1);
            assertThat(m.rounds().get(0).passed()).isFalse();
            assertThat(m.finalTerms()).isEmpty();
        }

        @Test
        void singleSmallSourceFailsReplication() {
            MechanismAggregate m = tournament.rank(List.of(
                    TestRecords.scored("s9", "Anakinra", "IL-1 blocker", "IL-1", 3, 100.0, true, 2019, 8.0, 8.0))).get(0);

            assertThat(m.tier()).isEqualTo(MechanismTier.HYPOTHESIS_ONLY);
            assertThat(m.rounds()).extracting(RoundResult::passed).containsExactly(true, false);
        }

        @Test
        @DisplayName("two anonymous sources count as independent")
        void anonymousSourcesReplicate() {
            MechanismAggregate m = tournament.rank(List.of(
                    TestRecords.scored(null, "Anakinra", "IL-1 blocker", "IL-1", 1, 100.0, true, 2019, 8.0, 8.0),
                    TestRecords.scored(null, "Canakinumab", "IL-1 blocker", "IL-1", 1, 100.0, true, 2020, 8.0, 8.0))).get(0);

            assertThat(m.rounds()).hasSize(4);
            assertThat(m.compositeScore()).isNotNull();
            assertThat(m.sourceIds()).isEmpty();
        }

        @Test
        void mostlyNegativeRecordsAreInconsistent() {
            MechanismAggregate m = tournament.rank(List.of(
                    TestRecords.scored("a", "Rituximab", "CD20 depletion", "B cell", 10, 60.0, true, 2015, 7.0, 7.0),
                    TestRecords.scored("b", "Rituximab", "CD20 depletion", "B cell", 10, 10.0, false, 2016, 3.0, 3.0),
                    TestRecords.scored("c", "Ocrelizumab", "CD20 depletion", "B cell", 10, 15.0, false, 2017, 3.0, 3.0))).get(0);

            assertThat(m.tier()).isEqualTo(MechanismTier.INCONSISTENT);
            assertThat(m.compositeScore()).isNull();
            assertThat(m.consistencyRate()).isEqualTo(0.33);
            assertThat(m.rounds()).extracting(RoundResult::passed).containsExactly(true, true, false);
        }
    }

    @Nested
    @DisplayName("finals")
    class Finals {

        @Test
        @DisplayName("mechanisms sharing a surviving pathway earn the convergence bonus")
        void convergenceBonus() {
            List<MechanismAggregate> ranked = tournament.rank(List.of(jak1(), jak2(),
                    TestRecords.scored("s3", "Deucravacitinib", "TYK2 inhibitor", "jak-stat", 40, 50.0, true, 2022, 6.5, 6.5),
                    TestRecords.scored("s4", "Secukinumab", "IL-17 inhibitor", "IL-17", 40, 50.0, true, 2016, 6.5, 6.5)));

            assertThat(ranked).extracting(MechanismAggregate::mechanism)
                    .containsExactly("JAK inhibitor", "TYK2 inhibitor", "IL-17 inhibitor");
            assertThat(ranked).extracting(MechanismAggregate::rank).containsExactly(1, 2, 3);

            MechanismAggregate jak = ranked.get(0);
            assertThat(jak.compositeScore()).isEqualTo(6.81);
            assertThat(jak.tier()).isEqualTo(MechanismTier.TIER_2);
            assertThat(jak.convergenceBonus()).isTrue();
            assertThat(jak.convergingMechanisms()).containsExactly("TYK2 inhibitor");
            assertThat(jak.uniqueDrugs()).isEqualTo(2);
            assertThat(jak.totalPatients()).isEqualTo(30L);
            assertThat(jak.weightedResponseRate()).isEqualTo(55.0);
            assertThat(jak.earliestEvidenceYear()).isEqualTo(2018);
            assertThat(jak.finalTerms()).containsKeys("aggregate_clinical", "evidence_volume",
                    "mechanism_diversity", "biological_coherence");
            assertThat(jak.finalTerms().get("biological_coherence")).isEqualTo(10.0);

            assertThat(byName(ranked, "TYK2 inhibitor").compositeScore()).isEqualTo(6.04);
            MechanismAggregate il17 = byName(ranked, "IL-17 inhibitor");
            assertThat(il17.compositeScore()).isEqualTo(4.75);
            assertThat(il17.tier()).isEqualTo(MechanismTier.TIER_3);
            assertThat(il17.convergenceBonus()).isFalse();
        }

        @Test
        @DisplayName("an eliminated mechanism on the same pathway does not converge")
        void eliminatedMechanismDoesNotConverge() {
            List<MechanismAggregate> ranked = tournament.rank(List.of(jak1(), jak2(),
                    TestRecords.scored("x1", "Drug X", "Other JAK", "JAK-STAT", 10, 50.0, true, 2020, 6.0, 6.0),
                    TestRecords.scored("x2", "Drug X", "Other JAK", "JAK-STAT", 10, 5.0, false, 2020, 2.0, 2.0),
                    TestRecords.scored("x3", "Drug X", "Other JAK", "JAK-STAT", 10, 5.0, false, 2020, 2.0, 2.0)));

            MechanismAggregate jak = byName(ranked, "JAK inhibitor");
            assertThat(jak.convergenceBonus()).isFalse();
            assertThat(jak.compositeScore()).isEqualTo(5.43);
            assertThat(jak.tier()).isEqualTo(MechanismTier.TIER_3);
            assertThat(ranked).extracting(MechanismAggregate::mechanism).containsExactly("JAK inhibitor", "Other JAK");
        }

        @Test
        @DisplayName("patient totals beyond int range accumulate without wrapping")
        void hugeSampleSizesDoNotWrap() {
            MechanismAggregate m = tournament.rank(List.of(
                    TestRecords.scored("a", "Tofacitinib", "JAK inhibitor", "JAK-STAT", 1_500_000_000, 50.0, true, 2019, 6.0, 6.0),
                    TestRecords.scored("b", "Baricitinib", "JAK inhibitor", "JAK-STAT", 1_500_000_000, 50.0, true, 2020, 6.0, 6.0))).get(0);

            assertThat(m.totalPatients()).isEqualTo(3_000_000_000L);
            assertThat(m.rounds()).extracting(RoundResult::passed).containsExactly(true, true, true, true);
            assertThat(m.finalTerms().get("evidence_volume")).isEqualTo(10.0);
        }

        @Test
        @DisplayName("equally common pathways resolve by name whatever the record order")
        void pathwayTieIsOrderIndependent() {
            OpportunityScore zeta = TestRecords.scored("a", "Drug A", "Kinase blocker", "Zeta", 10, 50.0, true, 2019, 6.0, 6.0);
            OpportunityScore alpha = TestRecords.scored("b", "Drug B", "Kinase blocker", "Alpha", 10, 50.0, true, 2020, 6.0, 6.0);
            OpportunityScore partner = TestRecords.scored("c", "Drug C", "Partner", "Alpha", 10, 50.0, true, 2021, 6.0, 6.0);

            MechanismAggregate forward = byName(tournament.rank(List.of(zeta, alpha, partner)), "Kinase blocker");
            MechanismAggregate reversed = byName(tournament.rank(List.of(alpha, zeta, partner)), "Kinase blocker");

            assertThat(forward.pathway()).isEqualTo("Alpha");
            assertThat(reversed.pathway()).isEqualTo("Alpha");
            assertThat(forward.convergenceBonus()).isTrue();
            assertThat(reversed.compositeScore()).isEqualTo(forward.compositeScore());
        }

        @Test
        void drugNamesAreCountedCaseInsensitively() {
            MechanismAggregate m = tournament.rank(List.of(
                    TestRecords.scored("a", "Tofacitinib", "JAK inhibitor", "JAK-STAT", 10, 50.0, true, 2019, 6.0, 6.0),
                    TestRecords.scored("b", "tofacitinib ", "JAK inhibitor", "JAK-STAT", 10, 50.0, true, 2020, 6.0, 6.0))).get(0);

            assertThat(m.uniqueDrugs()).isEqualTo(1);
            assertThat(m.paperCount()).isEqualTo(2);
            assertThat(m.sourceIds()).containsExactly("a", "b");
        }
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        private OpportunityScore single(String source, String mechanism, Integer year) {
            return TestRecords.scored(source, "Drug " + source, mechanism, mechanism + " pathway", 10, 50.0, true, year, 6.0, 6.0);
        }

        @Test
        @DisplayName("equal composites break ties on earliest evidence, then name, with unknown years last")
        void tieBreaks() {
            List<MechanismAggregate> ranked = tournament.rank(List.of(
                    single("1", "Delta", null),
                    single("2", "Charlie", 2019),
                    single("3", "Bravo", 2015),
                    single("4", "Alpha", 2019)));

            assertThat(ranked).extracting(MechanismAggregate::compositeScore).containsOnly(ranked.get(0).compositeScore());
            assertThat(ranked).extracting(MechanismAggregate::mechanism)
                    .containsExactly("Bravo", "Alpha", "Charlie", "Delta");
        }

        @Test
        @DisplayName("equal composites rank the larger patient total first, ahead of the year rule")
        void patientTotalBreaksTiesBeforeYear() {
            // both volumes saturate at 10, so the composites match
            List<MechanismAggregate> ranked = tournament.rank(List.of(
                    TestRecords.scored("1", "Drug 1", "Alpha", "Alpha pathway", 20_000, 50.0, true, 2010, 6.0, 6.0),
                    TestRecords.scored("2", "Drug 2", "Zulu", "Zulu pathway", 50_000, 50.0, true, 2020, 6.0, 6.0)));

            assertThat(ranked.get(0).compositeScore()).isEqualTo(ranked.get(1).compositeScore());
            assertThat(ranked).extracting(MechanismAggregate::mechanism).containsExactly("Zulu", "Alpha");
        }

        @Test
        void survivorsBeforeInconsistentBeforeHypothesisOnly() {
            List<MechanismAggregate> ranked = tournament.rank(List.of(
                    TestRecords.scored("h", "Drug H", "Hypothesis", "P1", 30, 10.0, false, 2010, 2.0, 2.0),
                    TestRecords.scored("i1", "Drug I", "Inconsistent", "P2", 10, 60.0, true, 2010, 7.0, 7.0),
                    TestRecords.scored("i2", "Drug I", "Inconsistent", "P2", 10, 10.0, false, 2011, 2.0, 2.0),
                    TestRecords.scored("i3", "Drug I", "Inconsistent", "P2", 10, 10.0, false, 2012, 2.0, 2.0),
                    single("s", "Survivor", 2021)));

            assertThat(ranked).extracting(MechanismAggregate::tier).containsExactly(
                    MechanismTier.TIER_3, MechanismTier.INCONSISTENT, MechanismTier.HYPOTHESIS_ONLY);
        }

        @Test
        void blankMechanismIsUnclassified() {
            MechanismAggregate m = tournament.rank(List.of(single("u", " ", 2020))).get(0);

            assertThat(m.mechanism()).isEqualTo(MechanismTournament.UNCLASSIFIED);
        }
    }

    @Test
    void tierBoundaries() {
        assertThat(MechanismTournament.tierFor(8.0)).isEqualTo(MechanismTier.TIER_1);
        assertThat(MechanismTournament.tierFor(7.99)).isEqualTo(MechanismTier.TIER_2);
        assertThat(MechanismTournament.tierFor(4.0)).isEqualTo(MechanismTier.TIER_3);
        assertThat(MechanismTournament.tierFor(3.99)).isEqualTo(MechanismTier.HYPOTHESIS_ONLY);
    }
}
