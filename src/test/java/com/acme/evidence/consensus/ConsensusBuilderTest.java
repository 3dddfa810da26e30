/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.consensus;

import com.acme.evidence.model.ConsensusEstimate;
import com.acme.evidence.model.Enums.ConfidenceLevel;
import com.acme.evidence.model.SourceEstimate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConsensusBuilderTest {

    private final ConsensusBuilder builder = new ConsensusBuilder();

    @Nested
    @DisplayName("weighted median")
    class WeightedMedian {

        @Test
        @DisplayName("a heavily weighted recent Tier-1 source dominates older Tier-3 ones")
        void tierOneSourceDominates() {
            ConsensusEstimate c = builder.build(List.of(
                    SourceEstimate.of(204_295, 1, 2021),
                    SourceEstimate.of(1_285, 3, 2015),
                    SourceEstimate.of(449, 3, null)));

            assertThat(c.consensusValue()).isEqualTo(204_295.0);
            assertThat(c.simpleMedian()).isEqualTo(1_285.0);
            assertThat(c.rangeLow()).isEqualTo(449.0);
            assertThat(c.rangeHigh()).isEqualTo(204_295.0);
            assertThat(c.coefficientOfVariation()).isCloseTo(1.71, within(0.01));
            assertThat(c.confidence()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(c.sourceCount()).isEqualTo(3);
            assertThat(c.tier1Count()).isEqualTo(1);
            assertThat(c.highQualityCount()).isEqualTo(1);
        }

        @Test
        void evenExpandedCountAveragesMiddleValues() {
            ConsensusEstimate c = builder.build(List.of(SourceEstimate.of(100, 3, null), SourceEstimate.of(120, 3, null)));

            assertThat(c.consensusValue()).isEqualTo(110.0);
            assertThat(c.confidence()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(c.rationale()).startsWith("Only two sources");
        }

        @Test
        void resultDoesNotDependOnInputOrder() {
            List<SourceEstimate> in = new ArrayList<>(List.of(
                    SourceEstimate.of(100, 1, 2022),
                    SourceEstimate.of(150, 3, 2010),
                    SourceEstimate.of(200, 3, 2012),
                    new SourceEstimate("registry", 180, 2, 2021, 25_000_000L)));
            ConsensusEstimate forward = builder.build(in);
            Collections.reverse(in);

            assertThat(builder.build(in)).isEqualTo(forward);
        }
    }

    @Nested
    @DisplayName("confidence ladder")
    class Confidence {

        @Test
        void agreeingHighQualitySourcesAreHigh() {
            ConsensusEstimate c = builder.build(List.of(
                    SourceEstimate.of(100, 1, 2021), SourceEstimate.of(110, 2, 2019), SourceEstimate.of(105, 1, 2023)));

            assertThat(c.confidence()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(c.highQualityCount()).isEqualTo(3);
        }

        @Test
        void tierOneWithModerateSpreadIsModerate() {
            ConsensusEstimate c = builder.build(List.of(
                    SourceEstimate.of(100, 1, 2021), SourceEstimate.of(150, 3, 2015), SourceEstimate.of(200, 3, 2015)));

            assertThat(c.coefficientOfVariation()).isCloseTo(0.333, within(0.001));
            assertThat(c.confidence()).isEqualTo(ConfidenceLevel.MODERATE);
        }

        @Test
        void threeLowTierSourcesAreLowModerate() {
            ConsensusEstimate c = builder.build(List.of(
                    SourceEstimate.of(100, 3, 2021), SourceEstimate.of(150, 3, 2015), SourceEstimate.of(200, 3, 2015)));

            assertThat(c.confidence()).isEqualTo(ConfidenceLevel.LOW_MODERATE);
        }

        @Test
        void twoWildlyDifferentSourcesAreVeryLow() {
            ConsensusEstimate c = builder.build(List.of(SourceEstimate.of(10, 1, 2021), SourceEstimate.of(1000, 1, 2021)));

            assertThat(c.confidence()).isEqualTo(ConfidenceLevel.VERY_LOW);
        }

        @Test
        void singleSourceDependsOnTier() {
            ConsensusEstimate tier1 = builder.build(List.of(SourceEstimate.of(5000, 1, 2022)));
            ConsensusEstimate tier3 = builder.build(List.of(SourceEstimate.of(5000, 3, 2022)));

            assertThat(tier1.confidence()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(tier1.rationale()).isEqualTo("Single Tier-1 source");
            assertThat(tier1.coefficientOfVariation()).isZero();
            assertThat(tier1.consensusValue()).isEqualTo(5000.0);
            assertThat(tier3.confidence()).isEqualTo(ConfidenceLevel.VERY_LOW);
        }
    }

    @Nested
    @DisplayName("invalid input")
    class InvalidInput {

        @Test
        void emptyOrNullIsRejected() {
            assertThatThrownBy(() -> builder.build(List.of())).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> builder.build(null)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void nonFiniteValuesAreDropped() {
            ConsensusEstimate c = builder.build(List.of(SourceEstimate.of(Double.NaN, 1, 2021), SourceEstimate.of(300, 2, 2020)));

            assertThat(c.sourceCount()).isEqualTo(1);
            assertThat(c.consensusValue()).isEqualTo(300.0);
        }

        @Test
        void onlyNonFiniteValuesIsRejected() {
            assertThatThrownBy(() -> builder.build(List.of(SourceEstimate.of(Double.POSITIVE_INFINITY, 1, 2021))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("No finite estimate");
        }
    }

    @Test
    void weightCombinesTierRecencyAndScale() {
        assertThat(ConsensusBuilder.weight(new SourceEstimate("gbd", 1, 1, 2021, 20_000_000L))).isCloseTo(5.85, within(1e-9));
        assertThat(ConsensusBuilder.weight(SourceEstimate.of(1, 2, 2019))).isEqualTo(2.0);
        assertThat(ConsensusBuilder.weight(SourceEstimate.of(1, 3, 2020))).isEqualTo(1.5);
        assertThat(ConsensusBuilder.weight(SourceEstimate.of(1, 0, null))).isEqualTo(3.0);
        assertThat(ConsensusBuilder.weight(SourceEstimate.of(1, 7, null))).isEqualTo(1.0);
    }

    @Test
    void coefficientOfVariationUsesSampleStandardDeviation() {
        assertThat(ConsensusBuilder.coefficientOfVariation(List.of(100.0, 150.0, 200.0))).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(ConsensusBuilder.coefficientOfVariation(List.of(42.0))).isZero();
        assertThat(ConsensusBuilder.coefficientOfVariation(List.of(-1.0, 1.0))).isZero();
    }
}
