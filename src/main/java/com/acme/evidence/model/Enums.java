/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.model;

import com.fasterxml.jackson.annotation.JsonValue;

public final class Enums {
    private Enums() {}

    public enum Severity { OK, WARN, ERROR }

    public enum EndpointCategory { PRIMARY, SECONDARY, EXPLORATORY }

    public enum Relatedness { RELATED, POSSIBLY_RELATED, UNRELATED, UNKNOWN }

    public enum VenueType { PEER_REVIEWED, PREPRINT, CONFERENCE_ABSTRACT, OTHER, UNKNOWN }

    public enum SeverityTier {
        CRITICAL(3.0), HIGH(2.0), MODERATE(1.0), LOW(0.5);

        private final double basePenalty;
        SeverityTier(double basePenalty) { this.basePenalty = basePenalty; }
        public double basePenalty() { return basePenalty; }
    }

    public enum DurabilityClass {
        LONG_TERM(9.0), MEDIUM_TERM(6.0), SHORT_TERM(3.0);

        private final double score;
        DurabilityClass(double score) { this.score = score; }
        public double score() { return score; }
    }

    public enum ConfidenceLevel {
        HIGH("High"), MODERATE("Moderate"), LOW_MODERATE("Low-Moderate"), LOW("Low"), VERY_LOW("Very Low");

        private final String label;
        ConfidenceLevel(String label) { this.label = label; }
        @JsonValue public String label() { return label; }
        @Override public String toString() { return label; }
    }

    public enum MechanismTier {
        TIER_1("Tier 1 (High Confidence)"),
        TIER_2("Tier 2 (Moderate)"),
        TIER_3("Tier 3 (Hypothesis-Generating)"),
        INCONSISTENT("Inconsistent"),
        HYPOTHESIS_ONLY("Hypothesis Only");

        private final String label;
        MechanismTier(String label) { this.label = label; }
        @JsonValue public String label() { return label; }
        public boolean ranked() { return this == TIER_1 || this == TIER_2 || this == TIER_3; }
        @Override public String toString() { return label; }
    }
}
