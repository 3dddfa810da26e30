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

/** The fields of a scored record that the mechanism tournament and exports need. */
public record RecordSummary(
        String sourceId,
        String drugName,
        String disease,
        String mechanismClass,
        String pathway,
        int patients,
        Double responderPercent,
        boolean positiveSignal,
        Integer year
) {}
