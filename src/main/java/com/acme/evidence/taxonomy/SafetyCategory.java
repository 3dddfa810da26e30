/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.taxonomy;

import com.acme.evidence.model.Enums.SeverityTier;

/**
 * MedDRA-aligned safety signal category with the metadata the safety sub-factor uses.
 */
public record SafetyCategory(String id, String description, SeverityTier severityTier, boolean regulatoryFlag, String meddraSoc) {
    public double basePenalty() { return severityTier.basePenalty(); }
    public boolean critical() { return severityTier == SeverityTier.CRITICAL; }
}
