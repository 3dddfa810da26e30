/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.scoring;

import com.acme.evidence.model.DimensionScore;

public interface Dimension {
    String id();
    DimensionScore score(ScoringContext ctx, OpportunityScoreBuilder out);
}
