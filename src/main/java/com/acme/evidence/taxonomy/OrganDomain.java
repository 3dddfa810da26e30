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

public enum OrganDomain {
    MUSCULOSKELETAL,
    MUCOCUTANEOUS,
    RENAL,
    NEUROLOGICAL,
    HEMATOLOGICAL,
    CARDIOPULMONARY,
    IMMUNOLOGICAL,
    SYSTEMIC,
    GASTROINTESTINAL,
    OCULAR,
    CONSTITUTIONAL
}
