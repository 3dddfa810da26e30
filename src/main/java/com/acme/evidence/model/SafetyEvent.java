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

import com.acme.evidence.model.Enums.Relatedness;

public record SafetyEvent(String name, boolean serious, Integer grade, Relatedness relatedness, Integer patientsAffected) {
    public SafetyEvent {
        if (name == null) name = "";
        if (relatedness == null) relatedness = Relatedness.UNKNOWN;
    }

    public static SafetyEvent of(String name, boolean serious) {
        return new SafetyEvent(name, serious, null, Relatedness.UNKNOWN, null);
    }

    /** Patients with the event; an event without a count stands for one patient. */
    public int affectedOrOne() {
        if (patientsAffected == null || patientsAffected < 1) return 1;
        return patientsAffected;
    }
}
