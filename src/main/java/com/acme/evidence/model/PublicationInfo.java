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

import com.acme.evidence.model.Enums.VenueType;

public record PublicationInfo(VenueType venueType, Integer year, String followUpDuration, String journal, String title) {
    public PublicationInfo {
        if (venueType == null) venueType = VenueType.UNKNOWN;
    }

    public static PublicationInfo unknown() {
        return new PublicationInfo(VenueType.UNKNOWN, null, null, null, null);
    }
}
