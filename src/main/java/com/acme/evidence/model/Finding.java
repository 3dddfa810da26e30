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

import com.acme.evidence.model.Enums.Severity;

public record Finding(Severity severity, String category, String message, Object details) {
    public static Finding warn(String c, String m) { return new Finding(Severity.WARN, c, m, null); }
    public static Finding warn(String c, String m, Object d) { return new Finding(Severity.WARN, c, m, d); }
    public static Finding err(String c, String m, Object d) { return new Finding(Severity.ERROR, c, m, d); }
}
