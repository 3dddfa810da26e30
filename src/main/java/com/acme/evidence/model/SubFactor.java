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

/**
 * One named input to a dimension score, kept for explainability and export.
 *
 * @param value  clamped to [1,10]
 * @param basis  short description of what the value was derived from
 */
public record SubFactor(String name, double value, double weight, String basis) {}
