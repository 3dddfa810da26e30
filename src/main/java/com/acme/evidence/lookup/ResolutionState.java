/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.lookup;

/** Which tier of the lookup answered a request. Tiers are tried in declaration order. */
public enum ResolutionState { STATIC, CACHE, FETCH }
