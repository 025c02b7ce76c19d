/*
 * Copyright 2026 The Cache Simulator Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.cachesim.simulator.cache;

import static java.util.Objects.requireNonNull;

/**
 * The fixed parameters of a simulated hierarchy. Every level is checked against the addressing
 * strategy when the configuration is created, so that a hierarchy is never built from parameters
 * that it cannot simulate.
 *
 * @param cores the expected number of cores; a sizing hint rather than a limit, as a private level
 *        is created for every distinct core seen in the trace
 * @param l1 the geometry of each private level
 * @param l2 the geometry of the first shared level
 * @param l3 the geometry of the last level
 * @param addressing the strategy used by every level to decompose an address
 */
public record HierarchyConfig(int cores, CacheGeometry l1,
    CacheGeometry l2, CacheGeometry l3, Addressing addressing) {

  public HierarchyConfig {
    requireNonNull(l1);
    requireNonNull(l2);
    requireNonNull(l3);
    requireNonNull(addressing);
    if (cores <= 0) {
      throw CacheConfigurationException.of("The number of cores must be positive: %,d", cores);
    }
    addressing.resolve(l1);
    addressing.resolve(l2);
    addressing.resolve(l3);
  }

  /** Returns the geometry of the given level. */
  public CacheGeometry geometry(CacheLevel level) {
    switch (level) {
      case L1:
        return l1;
      case L2:
        return l2;
      case L3:
        return l3;
      default:
        throw new IllegalArgumentException("Unknown level: " + level);
    }
  }
}
