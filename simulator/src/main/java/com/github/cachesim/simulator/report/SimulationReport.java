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
package com.github.cachesim.simulator.report;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;

import com.github.cachesim.simulator.cache.CacheHierarchy;
import com.github.cachesim.simulator.cache.CacheLevel;
import com.github.cachesim.simulator.cache.CacheStats;

/**
 * The outcome of replaying a trace through a hierarchy.
 *
 * @param l1 the combined statistics of every private level
 * @param l2 the statistics of the first shared level
 * @param l3 the statistics of the last level
 * @param cores the number of distinct cores that issued an access
 * @param processed the number of records replayed
 * @param skipped the number of malformed records that were not replayed
 * @param elapsed the time spent replaying the trace
 */
public record SimulationReport(CacheStats l1, CacheStats l2, CacheStats l3,
    int cores, long processed, long skipped, Duration elapsed) {

  public SimulationReport {
    requireNonNull(l1);
    requireNonNull(l2);
    requireNonNull(l3);
    requireNonNull(elapsed);
    checkArgument(processed >= 0, "processed: %s", processed);
    checkArgument(skipped >= 0, "skipped: %s", skipped);
  }

  /**
   * Returns the report of the hierarchy's current state, summing the counters of every private
   * level and reading the shared levels directly.
   */
  public static SimulationReport from(CacheHierarchy hierarchy,
      long processed, long skipped, Duration elapsed) {
    return new SimulationReport(hierarchy.l1Stats(), hierarchy.l2Stats(), hierarchy.l3Stats(),
        hierarchy.coreCount(), processed, skipped, elapsed);
  }

  /** Returns the statistics of the level. */
  public CacheStats stats(CacheLevel level) {
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
