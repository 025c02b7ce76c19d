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
package com.github.cachesim.simulator.report.text;

import static java.util.Locale.US;

import com.github.cachesim.simulator.cache.CacheLevel;
import com.github.cachesim.simulator.cache.CacheStats;
import com.github.cachesim.simulator.report.SimulationReport;
import com.github.cachesim.simulator.report.TextReporter;
import com.typesafe.config.Config;

/**
 * A plain text report of the hits and misses at each level, such as
 * <pre>{@code
 *   Cache Statistics:
 *   L1: 8 hits, 2 misses
 *   L2: 0 hits, 2 misses
 *   L3: 0 hits, 2 misses
 * }</pre>
 * A trailing line with the number of skipped records is added only if the trace had malformed
 * records.
 */
public final class StatisticsReporter extends TextReporter {

  public StatisticsReporter(Config config) {
    super(config);
  }

  @Override
  protected String assemble(SimulationReport report) {
    var output = new StringBuilder("Cache Statistics:\n");
    for (CacheLevel level : LEVELS) {
      CacheStats stats = report.stats(level);
      output.append(String.format(US, "%s: %d hits, %d misses",
          level, stats.hits(), stats.misses())).append('\n');
    }
    if (report.skipped() > 0) {
      output.append(String.format(US, "Skipped: %d malformed records", report.skipped()))
          .append('\n');
    }
    return output.toString();
  }
}
