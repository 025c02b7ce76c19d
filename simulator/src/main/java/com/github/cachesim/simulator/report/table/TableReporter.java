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
package com.github.cachesim.simulator.report.table;

import static java.util.Locale.US;

import com.github.cachesim.simulator.cache.CacheLevel;
import com.github.cachesim.simulator.cache.CacheStats;
import com.github.cachesim.simulator.report.SimulationReport;
import com.github.cachesim.simulator.report.TextReporter;
import com.jakewharton.fliptables.FlipTable;
import com.typesafe.config.Config;

/**
 * A plain text report that pretty-prints to a table.
 */
public final class TableReporter extends TextReporter {
  private static final String[] HEADERS = {
      "Level", "Hits", "Misses", "Requests", "Hit Rate", "Miss Rate", "Evictions" };

  public TableReporter(Config config) {
    super(config);
  }

  @Override
  protected String assemble(SimulationReport report) {
    String[][] data = new String[LEVELS.size()][];
    for (int i = 0; i < LEVELS.size(); i++) {
      CacheLevel level = LEVELS.get(i);
      CacheStats stats = report.stats(level);
      data[i] = new String[] {
          level.name(),
          String.format(US, "%,d", stats.hits()),
          String.format(US, "%,d", stats.misses()),
          String.format(US, "%,d", stats.requestCount()),
          String.format(US, "%.2f %%", 100 * stats.hitRate()),
          String.format(US, "%.2f %%", 100 * stats.missRate()),
          String.format(US, "%,d", stats.evictions()),
      };
    }
    return FlipTable.of(HEADERS, data) + String.format(US,
        "Cores: %,d, Records: %,d, Skipped: %,d, Elapsed: %,d ms%n", report.cores(),
        report.processed(), report.skipped(), report.elapsed().toMillis());
  }
}
