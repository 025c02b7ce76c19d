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
package com.github.cachesim.simulator.report.csv;

import static java.util.Locale.US;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

import com.github.cachesim.simulator.cache.CacheLevel;
import com.github.cachesim.simulator.cache.CacheStats;
import com.github.cachesim.simulator.report.SimulationReport;
import com.github.cachesim.simulator.report.TextReporter;
import com.typesafe.config.Config;

import de.siegmar.fastcsv.writer.CsvWriter;
import de.siegmar.fastcsv.writer.LineDelimiter;

/**
 * A plain text report that prints comma-separated values, one row per level.
 */
public final class CsvReporter extends TextReporter {

  public CsvReporter(Config config) {
    super(config);
  }

  @Override
  protected String assemble(SimulationReport report) {
    var output = new StringWriter();
    try (var writer = CsvWriter.builder().lineDelimiter(LineDelimiter.LF).build(output)) {
      writer.writeRecord("Level", "Hits", "Misses", "Requests",
          "Hit Rate", "Miss Rate", "Evictions");
      for (CacheLevel level : LEVELS) {
        CacheStats stats = report.stats(level);
        writer.writeRecord(level.name(),
            Long.toString(stats.hits()),
            Long.toString(stats.misses()),
            Long.toString(stats.requestCount()),
            String.format(US, "%.2f", 100 * stats.hitRate()),
            String.format(US, "%.2f", 100 * stats.missRate()),
            Long.toString(stats.evictions()));
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return output.toString();
  }
}
