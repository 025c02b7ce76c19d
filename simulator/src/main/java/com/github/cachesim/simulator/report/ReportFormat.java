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

import static java.util.Objects.requireNonNull;

import java.util.function.Function;

import com.github.cachesim.simulator.report.csv.CsvReporter;
import com.github.cachesim.simulator.report.table.TableReporter;
import com.github.cachesim.simulator.report.text.StatisticsReporter;
import com.typesafe.config.Config;

/**
 * The report data formats.
 */
@SuppressWarnings("ImmutableEnumChecker")
public enum ReportFormat {
  TEXT(StatisticsReporter::new),
  TABLE(TableReporter::new),
  CSV(CsvReporter::new);

  private final Function<Config, Reporter> factory;

  ReportFormat(Function<Config, Reporter> factory) {
    this.factory = requireNonNull(factory);
  }

  /** Returns a reporter configured by the simulator's settings. */
  public Reporter create(Config config) {
    return factory.apply(config);
  }
}
