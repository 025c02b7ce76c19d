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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import com.github.cachesim.simulator.BasicSettings;
import com.github.cachesim.simulator.cache.CacheLevel;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;

/**
 * A skeletal plain text implementation applicable for printing to the console or a file.
 */
public abstract class TextReporter implements Reporter {
  /** The levels in the order that they are reported. */
  protected static final ImmutableList<CacheLevel> LEVELS = ImmutableList.of(
      CacheLevel.L1, CacheLevel.L2, CacheLevel.L3);

  private final BasicSettings settings;

  protected TextReporter(Config config) {
    this.settings = new BasicSettings(config);
  }

  @Override
  public void print(SimulationReport report) {
    String output = assemble(report);
    String destination = settings.report().output();
    if (destination.equalsIgnoreCase("console")) {
      var writer = new PrintWriter(System.out, /* autoFlush= */ true, UTF_8);
      writer.print(output);
      writer.flush();
      return;
    }
    try (Writer writer = makeFileWriter(Path.of(destination))) {
      writer.write(output);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static Writer makeFileWriter(Path path) throws IOException {
    var parent = path.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return Files.newBufferedWriter(path, UTF_8);
  }

  /** Assembles an aggregated report. */
  protected abstract String assemble(SimulationReport report);
}
