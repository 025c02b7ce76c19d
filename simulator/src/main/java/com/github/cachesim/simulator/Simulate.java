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
package com.github.cachesim.simulator;

import static java.util.Locale.US;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import com.github.cachesim.simulator.cache.Addressing;
import com.github.cachesim.simulator.parser.TraceFormat;
import com.github.cachesim.simulator.report.ReportFormat;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help;
import picocli.CommandLine.Option;

/**
 * A command that runs a simulation, where the options override the default configuration. The
 * configuration may also be overridden by using system properties.
 * <p>
 * <pre>{@code
 *   java -Dcachesim.simulator.hierarchy.l1.size=32KiB \
 *     -cp simulator.jar com.github.cachesim.simulator.Simulate \
 *     --files=memory_trace.log.xz,address:gcc.trace \
 *     --addressing=division \
 *     --report=table
 * }</pre>
 */
@Command(mixinStandardHelpOptions = true,
    description = "Replays a memory trace through an L1/L2/L3 cache hierarchy")
public final class Simulate implements Runnable {
  private static final String PATH = "cachesim.simulator.";

  @Option(names = "--files", split = ",", description = "The trace files, replayed in order")
  private @Nullable List<String> files;
  @Option(names = "--format", description = "The default trace format: ${COMPLETION-CANDIDATES}")
  private @Nullable TraceFormat format;
  @Option(names = "--report", description = "The report format: ${COMPLETION-CANDIDATES}")
  private @Nullable ReportFormat report;
  @Option(names = "--output", description = "The report destination, console or a file path")
  private @Nullable String output;
  @Option(names = "--addressing", description = "The address decomposition: "
      + "${COMPLETION-CANDIDATES}")
  private @Nullable Addressing addressing;
  @Option(names = "--cores", description = "The expected number of cores")
  private @Nullable Integer cores;

  @Override
  public void run() {
    var stopwatch = Stopwatch.createStarted();
    var simulator = new Simulator(config());
    simulator.run();
    System.err.printf(US, "Executed in %s%n", stopwatch);
  }

  /** Returns the configuration with the command's options taking precedence. */
  Config config() {
    var overrides = new HashMap<String, Object>();
    putIfPresent(overrides, "files.paths", files);
    putIfPresent(overrides, "files.format", (format == null) ? null : format.name());
    putIfPresent(overrides, "report.format", (report == null) ? null : report.name());
    putIfPresent(overrides, "report.output", output);
    putIfPresent(overrides, "hierarchy.addressing",
        (addressing == null) ? null : addressing.name());
    putIfPresent(overrides, "hierarchy.cores", cores);
    return ConfigFactory.parseMap(overrides).withFallback(ConfigFactory.load());
  }

  private static void putIfPresent(Map<String, Object> overrides,
      String path, @Nullable Object value) {
    if (value != null) {
      overrides.put(PATH + path, value);
    }
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(Simulate.class)
        .setColorScheme(Help.defaultColorScheme(Help.Ansi.AUTO))
        .setCommandName(Simulate.class.getSimpleName())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
          commandLine.getErr().println(commandLine.getColorScheme().errorText(e.getMessage()));
          return commandLine.getCommandSpec().exitCodeOnExecutionException();
        })
        .execute(args);
    System.exit(exitCode);
  }
}
