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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.expectThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

import org.testng.annotations.Test;

import com.github.cachesim.simulator.cache.CacheConfigurationException;
import com.github.cachesim.simulator.cache.CacheStats;
import com.github.cachesim.simulator.parser.TraceUnavailableException;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

public final class SimulatorTest {

  @Test
  public void simulate() {
    var report = new Simulator(config(Map.of())).simulate();
    assertThat(report.l1()).isEqualTo(new CacheStats(2, 4, 0));
    assertThat(report.l2()).isEqualTo(new CacheStats(1, 3, 0));
    assertThat(report.l3()).isEqualTo(new CacheStats(0, 3, 0));
    assertThat(report.cores()).isEqualTo(3);
    assertThat(report.processed()).isEqualTo(6);
    assertThat(report.skipped()).isEqualTo(1);
  }

  @Test
  public void simulate_logsProgress() {
    var logger = java.util.logging.Logger.getLogger(Simulator.class.getName());
    var messages = new ArrayList<String>();
    var handler = new Handler() {
      @Override public void publish(LogRecord record) {
        messages.add(getFormatter().formatMessage(record));
      }
      @Override public void flush() {}
      @Override public void close() {}
    };
    handler.setFormatter(new SimpleFormatter());
    logger.addHandler(handler);
    try {
      new Simulator(config(Map.of())).simulate();
    } finally {
      logger.removeHandler(handler);
    }

    var progress = messages.stream()
        .filter(message -> message.startsWith("Processed"))
        .collect(toImmutableList());
    assertThat(progress).containsExactly(
        "Processed 2 records", "Processed 4 records", "Processed 6 records").inOrder();
  }

  @Test
  public void simulate_deterministic() {
    var first = new Simulator(config(Map.of())).simulate();
    var second = new Simulator(config(Map.of())).simulate();
    assertThat(second.l1()).isEqualTo(first.l1());
    assertThat(second.l2()).isEqualTo(first.l2());
    assertThat(second.l3()).isEqualTo(first.l3());
  }

  @Test
  public void simulate_division() {
    var report = new Simulator(config(Map.of(
        "cachesim.simulator.hierarchy.addressing", "division"))).simulate();
    assertThat(report.l1()).isEqualTo(new CacheStats(2, 4, 0));
    assertThat(report.l3()).isEqualTo(new CacheStats(0, 3, 0));
  }

  @Test
  public void simulate_defaultHierarchy() {
    var report = new Simulator(config(Map.of(
        "cachesim.simulator.hierarchy.l1.size", "5MiB",
        "cachesim.simulator.hierarchy.l2.size", "39MiB",
        "cachesim.simulator.hierarchy.l3.size", "6MiB"))).simulate();
    assertThat(report.l1()).isEqualTo(new CacheStats(2, 4, 0));
  }

  @Test
  public void simulate_missingTrace() {
    var simulator = new Simulator(config(Map.of(
        "cachesim.simulator.files.paths", List.of("/no/such/memory_trace.log"))));
    var e = expectThrows(TraceUnavailableException.class, simulator::simulate);
    assertThat(e).hasMessageThat().contains("/no/such/memory_trace.log");
  }

  @Test
  public void simulate_invalidGeometry() {
    var simulator = new Simulator(config(Map.of(
        "cachesim.simulator.hierarchy.l2.size", "1000")));
    assertThrows(CacheConfigurationException.class, simulator::simulate);
  }

  @Test
  public void simulate_bitMaskRejected() {
    var simulator = new Simulator(config(Map.of(
        "cachesim.simulator.hierarchy.addressing", "bit-mask",
        "cachesim.simulator.hierarchy.l3.size", "6MiB")));
    assertThrows(CacheConfigurationException.class, simulator::simulate);
  }

  @Test
  public void run() throws IOException {
    Path file = Files.createTempFile("report", ".txt");
    file.toFile().deleteOnExit();
    new Simulator(config(Map.of("cachesim.simulator.report.output", file.toString()))).run();
    assertThat(Files.readString(file, UTF_8)).isEqualTo(
        "Cache Statistics:\n"
        + "L1: 2 hits, 4 misses\n"
        + "L2: 1 hits, 3 misses\n"
        + "L3: 0 hits, 3 misses\n"
        + "Skipped: 1 malformed records\n");
  }

  /** A small hierarchy replaying the bundled trace, with the overrides taking precedence. */
  static Config config(Map<String, Object> overrides) {
    Map<String, Object> defaults = ImmutableMap.<String, Object>builder()
        .put("cachesim.simulator.files.paths", List.of("/memory.trace"))
        .put("cachesim.simulator.progress-interval", 2)
        .put("cachesim.simulator.hierarchy.l1.size", "512B")
        .put("cachesim.simulator.hierarchy.l1.associativity", 2)
        .put("cachesim.simulator.hierarchy.l2.size", "2KiB")
        .put("cachesim.simulator.hierarchy.l2.associativity", 4)
        .put("cachesim.simulator.hierarchy.l3.size", "8KiB")
        .put("cachesim.simulator.hierarchy.l3.associativity", 8)
        .buildOrThrow();
    return ConfigFactory.parseMap(overrides)
        .withFallback(ConfigFactory.parseMap(defaults))
        .withFallback(ConfigFactory.load());
  }
}
