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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Iterator;
import java.util.stream.Stream;

import com.github.cachesim.simulator.cache.CacheHierarchy;
import com.github.cachesim.simulator.cache.HierarchyConfig;
import com.github.cachesim.simulator.parser.MemoryAccess;
import com.github.cachesim.simulator.parser.TraceReader;
import com.github.cachesim.simulator.report.SimulationReport;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A simulator that replays a memory access trace through a cache hierarchy of private L1 caches
 * and shared L2 and L3 caches, and reports the hits and misses at each level. See
 * <tt>reference.conf</tt> for details on the configuration.
 * <p>
 * The trace is replayed sequentially in its recorded order, as the recency of each cache line is
 * defined by the order of the accesses. The thread id of a record selects the private cache that
 * the access is issued to and does not imply any concurrency within the simulation.
 */
public final class Simulator {
  private static final Logger logger = System.getLogger(Simulator.class.getName());

  private final BasicSettings settings;

  public Simulator(Config config) {
    settings = new BasicSettings(config.getConfig("cachesim.simulator"));
  }

  /** Replays the trace and prints the report. */
  public void run() {
    var report = simulate();
    settings.report().format().create(settings.config()).print(report);
  }

  /**
   * Replays the configured trace through a new hierarchy.
   *
   * @return the statistics of the replay
   * @throws com.github.cachesim.simulator.cache.CacheConfigurationException if the hierarchy's
   *         parameters cannot be simulated
   * @throws com.github.cachesim.simulator.parser.TraceUnavailableException if a trace file cannot
   *         be read
   */
  public SimulationReport simulate() {
    HierarchyConfig config = settings.hierarchy().toHierarchyConfig();
    var trace = settings.traceFiles().format().readFiles(settings.traceFiles().paths());
    return replay(trace, new CacheHierarchy(config));
  }

  /** Feeds every record of the trace to the hierarchy, one at a time. */
  private SimulationReport replay(TraceReader trace, CacheHierarchy hierarchy) {
    long interval = settings.progressInterval();
    var stopwatch = Stopwatch.createStarted();
    long processed = 0;
    try (Stream<MemoryAccess> events = trace.events()) {
      for (Iterator<MemoryAccess> i = events.iterator(); i.hasNext();) {
        MemoryAccess access = i.next();
        hierarchy.access(access.address(), access.threadId());
        processed++;
        if ((processed % interval) == 0) {
          logger.log(Level.INFO, "Processed {0} records", processed);
        }
      }
    }
    stopwatch.stop();

    logger.log(Level.INFO, "Replayed {0} records ({1} skipped) across {2} cores in {3}",
        processed, trace.skipped(), hierarchy.coreCount(), stopwatch);
    if (logger.isLoggable(Level.DEBUG)) {
      hierarchy.forEachL1((stats, coreId) -> logger.log(Level.DEBUG, "L1-{0}: {1}",
          Long.toUnsignedString(coreId), stats));
    }
    return SimulationReport.from(hierarchy, processed, trace.skipped(), stopwatch.elapsed());
  }

  public static void main(String[] args) {
    var simulator = new Simulator(ConfigFactory.load());
    simulator.run();
  }
}
