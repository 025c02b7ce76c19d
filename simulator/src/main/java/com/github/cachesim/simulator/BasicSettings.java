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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.util.List;

import com.github.cachesim.simulator.cache.Addressing;
import com.github.cachesim.simulator.cache.CacheGeometry;
import com.github.cachesim.simulator.cache.CacheLevel;
import com.github.cachesim.simulator.cache.HierarchyConfig;
import com.github.cachesim.simulator.parser.TraceFormat;
import com.github.cachesim.simulator.report.ReportFormat;
import com.typesafe.config.Config;

/**
 * The simulator's configuration. See <tt>reference.conf</tt> for the settings and their defaults.
 */
public class BasicSettings {
  private final Config config;

  public BasicSettings(Config config) {
    this.config = requireNonNull(config);
  }

  public HierarchySettings hierarchy() {
    return new HierarchySettings();
  }

  public TraceFilesSettings traceFiles() {
    return new TraceFilesSettings();
  }

  public ReportSettings report() {
    return new ReportSettings();
  }

  /** Returns the number of records between progress messages. */
  public long progressInterval() {
    long interval = config().getLong("progress-interval");
    checkArgument(interval > 0, "progress-interval must be positive: %s", interval);
    return interval;
  }

  /** Returns the config resolved at the simulator's path. */
  public Config config() {
    return config;
  }

  private static String enumName(String value) {
    return value.trim().replace('-', '_').toUpperCase(US);
  }

  public final class HierarchySettings {
    public int cores() {
      return config().getInt("hierarchy.cores");
    }
    public Addressing addressing() {
      return Addressing.valueOf(enumName(config().getString("hierarchy.addressing")));
    }
    public CacheGeometry geometry(CacheLevel level) {
      String path = "hierarchy." + level.name().toLowerCase(US);
      return new CacheGeometry(
          config().getBytes(path + ".size"),
          config().getBytes(path + ".line-size"),
          config().getInt(path + ".associativity"));
    }

    /**
     * Returns the validated parameters of the hierarchy.
     *
     * @throws com.github.cachesim.simulator.cache.CacheConfigurationException if a level's
     *         geometry cannot be simulated
     */
    public HierarchyConfig toHierarchyConfig() {
      return new HierarchyConfig(cores(), geometry(CacheLevel.L1),
          geometry(CacheLevel.L2), geometry(CacheLevel.L3), addressing());
    }
  }

  public final class TraceFilesSettings {
    public List<String> paths() {
      return config().getStringList("files.paths");
    }
    public TraceFormat format() {
      return TraceFormat.named(config().getString("files.format"));
    }
  }

  public final class ReportSettings {
    public ReportFormat format() {
      return ReportFormat.valueOf(enumName(config().getString("report.format")));
    }
    public String output() {
      return config().getString("report.output").trim();
    }
  }
}
