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
package com.github.cachesim.simulator.cache;

import static java.util.Objects.requireNonNull;

import java.util.function.ObjLongConsumer;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrays;

/**
 * A three level inclusive hierarchy with a private L1 per core, and an L2 and L3 that are shared by
 * every core.
 * <p>
 * An access that misses a level is filled into every level above it, so a line resident in an L1
 * was placed in the L2 and L3 when it was fetched. The shared levels may later evict that line
 * without invalidating the copies above them, as back-invalidation is not modeled.
 * <p>
 * The core ids are opaque keys and a private level is created on the first access by each id, so
 * a trace may use any sparse set of ids regardless of the configured number of cores.
 */
public final class CacheHierarchy {
  /** The most private levels that the expected core count may presize the table for. */
  static final int MAXIMUM_PRESIZE = 1 << 16;

  private final Long2ObjectMap<SetAssociativeCache> l1ByCoreId;
  private final HierarchyConfig config;
  private final SetAssociativeCache l2;
  private final SetAssociativeCache l3;

  public CacheHierarchy(HierarchyConfig config) {
    this.config = requireNonNull(config);
    this.l1ByCoreId = new Long2ObjectOpenHashMap<>(Math.min(config.cores(), MAXIMUM_PRESIZE));
    this.l2 = new SetAssociativeCache("L2", config.l2(), config.addressing(), /* shared= */ true);
    this.l3 = new SetAssociativeCache("L3", config.l3(), config.addressing(), /* shared= */ true);
  }

  /**
   * Replays a memory access by the core. The levels are probed in order until the address is
   * found, and each level that missed is then filled silently on the way back to the core.
   *
   * @param address the unsigned memory address
   * @param coreId the opaque id of the core, or thread, that issued the access
   */
  public void access(long address, long coreId) {
    SetAssociativeCache l1 = privateCache(coreId);
    if (l1.access(address)) {
      return;
    }

    if (l2.access(address)) {
      l1.access(address, /* countTowardStatistics= */ false);
      return;
    }

    // L3 fills from memory on a miss, after which the line is installed in L2 and L1
    l3.access(address);
    l2.access(address, /* countTowardStatistics= */ false);
    l1.access(address, /* countTowardStatistics= */ false);
  }

  /** Returns the core's private level, creating it on the first access. */
  private SetAssociativeCache privateCache(long coreId) {
    SetAssociativeCache l1 = l1ByCoreId.get(coreId);
    if (l1 == null) {
      l1 = new SetAssociativeCache("L1-" + Long.toUnsignedString(coreId),
          config.l1(), config.addressing(), /* shared= */ false);
      l1ByCoreId.put(coreId, l1);
    }
    return l1;
  }

  /**
   * Performs the action for the statistics of each private level, in ascending order of the
   * unsigned core id.
   *
   * @param action the consumer of each private level's statistics and its core id
   */
  public void forEachL1(ObjLongConsumer<CacheStats> action) {
    long[] coreIds = l1ByCoreId.keySet().toLongArray();
    LongArrays.quickSort(coreIds, Long::compareUnsigned);
    for (long coreId : coreIds) {
      action.accept(l1ByCoreId.get(coreId).stats(), coreId);
    }
  }

  /** Returns the combined statistics of every private level. */
  public CacheStats l1Stats() {
    var total = CacheStats.empty();
    for (SetAssociativeCache l1 : l1ByCoreId.values()) {
      total = total.plus(l1.stats());
    }
    return total;
  }

  public CacheStats l2Stats() {
    return l2.stats();
  }

  public CacheStats l3Stats() {
    return l3.stats();
  }

  /** Returns the statistics of the level, combining the private levels for {@code L1}. */
  public CacheStats stats(CacheLevel level) {
    switch (level) {
      case L1:
        return l1Stats();
      case L2:
        return l2Stats();
      case L3:
        return l3Stats();
      default:
        throw new IllegalArgumentException("Unknown level: " + level);
    }
  }

  /** Returns the number of private levels, which is the number of distinct cores seen. */
  public int coreCount() {
    return l1ByCoreId.size();
  }

  /** Returns the core's private level, or {@code null} if the core has not issued an access. */
  public @Nullable SetAssociativeCache l1Cache(long coreId) {
    return l1ByCoreId.get(coreId);
  }

  public SetAssociativeCache l2Cache() {
    return l2;
  }

  public SetAssociativeCache l3Cache() {
    return l3;
  }

  public HierarchyConfig config() {
    return config;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("cores", coreCount())
        .add("l1", l1Stats())
        .add("l2", l2Stats())
        .add("l3", l3Stats())
        .toString();
  }
}
