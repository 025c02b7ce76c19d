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

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A single level of a cache hierarchy that maps each address to one set and evicts the least
 * recently used line within that set.
 * <p>
 * An access may be counted or silent. A counted access updates the hit and miss counters, whereas
 * a silent access performs the same lookup-or-replace mutation without touching them. The silent
 * form lets a hierarchy fill a level on behalf of another level's miss without counting that fill
 * as traffic of its own.
 * <p>
 * Recency is tracked by a logical clock that advances on every access, so the simulation is
 * deterministic for a given sequence of addresses. This class is not thread-safe.
 */
public final class SetAssociativeCache {
  private final CacheGeometry geometry;
  private final Addressing addressing;
  private final CacheLine[][] sets;
  private final boolean shared;
  private final String name;

  /** log_2(line size), if addressed by bit mask */
  private final int offsetBits;
  /** log_2(num sets), if addressed by bit mask */
  private final int indexBits;
  private final long indexMask;

  private long clock;
  private long hits;
  private long misses;
  private long evictions;

  /**
   * Creates an empty cache level.
   *
   * @param name the level's name for diagnostics, such as {@code L2}
   * @param geometry the capacity, line size and associativity
   * @param addressing the strategy to split an address into its set index and tag
   * @param shared whether the level is shared by all cores or private to one
   * @throws CacheConfigurationException if the addressing cannot be applied to the geometry
   */
  public SetAssociativeCache(String name, CacheGeometry geometry,
      Addressing addressing, boolean shared) {
    this.addressing = addressing.resolve(geometry);
    this.geometry = requireNonNull(geometry);
    this.name = requireNonNull(name);
    this.shared = shared;

    if (this.addressing == Addressing.BIT_MASK) {
      offsetBits = Long.numberOfTrailingZeros(geometry.lineSize());
      indexBits = Integer.numberOfTrailingZeros(geometry.sets());
      indexMask = geometry.sets() - 1L;
    } else {
      offsetBits = 0;
      indexBits = 0;
      indexMask = 0L;
    }

    sets = new CacheLine[geometry.sets()][geometry.associativity()];
    for (CacheLine[] set : sets) {
      for (int i = 0; i < set.length; i++) {
        set[i] = new CacheLine();
      }
    }
  }

  /** Performs a counted access and returns whether the address was resident. */
  @CanIgnoreReturnValue
  public boolean access(long address) {
    return access(address, /* countTowardStatistics= */ true);
  }

  /**
   * Looks up the address and installs it on a miss, evicting the least recently used line of the
   * set if no line is free.
   *
   * @param address the unsigned memory address
   * @param countTowardStatistics whether the hit or miss is recorded, or the access is silent
   * @return whether the address was resident prior to this access
   */
  @CanIgnoreReturnValue
  public boolean access(long address, boolean countTowardStatistics) {
    long tag = tag(address);
    CacheLine[] set = sets[setIndex(address)];
    for (CacheLine line : set) {
      if (line.matches(tag)) {
        line.touch(++clock);
        if (countTowardStatistics) {
          hits++;
        }
        return true;
      }
    }

    if (countTowardStatistics) {
      misses++;
    }
    CacheLine victim = victim(set);
    if (victim.valid) {
      evictions++;
    }
    victim.install(tag, ++clock);
    return false;
  }

  /**
   * Returns whether the address is resident, without updating the recency or the counters.
   *
   * @param address the unsigned memory address
   * @return if a valid line of the address's set holds its tag
   */
  public boolean contains(long address) {
    long tag = tag(address);
    for (CacheLine line : sets[setIndex(address)]) {
      if (line.matches(tag)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the first free line, else the least recently used one. */
  private static CacheLine victim(CacheLine[] set) {
    CacheLine lru = set[0];
    for (CacheLine line : set) {
      if (!line.valid) {
        return line;
      } else if (Long.compareUnsigned(line.lastAccessTime, lru.lastAccessTime) < 0) {
        lru = line;
      }
    }
    return lru;
  }

  /** Returns the index of the set that the address maps to. */
  int setIndex(long address) {
    if (addressing == Addressing.BIT_MASK) {
      return (int) ((address >>> offsetBits) & indexMask);
    }
    long block = Long.divideUnsigned(address, geometry.lineSize());
    return (int) Long.remainderUnsigned(block, sets.length);
  }

  /** Returns the tag that identifies the address's line within its set. */
  long tag(long address) {
    if (addressing == Addressing.BIT_MASK) {
      return address >>> (offsetBits + indexBits);
    }
    long block = Long.divideUnsigned(address, geometry.lineSize());
    return Long.divideUnsigned(block, sets.length);
  }

  /** Returns a snapshot of the counters. */
  public CacheStats stats() {
    return new CacheStats(hits, misses, evictions);
  }

  public CacheGeometry geometry() {
    return geometry;
  }

  /** Returns the addressing in effect, never {@link Addressing#AUTO}. */
  public Addressing addressing() {
    return addressing;
  }

  public boolean isShared() {
    return shared;
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("shared", shared)
        .add("geometry", geometry)
        .add("addressing", addressing)
        .add("stats", stats())
        .toString();
  }
}
