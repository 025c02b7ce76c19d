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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable snapshot of a cache level's counters. Only counted accesses contribute to the hits
 * and misses, while every replacement of a valid line is an eviction.
 *
 * @param hits the number of counted accesses that found the line resident
 * @param misses the number of counted accesses that did not
 * @param evictions the number of valid lines that were replaced
 */
public record CacheStats(long hits, long misses, long evictions) {
  private static final CacheStats EMPTY = new CacheStats(0, 0, 0);

  public CacheStats {
    checkArgument(hits >= 0, "hits: %s", hits);
    checkArgument(misses >= 0, "misses: %s", misses);
    checkArgument(evictions >= 0, "evictions: %s", evictions);
  }

  /** Returns a snapshot with no recorded activity. */
  public static CacheStats empty() {
    return EMPTY;
  }

  /** Returns the number of counted accesses. */
  public long requestCount() {
    return hits + misses;
  }

  public double hitRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 1.0 : (double) hits / requestCount;
  }

  public double missRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 0.0 : (double) misses / requestCount;
  }

  /** Returns the sum of this and the other snapshot. */
  public CacheStats plus(CacheStats other) {
    return new CacheStats(hits + other.hits, misses + other.misses,
        evictions + other.evictions);
  }
}
