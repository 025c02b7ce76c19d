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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public final class CacheHierarchyTest {
  static final HierarchyConfig CONFIG = new HierarchyConfig(2,
      new CacheGeometry(512, 64, 2),
      new CacheGeometry(2048, 64, 4),
      new CacheGeometry(8192, 64, 8),
      Addressing.AUTO);

  CacheHierarchy hierarchy;

  @BeforeMethod
  public void before() {
    hierarchy = new CacheHierarchy(CONFIG);
  }

  @Test
  public void access_cold() {
    hierarchy.access(0x1000, 0);
    assertThat(hierarchy.l1Stats()).isEqualTo(new CacheStats(0, 1, 0));
    assertThat(hierarchy.l2Stats()).isEqualTo(new CacheStats(0, 1, 0));
    assertThat(hierarchy.l3Stats()).isEqualTo(new CacheStats(0, 1, 0));

    hierarchy.access(0x1000, 0);
    assertThat(hierarchy.l1Stats()).isEqualTo(new CacheStats(1, 1, 0));
    assertThat(hierarchy.l2Stats()).isEqualTo(new CacheStats(0, 1, 0));
    assertThat(hierarchy.l3Stats()).isEqualTo(new CacheStats(0, 1, 0));
  }

  @Test
  public void access_fillsEveryLevel() {
    hierarchy.access(0x1000, 0);
    assertThat(hierarchy.l1Cache(0).contains(0x1000)).isTrue();
    assertThat(hierarchy.l2Cache().contains(0x1000)).isTrue();
    assertThat(hierarchy.l3Cache().contains(0x1000)).isTrue();
  }

  @Test
  public void access_l2Hit_fillsPrivateLevel() {
    hierarchy.access(0x1000, 0);
    hierarchy.access(0x1000, 1);
    assertThat(hierarchy.l1Cache(1).stats()).isEqualTo(new CacheStats(0, 1, 0));
    assertThat(hierarchy.l2Stats()).isEqualTo(new CacheStats(1, 1, 0));
    assertThat(hierarchy.l3Stats()).isEqualTo(new CacheStats(0, 1, 0));
    assertThat(hierarchy.l1Cache(1).contains(0x1000)).isTrue();

    hierarchy.access(0x1000, 1);
    assertThat(hierarchy.l1Cache(1).stats()).isEqualTo(new CacheStats(1, 1, 0));
  }

  /** Lines 512 bytes apart share a set in every level, and L3 holds more of them than L2. */
  @Test
  public void access_l3Hit_fillsUpperLevels() {
    for (long i = 0; i < 5; i++) {
      hierarchy.access(i * 512, 0);
    }
    assertThat(hierarchy.l2Cache().contains(0)).isFalse();
    assertThat(hierarchy.l1Cache(0).contains(0)).isFalse();
    assertThat(hierarchy.l3Cache().contains(0)).isTrue();

    hierarchy.access(0, 0);
    assertThat(hierarchy.l3Stats()).isEqualTo(new CacheStats(1, 5, 0));
    assertThat(hierarchy.l2Stats().misses()).isEqualTo(6);
    assertThat(hierarchy.l2Cache().contains(0)).isTrue();
    assertThat(hierarchy.l1Cache(0).contains(0)).isTrue();
  }

  @Test
  public void access_privateLevelsAreIsolated() {
    hierarchy.access(0x1000, 0);
    assertThat(hierarchy.l1Cache(1)).isNull();

    hierarchy.access(0x2000, 1);
    assertThat(hierarchy.l1Cache(0).contains(0x2000)).isFalse();
    assertThat(hierarchy.l1Cache(1).contains(0x1000)).isFalse();
  }

  @Test
  public void access_sparseCoreIds() {
    long[] coreIds = { 7, 1L << 40, -1L, Long.MIN_VALUE };
    for (long coreId : coreIds) {
      hierarchy.access(0x1000, coreId);
    }
    assertThat(hierarchy.coreCount()).isEqualTo(coreIds.length);
    for (long coreId : coreIds) {
      assertThat(hierarchy.l1Cache(coreId)).isNotNull();
    }
    assertThat(hierarchy.l1Cache(5)).isNull();
    assertThat(hierarchy.l1Cache(-1L).name()).isEqualTo("L1-18446744073709551615");
  }

  @Test
  public void access_moreCoresThanExpected() {
    for (long coreId = 0; coreId < 100; coreId++) {
      hierarchy.access(0x1000, coreId);
    }
    assertThat(hierarchy.coreCount()).isEqualTo(100);
    assertThat(hierarchy.l1Stats()).isEqualTo(new CacheStats(0, 100, 0));
    assertThat(hierarchy.l2Stats()).isEqualTo(new CacheStats(99, 1, 0));
    assertThat(hierarchy.l3Stats()).isEqualTo(new CacheStats(0, 1, 0));
  }

  @Test
  public void access_expectedCoresIsOnlyAHint() {
    var config = new HierarchyConfig(Integer.MAX_VALUE,
        CONFIG.l1(), CONFIG.l2(), CONFIG.l3(), Addressing.AUTO);
    var large = new CacheHierarchy(config);
    large.access(0x1000, 42);
    assertThat(large.coreCount()).isEqualTo(1);
    assertThat(large.l1Stats()).isEqualTo(new CacheStats(0, 1, 0));
  }

  @Test
  public void stats_conservation() {
    var random = new Random(11);
    int accesses = 20_000;
    for (int i = 0; i < accesses; i++) {
      hierarchy.access(random.nextInt(1 << 15), random.nextInt(4));
    }
    assertThat(hierarchy.l1Stats().requestCount()).isEqualTo(accesses);
    assertThat(hierarchy.l2Stats().requestCount()).isEqualTo(hierarchy.l1Stats().misses());
    assertThat(hierarchy.l3Stats().requestCount()).isEqualTo(hierarchy.l2Stats().misses());
    assertThat(hierarchy.stats(CacheLevel.L1)).isEqualTo(hierarchy.l1Stats());
    assertThat(hierarchy.stats(CacheLevel.L2)).isEqualTo(hierarchy.l2Stats());
    assertThat(hierarchy.stats(CacheLevel.L3)).isEqualTo(hierarchy.l3Stats());
  }

  @Test
  public void replay_deterministic() {
    var other = new CacheHierarchy(CONFIG);
    var random = new Random(3);
    for (int i = 0; i < 10_000; i++) {
      long address = random.nextInt(1 << 16);
      long coreId = random.nextInt(8);
      hierarchy.access(address, coreId);
      other.access(address, coreId);
    }
    for (var level : CacheLevel.values()) {
      assertThat(hierarchy.stats(level)).isEqualTo(other.stats(level));
    }
    assertThat(perCore(hierarchy)).isEqualTo(perCore(other));
  }

  @Test
  public void forEachL1_unsignedOrder() {
    hierarchy.access(0x1000, -1L);
    hierarchy.access(0x1000, 3);
    hierarchy.access(0x1000, 1);
    hierarchy.access(0x2000, 1);

    var coreIds = new ArrayList<Long>();
    var stats = new ArrayList<CacheStats>();
    hierarchy.forEachL1((l1, coreId) -> {
      coreIds.add(coreId);
      stats.add(l1);
    });
    assertThat(coreIds).containsExactly(1L, 3L, -1L).inOrder();
    assertThat(stats.get(0)).isEqualTo(new CacheStats(0, 2, 0));
  }

  @Test
  public void addressing_division() {
    var config = new HierarchyConfig(1, CONFIG.l1(), CONFIG.l2(), CONFIG.l3(), Addressing.DIVISION);
    var divided = new CacheHierarchy(config);
    var random = new Random(5);
    for (int i = 0; i < 10_000; i++) {
      long address = random.nextLong();
      hierarchy.access(address, 0);
      divided.access(address, 0);
    }
    assertThat(divided.l2Cache().addressing()).isEqualTo(Addressing.DIVISION);
    assertThat(hierarchy.l2Cache().addressing()).isEqualTo(Addressing.BIT_MASK);
    for (var level : CacheLevel.values()) {
      assertThat(divided.stats(level)).isEqualTo(hierarchy.stats(level));
    }
  }

  private static List<String> perCore(CacheHierarchy hierarchy) {
    var result = new ArrayList<String>();
    hierarchy.forEachL1((stats, coreId) -> result.add(coreId + "=" + stats));
    return result;
  }
}
