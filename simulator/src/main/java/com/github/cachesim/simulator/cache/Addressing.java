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

/**
 * The strategies for splitting an address into its set index and tag. All arithmetic treats the
 * address as an unsigned 64-bit value.
 */
public enum Addressing {

  /** Divides by the line size and set count; correct for every geometry. */
  DIVISION,

  /**
   * Shifts and masks the address bits; requires that both the line size and the set count are
   * powers of two, otherwise the cache is rejected at construction.
   */
  BIT_MASK,

  /** Uses {@link #BIT_MASK} when the geometry allows it and {@link #DIVISION} otherwise. */
  AUTO;

  /** Returns the concrete strategy used for the given geometry. */
  public Addressing resolve(CacheGeometry geometry) {
    if (this == AUTO) {
      return geometry.isPowerOfTwo() ? BIT_MASK : DIVISION;
    } else if ((this == BIT_MASK) && !geometry.isPowerOfTwo()) {
      throw CacheConfigurationException.of("Bit mask addressing requires a power of two "
          + "line size and set count, but was %s", geometry);
    }
    return this;
  }
}
