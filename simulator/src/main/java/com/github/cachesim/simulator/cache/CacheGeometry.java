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

import static java.util.Locale.US;

import com.google.common.math.LongMath;

/**
 * The shape of a single cache level. A geometry is validated on construction so that every
 * instance describes at least one whole set.
 *
 * @param capacity the total size in bytes
 * @param lineSize the size of a cache line in bytes
 * @param associativity the number of lines per set
 */
public record CacheGeometry(long capacity, long lineSize, int associativity) {
  /** The largest number of sets that a single cache can index. */
  static final long MAXIMUM_SETS = Integer.MAX_VALUE;

  public CacheGeometry {
    if (capacity <= 0) {
      throw CacheConfigurationException.of("Capacity must be positive: %,d", capacity);
    } else if (lineSize <= 0) {
      throw CacheConfigurationException.of("Line size must be positive: %,d", lineSize);
    } else if (associativity <= 0) {
      throw CacheConfigurationException.of("Associativity must be positive: %,d", associativity);
    }

    long setSize;
    try {
      setSize = LongMath.checkedMultiply(lineSize, associativity);
    } catch (ArithmeticException e) {
      throw CacheConfigurationException.of("Set size overflows: %,d x %,d",
          lineSize, associativity);
    }
    if ((capacity % setSize) != 0) {
      throw CacheConfigurationException.of("Capacity %,d is not divisible by the set size "
          + "(%,d byte lines x %,d ways)", capacity, lineSize, associativity);
    }
    long sets = capacity / setSize;
    if (sets == 0) {
      throw CacheConfigurationException.of("Capacity %,d holds no sets", capacity);
    } else if (sets > MAXIMUM_SETS) {
      throw CacheConfigurationException.of("Capacity %,d requires %,d sets", capacity, sets);
    }
  }

  /** Returns the number of sets. */
  public int sets() {
    return (int) (capacity / (lineSize * associativity));
  }

  /** Returns whether the line size and the set count are both powers of two. */
  public boolean isPowerOfTwo() {
    return LongMath.isPowerOfTwo(lineSize) && LongMath.isPowerOfTwo(sets());
  }

  @Override
  public String toString() {
    return String.format(US, "%,d bytes (%,d sets x %,d ways x %,d byte lines)",
        capacity, sets(), associativity, lineSize);
  }
}
