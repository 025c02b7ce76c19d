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

import com.google.common.base.MoreObjects;

/**
 * A line within a set. A line starts out invalid and becomes valid once a tag is installed; it is
 * only ever replaced and never invalidated again.
 */
final class CacheLine {
  long tag;
  boolean valid;
  long lastAccessTime;

  /** Returns whether the line holds the given tag. */
  boolean matches(long tag) {
    return valid && (this.tag == tag);
  }

  /** Refreshes the recency of the resident tag. */
  void touch(long time) {
    lastAccessTime = time;
  }

  /** Replaces the contents with the given tag. */
  void install(long tag, long time) {
    this.tag = tag;
    this.valid = true;
    this.lastAccessTime = time;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tag", Long.toUnsignedString(tag, 16))
        .add("valid", valid)
        .add("lastAccessTime", Long.toUnsignedString(lastAccessTime))
        .toString();
  }
}
