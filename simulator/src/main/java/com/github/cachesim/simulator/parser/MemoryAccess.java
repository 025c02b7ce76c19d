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
package com.github.cachesim.simulator.parser;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

/**
 * A memory access recorded in a trace. The numeric fields are unsigned 64-bit values; only the
 * address and the thread id take part in the simulation.
 *
 * @param accessType the kind of access, such as a load or a store
 * @param address the accessed memory address
 * @param threadId the thread, or core, that issued the access
 * @param returnAddress the return address of the issuing function
 */
public record MemoryAccess(String accessType, long address, long threadId, long returnAddress) {

  public MemoryAccess {
    requireNonNull(accessType);
  }

  /** Returns an access by core zero with no further metadata. */
  public static MemoryAccess forAddress(String accessType, long address) {
    return new MemoryAccess(accessType, address, 0L, 0L);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("accessType", accessType)
        .add("address", "0x" + Long.toHexString(address))
        .add("threadId", Long.toUnsignedString(threadId))
        .add("returnAddress", "0x" + Long.toHexString(returnAddress))
        .toString();
  }
}
