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

import java.util.stream.Stream;

/**
 * A reader to a memory access trace.
 */
public interface TraceReader {

  /**
   * Creates a stream that lazily reads the trace source in its recorded order.
   * <p>
   * The try-with-resources construct should be used to ensure that the stream's
   * {@link Stream#close close} method is invoked after the stream operations are completed.
   *
   * @return a lazy stream of memory accesses
   * @throws TraceUnavailableException if the trace cannot be opened
   */
  Stream<MemoryAccess> events();

  /** Returns the number of malformed records that were skipped while streaming the events. */
  long skipped();
}
