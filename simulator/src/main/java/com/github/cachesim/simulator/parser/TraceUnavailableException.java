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

import java.io.IOException;
import java.io.UncheckedIOException;

/** Indicates that a trace file could not be found, opened or read. */
public final class TraceUnavailableException extends UncheckedIOException {
  private static final long serialVersionUID = 1L;

  private final String filePath;

  public TraceUnavailableException(String filePath, IOException cause) {
    super("Could not read trace file: " + filePath, cause);
    this.filePath = filePath;
  }

  /** Returns the path of the unavailable trace. */
  public String filePath() {
    return filePath;
  }
}
