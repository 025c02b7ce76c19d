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

/**
 * Indicates that a line of a trace could not be parsed into a complete record. A reader skips
 * such a line rather than replaying a partially populated record.
 */
public final class MalformedRecordException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String line;

  public MalformedRecordException(String line, String reason) {
    super(reason + ": \"" + line + "\"");
    this.line = line;
  }

  public MalformedRecordException(String line, String reason, Throwable cause) {
    super(reason + ": \"" + line + "\"", cause);
    this.line = line;
  }

  /** Returns the offending line. */
  public String line() {
    return line;
  }
}
