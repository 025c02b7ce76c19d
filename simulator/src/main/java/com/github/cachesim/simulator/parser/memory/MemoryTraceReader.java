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
package com.github.cachesim.simulator.parser.memory;

import java.util.List;

import com.github.cachesim.simulator.parser.MalformedRecordException;
import com.github.cachesim.simulator.parser.MemoryAccess;
import com.github.cachesim.simulator.parser.TextTraceReader;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * A reader for memory traces with one access per line, in the whitespace separated form
 * {@code <access type> <address> <thread id> <return address>}, such as {@code R 140737488346664
 * 4242 4198400}. Numbers are decimal unless prefixed with {@code 0x}.
 */
public final class MemoryTraceReader extends TextTraceReader {
  private static final Splitter SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final int FIELDS = 4;

  public MemoryTraceReader(String filePath) {
    super(filePath);
  }

  @Override
  protected MemoryAccess parse(String line) {
    List<String> fields = SPLITTER.splitToList(line);
    if (fields.size() != FIELDS) {
      throw new MalformedRecordException(line,
          "Expected " + FIELDS + " fields but found " + fields.size());
    }
    return new MemoryAccess(fields.get(0),
        parseUnsigned(fields.get(1), line),
        parseUnsigned(fields.get(2), line),
        parseUnsigned(fields.get(3), line));
  }
}
