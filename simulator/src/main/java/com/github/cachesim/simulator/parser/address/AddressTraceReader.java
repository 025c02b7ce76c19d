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
package com.github.cachesim.simulator.parser.address;

import java.util.List;

import com.github.cachesim.simulator.parser.MalformedRecordException;
import com.github.cachesim.simulator.parser.MemoryAccess;
import com.github.cachesim.simulator.parser.TextTraceReader;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * A reader for the single core trace files of application address instructions, provided by
 * <a href="http://cseweb.ucsd.edu/classes/fa07/cse240a/project1.html">UC SD</a>. Each line has
 * the form {@code <type> 0x<hex address> <instructions since the last access>}, and every access
 * is attributed to core zero.
 */
public final class AddressTraceReader extends TextTraceReader {
  private static final Splitter SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  public AddressTraceReader(String filePath) {
    super(filePath);
  }

  @Override
  protected MemoryAccess parse(String line) {
    List<String> fields = SPLITTER.limit(3).splitToList(line);
    if (fields.size() < 2) {
      throw new MalformedRecordException(line, "Expected an access type and an address");
    }
    String address = fields.get(1);
    if (!address.startsWith("0x") && !address.startsWith("0X")) {
      throw new MalformedRecordException(line, "Expected a hexadecimal address");
    }
    return MemoryAccess.forAddress(fields.get(0), parseUnsigned(address, line));
  }
}
