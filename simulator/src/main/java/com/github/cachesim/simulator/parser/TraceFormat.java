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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import com.github.cachesim.simulator.parser.address.AddressTraceReader;
import com.github.cachesim.simulator.parser.memory.MemoryTraceReader;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * The trace file formats.
 */
@SuppressWarnings("ImmutableEnumChecker")
public enum TraceFormat {
  ADDRESS(AddressTraceReader::new),
  MEMORY(MemoryTraceReader::new);

  private final Function<String, TraceReader> factory;

  TraceFormat(Function<String, TraceReader> factory) {
    this.factory = requireNonNull(factory);
  }

  /**
   * Returns a new reader that streams the events of the trace files in the order given. A path may
   * be prefixed by a format name, as in {@code address:gcc.trace.xz}, to read that file in another
   * format than this one. A prefix that does not name a format is taken to be part of the path.
   *
   * @param filePaths the path to the files in the trace's format
   * @return a reader for streaming the events from the files
   */
  public TraceReader readFiles(List<String> filePaths) {
    ImmutableList<TraceReader> readers = filePaths.stream().map(path -> {
      List<String> parts = Splitter.on(':').limit(2).splitToList(path);
      Optional<TraceFormat> prefix = (parts.size() == 1)
          ? Optional.absent()
          : Enums.getIfPresent(TraceFormat.class, enumName(parts.get(0)));
      return prefix.isPresent()
          ? prefix.get().factory.apply(parts.get(1))
          : factory.apply(path);
    }).collect(toImmutableList());

    return new TraceReader() {
      @Override public Stream<MemoryAccess> events() {
        return readers.stream().flatMap(TraceReader::events);
      }
      @Override public long skipped() {
        return readers.stream().mapToLong(TraceReader::skipped).sum();
      }
    };
  }

  /** Returns the format for the given name, ignoring case and treating dashes as underscores. */
  public static TraceFormat named(String name) {
    return TraceFormat.valueOf(enumName(name));
  }

  private static String enumName(String name) {
    return name.trim().replace('-', '_').toUpperCase(US);
  }
}
