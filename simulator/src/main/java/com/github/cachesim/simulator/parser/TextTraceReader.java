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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Iterator;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Ascii;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import com.google.common.io.Closeables;

/**
 * A skeletal implementation that reads the trace file line by line as textual data. Blank lines
 * are ignored, and a line that cannot be parsed is skipped and counted rather than failing the
 * whole trace.
 */
public abstract class TextTraceReader extends AbstractTraceReader {
  private static final Logger logger = System.getLogger(TextTraceReader.class.getName());

  private long lineNumber;
  private long skipped;

  protected TextTraceReader(String filePath) {
    super(filePath);
  }

  @Override
  public Stream<MemoryAccess> events() {
    return lines().flatMap(line -> {
      lineNumber++;
      if (StringUtils.isBlank(line)) {
        return Stream.empty();
      }
      try {
        return Stream.of(parse(line));
      } catch (MalformedRecordException e) {
        recordMalformed(e);
        return Stream.empty();
      }
    });
  }

  @Override
  public long skipped() {
    return skipped;
  }

  /**
   * Returns the record described by the line.
   *
   * @param line a non-blank line of the trace, without surrounding whitespace
   * @throws MalformedRecordException if the line is not a complete record
   */
  protected abstract MemoryAccess parse(String line);

  /**
   * Returns a stream of each line in the trace file.
   *
   * @throws TraceUnavailableException if the file cannot be opened, or later while streaming if
   *         it cannot be read
   */
  @SuppressWarnings("PMD.CloseResource")
  protected Stream<String> lines() {
    InputStream input = readFile();
    Reader reader = new InputStreamReader(input, UTF_8);
    Iterator<String> lines = new BufferedReader(reader).lines().iterator();
    Iterator<String> guarded = new AbstractIterator<>() {
      @Override protected String computeNext() {
        try {
          return lines.hasNext() ? lines.next() : endOfData();
        } catch (UncheckedIOException e) {
          throw new TraceUnavailableException(filePath, e.getCause());
        }
      }
    };
    return Streams.stream(guarded).map(String::trim)
        .onClose(() -> Closeables.closeQuietly(input));
  }

  private void recordMalformed(MalformedRecordException e) {
    skipped++;
    if (skipped == 1) {
      logger.log(Level.WARNING, "Skipping malformed records in {0}, starting at line {1}: {2}",
          filePath, lineNumber, e.getMessage());
    } else {
      logger.log(Level.DEBUG, "Skipping malformed record in {0} at line {1}: {2}",
          filePath, lineNumber, e.getMessage());
    }
  }

  /**
   * Returns the unsigned value of the field, which is decimal unless it has a {@code 0x} prefix.
   *
   * @throws MalformedRecordException if the field is not an unsigned 64-bit integer
   */
  protected static long parseUnsigned(String field, String line) {
    boolean hex = (field.length() > 2) && Ascii.toLowerCase(field.substring(0, 2)).equals("0x");
    String digits = hex ? field.substring(2) : field;
    if (digits.startsWith("+")) {
      throw new MalformedRecordException(line, "Signed number (" + field + ")");
    }
    try {
      return hex ? Long.parseUnsignedLong(digits, 16) : Long.parseUnsignedLong(digits);
    } catch (NumberFormatException e) {
      throw new MalformedRecordException(line, "Not an unsigned integer (" + field + ")", e);
    }
  }
}
