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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Function;

import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.jspecify.annotations.Nullable;
import org.tukaani.xz.XZInputStream;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Closeables;

/**
 * A skeletal implementation that opens the trace file as a data stream. The file is resolved on
 * the filesystem first and then on the classpath, and is decompressed transparently if it was
 * written in a format that commons-compress or XZ recognizes.
 */
public abstract class AbstractTraceReader implements TraceReader {
  private static final int BUFFER_SIZE = 1 << 16;
  private static final int MARK_LIMIT = 100;

  protected final String filePath;

  protected AbstractTraceReader(String filePath) {
    this.filePath = filePath.trim();
  }

  /**
   * Returns the input stream of the trace data.
   *
   * @throws TraceUnavailableException if the file does not exist or cannot be read
   */
  protected BufferedInputStream readFile() {
    InputStream input;
    try {
      input = openFile();
    } catch (IOException e) {
      throw new TraceUnavailableException(filePath, e);
    }
    try {
      return readInput(input);
    } catch (IOException e) {
      Closeables.closeQuietly(input);
      throw new TraceUnavailableException(filePath, e);
    }
  }

  /** Returns the input stream, unwrapping each layer of compression that is detected. */
  @SuppressWarnings("PMD.CloseResource")
  protected BufferedInputStream readInput(InputStream input) throws IOException {
    var buffered = new BufferedInputStream(input, BUFFER_SIZE);
    List<Function<InputStream, @Nullable InputStream>> extractors = ImmutableList.of(
        this::tryXZ, this::tryCompressed);
    for (var extractor : extractors) {
      buffered.mark(MARK_LIMIT);
      InputStream next = extractor.apply(buffered);
      if (next == null) {
        buffered.reset();
      } else if (next instanceof BufferedInputStream) {
        buffered = (BufferedInputStream) next;
      } else {
        buffered = new BufferedInputStream(next, BUFFER_SIZE);
      }
    }
    return buffered;
  }

  /** Returns an uncompressed stream if XZ encoded, else {@code null}. */
  private @Nullable InputStream tryXZ(InputStream input) {
    try {
      return new XZInputStream(input);
    } catch (IOException e) {
      return null;
    }
  }

  /** Returns an uncompressed stream, else {@code null}. */
  private @Nullable InputStream tryCompressed(InputStream input) {
    try {
      return new CompressorStreamFactory().createCompressorInputStream(input);
    } catch (CompressorException e) {
      return null;
    }
  }

  /** Returns the input stream for the raw file. */
  private InputStream openFile() throws IOException {
    Path file = Paths.get(filePath);
    if (Files.exists(file)) {
      return Files.newInputStream(file);
    }
    InputStream input = getClass().getResourceAsStream(filePath);
    if (input == null) {
      throw new NoSuchFileException(filePath);
    }
    return input;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + filePath + "]";
  }
}
