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

import static java.util.Locale.US;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Indicates that a cache level was configured with a geometry that cannot be simulated, such as a
 * capacity that does not divide into whole sets.
 */
public final class CacheConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public CacheConfigurationException(String message) {
    super(message);
  }

  @FormatMethod
  static CacheConfigurationException of(String format, Object... args) {
    return new CacheConfigurationException(String.format(US, format, args));
  }
}
