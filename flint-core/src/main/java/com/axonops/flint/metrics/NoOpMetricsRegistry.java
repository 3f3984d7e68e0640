/*
 * Copyright 2025 AxonOps
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


package com.axonops.flint.metrics;

import java.util.function.Supplier;

/**
 * Metrics registry that discards everything.
 *
 * <p>Default for {@link com.axonops.flint.cache.FlintConfig#DEFAULT}.
 *
 * @since 1.0.0
 */
public final class NoOpMetricsRegistry implements FlintMetricsRegistry {

  /** Shared instance. */
  public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

  private NoOpMetricsRegistry() {}

  @Override
  public void incrementCounter(String name) {}

  @Override
  public void incrementCounter(String name, long delta) {}

  @Override
  public void recordTimer(String name, long durationNanos) {}

  @Override
  public void registerGauge(String name, Supplier<Number> valueSupplier) {}

  @Override
  public void removeGauge(String name) {}
}
