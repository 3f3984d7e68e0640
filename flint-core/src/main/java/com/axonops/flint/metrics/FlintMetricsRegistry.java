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
 * Metrics sink used by Flint.
 *
 * <p>Decouples the library from any particular metrics system: the core module only talks to this
 * interface, and Dropwizard Metrics is optional at runtime.
 *
 * <p><strong>Metric types:</strong>
 * <ul>
 *   <li><strong>Counter:</strong> monotonically increasing long</li>
 *   <li><strong>Timer:</strong> duration in nanoseconds</li>
 *   <li><strong>Gauge:</strong> value computed on read via a supplier</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface FlintMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "find.operations.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a delta.
     *
     * @param name  metric name
     * @param delta amount to add (non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a duration.
     *
     * @param name          metric name (e.g., "find.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge, replacing any gauge already registered under the name.
     *
     * <p>The supplier is called on every read and must not block.
     *
     * @param name          metric name
     * @param valueSupplier current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a gauge. No-op if absent.
     *
     * @param name metric name
     */
    void removeGauge(String name);
}
