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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link FlintMetricsRegistry} backed by a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name is qualified with a prefix, so with the default prefix the find counter is
 * registered as {@code com.axonops.flint.find.operations.total.count}.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * FlintConfig config = FlintConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.flint"))
 *     .build();
 * TextMatcher.configureCache(config);
 * }</pre>
 *
 * <p>Thread-safe.
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements FlintMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.flint";

    private final MetricRegistry registry;
    private final String prefix;

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry Dropwizard registry to publish to
     * @param prefix   metric name prefix (e.g., "myapp.flint")
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    public MetricRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);
        // Replace, registry.register rejects duplicates
        registry.remove(fullName);
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
