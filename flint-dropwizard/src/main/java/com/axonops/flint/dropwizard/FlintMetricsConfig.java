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


package com.axonops.flint.dropwizard;

import com.axonops.flint.cache.FlintConfig;
import com.axonops.flint.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for a {@link FlintConfig} that publishes to a Dropwizard
 * {@link MetricRegistry}, optionally exposed over JMX.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * TextMatcher.configureCache(FlintMetricsConfig.withMetrics(registry, "com.myapp.flint"));
 * }</pre>
 *
 * <p>At most one {@link JmxReporter} is started per JVM by this class; call {@link #shutdown()}
 * to stop it.
 *
 * @since 1.0.0
 */
public final class FlintMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(FlintMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private FlintMetricsConfig() {
        // Utility class
    }

    /**
     * Metrics under the default prefix {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}, with JMX.
     *
     * @param registry the Dropwizard registry to publish to
     * @return default configuration with metrics enabled
     */
    public static FlintConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    public static FlintConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * @param registry     the Dropwizard registry to publish to
     * @param metricPrefix metric namespace (e.g. "com.myapp.flint")
     * @param enableJmx    start a JMX reporter for the registry if none is running
     * @return default configuration with metrics enabled
     */
    public static FlintConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return FlintConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("Flint: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal, the registry may already be exposed
                logger.warn("Flint: Failed to start JmxReporter", e);
            }
        }
    }

    static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /** Stops the JMX reporter started by this class, if any. */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Flint: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
