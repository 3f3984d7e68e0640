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


package com.axonops.flint.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daemon thread that periodically evicts idle matchers from a {@link MatcherCache}.
 *
 * @since 1.0.0
 */
final class IdleEvictionTask {
    private static final Logger logger = LoggerFactory.getLogger(IdleEvictionTask.class);

    private final MatcherCache cache;
    private final long scanIntervalMs;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    IdleEvictionTask(MatcherCache cache, FlintConfig config) {
        this.cache = cache;
        this.scanIntervalMs = config.evictionScanIntervalSeconds() * 1000;
    }

    void start() {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "Flint-IdleEviction");
            t.setDaemon(true);
            t.setPriority(Thread.MIN_PRIORITY);
            thread = t;
            t.start();

            logger.info("Flint: Idle eviction thread started - interval: {}ms", scanIntervalMs);
        }
    }

    void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            logger.info("Flint: Idle eviction thread stopped");
        }
    }

    private void run() {
        while (running.get()) {
            try {
                Thread.sleep(scanIntervalMs);
                int evicted = cache.evictIdleMatchers();
                logger.debug("Flint: Idle eviction scan complete - evicted: {}", evicted);
            } catch (InterruptedException e) {
                logger.debug("Flint: Idle eviction thread interrupted");
                break;
            } catch (RuntimeException e) {
                // Keep scanning
                logger.error("Flint: Error in idle eviction thread", e);
            }
        }
        logger.debug("Flint: Idle eviction thread exiting");
    }

    boolean isRunning() {
        Thread t = thread;
        return running.get() && t != null && t.isAlive();
    }
}
