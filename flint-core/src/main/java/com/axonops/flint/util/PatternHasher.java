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


package com.axonops.flint.util;

import java.util.List;

/**
 * Log-safe fingerprints of pattern sets.
 *
 * <p>Patterns may contain sensitive terms, so logs only ever carry a hash of the set. The same set
 * always yields the same fingerprint, which keeps log lines greppable.
 *
 * <p>Example: {@code ["jedi", "sith"]} → {@code "5c1e7a02[n=2]"}
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * @param pattern a single pattern
     * @return hex hash of the pattern, or "null"
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * @param patterns a pattern set
     * @return hex hash of the ordered set plus its size (e.g., "5c1e7a02[n=2]")
     */
    public static String hash(List<String> patterns) {
        if (patterns == null) {
            return "null";
        }
        return Integer.toHexString(patterns.hashCode()) + "[n=" + patterns.size() + "]";
    }
}
