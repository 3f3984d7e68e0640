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


package com.axonops.flint.api;

/**
 * Which automaton hits become matches.
 *
 * @since 1.0.0
 */
public enum MatchMode {
    /** Every occurrence, including inside longer words and overlapping ones. */
    FUZZY,
    /**
     * Whole-word occurrences only. The match must not be adjacent to a letter, digit or underscore,
     * and its text must equal the pattern exactly, case included, whatever the comparison.
     */
    EXACT_MATCH
}
