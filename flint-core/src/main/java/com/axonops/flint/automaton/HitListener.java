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


package com.axonops.flint.automaton;

/**
 * Push-style receiver of raw automaton hits.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface HitListener {

    /**
     * Called once per (position, pattern) pair, in scan order.
     *
     * @param startIndex inclusive start index into the scanned text
     * @param endIndex   inclusive end index into the scanned text
     * @param patternId  id of the matched pattern
     */
    void onHit(int startIndex, int endIndex, int patternId);
}
