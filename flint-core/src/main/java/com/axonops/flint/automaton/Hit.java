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
 * A raw scan result: a pattern occurrence identified by pattern id.
 *
 * @param startIndex inclusive start index
 * @param endIndex   inclusive end index ({@code startIndex - 1} for the empty pattern)
 * @param patternId  id of the matched pattern
 * @since 1.0.0
 */
public record Hit(int startIndex, int endIndex, int patternId) {

    public int length() {
        return endIndex - startIndex + 1;
    }
}
