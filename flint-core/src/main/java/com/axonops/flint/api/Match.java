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

import java.util.Objects;

/**
 * One occurrence of a pattern in a text.
 *
 * <p>Indices are inclusive and refer to the original text, and {@code value} is the original
 * (not case-folded) substring {@code text.substring(startIndex, endIndex + 1)}. For the empty
 * pattern {@code endIndex == startIndex - 1}.
 *
 * @param startIndex index of the first character
 * @param endIndex index of the last character
 * @param value matched text
 * @since 1.0.0
 */
public record Match(int startIndex, int endIndex, String value) {

    public Match {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public int length() {
        return endIndex - startIndex + 1;
    }
}
