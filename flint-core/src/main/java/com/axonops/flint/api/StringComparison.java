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

import com.axonops.flint.text.Normalizer;

import java.util.Locale;

/**
 * How patterns are compared with the text.
 *
 * <p>Comparisons fold one UTF-16 code unit at a time, so match indices always refer to the original
 * text. Case-sensitive comparisons are ordinal; the {@code *_IGNORE_CASE} variants upper-case both
 * sides before matching.
 *
 * @since 1.0.0
 */
public enum StringComparison {
    /** Case-sensitive code-unit comparison. */
    ORDINAL,
    /** Code-unit comparison after culture-neutral upper-casing. */
    ORDINAL_IGNORE_CASE,
    /** Case-sensitive; equivalent to {@link #ORDINAL}. */
    CURRENT_CULTURE,
    /** Upper-casing with the default locale's rules (Turkish and Azeri dotted i included). */
    CURRENT_CULTURE_IGNORE_CASE,
    /** Case-sensitive; equivalent to {@link #ORDINAL}. */
    INVARIANT_CULTURE,
    /** Upper-casing with {@link Locale#ROOT} rules. */
    INVARIANT_CULTURE_IGNORE_CASE;

    public boolean isIgnoreCase() {
        return this == ORDINAL_IGNORE_CASE
            || this == CURRENT_CULTURE_IGNORE_CASE
            || this == INVARIANT_CULTURE_IGNORE_CASE;
    }

    /**
     * Locale whose casing rules apply, resolved now.
     *
     * @return the default locale for {@link #CURRENT_CULTURE_IGNORE_CASE}, {@link Locale#ROOT} for
     *     the other ignore-case comparisons, null for case-sensitive ones
     */
    public Locale locale() {
        switch (this) {
            case CURRENT_CULTURE_IGNORE_CASE:
                return Locale.getDefault();
            case ORDINAL_IGNORE_CASE:
            case INVARIANT_CULTURE_IGNORE_CASE:
                return Locale.ROOT;
            default:
                return null;
        }
    }

    /**
     * Builds the fold for this comparison. The current culture is captured at this call.
     *
     * @return normalizer applied to patterns and texts
     */
    public Normalizer normalizer() {
        switch (this) {
            case CURRENT_CULTURE_IGNORE_CASE:
                return Normalizer.upperCase(Locale.getDefault());
            case ORDINAL_IGNORE_CASE:
            case INVARIANT_CULTURE_IGNORE_CASE:
                return Normalizer.invariantUpperCase();
            default:
                return Normalizer.IDENTITY;
        }
    }
}
