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


package com.axonops.flint.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Length-preserving, per-code-unit case fold.
 *
 * <p>Patterns and texts are folded with the same normalizer before they reach the automaton, so a
 * match at index {@code i} of the folded text is also at index {@code i} of the original text.
 * Folds that would expand a single code unit into several (e.g. German sharp s) are never used:
 * each {@code char} maps to exactly one {@code char}.
 *
 * <p>Instances are immutable and thread-safe.
 *
 * @since 1.0.0
 */
public final class Normalizer {

    /** No-op fold used by the case-sensitive comparisons. */
    public static final Normalizer IDENTITY = new Normalizer(null);

    private static final char DOTTED_CAPITAL_I = 'İ';

    private final Locale locale;
    private final boolean turkic;

    private Normalizer(Locale locale) {
        this.locale = locale;
        this.turkic = locale != null && isTurkic(locale);
    }

    /**
     * Culture-neutral upper-case fold.
     *
     * @return invariant upper-casing normalizer
     */
    public static Normalizer invariantUpperCase() {
        return new Normalizer(Locale.ROOT);
    }

    /**
     * Upper-case fold for a specific locale.
     *
     * @param locale locale whose casing rules apply
     * @return upper-casing normalizer
     */
    public static Normalizer upperCase(Locale locale) {
        Objects.requireNonNull(locale, "locale cannot be null");
        return new Normalizer(locale);
    }

    public boolean isIdentity() {
        return locale == null;
    }

    public Locale locale() {
        return locale;
    }

    public char normalize(char c) {
        if (locale == null) {
            return c;
        }
        if (turkic && c == 'i') {
            return DOTTED_CAPITAL_I;
        }
        return Character.toUpperCase(c);
    }

    /**
     * Folds a string.
     *
     * @param value string to fold
     * @return folded string of the same length (the same instance if nothing changed)
     */
    public String normalize(String value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (locale == null) {
            return value;
        }

        char[] chars = null;
        for (int i = 0; i < value.length(); i++) {
            char original = value.charAt(i);
            char folded = normalize(original);
            if (folded != original) {
                if (chars == null) {
                    chars = value.toCharArray();
                }
                chars[i] = folded;
            }
        }
        return chars == null ? value : new String(chars);
    }

    public List<String> normalizeAll(List<String> values) {
        if (locale == null) {
            return values;
        }
        List<String> folded = new ArrayList<>(values.size());
        for (String value : values) {
            folded.add(normalize(value));
        }
        return Collections.unmodifiableList(folded);
    }

    private static boolean isTurkic(Locale locale) {
        String language = locale.getLanguage();
        return "tr".equals(language) || "az".equals(language);
    }

    @Override
    public String toString() {
        return locale == null ? "Normalizer{identity}" : "Normalizer{upperCase, locale=" + locale.toLanguageTag() + "}";
    }
}
