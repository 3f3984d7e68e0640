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

import com.axonops.flint.automaton.Hit;

/**
 * Produces the replacement text for one applied hit.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Substitution {

    /**
     * @param hit the hit being replaced
     * @return replacement text; null is treated as empty
     */
    String substitute(Hit hit);
}
