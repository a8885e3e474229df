/* Copyright (C) 2026 – ChomskyKit contributors
 * This file is part of ChomskyKit.
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
package de.chomskykit.algorithms.analyzer;

import de.chomskykit.api.ChomskyType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Chomsky type of the language recognized by an automaton.
 * <p>
 * For Turing machines the distinction between Type 1 and Type 0 is based on bounded simulation only; such results are
 * flagged as heuristic and carry a caveat.
 */
public final class LanguageClass {

    private final ChomskyType type;
    private final boolean heuristic;
    private final @Nullable String caveat;

    public LanguageClass(ChomskyType type, boolean heuristic, @Nullable String caveat) {
        this.type = type;
        this.heuristic = heuristic;
        this.caveat = caveat;
    }

    public ChomskyType getType() {
        return type;
    }

    public boolean isHeuristic() {
        return heuristic;
    }

    public @Nullable String getCaveat() {
        return caveat;
    }

    @Override
    public String toString() {
        return caveat == null ? type.toString() : type + " (" + caveat + ')';
    }
}
