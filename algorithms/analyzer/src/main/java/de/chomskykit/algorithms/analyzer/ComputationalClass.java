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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.chomskykit.datastructure.automaton.AutomatonVariant;

/**
 * The machine model of an automaton: its variant tag, whether its transition relation is deterministic and notes on
 * structural peculiarities (e.g. an NFA without any nondeterminism).
 */
public final class ComputationalClass {

    private final AutomatonVariant variant;
    private final boolean deterministic;
    private final List<String> notes;

    public ComputationalClass(AutomatonVariant variant, boolean deterministic, List<String> notes) {
        this.variant = variant;
        this.deterministic = deterministic;
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    public AutomatonVariant getVariant() {
        return variant;
    }

    public boolean isDeterministic() {
        return deterministic;
    }

    public List<String> getNotes() {
        return notes;
    }

    @Override
    public String toString() {
        return notes.isEmpty() ? variant.name() : variant + " (" + String.join(", ", notes) + ')';
    }
}
