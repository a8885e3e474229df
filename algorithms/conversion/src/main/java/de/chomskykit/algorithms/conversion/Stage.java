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
package de.chomskykit.algorithms.conversion;

/**
 * The stages of the regex to grammar conversion, in execution order.
 */
public enum Stage {
    REGEX("Regular expression"),
    NFA("Thompson NFA"),
    SUBSET_DFA("Subset construction"),
    DFA("Minimal DFA"),
    GRAMMAR("Right-linear grammar");

    private final String title;

    Stage(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
