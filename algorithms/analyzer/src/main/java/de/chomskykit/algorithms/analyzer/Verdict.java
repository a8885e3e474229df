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

/**
 * The outcome of simulating an automaton on one input.
 */
public enum Verdict {
    ACCEPTED,
    REJECTED,
    /** The input contains a symbol outside the input alphabet. */
    INVALID_SYMBOL,
    /** The simulation used up its step budget without reaching a verdict. */
    STEP_LIMIT_EXCEEDED
}
