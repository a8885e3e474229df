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

import de.chomskykit.datastructure.automaton.Automaton;
import net.automatalib.words.Word;

/**
 * Runs an automaton on an input word.
 * <p>
 * Implementations never mutate the automaton and allocate their working state (state sets, stack, tape) per call, so a
 * single instance may be shared between threads.
 */
public interface Simulator {

    /**
     * @return the verdict; the outcomes of {@link Verdict} are reported, never thrown
     */
    SimulationResult simulate(Automaton automaton, Word<String> input);
}
