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
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import net.automatalib.words.Word;

/**
 * Base class for simulators: validates the input against the input alphabet before delegating to the variant specific
 * simulation.
 */
public abstract class AbstractSimulator implements Simulator {

    @Override
    public final SimulationResult simulate(Automaton automaton, Word<String> input) {
        if (!supports(automaton.getVariant())) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " cannot simulate a " +
                                               automaton.getVariant());
        }
        for (int i = 0; i < input.length(); i++) {
            final String symbol = input.getSymbol(i);
            if (!automaton.getInputAlphabet().contains(symbol)) {
                return SimulationResult.invalidSymbol(symbol, i);
            }
        }
        return doSimulate(automaton, input);
    }

    protected abstract boolean supports(AutomatonVariant variant);

    /**
     * Simulates the automaton on an input that only consists of symbols of its input alphabet.
     */
    protected abstract SimulationResult doSimulate(Automaton automaton, Word<String> input);
}
