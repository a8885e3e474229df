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
package de.chomskykit.datastructure.automaton;

import java.util.HashMap;
import java.util.Map;

import net.automatalib.automata.fsa.impl.compact.CompactDFA;

/**
 * Bridges to AutomataLib's automaton implementations.
 */
public final class AutomatonConversions {

    private AutomatonConversions() {
        // prevent instantiation
    }

    /**
     * Exports a DFA to a (possibly partial) {@link CompactDFA} over the same input alphabet.
     *
     * @throws IllegalArgumentException if the automaton is not a DFA
     */
    public static CompactDFA<String> toCompactDFA(Automaton automaton) {
        if (automaton.getVariant() != AutomatonVariant.DFA) {
            throw new IllegalArgumentException("Only DFAs can be exported, got " + automaton.getVariant());
        }

        final CompactDFA<String> result = new CompactDFA<>(automaton.getInputAlphabet());
        final Map<String, Integer> ids = new HashMap<>();
        for (AutomatonState s : automaton.getStates()) {
            final Integer id = s.isInitial() ? result.addInitialState(s.isAccepting()) : result.addState(s.isAccepting());
            ids.put(s.getId(), id);
        }
        for (Transition t : automaton.getTransitions()) {
            final Integer source = ids.get(t.getSource());
            final Integer target = ids.get(t.getTarget());
            result.setTransition(source, t.getInput(), target);
        }
        return result;
    }
}
