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

import java.util.LinkedHashSet;
import java.util.Set;

import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonState;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import net.automatalib.words.Word;

/**
 * Simulates DFAs by following their transitions and NFAs by tracking the epsilon-closed set of active states.
 * <p>
 * Both take exactly one step per input symbol.
 */
public class FiniteAutomatonSimulator extends AbstractSimulator {

    @Override
    protected boolean supports(AutomatonVariant variant) {
        return variant.isFinite();
    }

    @Override
    protected SimulationResult doSimulate(Automaton automaton, Word<String> input) {
        return automaton.getVariant() == AutomatonVariant.DFA ? runDeterministic(automaton, input) :
                runNondeterministic(automaton, input);
    }

    private SimulationResult runDeterministic(Automaton dfa, Word<String> input) {
        String current = dfa.getInitialState().getId();
        for (int i = 0; i < input.length(); i++) {
            final String symbol = input.getSymbol(i);
            final Set<String> successors = dfa.getSuccessors(current, symbol);
            if (successors.isEmpty()) {
                return SimulationResult.stuck(current, symbol, i, i);
            }
            current = successors.iterator().next();
        }
        return finish(dfa.isAccepting(current), input.length(), "ended in state " + current);
    }

    private SimulationResult runNondeterministic(Automaton nfa, Word<String> input) {
        final Set<String> initial = new LinkedHashSet<>();
        for (AutomatonState s : nfa.getInitialStates()) {
            initial.add(s.getId());
        }
        Set<String> active = nfa.epsilonClosure(initial);

        for (int i = 0; i < input.length(); i++) {
            final Set<String> next = new LinkedHashSet<>();
            for (String state : active) {
                next.addAll(nfa.getSuccessors(state, input.getSymbol(i)));
            }
            active = nfa.epsilonClosure(next);
            if (active.isEmpty()) {
                return SimulationResult.rejected(i + 1, "no active state after position " + i);
            }
        }

        final Set<String> accepting = new LinkedHashSet<>();
        for (String state : active) {
            if (nfa.isAccepting(state)) {
                accepting.add(state);
            }
        }
        return finish(!accepting.isEmpty(),
                      input.length(),
                      "ended in " + (accepting.isEmpty() ? active : accepting));
    }

    private static SimulationResult finish(boolean accepted, long steps, String detail) {
        return accepted ? SimulationResult.accepted(steps, detail) : SimulationResult.rejected(steps, detail);
    }
}
