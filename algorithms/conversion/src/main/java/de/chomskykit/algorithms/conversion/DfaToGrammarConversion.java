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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import de.chomskykit.api.logging.AnalysisLogger;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonState;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.Transition;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.Symbol;

/**
 * Reads a right-linear grammar off a DFA.
 * <p>
 * Every useful state (reachable and able to reach an accepting state) becomes a non-terminal of the same name. A
 * transition {@code δ(X, a) = Y} yields {@code X -> a Y} and an accepting state {@code X} yields {@code X -> ε}.
 * Productions are emitted per state in state order, transitions in alphabet order.
 */
public final class DfaToGrammarConversion {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(DfaToGrammarConversion.class);

    private DfaToGrammarConversion() {}

    /**
     * @throws IllegalArgumentException
     *         if the automaton is not a DFA or accepts no word at all
     */
    public static Grammar convert(Automaton dfa) {
        if (dfa.getVariant() != AutomatonVariant.DFA) {
            throw new IllegalArgumentException("Grammar extraction needs a DFA, got " + dfa.getVariant());
        }
        final Set<String> useful = findUsefulStates(dfa);
        final String initial = dfa.getInitialState().getId();
        if (!useful.contains(initial)) {
            throw new IllegalArgumentException("The automaton accepts no word, there is no grammar for its language");
        }

        final Grammar.Builder builder = Grammar.builder().withStartSymbol(Symbol.nonTerminal(initial));
        for (AutomatonState state : dfa.getStates()) {
            if (!useful.contains(state.getId())) {
                continue;
            }
            final Symbol left = Symbol.nonTerminal(state.getId());
            for (String symbol : dfa.getInputAlphabet()) {
                for (Transition t : dfa.getTransitions(state.getId(), symbol)) {
                    if (useful.contains(t.getTarget())) {
                        builder.addProduction(left, Symbol.terminal(symbol), Symbol.nonTerminal(t.getTarget()));
                    }
                }
            }
            if (state.isAccepting()) {
                builder.addProduction(left);
            }
        }

        final List<String> dropped = getDroppedStates(dfa);
        if (!dropped.isEmpty()) {
            LOGGER.logFinding("States without a non-terminal: " + dropped);
        }
        return builder.build();
    }

    /**
     * @return the states of {@code dfa} that do not contribute a non-terminal, in state order
     */
    public static List<String> getDroppedStates(Automaton dfa) {
        final Set<String> useful = findUsefulStates(dfa);
        final List<String> dropped = new ArrayList<>();
        for (AutomatonState s : dfa.getStates()) {
            if (!useful.contains(s.getId())) {
                dropped.add(s.getId());
            }
        }
        return dropped;
    }

    static Set<String> findUsefulStates(Automaton dfa) {
        final Set<String> reachable = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        for (AutomatonState s : dfa.getInitialStates()) {
            reachable.add(s.getId());
            queue.add(s.getId());
        }
        while (!queue.isEmpty()) {
            for (Transition t : dfa.getTransitions(queue.poll())) {
                if (reachable.add(t.getTarget())) {
                    queue.add(t.getTarget());
                }
            }
        }

        final Set<String> productive = new LinkedHashSet<>();
        dfa.getAcceptingStates().forEach(s -> productive.add(s.getId()));
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Transition t : dfa.getTransitions()) {
                if (productive.contains(t.getTarget()) && productive.add(t.getSource())) {
                    changed = true;
                }
            }
        }

        productive.retainAll(reachable);
        return Collections.unmodifiableSet(productive);
    }
}
