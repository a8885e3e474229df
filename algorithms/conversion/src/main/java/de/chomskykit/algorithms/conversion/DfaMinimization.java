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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonConversions;
import de.chomskykit.datastructure.automaton.AutomatonState;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.Transition;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.minimizer.hopcroft.HopcroftMinimization;
import net.automatalib.words.Alphabet;

/**
 * Minimization of (possibly partial) DFAs with AutomataLib's Hopcroft minimization.
 * <p>
 * Missing transitions are treated as transitions into an implicit dead state. States equivalent to that dead state
 * and unreachable states do not appear in the result, so the minimal DFA is partial again. Its states are named
 * {@code D0, D1, ...} in breadth-first order from the initial state, exploring symbols in alphabet order. A DFA
 * that accepts nothing minimizes to a single non-accepting state without transitions.
 */
public final class DfaMinimization {

    private DfaMinimization() {}

    public static Result minimize(Automaton dfa) {
        if (dfa.getVariant() != AutomatonVariant.DFA) {
            throw new IllegalArgumentException("Minimization needs a DFA, got " + dfa.getVariant());
        }

        final Alphabet<String> alphabet = dfa.getInputAlphabet();
        final CompactDFA<String> minimal =
                HopcroftMinimization.minimizePartialDFA(AutomatonConversions.toCompactDFA(dfa), alphabet);
        final Integer initial = minimal.getInitialState();
        final Set<Integer> useful = initial == null ? Collections.emptySet() : usefulStates(minimal, alphabet);

        final Map<Integer, String> names = new LinkedHashMap<>();
        final List<Transition> transitions = new ArrayList<>();
        final Queue<Integer> queue = new ArrayDeque<>();
        if (useful.contains(initial)) {
            names.put(initial, SubsetConstruction.DFA_STATE_PREFIX + 0);
            queue.add(initial);
        }
        while (!queue.isEmpty()) {
            final Integer current = queue.poll();
            for (String symbol : alphabet) {
                final Integer target = minimal.getSuccessor(current, symbol);
                if (target == null || !useful.contains(target)) {
                    continue;
                }
                if (!names.containsKey(target)) {
                    names.put(target, SubsetConstruction.DFA_STATE_PREFIX + names.size());
                    queue.add(target);
                }
                transitions.add(Transition.of(names.get(current), symbol, names.get(target)));
            }
        }

        final boolean emptyLanguage = names.isEmpty();
        final String emptyName = SubsetConstruction.DFA_STATE_PREFIX + 0;
        final Automaton.Builder builder = Automaton.builder(AutomatonVariant.DFA).withInputAlphabet(alphabet);
        if (emptyLanguage) {
            builder.addState(emptyName, true, false);
        }
        for (Map.Entry<Integer, String> e : names.entrySet()) {
            builder.addState(e.getValue(), e.getKey().equals(initial), minimal.isAccepting(e.getKey()));
        }
        transitions.forEach(builder::addTransition);

        final Map<String, List<String>> merged = new LinkedHashMap<>();
        for (String name : names.values()) {
            merged.put(name, new ArrayList<>());
        }
        if (emptyLanguage) {
            merged.put(emptyName, new ArrayList<>());
        }
        final List<String> removed = new ArrayList<>();
        final Map<String, Integer> partners = partners(dfa, minimal, alphabet);
        for (AutomatonState s : dfa.getStates()) {
            final Integer partner = partners.get(s.getId());
            if (partner != null && names.containsKey(partner)) {
                merged.get(names.get(partner)).add(s.getId());
            } else if (emptyLanguage && partners.containsKey(s.getId())) {
                // all reachable states collapse into the single rejecting state
                merged.get(emptyName).add(s.getId());
            } else {
                removed.add(s.getId());
            }
        }
        return new Result(builder.build(), merged, removed);
    }

    /**
     * Runs the original DFA and the minimized one in lockstep and records, for every reachable original state, the
     * minimized state it corresponds to ({@code null} where the minimized DFA is already stuck).
     */
    private static Map<String, Integer> partners(Automaton dfa, CompactDFA<String> minimal, Alphabet<String> alphabet) {
        final Map<String, Integer> partners = new HashMap<>();
        final Queue<String> queue = new ArrayDeque<>();
        final String initial = dfa.getInitialState().getId();
        partners.put(initial, minimal.getInitialState());
        queue.add(initial);
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            final Integer partner = partners.get(current);
            for (String symbol : alphabet) {
                for (Transition t : dfa.getTransitions(current, symbol)) {
                    if (!partners.containsKey(t.getTarget())) {
                        partners.put(t.getTarget(), partner == null ? null : minimal.getSuccessor(partner, symbol));
                        queue.add(t.getTarget());
                    }
                }
            }
        }
        return partners;
    }

    private static Set<Integer> usefulStates(CompactDFA<String> dfa, Alphabet<String> alphabet) {
        final Map<Integer, List<Integer>> predecessors = new HashMap<>();
        final Queue<Integer> queue = new ArrayDeque<>();
        final Set<Integer> useful = new HashSet<>();
        for (Integer state : dfa.getStates()) {
            for (String symbol : alphabet) {
                final Integer target = dfa.getSuccessor(state, symbol);
                if (target != null) {
                    predecessors.computeIfAbsent(target, k -> new ArrayList<>()).add(state);
                }
            }
            if (dfa.isAccepting(state)) {
                useful.add(state);
                queue.add(state);
            }
        }
        while (!queue.isEmpty()) {
            for (Integer pred : predecessors.getOrDefault(queue.poll(), Collections.emptyList())) {
                if (useful.add(pred)) {
                    queue.add(pred);
                }
            }
        }
        return useful;
    }

    /**
     * A minimized DFA and how its states relate to the original ones.
     */
    public static final class Result {

        private final Automaton dfa;
        private final Map<String, List<String>> mergedStates;
        private final List<String> removedStates;

        Result(Automaton dfa, Map<String, List<String>> mergedStates, List<String> removedStates) {
            this.dfa = dfa;
            this.mergedStates = Collections.unmodifiableMap(mergedStates);
            this.removedStates = Collections.unmodifiableList(removedStates);
        }

        public Automaton getDfa() {
            return dfa;
        }

        /**
         * @return for each state of the minimized DFA, the reachable original states it replaces
         */
        public Map<String, List<String>> getMergedStates() {
            return mergedStates;
        }

        /**
         * @return original states that are unreachable or cannot reach an accepting state
         */
        public List<String> getRemovedStates() {
            return removedStates;
        }
    }
}
