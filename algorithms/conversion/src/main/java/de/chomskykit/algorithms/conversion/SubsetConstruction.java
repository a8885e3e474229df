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
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonState;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.Transition;

/**
 * Powerset construction from an NFA (with or without epsilon transitions) to a DFA.
 * <p>
 * DFA states are named {@code D0, D1, ...} in breadth-first discovery order, exploring the input symbols in alphabet
 * order. Two DFA states are identified if they stand for the same set of NFA states. Empty successor sets are not
 * materialized: the result is a partial DFA, see {@link #complete(Automaton)}.
 */
public final class SubsetConstruction {

    public static final String DFA_STATE_PREFIX = "D";

    private SubsetConstruction() {}

    /**
     * @param nfa
     *         a finite automaton
     * @param maxStates
     *         the maximum number of DFA states to create
     *
     * @throws StepLimitExceededException
     *         if the DFA would need more than {@code maxStates} states
     */
    public static Result determinize(Automaton nfa, int maxStates) throws StepLimitExceededException {
        if (!nfa.getVariant().isFinite()) {
            throw new IllegalArgumentException("Subset construction needs a finite automaton, got " +
                                               nfa.getVariant());
        }

        final Map<String, Integer> order = new HashMap<>();
        for (AutomatonState s : nfa.getStates()) {
            order.put(s.getId(), order.size());
        }
        final Comparator<String> byDeclaration = Comparator.comparing(order::get);

        final List<String> initialIds = new ArrayList<>();
        nfa.getInitialStates().forEach(s -> initialIds.add(s.getId()));

        final Map<Set<String>, String> names = new HashMap<>();
        final Map<String, List<String>> subsets = new LinkedHashMap<>();
        final Queue<Set<String>> queue = new ArrayDeque<>();
        final List<Transition> transitions = new ArrayList<>();

        final Set<String> start = nfa.epsilonClosure(initialIds);
        register(start, names, subsets, queue, byDeclaration, maxStates);

        while (!queue.isEmpty()) {
            final Set<String> current = queue.poll();
            final String source = names.get(current);
            for (String symbol : nfa.getInputAlphabet()) {
                final Set<String> moved = new HashSet<>();
                for (String state : current) {
                    moved.addAll(nfa.getSuccessors(state, symbol));
                }
                if (moved.isEmpty()) {
                    continue;
                }
                final Set<String> target = new HashSet<>(nfa.epsilonClosure(moved));
                String targetName = names.get(target);
                if (targetName == null) {
                    targetName = register(target, names, subsets, queue, byDeclaration, maxStates);
                }
                transitions.add(Transition.of(source, symbol, targetName));
            }
        }

        final Automaton.Builder builder =
                Automaton.builder(AutomatonVariant.DFA).withInputAlphabet(nfa.getInputAlphabet());
        for (Map.Entry<String, List<String>> e : subsets.entrySet()) {
            final boolean accepting = e.getValue().stream().anyMatch(nfa::isAccepting);
            builder.addState(e.getKey(), e.getKey().equals(DFA_STATE_PREFIX + 0), accepting);
        }
        transitions.forEach(builder::addTransition);
        return new Result(builder.build(), subsets);
    }

    private static String register(Set<String> subset,
                                   Map<Set<String>, String> names,
                                   Map<String, List<String>> subsets,
                                   Queue<Set<String>> queue,
                                   Comparator<String> byDeclaration,
                                   int maxStates) throws StepLimitExceededException {
        if (names.size() >= maxStates) {
            throw new StepLimitExceededException("Subset construction", maxStates);
        }
        final String name = DFA_STATE_PREFIX + names.size();
        final Set<String> key = new HashSet<>(subset);
        final List<String> sorted = new ArrayList<>(subset);
        sorted.sort(byDeclaration);
        names.put(key, name);
        subsets.put(name, Collections.unmodifiableList(sorted));
        queue.add(key);
        return name;
    }

    /**
     * Adds a single non-accepting dead state that receives every missing transition. Returns the given DFA if it is
     * already complete.
     */
    public static Automaton complete(Automaton dfa) {
        String dead = "dead";
        while (dfa.getState(dead) != null) {
            dead += '\'';
        }

        final List<Transition> missing = new ArrayList<>();
        for (AutomatonState s : dfa.getStates()) {
            for (String symbol : dfa.getInputAlphabet()) {
                if (dfa.getTransitions(s.getId(), symbol).isEmpty()) {
                    missing.add(Transition.of(s.getId(), symbol, dead));
                }
            }
        }
        if (missing.isEmpty()) {
            return dfa;
        }

        final Automaton.Builder builder =
                Automaton.builder(AutomatonVariant.DFA).withInputAlphabet(dfa.getInputAlphabet());
        dfa.getStates().forEach(s -> builder.addState(s.getId(), s.isInitial(), s.isAccepting()));
        builder.addState(dead, false, false);
        dfa.getTransitions().forEach(builder::addTransition);
        missing.forEach(builder::addTransition);
        for (String symbol : dfa.getInputAlphabet()) {
            builder.addTransition(dead, symbol, dead);
        }
        return builder.build();
    }

    /**
     * A determinized automaton together with the NFA states each of its states stands for.
     */
    public static final class Result {

        private final Automaton dfa;
        private final Map<String, List<String>> subsets;

        Result(Automaton dfa, Map<String, List<String>> subsets) {
            this.dfa = dfa;
            this.subsets = Collections.unmodifiableMap(subsets);
        }

        public Automaton getDfa() {
            return dfa;
        }

        /**
         * @return for each DFA state, the NFA states it represents in their declaration order
         */
        public Map<String, List<String>> getSubsets() {
            return subsets;
        }
    }
}
