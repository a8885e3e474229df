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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable DFA, NFA, PDA or Turing machine.
 * <p>
 * All variants share the same representation (states, input alphabet and a list of {@link Transition}s); each variant
 * only uses the extra fields it needs: the stack alphabet and initial stack symbol for PDAs, the tape alphabet and
 * blank symbol for Turing machines. Instances are created through {@link Builder}, which rejects automata violating
 * the invariants of their variant (see {@link AutomatonValidator}).
 */
public final class Automaton {

    public static final String DEFAULT_BLANK = "_";

    private final AutomatonVariant variant;
    private final List<AutomatonState> states;
    private final Map<String, AutomatonState> stateById;
    private final Alphabet<String> inputAlphabet;
    private final List<Transition> transitions;
    private final Map<String, List<Transition>> transitionsBySource;
    private final List<String> stackAlphabet;
    private final @Nullable String initialStackSymbol;
    private final List<String> tapeAlphabet;
    private final @Nullable String blankSymbol;

    private Automaton(AutomatonVariant variant,
                      List<AutomatonState> states,
                      Alphabet<String> inputAlphabet,
                      List<Transition> transitions,
                      List<String> stackAlphabet,
                      @Nullable String initialStackSymbol,
                      List<String> tapeAlphabet,
                      @Nullable String blankSymbol) {
        this.variant = variant;
        this.states = states;
        this.inputAlphabet = inputAlphabet;
        this.transitions = transitions;
        this.stackAlphabet = stackAlphabet;
        this.initialStackSymbol = initialStackSymbol;
        this.tapeAlphabet = tapeAlphabet;
        this.blankSymbol = blankSymbol;

        this.stateById = new HashMap<>();
        for (AutomatonState s : states) {
            this.stateById.putIfAbsent(s.getId(), s);
        }
        final Map<String, List<Transition>> bySource = new HashMap<>();
        for (Transition t : transitions) {
            bySource.computeIfAbsent(t.getSource(), k -> new ArrayList<>()).add(t);
        }
        this.transitionsBySource = bySource;
    }

    public static Builder builder(AutomatonVariant variant) {
        return new Builder(variant);
    }

    public AutomatonVariant getVariant() {
        return variant;
    }

    public List<AutomatonState> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public @Nullable AutomatonState getState(String id) {
        return stateById.get(id);
    }

    public boolean isAccepting(String stateId) {
        final AutomatonState state = stateById.get(stateId);
        return state != null && state.isAccepting();
    }

    public List<AutomatonState> getInitialStates() {
        return states.stream().filter(AutomatonState::isInitial).collect(Collectors.toList());
    }

    /**
     * @return the unique initial state
     *
     * @throws IllegalStateException if the automaton has several initial states
     */
    public AutomatonState getInitialState() {
        final List<AutomatonState> initial = getInitialStates();
        if (initial.size() != 1) {
            throw new IllegalStateException("Automaton has " + initial.size() + " initial states");
        }
        return initial.get(0);
    }

    public List<AutomatonState> getAcceptingStates() {
        return states.stream().filter(AutomatonState::isAccepting).collect(Collectors.toList());
    }

    public Alphabet<String> getInputAlphabet() {
        return inputAlphabet;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    public List<Transition> getTransitions(String state) {
        return transitionsBySource.getOrDefault(state, Collections.emptyList());
    }

    /**
     * @param input the input symbol, {@code null} for epsilon transitions
     */
    public List<Transition> getTransitions(String state, @Nullable String input) {
        final List<Transition> result = new ArrayList<>();
        for (Transition t : getTransitions(state)) {
            if (Objects.equals(t.getInput(), input)) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * @param input the input symbol, {@code null} for epsilon transitions
     *
     * @return the distinct targets, in transition order
     */
    public Set<String> getSuccessors(String state, @Nullable String input) {
        final Set<String> result = new LinkedHashSet<>();
        for (Transition t : getTransitions(state, input)) {
            result.add(t.getTarget());
        }
        return result;
    }

    /**
     * @return the given states plus every state reachable from them through epsilon transitions
     */
    public Set<String> epsilonClosure(Collection<String> from) {
        final Set<String> closure = new LinkedHashSet<>(from);
        final Deque<String> worklist = new ArrayDeque<>(from);
        while (!worklist.isEmpty()) {
            for (String next : getSuccessors(worklist.pop(), null)) {
                if (closure.add(next)) {
                    worklist.push(next);
                }
            }
        }
        return closure;
    }

    public boolean hasEpsilonTransitions() {
        return transitions.stream().anyMatch(Transition::isEpsilon);
    }

    /**
     * Checks whether the transition relation is deterministic, regardless of the variant tag: no epsilon moves and
     * at most one transition per state and input (and, for PDAs, per popped symbol).
     */
    public boolean isStructurallyDeterministic() {
        if (hasEpsilonTransitions() || getInitialStates().size() > 1) {
            return false;
        }
        final Set<List<Object>> keys = new LinkedHashSet<>();
        for (Transition t : transitions) {
            final StackAction stack = t.getStackAction();
            final List<Object> key = new ArrayList<>(3);
            key.add(t.getSource());
            key.add(t.getInput());
            if (stack != null) {
                key.add(stack.getPop());
            }
            if (!keys.add(key)) {
                return false;
            }
        }
        return true;
    }

    public List<String> getStackAlphabet() {
        return stackAlphabet;
    }

    public @Nullable String getInitialStackSymbol() {
        return initialStackSymbol;
    }

    public List<String> getTapeAlphabet() {
        return tapeAlphabet;
    }

    public @Nullable String getBlankSymbol() {
        return blankSymbol;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Automaton)) {
            return false;
        }
        Automaton other = (Automaton) obj;
        return variant == other.variant && states.equals(other.states) &&
               new ArrayList<>(inputAlphabet).equals(new ArrayList<>(other.inputAlphabet)) &&
               new LinkedHashSet<>(transitions).equals(new LinkedHashSet<>(other.transitions)) &&
               stackAlphabet.equals(other.stackAlphabet) &&
               Objects.equals(initialStackSymbol, other.initialStackSymbol) &&
               tapeAlphabet.equals(other.tapeAlphabet) && Objects.equals(blankSymbol, other.blankSymbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variant, states, new LinkedHashSet<>(transitions));
    }

    @Override
    public String toString() {
        return AutomatonWriter.write(this);
    }

    /**
     * Assembles an {@link Automaton}. States keep the order in which they were added.
     */
    public static final class Builder {

        private final AutomatonVariant variant;
        private final Map<String, AutomatonState> states = new LinkedHashMap<>();
        private final List<String> duplicateStates = new ArrayList<>();
        private final Set<String> inputAlphabet = new LinkedHashSet<>();
        private final List<Transition> transitions = new ArrayList<>();
        private final Set<String> stackAlphabet = new LinkedHashSet<>();
        private @Nullable String initialStackSymbol;
        private final Set<String> tapeAlphabet = new LinkedHashSet<>();
        private @Nullable String blankSymbol;

        private Builder(AutomatonVariant variant) {
            this.variant = variant;
        }

        public Builder addState(String id, boolean initial, boolean accepting) {
            if (states.putIfAbsent(id, new AutomatonState(id, initial, accepting)) != null) {
                duplicateStates.add(id);
            }
            return this;
        }

        public Builder addState(String id) {
            return addState(id, false, false);
        }

        public Builder addInitialState(String id, boolean accepting) {
            return addState(id, true, accepting);
        }

        public Builder withInputAlphabet(Collection<String> symbols) {
            inputAlphabet.addAll(symbols);
            return this;
        }

        public Builder withInputAlphabet(String... symbols) {
            return withInputAlphabet(Arrays.asList(symbols));
        }

        public Builder addTransition(Transition transition) {
            transitions.add(transition);
            return this;
        }

        public Builder addTransition(String source, @Nullable String input, String target) {
            return addTransition(Transition.of(source, input, target));
        }

        public Builder withStackAlphabet(Collection<String> symbols) {
            stackAlphabet.addAll(symbols);
            return this;
        }

        /**
         * Sets the symbol the stack initially holds. Defaults to the first stack symbol.
         */
        public Builder withInitialStackSymbol(String symbol) {
            this.initialStackSymbol = symbol;
            return this;
        }

        public Builder withTapeAlphabet(Collection<String> symbols) {
            tapeAlphabet.addAll(symbols);
            return this;
        }

        /**
         * Sets the blank symbol. Defaults to {@value Automaton#DEFAULT_BLANK}.
         */
        public Builder withBlankSymbol(String symbol) {
            this.blankSymbol = symbol;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the automaton violates an invariant of its variant
         */
        public Automaton build() {
            final Automaton automaton = assemble();
            final List<AutomatonValidator.Problem> problems = AutomatonValidator.validate(automaton);
            if (!duplicateStates.isEmpty() || !problems.isEmpty()) {
                final StringBuilder sb = new StringBuilder("Invalid ").append(variant).append(':');
                for (String d : duplicateStates) {
                    sb.append(System.lineSeparator()).append("  duplicate state ").append(d);
                }
                for (AutomatonValidator.Problem p : problems) {
                    sb.append(System.lineSeparator()).append("  ").append(p);
                }
                throw new IllegalArgumentException(sb.toString());
            }
            return automaton;
        }

        List<String> getDuplicateStates() {
            return duplicateStates;
        }

        Automaton assemble() {
            String stackStart = null;
            if (variant == AutomatonVariant.PDA) {
                stackStart = initialStackSymbol != null ? initialStackSymbol :
                        stackAlphabet.isEmpty() ? null : stackAlphabet.iterator().next();
            }
            String blank = null;
            if (variant == AutomatonVariant.TM) {
                blank = blankSymbol != null ? blankSymbol : DEFAULT_BLANK;
            }
            return new Automaton(variant,
                                 Collections.unmodifiableList(new ArrayList<>(states.values())),
                                 Alphabets.fromList(new ArrayList<>(inputAlphabet)),
                                 Collections.unmodifiableList(new ArrayList<>(transitions)),
                                 Collections.unmodifiableList(new ArrayList<>(stackAlphabet)),
                                 stackStart,
                                 Collections.unmodifiableList(new ArrayList<>(tapeAlphabet)),
                                 blank);
        }
    }
}
