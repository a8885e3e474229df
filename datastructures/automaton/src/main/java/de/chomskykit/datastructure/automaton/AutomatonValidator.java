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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks the structural invariants of an {@link Automaton} with respect to its {@link AutomatonVariant}.
 * <p>
 * All variants require declared states and symbols. In addition:
 * <ul>
 * <li>DFA: exactly one initial state, no epsilon transitions, at most one transition per state and symbol;</li>
 * <li>NFA: at least one initial state;</li>
 * <li>PDA: exactly one initial state, a non-empty stack alphabet and a stack action over it on every transition;</li>
 * <li>TM: exactly one initial state, a blank symbol from the tape alphabet but not from the input alphabet, an input
 * alphabet contained in the tape alphabet and a deterministic tape action on every transition.</li>
 * </ul>
 * The validator reports every problem instead of stopping at the first one.
 */
public final class AutomatonValidator {

    private AutomatonValidator() {
        // prevent instantiation
    }

    public static List<Problem> validate(Automaton automaton) {
        final List<Problem> problems = new ArrayList<>();
        final AutomatonVariant variant = automaton.getVariant();

        if (automaton.getStates().isEmpty()) {
            problems.add(new Problem("the automaton has no states", null));
        }

        final int initial = automaton.getInitialStates().size();
        if (variant == AutomatonVariant.NFA) {
            if (initial == 0) {
                problems.add(new Problem("an NFA needs at least one initial state", null));
            }
        } else if (initial != 1) {
            problems.add(new Problem("a " + variant + " needs exactly one initial state, found " + initial, null));
        }

        switch (variant) {
            case PDA:
                checkStackAlphabet(automaton, problems);
                break;
            case TM:
                checkTapeAlphabet(automaton, problems);
                break;
            default:
                break;
        }

        final Set<List<Object>> seen = new HashSet<>();
        for (Transition t : automaton.getTransitions()) {
            checkTransition(automaton, t, problems);
            if ((variant == AutomatonVariant.DFA || variant == AutomatonVariant.TM) &&
                !seen.add(Arrays.asList(t.getSource(), t.getInput()))) {
                problems.add(new Problem("more than one transition for state " + t.getSource() + " and symbol " +
                                         t.getInput(), t));
            }
        }

        return problems;
    }

    private static void checkStackAlphabet(Automaton automaton, List<Problem> problems) {
        if (automaton.getStackAlphabet().isEmpty()) {
            problems.add(new Problem("a PDA needs a non-empty stack alphabet", null));
        } else if (!automaton.getStackAlphabet().contains(automaton.getInitialStackSymbol())) {
            problems.add(new Problem("initial stack symbol " + automaton.getInitialStackSymbol() +
                                     " is not in the stack alphabet", null));
        }
    }

    private static void checkTapeAlphabet(Automaton automaton, List<Problem> problems) {
        final List<String> tape = automaton.getTapeAlphabet();
        final String blank = automaton.getBlankSymbol();
        if (!tape.contains(blank)) {
            problems.add(new Problem("blank symbol " + blank + " is not in the tape alphabet", null));
        }
        if (automaton.getInputAlphabet().contains(blank)) {
            problems.add(new Problem("blank symbol " + blank + " must not be an input symbol", null));
        }
        for (String a : automaton.getInputAlphabet()) {
            if (!tape.contains(a)) {
                problems.add(new Problem("input symbol " + a + " is not in the tape alphabet", null));
            }
        }
    }

    private static void checkTransition(Automaton automaton, Transition t, List<Problem> problems) {
        final AutomatonVariant variant = automaton.getVariant();
        if (automaton.getState(t.getSource()) == null) {
            problems.add(new Problem("undeclared state " + t.getSource(), t));
        }
        if (automaton.getState(t.getTarget()) == null) {
            problems.add(new Problem("undeclared state " + t.getTarget(), t));
        }

        final String input = t.getInput();
        if (variant == AutomatonVariant.TM) {
            if (input == null) {
                problems.add(new Problem("a TM transition must read a symbol", t));
            } else if (!automaton.getTapeAlphabet().contains(input)) {
                problems.add(new Problem("symbol " + input + " is not in the tape alphabet", t));
            }
        } else if (input != null && !automaton.getInputAlphabet().contains(input)) {
            problems.add(new Problem("symbol " + input + " is not in the input alphabet", t));
        } else if (input == null && variant == AutomatonVariant.DFA) {
            problems.add(new Problem("a DFA must not have epsilon transitions", t));
        }

        final StackAction stack = t.getStackAction();
        if (variant == AutomatonVariant.PDA) {
            if (stack == null) {
                problems.add(new Problem("a PDA transition needs a stack action", t));
            } else {
                checkStackSymbol(automaton, stack.getPop(), t, problems);
                for (String s : stack.getPush()) {
                    checkStackSymbol(automaton, s, t, problems);
                }
            }
        } else if (stack != null) {
            problems.add(new Problem("only PDA transitions may have a stack action", t));
        }

        final TapeAction tape = t.getTapeAction();
        if (variant == AutomatonVariant.TM) {
            if (tape == null) {
                problems.add(new Problem("a TM transition needs a tape action", t));
            } else if (!automaton.getTapeAlphabet().contains(tape.getWrite())) {
                problems.add(new Problem("symbol " + tape.getWrite() + " is not in the tape alphabet", t));
            }
        } else if (tape != null) {
            problems.add(new Problem("only TM transitions may have a tape action", t));
        }
    }

    private static void checkStackSymbol(Automaton automaton,
                                         @Nullable String symbol,
                                         Transition t,
                                         List<Problem> problems) {
        if (symbol != null && !automaton.getStackAlphabet().contains(symbol)) {
            problems.add(new Problem("symbol " + symbol + " is not in the stack alphabet", t));
        }
    }

    /**
     * A violated invariant, optionally tied to the transition that violates it.
     */
    public static final class Problem {

        private final String message;
        private final @Nullable Transition transition;

        Problem(String message, @Nullable Transition transition) {
            this.message = message;
            this.transition = transition;
        }

        public String getMessage() {
            return message;
        }

        public @Nullable Transition getTransition() {
            return transition;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (!(obj instanceof Problem)) {
                return false;
            }
            Problem other = (Problem) obj;
            return message.equals(other.message) && Objects.equals(transition, other.transition);
        }

        @Override
        public int hashCode() {
            return Objects.hash(message, transition);
        }

        @Override
        public String toString() {
            return transition == null ? message : message + " (" + transition + ')';
        }
    }
}
