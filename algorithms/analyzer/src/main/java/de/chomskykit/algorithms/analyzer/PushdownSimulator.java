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

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.StackAction;
import de.chomskykit.datastructure.automaton.Transition;
import net.automatalib.words.Word;

/**
 * Simulates a pushdown automaton by breadth-first search over its configurations (state, input position, stack).
 * <p>
 * The automaton accepts by final state once the whole input has been consumed. Every configuration taken from the
 * worklist counts as one step; configurations already visited are skipped, and the search reports
 * {@link Verdict#STEP_LIMIT_EXCEEDED} once the step budget is used up (e.g. for epsilon loops that keep growing the
 * stack).
 */
public class PushdownSimulator extends AbstractSimulator {

    private final long maxSteps;

    public PushdownSimulator(long maxSteps) {
        this.maxSteps = maxSteps;
    }

    @Override
    protected boolean supports(AutomatonVariant variant) {
        return variant == AutomatonVariant.PDA;
    }

    @Override
    protected SimulationResult doSimulate(Automaton pda, Word<String> input) {
        final String bottom = Objects.requireNonNull(pda.getInitialStackSymbol());
        final Configuration start = new Configuration(pda.getInitialState().getId(), 0, Word.fromLetter(bottom));

        final Queue<Configuration> worklist = new ArrayDeque<>();
        final Set<Configuration> visited = new HashSet<>();
        worklist.add(start);
        visited.add(start);

        long steps = 0;
        while (!worklist.isEmpty()) {
            if (steps == maxSteps) {
                return SimulationResult.stepLimitExceeded(maxSteps);
            }
            steps++;

            final Configuration c = worklist.poll();
            if (c.position == input.length() && pda.isAccepting(c.state)) {
                return SimulationResult.accepted(steps, "accepted in state " + c.state + " with stack " + c.stack);
            }

            for (Transition t : pda.getTransitions(c.state)) {
                final String symbol = t.getInput();
                if (symbol != null && (c.position == input.length() || !symbol.equals(input.getSymbol(c.position)))) {
                    continue;
                }
                final StackAction action = Objects.requireNonNull(t.getStackAction());
                final String pop = action.getPop();
                Word<String> rest = c.stack;
                if (pop != null) {
                    if (c.stack.isEmpty() || !pop.equals(c.stack.firstSymbol())) {
                        continue;
                    }
                    rest = c.stack.subWord(1);
                }
                final int position = symbol == null ? c.position : c.position + 1;
                final Configuration next = new Configuration(t.getTarget(), position, action.getPush().concat(rest));
                if (visited.add(next)) {
                    worklist.add(next);
                }
            }
        }

        return SimulationResult.rejected(steps, "no accepting configuration after exploring " + visited.size() +
                                                " configurations");
    }

    private static final class Configuration {

        private final String state;
        private final int position;
        private final Word<String> stack;

        Configuration(String state, int position, Word<String> stack) {
            this.state = state;
            this.position = position;
            this.stack = stack;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (!(obj instanceof Configuration)) {
                return false;
            }
            Configuration other = (Configuration) obj;
            return position == other.position && state.equals(other.state) && stack.equals(other.stack);
        }

        @Override
        public int hashCode() {
            return Objects.hash(state, position, stack);
        }
    }
}
