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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.TapeAction;
import de.chomskykit.datastructure.automaton.Transition;
import net.automatalib.words.Word;

/**
 * Simulates a single-tape Turing machine on an explicit tape.
 * <p>
 * The input is written to cells {@code 0..n-1}, all other cells hold the blank symbol, and the head starts on cell
 * {@code 0}. The machine accepts as soon as it enters an accepting state and rejects when no transition matches the
 * current state and the symbol under the head. Each applied transition counts as one step.
 */
public class TuringMachineSimulator extends AbstractSimulator {

    private final long maxSteps;

    public TuringMachineSimulator(long maxSteps) {
        this.maxSteps = maxSteps;
    }

    @Override
    protected boolean supports(AutomatonVariant variant) {
        return variant == AutomatonVariant.TM;
    }

    @Override
    protected SimulationResult doSimulate(Automaton tm, Word<String> input) {
        return run(tm, input).getResult();
    }

    /**
     * Simulates the machine and additionally records the range of tape cells visited by the head.
     */
    public Run run(Automaton tm, Word<String> input) {
        final String blank = Objects.requireNonNull(tm.getBlankSymbol());
        final Map<Integer, String> tape = new HashMap<>();
        for (int i = 0; i < input.length(); i++) {
            tape.put(i, input.getSymbol(i));
        }

        String state = tm.getInitialState().getId();
        int head = 0;
        int minHead = 0;
        int maxHead = 0;
        long steps = 0;

        while (!tm.isAccepting(state)) {
            final String read = tape.getOrDefault(head, blank);
            final List<Transition> transitions = tm.getTransitions(state, read);
            if (transitions.isEmpty()) {
                return new Run(SimulationResult.rejected(steps, "halted in state " + state + " reading " + read +
                                                                " at cell " + head), minHead, maxHead);
            }
            if (steps == maxSteps) {
                return new Run(SimulationResult.stepLimitExceeded(maxSteps), minHead, maxHead);
            }
            steps++;

            final Transition t = transitions.get(0);
            final TapeAction action = Objects.requireNonNull(t.getTapeAction());
            tape.put(head, action.getWrite());
            head += action.getMove().getOffset();
            minHead = Math.min(minHead, head);
            maxHead = Math.max(maxHead, head);
            state = t.getTarget();
        }

        return new Run(SimulationResult.accepted(steps, "entered accepting state " + state), minHead, maxHead);
    }

    /**
     * The result of a Turing machine run and the leftmost and rightmost cells the head visited.
     */
    public static final class Run {

        private final SimulationResult result;
        private final int minHead;
        private final int maxHead;

        Run(SimulationResult result, int minHead, int maxHead) {
            this.result = result;
            this.minHead = minHead;
            this.maxHead = maxHead;
        }

        public SimulationResult getResult() {
            return result;
        }

        public int getMinHead() {
            return minHead;
        }

        public int getMaxHead() {
            return maxHead;
        }
    }
}
