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
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.InvalidSymbolException;
import de.chomskykit.api.exception.RejectedException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.api.logging.AnalysisLogger;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonState;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.Transition;
import de.chomskykit.util.EngineLimits;
import net.automatalib.words.Word;

/**
 * Determines the computational class of an automaton and the Chomsky type of its language, and simulates it on
 * inputs.
 * <p>
 * Finite automata recognize regular (Type 3) languages and pushdown automata context-free (Type 2) ones. Turing
 * machines are reported as Type 0 unless a bounded simulation suggests a linear bound: if the machine halts on every
 * word up to {@link EngineLimits#getTmProbeLength()} symbols within the step budget and its head never leaves the input
 * extended by one cell on either side, it is reported as Type 1 with a caveat. This is a heuristic, not a decision
 * procedure.
 */
public class AutomatonAnalyzer {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(AutomatonAnalyzer.class);

    private final EngineLimits limits;
    private final FiniteAutomatonSimulator finiteSimulator;
    private final PushdownSimulator pushdownSimulator;
    private final TuringMachineSimulator turingSimulator;

    public AutomatonAnalyzer(EngineLimits limits) {
        this.limits = limits;
        this.finiteSimulator = new FiniteAutomatonSimulator();
        this.pushdownSimulator = new PushdownSimulator(limits.getMaxSimulationSteps());
        this.turingSimulator = new TuringMachineSimulator(limits.getMaxSimulationSteps());
    }

    public ComputationalClass classifyComputationalClass(Automaton automaton) {
        final boolean deterministic = automaton.isStructurallyDeterministic();
        final List<String> notes = new ArrayList<>();
        switch (automaton.getVariant()) {
            case DFA:
                if (!findMissingTransitions(automaton).isEmpty()) {
                    notes.add("incomplete");
                }
                break;
            case NFA:
                if (deterministic) {
                    notes.add("deterministic");
                }
                if (automaton.hasEpsilonTransitions()) {
                    notes.add("epsilon transitions");
                }
                break;
            case PDA:
                notes.add(deterministic ? "deterministic" : "nondeterministic");
                break;
            case TM:
            default:
                notes.add("single tape");
                break;
        }
        return new ComputationalClass(automaton.getVariant(), deterministic, notes);
    }

    public LanguageClass chomskyTypeOfLanguage(Automaton automaton) {
        switch (automaton.getVariant()) {
            case DFA:
            case NFA:
                return new LanguageClass(ChomskyType.TYPE_3, false, null);
            case PDA:
                return new LanguageClass(ChomskyType.TYPE_2, false, null);
            case TM:
            default:
                return classifyTuringMachine(automaton);
        }
    }

    private LanguageClass classifyTuringMachine(Automaton tm) {
        final int probeLength = limits.getTmProbeLength();
        LOGGER.logPhase("Probing Turing machine on all words up to length " + probeLength);

        for (Word<String> probe : allWords(tm, probeLength)) {
            final TuringMachineSimulator.Run run = turingSimulator.run(tm, probe);
            if (run.getResult().getVerdict() == Verdict.STEP_LIMIT_EXCEEDED) {
                return new LanguageClass(ChomskyType.TYPE_0,
                                         false,
                                         "no halt on '" + render(probe) + "' within " + limits.getMaxSimulationSteps() +
                                         " steps");
            }
            if (run.getMinHead() < -1 || run.getMaxHead() > probe.length()) {
                return new LanguageClass(ChomskyType.TYPE_0,
                                         false,
                                         "head leaves the input region on '" + render(probe) + '\'');
            }
        }
        return new LanguageClass(ChomskyType.TYPE_1,
                                 true,
                                 "heuristic: halts within the input region on all words up to length " + probeLength +
                                 ", linear boundedness is not decidable");
    }

    /**
     * Performs the complete structural analysis of an automaton. Findings such as unreachable states are logged and
     * returned as warnings.
     */
    public AnalysisResult analyze(Automaton automaton) {
        LOGGER.logPhase("Analyzing " + automaton.getVariant() + " with " + automaton.size() + " states");

        final ComputationalClass computationalClass = classifyComputationalClass(automaton);
        final LanguageClass languageClass = chomskyTypeOfLanguage(automaton);
        final Set<String> reachable = findReachableStates(automaton);
        final Set<String> coReachable = findCoReachableStates(automaton);
        final List<String> missing =
                automaton.getVariant().isFinite() ? findMissingTransitions(automaton) : new ArrayList<>();

        final Set<String> useless = new LinkedHashSet<>();
        final List<String> warnings = new ArrayList<>();
        for (AutomatonState s : automaton.getStates()) {
            if (!reachable.contains(s.getId())) {
                useless.add(s.getId());
                warnings.add("state " + s.getId() + " is unreachable");
            } else if (!coReachable.contains(s.getId())) {
                useless.add(s.getId());
                warnings.add("state " + s.getId() + " cannot reach an accepting state");
            }
        }
        if (automaton.getAcceptingStates().isEmpty()) {
            warnings.add("the automaton has no accepting state");
        }
        if (automaton.getVariant() == AutomatonVariant.DFA && !missing.isEmpty()) {
            warnings.add("missing transitions: " + String.join(", ", missing));
        }
        for (String w : warnings) {
            LOGGER.logFinding(w);
        }

        final AnalysisResult result = new AnalysisResult(computationalClass,
                                                         languageClass,
                                                         reachable,
                                                         coReachable,
                                                         useless,
                                                         missing,
                                                         warnings);
        LOGGER.logPhase("Result: " + result);
        return result;
    }

    /**
     * Simulates the automaton on the given input. All outcomes, including invalid symbols and exhausted step budgets,
     * are reported through the result.
     */
    public SimulationResult simulate(Automaton automaton, Word<String> input) {
        final SimulationResult result = simulatorFor(automaton.getVariant()).simulate(automaton, input);
        LOGGER.debug("{} on '{}': {}", automaton.getVariant(), render(input), result);
        return result;
    }

    /**
     * Decides acceptance of the given input.
     *
     * @return {@code true} if the input is accepted, {@code false} if the run ends without acceptance
     *
     * @throws InvalidSymbolException     if the input contains a symbol outside the input alphabet
     * @throws RejectedException          if a DFA has no transition for the next symbol
     * @throws StepLimitExceededException if a PDA or Turing machine uses up its step budget
     */
    public boolean accepts(Automaton automaton, Word<String> input)
            throws InvalidSymbolException, RejectedException, StepLimitExceededException {
        final SimulationResult result = simulate(automaton, input);
        switch (result.getVerdict()) {
            case ACCEPTED:
                return true;
            case INVALID_SYMBOL:
                throw new InvalidSymbolException(String.valueOf(result.getSymbol()), result.getPosition());
            case STEP_LIMIT_EXCEEDED:
                throw new StepLimitExceededException("Simulation of " + automaton.getVariant(),
                                                     limits.getMaxSimulationSteps());
            case REJECTED:
            default:
                final String state = result.getState();
                final String symbol = result.getSymbol();
                if (state != null && symbol != null) {
                    throw new RejectedException(state, symbol, result.getPosition());
                }
                return false;
        }
    }

    private Simulator simulatorFor(AutomatonVariant variant) {
        switch (variant) {
            case PDA:
                return pushdownSimulator;
            case TM:
                return turingSimulator;
            default:
                return finiteSimulator;
        }
    }

    static Set<String> findReachableStates(Automaton automaton) {
        final Set<String> reachable = new LinkedHashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        for (AutomatonState s : automaton.getInitialStates()) {
            if (reachable.add(s.getId())) {
                queue.add(s.getId());
            }
        }
        while (!queue.isEmpty()) {
            for (Transition t : automaton.getTransitions(queue.poll())) {
                if (reachable.add(t.getTarget())) {
                    queue.add(t.getTarget());
                }
            }
        }
        return reachable;
    }

    static Set<String> findCoReachableStates(Automaton automaton) {
        final Map<String, List<String>> predecessors = new HashMap<>();
        for (Transition t : automaton.getTransitions()) {
            predecessors.computeIfAbsent(t.getTarget(), k -> new ArrayList<>()).add(t.getSource());
        }

        final Set<String> coReachable = new LinkedHashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        for (AutomatonState s : automaton.getAcceptingStates()) {
            coReachable.add(s.getId());
            queue.add(s.getId());
        }
        while (!queue.isEmpty()) {
            for (String p : predecessors.getOrDefault(queue.poll(), new ArrayList<>())) {
                if (coReachable.add(p)) {
                    queue.add(p);
                }
            }
        }
        return coReachable;
    }

    static List<String> findMissingTransitions(Automaton automaton) {
        final List<String> missing = new ArrayList<>();
        for (AutomatonState s : automaton.getStates()) {
            for (String a : automaton.getInputAlphabet()) {
                if (automaton.getTransitions(s.getId(), a).isEmpty()) {
                    missing.add("δ(" + s.getId() + ", " + a + ')');
                }
            }
        }
        return missing;
    }

    private static List<Word<String>> allWords(Automaton automaton, int maxLength) {
        final List<Word<String>> words = new ArrayList<>();
        List<Word<String>> layer = new ArrayList<>();
        layer.add(Word.epsilon());
        words.addAll(layer);
        for (int length = 1; length <= maxLength; length++) {
            final List<Word<String>> next = new ArrayList<>();
            for (Word<String> w : layer) {
                for (String a : automaton.getInputAlphabet()) {
                    next.add(w.append(a));
                }
            }
            words.addAll(next);
            layer = next;
        }
        return words;
    }

    private static String render(Word<String> word) {
        return word.isEmpty() ? "ε" : String.join("", word.asList());
    }
}
