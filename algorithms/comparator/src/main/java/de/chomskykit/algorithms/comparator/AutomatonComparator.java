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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

import de.chomskykit.algorithms.conversion.SubsetConstruction;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.api.logging.AnalysisLogger;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonConversions;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.util.EngineLimits;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.Automata;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compares two automata by their structure (type, number of states, input alphabet) and, if both are finite
 * automata, by the languages they accept.
 * <p>
 * Finite automata are determinized over the union of both input alphabets and completed, after which AutomataLib
 * searches for a separating word. Equivalence of pushdown automata and Turing machines is not decided.
 */
public class AutomatonComparator {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(AutomatonComparator.class);

    private final EngineLimits limits;

    public AutomatonComparator(EngineLimits limits) {
        this.limits = limits;
    }

    /**
     * @throws StepLimitExceededException
     *         if determinizing one of the automata needs more states than allowed by the limits
     */
    public AutomatonComparisonResult compare(Automaton first, Automaton second) throws StepLimitExceededException {
        final List<String> similarities = new ArrayList<>();
        final List<String> differences = new ArrayList<>();

        final AutomatonVariant firstVariant = first.getVariant();
        final AutomatonVariant secondVariant = second.getVariant();
        if (firstVariant == secondVariant) {
            similarities.add("Both automata are " + firstVariant + 's');
        } else {
            differences.add("Different types: " + firstVariant + " vs " + secondVariant);
        }

        final int firstStates = first.getStates().size();
        final int secondStates = second.getStates().size();
        if (firstStates == secondStates) {
            similarities.add("Same number of states: " + firstStates);
        } else {
            differences.add("Different number of states: " + firstStates + " vs " + secondStates);
        }

        final Set<String> firstAlphabet = new LinkedHashSet<>(first.getInputAlphabet());
        final Set<String> secondAlphabet = new LinkedHashSet<>(second.getInputAlphabet());
        if (firstAlphabet.equals(secondAlphabet)) {
            similarities.add("Same input alphabet: " + braces(firstAlphabet));
        } else {
            differences.add("Different input alphabets: " + braces(firstAlphabet) + " vs " + braces(secondAlphabet));
        }

        if (!firstVariant.isFinite() || !secondVariant.isFinite()) {
            LOGGER.logFinding("Language equivalence is only decided for finite automata, not for " + firstVariant +
                              " and " + secondVariant);
            return new AutomatonComparisonResult(firstVariant,
                                                 secondVariant,
                                                 EquivalenceVerdict.UNDECIDED,
                                                 null,
                                                 false,
                                                 similarities,
                                                 differences);
        }

        LOGGER.logPhase("Checking language equivalence");
        final Set<String> alphabet = new LinkedHashSet<>(firstAlphabet);
        alphabet.addAll(secondAlphabet);
        final CompactDFA<String> firstDfa = determinize(first, alphabet);
        final CompactDFA<String> secondDfa = determinize(second, alphabet);

        final @Nullable Word<String> separating = Automata.findSeparatingWord(firstDfa, secondDfa, alphabet);
        if (separating == null) {
            similarities.add("Both automata accept the same language");
            return new AutomatonComparisonResult(firstVariant,
                                                 secondVariant,
                                                 EquivalenceVerdict.EQUIVALENT,
                                                 null,
                                                 false,
                                                 similarities,
                                                 differences);
        }

        final boolean byFirst = firstDfa.accepts(separating);
        differences.add("The word " + render(separating) + " is only accepted by the " +
                        (byFirst ? "first" : "second") + " automaton");
        LOGGER.logFinding("Separating word " + render(separating));
        return new AutomatonComparisonResult(firstVariant,
                                             secondVariant,
                                             EquivalenceVerdict.DIFFERENT,
                                             separating,
                                             byFirst,
                                             similarities,
                                             differences);
    }

    private CompactDFA<String> determinize(Automaton automaton, Collection<String> alphabet)
            throws StepLimitExceededException {
        final Automaton.Builder builder =
                Automaton.builder(automaton.getVariant()).withInputAlphabet(automaton.getInputAlphabet());
        builder.withInputAlphabet(alphabet);
        automaton.getStates().forEach(s -> builder.addState(s.getId(), s.isInitial(), s.isAccepting()));
        automaton.getTransitions().forEach(builder::addTransition);

        final Automaton dfa = SubsetConstruction.determinize(builder.build(), limits.getMaxDfaStates()).getDfa();
        return AutomatonConversions.toCompactDFA(SubsetConstruction.complete(dfa));
    }

    private static String render(Word<String> word) {
        if (word.isEmpty()) {
            return "ε";
        }
        final StringJoiner joiner = new StringJoiner(" ", "'", "'");
        for (String symbol : word) {
            joiner.add(symbol);
        }
        return joiner.toString();
    }

    private static String braces(Collection<String> symbols) {
        return '{' + String.join(", ", symbols) + '}';
    }
}
