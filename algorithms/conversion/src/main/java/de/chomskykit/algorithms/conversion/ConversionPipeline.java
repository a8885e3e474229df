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
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import de.chomskykit.api.exception.InvalidRegexException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.api.logging.AnalysisLogger;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonWriter;
import de.chomskykit.datastructure.automaton.Transition;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.GrammarWriter;
import de.chomskykit.util.EngineLimits;

/**
 * Converts a regular expression into a right-linear grammar, recording every intermediate model.
 * <p>
 * The stages are: parsing, Thompson's construction, subset construction, minimization and grammar extraction. All
 * state names are assigned deterministically, so converting the same expression twice yields identical traces. The
 * pipeline holds no mutable state and may be shared between threads.
 */
public class ConversionPipeline {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(ConversionPipeline.class);

    private final EngineLimits limits;

    public ConversionPipeline(EngineLimits limits) {
        this.limits = limits;
    }

    public EngineLimits getLimits() {
        return limits;
    }

    /**
     * @throws InvalidRegexException
     *         if {@code regex} is not a well-formed regular expression
     * @throws StepLimitExceededException
     *         if subset construction needs more DFA states than allowed by the limits
     */
    public ConversionTrace convert(String regex) throws InvalidRegexException, StepLimitExceededException {
        final List<TraceEntry> entries = new ArrayList<>(Stage.values().length);

        LOGGER.logPhase("Parsing regular expression " + regex);
        final RegexNode ast = RegexParser.parse(regex);
        entries.add(new TraceEntry(Stage.REGEX,
                                   ast,
                                   ast.toString(),
                                   "Parsed the expression over the alphabet " + braces(ast.getSymbols()) + '.'));

        LOGGER.logPhase("Thompson construction");
        final Automaton nfa = ThompsonConstruction.construct(ast);
        LOGGER.logModel(nfa);
        entries.add(new TraceEntry(Stage.NFA, nfa, AutomatonWriter.write(nfa), explainNfa(nfa)));

        LOGGER.logPhase("Subset construction");
        final SubsetConstruction.Result subsets = SubsetConstruction.determinize(nfa, limits.getMaxDfaStates());
        final Automaton subsetDfa = subsets.getDfa();
        LOGGER.logModel(subsetDfa);
        entries.add(new TraceEntry(Stage.SUBSET_DFA,
                                   subsetDfa,
                                   AutomatonWriter.write(subsetDfa),
                                   explainSubsets(subsets)));

        LOGGER.logPhase("Minimization");
        final DfaMinimization.Result minimal = DfaMinimization.minimize(subsetDfa);
        final Automaton dfa = minimal.getDfa();
        LOGGER.logModel(dfa);
        entries.add(new TraceEntry(Stage.DFA, dfa, AutomatonWriter.write(dfa), explainMinimization(subsetDfa, minimal)));

        LOGGER.logPhase("Grammar extraction");
        final Grammar grammar = DfaToGrammarConversion.convert(dfa);
        LOGGER.logModel(grammar);
        entries.add(new TraceEntry(Stage.GRAMMAR, grammar, GrammarWriter.write(grammar), explainGrammar(grammar)));

        return new ConversionTrace(regex, entries, subsets.getSubsets());
    }

    private static String explainNfa(Automaton nfa) {
        int epsilons = 0;
        for (Transition t : nfa.getTransitions()) {
            if (t.isEpsilon()) {
                epsilons++;
            }
        }
        return "Thompson's construction built an NFA with " + nfa.size() + " states and " + epsilons +
               " epsilon transitions. Every operator contributes a fragment with one entry and one exit state.";
    }

    private static String explainSubsets(SubsetConstruction.Result result) {
        final Automaton dfa = result.getDfa();
        final StringBuilder sb = new StringBuilder("Subset construction found ").append(dfa.size())
                                                                                .append(" sets of NFA states:");
        for (Map.Entry<String, List<String>> e : result.getSubsets().entrySet()) {
            sb.append(' ').append(e.getKey()).append(" = ").append(braces(e.getValue())).append(';');
        }
        final int missing = dfa.size() * dfa.getInputAlphabet().size() - dfa.getTransitions().size();
        if (missing == 0) {
            sb.append(" every transition is defined, no dead state is needed.");
        } else {
            sb.append(' ').append(missing).append(" missing transitions lead to an implicit dead state.");
        }
        return sb.toString();
    }

    private static String explainMinimization(Automaton before, DfaMinimization.Result result) {
        final Automaton after = result.getDfa();
        if (after.size() == before.size()) {
            return "The DFA is already minimal.";
        }
        final StringBuilder sb = new StringBuilder("Minimization reduced ").append(before.size())
                                                                           .append(" states to ")
                                                                           .append(after.size())
                                                                           .append(':');
        for (Map.Entry<String, List<String>> e : result.getMergedStates().entrySet()) {
            sb.append(' ').append(e.getKey()).append(" = ").append(braces(e.getValue())).append(';');
        }
        if (!result.getRemovedStates().isEmpty()) {
            sb.append(" removed ").append(braces(result.getRemovedStates())).append(';');
        }
        sb.setLength(sb.length() - 1);
        return sb.append('.').toString();
    }

    private static String explainGrammar(Grammar grammar) {
        return "Each transition δ(X, a) = Y became X -> a Y and each accepting state X became X -> ε, giving " +
               grammar.size() + " productions over " + grammar.getNonTerminals().size() + " non-terminals.";
    }

    private static String braces(Iterable<String> elements) {
        final StringJoiner joiner = new StringJoiner(", ", "{", "}");
        elements.forEach(joiner::add);
        return joiner.toString();
    }
}
