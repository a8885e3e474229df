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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import de.chomskykit.algorithms.analyzer.AutomatonAnalyzer;
import de.chomskykit.algorithms.classifier.ChomskyClassifier;
import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonConversions;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.AutomatonWriter;
import de.chomskykit.datastructure.automaton.Transition;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.GrammarParser;
import de.chomskykit.util.EngineLimits;
import net.automatalib.util.automata.Automata;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ConversionPipelineTest {

    private final ConversionPipeline pipeline = new ConversionPipeline(EngineLimits.defaults());

    @Test
    public void testBranchingStar() throws AnalysisException {
        final ConversionTrace trace = pipeline.convert("a(b|c)*");

        Assert.assertEquals(trace.getEntries().size(), 5);
        Assert.assertEquals(trace.getEntries().get(0).getStage(), Stage.REGEX);
        Assert.assertEquals(trace.getEntries().get(4).getStage(), Stage.GRAMMAR);

        final Automaton nfa = trace.getNfa();
        Assert.assertEquals(nfa.getVariant(), AutomatonVariant.NFA);
        Assert.assertTrue(nfa.hasEpsilonTransitions());
        Assert.assertEquals(nfa.size(), 10);

        Assert.assertEquals(trace.getSubsetDfa().size(), 4);
        Assert.assertEquals(trace.getSubsets().get("D0"), Collections.singletonList("q0"));

        final Automaton dfa = trace.getDfa();
        Assert.assertEquals(dfa.size(), 2);
        Assert.assertEquals(dfa.getInitialState().getId(), "D0");
        Assert.assertFalse(dfa.isAccepting("D0"));
        Assert.assertTrue(dfa.isAccepting("D1"));
        Assert.assertEquals(dfa.getTransitions(),
                            Arrays.asList(Transition.of("D0", "a", "D1"),
                                          Transition.of("D1", "b", "D1"),
                                          Transition.of("D1", "c", "D1")));

        final Grammar expected = GrammarParser.parse("D0 -> a D1\nD1 -> b D1 | c D1 | ε");
        Assert.assertEquals(trace.getGrammar(), expected);
        Assert.assertEquals(new ChomskyClassifier().classify(trace.getGrammar()).getType(), ChomskyType.TYPE_3);
    }

    @Test
    public void testExplanations() throws AnalysisException {
        final ConversionTrace trace = pipeline.convert("a(b|c)*");

        Assert.assertTrue(trace.getEntry(Stage.REGEX).getExplanation().contains("{a, b, c}"));
        Assert.assertTrue(trace.getEntry(Stage.SUBSET_DFA).getExplanation().contains("D0 = {q0}"));
        Assert.assertTrue(trace.getEntry(Stage.DFA).getExplanation().startsWith("Minimization reduced 4 states to 2"));
        Assert.assertTrue(trace.getEntry(Stage.DFA).getExplanation().contains("D1 = {D1, D2, D3}"));
        Assert.assertTrue(trace.toString().contains("== Right-linear grammar =="));
    }

    @Test
    public void testReproducibleNumbering() throws AnalysisException {
        final String regex = "(a|b)*abb";
        final ConversionTrace first = pipeline.convert(regex);
        final ConversionTrace second = new ConversionPipeline(EngineLimits.defaults()).convert(regex);

        Assert.assertEquals(AutomatonWriter.write(second.getNfa()), AutomatonWriter.write(first.getNfa()));
        Assert.assertEquals(AutomatonWriter.write(second.getSubsetDfa()),
                            AutomatonWriter.write(first.getSubsetDfa()));
        Assert.assertEquals(AutomatonWriter.write(second.getDfa()), AutomatonWriter.write(first.getDfa()));
        Assert.assertEquals(second.toString(), first.toString());
    }

    @DataProvider
    public static Object[][] expressions() {
        return new Object[][] {{"a(b|c)*"},
                               {"(ab)+"},
                               {"a?b*"},
                               {"(a|b)*abb"},
                               {"[a-c]b?"},
                               {"a*b*"},
                               {"(a|bc)*(c|a)"},
                               {"((a|b)(a|b))*"}};
    }

    @Test(dataProvider = "expressions")
    public void testStagesMatchJavaRegex(String regex) throws AnalysisException {
        final ConversionTrace trace = pipeline.convert(regex);
        final Pattern pattern = Pattern.compile(regex);
        final AutomatonAnalyzer analyzer = new AutomatonAnalyzer(EngineLimits.defaults());
        final List<String> alphabet = new ArrayList<>(trace.getNfa().getInputAlphabet());

        for (Word<String> word : wordsUpTo(alphabet, 5)) {
            final boolean expected = pattern.matcher(String.join("", word.asList())).matches();
            Assert.assertEquals(analyzer.simulate(trace.getNfa(), word).isAccepted(), expected, "NFA on " + word);
            Assert.assertEquals(analyzer.simulate(trace.getSubsetDfa(), word).isAccepted(),
                                expected,
                                "subset DFA on " + word);
            Assert.assertEquals(analyzer.simulate(trace.getDfa(), word).isAccepted(), expected, "DFA on " + word);
        }
    }

    @Test(dataProvider = "expressions")
    public void testMinimizationPreservesLanguage(String regex) throws AnalysisException {
        final ConversionTrace trace = pipeline.convert(regex);
        final Automaton subset = SubsetConstruction.complete(trace.getSubsetDfa());
        final Automaton minimal = SubsetConstruction.complete(trace.getDfa());

        Assert.assertTrue(Automata.testEquivalence(AutomatonConversions.toCompactDFA(subset),
                                                   AutomatonConversions.toCompactDFA(minimal),
                                                   subset.getInputAlphabet()));
        Assert.assertTrue(trace.getDfa().size() <= trace.getSubsetDfa().size());
    }

    @Test
    public void testEpsilonAndOptional() throws AnalysisException {
        final ConversionTrace trace = pipeline.convert("ε | a b?");
        final Grammar expected = GrammarParser.parse("D0 -> a D1 | ε\nD1 -> b D2 | ε\nD2 -> ε");

        Assert.assertEquals(trace.getGrammar(), expected);
        Assert.assertEquals(trace.getRegex().toString(), "ε|ab?");
    }

    @Test(expectedExceptions = StepLimitExceededException.class)
    public void testStateLimit() throws AnalysisException {
        // the minimal DFA needs 2^4 states, the subset construction at least as many
        new ConversionPipeline(EngineLimits.defaults().withMaxDfaStates(8)).convert("(a|b)*a(a|b)(a|b)(a|b)");
    }

    static List<Word<String>> wordsUpTo(List<String> alphabet, int length) {
        final List<Word<String>> result = new ArrayList<>();
        List<Word<String>> layer = Collections.singletonList(Word.epsilon());
        result.addAll(layer);
        for (int i = 0; i < length; i++) {
            final List<Word<String>> next = new ArrayList<>();
            for (Word<String> w : layer) {
                for (String a : alphabet) {
                    next.add(w.append(a));
                }
            }
            result.addAll(next);
            layer = next;
        }
        return result;
    }
}
