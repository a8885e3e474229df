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
package de.chomskykit.engine;

import java.util.Random;

import de.chomskykit.algorithms.analyzer.AnalysisResult;
import de.chomskykit.algorithms.analyzer.Verdict;
import de.chomskykit.algorithms.classifier.ClassificationResult;
import de.chomskykit.algorithms.comparator.AutomatonComparisonResult;
import de.chomskykit.algorithms.comparator.ComparisonResult;
import de.chomskykit.algorithms.comparator.EquivalenceVerdict;
import de.chomskykit.algorithms.conversion.ConversionCache;
import de.chomskykit.algorithms.conversion.ConversionTrace;
import de.chomskykit.algorithms.generator.Difficulty;
import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.api.exception.InvalidRegexException;
import de.chomskykit.api.exception.MalformedGrammarException;
import de.chomskykit.api.exception.RejectedException;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.examples.ExampleAutomata;
import de.chomskykit.util.EngineLimits;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class FormalLanguageEngineTest {

    private final FormalLanguageEngine engine = new FormalLanguageEngine(EngineLimits.defaults());

    @Test
    public void testGrammarWorkflow() throws AnalysisException {
        final Grammar grammar = engine.parseGrammar("S -> aSb | ab");
        final ClassificationResult classification = engine.classifyGrammar(grammar);

        Assert.assertEquals(classification.getType(), ChomskyType.TYPE_2);
        Assert.assertFalse(classification.getViolations(ChomskyType.TYPE_3).isEmpty());
    }

    @Test
    public void testAutomatonComparison() throws AnalysisException {
        final Automaton converted = engine.convertRegexToGrammar("(a|b)*b").getDfa();

        final AutomatonComparisonResult same = engine.compareAutomata(ExampleAutomata.dfa(), converted);
        Assert.assertEquals(same.getVerdict(), EquivalenceVerdict.EQUIVALENT);

        final AutomatonComparisonResult different = engine.compareAutomata(ExampleAutomata.dfa(), ExampleAutomata.nfa());
        Assert.assertEquals(different.getVerdict(), EquivalenceVerdict.DIFFERENT);
        Assert.assertNotNull(different.getSeparatingWord());
        Assert.assertTrue(different.isSeparatingWordAcceptedByFirst());

        Assert.assertEquals(engine.compareAutomata(ExampleAutomata.pda(), ExampleAutomata.tm()).getVerdict(),
                            EquivalenceVerdict.UNDECIDED);
    }

    @Test(expectedExceptions = MalformedGrammarException.class)
    public void testMalformedGrammar() throws MalformedGrammarException {
        engine.parseGrammar("S aSb");
    }

    @Test
    public void testAutomatonWorkflow() throws AnalysisException {
        final Automaton pda = engine.parseAutomaton(ExampleAutomata.PDA);
        final AnalysisResult analysis = engine.analyzeAutomaton(pda);

        Assert.assertEquals(analysis.getComputationalClass().getVariant(), AutomatonVariant.PDA);
        Assert.assertEquals(analysis.getLanguageClass().getType(), ChomskyType.TYPE_2);
        Assert.assertEquals(engine.simulate(pda, "aaabbb").getVerdict(), Verdict.ACCEPTED);
        Assert.assertEquals(engine.simulate(pda, "aabbb").getVerdict(), Verdict.REJECTED);
        Assert.assertEquals(engine.simulate(pda, "abc").getVerdict(), Verdict.INVALID_SYMBOL);
        Assert.assertTrue(engine.accepts(pda, "ab"));
    }

    @Test(expectedExceptions = RejectedException.class)
    public void testDfaWithoutTransition() throws AnalysisException {
        final Automaton partial = engine.parseAutomaton("states: p, q\nalphabet: a, b\ninitial: p\naccepting: q\n" +
                                                        "transitions:\np, a, q");
        engine.accepts(partial, "b");
    }

    @Test
    public void testConversion() throws AnalysisException {
        final ConversionTrace trace = engine.convertRegexToGrammar("a(b|c)*");

        Assert.assertEquals(trace.getDfa().size(), 2);
        Assert.assertEquals(engine.classifyGrammar(trace.getGrammar()).getType(), ChomskyType.TYPE_3);

        final ConversionCache cache = engine.newConversionCache();
        Assert.assertSame(cache.convert("a (b|c)*"), cache.convert("a(b|c)*"));
    }

    @Test(expectedExceptions = InvalidRegexException.class)
    public void testInvalidRegex() throws AnalysisException {
        engine.convertRegexToGrammar("a(b|c");
    }

    @Test
    public void testComparison() throws AnalysisException {
        final ComparisonResult result = engine.compareGrammars(engine.parseGrammar("S -> aS | a"),
                                                               engine.parseGrammar("S -> aA | a\nA -> aA | a"),
                                                               4);
        Assert.assertEquals(result.getSimilarity(), 1.0);
    }

    @Test
    public void testGeneratedExamplesClassifyAsRequested() {
        for (int level = 0; level <= 3; level++) {
            final Grammar example =
                    engine.generateExample(ChomskyType.ofLevel(level), Difficulty.MEDIUM, new Random(level));
            Assert.assertEquals(engine.classifyGrammar(example).getType().getLevel(), level);
        }
        Assert.assertNotNull(engine.generateExample(3, Difficulty.EASY));
    }

    @Test
    public void testInputSplitting() {
        Assert.assertEquals(FormalLanguageEngine.toWord("aab"), Word.fromSymbols("a", "a", "b"));
        Assert.assertEquals(FormalLanguageEngine.toWord(" id + id "), Word.fromSymbols("id", "+", "id"));
        Assert.assertTrue(FormalLanguageEngine.toWord("ε").isEmpty());
        Assert.assertTrue(FormalLanguageEngine.toWord("").isEmpty());
    }
}
