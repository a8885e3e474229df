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

import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.api.exception.InvalidSymbolException;
import de.chomskykit.api.exception.MalformedAutomatonException;
import de.chomskykit.api.exception.RejectedException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonParser;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.util.EngineLimits;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomatonAnalyzerTest {

    // words over {a, b} ending with "ab"; q3 is unreachable and partial
    private static final String DFA = "states: q0, q1, q2, q3\n" +
                                      "alphabet: a, b\n" +
                                      "initial: q0\n" +
                                      "accepting: q2\n" +
                                      "transitions:\n" +
                                      "q0, a, q1\nq0, b, q0\n" +
                                      "q1, a, q1\nq1, b, q2\n" +
                                      "q2, a, q1\nq2, b, q0\n" +
                                      "q3, a, q0\n";

    // (a|b)* a b b with epsilon moves
    private static final String NFA = "states: s, t, u, v, w\n" +
                                      "alphabet: a, b\n" +
                                      "initial: s\n" +
                                      "accepting: w\n" +
                                      "transitions:\n" +
                                      "s, a, s\ns, b, s\ns, ε, t\n" +
                                      "t, a, u\nu, b, v\nv, b, w\n";

    private static final String PDA = "states: q0, q1, q2\n" +
                                      "alphabet: a, b\n" +
                                      "stack alphabet: Z, A\n" +
                                      "initial: q0\n" +
                                      "accepting: q2\n" +
                                      "transitions:\n" +
                                      "q0, a, Z, q0, AZ\n" +
                                      "q0, a, A, q0, AA\n" +
                                      "q0, b, A, q1, ε\n" +
                                      "q1, b, A, q1, ε\n" +
                                      "q1, ε, Z, q2, Z\n";

    // (ab)*, scanning left to right
    private static final String TM = "states: q0, q1, qf\n" +
                                     "alphabet: a, b\n" +
                                     "tape alphabet: a, b, _\n" +
                                     "initial: q0\n" +
                                     "accepting: qf\n" +
                                     "transitions:\n" +
                                     "q0, a, q1, a, R\n" +
                                     "q1, b, q0, b, R\n" +
                                     "q0, _, qf, _, S\n";

    private final AutomatonAnalyzer analyzer =
            new AutomatonAnalyzer(EngineLimits.defaults().withMaxSimulationSteps(500));

    @Test
    public void testDfaAcceptance() throws AnalysisException {
        final Automaton dfa = AutomatonParser.parse(DFA);

        Assert.assertTrue(analyzer.accepts(dfa, word("a", "b")));
        Assert.assertTrue(analyzer.accepts(dfa, word("b", "b", "a", "a", "b")));
        Assert.assertFalse(analyzer.accepts(dfa, word("a", "b", "a")));
        Assert.assertFalse(analyzer.accepts(dfa, Word.epsilon()));
    }

    @Test
    public void testDfaWithoutTransitionRejects() throws AnalysisException {
        final Automaton dfa = AutomatonParser.parse("states: p, q\nalphabet: a, b\ninitial: p\naccepting: q\n" +
                                                    "transitions:\np, a, q\n");

        final SimulationResult result = analyzer.simulate(dfa, word("a", "a"));
        Assert.assertEquals(result.getVerdict(), Verdict.REJECTED);
        Assert.assertEquals(result.getState(), "q");
        Assert.assertEquals(result.getPosition(), 1);

        try {
            analyzer.accepts(dfa, word("a", "a"));
            Assert.fail();
        } catch (RejectedException e) {
            Assert.assertEquals(e.getState(), "q");
            Assert.assertEquals(e.getSymbol(), "a");
            Assert.assertEquals(e.getPosition(), 1);
        }
    }

    @Test
    public void testInvalidSymbol() throws MalformedAutomatonException {
        final Automaton dfa = AutomatonParser.parse(DFA);

        Assert.assertEquals(analyzer.simulate(dfa, word("a", "c")).getVerdict(), Verdict.INVALID_SYMBOL);
        try {
            analyzer.accepts(dfa, word("a", "c"));
            Assert.fail();
        } catch (InvalidSymbolException e) {
            Assert.assertEquals(e.getSymbol(), "c");
            Assert.assertEquals(e.getPosition(), 1);
        } catch (AnalysisException e) {
            Assert.fail("Unexpected " + e);
        }
    }

    @Test(timeOut = 10000)
    public void testDfaSimulationIsLinear() throws MalformedAutomatonException {
        final Automaton dfa = AutomatonParser.parse(DFA);
        final Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            final String[] symbols = new String[random.nextInt(2000)];
            for (int j = 0; j < symbols.length; j++) {
                symbols[j] = random.nextBoolean() ? "a" : "b";
            }
            final SimulationResult result = analyzer.simulate(dfa, Word.fromSymbols(symbols));
            Assert.assertNotEquals(result.getVerdict(), Verdict.STEP_LIMIT_EXCEEDED);
            Assert.assertEquals(result.getSteps(), symbols.length);
        }
    }

    @Test
    public void testNfaAcceptance() throws AnalysisException {
        final Automaton nfa = AutomatonParser.parse(NFA);

        Assert.assertEquals(nfa.getVariant(), AutomatonVariant.NFA);
        Assert.assertTrue(analyzer.accepts(nfa, word("a", "b", "b")));
        Assert.assertTrue(analyzer.accepts(nfa, word("b", "a", "a", "b", "b")));
        Assert.assertFalse(analyzer.accepts(nfa, word("a", "b", "b", "a")));
        Assert.assertFalse(analyzer.accepts(nfa, word("b")));
    }

    @Test(timeOut = 10000)
    public void testPushdownAcceptance() throws AnalysisException {
        final Automaton pda = AutomatonParser.parse(PDA);

        Assert.assertTrue(analyzer.accepts(pda, word("a", "b")));
        Assert.assertTrue(analyzer.accepts(pda, word("a", "a", "a", "b", "b", "b")));
        Assert.assertFalse(analyzer.accepts(pda, word("a", "a", "b")));
        Assert.assertFalse(analyzer.accepts(pda, word("a", "b", "b")));
        Assert.assertFalse(analyzer.accepts(pda, word("b", "a")));
        Assert.assertFalse(analyzer.accepts(pda, Word.epsilon()));
    }

    @Test(timeOut = 10000)
    public void testPushdownStepLimit() throws AnalysisException {
        final Automaton pda = AutomatonParser.parse("states: q, f\nalphabet: a\nstack alphabet: Z, A\n" +
                                                    "initial: q\naccepting: f\ntransitions:\n" +
                                                    "q, ε, Z, q, AZ\nq, ε, A, q, AA\n");

        Assert.assertEquals(analyzer.simulate(pda, word("a")).getVerdict(), Verdict.STEP_LIMIT_EXCEEDED);
        try {
            analyzer.accepts(pda, word("a"));
            Assert.fail();
        } catch (StepLimitExceededException e) {
            Assert.assertEquals(e.getLimit(), 500);
        }
    }

    @Test(timeOut = 10000)
    public void testTuringMachine() throws AnalysisException {
        final Automaton tm = AutomatonParser.parse(TM);

        Assert.assertTrue(analyzer.accepts(tm, Word.epsilon()));
        Assert.assertTrue(analyzer.accepts(tm, word("a", "b", "a", "b")));
        Assert.assertFalse(analyzer.accepts(tm, word("a", "a")));
        Assert.assertEquals(analyzer.simulate(tm, word("a", "b")).getSteps(), 3);

        final LanguageClass languageClass = analyzer.chomskyTypeOfLanguage(tm);
        Assert.assertEquals(languageClass.getType(), ChomskyType.TYPE_1);
        Assert.assertTrue(languageClass.isHeuristic());
        Assert.assertNotNull(languageClass.getCaveat());
    }

    @Test(timeOut = 10000)
    public void testNonHaltingTuringMachineIsUnrestricted() throws AnalysisException {
        final Automaton tm = AutomatonParser.parse("states: q0, qf\nalphabet: a\ntape alphabet: a, _\n" +
                                                   "initial: q0\naccepting: qf\ntransitions:\n" +
                                                   "q0, a, q0, a, R\nq0, _, q0, _, R\n");

        Assert.assertEquals(analyzer.simulate(tm, word("a")).getVerdict(), Verdict.STEP_LIMIT_EXCEEDED);
        Assert.assertEquals(analyzer.chomskyTypeOfLanguage(tm).getType(), ChomskyType.TYPE_0);
    }

    @Test
    public void testWanderingTuringMachineIsUnrestricted() throws AnalysisException {
        final Automaton tm = AutomatonParser.parse("states: q0, q1, q2, qf\nalphabet: a\ntape alphabet: a, _\n" +
                                                   "initial: q0\naccepting: qf\ntransitions:\n" +
                                                   "q0, _, q1, _, L\nq1, _, q2, _, L\nq2, _, qf, _, S\n");

        final LanguageClass languageClass = analyzer.chomskyTypeOfLanguage(tm);
        Assert.assertEquals(languageClass.getType(), ChomskyType.TYPE_0);
        Assert.assertTrue(languageClass.getCaveat().contains("head leaves"));
    }

    @Test
    public void testStructuralAnalysis() throws MalformedAutomatonException {
        final AnalysisResult result = analyzer.analyze(AutomatonParser.parse(DFA));

        Assert.assertEquals(result.getComputationalClass().getVariant(), AutomatonVariant.DFA);
        Assert.assertEquals(result.getComputationalClass().getNotes(), Arrays.asList("incomplete"));
        Assert.assertEquals(result.getLanguageClass().getType(), ChomskyType.TYPE_3);
        Assert.assertFalse(result.getReachableStates().contains("q3"));
        Assert.assertTrue(result.getCoReachableStates().contains("q3"));
        Assert.assertEquals(result.getUselessStates(), Collections.singleton("q3"));
        Assert.assertEquals(result.getMissingTransitions(), Arrays.asList("δ(q3, b)"));
        Assert.assertEquals(result.getWarnings().size(), 2);
    }

    @Test
    public void testComputationalClassOfDeterministicNfa() throws MalformedAutomatonException {
        final Automaton nfa = AutomatonParser.parse("type: NFA\nstates: p\nalphabet: a\ninitial: p\naccepting: p\n" +
                                                    "transitions:\np, a, p\n");
        final ComputationalClass cc = analyzer.classifyComputationalClass(nfa);

        Assert.assertEquals(cc.getVariant(), AutomatonVariant.NFA);
        Assert.assertTrue(cc.isDeterministic());
        Assert.assertTrue(cc.getNotes().contains("deterministic"));
        Assert.assertEquals(analyzer.chomskyTypeOfLanguage(nfa).getType(), ChomskyType.TYPE_3);
        Assert.assertEquals(analyzer.chomskyTypeOfLanguage(AutomatonParser.parse(PDA)).getType(),
                            ChomskyType.TYPE_2);
    }

    @Test
    public void testSimulationLeavesAutomatonUntouched() throws AnalysisException {
        final Automaton pda = AutomatonParser.parse(PDA);
        final Automaton copy = AutomatonParser.parse(PDA);

        analyzer.simulate(pda, word("a", "a", "b", "b"));
        analyzer.analyze(pda);
        Assert.assertEquals(pda, copy);
    }

    private static Word<String> word(String... symbols) {
        return Word.fromSymbols(symbols);
    }
}
