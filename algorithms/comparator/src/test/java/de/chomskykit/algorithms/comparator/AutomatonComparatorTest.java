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

import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonParser;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.util.EngineLimits;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomatonComparatorTest {

    private static final String ENDS_WITH_B_DFA = "type: DFA\n" +
                                                  "states: q0, q1\n" +
                                                  "alphabet: a, b\n" +
                                                  "initial: q0\n" +
                                                  "accepting: q1\n" +
                                                  "transitions:\n" +
                                                  "q0, a, q0\n" +
                                                  "q0, b, q1\n" +
                                                  "q1, a, q0\n" +
                                                  "q1, b, q1\n";

    private static final String ENDS_WITH_B_NFA = "type: NFA\n" +
                                                  "states: p0, p1\n" +
                                                  "alphabet: a, b\n" +
                                                  "initial: p0\n" +
                                                  "accepting: p1\n" +
                                                  "transitions:\n" +
                                                  "p0, a, p0\n" +
                                                  "p0, b, p0\n" +
                                                  "p0, b, p1\n";

    private static final String A_STAR = "type: DFA\n" +
                                          "states: q0\n" +
                                          "alphabet: a\n" +
                                          "initial: q0\n" +
                                          "accepting: q0\n" +
                                          "transitions:\n" +
                                          "q0, a, q0\n";

    private static final String A_PLUS = "type: NFA\n" +
                                          "states: q0, q1, q2\n" +
                                          "alphabet: a, b\n" +
                                          "initial: q0\n" +
                                          "accepting: q2\n" +
                                          "transitions:\n" +
                                          "q0, a, q1\n" +
                                          "q1, ε, q2\n" +
                                          "q2, a, q1\n";

    private static final String AN_BN_PDA = "type: PDA\n" +
                                             "states: q0, q1, q2\n" +
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

    private final AutomatonComparator comparator = new AutomatonComparator(EngineLimits.defaults());

    @Test
    public void testEquivalentDfaAndNfa() throws AnalysisException {
        final AutomatonComparisonResult result =
                comparator.compare(AutomatonParser.parse(ENDS_WITH_B_DFA), AutomatonParser.parse(ENDS_WITH_B_NFA));

        Assert.assertEquals(result.getVerdict(), EquivalenceVerdict.EQUIVALENT);
        Assert.assertNull(result.getSeparatingWord());
        Assert.assertFalse(result.isSameVariant());
        Assert.assertEquals(result.getFirstVariant(), AutomatonVariant.DFA);
        Assert.assertEquals(result.getSecondVariant(), AutomatonVariant.NFA);
        Assert.assertTrue(result.getDifferences().contains("Different types: DFA vs NFA"));
        Assert.assertTrue(result.getSimilarities().contains("Same number of states: 2"));
        Assert.assertTrue(result.getSimilarities().contains("Same input alphabet: {a, b}"));
        Assert.assertTrue(result.getSimilarities().contains("Both automata accept the same language"));
    }

    @Test
    public void testSeparatingWord() throws AnalysisException {
        final Automaton star = AutomatonParser.parse(A_STAR);
        final Automaton plus = AutomatonParser.parse(A_PLUS);

        final AutomatonComparisonResult result = comparator.compare(star, plus);

        Assert.assertEquals(result.getVerdict(), EquivalenceVerdict.DIFFERENT);
        // the empty word is the only word in exactly one of the languages
        Assert.assertEquals(result.getSeparatingWord(), Word.epsilon());
        Assert.assertTrue(result.isSeparatingWordAcceptedByFirst());
        Assert.assertTrue(result.getDifferences().contains("Different input alphabets: {a} vs {a, b}"));
        Assert.assertTrue(result.getDifferences().contains("Different number of states: 1 vs 3"));
        Assert.assertTrue(result.getDifferences().contains("The word ε is only accepted by the first automaton"));

        final AutomatonComparisonResult swapped = comparator.compare(plus, star);
        Assert.assertEquals(swapped.getSeparatingWord(), Word.epsilon());
        Assert.assertFalse(swapped.isSeparatingWordAcceptedByFirst());
    }

    @Test
    public void testAlphabetsAreWidened() throws AnalysisException {
        final Automaton narrow = AutomatonParser.parse(A_STAR);
        final Automaton wide = AutomatonParser.parse(A_STAR.replace("alphabet: a", "alphabet: a, b"));

        final AutomatonComparisonResult result = comparator.compare(narrow, wide);

        Assert.assertEquals(result.getVerdict(), EquivalenceVerdict.EQUIVALENT);
        Assert.assertTrue(result.isSameVariant());
        Assert.assertTrue(result.getDifferences().contains("Different input alphabets: {a} vs {a, b}"));
    }

    @Test
    public void testPushdownAutomataAreUndecided() throws AnalysisException {
        final Automaton pda = AutomatonParser.parse(AN_BN_PDA);

        final AutomatonComparisonResult result = comparator.compare(pda, pda);

        Assert.assertEquals(result.getVerdict(), EquivalenceVerdict.UNDECIDED);
        Assert.assertNull(result.getSeparatingWord());
        Assert.assertTrue(result.getSimilarities().contains("Both automata are PDAs"));
        Assert.assertTrue(result.getDifferences().isEmpty());
    }

    @Test(expectedExceptions = StepLimitExceededException.class)
    public void testDeterminizationLimit() throws AnalysisException {
        final AutomatonComparator tight = new AutomatonComparator(EngineLimits.defaults().withMaxDfaStates(1));
        tight.compare(AutomatonParser.parse(ENDS_WITH_B_NFA), AutomatonParser.parse(ENDS_WITH_B_DFA));
    }
}
