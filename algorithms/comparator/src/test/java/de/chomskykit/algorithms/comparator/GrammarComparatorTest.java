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
package de.chomskykit.algorithms.comparator;

import java.util.Arrays;
import java.util.LinkedHashSet;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.api.exception.IncomparableGrammarsException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.GrammarParser;
import de.chomskykit.util.EngineLimits;
import org.testng.Assert;
import org.testng.annotations.Test;

public class GrammarComparatorTest {

    private final GrammarComparator comparator = new GrammarComparator(EngineLimits.defaults());

    @Test
    public void testEquivalentRegularGrammars() throws AnalysisException {
        final Grammar first = GrammarParser.parse("S -> aS | a");
        final Grammar second = GrammarParser.parse("S -> aA | a\nA -> aA | a");

        final ComparisonResult result = comparator.compare(first, second, 4);

        Assert.assertEquals(result.getInBoth(), new LinkedHashSet<>(Arrays.asList("a", "aa", "aaa", "aaaa")));
        Assert.assertTrue(result.getOnlyInFirst().isEmpty());
        Assert.assertTrue(result.getOnlyInSecond().isEmpty());
        Assert.assertEquals(result.getSimilarity(), 1.0);
        Assert.assertTrue(result.isLikelyEquivalent());
        Assert.assertTrue(result.getDisclaimer().contains("evidence, not proof"));
        Assert.assertTrue(result.isSameType());
        Assert.assertEquals(result.getFirstType(), ChomskyType.TYPE_3);
        Assert.assertTrue(result.getDifferences().contains("Different number of productions: 2 vs 4"));
    }

    @Test
    public void testDifferentLanguages() throws AnalysisException {
        final Grammar first = GrammarParser.parse("S -> aSb | ab");
        final Grammar second = GrammarParser.parse("S -> aSb | ε");

        final ComparisonResult result = comparator.compare(first, second, 3);

        Assert.assertEquals(result.getInBoth(), new LinkedHashSet<>(Arrays.asList("ab", "aabb")));
        Assert.assertEquals(result.getOnlyInFirst(), new LinkedHashSet<>(Arrays.asList("aaabbb")));
        Assert.assertEquals(result.getOnlyInSecond(), new LinkedHashSet<>(Arrays.asList("")));
        Assert.assertEquals(result.getSimilarity(), 0.5);
        Assert.assertFalse(result.isLikelyEquivalent());
        Assert.assertTrue(result.getDifferences().contains("Strings only derived by the second grammar: [ε]"));
    }

    @Test
    public void testStructuralDifferences() throws AnalysisException {
        final Grammar first = GrammarParser.parse("S -> aS | b");
        final Grammar second = GrammarParser.parse("S -> aSc | b");

        final ComparisonResult result = comparator.compare(first, second);

        Assert.assertFalse(result.isSameType());
        Assert.assertEquals(result.getSecondType(), ChomskyType.TYPE_2);
        Assert.assertTrue(result.getTerminalsOnlyInFirst().isEmpty());
        Assert.assertEquals(result.getTerminalsOnlyInSecond(), new LinkedHashSet<>(Arrays.asList("c")));
        Assert.assertEquals(result.getInBoth(), new LinkedHashSet<>(Arrays.asList("b")));
    }

    @Test
    public void testContextSensitiveDerivation() throws AnalysisException {
        final String text = "S -> aSBC | aBC; CB -> BC; aB -> ab; bB -> bb; bC -> bc; cC -> cc";

        final ComparisonResult result =
                comparator.compare(GrammarParser.parse(text), GrammarParser.parse(text), 10);

        Assert.assertTrue(result.getInBoth().contains("abc"));
        Assert.assertTrue(result.getInBoth().contains("aabbcc"));
        Assert.assertTrue(result.isLikelyEquivalent());
    }

    @Test
    public void testDegenerateGrammar() throws AnalysisException {
        final Grammar productive = GrammarParser.parse("S -> a");
        final Grammar looping = GrammarParser.parse("S -> aS");

        try {
            comparator.compare(productive, looping, 5);
            Assert.fail();
        } catch (IncomparableGrammarsException e) {
            Assert.assertFalse(e.isFirstDegenerate());
            Assert.assertTrue(e.isSecondDegenerate());
        }
    }

    @Test(expectedExceptions = StepLimitExceededException.class)
    public void testFormLimit() throws AnalysisException {
        final Grammar grammar = GrammarParser.parse("S -> SS | a | b");
        new GrammarComparator(EngineLimits.defaults().withComparatorMaxForms(50)).compare(grammar, grammar, 8);
    }
}
