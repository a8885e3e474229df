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
package de.chomskykit.algorithms.classifier;

import java.util.List;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.MalformedGrammarException;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.GrammarParser;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ChomskyClassifierTest {

    private final ChomskyClassifier classifier = new ChomskyClassifier();

    @Test
    public void testRightLinearGrammar() throws MalformedGrammarException {
        final ClassificationResult result = classifier.classify(GrammarParser.parse("S -> aS | b"));

        Assert.assertEquals(result.getType(), ChomskyType.TYPE_3);
        Assert.assertEquals(result.getDirection(), LinearDirection.RIGHT);
        Assert.assertTrue(result.getBoundaryCases().isEmpty());

        final List<RuleEvaluation> evaluations = result.getEvaluations(ChomskyType.TYPE_3);
        Assert.assertEquals(evaluations.size(), 2);
        Assert.assertTrue(evaluations.get(0).isPassed());
        Assert.assertTrue(evaluations.get(0).getRule().contains("right-linear"));
        Assert.assertTrue(evaluations.get(1).getRule().contains("A -> a"));
        // nothing weaker is evaluated once Type 3 holds
        Assert.assertEquals(result.getEvaluations().size(), 2);
    }

    @Test
    public void testLeftLinearGrammar() throws MalformedGrammarException {
        final ClassificationResult result = classifier.classify(GrammarParser.parse("S -> Sa | A b; A -> a | ε"));

        Assert.assertEquals(result.getType(), ChomskyType.TYPE_3);
        Assert.assertEquals(result.getDirection(), LinearDirection.LEFT);
    }

    @Test
    public void testContextFreeGrammar() throws MalformedGrammarException {
        final Grammar g = GrammarParser.parse("S -> aSb | ab");
        final ClassificationResult result = classifier.classify(g);

        Assert.assertEquals(result.getType(), ChomskyType.TYPE_2);
        Assert.assertEquals(result.getDirection(), LinearDirection.NONE);
        Assert.assertEquals(result.getBoundaryCases(), g.getProductions());
        Assert.assertEquals(result.getViolations(ChomskyType.TYPE_3).size(), 2);
        Assert.assertTrue(result.getViolations(ChomskyType.TYPE_2).isEmpty());
    }

    @Test
    public void testMixedLinearityDowngradesToContextFree() throws MalformedGrammarException {
        final Grammar g = GrammarParser.parse("S -> aA | b; A -> Sb | a");
        final ClassificationResult result = classifier.classify(g);

        Assert.assertEquals(result.getType(), ChomskyType.TYPE_2);
        Assert.assertEquals(result.getBoundaryCases().size(), 1);
        Assert.assertEquals(result.getBoundaryCases().get(0).toString(), "A -> S b");
        Assert.assertTrue(result.getViolations(ChomskyType.TYPE_3).get(0).getRule().contains("mixes"));
    }

    @Test
    public void testUnitProductionIsNotRegular() throws MalformedGrammarException {
        Assert.assertEquals(classifier.classify(GrammarParser.parse("S -> A | a; A -> a")).getType(),
                            ChomskyType.TYPE_2);
    }

    @Test
    public void testNonContractingSwap() throws MalformedGrammarException {
        final ClassificationResult result = classifier.classify(GrammarParser.parse("S -> AB; AB -> BA; A -> a; B -> b"));

        Assert.assertEquals(result.getType(), ChomskyType.TYPE_1);
        Assert.assertEquals(result.getBoundaryCases().size(), 1);
        Assert.assertEquals(result.getBoundaryCases().get(0).toString(), "A B -> B A");
    }

    @Test
    public void testContractingGrammarIsUnrestricted() throws MalformedGrammarException {
        final ClassificationResult result = classifier.classify(GrammarParser.parse("S -> AB; AB -> a; A -> a; B -> b"));

        Assert.assertEquals(result.getType(), ChomskyType.TYPE_0);
        Assert.assertEquals(result.getBoundaryCases().get(0).toString(), "A B -> a");
        Assert.assertEquals(result.getViolations(ChomskyType.TYPE_1).size(), 1);
    }

    @Test
    public void testStartEpsilonException() throws MalformedGrammarException {
        final String csg = "S -> ε | aBC; CB -> BC; aB -> ab; bB -> bb; bC -> bc; cC -> cc; B -> b; C -> c";
        Assert.assertEquals(classifier.classify(GrammarParser.parse(csg)).getType(), ChomskyType.TYPE_1);

        final String recursive = "S -> ε | aSBC; CB -> BC; aB -> ab; bB -> bb; bC -> bc; cC -> cc";
        final ClassificationResult result = classifier.classify(GrammarParser.parse(recursive));
        Assert.assertEquals(result.getType(), ChomskyType.TYPE_0);
        Assert.assertTrue(result.getViolations(ChomskyType.TYPE_1).get(0).getRule().contains("right-hand side"));
    }

    @Test
    public void testJustificationLines() throws MalformedGrammarException {
        final List<String> lines = classifier.classify(GrammarParser.parse("S -> aSb | ab")).getJustification();

        Assert.assertEquals(lines.get(0), "Type 3 (regular): not satisfied");
        Assert.assertTrue(lines.get(1).contains("S -> a S b"));
        Assert.assertEquals(lines.get(3), "Type 2 (context-free): satisfied");
    }

    @DataProvider
    public Object[][] grammars() {
        return new Object[][] {{"S -> aS | b"},
                               {"S -> aA; A -> ε"},
                               {"S -> Sa | a"},
                               {"S -> aSb | ε"},
                               {"S -> aSBC | aBC; CB -> BC; aB -> ab; bB -> bb; bC -> bc; cC -> cc"},
                               {"S -> ACaB; Ca -> aaC; CB -> DB | E; aD -> Da; AD -> AC; aE -> Ea; AE -> ε"}};
    }

    @Test(dataProvider = "grammars")
    public void testMonotonicity(String text) throws MalformedGrammarException {
        final Grammar g = GrammarParser.parse(text);
        final ChomskyType type = classifier.classify(g).getType();

        for (ChomskyType t : ChomskyType.values()) {
            Assert.assertEquals(classifier.satisfies(g, t), type.isAtLeastAsRestrictiveAs(t));
        }
        // every level above the result has a failing production
        for (ChomskyType t : ChomskyType.values()) {
            if (t.getLevel() > type.getLevel()) {
                Assert.assertFalse(classifier.evaluate(g, t).stream().allMatch(RuleEvaluation::isPassed));
            }
        }
        Assert.assertTrue(classifier.evaluate(g, type).stream().allMatch(RuleEvaluation::isPassed));
    }

    @Test
    public void testRegularImpliesContextFree() throws MalformedGrammarException {
        final Grammar g = GrammarParser.parse("S -> aA | b; A -> bS | a");

        Assert.assertTrue(classifier.evaluate(g, ChomskyType.TYPE_3).stream().allMatch(RuleEvaluation::isPassed));
        Assert.assertTrue(classifier.evaluate(g, ChomskyType.TYPE_2).stream().allMatch(RuleEvaluation::isPassed));
        Assert.assertTrue(classifier.evaluate(g, ChomskyType.TYPE_1).stream().allMatch(RuleEvaluation::isPassed));
    }
}
