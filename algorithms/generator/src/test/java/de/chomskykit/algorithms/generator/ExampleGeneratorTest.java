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
package de.chomskykit.algorithms.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import de.chomskykit.algorithms.classifier.ChomskyClassifier;
import de.chomskykit.api.ChomskyType;
import de.chomskykit.datastructure.grammar.Grammar;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ExampleGeneratorTest {

    private final ChomskyClassifier classifier = new ChomskyClassifier();

    @DataProvider
    public static Object[][] requests() {
        final List<Object[]> result = new ArrayList<>();
        for (ChomskyType type : ChomskyType.values()) {
            for (Difficulty difficulty : Difficulty.values()) {
                result.add(new Object[] {type, difficulty});
            }
        }
        return result.toArray(new Object[0][]);
    }

    @Test(dataProvider = "requests")
    public void testClassificationMatchesRequest(ChomskyType type, Difficulty difficulty) {
        for (int seed = 0; seed < 20; seed++) {
            final Grammar grammar = new ExampleGenerator(new Random(seed)).generateExample(type, difficulty);
            Assert.assertEquals(classifier.classify(grammar).getType(), type, grammar.toString());
            Assert.assertTrue(grammar.getWarnings().isEmpty(), grammar.getWarnings().toString());
        }
    }

    @Test
    public void testSeedDeterminesExample() {
        for (ChomskyType type : ChomskyType.values()) {
            final Grammar first = new ExampleGenerator(new Random(42)).generateExample(type, Difficulty.HARD);
            final Grammar second = new ExampleGenerator(new Random(42)).generateExample(type, Difficulty.HARD);
            Assert.assertEquals(second, first);
        }
    }

    @Test
    public void testDifficultyGrowsGrammar() {
        final ExampleGenerator generator = new ExampleGenerator(new Random(7));

        Assert.assertTrue(generator.generateExample(ChomskyType.TYPE_3, Difficulty.EASY).size() <
                          generator.generateExample(ChomskyType.TYPE_3, Difficulty.HARD).size());
        Assert.assertTrue(generator.generateExample(ChomskyType.TYPE_1, Difficulty.MEDIUM).size() <
                          generator.generateExample(ChomskyType.TYPE_1, Difficulty.HARD).size());
    }
}
