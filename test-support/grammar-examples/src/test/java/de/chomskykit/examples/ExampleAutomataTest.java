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
package de.chomskykit.examples;

import de.chomskykit.algorithms.analyzer.AutomatonAnalyzer;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.util.EngineLimits;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ExampleAutomataTest {

    private final AutomatonAnalyzer analyzer = new AutomatonAnalyzer(EngineLimits.defaults());

    @DataProvider
    public static Object[][] samples() {
        return new Object[][] {{ExampleAutomata.dfa(), AutomatonVariant.DFA, "aab", "aba"},
                               {ExampleAutomata.nfa(), AutomatonVariant.NFA, "babb", "abab"},
                               {ExampleAutomata.pda(), AutomatonVariant.PDA, "aabb", "aab"},
                               {ExampleAutomata.tm(), AutomatonVariant.TM, "abab", "aba"}};
    }

    @Test(dataProvider = "samples")
    public void testSamples(Automaton automaton, AutomatonVariant variant, String accepted, String rejected) {
        Assert.assertEquals(automaton.getVariant(), variant);
        Assert.assertTrue(analyzer.simulate(automaton, letters(accepted)).isAccepted());
        Assert.assertFalse(analyzer.simulate(automaton, letters(rejected)).isAccepted());
    }

    private static Word<String> letters(String text) {
        return Word.fromSymbols(text.split(""));
    }
}
