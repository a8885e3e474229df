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
package de.chomskykit.datastructure.automaton;

import de.chomskykit.api.exception.MalformedAutomatonException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class AutomatonWriterTest {

    @DataProvider
    public Object[][] descriptions() {
        return new Object[][] {{AutomatonParserTest.DFA}, {AutomatonParserTest.PDA}, {AutomatonParserTest.TM}};
    }

    @Test(dataProvider = "descriptions")
    public void testRoundTrip(String description) throws MalformedAutomatonException {
        final Automaton automaton = AutomatonParser.parse(description);

        Assert.assertEquals(AutomatonParser.parse(AutomatonWriter.write(automaton)), automaton);
    }

    @Test
    public void testTransitionLines() {
        Assert.assertEquals(AutomatonWriter.writeTransition(Transition.epsilon("p", "q")), "p, ε, q");
        Assert.assertEquals(AutomatonWriter.writeTransition(Transition.turing("p", "_", "q", "a", TapeAction.Move.LEFT)),
                            "p, _, q, a, L");
    }

    @Test
    public void testHeader() throws MalformedAutomatonException {
        final String text = AutomatonWriter.write(AutomatonParser.parse(AutomatonParserTest.PDA));

        Assert.assertTrue(text.startsWith("type: PDA"));
        Assert.assertTrue(text.contains("initial stack: Z"));
        Assert.assertTrue(text.contains("q0, a, Z, q0, AZ"));
        Assert.assertTrue(text.contains("q1, ε, Z, q2, Z"));
    }
}
