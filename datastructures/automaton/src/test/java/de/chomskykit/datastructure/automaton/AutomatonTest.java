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

import java.util.Arrays;

import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomatonTest {

    @Test
    public void testBuilderKeepsStateOrder() {
        final Automaton nfa = Automaton.builder(AutomatonVariant.NFA)
                                       .withInputAlphabet("a", "b")
                                       .addInitialState("s", false)
                                       .addState("t", false, true)
                                       .addState("u")
                                       .addTransition("s", "a", "t")
                                       .addTransition("s", "a", "u")
                                       .addTransition(Transition.epsilon("u", "t"))
                                       .build();

        Assert.assertEquals(nfa.getStates().get(1).getId(), "t");
        Assert.assertEquals(nfa.getAcceptingStates().size(), 1);
        Assert.assertEquals(nfa.getTransitions("s", "a").size(), 2);
        Assert.assertTrue(nfa.getTransitions("t").isEmpty());
        Assert.assertFalse(nfa.isStructurallyDeterministic());
        Assert.assertNull(nfa.getState("x"));
    }

    @Test
    public void testNfaWithoutBranchingIsStructurallyDeterministic() {
        final Automaton nfa = Automaton.builder(AutomatonVariant.NFA)
                                       .withInputAlphabet("a")
                                       .addInitialState("s", true)
                                       .addTransition("s", "a", "s")
                                       .build();

        Assert.assertTrue(nfa.isStructurallyDeterministic());
    }

    @Test
    public void testPdaDefaults() {
        final Automaton pda = Automaton.builder(AutomatonVariant.PDA)
                                       .withInputAlphabet("a")
                                       .withStackAlphabet(Arrays.asList("Z", "A"))
                                       .addInitialState("q", true)
                                       .addTransition(Transition.pushdown("q", "a", null, "q", Word.fromLetter("A")))
                                       .build();

        Assert.assertEquals(pda.getInitialStackSymbol(), "Z");
        Assert.assertNull(pda.getBlankSymbol());
    }

    @Test
    public void testInvalidDfaReportsEveryProblem() {
        try {
            Automaton.builder(AutomatonVariant.DFA)
                     .withInputAlphabet("a")
                     .addState("s")
                     .addState("s")
                     .addTransition(Transition.epsilon("s", "s"))
                     .addTransition("s", "c", "t")
                     .build();
            Assert.fail();
        } catch (IllegalArgumentException e) {
            final String message = e.getMessage();
            Assert.assertTrue(message.contains("duplicate state s"), message);
            Assert.assertTrue(message.contains("exactly one initial state"), message);
            Assert.assertTrue(message.contains("epsilon"), message);
            Assert.assertTrue(message.contains("symbol c"), message);
            Assert.assertTrue(message.contains("undeclared state t"), message);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTmRequiresTapeActions() {
        Automaton.builder(AutomatonVariant.TM)
                 .withInputAlphabet("a")
                 .withTapeAlphabet(Arrays.asList("a", "_"))
                 .addInitialState("q", false)
                 .addTransition("q", "a", "q")
                 .build();
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testSeveralInitialStates() {
        Automaton.builder(AutomatonVariant.NFA)
                 .addInitialState("p", false)
                 .addInitialState("q", false)
                 .build()
                 .getInitialState();
    }
}
