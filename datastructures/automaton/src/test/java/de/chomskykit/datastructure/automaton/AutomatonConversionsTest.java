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
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.Automata;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomatonConversionsTest {

    @Test
    public void testExportPreservesLanguage() throws MalformedAutomatonException {
        final Automaton dfa = AutomatonParser.parse(AutomatonParserTest.DFA);
        final CompactDFA<String> exported = AutomatonConversions.toCompactDFA(dfa);

        // words ending with b
        final CompactDFA<String> expected = new CompactDFA<>(dfa.getInputAlphabet());
        final Integer s0 = expected.addInitialState(false);
        final Integer s1 = expected.addState(true);
        expected.setTransition(s0, "a", s0);
        expected.setTransition(s0, "b", s1);
        expected.setTransition(s1, "a", s0);
        expected.setTransition(s1, "b", s1);

        Assert.assertEquals(exported.size(), 2);
        Assert.assertTrue(Automata.testEquivalence(exported, expected, dfa.getInputAlphabet()));
        Assert.assertTrue(exported.accepts(Word.fromSymbols("a", "a", "b")));
        Assert.assertFalse(exported.accepts(Word.fromSymbols("b", "a")));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testOnlyDfasAreExported() throws MalformedAutomatonException {
        AutomatonConversions.toCompactDFA(AutomatonParser.parse(AutomatonParserTest.PDA));
    }
}
