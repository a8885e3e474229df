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

import de.chomskykit.api.exception.MalformedAutomatonException;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonParser;

/**
 * Sample automata for each variant, as text and as parsed models.
 */
public final class ExampleAutomata {

    /** Words over {a, b} ending with b. */
    public static final String DFA = "# words ending with b\n" +
                                     "type: DFA\n" +
                                     "states: q0, q1\n" +
                                     "alphabet: a, b\n" +
                                     "initial: q0\n" +
                                     "accepting: q1\n" +
                                     "transitions:\n" +
                                     "q0, a, q0\n" +
                                     "q0, b, q1\n" +
                                     "q1, a, q0\n" +
                                     "q1, b, q1\n";

    /** Words over {a, b} ending with abb. */
    public static final String NFA = "# (a|b)* a b b\n" +
                                     "type: NFA\n" +
                                     "states: q0, q1, q2, q3\n" +
                                     "alphabet: a, b\n" +
                                     "initial: q0\n" +
                                     "accepting: q3\n" +
                                     "transitions:\n" +
                                     "q0, a, q0\n" +
                                     "q0, b, q0\n" +
                                     "q0, a, q1\n" +
                                     "q1, b, q2\n" +
                                     "q2, b, q3\n";

    /** a^n b^n for n &gt;= 1, accepting by final state. */
    public static final String PDA = "# a^n b^n\n" +
                                     "type: PDA\n" +
                                     "states: q0, q1, q2\n" +
                                     "alphabet: a, b\n" +
                                     "stack alphabet: Z, A\n" +
                                     "initial stack: Z\n" +
                                     "initial: q0\n" +
                                     "accepting: q2\n" +
                                     "transitions:\n" +
                                     "q0, a, Z, q0, AZ\n" +
                                     "q0, a, A, q0, AA\n" +
                                     "q0, b, A, q1, ε\n" +
                                     "q1, b, A, q1, ε\n" +
                                     "q1, ε, Z, q2, Z\n";

    /** (ab)*, read left to right without moving back. */
    public static final String TM = "# (ab)*\n" +
                                    "type: TM\n" +
                                    "states: q0, q1, qf\n" +
                                    "alphabet: a, b\n" +
                                    "tape alphabet: a, b, _\n" +
                                    "blank: _\n" +
                                    "initial: q0\n" +
                                    "accepting: qf\n" +
                                    "transitions:\n" +
                                    "q0, a, q1, a, R\n" +
                                    "q1, b, q0, b, R\n" +
                                    "q0, _, qf, _, S\n";

    private ExampleAutomata() {}

    public static Automaton dfa() {
        return parse(DFA);
    }

    public static Automaton nfa() {
        return parse(NFA);
    }

    public static Automaton pda() {
        return parse(PDA);
    }

    public static Automaton tm() {
        return parse(TM);
    }

    private static Automaton parse(String text) {
        try {
            return AutomatonParser.parse(text);
        } catch (MalformedAutomatonException e) {
            throw new IllegalStateException("Invalid sample automaton", e);
        }
    }
}
