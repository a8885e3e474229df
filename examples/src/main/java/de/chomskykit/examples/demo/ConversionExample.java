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
package de.chomskykit.examples.demo;

import java.io.IOException;

import de.chomskykit.algorithms.conversion.ConversionTrace;
import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonConversions;
import de.chomskykit.engine.FormalLanguageEngine;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.serialization.dot.GraphDOT;

/**
 * Converts a regular expression to a grammar and prints every stage, followed by the minimal DFA in DOT format.
 */
public class ConversionExample {

    private ConversionExample() {}

    public static void main(String[] args) throws AnalysisException, IOException {
        final String regex = args.length > 0 ? args[0] : "a(b|c)*";
        final FormalLanguageEngine engine = new FormalLanguageEngine();

        final ConversionTrace trace = engine.convertRegexToGrammar(regex);
        System.out.println(trace);

        final Automaton dfa = trace.getDfa();
        final CompactDFA<String> exported = AutomatonConversions.toCompactDFA(dfa);

        System.out.println("-------------------------------------------------------");
        System.out.println("States: " + exported.size());
        System.out.println("Sigma: " + dfa.getInputAlphabet().size());
        System.out.println();
        System.out.println("Model: ");
        GraphDOT.write(exported, dfa.getInputAlphabet(), System.out);
        System.out.println("-------------------------------------------------------");
    }
}
