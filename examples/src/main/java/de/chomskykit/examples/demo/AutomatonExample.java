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

import de.chomskykit.algorithms.analyzer.AnalysisResult;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.engine.FormalLanguageEngine;
import de.chomskykit.examples.ExampleAutomata;

/**
 * Analyzes the sample automata and runs them on a few inputs.
 */
public class AutomatonExample {

    private static final String[] INPUTS = {"", "ab", "aabb", "abab", "abb", "ba"};

    private AutomatonExample() {}

    public static void main(String[] args) {
        final FormalLanguageEngine engine = new FormalLanguageEngine();
        final Automaton[] automata =
                {ExampleAutomata.dfa(), ExampleAutomata.nfa(), ExampleAutomata.pda(), ExampleAutomata.tm()};

        for (Automaton automaton : automata) {
            final AnalysisResult analysis = engine.analyzeAutomaton(automaton);

            System.out.println("-------------------------------------------------------");
            System.out.println(automaton);
            System.out.println(analysis);
            for (String input : INPUTS) {
                System.out.println(String.format("%-6s %s",
                                                 input.isEmpty() ? "ε" : input,
                                                 engine.simulate(automaton, input)));
            }
        }
    }
}
