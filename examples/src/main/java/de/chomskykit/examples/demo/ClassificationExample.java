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

import java.util.Random;

import de.chomskykit.algorithms.classifier.ClassificationResult;
import de.chomskykit.algorithms.comparator.ComparisonResult;
import de.chomskykit.algorithms.generator.Difficulty;
import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.engine.FormalLanguageEngine;

/**
 * Classifies a few grammars, generated examples included, and compares two grammars for the same language.
 */
public class ClassificationExample {

    private ClassificationExample() {}

    public static void main(String[] args) throws AnalysisException {
        final FormalLanguageEngine engine = new FormalLanguageEngine();

        final String[] grammars =
                {"S -> aS | b", "S -> Sa | b", "S -> aSb | ab", "S -> AB\nAB -> BA\nA -> a\nB -> b"};
        for (String text : grammars) {
            classify(engine, engine.parseGrammar(text));
        }

        final Random random = new Random(1);
        for (ChomskyType type : ChomskyType.values()) {
            classify(engine, engine.generateExample(type, Difficulty.MEDIUM, random));
        }

        System.out.println("-------------------------------------------------------");
        final ComparisonResult comparison = engine.compareGrammars(engine.parseGrammar("S -> aS | a"),
                                                                   engine.parseGrammar("S -> aA | a\nA -> aA | a"),
                                                                   4);
        System.out.println(comparison);
    }

    private static void classify(FormalLanguageEngine engine, Grammar grammar) {
        final ClassificationResult result = engine.classifyGrammar(grammar);

        System.out.println("-------------------------------------------------------");
        System.out.println(grammar);
        System.out.println("=> " + result.getType());
        result.getJustification().forEach(System.out::println);
        for (String warning : grammar.getWarnings()) {
            System.out.println("warning: " + warning);
        }
    }
}
