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
import java.util.Collections;
import java.util.List;
import java.util.Random;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.MalformedGrammarException;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.GrammarParser;

/**
 * Generates example grammars for each level of the Chomsky hierarchy.
 * <p>
 * Every example is a fixed template whose terminals are drawn at random. The templates are chosen so that the
 * most restrictive type of the resulting grammar is exactly the requested one:
 * <ul>
 * <li>Type 3: right-linear chains, with self loops from {@link Difficulty#MEDIUM} on.</li>
 * <li>Type 2: nested pairs, palindromes and an expression grammar.</li>
 * <li>Type 1: {@code x^n z y^n} with a context rule, {@code a^n b^n c^n} and {@code a^n b^n c^n d^n}.</li>
 * <li>Type 0: grammars with an erasing context rule, the hardest one generating {@code a^(2^n)}.</li>
 * </ul>
 */
public class ExampleGenerator {

    private static final String TERMINALS = "abcdefghijklmnopqrstuvwxyz";
    private static final String CHAIN = "SABCDEFGH";

    private final Random random;

    public ExampleGenerator() {
        this(new Random());
    }

    public ExampleGenerator(Random random) {
        this.random = random;
    }

    public Grammar generateExample(ChomskyType type, Difficulty difficulty) {
        final String text = generateText(type, difficulty);
        try {
            return GrammarParser.parse(text);
        } catch (MalformedGrammarException e) {
            throw new IllegalStateException("Template for " + type + " (" + difficulty + ") is malformed", e);
        }
    }

    /**
     * @return the grammar text of a new example, with rules separated by line breaks
     */
    public String generateText(ChomskyType type, Difficulty difficulty) {
        final List<String> t = drawTerminals(5);
        switch (type) {
            case TYPE_3:
                return regular(difficulty, t);
            case TYPE_2:
                return contextFree(difficulty, t);
            case TYPE_1:
                return contextSensitive(difficulty, t);
            case TYPE_0:
                return unrestricted(difficulty, t);
            default:
                throw new IllegalArgumentException("Unknown type " + type);
        }
    }

    private String regular(Difficulty difficulty, List<String> t) {
        final int length;
        switch (difficulty) {
            case EASY:
                length = 3;
                break;
            case MEDIUM:
                length = 5;
                break;
            default:
                length = 8;
                break;
        }
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            final char current = CHAIN.charAt(i);
            sb.append(current).append(" -> ");
            if (i < length - 1) {
                sb.append(pick(t)).append(' ').append(CHAIN.charAt(i + 1));
                if (difficulty != Difficulty.EASY && random.nextBoolean()) {
                    sb.append(" | ").append(pick(t)).append(' ').append(current);
                }
                sb.append('\n');
            } else {
                sb.append(pick(t));
            }
        }
        return sb.toString();
    }

    private static String contextFree(Difficulty difficulty, List<String> t) {
        switch (difficulty) {
            case EASY:
                return fill("S -> $0 S $1 | $0 $1", t);
            case MEDIUM:
                return fill("S -> $0 S $0 | $1 S $1 | $0 | $1", t);
            default:
                // $0 plus, $1 times, $2 and $3 parentheses, $4 identifier
                return fill("E -> E $0 T | T\n" + "T -> T $1 F | F\n" + "F -> $2 E $3 | $4", t);
        }
    }

    private static String contextSensitive(Difficulty difficulty, List<String> t) {
        switch (difficulty) {
            case EASY:
                return fill("S -> $0 S $1 | A\n" + "$0 A -> $0 $2", t);
            case MEDIUM:
                return fill("S -> $0 S B C | $0 B C\n" + "C B -> B C\n" + "$0 B -> $0 $1\n" + "$1 B -> $1 $1\n" +
                            "$1 C -> $1 $2\n" + "$2 C -> $2 $2", t);
            default:
                return fill("S -> $0 S B C D | $0 B C D\n" + "D C -> C D\n" + "D B -> B D\n" + "C B -> B C\n" +
                            "$0 B -> $0 $1\n" + "$1 B -> $1 $1\n" + "$1 C -> $1 $2\n" + "$2 C -> $2 $2\n" +
                            "$2 D -> $2 $3\n" + "$3 D -> $3 $3", t);
        }
    }

    private static String unrestricted(Difficulty difficulty, List<String> t) {
        switch (difficulty) {
            case EASY:
                return fill("S -> $0 A $1\n" + "$0 A -> $0 $0\n" + "A -> ε", t);
            case MEDIUM:
                return fill("S -> $0 S $1 | A\n" + "$0 A $1 -> $2", t);
            default:
                // doubles a run of $0 on every pass of C from left to right
                return fill("S -> A C $0 B\n" + "C $0 -> $0 $0 C\n" + "C B -> D B | E\n" + "$0 D -> D $0\n" +
                            "A D -> A C\n" + "$0 E -> E $0\n" + "A E -> ε", t);
        }
    }

    private List<String> drawTerminals(int count) {
        final List<String> letters = new ArrayList<>(TERMINALS.length());
        for (char c : TERMINALS.toCharArray()) {
            letters.add(String.valueOf(c));
        }
        Collections.shuffle(letters, random);
        return letters.subList(0, count);
    }

    private String pick(List<String> terminals) {
        return terminals.get(random.nextInt(3));
    }

    private static String fill(String template, List<String> terminals) {
        String result = template;
        for (int i = 0; i < terminals.size(); i++) {
            result = result.replace("$" + i, terminals.get(i));
        }
        return result;
    }
}
