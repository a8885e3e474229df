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
package de.chomskykit.algorithms.comparator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.Production;
import de.chomskykit.datastructure.grammar.Symbol;
import net.automatalib.words.Word;

/**
 * Breadth-first enumeration of the terminal strings a grammar derives within a bounded number of steps.
 * <p>
 * Each level of the search applies one production. Context-free shaped grammars rewrite the leftmost non-terminal
 * only, which does not change the derivable strings or the number of steps needed. Other grammars rewrite every
 * occurrence of every left-hand side. Sentential forms longer than the length bound are discarded.
 */
public class BoundedDerivation {

    /**
     * Orders strings by length first, then lexicographically.
     */
    public static final Comparator<String> SHORTLEX =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private final int depth;
    private final int maxLength;
    private final long maxForms;

    public BoundedDerivation(int depth, int maxLength, long maxForms) {
        if (depth < 0 || maxLength < 0 || maxForms < 1) {
            throw new IllegalArgumentException("Invalid derivation bounds: depth " + depth + ", length " + maxLength +
                                               ", forms " + maxForms);
        }
        this.depth = depth;
        this.maxLength = maxLength;
        this.maxForms = maxForms;
    }

    /**
     * @return the derived terminal strings in shortlex order, each rendered as the concatenation of its terminals
     *
     * @throws StepLimitExceededException
     *         if more than the allowed number of distinct sentential forms is reached
     */
    public Set<String> generate(Grammar grammar) throws StepLimitExceededException {
        final boolean leftmost = grammar.isContextFreeShaped();
        final Set<String> result = new TreeSet<>(SHORTLEX);
        final Set<Word<Symbol>> seen = new HashSet<>();

        List<Word<Symbol>> layer = Collections.singletonList(Word.fromLetter(grammar.getStartSymbol()));
        seen.addAll(layer);

        for (int step = 0; step < depth && !layer.isEmpty(); step++) {
            final List<Word<Symbol>> next = new ArrayList<>();
            for (Word<Symbol> form : layer) {
                for (Word<Symbol> successor : rewrite(grammar, form, leftmost)) {
                    if (successor.length() > maxLength || !seen.add(successor)) {
                        continue;
                    }
                    if (seen.size() > maxForms) {
                        throw new StepLimitExceededException("Derivation from " + grammar.getStartSymbol(), maxForms);
                    }
                    if (isTerminal(successor)) {
                        result.add(render(successor));
                    } else {
                        next.add(successor);
                    }
                }
            }
            layer = next;
        }
        return result;
    }

    private static List<Word<Symbol>> rewrite(Grammar grammar, Word<Symbol> form, boolean leftmost) {
        final List<Word<Symbol>> successors = new ArrayList<>();
        if (leftmost) {
            for (int i = 0; i < form.length(); i++) {
                final Symbol symbol = form.getSymbol(i);
                if (symbol.isNonTerminal()) {
                    for (Production p : grammar.getProductionsFor(symbol)) {
                        successors.add(replace(form, i, 1, p.getRightHandSide()));
                    }
                    break;
                }
            }
            return successors;
        }

        for (Production p : grammar.getProductions()) {
            final Word<Symbol> lhs = p.getLeftHandSide();
            for (int i = 0; i + lhs.length() <= form.length(); i++) {
                if (form.subWord(i, i + lhs.length()).equals(lhs)) {
                    successors.add(replace(form, i, lhs.length(), p.getRightHandSide()));
                }
            }
        }
        return successors;
    }

    private static Word<Symbol> replace(Word<Symbol> form, int from, int length, Word<Symbol> replacement) {
        return form.prefix(from).concat(replacement, form.subWord(from + length));
    }

    private static boolean isTerminal(Word<Symbol> form) {
        for (Symbol s : form) {
            if (s.isNonTerminal()) {
                return false;
            }
        }
        return true;
    }

    static String render(Word<Symbol> terminals) {
        final StringBuilder sb = new StringBuilder();
        for (Symbol s : terminals) {
            sb.append(s.getText());
        }
        return sb.toString();
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
