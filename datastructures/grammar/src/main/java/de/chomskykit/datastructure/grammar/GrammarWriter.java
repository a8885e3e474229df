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
package de.chomskykit.datastructure.grammar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renders grammars in the textual notation understood by {@link GrammarParser}.
 * <p>
 * The rules of the start symbol come first, followed by the remaining left-hand sides in the order of their first
 * appearance. A {@code %start} directive is written when the start symbol would not be recovered from the first rule,
 * e.g. when it only occurs inside longer left-hand sides. Alternatives are joined by {@code " | "}, symbols are separated by a single space and the empty word is
 * written as {@value #EPSILON}.
 */
public final class GrammarWriter {

    public static final String EPSILON = "ε";

    private static final String START_DIRECTIVE = "%start";

    private static final String RESERVED = "|;#'\"<>%→-:=ελ";

    private GrammarWriter() {
        // prevent instantiation
    }

    public static String write(Grammar grammar) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(grammar, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    public static void write(Grammar grammar, Appendable out) throws IOException {
        final Symbol startSymbol = grammar.getStartSymbol();
        final Word<Symbol> start = Word.fromLetter(startSymbol);
        final List<Word<Symbol>> order = new ArrayList<>(grammar.getLeftHandSides().size());
        if (!grammar.getProductionsFor(start).isEmpty()) {
            order.add(start);
        }
        for (Word<Symbol> lhs : grammar.getLeftHandSides()) {
            if (!lhs.equals(start)) {
                order.add(lhs);
            }
        }

        if (!startSymbol.equals(firstNonTerminal(order.get(0)))) {
            out.append(START_DIRECTIVE).append(' ').append(writeSymbol(startSymbol)).append(System.lineSeparator());
        }

        for (Word<Symbol> lhs : order) {
            out.append(writeSymbols(lhs)).append(" -> ");
            boolean first = true;
            for (Production p : grammar.getProductionsFor(lhs)) {
                if (first) {
                    first = false;
                } else {
                    out.append(" | ");
                }
                out.append(writeSymbols(p.getRightHandSide()));
            }
            out.append(System.lineSeparator());
        }
    }

    /**
     * Renders a sequence of symbols, using {@value #EPSILON} for the empty word.
     */
    public static String writeSymbols(Word<Symbol> symbols) {
        if (symbols.isEmpty()) {
            return EPSILON;
        }
        final StringBuilder sb = new StringBuilder();
        for (Symbol s : symbols) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(writeSymbol(s));
        }
        return sb.toString();
    }

    public static String writeSymbol(Symbol symbol) {
        final String text = symbol.getText();
        if (symbol.isNonTerminal()) {
            return isShortNonTerminal(text) ? text : '<' + text + '>';
        }
        if (text.codePointCount(0, text.length()) == 1 && !needsQuotes(text.codePointAt(0))) {
            return text;
        }
        final char quote = text.indexOf('\'') < 0 ? '\'' : '"';
        return quote + text + quote;
    }

    private static @Nullable Symbol firstNonTerminal(Word<Symbol> symbols) {
        for (Symbol s : symbols) {
            if (s.isNonTerminal()) {
                return s;
            }
        }
        return null;
    }

    private static boolean isShortNonTerminal(String text) {
        if (!Character.isUpperCase(text.codePointAt(0))) {
            return false;
        }
        final int offset = Character.charCount(text.codePointAt(0));
        for (int i = offset; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean needsQuotes(int codePoint) {
        return Character.isUpperCase(codePoint) || Character.isWhitespace(codePoint) ||
               RESERVED.indexOf(codePoint) >= 0;
    }
}
