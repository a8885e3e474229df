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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import de.chomskykit.api.exception.MalformedGrammarException;
import de.chomskykit.api.logging.AnalysisLogger;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses grammar text in a BNF-like notation into a canonical {@link Grammar}.
 * <p>
 * Example:
 * <pre>
 * %start S        # optional
 * S -&gt; a S b | ε
 *   | &lt;tail&gt;
 * &lt;tail&gt; -&gt; 'cd'; T1 -&gt; c
 * </pre>
 * Rules are separated by line breaks or {@code ;}; a line starting with {@code |} adds alternatives to the previous
 * rule. Accepted arrows are {@code ->}, {@code →} and {@code ::=}. Upper-case letters (optionally followed by digits)
 * and names in angle brackets are non-terminals, quoted text is a terminal, every other character is a one-character
 * terminal. The empty word is written {@code ε} or {@code λ}, consistently and on its own.
 */
public final class GrammarParser {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(GrammarParser.class);

    private static final String START_DIRECTIVE = "%start";

    private GrammarParser() {
        // prevent instantiation
    }

    /**
     * Parses the given text, using the left-hand side of the first rule (or a {@code %start} directive) as start
     * symbol.
     *
     * @throws MalformedGrammarException if the text does not describe a well-formed grammar
     */
    public static Grammar parse(String text) throws MalformedGrammarException {
        return parse(text, null);
    }

    /**
     * Parses the given text with an explicit start symbol.
     *
     * @param startSymbol the name of the start non-terminal, or {@code null} for the default
     *
     * @throws MalformedGrammarException if the text does not describe a well-formed grammar or the start symbol has no
     *                                   rule
     */
    public static Grammar parse(String text, @Nullable String startSymbol) throws MalformedGrammarException {
        final State state = new State();
        final String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            parseLine(state, lines[i], i + 1);
        }

        if (state.productions.isEmpty()) {
            throw new MalformedGrammarException(0, "", "the grammar contains no rule");
        }

        checkDeclared(state);

        Symbol start = null;
        if (startSymbol != null) {
            start = resolveStart(state, startSymbol, 0);
        } else if (state.startDirective != null) {
            start = resolveStart(state, state.startDirective, state.startDirectiveLine);
        }

        final Grammar.Builder builder = Grammar.builder();
        if (start != null) {
            builder.withStartSymbol(start);
        }
        for (LocatedProduction lp : state.productions) {
            builder.addProduction(lp.production);
        }
        final Grammar grammar = builder.build();

        for (String warning : grammar.getWarnings()) {
            LOGGER.logFinding(warning);
        }
        LOGGER.logModel(grammar);
        return grammar;
    }

    private static void parseLine(State state, String line, int lineNumber) throws MalformedGrammarException {
        final String trimmed = line.trim();
        if (trimmed.startsWith("%")) {
            parseDirective(state, trimmed, lineNumber);
            return;
        }

        final List<Token> tokens = new Tokenizer(line, lineNumber).tokenize();
        List<Token> statement = new ArrayList<>();
        for (Token t : tokens) {
            if (t.type == TokenType.SEPARATOR) {
                parseStatement(state, statement, trimmed, lineNumber);
                statement = new ArrayList<>();
            } else {
                statement.add(t);
            }
        }
        parseStatement(state, statement, trimmed, lineNumber);
    }

    private static void parseDirective(State state, String directive, int lineNumber)
            throws MalformedGrammarException {
        final int comment = directive.indexOf('#');
        final String line = comment < 0 ? directive : directive.substring(0, comment).trim();
        final String[] parts = line.split("\\s+");
        if (!START_DIRECTIVE.equals(parts[0])) {
            throw new MalformedGrammarException(lineNumber, parts[0], "unknown directive");
        }
        if (parts.length != 2) {
            throw new MalformedGrammarException(lineNumber, line, "%start expects exactly one non-terminal");
        }
        if (state.startDirective != null) {
            throw new MalformedGrammarException(lineNumber, line, "duplicate %start directive");
        }
        state.startDirective = parts[1];
        state.startDirectiveLine = lineNumber;
    }

    private static void parseStatement(State state, List<Token> statement, String line, int lineNumber)
            throws MalformedGrammarException {
        if (statement.isEmpty()) {
            return;
        }

        final Word<Symbol> lhs;
        final List<Token> rhs;
        if (statement.get(0).type == TokenType.BAR) {
            if (state.previousLeft == null) {
                throw new MalformedGrammarException(lineNumber, line, "continuation without a preceding rule");
            }
            lhs = state.previousLeft;
            rhs = statement.subList(1, statement.size());
        } else {
            final int arrow = indexOfArrow(statement, line, lineNumber);
            lhs = parseLeft(state, statement.subList(0, arrow), line, lineNumber);
            rhs = statement.subList(arrow + 1, statement.size());
        }

        if (rhs.isEmpty()) {
            throw new MalformedGrammarException(lineNumber, line, "empty right-hand side");
        }

        List<Token> alternative = new ArrayList<>();
        for (Token t : rhs) {
            if (t.type == TokenType.BAR) {
                addAlternative(state, lhs, alternative, line, lineNumber);
                alternative = new ArrayList<>();
            } else {
                alternative.add(t);
            }
        }
        addAlternative(state, lhs, alternative, line, lineNumber);
        state.previousLeft = lhs;
    }

    private static int indexOfArrow(List<Token> statement, String line, int lineNumber)
            throws MalformedGrammarException {
        int arrow = -1;
        for (int i = 0; i < statement.size(); i++) {
            if (statement.get(i).type == TokenType.ARROW) {
                if (arrow >= 0) {
                    throw new MalformedGrammarException(lineNumber, line, "more than one arrow in a rule");
                }
                arrow = i;
            }
        }
        if (arrow < 0) {
            throw new MalformedGrammarException(lineNumber, line, "missing arrow");
        }
        return arrow;
    }

    private static Word<Symbol> parseLeft(State state, List<Token> tokens, String line, int lineNumber)
            throws MalformedGrammarException {
        if (tokens.isEmpty()) {
            throw new MalformedGrammarException(lineNumber, line, "empty left-hand side");
        }
        final List<Symbol> symbols = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            switch (t.type) {
                case EPSILON:
                    throw new MalformedGrammarException(lineNumber, t.text, "epsilon on a left-hand side");
                case BAR:
                    throw new MalformedGrammarException(lineNumber, line, "alternation on a left-hand side");
                default:
                    symbols.add(t.toSymbol());
            }
        }
        final Word<Symbol> lhs = Word.fromList(symbols);
        if (Production.countNonTerminals(lhs) == 0) {
            throw new MalformedGrammarException(lineNumber, line, "left-hand side without non-terminal");
        }
        for (Symbol s : symbols) {
            if (s.isNonTerminal()) {
                state.declared.add(s);
            }
        }
        return lhs;
    }

    private static void addAlternative(State state,
                                       Word<Symbol> lhs,
                                       List<Token> alternative,
                                       String line,
                                       int lineNumber) throws MalformedGrammarException {
        if (alternative.isEmpty()) {
            throw new MalformedGrammarException(lineNumber, line, "empty alternative");
        }

        final Word<Symbol> rhs;
        if (alternative.get(0).type == TokenType.EPSILON) {
            if (alternative.size() > 1) {
                throw new MalformedGrammarException(lineNumber, line, "inconsistent epsilon token");
            }
            rhs = Word.epsilon();
        } else {
            final List<Symbol> symbols = new ArrayList<>(alternative.size());
            for (Token t : alternative) {
                if (t.type == TokenType.EPSILON) {
                    throw new MalformedGrammarException(lineNumber, line, "inconsistent epsilon token");
                }
                symbols.add(t.toSymbol());
            }
            rhs = Word.fromList(symbols);
        }

        for (Token t : alternative) {
            if (t.type == TokenType.EPSILON) {
                if (state.epsilonSpelling == null) {
                    state.epsilonSpelling = t.text;
                } else if (!state.epsilonSpelling.equals(t.text)) {
                    throw new MalformedGrammarException(lineNumber, t.text, "inconsistent epsilon token");
                }
            }
        }

        state.productions.add(new LocatedProduction(new Production(lhs, rhs), lineNumber));
    }

    private static void checkDeclared(State state) throws MalformedGrammarException {
        for (LocatedProduction lp : state.productions) {
            for (Symbol s : lp.production.getRightHandSide()) {
                if (s.isNonTerminal() && !state.declared.contains(s)) {
                    throw new MalformedGrammarException(lp.line, s.getText(), "undeclared symbol");
                }
            }
        }
    }

    private static Symbol resolveStart(State state, String name, int lineNumber) throws MalformedGrammarException {
        String plain = name.trim();
        if (plain.length() > 2 && plain.startsWith("<") && plain.endsWith(">")) {
            plain = plain.substring(1, plain.length() - 1);
        }
        final Symbol start = Symbol.nonTerminal(plain);
        if (!state.declared.contains(start)) {
            throw new MalformedGrammarException(lineNumber, name, "start symbol has no rule");
        }
        return start;
    }

    private enum TokenType {
        ARROW,
        BAR,
        SEPARATOR,
        NON_TERMINAL,
        TERMINAL,
        EPSILON
    }

    private static final class Token {

        private final TokenType type;
        private final String text;

        Token(TokenType type, String text) {
            this.type = type;
            this.text = text;
        }

        Symbol toSymbol() {
            if (type == TokenType.NON_TERMINAL) {
                return Symbol.nonTerminal(text);
            }
            if (type == TokenType.TERMINAL) {
                return Symbol.terminal(text);
            }
            throw new IllegalStateException("Token " + type + " is not a symbol");
        }
    }

    private static final class LocatedProduction {

        private final Production production;
        private final int line;

        LocatedProduction(Production production, int line) {
            this.production = production;
            this.line = line;
        }
    }

    private static final class State {

        private final List<LocatedProduction> productions = new ArrayList<>();
        private final Set<Symbol> declared = new LinkedHashSet<>();
        private @Nullable Word<Symbol> previousLeft;
        private @Nullable String epsilonSpelling;
        private @Nullable String startDirective;
        private int startDirectiveLine;
    }

    private static final class Tokenizer {

        private final String line;
        private final int lineNumber;
        private int pos;

        Tokenizer(String line, int lineNumber) {
            this.line = line;
            this.lineNumber = lineNumber;
        }

        List<Token> tokenize() throws MalformedGrammarException {
            final List<Token> tokens = new ArrayList<>();
            while (pos < line.length()) {
                final int c = line.codePointAt(pos);
                final int width = Character.charCount(c);

                if (Character.isWhitespace(c)) {
                    pos += width;
                } else if (c == '#') {
                    break;
                } else if (line.startsWith("->", pos)) {
                    tokens.add(new Token(TokenType.ARROW, "->"));
                    pos += 2;
                } else if (line.startsWith("::=", pos)) {
                    tokens.add(new Token(TokenType.ARROW, "::="));
                    pos += 3;
                } else if (c == '→') {
                    tokens.add(new Token(TokenType.ARROW, "→"));
                    pos += width;
                } else if (c == '|') {
                    tokens.add(new Token(TokenType.BAR, "|"));
                    pos += width;
                } else if (c == ';') {
                    tokens.add(new Token(TokenType.SEPARATOR, ";"));
                    pos += width;
                } else if (c == 'ε' || c == 'λ') {
                    tokens.add(new Token(TokenType.EPSILON, new String(Character.toChars(c))));
                    pos += width;
                } else if (c == '\'' || c == '"') {
                    tokens.add(new Token(TokenType.TERMINAL, readDelimited((char) c, (char) c, "quote")));
                } else if (c == '<') {
                    tokens.add(new Token(TokenType.NON_TERMINAL, readDelimited('<', '>', "'<'")));
                } else if (Character.isUpperCase(c)) {
                    final int begin = pos;
                    pos += width;
                    while (pos < line.length() && Character.isDigit(line.charAt(pos))) {
                        pos++;
                    }
                    tokens.add(new Token(TokenType.NON_TERMINAL, line.substring(begin, pos)));
                } else {
                    tokens.add(new Token(TokenType.TERMINAL, new String(Character.toChars(c))));
                    pos += width;
                }
            }
            return tokens;
        }

        private String readDelimited(char open, char close, String what) throws MalformedGrammarException {
            final int begin = pos;
            final int end = line.indexOf(close, pos + 1);
            if (end < 0) {
                throw new MalformedGrammarException(lineNumber, line.substring(begin).trim(), "unterminated " + what);
            }
            pos = end + 1;
            final String content = line.substring(begin + 1, end);
            if (content.isEmpty()) {
                throw new MalformedGrammarException(lineNumber, open + "" + close, "empty symbol");
            }
            return content;
        }
    }
}
