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
package de.chomskykit.algorithms.conversion;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import de.chomskykit.api.exception.InvalidRegexException;

/**
 * Recursive descent parser for regular expressions.
 * <p>
 * Supported syntax, from loosest to tightest binding:
 * <pre>
 * regex       := sequence ('|' sequence)*
 * sequence    := repetition+
 * repetition  := atom ('*' | '+' | '?')*
 * atom        := literal | '\' any | 'ε' | '(' regex ')' | '[' class ']'
 * </pre>
 * Whitespace is ignored. A character class lists single characters and ranges such as {@code a-z}. Error positions
 * are 0-based indices into the unmodified input.
 */
public final class RegexParser {

    private static final String UNSUPPORTED = "{}^$.";

    private final String input;
    private int pos;

    private RegexParser(String input) {
        this.input = input;
    }

    public static RegexNode parse(String regex) throws InvalidRegexException {
        final RegexParser parser = new RegexParser(regex);
        parser.skipWhitespace();
        if (parser.atEnd()) {
            throw new InvalidRegexException(0, regex, "empty expression");
        }
        final RegexNode result = parser.parseAlternation();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            // parseAlternation only stops early on a closing parenthesis
            throw new InvalidRegexException(parser.pos, ")", "unmatched ')'");
        }
        return result;
    }

    private RegexNode parseAlternation() throws InvalidRegexException {
        final List<RegexNode> alternatives = new ArrayList<>();
        alternatives.add(parseSequence());
        skipWhitespace();
        while (!atEnd() && peek() == '|') {
            pos++;
            alternatives.add(parseSequence());
            skipWhitespace();
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new RegexNode.Alternation(alternatives);
    }

    private RegexNode parseSequence() throws InvalidRegexException {
        final List<RegexNode> factors = new ArrayList<>();
        skipWhitespace();
        while (!atEnd() && peek() != '|' && peek() != ')') {
            factors.add(parseRepetition());
            skipWhitespace();
        }
        if (factors.isEmpty()) {
            throw new InvalidRegexException(pos, fragmentAt(pos), "empty alternative");
        }
        return factors.size() == 1 ? factors.get(0) : new RegexNode.Concatenation(factors);
    }

    private RegexNode parseRepetition() throws InvalidRegexException {
        RegexNode node = parseAtom();
        skipWhitespace();
        while (!atEnd()) {
            final char c = peek();
            if (c == '*') {
                node = new RegexNode.Star(node);
            } else if (c == '+') {
                node = new RegexNode.Plus(node);
            } else if (c == '?') {
                node = new RegexNode.Optional(node);
            } else {
                break;
            }
            pos++;
            skipWhitespace();
        }
        return node;
    }

    private RegexNode parseAtom() throws InvalidRegexException {
        final int start = pos;
        final int cp = input.codePointAt(pos);
        switch (cp) {
            case '(': {
                pos++;
                skipWhitespace();
                if (atEnd()) {
                    throw new InvalidRegexException(start, "(", "missing ')'");
                }
                if (peek() == ')') {
                    throw new InvalidRegexException(start, "()", "empty group");
                }
                final RegexNode inner = parseAlternation();
                skipWhitespace();
                if (atEnd()) {
                    throw new InvalidRegexException(start, "(", "missing ')'");
                }
                pos++;
                return inner;
            }
            case '[':
                return parseClass();
            case '*':
            case '+':
            case '?':
                throw new InvalidRegexException(start, new String(Character.toChars(cp)), "operator without operand");
            case '\\': {
                pos++;
                if (atEnd()) {
                    throw new InvalidRegexException(start, "\\", "trailing escape");
                }
                return new RegexNode.Literal(nextCodePoint());
            }
            case 'ε':
                pos++;
                return new RegexNode.Epsilon();
            default:
                if (UNSUPPORTED.indexOf(cp) >= 0) {
                    throw new InvalidRegexException(start, new String(Character.toChars(cp)), "unsupported operator");
                }
                return new RegexNode.Literal(nextCodePoint());
        }
    }

    private RegexNode parseClass() throws InvalidRegexException {
        final int start = pos;
        pos++;
        final Set<String> members = new LinkedHashSet<>();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                throw new InvalidRegexException(start, input.substring(start), "unterminated character class");
            }
            if (peek() == ']') {
                pos++;
                break;
            }
            final int from = nextClassMember(start);
            if (!atEnd() && peek() == '-' && pos + 1 < input.length() && input.charAt(pos + 1) != ']') {
                final int rangeStart = pos - Character.charCount(from);
                pos++;
                final int to = nextClassMember(start);
                if (to < from) {
                    throw new InvalidRegexException(rangeStart, input.substring(rangeStart, pos), "invalid range");
                }
                for (int c = from; c <= to; c++) {
                    members.add(new String(Character.toChars(c)));
                }
            } else {
                members.add(new String(Character.toChars(from)));
            }
        }
        if (members.isEmpty()) {
            throw new InvalidRegexException(start, input.substring(start, pos), "empty character class");
        }
        final List<RegexNode> literals = new ArrayList<>(members.size());
        for (String member : members) {
            literals.add(new RegexNode.Literal(member));
        }
        return literals.size() == 1 ? literals.get(0) : new RegexNode.Alternation(literals);
    }

    private int nextClassMember(int classStart) throws InvalidRegexException {
        if (peek() == '\\') {
            pos++;
            if (atEnd()) {
                throw new InvalidRegexException(classStart, input.substring(classStart), "trailing escape");
            }
        }
        final int cp = input.codePointAt(pos);
        pos += Character.charCount(cp);
        return cp;
    }

    private String nextCodePoint() {
        final int cp = input.codePointAt(pos);
        pos += Character.charCount(cp);
        return new String(Character.toChars(cp));
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private String fragmentAt(int index) {
        return index < input.length() ? input.substring(index, index + 1) : "";
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }
}
