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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import de.chomskykit.api.exception.MalformedAutomatonException;
import de.chomskykit.api.logging.AnalysisLogger;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads automaton descriptions of the following form:
 * <pre>
 * type: PDA                 # optional, inferred from the keys otherwise
 * states: q0, q1, q2
 * alphabet: a, b
 * stack alphabet: Z, A      # PDA only
 * initial stack: Z          # PDA only, defaults to the first stack symbol
 * tape alphabet: a, b, _    # TM only
 * blank: _                  # TM only, defaults to "_"
 * initial: q0
 * accepting: q2
 * transitions:
 * q0, a, q1                 # DFA/NFA: source, input, target
 * q0, a, Z, q0, AZ          # PDA: source, input, pop, target, push
 * q0, a, q1, a, R           # TM: source, read, target, write, L|R|S
 * </pre>
 * {@code ε}, {@code λ} and {@code eps} denote the empty input, pop or push. A {@code #} that is not followed by
 * whitespace is an ordinary symbol, e.g. a tape marker.
 */
public final class AutomatonParser {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(AutomatonParser.class);

    private static final String TYPE = "type";
    private static final String STATES = "states";
    private static final String ALPHABET = "alphabet";
    private static final String STACK_ALPHABET = "stack alphabet";
    private static final String INITIAL_STACK = "initial stack";
    private static final String TAPE_ALPHABET = "tape alphabet";
    private static final String BLANK = "blank";
    private static final String INITIAL = "initial";
    private static final String ACCEPTING = "accepting";
    private static final String TRANSITIONS = "transitions";

    private static final Set<String> KEYS = new HashSet<>(Arrays.asList(TYPE,
                                                                        STATES,
                                                                        ALPHABET,
                                                                        STACK_ALPHABET,
                                                                        INITIAL_STACK,
                                                                        TAPE_ALPHABET,
                                                                        BLANK,
                                                                        INITIAL,
                                                                        ACCEPTING,
                                                                        TRANSITIONS));

    private static final Set<String> EPSILON_TOKENS = new HashSet<>(Arrays.asList("ε", "λ", "eps"));

    private AutomatonParser() {
        // prevent instantiation
    }

    /**
     * @throws MalformedAutomatonException if the description is incomplete, references undeclared states or symbols,
     *                                     or describes an automaton violating the invariants of its variant
     */
    public static Automaton parse(String description) throws MalformedAutomatonException {
        final Map<String, Entry> entries = new HashMap<>();
        final List<Entry> transitionLines = new ArrayList<>();

        final String[] lines = description.split("\\R", -1);
        boolean inTransitions = false;
        for (int i = 0; i < lines.length; i++) {
            final int lineNumber = i + 1;
            final String line = stripComment(lines[i]);
            if (line.isEmpty()) {
                continue;
            }
            final int colon = line.indexOf(':');
            final String key = colon < 0 ? null : line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (key != null && KEYS.contains(key)) {
                final Entry entry = new Entry(line.substring(colon + 1).trim(), line, lineNumber);
                if (entries.putIfAbsent(key, entry) != null) {
                    throw new MalformedAutomatonException(lineNumber, line, "duplicate key '" + key + '\'');
                }
                inTransitions = TRANSITIONS.equals(key);
                if (inTransitions && !entry.value.isEmpty()) {
                    transitionLines.add(entry);
                }
            } else if (inTransitions) {
                transitionLines.add(new Entry(line, line, lineNumber));
            } else if (key != null) {
                throw new MalformedAutomatonException(lineNumber, line, "unknown key '" + key + '\'');
            } else {
                throw new MalformedAutomatonException(lineNumber, line, "expected 'key: value'");
            }
        }

        final List<String[]> fields = new ArrayList<>(transitionLines.size());
        for (Entry e : transitionLines) {
            final String[] f = e.value.split(",", -1);
            for (int i = 0; i < f.length; i++) {
                f[i] = f[i].trim();
                if (f[i].isEmpty()) {
                    throw new MalformedAutomatonException(e.line, e.text, "empty transition field");
                }
            }
            fields.add(f);
        }

        final List<String> states = list(required(entries, STATES));
        final Entry initialEntry = required(entries, INITIAL);
        final List<String> initial = list(initialEntry);
        final Entry acceptingEntry = entries.get(ACCEPTING);
        final List<String> accepting = acceptingEntry == null ? Collections.emptyList() : list(acceptingEntry);
        final Entry alphabetEntry = required(entries, ALPHABET);
        final List<String> alphabet = list(alphabetEntry);

        final AutomatonVariant variant = determineVariant(entries, fields, initial);
        checkVariantKeys(entries, variant);

        final Entry statesEntry = entries.get(STATES);
        if (states.isEmpty()) {
            throw new MalformedAutomatonException(statesEntry.line, statesEntry.text, "no states declared");
        }
        checkDistinct(states, statesEntry);
        checkDistinct(alphabet, alphabetEntry);
        for (String a : alphabet) {
            if (EPSILON_TOKENS.contains(a)) {
                throw new MalformedAutomatonException(alphabetEntry.line, a, "epsilon is not an input symbol");
            }
        }
        checkDeclared(initial, states, initialEntry);
        if (acceptingEntry != null) {
            checkDeclared(accepting, states, acceptingEntry);
        }

        final Automaton.Builder builder = Automaton.builder(variant).withInputAlphabet(alphabet);
        for (String s : states) {
            builder.addState(s, initial.contains(s), accepting.contains(s));
        }

        List<String> stackAlphabet = Collections.emptyList();
        if (variant == AutomatonVariant.PDA) {
            stackAlphabet = list(entries.get(STACK_ALPHABET));
            builder.withStackAlphabet(stackAlphabet);
            final Entry initialStack = entries.get(INITIAL_STACK);
            if (initialStack != null) {
                builder.withInitialStackSymbol(initialStack.value);
            }
        } else if (variant == AutomatonVariant.TM) {
            builder.withTapeAlphabet(list(entries.get(TAPE_ALPHABET)));
            final Entry blank = entries.get(BLANK);
            if (blank != null) {
                builder.withBlankSymbol(blank.value);
            }
        }

        final Map<Transition, Entry> origin = new HashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            final Transition t = toTransition(variant, fields.get(i), transitionLines.get(i), stackAlphabet);
            origin.putIfAbsent(t, transitionLines.get(i));
            builder.addTransition(t);
        }

        final Automaton automaton = builder.assemble();
        final List<AutomatonValidator.Problem> problems = AutomatonValidator.validate(automaton);
        if (!problems.isEmpty()) {
            final AutomatonValidator.Problem first = problems.get(0);
            final Transition t = first.getTransition();
            final Entry e = t == null ? null : origin.get(t);
            throw new MalformedAutomatonException(e == null ? 0 : e.line, e == null ? "" : e.text, first.getMessage());
        }

        LOGGER.logModel(automaton);
        return automaton;
    }

    private static AutomatonVariant determineVariant(Map<String, Entry> entries,
                                                     List<String[]> fields,
                                                     List<String> initial) throws MalformedAutomatonException {
        final Entry type = entries.get(TYPE);
        if (type != null) {
            try {
                return AutomatonVariant.valueOf(type.value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new MalformedAutomatonException(type.line, type.value, "unknown automaton type");
            }
        }
        if (entries.containsKey(TAPE_ALPHABET)) {
            return AutomatonVariant.TM;
        }
        if (entries.containsKey(STACK_ALPHABET)) {
            return AutomatonVariant.PDA;
        }
        if (initial.size() > 1) {
            return AutomatonVariant.NFA;
        }
        final Set<List<String>> seen = new HashSet<>();
        for (String[] f : fields) {
            if (f.length > 1 && (EPSILON_TOKENS.contains(f[1]) || !seen.add(Arrays.asList(f[0], f[1])))) {
                return AutomatonVariant.NFA;
            }
        }
        return AutomatonVariant.DFA;
    }

    private static void checkVariantKeys(Map<String, Entry> entries, AutomatonVariant variant)
            throws MalformedAutomatonException {
        for (String key : Arrays.asList(STACK_ALPHABET, INITIAL_STACK)) {
            final Entry e = entries.get(key);
            if (e != null && variant != AutomatonVariant.PDA) {
                throw new MalformedAutomatonException(e.line, e.text, "key '" + key + "' is only valid for a PDA");
            }
        }
        for (String key : Arrays.asList(TAPE_ALPHABET, BLANK)) {
            final Entry e = entries.get(key);
            if (e != null && variant != AutomatonVariant.TM) {
                throw new MalformedAutomatonException(e.line, e.text, "key '" + key + "' is only valid for a TM");
            }
        }
        if (variant == AutomatonVariant.PDA) {
            required(entries, STACK_ALPHABET);
        } else if (variant == AutomatonVariant.TM) {
            required(entries, TAPE_ALPHABET);
        }
    }

    private static Transition toTransition(AutomatonVariant variant,
                                           String[] f,
                                           Entry origin,
                                           List<String> stackAlphabet) throws MalformedAutomatonException {
        final int expected = variant.isFinite() ? 3 : 5;
        if (f.length != expected) {
            throw new MalformedAutomatonException(origin.line,
                                                  origin.text,
                                                  "a " + variant + " transition has " + expected + " fields, found " +
                                                  f.length);
        }
        switch (variant) {
            case PDA:
                return Transition.pushdown(f[0],
                                           symbol(f[1]),
                                           symbol(f[2]),
                                           f[3],
                                           parsePush(f[4], stackAlphabet, origin));
            case TM: {
                final TapeAction.Move move;
                try {
                    move = TapeAction.Move.fromCode(f[4]);
                } catch (IllegalArgumentException e) {
                    throw new MalformedAutomatonException(origin.line, f[4], "invalid head movement, expected L, R or S");
                }
                if (EPSILON_TOKENS.contains(f[1])) {
                    throw new MalformedAutomatonException(origin.line, origin.text, "a TM transition must read a symbol");
                }
                return Transition.turing(f[0], f[1], f[2], f[3], move);
            }
            default:
                return Transition.of(f[0], symbol(f[1]), f[2]);
        }
    }

    /**
     * Splits the pushed word. Symbols may be separated by spaces; otherwise the longest matching stack symbol is taken
     * repeatedly.
     */
    private static Word<String> parsePush(String push, List<String> stackAlphabet, Entry origin)
            throws MalformedAutomatonException {
        if (EPSILON_TOKENS.contains(push)) {
            return Word.epsilon();
        }
        if (push.contains(" ")) {
            return Word.fromSymbols(push.split("\\s+"));
        }
        final List<String> symbols = new ArrayList<>();
        int pos = 0;
        while (pos < push.length()) {
            String match = null;
            for (String s : stackAlphabet) {
                if (push.startsWith(s, pos) && (match == null || s.length() > match.length())) {
                    match = s;
                }
            }
            if (match == null) {
                throw new MalformedAutomatonException(origin.line, push.substring(pos), "unknown stack symbol");
            }
            symbols.add(match);
            pos += match.length();
        }
        return Word.fromList(symbols);
    }

    private static @Nullable String symbol(String field) {
        return EPSILON_TOKENS.contains(field) ? null : field;
    }

    private static Entry required(Map<String, Entry> entries, String key) throws MalformedAutomatonException {
        final Entry e = entries.get(key);
        if (e == null) {
            throw new MalformedAutomatonException(0, "", "missing key '" + key + '\'');
        }
        return e;
    }

    private static void checkDistinct(List<String> values, Entry entry) throws MalformedAutomatonException {
        final Set<String> seen = new LinkedHashSet<>();
        for (String v : values) {
            if (!seen.add(v)) {
                throw new MalformedAutomatonException(entry.line, v, "declared twice");
            }
        }
    }

    private static void checkDeclared(List<String> values, List<String> states, Entry entry)
            throws MalformedAutomatonException {
        for (String v : values) {
            if (!states.contains(v)) {
                throw new MalformedAutomatonException(entry.line, v, "undeclared state");
            }
        }
    }

    private static List<String> list(Entry entry) {
        final List<String> result = new ArrayList<>();
        for (String part : entry.value.split(",")) {
            final String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /**
     * Comments start with {@code #} at the beginning of a line or with {@code "# "} after whitespace. Any other
     * {@code #} is a symbol.
     */
    private static String stripComment(String line) {
        final String trimmed = line.trim();
        if (trimmed.startsWith("#")) {
            return "";
        }
        for (int i = 1; i < trimmed.length() - 1; i++) {
            if (trimmed.charAt(i) == '#' && Character.isWhitespace(trimmed.charAt(i - 1)) &&
                Character.isWhitespace(trimmed.charAt(i + 1))) {
                return trimmed.substring(0, i).trim();
            }
        }
        return trimmed;
    }

    private static final class Entry {

        private final String value;
        private final String text;
        private final int line;

        Entry(String value, String text, int line) {
            this.value = value;
            this.text = text;
            this.line = line;
        }
    }
}
