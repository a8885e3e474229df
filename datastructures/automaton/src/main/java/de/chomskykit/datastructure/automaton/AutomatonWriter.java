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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renders automata in the description format read by {@link AutomatonParser}.
 */
public final class AutomatonWriter {

    static final String EPSILON = "ε";

    private AutomatonWriter() {
        // prevent instantiation
    }

    public static String write(Automaton automaton) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(automaton, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    public static void write(Automaton automaton, Appendable out) throws IOException {
        final List<String> initial = new ArrayList<>();
        final List<String> accepting = new ArrayList<>();
        final List<String> states = new ArrayList<>();
        for (AutomatonState s : automaton.getStates()) {
            states.add(s.getId());
            if (s.isInitial()) {
                initial.add(s.getId());
            }
            if (s.isAccepting()) {
                accepting.add(s.getId());
            }
        }

        appendEntry(out, "type", automaton.getVariant().name());
        appendEntry(out, "states", join(states));
        appendEntry(out, "alphabet", join(automaton.getInputAlphabet()));
        if (automaton.getVariant() == AutomatonVariant.PDA) {
            appendEntry(out, "stack alphabet", join(automaton.getStackAlphabet()));
            appendEntry(out, "initial stack", String.valueOf(automaton.getInitialStackSymbol()));
        } else if (automaton.getVariant() == AutomatonVariant.TM) {
            appendEntry(out, "tape alphabet", join(automaton.getTapeAlphabet()));
            appendEntry(out, "blank", String.valueOf(automaton.getBlankSymbol()));
        }
        appendEntry(out, "initial", join(initial));
        appendEntry(out, "accepting", join(accepting));

        out.append("transitions:").append(System.lineSeparator());
        for (Transition t : automaton.getTransitions()) {
            out.append(writeTransition(t)).append(System.lineSeparator());
        }
    }

    /**
     * Renders one transition as a line of the {@code transitions:} section.
     */
    public static String writeTransition(Transition t) {
        final StringBuilder sb = new StringBuilder();
        sb.append(t.getSource()).append(", ").append(symbol(t.getInput()));
        final StackAction stack = t.getStackAction();
        final TapeAction tape = t.getTapeAction();
        if (stack != null) {
            sb.append(", ").append(symbol(stack.getPop()));
            sb.append(", ").append(t.getTarget());
            sb.append(", ").append(writePush(stack.getPush()));
        } else if (tape != null) {
            sb.append(", ").append(t.getTarget());
            sb.append(", ").append(tape.getWrite());
            sb.append(", ").append(tape.getMove().getCode());
        } else {
            sb.append(", ").append(t.getTarget());
        }
        return sb.toString();
    }

    private static String writePush(Word<String> push) {
        if (push.isEmpty()) {
            return EPSILON;
        }
        for (String s : push) {
            if (s.length() != 1) {
                return String.join(" ", push.asList());
            }
        }
        return String.join("", push.asList());
    }

    private static String symbol(@Nullable String symbol) {
        return symbol == null ? EPSILON : symbol;
    }

    private static String join(Collection<String> values) {
        return String.join(", ", values);
    }

    private static void appendEntry(Appendable out, String key, String value) throws IOException {
        out.append(key).append(": ").append(value).append(System.lineSeparator());
    }
}
