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

import java.util.Objects;

import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A single transition of an {@link Automaton}.
 * <p>
 * Every transition has exactly one target; nondeterminism is expressed by several transitions that share source and
 * input. A {@code null} input denotes an epsilon transition. Pushdown transitions carry a {@link StackAction}, Turing
 * machine transitions a {@link TapeAction} (their input being the symbol read from the tape).
 */
public final class Transition {

    private final String source;
    private final @Nullable String input;
    private final String target;
    private final @Nullable StackAction stackAction;
    private final @Nullable TapeAction tapeAction;

    private Transition(String source,
                       @Nullable String input,
                       String target,
                       @Nullable StackAction stackAction,
                       @Nullable TapeAction tapeAction) {
        this.source = source;
        this.input = input;
        this.target = target;
        this.stackAction = stackAction;
        this.tapeAction = tapeAction;
    }

    public static Transition of(String source, @Nullable String input, String target) {
        return new Transition(source, input, target, null, null);
    }

    public static Transition epsilon(String source, String target) {
        return of(source, null, target);
    }

    public static Transition pushdown(String source,
                                      @Nullable String input,
                                      @Nullable String pop,
                                      String target,
                                      Word<String> push) {
        return new Transition(source, input, target, new StackAction(pop, push), null);
    }

    public static Transition turing(String source, String read, String target, String write, TapeAction.Move move) {
        return new Transition(source, read, target, null, new TapeAction(write, move));
    }

    public String getSource() {
        return source;
    }

    public @Nullable String getInput() {
        return input;
    }

    public String getTarget() {
        return target;
    }

    public boolean isEpsilon() {
        return input == null;
    }

    public @Nullable StackAction getStackAction() {
        return stackAction;
    }

    public @Nullable TapeAction getTapeAction() {
        return tapeAction;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Transition)) {
            return false;
        }
        Transition other = (Transition) obj;
        return source.equals(other.source) && Objects.equals(input, other.input) && target.equals(other.target) &&
               Objects.equals(stackAction, other.stackAction) && Objects.equals(tapeAction, other.tapeAction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, input, target, stackAction, tapeAction);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append('δ').append('(').append(source).append(", ").append(input == null ? "ε" : input);
        if (stackAction != null) {
            sb.append(", ").append(stackAction.getPop() == null ? "ε" : stackAction.getPop());
        }
        sb.append(") = ").append(target);
        if (stackAction != null) {
            sb.append(" push ").append(stackAction.getPush().isEmpty() ? "ε" : stackAction.getPush());
        }
        if (tapeAction != null) {
            sb.append(" write ").append(tapeAction.getWrite()).append(" move ").append(tapeAction.getMove().getCode());
        }
        return sb.toString();
    }
}
