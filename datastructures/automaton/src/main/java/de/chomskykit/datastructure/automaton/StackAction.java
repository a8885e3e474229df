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
 * The stack operation of a pushdown transition: optionally pop one symbol, then push a word.
 * <p>
 * The first symbol of the pushed word ends up on top of the stack, i.e. pushing {@code AZ} onto a stack with top
 * {@code Z} yields {@code A Z ...}.
 */
public final class StackAction {

    private final @Nullable String pop;
    private final Word<String> push;

    public StackAction(@Nullable String pop, Word<String> push) {
        this.pop = pop;
        this.push = push;
    }

    /**
     * @return the symbol that must be on top of the stack and is removed, or {@code null} if the stack is not
     * inspected
     */
    public @Nullable String getPop() {
        return pop;
    }

    public Word<String> getPush() {
        return push;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof StackAction)) {
            return false;
        }
        StackAction other = (StackAction) obj;
        return Objects.equals(pop, other.pop) && push.equals(other.push);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pop, push);
    }

    @Override
    public String toString() {
        return (pop == null ? "ε" : pop) + "/" + (push.isEmpty() ? "ε" : String.join("", push.asList()));
    }
}
