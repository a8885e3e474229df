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

import java.util.Objects;

/**
 * An atomic grammar symbol: either a terminal or a non-terminal.
 * <p>
 * Two symbols are equal iff their textual representations (and hence their kinds) are equal.
 */
public final class Symbol {

    public enum Kind {
        TERMINAL,
        NON_TERMINAL
    }

    private final String text;
    private final Kind kind;

    private Symbol(String text, Kind kind) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException("A symbol must not be empty");
        }
        this.text = text;
        this.kind = kind;
    }

    public static Symbol terminal(String text) {
        return new Symbol(text, Kind.TERMINAL);
    }

    public static Symbol nonTerminal(String text) {
        return new Symbol(text, Kind.NON_TERMINAL);
    }

    public String getText() {
        return text;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTerminal() {
        return kind == Kind.TERMINAL;
    }

    public boolean isNonTerminal() {
        return kind == Kind.NON_TERMINAL;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Symbol)) {
            return false;
        }
        Symbol other = (Symbol) obj;
        return kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, kind);
    }

    @Override
    public String toString() {
        return text;
    }
}
