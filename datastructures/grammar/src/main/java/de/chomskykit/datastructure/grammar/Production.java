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
import java.util.List;
import java.util.Objects;

import net.automatalib.words.Word;

/**
 * A rewriting rule {@code α -> β}.
 * <p>
 * The left-hand side is a non-empty word containing at least one non-terminal; the right-hand side may be empty, which
 * denotes an epsilon production.
 */
public final class Production {

    private final Word<Symbol> leftHandSide;
    private final Word<Symbol> rightHandSide;

    public Production(Word<Symbol> leftHandSide, Word<Symbol> rightHandSide) {
        if (leftHandSide.isEmpty()) {
            throw new IllegalArgumentException("The left-hand side of a production must not be empty");
        }
        if (countNonTerminals(leftHandSide) == 0) {
            throw new IllegalArgumentException("The left-hand side " + leftHandSide + " contains no non-terminal");
        }
        this.leftHandSide = leftHandSide;
        this.rightHandSide = rightHandSide;
    }

    /**
     * Convenience factory for productions with a single non-terminal on the left.
     */
    public static Production of(Symbol leftNonTerminal, Symbol... rightHandSide) {
        return new Production(Word.fromLetter(leftNonTerminal), Word.fromSymbols(rightHandSide));
    }

    public Word<Symbol> getLeftHandSide() {
        return leftHandSide;
    }

    public Word<Symbol> getRightHandSide() {
        return rightHandSide;
    }

    public boolean isEpsilon() {
        return rightHandSide.isEmpty();
    }

    /**
     * @return {@code true} iff the left-hand side consists of exactly one non-terminal
     */
    public boolean hasSingleNonTerminalLeft() {
        return leftHandSide.length() == 1 && leftHandSide.firstSymbol().isNonTerminal();
    }

    /**
     * @return the only symbol of the left-hand side
     *
     * @throws IllegalStateException if the left-hand side is not a single non-terminal
     */
    public Symbol getLeftNonTerminal() {
        if (!hasSingleNonTerminalLeft()) {
            throw new IllegalStateException("Left-hand side " + leftHandSide + " is not a single non-terminal");
        }
        return leftHandSide.firstSymbol();
    }

    public List<Symbol> getNonTerminalsOnRight() {
        final List<Symbol> result = new ArrayList<>();
        for (Symbol s : rightHandSide) {
            if (s.isNonTerminal()) {
                result.add(s);
            }
        }
        return result;
    }

    public static int countNonTerminals(Word<Symbol> word) {
        int count = 0;
        for (Symbol s : word) {
            if (s.isNonTerminal()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Production)) {
            return false;
        }
        Production other = (Production) obj;
        return leftHandSide.equals(other.leftHandSide) && rightHandSide.equals(other.rightHandSide);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leftHandSide, rightHandSide);
    }

    @Override
    public String toString() {
        return GrammarWriter.writeSymbols(leftHandSide) + " -> " + GrammarWriter.writeSymbols(rightHandSide);
    }
}
