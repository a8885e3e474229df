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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A canonical, immutable formal grammar.
 * <p>
 * A grammar is a deduplicated list of {@link Production}s (kept in the order of their first appearance), a designated
 * start symbol and the terminal and non-terminal sets derived from the productions. Every instance satisfies:
 * <ul>
 * <li>the start symbol is a non-terminal occurring on the left-hand side of at least one production,</li>
 * <li>every non-terminal used on a right-hand side occurs on some left-hand side.</li>
 * </ul>
 * Non-terminals that are declared but never used on a right-hand side are tolerated and reported through
 * {@link #getWarnings()}.
 */
public final class Grammar {

    private final Symbol startSymbol;
    private final List<Production> productions;
    private final Set<Symbol> nonTerminals;
    private final Set<Symbol> terminals;
    private final Map<Word<Symbol>, List<Production>> productionsByLeft;
    private final List<String> warnings;

    private Grammar(Symbol startSymbol,
                    List<Production> productions,
                    Set<Symbol> nonTerminals,
                    Set<Symbol> terminals,
                    Map<Word<Symbol>, List<Production>> productionsByLeft,
                    List<String> warnings) {
        this.startSymbol = startSymbol;
        this.productions = productions;
        this.nonTerminals = nonTerminals;
        this.terminals = terminals;
        this.productionsByLeft = productionsByLeft;
        this.warnings = warnings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Symbol getStartSymbol() {
        return startSymbol;
    }

    public List<Production> getProductions() {
        return productions;
    }

    public int size() {
        return productions.size();
    }

    public Set<Symbol> getNonTerminals() {
        return nonTerminals;
    }

    public Set<Symbol> getTerminals() {
        return terminals;
    }

    /**
     * @return the distinct left-hand sides, in the order of their first appearance
     */
    public Set<Word<Symbol>> getLeftHandSides() {
        return productionsByLeft.keySet();
    }

    public List<Production> getProductionsFor(Word<Symbol> leftHandSide) {
        return productionsByLeft.getOrDefault(leftHandSide, Collections.emptyList());
    }

    public List<Production> getProductionsFor(Symbol nonTerminal) {
        return getProductionsFor(Word.fromLetter(nonTerminal));
    }

    /**
     * @return {@code true} iff every production has a single non-terminal on its left-hand side
     */
    public boolean isContextFreeShaped() {
        for (Production p : productions) {
            if (!p.hasSingleNonTerminalLeft()) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the non-terminals that occur on at least one right-hand side
     */
    public Set<Symbol> getNonTerminalsOnRightSides() {
        final Set<Symbol> result = new LinkedHashSet<>();
        for (Production p : productions) {
            result.addAll(p.getNonTerminalsOnRight());
        }
        return result;
    }

    public boolean appearsOnRightHandSide(Symbol symbol) {
        for (Production p : productions) {
            if (p.getRightHandSide().asList().contains(symbol)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the non-fatal findings collected while the grammar was built
     */
    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Two grammars are equal iff they have the same start symbol and the same set of productions. Production order and
     * warnings are not taken into account.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Grammar)) {
            return false;
        }
        Grammar other = (Grammar) obj;
        return startSymbol.equals(other.startSymbol) &&
               new HashSet<>(productions).equals(new HashSet<>(other.productions));
    }

    @Override
    public int hashCode() {
        return Objects.hash(startSymbol, new HashSet<>(productions));
    }

    @Override
    public String toString() {
        return GrammarWriter.write(this);
    }

    /**
     * Collects productions and validates the grammar invariants on {@link #build()}.
     */
    public static final class Builder {

        private final Set<Production> productions = new LinkedHashSet<>();
        private @Nullable Symbol startSymbol;

        private Builder() {}

        /**
         * Sets the start symbol. If none is set, the first non-terminal on the left-hand side of the first production
         * is used.
         */
        public Builder withStartSymbol(Symbol startSymbol) {
            this.startSymbol = startSymbol;
            return this;
        }

        public Builder addProduction(Production production) {
            productions.add(production);
            return this;
        }

        public Builder addProduction(Symbol leftNonTerminal, Symbol... rightHandSide) {
            return addProduction(Production.of(leftNonTerminal, rightHandSide));
        }

        public Builder addProductions(Iterable<Production> toAdd) {
            for (Production p : toAdd) {
                productions.add(p);
            }
            return this;
        }

        /**
         * @throws IllegalArgumentException if the collected productions do not form a valid grammar
         */
        public Grammar build() {
            if (productions.isEmpty()) {
                throw new IllegalArgumentException("A grammar needs at least one production");
            }

            final Map<Word<Symbol>, List<Production>> byLeft = new LinkedHashMap<>();
            final Set<Symbol> declared = new LinkedHashSet<>();
            final Set<Symbol> nonTerminals = new LinkedHashSet<>();
            final Set<Symbol> terminals = new LinkedHashSet<>();

            for (Production p : productions) {
                byLeft.computeIfAbsent(p.getLeftHandSide(), k -> new ArrayList<>()).add(p);
                for (Symbol s : p.getLeftHandSide()) {
                    if (s.isNonTerminal()) {
                        declared.add(s);
                    }
                }
            }

            final Set<Symbol> used = new HashSet<>();
            for (Production p : productions) {
                collect(p.getLeftHandSide(), nonTerminals, terminals);
                collect(p.getRightHandSide(), nonTerminals, terminals);
                for (Symbol s : p.getRightHandSide()) {
                    if (s.isNonTerminal()) {
                        if (!declared.contains(s)) {
                            throw new IllegalArgumentException("Non-terminal " + s + " in " + p +
                                                               " does not occur on any left-hand side");
                        }
                        used.add(s);
                    }
                }
            }

            final Symbol start = startSymbol != null ? startSymbol : firstLeftNonTerminal();
            if (!start.isNonTerminal()) {
                throw new IllegalArgumentException("The start symbol " + start + " is not a non-terminal");
            }
            if (!declared.contains(start)) {
                throw new IllegalArgumentException("The start symbol " + start + " has no production");
            }

            final List<String> warnings = new ArrayList<>();
            for (Symbol nt : declared) {
                if (!nt.equals(start) && !used.contains(nt)) {
                    warnings.add("Non-terminal " + nt + " is never used on a right-hand side");
                }
            }

            for (Map.Entry<Word<Symbol>, List<Production>> e : byLeft.entrySet()) {
                e.setValue(Collections.unmodifiableList(e.getValue()));
            }

            return new Grammar(start,
                               Collections.unmodifiableList(new ArrayList<>(productions)),
                               Collections.unmodifiableSet(nonTerminals),
                               Collections.unmodifiableSet(terminals),
                               Collections.unmodifiableMap(byLeft),
                               Collections.unmodifiableList(warnings));
        }

        private Symbol firstLeftNonTerminal() {
            for (Symbol s : productions.iterator().next().getLeftHandSide()) {
                if (s.isNonTerminal()) {
                    return s;
                }
            }
            throw new IllegalStateException("Production without non-terminal on the left");
        }

        private static void collect(Word<Symbol> word, Set<Symbol> nonTerminals, Set<Symbol> terminals) {
            for (Symbol s : word) {
                if (s.isNonTerminal()) {
                    nonTerminals.add(s);
                } else {
                    terminals.add(s);
                }
            }
        }
    }
}
