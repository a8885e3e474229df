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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract syntax tree of a regular expression.
 * <p>
 * {@link #toString()} renders a node in the syntax accepted by {@link RegexParser}, with the minimal number of
 * parentheses.
 */
public abstract class RegexNode {

    private static final String METACHARACTERS = "|*+?()[]\\{}^$.ε ";

    public abstract <R> R accept(RegexVisitor<R> visitor);

    /**
     * @return the binding strength used for parenthesizing: alternation &lt; concatenation &lt; postfix operators
     * &lt; atoms
     */
    abstract int precedence();

    /**
     * @return the literal symbols of this expression in the order of their first occurrence
     */
    public Set<String> getSymbols() {
        final Set<String> symbols = new LinkedHashSet<>();
        collectSymbols(symbols);
        return symbols;
    }

    abstract void collectSymbols(Set<String> symbols);

    static String parenthesize(RegexNode child, int precedence) {
        return child.precedence() < precedence ? "(" + child + ')' : child.toString();
    }

    public static final class Literal extends RegexNode {

        private final String symbol;

        public Literal(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void collectSymbols(Set<String> symbols) {
            symbols.add(symbol);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Literal && symbol.equals(((Literal) obj).symbol);
        }

        @Override
        public int hashCode() {
            return symbol.hashCode();
        }

        @Override
        public String toString() {
            return METACHARACTERS.contains(symbol) ? "\\" + symbol : symbol;
        }
    }

    public static final class Epsilon extends RegexNode {

        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitEpsilon(this);
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void collectSymbols(Set<String> symbols) {
            // no symbols
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Epsilon;
        }

        @Override
        public int hashCode() {
            return Epsilon.class.hashCode();
        }

        @Override
        public String toString() {
            return "ε";
        }
    }

    /**
     * Base class of the n-ary nodes.
     */
    abstract static class Composite extends RegexNode {

        private final List<RegexNode> children;

        Composite(List<RegexNode> children) {
            if (children.size() < 2) {
                throw new IllegalArgumentException(getClass().getSimpleName() + " needs at least two operands");
            }
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        public List<RegexNode> getChildren() {
            return children;
        }

        @Override
        void collectSymbols(Set<String> symbols) {
            for (RegexNode child : children) {
                child.collectSymbols(symbols);
            }
        }

        String join(String separator) {
            final StringBuilder sb = new StringBuilder();
            for (RegexNode child : children) {
                if (sb.length() > 0) {
                    sb.append(separator);
                }
                sb.append(parenthesize(child, precedence()));
            }
            return sb.toString();
        }

        @Override
        public boolean equals(Object obj) {
            return obj != null && obj.getClass() == getClass() && children.equals(((Composite) obj).children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), children);
        }
    }

    public static final class Concatenation extends Composite {

        public Concatenation(List<RegexNode> children) {
            super(children);
        }

        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitConcatenation(this);
        }

        @Override
        int precedence() {
            return 1;
        }

        @Override
        public String toString() {
            return join("");
        }
    }

    public static final class Alternation extends Composite {

        public Alternation(List<RegexNode> children) {
            super(children);
        }

        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitAlternation(this);
        }

        @Override
        int precedence() {
            return 0;
        }

        @Override
        public String toString() {
            return join("|");
        }
    }

    /**
     * Base class of the postfix operators.
     */
    abstract static class Unary extends RegexNode {

        private final RegexNode operand;

        Unary(RegexNode operand) {
            this.operand = operand;
        }

        public RegexNode getOperand() {
            return operand;
        }

        @Override
        int precedence() {
            return 2;
        }

        @Override
        void collectSymbols(Set<String> symbols) {
            operand.collectSymbols(symbols);
        }

        String postfix(char operator) {
            return parenthesize(operand, precedence()) + operator;
        }

        @Override
        public boolean equals(Object obj) {
            return obj != null && obj.getClass() == getClass() && operand.equals(((Unary) obj).operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), operand);
        }
    }

    /** Zero or more repetitions. */
    public static final class Star extends Unary {

        public Star(RegexNode operand) {
            super(operand);
        }

        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitStar(this);
        }

        @Override
        public String toString() {
            return postfix('*');
        }
    }

    /** One or more repetitions. */
    public static final class Plus extends Unary {

        public Plus(RegexNode operand) {
            super(operand);
        }

        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitPlus(this);
        }

        @Override
        public String toString() {
            return postfix('+');
        }
    }

    /** Zero or one occurrence. */
    public static final class Optional extends Unary {

        public Optional(RegexNode operand) {
            super(operand);
        }

        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitOptional(this);
        }

        @Override
        public String toString() {
            return postfix('?');
        }
    }
}
