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
import java.util.Arrays;
import java.util.List;

import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonVariant;
import de.chomskykit.datastructure.automaton.Transition;

/**
 * Builds an epsilon-NFA from a regular expression using Thompson's construction.
 * <p>
 * Every sub-expression yields a fragment with one entry and one exit state. States are named {@code q0, q1, ...} in
 * creation order, so the same expression always yields the same automaton. The resulting NFA has exactly one
 * initial and one accepting state.
 */
public final class ThompsonConstruction {

    private ThompsonConstruction() {}

    public static Automaton construct(RegexNode regex) {
        final FragmentBuilder fragments = new FragmentBuilder();
        final Fragment fragment = regex.accept(fragments);

        final Automaton.Builder builder = Automaton.builder(AutomatonVariant.NFA).withInputAlphabet(regex.getSymbols());
        for (int i = 0; i < fragments.counter; i++) {
            final String id = "q" + i;
            builder.addState(id, id.equals(fragment.start), id.equals(fragment.end));
        }
        fragments.transitions.forEach(builder::addTransition);
        return builder.build();
    }

    private static final class FragmentBuilder implements RegexVisitor<Fragment> {

        private final List<Transition> transitions = new ArrayList<>();
        private int counter;

        private String newState() {
            return "q" + counter++;
        }

        @Override
        public Fragment visitLiteral(RegexNode.Literal literal) {
            final String start = newState();
            final String end = newState();
            transitions.add(Transition.of(start, literal.getSymbol(), end));
            return new Fragment(start, end);
        }

        @Override
        public Fragment visitEpsilon(RegexNode.Epsilon epsilon) {
            final String start = newState();
            final String end = newState();
            transitions.add(Transition.epsilon(start, end));
            return new Fragment(start, end);
        }

        @Override
        public Fragment visitConcatenation(RegexNode.Concatenation concatenation) {
            final List<RegexNode> children = concatenation.getChildren();
            Fragment result = children.get(0).accept(this);
            for (RegexNode child : children.subList(1, children.size())) {
                final Fragment next = child.accept(this);
                transitions.add(Transition.epsilon(result.end, next.start));
                result = new Fragment(result.start, next.end);
            }
            return result;
        }

        @Override
        public Fragment visitAlternation(RegexNode.Alternation alternation) {
            final String start = newState();
            final List<Fragment> branches = new ArrayList<>();
            for (RegexNode child : alternation.getChildren()) {
                branches.add(child.accept(this));
            }
            final String end = newState();
            for (Fragment branch : branches) {
                transitions.add(Transition.epsilon(start, branch.start));
                transitions.add(Transition.epsilon(branch.end, end));
            }
            return new Fragment(start, end);
        }

        @Override
        public Fragment visitStar(RegexNode.Star star) {
            final String start = newState();
            final Fragment inner = star.getOperand().accept(this);
            final String end = newState();
            transitions.add(Transition.epsilon(start, inner.start));
            transitions.add(Transition.epsilon(start, end));
            transitions.add(Transition.epsilon(inner.end, inner.start));
            transitions.add(Transition.epsilon(inner.end, end));
            return new Fragment(start, end);
        }

        @Override
        public Fragment visitPlus(RegexNode.Plus plus) {
            final RegexNode operand = plus.getOperand();
            return new RegexNode.Concatenation(Arrays.asList(operand, new RegexNode.Star(operand))).accept(this);
        }

        @Override
        public Fragment visitOptional(RegexNode.Optional optional) {
            return new RegexNode.Alternation(Arrays.asList(optional.getOperand(), new RegexNode.Epsilon()))
                    .accept(this);
        }
    }

    private static final class Fragment {

        private final String start;
        private final String end;

        Fragment(String start, String end) {
            this.start = start;
            this.end = end;
        }
    }
}
