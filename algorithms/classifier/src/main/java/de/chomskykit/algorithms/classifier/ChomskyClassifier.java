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
package de.chomskykit.algorithms.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.logging.AnalysisLogger;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.Production;
import de.chomskykit.datastructure.grammar.Symbol;
import net.automatalib.words.Word;

/**
 * Assigns a grammar its position in the Chomsky hierarchy.
 * <p>
 * Levels are checked from the most restrictive one (Type 3) downwards and the first level whose invariant holds for
 * every production wins. Checking in this order keeps the classification monotonic: a grammar is never reported with a
 * weaker type than one of its structural checks justifies.
 */
public class ChomskyClassifier {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(ChomskyClassifier.class);

    public ClassificationResult classify(Grammar grammar) {
        final List<RuleEvaluation> trace = new ArrayList<>();
        List<Production> previousFailures = Collections.emptyList();

        for (ChomskyType type = ChomskyType.TYPE_3; type != null; type = type.weaker()) {
            LOGGER.logPhase("Checking " + type);
            final LevelCheck check = check(grammar, type);
            trace.addAll(check.evaluations);

            final List<Production> failures = new ArrayList<>();
            for (RuleEvaluation e : check.evaluations) {
                LOGGER.logEvaluation(e.toString());
                if (!e.isPassed()) {
                    failures.add(e.getProduction());
                }
            }

            if (failures.isEmpty()) {
                final LinearDirection direction = type == ChomskyType.TYPE_3 ? check.direction : LinearDirection.NONE;
                final ClassificationResult result =
                        new ClassificationResult(type, trace, direction, previousFailures);
                LOGGER.logPhase("Classified as " + type);
                return result;
            }
            previousFailures = failures;
        }

        throw new IllegalStateException("Type 0 holds for every grammar");
    }

    /**
     * Evaluates the invariant of a single level in isolation.
     * <p>
     * Note that an isolated check is stricter than hierarchy membership: a regular grammar with an epsilon production
     * for a non-start symbol fails the non-contracting check of Type 1. Use {@link #satisfies(Grammar, ChomskyType)}
     * for membership.
     */
    public List<RuleEvaluation> evaluate(Grammar grammar, ChomskyType type) {
        return check(grammar, type).evaluations;
    }

    /**
     * @return {@code true} iff the classification of the grammar is at least as restrictive as the given type
     */
    public boolean satisfies(Grammar grammar, ChomskyType type) {
        return classify(grammar).getType().isAtLeastAsRestrictiveAs(type);
    }

    private LevelCheck check(Grammar grammar, ChomskyType type) {
        switch (type) {
            case TYPE_3:
                return checkRegular(grammar);
            case TYPE_2:
                return checkContextFree(grammar);
            case TYPE_1:
                return checkContextSensitive(grammar);
            case TYPE_0:
            default:
                final List<RuleEvaluation> evaluations = new ArrayList<>(grammar.size());
                for (Production p : grammar.getProductions()) {
                    evaluations.add(pass(ChomskyType.TYPE_0, p, "unrestricted production α -> β"));
                }
                return new LevelCheck(evaluations, LinearDirection.NONE);
        }
    }

    private LevelCheck checkRegular(Grammar grammar) {
        final ChomskyType t = ChomskyType.TYPE_3;
        final List<RuleEvaluation> evaluations = new ArrayList<>(grammar.size());
        LinearDirection direction = LinearDirection.NONE;

        for (Production p : grammar.getProductions()) {
            if (!p.hasSingleNonTerminalLeft()) {
                evaluations.add(fail(t, p, "left-hand side is not a single non-terminal"));
                continue;
            }
            final Word<Symbol> rhs = p.getRightHandSide();
            if (rhs.isEmpty()) {
                evaluations.add(pass(t, p, "epsilon production (A -> ε)"));
            } else if (rhs.length() == 1 && rhs.firstSymbol().isTerminal()) {
                evaluations.add(pass(t, p, "terminal production (A -> a)"));
            } else if (rhs.length() == 1) {
                evaluations.add(fail(t, p, "unit production (A -> B) is not regular"));
            } else if (rhs.length() == 2 && rhs.getSymbol(0).isTerminal() && rhs.getSymbol(1).isNonTerminal()) {
                if (direction == LinearDirection.LEFT) {
                    evaluations.add(fail(t, p, "right-linear production in a left-linear grammar " +
                                               "(mixes left-linear and right-linear productions)"));
                } else {
                    direction = LinearDirection.RIGHT;
                    evaluations.add(pass(t, p, "right-linear (A -> aB)"));
                }
            } else if (rhs.length() == 2 && rhs.getSymbol(0).isNonTerminal() && rhs.getSymbol(1).isTerminal()) {
                if (direction == LinearDirection.RIGHT) {
                    evaluations.add(fail(t, p, "left-linear production in a right-linear grammar " +
                                               "(mixes left-linear and right-linear productions)"));
                } else {
                    direction = LinearDirection.LEFT;
                    evaluations.add(pass(t, p, "left-linear (A -> Ba)"));
                }
            } else {
                evaluations.add(fail(t, p, "right-hand side is not of the form ε, a, aB or Ba"));
            }
        }
        return new LevelCheck(evaluations, direction);
    }

    private LevelCheck checkContextFree(Grammar grammar) {
        final List<RuleEvaluation> evaluations = new ArrayList<>(grammar.size());
        for (Production p : grammar.getProductions()) {
            if (p.hasSingleNonTerminalLeft()) {
                evaluations.add(pass(ChomskyType.TYPE_2, p, "single non-terminal on the left (A -> γ)"));
            } else {
                evaluations.add(fail(ChomskyType.TYPE_2, p, "left-hand side is not a single non-terminal"));
            }
        }
        return new LevelCheck(evaluations, LinearDirection.NONE);
    }

    private LevelCheck checkContextSensitive(Grammar grammar) {
        final Symbol start = grammar.getStartSymbol();
        final boolean startOnRight = grammar.appearsOnRightHandSide(start);
        final List<RuleEvaluation> evaluations = new ArrayList<>(grammar.size());

        for (Production p : grammar.getProductions()) {
            final int lhs = p.getLeftHandSide().length();
            final int rhs = p.getRightHandSide().length();
            if (rhs >= lhs) {
                evaluations.add(pass(ChomskyType.TYPE_1, p, "non-contracting (|β| >= |α|)"));
            } else if (p.isEpsilon() && p.getLeftHandSide().equals(Word.fromLetter(start))) {
                if (startOnRight) {
                    evaluations.add(fail(ChomskyType.TYPE_1, p, "epsilon production of the start symbol, " +
                                                                "but " + start + " occurs on a right-hand side"));
                } else {
                    evaluations.add(pass(ChomskyType.TYPE_1, p, "epsilon production of the start symbol, " +
                                                                "which occurs on no right-hand side"));
                }
            } else {
                evaluations.add(fail(ChomskyType.TYPE_1, p, "contracting: " + lhs + " symbols rewritten to " + rhs));
            }
        }
        return new LevelCheck(evaluations, LinearDirection.NONE);
    }

    private static RuleEvaluation pass(ChomskyType type, Production p, String rule) {
        return new RuleEvaluation(type, p, true, rule);
    }

    private static RuleEvaluation fail(ChomskyType type, Production p, String rule) {
        return new RuleEvaluation(type, p, false, rule);
    }

    private static final class LevelCheck {

        private final List<RuleEvaluation> evaluations;
        private final LinearDirection direction;

        LevelCheck(List<RuleEvaluation> evaluations, LinearDirection direction) {
            this.evaluations = evaluations;
            this.direction = direction;
        }
    }
}
