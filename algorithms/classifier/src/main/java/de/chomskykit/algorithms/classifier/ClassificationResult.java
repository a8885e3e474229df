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
import java.util.Locale;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.datastructure.grammar.Production;

/**
 * The Chomsky type of a grammar together with the evaluation trace that justifies it.
 * <p>
 * The trace holds the evaluations of every level that was checked, from Type 3 down to the resulting type. The
 * boundary cases are the productions that failed the check of the type immediately more restrictive than the result,
 * e.g. the productions that keep a context-free grammar from being regular.
 */
public final class ClassificationResult {

    private final ChomskyType type;
    private final List<RuleEvaluation> evaluations;
    private final LinearDirection direction;
    private final List<Production> boundaryCases;

    public ClassificationResult(ChomskyType type,
                                List<RuleEvaluation> evaluations,
                                LinearDirection direction,
                                List<Production> boundaryCases) {
        this.type = type;
        this.evaluations = Collections.unmodifiableList(new ArrayList<>(evaluations));
        this.direction = direction;
        this.boundaryCases = Collections.unmodifiableList(new ArrayList<>(boundaryCases));
    }

    public ChomskyType getType() {
        return type;
    }

    public List<RuleEvaluation> getEvaluations() {
        return evaluations;
    }

    public List<RuleEvaluation> getEvaluations(ChomskyType checkedType) {
        final List<RuleEvaluation> result = new ArrayList<>();
        for (RuleEvaluation e : evaluations) {
            if (e.getCheckedType() == checkedType) {
                result.add(e);
            }
        }
        return result;
    }

    public List<RuleEvaluation> getViolations(ChomskyType checkedType) {
        final List<RuleEvaluation> result = new ArrayList<>();
        for (RuleEvaluation e : getEvaluations(checkedType)) {
            if (!e.isPassed()) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * @return the direction of a regular grammar, {@link LinearDirection#NONE} for all other types
     */
    public LinearDirection getDirection() {
        return direction;
    }

    public List<Production> getBoundaryCases() {
        return boundaryCases;
    }

    /**
     * @return one line per checked level followed by its rule evaluations
     */
    public List<String> getJustification() {
        final List<String> lines = new ArrayList<>();
        ChomskyType current = null;
        for (RuleEvaluation e : evaluations) {
            if (e.getCheckedType() != current) {
                current = e.getCheckedType();
                final boolean satisfied = getViolations(current).isEmpty();
                lines.add(current + ": " + (satisfied ? "satisfied" : "not satisfied"));
            }
            lines.add("  " + e.getProduction() + "  " + (e.isPassed() ? "✓ " : "✗ ") + e.getRule());
        }
        return lines;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(type);
        if (direction != LinearDirection.NONE) {
            sb.append(", ").append(direction.name().toLowerCase(Locale.ROOT)).append("-linear");
        }
        for (String line : getJustification()) {
            sb.append(System.lineSeparator()).append(line);
        }
        return sb.toString();
    }
}
