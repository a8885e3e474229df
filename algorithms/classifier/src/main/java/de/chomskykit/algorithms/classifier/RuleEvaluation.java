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

import java.util.Objects;

import de.chomskykit.api.ChomskyType;
import de.chomskykit.datastructure.grammar.Production;

/**
 * The outcome of checking one production against the invariant of one Chomsky type.
 */
public final class RuleEvaluation {

    private final ChomskyType checkedType;
    private final Production production;
    private final boolean passed;
    private final String rule;

    public RuleEvaluation(ChomskyType checkedType, Production production, boolean passed, String rule) {
        this.checkedType = checkedType;
        this.production = production;
        this.passed = passed;
        this.rule = rule;
    }

    public ChomskyType getCheckedType() {
        return checkedType;
    }

    public Production getProduction() {
        return production;
    }

    public boolean isPassed() {
        return passed;
    }

    /**
     * @return the rule that was satisfied, or the reason for the failure
     */
    public String getRule() {
        return rule;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof RuleEvaluation)) {
            return false;
        }
        RuleEvaluation other = (RuleEvaluation) obj;
        return checkedType == other.checkedType && production.equals(other.production) && passed == other.passed &&
               rule.equals(other.rule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkedType, production, passed, rule);
    }

    @Override
    public String toString() {
        return "[Type " + checkedType.getLevel() + "] " + production + ": " + (passed ? "passed, " : "failed, ") + rule;
    }
}
