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
package de.chomskykit.setting;

/**
 * The configuration keys understood by {@link ChomskyKitSettings}.
 */
public enum ChomskyKitProperty {

    /**
     * Maximum number of configurations a pushdown or Turing machine simulation may explore.
     */
    SIMULATION_MAX_STEPS("simulation.maxSteps"),

    /**
     * Length of the probe inputs used by the Turing machine boundedness heuristic.
     */
    TM_PROBE_LENGTH("tm.probeLength"),

    /**
     * Maximum number of states the subset construction may create.
     */
    CONVERSION_MAX_DFA_STATES("conversion.maxDfaStates"),

    /**
     * Default derivation depth of the grammar comparator.
     */
    COMPARATOR_MAX_DEPTH("comparator.maxDepth"),

    /**
     * Maximum length of the sentential forms kept by the grammar comparator.
     */
    COMPARATOR_MAX_LENGTH("comparator.maxLength"),

    /**
     * Maximum number of sentential forms the grammar comparator may explore per grammar.
     */
    COMPARATOR_MAX_FORMS("comparator.maxForms");

    private final String key;

    ChomskyKitProperty(String key) {
        this.key = "chomskykit." + key;
    }

    public String getPropertyKey() {
        return this.key;
    }

    @Override
    public String toString() {
        return key;
    }
}
