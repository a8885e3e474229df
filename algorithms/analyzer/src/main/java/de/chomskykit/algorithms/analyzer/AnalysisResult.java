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
package de.chomskykit.algorithms.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the analyzer determines about an automaton without running it on a particular input.
 */
public final class AnalysisResult {

    private final ComputationalClass computationalClass;
    private final LanguageClass languageClass;
    private final Set<String> reachableStates;
    private final Set<String> coReachableStates;
    private final Set<String> uselessStates;
    private final List<String> missingTransitions;
    private final List<String> warnings;

    public AnalysisResult(ComputationalClass computationalClass,
                          LanguageClass languageClass,
                          Set<String> reachableStates,
                          Set<String> coReachableStates,
                          Set<String> uselessStates,
                          List<String> missingTransitions,
                          List<String> warnings) {
        this.computationalClass = computationalClass;
        this.languageClass = languageClass;
        this.reachableStates = Collections.unmodifiableSet(new LinkedHashSet<>(reachableStates));
        this.coReachableStates = Collections.unmodifiableSet(new LinkedHashSet<>(coReachableStates));
        this.uselessStates = Collections.unmodifiableSet(new LinkedHashSet<>(uselessStates));
        this.missingTransitions = Collections.unmodifiableList(new ArrayList<>(missingTransitions));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public ComputationalClass getComputationalClass() {
        return computationalClass;
    }

    public LanguageClass getLanguageClass() {
        return languageClass;
    }

    /**
     * @return the states reachable from an initial state
     */
    public Set<String> getReachableStates() {
        return reachableStates;
    }

    /**
     * @return the states from which an accepting state is reachable
     */
    public Set<String> getCoReachableStates() {
        return coReachableStates;
    }

    /**
     * @return the states that are not both reachable and co-reachable
     */
    public Set<String> getUselessStates() {
        return uselessStates;
    }

    /**
     * @return the (state, symbol) pairs of a finite automaton without transition, rendered as {@code δ(q, a)}
     */
    public List<String> getMissingTransitions() {
        return missingTransitions;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return computationalClass + ", " + languageClass;
    }
}
