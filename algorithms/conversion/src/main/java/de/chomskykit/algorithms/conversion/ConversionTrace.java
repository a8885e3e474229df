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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.grammar.Grammar;

/**
 * The result of {@link ConversionPipeline#convert(String)}: one {@link TraceEntry} per {@link Stage}, in stage
 * order.
 */
public final class ConversionTrace {

    private final String source;
    private final Map<Stage, TraceEntry> entries = new EnumMap<>(Stage.class);
    private final Map<String, List<String>> subsets;

    ConversionTrace(String source, List<TraceEntry> entries, Map<String, List<String>> subsets) {
        this.source = source;
        for (TraceEntry e : entries) {
            this.entries.put(e.getStage(), e);
        }
        if (this.entries.size() != Stage.values().length) {
            throw new IllegalArgumentException("A conversion trace needs one entry per stage, got " + entries);
        }
        this.subsets = subsets;
    }

    /**
     * @return the regular expression as given by the caller
     */
    public String getSource() {
        return source;
    }

    public List<TraceEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    public TraceEntry getEntry(Stage stage) {
        return entries.get(stage);
    }

    public RegexNode getRegex() {
        return (RegexNode) entries.get(Stage.REGEX).getModel();
    }

    public Automaton getNfa() {
        return (Automaton) entries.get(Stage.NFA).getModel();
    }

    /**
     * @return the DFA as produced by subset construction, before minimization
     */
    public Automaton getSubsetDfa() {
        return (Automaton) entries.get(Stage.SUBSET_DFA).getModel();
    }

    /**
     * @return for each state of {@link #getSubsetDfa()}, the NFA states it represents
     */
    public Map<String, List<String>> getSubsets() {
        return Collections.unmodifiableMap(subsets);
    }

    /**
     * @return the minimal DFA
     */
    public Automaton getDfa() {
        return (Automaton) entries.get(Stage.DFA).getModel();
    }

    public Grammar getGrammar() {
        return (Grammar) entries.get(Stage.GRAMMAR).getModel();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (TraceEntry e : entries.values()) {
            sb.append(e).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
