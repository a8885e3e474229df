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

import java.util.Collections;
import java.util.List;

import de.chomskykit.datastructure.automaton.AutomatonVariant;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of comparing two automata: their structure and, for finite automata, their languages.
 */
public final class AutomatonComparisonResult {

    private final AutomatonVariant firstVariant;
    private final AutomatonVariant secondVariant;
    private final EquivalenceVerdict verdict;
    private final @Nullable Word<String> separatingWord;
    private final boolean acceptedByFirst;
    private final List<String> similarities;
    private final List<String> differences;

    AutomatonComparisonResult(AutomatonVariant firstVariant,
                              AutomatonVariant secondVariant,
                              EquivalenceVerdict verdict,
                              @Nullable Word<String> separatingWord,
                              boolean acceptedByFirst,
                              List<String> similarities,
                              List<String> differences) {
        this.firstVariant = firstVariant;
        this.secondVariant = secondVariant;
        this.verdict = verdict;
        this.separatingWord = separatingWord;
        this.acceptedByFirst = acceptedByFirst;
        this.similarities = Collections.unmodifiableList(similarities);
        this.differences = Collections.unmodifiableList(differences);
    }

    public AutomatonVariant getFirstVariant() {
        return firstVariant;
    }

    public AutomatonVariant getSecondVariant() {
        return secondVariant;
    }

    public boolean isSameVariant() {
        return firstVariant == secondVariant;
    }

    public EquivalenceVerdict getVerdict() {
        return verdict;
    }

    /**
     * @return a word accepted by exactly one of the automata, or {@code null} unless the verdict is
     * {@link EquivalenceVerdict#DIFFERENT}
     */
    public @Nullable Word<String> getSeparatingWord() {
        return separatingWord;
    }

    /**
     * @return whether the {@link #getSeparatingWord() separating word} is accepted by the first automaton (and thus
     * rejected by the second)
     */
    public boolean isSeparatingWordAcceptedByFirst() {
        return acceptedByFirst;
    }

    public List<String> getSimilarities() {
        return similarities;
    }

    public List<String> getDifferences() {
        return differences;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(firstVariant).append(" vs ").append(secondVariant).append(": ").append(verdict);
        for (String s : similarities) {
            sb.append(System.lineSeparator()).append("  = ").append(s);
        }
        for (String d : differences) {
            sb.append(System.lineSeparator()).append("  ≠ ").append(d);
        }
        return sb.toString();
    }
}
