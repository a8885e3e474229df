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
package de.chomskykit.algorithms.comparator;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import de.chomskykit.api.ChomskyType;

/**
 * Outcome of a bounded comparison of two grammars.
 * <p>
 * The string sets only cover derivations within {@link #getDepth()} steps and sentential forms of at most
 * {@link #getMaxLength()} symbols. The empty string is represented by {@code ""}.
 */
public final class ComparisonResult {

    private final Set<String> onlyInFirst;
    private final Set<String> onlyInSecond;
    private final Set<String> inBoth;
    private final ChomskyType firstType;
    private final ChomskyType secondType;
    private final Set<String> terminalsOnlyInFirst;
    private final Set<String> terminalsOnlyInSecond;
    private final List<String> similarities;
    private final List<String> differences;
    private final int depth;
    private final int maxLength;

    ComparisonResult(Set<String> onlyInFirst,
                     Set<String> onlyInSecond,
                     Set<String> inBoth,
                     ChomskyType firstType,
                     ChomskyType secondType,
                     Set<String> terminalsOnlyInFirst,
                     Set<String> terminalsOnlyInSecond,
                     List<String> similarities,
                     List<String> differences,
                     int depth,
                     int maxLength) {
        this.onlyInFirst = Collections.unmodifiableSet(onlyInFirst);
        this.onlyInSecond = Collections.unmodifiableSet(onlyInSecond);
        this.inBoth = Collections.unmodifiableSet(inBoth);
        this.firstType = firstType;
        this.secondType = secondType;
        this.terminalsOnlyInFirst = Collections.unmodifiableSet(terminalsOnlyInFirst);
        this.terminalsOnlyInSecond = Collections.unmodifiableSet(terminalsOnlyInSecond);
        this.similarities = Collections.unmodifiableList(similarities);
        this.differences = Collections.unmodifiableList(differences);
        this.depth = depth;
        this.maxLength = maxLength;
    }

    /**
     * @return strings derived by the first grammar only, in shortlex order
     */
    public Set<String> getOnlyInFirst() {
        return onlyInFirst;
    }

    /**
     * @return strings derived by the second grammar only, in shortlex order
     */
    public Set<String> getOnlyInSecond() {
        return onlyInSecond;
    }

    /**
     * @return strings derived by both grammars, in shortlex order
     */
    public Set<String> getInBoth() {
        return inBoth;
    }

    /**
     * @return the Jaccard index of the two string sets, between 0 and 1
     */
    public double getSimilarity() {
        final int union = onlyInFirst.size() + onlyInSecond.size() + inBoth.size();
        return (double) inBoth.size() / union;
    }

    /**
     * Whether no difference was found within the bounds. This is evidence, not proof, of equivalence.
     */
    public boolean isLikelyEquivalent() {
        return onlyInFirst.isEmpty() && onlyInSecond.isEmpty();
    }

    public String getDisclaimer() {
        return "Agreement on derivations of up to " + depth + " steps and " + maxLength +
               " symbols is evidence, not proof, that both grammars generate the same language.";
    }

    public ChomskyType getFirstType() {
        return firstType;
    }

    public ChomskyType getSecondType() {
        return secondType;
    }

    public boolean isSameType() {
        return firstType == secondType;
    }

    public Set<String> getTerminalsOnlyInFirst() {
        return terminalsOnlyInFirst;
    }

    public Set<String> getTerminalsOnlyInSecond() {
        return terminalsOnlyInSecond;
    }

    public List<String> getSimilarities() {
        return similarities;
    }

    public List<String> getDifferences() {
        return differences;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxLength() {
        return maxLength;
    }

    @Override
    public String toString() {
        final String nl = System.lineSeparator();
        final StringBuilder sb = new StringBuilder();
        sb.append(String.format("Similarity: %.0f%% (%d common, %d only in first, %d only in second)",
                                getSimilarity() * 100,
                                inBoth.size(),
                                onlyInFirst.size(),
                                onlyInSecond.size())).append(nl);
        for (String s : similarities) {
            sb.append("  = ").append(s).append(nl);
        }
        for (String d : differences) {
            sb.append("  ≠ ").append(d).append(nl);
        }
        return sb.append(getDisclaimer()).toString();
    }
}
