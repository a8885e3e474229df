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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;

import de.chomskykit.algorithms.classifier.ChomskyClassifier;
import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.IncomparableGrammarsException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.api.logging.AnalysisLogger;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.Symbol;
import de.chomskykit.util.EngineLimits;

/**
 * Compares two grammars by the strings they derive within a bounded number of steps, and by their structure.
 * <p>
 * Language equivalence of grammars is undecidable in general, so the comparison can only refute equivalence. A
 * result without differences is reported as evidence for equivalence together with the bounds it holds for.
 */
public class GrammarComparator {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(GrammarComparator.class);
    private static final int SAMPLE_SIZE = 5;

    private final EngineLimits limits;
    private final ChomskyClassifier classifier = new ChomskyClassifier();

    public GrammarComparator(EngineLimits limits) {
        this.limits = limits;
    }

    /**
     * Compares with the configured derivation depth.
     *
     * @see #compare(Grammar, Grammar, int)
     */
    public ComparisonResult compare(Grammar first, Grammar second)
            throws IncomparableGrammarsException, StepLimitExceededException {
        return compare(first, second, limits.getComparatorDepth());
    }

    /**
     * @throws IncomparableGrammarsException
     *         if one of the grammars derives no terminal string within the bounds
     * @throws StepLimitExceededException
     *         if the search visits more sentential forms than allowed by the limits
     */
    public ComparisonResult compare(Grammar first, Grammar second, int depth)
            throws IncomparableGrammarsException, StepLimitExceededException {
        final BoundedDerivation derivation =
                new BoundedDerivation(depth, limits.getComparatorMaxLength(), limits.getComparatorMaxForms());

        LOGGER.logPhase("Deriving strings of the first grammar up to depth " + depth);
        final Set<String> firstStrings = derivation.generate(first);
        LOGGER.logPhase("Deriving strings of the second grammar up to depth " + depth);
        final Set<String> secondStrings = derivation.generate(second);
        LOGGER.debug("Derived {} and {} strings", firstStrings.size(), secondStrings.size());

        if (firstStrings.isEmpty() || secondStrings.isEmpty()) {
            throw new IncomparableGrammarsException(firstStrings.isEmpty(),
                                                    secondStrings.isEmpty(),
                                                    depth,
                                                    limits.getComparatorMaxLength());
        }

        final Set<String> inBoth = new TreeSet<>(BoundedDerivation.SHORTLEX);
        final Set<String> onlyInFirst = new TreeSet<>(BoundedDerivation.SHORTLEX);
        final Set<String> onlyInSecond = new TreeSet<>(BoundedDerivation.SHORTLEX);
        for (String s : firstStrings) {
            (secondStrings.contains(s) ? inBoth : onlyInFirst).add(s);
        }
        for (String s : secondStrings) {
            if (!firstStrings.contains(s)) {
                onlyInSecond.add(s);
            }
        }

        final List<String> similarities = new ArrayList<>();
        final List<String> differences = new ArrayList<>();

        final ChomskyType firstType = classifier.classify(first).getType();
        final ChomskyType secondType = classifier.classify(second).getType();
        if (firstType == secondType) {
            similarities.add("Both grammars are " + firstType);
        } else {
            differences.add("Different types: " + firstType + " vs " + secondType);
        }

        final Set<String> firstTerminals = texts(first.getTerminals());
        final Set<String> secondTerminals = texts(second.getTerminals());
        final Set<String> terminalsOnlyInFirst = minus(firstTerminals, secondTerminals);
        final Set<String> terminalsOnlyInSecond = minus(secondTerminals, firstTerminals);
        if (terminalsOnlyInFirst.isEmpty() && terminalsOnlyInSecond.isEmpty()) {
            similarities.add("Same terminals: " + join(firstTerminals));
        } else {
            if (!terminalsOnlyInFirst.isEmpty()) {
                differences.add("Terminals only in the first grammar: " + join(terminalsOnlyInFirst));
            }
            if (!terminalsOnlyInSecond.isEmpty()) {
                differences.add("Terminals only in the second grammar: " + join(terminalsOnlyInSecond));
            }
        }

        if (first.size() == second.size()) {
            similarities.add("Same number of productions: " + first.size());
        } else {
            differences.add("Different number of productions: " + first.size() + " vs " + second.size());
        }

        if (onlyInFirst.isEmpty() && onlyInSecond.isEmpty()) {
            similarities.add("All " + inBoth.size() + " derived strings are common");
        } else {
            if (!onlyInFirst.isEmpty()) {
                differences.add("Strings only derived by the first grammar: " + sample(onlyInFirst));
            }
            if (!onlyInSecond.isEmpty()) {
                differences.add("Strings only derived by the second grammar: " + sample(onlyInSecond));
            }
        }

        final ComparisonResult result = new ComparisonResult(onlyInFirst,
                                                             onlyInSecond,
                                                             inBoth,
                                                             firstType,
                                                             secondType,
                                                             terminalsOnlyInFirst,
                                                             terminalsOnlyInSecond,
                                                             similarities,
                                                             differences,
                                                             depth,
                                                             limits.getComparatorMaxLength());
        LOGGER.logModel(result);
        return result;
    }

    private static Set<String> texts(Set<Symbol> symbols) {
        final Set<String> result = new LinkedHashSet<>();
        for (Symbol s : symbols) {
            result.add(s.getText());
        }
        return result;
    }

    private static Set<String> minus(Set<String> left, Set<String> right) {
        final Set<String> result = new LinkedHashSet<>(left);
        result.removeAll(right);
        return result;
    }

    private static String join(Set<String> elements) {
        final StringJoiner joiner = new StringJoiner(", ", "{", "}");
        elements.forEach(joiner::add);
        return joiner.toString();
    }

    private static String sample(Set<String> strings) {
        final StringJoiner joiner = new StringJoiner(", ", "[", strings.size() > SAMPLE_SIZE ? ", ...]" : "]");
        final Iterator<String> it = strings.iterator();
        for (int i = 0; i < SAMPLE_SIZE && it.hasNext(); i++) {
            final String s = it.next();
            joiner.add(s.isEmpty() ? "ε" : s);
        }
        return joiner.toString();
    }
}
