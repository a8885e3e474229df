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
package de.chomskykit.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import de.chomskykit.algorithms.analyzer.AnalysisResult;
import de.chomskykit.algorithms.analyzer.AutomatonAnalyzer;
import de.chomskykit.algorithms.analyzer.SimulationResult;
import de.chomskykit.algorithms.classifier.ChomskyClassifier;
import de.chomskykit.algorithms.classifier.ClassificationResult;
import de.chomskykit.algorithms.comparator.AutomatonComparator;
import de.chomskykit.algorithms.comparator.AutomatonComparisonResult;
import de.chomskykit.algorithms.comparator.ComparisonResult;
import de.chomskykit.algorithms.comparator.GrammarComparator;
import de.chomskykit.algorithms.conversion.ConversionCache;
import de.chomskykit.algorithms.conversion.ConversionPipeline;
import de.chomskykit.algorithms.conversion.ConversionTrace;
import de.chomskykit.algorithms.generator.Difficulty;
import de.chomskykit.algorithms.generator.ExampleGenerator;
import de.chomskykit.api.ChomskyType;
import de.chomskykit.api.exception.IncomparableGrammarsException;
import de.chomskykit.api.exception.InvalidRegexException;
import de.chomskykit.api.exception.InvalidSymbolException;
import de.chomskykit.api.exception.MalformedAutomatonException;
import de.chomskykit.api.exception.MalformedGrammarException;
import de.chomskykit.api.exception.RejectedException;
import de.chomskykit.api.exception.StepLimitExceededException;
import de.chomskykit.api.logging.AnalysisLogger;
import de.chomskykit.datastructure.automaton.Automaton;
import de.chomskykit.datastructure.automaton.AutomatonParser;
import de.chomskykit.datastructure.grammar.Grammar;
import de.chomskykit.datastructure.grammar.GrammarParser;
import de.chomskykit.util.EngineLimits;
import net.automatalib.words.Word;

/**
 * Entry point to all analyses of grammars and automata.
 * <p>
 * The engine holds no mutable state. Every call works on its arguments only and may run concurrently with other
 * calls. Unbounded searches are cut off by the {@link EngineLimits} the engine was created with.
 */
public class FormalLanguageEngine {

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(FormalLanguageEngine.class);

    private final EngineLimits limits;
    private final ChomskyClassifier classifier;
    private final AutomatonAnalyzer analyzer;
    private final ConversionPipeline pipeline;
    private final GrammarComparator comparator;
    private final AutomatonComparator automatonComparator;

    /**
     * Creates an engine with the limits configured through {@link de.chomskykit.setting.ChomskyKitSettings}.
     */
    public FormalLanguageEngine() {
        this(EngineLimits.fromSettings());
    }

    public FormalLanguageEngine(EngineLimits limits) {
        this.limits = limits;
        this.classifier = new ChomskyClassifier();
        this.analyzer = new AutomatonAnalyzer(limits);
        this.pipeline = new ConversionPipeline(limits);
        this.comparator = new GrammarComparator(limits);
        this.automatonComparator = new AutomatonComparator(limits);
    }

    public EngineLimits getLimits() {
        return limits;
    }

    public Grammar parseGrammar(String text) throws MalformedGrammarException {
        LOGGER.logPhase("Parsing grammar");
        return GrammarParser.parse(text);
    }

    public ClassificationResult classifyGrammar(Grammar grammar) {
        LOGGER.logPhase("Classifying grammar with start symbol " + grammar.getStartSymbol());
        return classifier.classify(grammar);
    }

    public Automaton parseAutomaton(String description) throws MalformedAutomatonException {
        LOGGER.logPhase("Parsing automaton");
        return AutomatonParser.parse(description);
    }

    public AnalysisResult analyzeAutomaton(Automaton automaton) {
        return analyzer.analyze(automaton);
    }

    public SimulationResult simulate(Automaton automaton, Word<String> input) {
        LOGGER.logPhase("Simulating " + automaton.getVariant() + " on " + input.length() + " symbols");
        return analyzer.simulate(automaton, input);
    }

    /**
     * Simulates the automaton on a textual input, see {@link #toWord(String)} for how the text is split into
     * symbols.
     */
    public SimulationResult simulate(Automaton automaton, String input) {
        return simulate(automaton, toWord(input));
    }

    /**
     * @throws InvalidSymbolException
     *         if the input contains a symbol outside the input alphabet
     * @throws RejectedException
     *         if a DFA has no transition for the next symbol
     * @throws StepLimitExceededException
     *         if a PDA or Turing machine uses up its step budget
     */
    public boolean accepts(Automaton automaton, String input)
            throws InvalidSymbolException, RejectedException, StepLimitExceededException {
        LOGGER.logPhase("Deciding acceptance for " + automaton.getVariant());
        return analyzer.accepts(automaton, toWord(input));
    }

    public ConversionTrace convertRegexToGrammar(String regex)
            throws InvalidRegexException, StepLimitExceededException {
        return pipeline.convert(regex);
    }

    /**
     * @return a new cache over this engine's conversion pipeline, owned by the caller
     */
    public ConversionCache newConversionCache() {
        return new ConversionCache(pipeline);
    }

    public ComparisonResult compareGrammars(Grammar first, Grammar second)
            throws IncomparableGrammarsException, StepLimitExceededException {
        return comparator.compare(first, second);
    }

    public ComparisonResult compareGrammars(Grammar first, Grammar second, int depth)
            throws IncomparableGrammarsException, StepLimitExceededException {
        return comparator.compare(first, second, depth);
    }

    /**
     * Compares the structure of two automata and, for finite automata, decides whether they accept the same language.
     *
     * @throws StepLimitExceededException
     *         if determinizing one of the automata needs more states than allowed by the limits
     */
    public AutomatonComparisonResult compareAutomata(Automaton first, Automaton second)
            throws StepLimitExceededException {
        LOGGER.logPhase("Comparing " + first.getVariant() + " with " + second.getVariant());
        return automatonComparator.compare(first, second);
    }

    public Grammar generateExample(ChomskyType type, Difficulty difficulty) {
        return generateExample(type, difficulty, new Random());
    }

    public Grammar generateExample(ChomskyType type, Difficulty difficulty, Random random) {
        LOGGER.logPhase("Generating a " + difficulty + " example of " + type);
        return new ExampleGenerator(random).generateExample(type, difficulty);
    }

    /**
     * @param level
     *         the Chomsky type, 0 to 3
     */
    public Grammar generateExample(int level, Difficulty difficulty) {
        return generateExample(ChomskyType.ofLevel(level), difficulty);
    }

    /**
     * Splits an input text into symbols. Text containing whitespace is split at whitespace, so that multi-character
     * symbols can be written as {@code "ab cd"}; other text is split into single characters. The empty text and
     * {@code ε} denote the empty word.
     */
    public static Word<String> toWord(String input) {
        final String trimmed = input.trim();
        if (trimmed.isEmpty() || "ε".equals(trimmed)) {
            return Word.epsilon();
        }
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            return Word.fromSymbols(trimmed.split("\\s+"));
        }
        final List<String> symbols = new ArrayList<>();
        trimmed.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return Word.fromList(symbols);
    }
}
