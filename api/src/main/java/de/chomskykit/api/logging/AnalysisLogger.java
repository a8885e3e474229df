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
package de.chomskykit.api.logging;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Thin wrapper around an SLF4J {@link Logger} that offers the logging categories of the analysis engine.
 */
public final class AnalysisLogger {

    private static final Map<String, AnalysisLogger> CACHE = new ConcurrentHashMap<>();

    private static final Marker PHASE = MarkerFactory.getMarker(Category.PHASE);
    private static final Marker MODEL = MarkerFactory.getMarker(Category.MODEL);
    private static final Marker EVALUATION = MarkerFactory.getMarker(Category.EVALUATION);
    private static final Marker FINDING = MarkerFactory.getMarker(Category.FINDING);

    private final Logger delegate;

    private AnalysisLogger(Logger delegate) {
        this.delegate = delegate;
    }

    public static AnalysisLogger getLogger(Class<?> clazz) {
        return CACHE.computeIfAbsent(clazz.getName(), name -> new AnalysisLogger(LoggerFactory.getLogger(name)));
    }

    /**
     * Logs the start of a phase, e.g. one level of the classifier or one stage of the conversion pipeline.
     *
     * @param phase the description of the phase
     */
    public void logPhase(String phase) {
        delegate.info(PHASE, phase);
    }

    /**
     * Logs a model (grammar, automaton, trace). Models are rendered lazily at debug level only.
     *
     * @param model the model
     */
    public void logModel(Object model) {
        if (delegate.isDebugEnabled(MODEL)) {
            delegate.debug(MODEL, "{}{}", System.lineSeparator(), model);
        }
    }

    /**
     * Logs the outcome of a single rule evaluation.
     *
     * @param evaluation the rendered evaluation
     */
    public void logEvaluation(String evaluation) {
        delegate.debug(EVALUATION, evaluation);
    }

    /**
     * Logs a non-fatal finding about an input, e.g. an unused non-terminal or an unreachable state.
     *
     * @param finding the description of the finding
     */
    public void logFinding(String finding) {
        delegate.warn(FINDING, finding);
    }

    public void debug(String format, Object... arguments) {
        delegate.debug(format, arguments);
    }

    public void info(String format, Object... arguments) {
        delegate.info(format, arguments);
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }
}
