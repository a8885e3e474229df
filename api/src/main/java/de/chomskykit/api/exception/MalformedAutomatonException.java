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
package de.chomskykit.api.exception;

/**
 * Thrown when an automaton description cannot be turned into a valid automaton.
 */
public class MalformedAutomatonException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final String offendingText;
    private final String reason;

    /**
     * @param line          the 1-based line of the description, or {@code 0} for problems of the automaton as a whole
     * @param offendingText the text that caused the problem
     * @param reason        a short description of the problem
     */
    public MalformedAutomatonException(int line, String offendingText, String reason) {
        super((line > 0 ? "line " + line + ": " : "") + reason +
              (offendingText.isEmpty() ? "" : " in '" + offendingText + '\''));
        this.line = line;
        this.offendingText = offendingText;
        this.reason = reason;
    }

    public int getLine() {
        return line;
    }

    public String getOffendingText() {
        return offendingText;
    }

    public String getReason() {
        return reason;
    }
}
