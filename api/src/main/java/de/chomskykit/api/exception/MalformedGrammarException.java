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
 * Thrown when grammar text does not describe a well-formed grammar.
 */
public class MalformedGrammarException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final String offendingText;
    private final String reason;

    /**
     * @param line          the 1-based line of the grammar text, or {@code 0} if the problem is not tied to a line
     * @param offendingText the text that caused the problem
     * @param reason        a short description of the problem
     */
    public MalformedGrammarException(int line, String offendingText, String reason) {
        super(format(line, offendingText, reason));
        this.line = line;
        this.offendingText = offendingText;
        this.reason = reason;
    }

    private static String format(int line, String offendingText, String reason) {
        final StringBuilder sb = new StringBuilder();
        if (line > 0) {
            sb.append("line ").append(line).append(": ");
        }
        sb.append(reason);
        if (!offendingText.isEmpty()) {
            sb.append(" in '").append(offendingText).append('\'');
        }
        return sb.toString();
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
