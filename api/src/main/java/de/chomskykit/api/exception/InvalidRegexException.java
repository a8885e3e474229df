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
 * Thrown when a regular expression is syntactically invalid.
 */
public class InvalidRegexException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String fragment;

    /**
     * @param position the 0-based index in the regular expression where the problem was detected
     * @param fragment the offending substring
     * @param reason   a short description of the problem
     */
    public InvalidRegexException(int position, String fragment, String reason) {
        super(reason + " at position " + position + ": '" + fragment + '\'');
        this.position = position;
        this.fragment = fragment;
    }

    public int getPosition() {
        return position;
    }

    public String getFragment() {
        return fragment;
    }
}
