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
 * Root of all reported outcomes of the analysis engine that are not a regular result.
 * <p>
 * Every engine call either returns a complete result or throws exactly one subclass of this exception. None of the
 * subclasses is ever retried internally.
 */
public abstract class AnalysisException extends Exception {

    private static final long serialVersionUID = 1L;

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
