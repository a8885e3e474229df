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
 * Signals that a bounded computation (pushdown or Turing machine simulation, subset construction, grammar generation)
 * used up its work budget before reaching a result.
 * <p>
 * Retrying with the same limit yields the same outcome; raising the limit is up to the caller.
 */
public class StepLimitExceededException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final long limit;

    public StepLimitExceededException(String operation, long limit) {
        super(operation + " exceeded its limit of " + limit + " steps");
        this.operation = operation;
        this.limit = limit;
    }

    public String getOperation() {
        return operation;
    }

    public long getLimit() {
        return limit;
    }
}
