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
 * Reported when at least one of two grammars generates no terminal string within the derivation depth and length
 * bound of a comparison.
 */
public class IncomparableGrammarsException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final boolean firstDegenerate;
    private final boolean secondDegenerate;

    public IncomparableGrammarsException(boolean firstDegenerate, boolean secondDegenerate, int depth, int maxLength) {
        super(describe(firstDegenerate, secondDegenerate) + " no string within depth " + depth + " and length " +
              maxLength);
        this.firstDegenerate = firstDegenerate;
        this.secondDegenerate = secondDegenerate;
    }

    private static String describe(boolean first, boolean second) {
        if (first && second) {
            return "Neither grammar generates";
        }
        return (first ? "The first" : "The second") + " grammar generates";
    }

    public boolean isFirstDegenerate() {
        return firstDegenerate;
    }

    public boolean isSecondDegenerate() {
        return secondDegenerate;
    }
}
