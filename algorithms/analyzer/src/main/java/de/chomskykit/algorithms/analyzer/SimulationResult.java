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
package de.chomskykit.algorithms.analyzer;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The verdict of a simulation, the number of steps it took and a short explanation.
 * <p>
 * A rejection caused by a missing transition of a deterministic machine and an invalid symbol also record the state,
 * symbol and input position involved.
 */
public final class SimulationResult {

    private final Verdict verdict;
    private final long steps;
    private final String detail;
    private final @Nullable String state;
    private final @Nullable String symbol;
    private final int position;

    private SimulationResult(Verdict verdict,
                             long steps,
                             String detail,
                             @Nullable String state,
                             @Nullable String symbol,
                             int position) {
        this.verdict = verdict;
        this.steps = steps;
        this.detail = detail;
        this.state = state;
        this.symbol = symbol;
        this.position = position;
    }

    public static SimulationResult accepted(long steps, String detail) {
        return new SimulationResult(Verdict.ACCEPTED, steps, detail, null, null, -1);
    }

    public static SimulationResult rejected(long steps, String detail) {
        return new SimulationResult(Verdict.REJECTED, steps, detail, null, null, -1);
    }

    /**
     * A rejection because a deterministic machine has no transition for the next symbol.
     */
    public static SimulationResult stuck(String state, String symbol, int position, long steps) {
        return new SimulationResult(Verdict.REJECTED,
                                    steps,
                                    "no transition from " + state + " on " + symbol + " at position " + position,
                                    state,
                                    symbol,
                                    position);
    }

    public static SimulationResult invalidSymbol(String symbol, int position) {
        return new SimulationResult(Verdict.INVALID_SYMBOL,
                                    0,
                                    "symbol " + symbol + " at position " + position + " is not in the input alphabet",
                                    null,
                                    symbol,
                                    position);
    }

    public static SimulationResult stepLimitExceeded(long limit) {
        return new SimulationResult(Verdict.STEP_LIMIT_EXCEEDED,
                                    limit,
                                    "no verdict within " + limit + " steps",
                                    null,
                                    null,
                                    -1);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }

    public long getSteps() {
        return steps;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * @return the state without a matching transition, if the machine got stuck
     */
    public @Nullable String getState() {
        return state;
    }

    public @Nullable String getSymbol() {
        return symbol;
    }

    /**
     * @return the 0-based input position of a stuck or invalid symbol, {@code -1} otherwise
     */
    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return verdict + " after " + steps + " steps: " + detail;
    }
}
