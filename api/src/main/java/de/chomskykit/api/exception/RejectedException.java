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
 * Signals that a deterministic automaton has no transition for the next input symbol.
 * <p>
 * This is a simulation outcome, not a failure of the engine: the automaton correctly determined that the input is not
 * accepted.
 */
public class RejectedException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final String state;
    private final String symbol;
    private final int position;

    public RejectedException(String state, String symbol, int position) {
        super("No transition from state " + state + " on '" + symbol + "' (input position " + position + ')');
        this.state = state;
        this.symbol = symbol;
        this.position = position;
    }

    public String getState() {
        return state;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPosition() {
        return position;
    }
}
