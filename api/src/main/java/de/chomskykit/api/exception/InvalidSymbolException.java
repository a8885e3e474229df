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
 * Signals that a simulation input contains a symbol outside the input alphabet of the automaton.
 */
public class InvalidSymbolException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final String symbol;
    private final int position;

    public InvalidSymbolException(String symbol, int position) {
        super("Symbol '" + symbol + "' at input position " + position + " is not part of the input alphabet");
        this.symbol = symbol;
        this.position = position;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPosition() {
        return position;
    }
}
