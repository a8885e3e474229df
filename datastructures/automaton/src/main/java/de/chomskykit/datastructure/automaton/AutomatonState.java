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
package de.chomskykit.datastructure.automaton;

import java.util.Objects;

/**
 * A named state with its initial and accepting flags.
 */
public final class AutomatonState {

    private final String id;
    private final boolean initial;
    private final boolean accepting;

    public AutomatonState(String id, boolean initial, boolean accepting) {
        if (id.isEmpty()) {
            throw new IllegalArgumentException("State identifiers must not be empty");
        }
        this.id = id;
        this.initial = initial;
        this.accepting = accepting;
    }

    public String getId() {
        return id;
    }

    public boolean isInitial() {
        return initial;
    }

    public boolean isAccepting() {
        return accepting;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof AutomatonState)) {
            return false;
        }
        AutomatonState other = (AutomatonState) obj;
        return id.equals(other.id) && initial == other.initial && accepting == other.accepting;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, initial, accepting);
    }

    @Override
    public String toString() {
        return id;
    }
}
