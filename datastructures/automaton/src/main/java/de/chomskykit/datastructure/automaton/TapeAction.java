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
 * The tape operation of a Turing machine transition: the symbol written over the cell under the head and the
 * subsequent head movement.
 */
public final class TapeAction {

    private final String write;
    private final Move move;

    public TapeAction(String write, Move move) {
        this.write = write;
        this.move = move;
    }

    public String getWrite() {
        return write;
    }

    public Move getMove() {
        return move;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof TapeAction)) {
            return false;
        }
        TapeAction other = (TapeAction) obj;
        return write.equals(other.write) && move == other.move;
    }

    @Override
    public int hashCode() {
        return Objects.hash(write, move);
    }

    @Override
    public String toString() {
        return write + "," + move.getCode();
    }

    public enum Move {
        LEFT('L', -1),
        RIGHT('R', 1),
        STAY('S', 0);

        private final char code;
        private final int offset;

        Move(char code, int offset) {
            this.code = code;
            this.offset = offset;
        }

        public char getCode() {
            return code;
        }

        /**
         * @return the change of the head position
         */
        public int getOffset() {
            return offset;
        }

        /**
         * @throws IllegalArgumentException if the code is not one of {@code L}, {@code R}, {@code S}
         */
        public static Move fromCode(String code) {
            for (Move m : values()) {
                if (code.length() == 1 && Character.toUpperCase(code.charAt(0)) == m.code) {
                    return m;
                }
            }
            throw new IllegalArgumentException("Unknown head movement '" + code + "'");
        }
    }
}
