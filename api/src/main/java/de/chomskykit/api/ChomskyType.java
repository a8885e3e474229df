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
package de.chomskykit.api;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The four classes of the Chomsky hierarchy.
 * <p>
 * The classes are nested: every regular grammar is context-free, every context-free grammar without erasing rules is
 * context-sensitive and every grammar is unrestricted. The constants are declared from the least to the most
 * restrictive class, so that {@link #ordinal()} coincides with {@link #getLevel()}.
 */
public enum ChomskyType {

    TYPE_0(0, "unrestricted"),
    TYPE_1(1, "context-sensitive"),
    TYPE_2(2, "context-free"),
    TYPE_3(3, "regular");

    private final int level;
    private final String displayName;

    ChomskyType(int level, String displayName) {
        this.level = level;
        this.displayName = displayName;
    }

    /**
     * @return the number of the class in the hierarchy (0 to 3)
     */
    public int getLevel() {
        return level;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Checks whether this class is contained in (or equal to) the given one.
     *
     * @param other the class to compare with
     * @return {@code true} iff this class is at least as restrictive as {@code other}
     */
    public boolean isAtLeastAsRestrictiveAs(ChomskyType other) {
        return level >= other.level;
    }

    /**
     * @return the next less restrictive class, or {@code null} for {@link #TYPE_0}
     */
    public @Nullable ChomskyType weaker() {
        return level == 0 ? null : values()[level - 1];
    }

    public static ChomskyType ofLevel(int level) {
        if (level < 0 || level > 3) {
            throw new IllegalArgumentException("There is no Chomsky type " + level);
        }
        return values()[level];
    }

    @Override
    public String toString() {
        return "Type " + level + " (" + displayName + ")";
    }
}
