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
package de.chomskykit.util;

import java.util.Objects;

import de.chomskykit.setting.ChomskyKitProperty;
import de.chomskykit.setting.ChomskyKitSettings;

/**
 * The caller-supplied bounds of every potentially unbounded computation of the engine.
 * <p>
 * Instances are immutable; the {@code withX} methods return modified copies.
 */
public final class EngineLimits {

    public static final long DEFAULT_SIMULATION_STEPS = 10_000;
    public static final int DEFAULT_TM_PROBE_LENGTH = 3;
    public static final int DEFAULT_MAX_DFA_STATES = 10_000;
    public static final int DEFAULT_COMPARATOR_DEPTH = 6;
    public static final int DEFAULT_COMPARATOR_LENGTH = 10;
    public static final long DEFAULT_COMPARATOR_FORMS = 200_000;

    private final long maxSimulationSteps;
    private final int tmProbeLength;
    private final int maxDfaStates;
    private final int comparatorDepth;
    private final int comparatorMaxLength;
    private final long comparatorMaxForms;

    private EngineLimits(long maxSimulationSteps,
                         int tmProbeLength,
                         int maxDfaStates,
                         int comparatorDepth,
                         int comparatorMaxLength,
                         long comparatorMaxForms) {
        this.maxSimulationSteps = requirePositive(maxSimulationSteps, "maxSimulationSteps");
        this.tmProbeLength = (int) requireNonNegative(tmProbeLength, "tmProbeLength");
        this.maxDfaStates = (int) requirePositive(maxDfaStates, "maxDfaStates");
        this.comparatorDepth = (int) requireNonNegative(comparatorDepth, "comparatorDepth");
        this.comparatorMaxLength = (int) requireNonNegative(comparatorMaxLength, "comparatorMaxLength");
        this.comparatorMaxForms = requirePositive(comparatorMaxForms, "comparatorMaxForms");
    }

    /**
     * @return the limits built from the compiled-in defaults only
     */
    public static EngineLimits defaults() {
        return new EngineLimits(DEFAULT_SIMULATION_STEPS,
                                DEFAULT_TM_PROBE_LENGTH,
                                DEFAULT_MAX_DFA_STATES,
                                DEFAULT_COMPARATOR_DEPTH,
                                DEFAULT_COMPARATOR_LENGTH,
                                DEFAULT_COMPARATOR_FORMS);
    }

    /**
     * @return the limits configured through {@link ChomskyKitSettings}, falling back to the defaults
     */
    public static EngineLimits fromSettings() {
        final ChomskyKitSettings settings = ChomskyKitSettings.getInstance();
        return new EngineLimits(settings.getLong(ChomskyKitProperty.SIMULATION_MAX_STEPS, DEFAULT_SIMULATION_STEPS),
                                settings.getInt(ChomskyKitProperty.TM_PROBE_LENGTH, DEFAULT_TM_PROBE_LENGTH),
                                settings.getInt(ChomskyKitProperty.CONVERSION_MAX_DFA_STATES,
                                                DEFAULT_MAX_DFA_STATES),
                                settings.getInt(ChomskyKitProperty.COMPARATOR_MAX_DEPTH, DEFAULT_COMPARATOR_DEPTH),
                                settings.getInt(ChomskyKitProperty.COMPARATOR_MAX_LENGTH,
                                                DEFAULT_COMPARATOR_LENGTH),
                                settings.getLong(ChomskyKitProperty.COMPARATOR_MAX_FORMS,
                                                 DEFAULT_COMPARATOR_FORMS));
    }

    private static long requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    private static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
        return value;
    }

    public long getMaxSimulationSteps() {
        return maxSimulationSteps;
    }

    public int getTmProbeLength() {
        return tmProbeLength;
    }

    public int getMaxDfaStates() {
        return maxDfaStates;
    }

    public int getComparatorDepth() {
        return comparatorDepth;
    }

    public int getComparatorMaxLength() {
        return comparatorMaxLength;
    }

    public long getComparatorMaxForms() {
        return comparatorMaxForms;
    }

    public EngineLimits withMaxSimulationSteps(long steps) {
        return new EngineLimits(steps, tmProbeLength, maxDfaStates, comparatorDepth, comparatorMaxLength,
                                comparatorMaxForms);
    }

    public EngineLimits withTmProbeLength(int length) {
        return new EngineLimits(maxSimulationSteps, length, maxDfaStates, comparatorDepth, comparatorMaxLength,
                                comparatorMaxForms);
    }

    public EngineLimits withMaxDfaStates(int states) {
        return new EngineLimits(maxSimulationSteps, tmProbeLength, states, comparatorDepth, comparatorMaxLength,
                                comparatorMaxForms);
    }

    public EngineLimits withComparatorDepth(int depth) {
        return new EngineLimits(maxSimulationSteps, tmProbeLength, maxDfaStates, depth, comparatorMaxLength,
                                comparatorMaxForms);
    }

    public EngineLimits withComparatorMaxLength(int length) {
        return new EngineLimits(maxSimulationSteps, tmProbeLength, maxDfaStates, comparatorDepth, length,
                                comparatorMaxForms);
    }

    public EngineLimits withComparatorMaxForms(long forms) {
        return new EngineLimits(maxSimulationSteps, tmProbeLength, maxDfaStates, comparatorDepth,
                                comparatorMaxLength, forms);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof EngineLimits)) {
            return false;
        }
        EngineLimits other = (EngineLimits) obj;
        return maxSimulationSteps == other.maxSimulationSteps && tmProbeLength == other.tmProbeLength &&
               maxDfaStates == other.maxDfaStates && comparatorDepth == other.comparatorDepth &&
               comparatorMaxLength == other.comparatorMaxLength && comparatorMaxForms == other.comparatorMaxForms;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxSimulationSteps,
                            tmProbeLength,
                            maxDfaStates,
                            comparatorDepth,
                            comparatorMaxLength,
                            comparatorMaxForms);
    }

    @Override
    public String toString() {
        return "EngineLimits[simulationSteps=" + maxSimulationSteps + ", tmProbeLength=" + tmProbeLength +
               ", dfaStates=" + maxDfaStates + ", comparatorDepth=" + comparatorDepth + ", comparatorLength=" +
               comparatorMaxLength + ", comparatorForms=" + comparatorMaxForms + ']';
    }
}
