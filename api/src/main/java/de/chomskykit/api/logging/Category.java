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
package de.chomskykit.api.logging;

/**
 * Marker names used by {@link AnalysisLogger} so that log configurations can filter analysis output by kind.
 */
public final class Category {

    public static final String PHASE = "phase";
    public static final String MODEL = "model";
    public static final String EVALUATION = "evaluation";
    public static final String FINDING = "finding";

    private Category() {
        // prevent instantiation
    }
}
