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
package de.chomskykit.algorithms.conversion;

import java.util.Objects;

/**
 * One stage of a {@link ConversionTrace}: the produced model, its textual rendering and an explanation of what the
 * stage did.
 */
public final class TraceEntry {

    private final Stage stage;
    private final Object model;
    private final String rendering;
    private final String explanation;

    public TraceEntry(Stage stage, Object model, String rendering, String explanation) {
        this.stage = Objects.requireNonNull(stage);
        this.model = Objects.requireNonNull(model);
        this.rendering = rendering;
        this.explanation = explanation;
    }

    public Stage getStage() {
        return stage;
    }

    public Object getModel() {
        return model;
    }

    public String getRendering() {
        return rendering;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        final String nl = System.lineSeparator();
        return "== " + stage.getTitle() + " ==" + nl + explanation + nl + rendering.trim() + nl;
    }
}
