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
package de.chomskykit.algorithms.classifier;

/**
 * The orientation of a regular grammar.
 */
public enum LinearDirection {
    /** Productions of the form {@code A -> aB}. */
    RIGHT,
    /** Productions of the form {@code A -> Ba}. */
    LEFT,
    /** Only productions of the form {@code A -> a} or {@code A -> ε}, or not a regular grammar. */
    NONE
}
