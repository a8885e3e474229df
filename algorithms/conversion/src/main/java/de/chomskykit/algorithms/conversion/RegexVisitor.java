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

/**
 * Visitor over {@link RegexNode} trees.
 *
 * @param <R> result type
 */
public interface RegexVisitor<R> {

    R visitLiteral(RegexNode.Literal literal);

    R visitEpsilon(RegexNode.Epsilon epsilon);

    R visitConcatenation(RegexNode.Concatenation concatenation);

    R visitAlternation(RegexNode.Alternation alternation);

    R visitStar(RegexNode.Star star);

    R visitPlus(RegexNode.Plus plus);

    R visitOptional(RegexNode.Optional optional);
}
