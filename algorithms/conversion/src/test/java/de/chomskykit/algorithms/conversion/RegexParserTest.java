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

import java.util.Arrays;

import de.chomskykit.api.exception.InvalidRegexException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class RegexParserTest {

    @Test
    public void testPrecedence() throws InvalidRegexException {
        final RegexNode node = RegexParser.parse("ab*|c");

        Assert.assertTrue(node instanceof RegexNode.Alternation);
        final RegexNode.Alternation alternation = (RegexNode.Alternation) node;
        Assert.assertEquals(alternation.getChildren().get(0),
                            new RegexNode.Concatenation(Arrays.asList(new RegexNode.Literal("a"),
                                                                      new RegexNode.Star(new RegexNode.Literal("b")))));
        Assert.assertEquals(alternation.getChildren().get(1), new RegexNode.Literal("c"));
    }

    @Test
    public void testRendering() throws InvalidRegexException {
        Assert.assertEquals(RegexParser.parse(" ( a | b ) * c ").toString(), "(a|b)*c");
        Assert.assertEquals(RegexParser.parse("((ab))+").toString(), "(ab)+");
        Assert.assertEquals(RegexParser.parse("a**?").toString(), "a**?");
        Assert.assertEquals(RegexParser.parse("\\*\\(").toString(), "\\*\\(");
    }

    @Test
    public void testCharacterClass() throws InvalidRegexException {
        final RegexNode node = RegexParser.parse("[a-cx]");

        Assert.assertEquals(node.toString(), "a|b|c|x");
        Assert.assertEquals(node.getSymbols().toString(), "[a, b, c, x]");
        Assert.assertEquals(RegexParser.parse("[z]"), new RegexNode.Literal("z"));
    }

    @Test
    public void testSymbolsInOrderOfAppearance() throws InvalidRegexException {
        Assert.assertEquals(RegexParser.parse("c(b|a)*c").getSymbols().toString(), "[c, b, a]");
        Assert.assertTrue(RegexParser.parse("ε").getSymbols().isEmpty());
    }

    @DataProvider
    public static Object[][] malformed() {
        return new Object[][] {{"", 0},
                               {"   ", 0},
                               {"(a", 0},
                               {"a(b", 1},
                               {"a)", 1},
                               {"()", 0},
                               {"a||b", 2},
                               {"|a", 0},
                               {"a|", 2},
                               {"*a", 0},
                               {"a|+", 2},
                               {"a{2}", 1},
                               {"a.b", 1},
                               {"[ab", 0},
                               {"[]", 0},
                               {"[c-a]", 1},
                               {"ab\\", 2}};
    }

    @Test(dataProvider = "malformed")
    public void testMalformed(String regex, int position) {
        try {
            RegexParser.parse(regex);
            Assert.fail("Expected an exception for '" + regex + '\'');
        } catch (InvalidRegexException e) {
            Assert.assertEquals(e.getPosition(), position, e.getMessage());
        }
    }

    @Test
    public void testErrorDetail() {
        try {
            RegexParser.parse("ab(c|d");
            Assert.fail();
        } catch (InvalidRegexException e) {
            Assert.assertEquals(e.getFragment(), "(");
            Assert.assertTrue(e.getMessage().contains("missing ')'"));
        }
    }
}
