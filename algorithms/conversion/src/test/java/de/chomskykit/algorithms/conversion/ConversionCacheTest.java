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

import de.chomskykit.api.exception.AnalysisException;
import de.chomskykit.api.exception.InvalidRegexException;
import de.chomskykit.util.EngineLimits;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ConversionCacheTest {

    @Test
    public void testHitsShareTraces() throws AnalysisException {
        final ConversionCache cache = new ConversionCache(new ConversionPipeline(EngineLimits.defaults()));

        final ConversionTrace first = cache.convert("a(b|c)*");
        final ConversionTrace second = cache.convert(" a ( b | c ) * ");

        Assert.assertSame(second, first);
        Assert.assertEquals(cache.size(), 1);
        Assert.assertEquals(cache.getHits(), 1);
        Assert.assertEquals(cache.getMisses(), 1);

        cache.convert("ab");
        Assert.assertEquals(cache.size(), 2);

        cache.clear();
        Assert.assertEquals(cache.size(), 0);
        Assert.assertNotSame(cache.convert("a(b|c)*"), first);
    }

    @Test
    public void testFailuresAreNotCached() {
        final ConversionCache cache = new ConversionCache(new ConversionPipeline(EngineLimits.defaults()));

        for (int i = 0; i < 2; i++) {
            try {
                cache.convert("a(");
                Assert.fail();
            } catch (AnalysisException e) {
                Assert.assertTrue(e instanceof InvalidRegexException);
            }
        }
        Assert.assertEquals(cache.size(), 0);
        Assert.assertEquals(cache.getMisses(), 2);
    }

    @Test
    public void testNormalization() {
        Assert.assertEquals(ConversionCache.normalize(" a | b "), "a|b");
        Assert.assertEquals(ConversionCache.normalize("a\\ b"), "a\\ b");
        Assert.assertEquals(ConversionCache.normalize("a\\\\ b"), "a\\\\b");
    }
}
