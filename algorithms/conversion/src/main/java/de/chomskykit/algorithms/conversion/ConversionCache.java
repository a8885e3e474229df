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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import de.chomskykit.api.exception.InvalidRegexException;
import de.chomskykit.api.exception.StepLimitExceededException;

/**
 * Memoizes the traces of a {@link ConversionPipeline}.
 * <p>
 * Expressions that differ only in insignificant whitespace share one entry, and a hit returns the trace of the
 * spelling converted first. Failed conversions are not cached. The cache is owned by its caller; there is no shared
 * instance. It is safe for concurrent use, although two threads missing on the same expression may both convert it.
 */
public class ConversionCache {

    private final ConversionPipeline delegate;
    private final Map<String, ConversionTrace> cache = new HashMap<>();
    private final Lock cacheLock = new ReentrantLock();
    private long hits;
    private long misses;

    public ConversionCache(ConversionPipeline delegate) {
        this.delegate = delegate;
    }

    public ConversionTrace convert(String regex) throws InvalidRegexException, StepLimitExceededException {
        final String key = normalize(regex);

        cacheLock.lock();
        try {
            final ConversionTrace cached = cache.get(key);
            if (cached != null) {
                hits++;
                return cached;
            }
            misses++;
        } finally {
            cacheLock.unlock();
        }

        final ConversionTrace trace = delegate.convert(regex);

        cacheLock.lock();
        try {
            final ConversionTrace previous = cache.putIfAbsent(key, trace);
            return previous == null ? trace : previous;
        } finally {
            cacheLock.unlock();
        }
    }

    public int size() {
        cacheLock.lock();
        try {
            return cache.size();
        } finally {
            cacheLock.unlock();
        }
    }

    public long getHits() {
        cacheLock.lock();
        try {
            return hits;
        } finally {
            cacheLock.unlock();
        }
    }

    public long getMisses() {
        cacheLock.lock();
        try {
            return misses;
        } finally {
            cacheLock.unlock();
        }
    }

    public void clear() {
        cacheLock.lock();
        try {
            cache.clear();
            hits = 0;
            misses = 0;
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * Removes whitespace that is not escaped by a backslash.
     */
    static String normalize(String regex) {
        final StringBuilder sb = new StringBuilder(regex.length());
        boolean escaped = false;
        for (int i = 0; i < regex.length(); i++) {
            final char c = regex.charAt(i);
            if (escaped) {
                sb.append(c);
                escaped = false;
            } else if (c == '\\') {
                sb.append(c);
                escaped = true;
            } else if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
