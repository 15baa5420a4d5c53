/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.xpspectra.basis;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Build-once cache for immutable values derived from the instrument model.
 *
 * <p>Each key is built at most once; concurrent requests for the same key wait
 * for the first builder. Values must not be mutated after they are returned.</p>
 */
public final class ReadThroughCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(ReadThroughCache.class);

    private final String name;
    private final Function<? super K, ? extends V> builder;
    private final ConcurrentMap<K, V> entries = new ConcurrentHashMap<>();

    public ReadThroughCache(String name, Function<? super K, ? extends V> builder) {
        this.name = name;
        this.builder = builder;
    }

    public V get(K key) {
        return entries.computeIfAbsent(key, k -> {
            log.debug("Building {} entry for {}", name, k);
            return builder.apply(k);
        });
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
