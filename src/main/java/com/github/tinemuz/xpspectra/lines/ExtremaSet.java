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
package com.github.tinemuz.xpspectra.lines;

import com.github.tinemuz.xpspectra.Band;

/**
 * Derivative zero crossings of one band of one source, in pseudo-wavelength
 * and ascending. Either sequence may be empty.
 */
public final class ExtremaSet {
    private final long sourceId;
    private final Band band;
    private final double[] extrema;
    private final double[] inflections;

    ExtremaSet(long sourceId, Band band, double[] extrema, double[] inflections) {
        this.sourceId = sourceId;
        this.band = band;
        this.extrema = extrema;
        this.inflections = inflections;
    }

    public long sourceId() {
        return sourceId;
    }

    public Band band() {
        return band;
    }

    /** Zeros of the first derivative. */
    public double[] extrema() {
        return extrema.clone();
    }

    /** Zeros of the second derivative. */
    public double[] inflections() {
        return inflections.clone();
    }

    public boolean isEmpty() {
        return extrema.length == 0 && inflections.length == 0;
    }
}
