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
package com.github.tinemuz.xpspectra.model;

import com.github.tinemuz.xpspectra.Band;

/**
 * One set of basis functions of the instrument model, identified by its
 * basis-function id.
 *
 * <p>The bases are Hermite functions evaluated on a normalised abscissa
 * obtained from pseudo-wavelength by a linear rescaling of {@link #range()}
 * onto {@link #normalizedRange()}, combined through a square transformation
 * matrix. Coefficient records store weights of the transformed bases.</p>
 */
public final class BasisConfiguration {
    private final int id;
    private final Band band;
    private final int dimension;
    private final Interval range;
    private final Interval normalizedRange;
    private final double[][] transformation;
    private final double scale;
    private final double offset;

    public BasisConfiguration(
            int id, Band band, Interval range, Interval normalizedRange, double[][] transformation) {
        int n = transformation.length;
        for (double[] row : transformation) {
            if (row.length != n) {
                throw new IllegalStateException(
                        "Transformation matrix of basis " + id + " is not square");
            }
        }
        if (range.width() <= 0.0) {
            throw new IllegalStateException("Empty pseudo-wavelength range for basis " + id);
        }
        this.id = id;
        this.band = band;
        this.dimension = n;
        this.range = range;
        this.normalizedRange = normalizedRange;
        this.transformation = deepCopy(transformation);
        this.scale = normalizedRange.width() / range.width();
        this.offset = normalizedRange.low() - range.low() * scale;
    }

    public int id() {
        return id;
    }

    public Band band() {
        return band;
    }

    /** Number of basis functions. */
    public int dimension() {
        return dimension;
    }

    /** Pseudo-wavelength interval mapped onto the normalised range. */
    public Interval range() {
        return range;
    }

    public Interval normalizedRange() {
        return normalizedRange;
    }

    public double scale() {
        return scale;
    }

    public double offset() {
        return offset;
    }

    /** Pseudo-wavelength to normalised Hermite abscissa. */
    public double toNormalized(double pseudoWavelength) {
        return pseudoWavelength * scale + offset;
    }

    /** Normalised Hermite abscissa back to pseudo-wavelength. */
    public double toPseudoWavelength(double normalized) {
        return (normalized - offset) / scale;
    }

    public double transformationEntry(int row, int column) {
        return transformation[row][column];
    }

    /** A copy of the transformation matrix (row = basis index). */
    public double[][] transformation() {
        return deepCopy(transformation);
    }

    static double[][] deepCopy(double[][] m) {
        double[][] copy = new double[m.length][];
        for (int i = 0; i < m.length; i++) copy[i] = m[i].clone();
        return copy;
    }

    @Override
    public String toString() {
        return "BasisConfiguration[id=" + id + ", band=" + band.tag() + ", dimension=" + dimension + "]";
    }
}
