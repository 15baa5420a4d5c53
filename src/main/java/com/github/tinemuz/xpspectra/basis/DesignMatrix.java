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

import com.github.tinemuz.xpspectra.SamplingGrid;

/**
 * Basis functions sampled on a grid: entry (i, j) is basis i evaluated at grid
 * point j, so a coefficient vector times this matrix gives the sampled curve.
 *
 * <p>Immutable once built; instances are shared between all sources that use
 * the same basis set and grid.</p>
 */
public final class DesignMatrix {
    private final SamplingGrid grid;
    private final double[][] values;

    /** Wraps the given array without copying; callers hand over ownership. */
    DesignMatrix(SamplingGrid grid, double[][] values) {
        for (double[] row : values) {
            if (row.length != grid.size()) {
                throw new IllegalArgumentException(
                        "Design matrix row has " + row.length + " columns, grid has " + grid.size());
            }
        }
        this.grid = grid;
        this.values = values;
    }

    /** Design matrix from externally computed values (copied). */
    public static DesignMatrix of(SamplingGrid grid, double[][] values) {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) copy[i] = values[i].clone();
        return new DesignMatrix(grid, copy);
    }

    public SamplingGrid grid() {
        return grid;
    }

    /** Number of basis functions. */
    public int rows() {
        return values.length;
    }

    /** Number of grid points. */
    public int columns() {
        return grid.size();
    }

    public double get(int basis, int point) {
        return values[basis][point];
    }
}
