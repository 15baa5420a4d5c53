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
package com.github.tinemuz.xpspectra.covariance;

import com.github.tinemuz.xpspectra.InvalidMatrixException;

/**
 * Expansion of symmetric matrices stored as their lower triangle.
 *
 * <p>Archive rows keep only the strict lower triangle of a correlation matrix
 * (row by row, the unit diagonal implied). The binary archive flavour keeps the
 * diagonal as well. Both layouts are recognised from the array length.</p>
 */
public final class TriangularPacking {

    private TriangularPacking() {}

    /** Matrix size n for a strict lower triangle of n(n-1)/2 values. */
    public static int sizeFromStrictLowerTriangle(int length) {
        int n = (int) Math.round((Math.sqrt(1.0 + 8.0 * length) + 1.0) / 2.0);
        if (n * (n - 1) / 2 != length) {
            throw new InvalidMatrixException(length + " values do not form a strict lower triangle");
        }
        return n;
    }

    /**
     * Full symmetric matrix of size n from its packed lower triangle, with or
     * without diagonal. A missing diagonal is filled with ones.
     */
    public static double[][] unpackLowerTriangle(double[] packed, int n) {
        int strict = n * (n - 1) / 2;
        boolean withDiagonal;
        if (packed.length == strict) {
            withDiagonal = false;
        } else if (packed.length == strict + n) {
            withDiagonal = true;
        } else {
            throw new InvalidMatrixException("Packed triangle of " + packed.length
                    + " values does not match a " + n + "x" + n + " matrix");
        }
        double[][] m = new double[n][n];
        int k = 0;
        for (int i = 0; i < n; i++) {
            int last = withDiagonal ? i : i - 1;
            for (int j = 0; j <= last; j++) {
                m[i][j] = packed[k];
                m[j][i] = packed[k];
                k++;
            }
            if (!withDiagonal) m[i][i] = 1.0;
        }
        return m;
    }

    /** Strict lower triangle of a square matrix, row by row. */
    public static double[] packStrictLowerTriangle(double[][] matrix) {
        int n = matrix.length;
        double[] out = new double[n * (n - 1) / 2];
        int k = 0;
        for (int i = 1; i < n; i++) {
            for (int j = 0; j < i; j++) out[k++] = matrix[i][j];
        }
        return out;
    }
}
