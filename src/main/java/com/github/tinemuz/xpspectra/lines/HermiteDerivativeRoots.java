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

import java.util.Arrays;
import java.util.function.Consumer;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zero crossings of the first and second derivative of a Hermite-function
 * series, on the normalised Hermite abscissa.
 *
 * <p>The series is sum_k t_k psi_k(x) with t = c T, where c are the basis
 * coefficients and T the basis transformation matrix. Derivatives of Hermite
 * functions are again Hermite-function series, so each derivative's zeros are
 * the eigenvalues of a tridiagonal Hermite companion matrix whose last row
 * holds the derivative coefficients scaled by the leading one. Only real
 * eigenvalues are returned, ascending.</p>
 *
 * <p>The recurrence always runs over the full basis dimension; truncation only
 * zeroes coefficients. When the leading derivative coefficient vanishes the
 * companion matrix does not exist and the root set is empty; the reason is
 * handed to the degeneracy listener, which by default logs a warning.</p>
 */
public final class HermiteDerivativeRoots {
    private static final Logger log = LoggerFactory.getLogger(HermiteDerivativeRoots.class);
    private static final double SQRT2 = Math.sqrt(2.0);
    /** Leading coefficient below this fraction of the largest one counts as zero. */
    static final double DEGENERACY_TOLERANCE = 1e-12;
    private static final double[] NONE = new double[0];

    private final int n;
    private final double[] series;
    private final Consumer<String> onDegenerate;

    /**
     * Series from explicit coefficients.
     *
     * <p>{@code nRelevantBases} is taken literally: exactly that many leading
     * coefficients are used, so 0 zeroes the whole series. This differs from
     * {@code BasisCoefficientRecord.activeBases}, where a stored count of 0
     * means the record carries no truncation level and every coefficient
     * is used; callers starting from a record pass its {@code activeBases}.</p>
     *
     * @param transformation n x n basis transformation matrix
     * @param nBases basis dimension n
     * @param nRelevantBases coefficients at index &ge; this are treated as zero
     * @param coefficients the n basis coefficients (not modified)
     */
    public HermiteDerivativeRoots(double[][] transformation, int nBases, int nRelevantBases, double[] coefficients) {
        this(transformation, nBases, nRelevantBases, coefficients,
                reason -> log.warn("No roots for series: {}, reported as empty", reason));
    }

    HermiteDerivativeRoots(
            double[][] transformation,
            int nBases,
            int nRelevantBases,
            double[] coefficients,
            Consumer<String> onDegenerate) {
        if (nBases <= 0) throw new IllegalArgumentException("Number of bases must be positive, got " + nBases);
        if (coefficients.length != nBases) {
            throw new IllegalArgumentException(
                    "Expected " + nBases + " coefficients, got " + coefficients.length);
        }
        if (transformation.length != nBases) {
            throw new IllegalArgumentException("Transformation matrix has " + transformation.length
                    + " rows, expected " + nBases);
        }
        if (nRelevantBases < 0 || nRelevantBases > nBases) {
            throw new IllegalArgumentException("Relevant bases " + nRelevantBases + " outside [0, " + nBases + "]");
        }
        this.n = nBases;
        this.onDegenerate = onDegenerate;
        this.series = new double[nBases];
        for (int i = 0; i < nRelevantBases; i++) {
            double c = coefficients[i];
            if (c == 0.0) continue;
            double[] row = transformation[i];
            if (row.length != nBases) {
                throw new IllegalArgumentException("Transformation matrix row " + i + " has " + row.length
                        + " columns, expected " + nBases);
            }
            for (int j = 0; j < nBases; j++) series[j] += c * row[j];
        }
    }

    /** Hermite-function coefficients t = c T of the series itself. */
    public double[] seriesCoefficients() {
        return series.clone();
    }

    /** Hermite-function coefficients of the first derivative (n + 1 values). */
    public double[] firstDerivativeCoefficients() {
        double[] d = new double[n + 1];
        // psi_k' = sqrt(k/2) psi_(k-1) - sqrt((k+1)/2) psi_(k+1)
        for (int k = 0; k < n; k++) {
            double f = Math.sqrt(k + 1.0) / SQRT2;
            d[k + 1] -= f * series[k];
            if (k + 1 < n) d[k] += f * series[k + 1];
        }
        return d;
    }

    /** Hermite-function coefficients of the second derivative (n + 2 values). */
    public double[] secondDerivativeCoefficients() {
        double[] d2 = new double[n + 2];
        for (int k = 0; k < n; k++) d2[k] = (-0.5 - k) * series[k];
        for (int k = 0; k < n; k++) {
            double f = 0.5 * Math.sqrt((k + 2.0) * (k + 1.0));
            if (k + 2 < n) d2[k] += f * series[k + 2];
            d2[k + 2] += f * series[k];
        }
        return d2;
    }

    /** Zeros of the first derivative (extrema of the series), ascending. */
    public double[] firstDerivativeRoots() {
        return companionRoots(firstDerivativeCoefficients(), n, "first derivative");
    }

    /** Zeros of the second derivative (inflection points of the series), ascending. */
    public double[] secondDerivativeRoots() {
        return companionRoots(secondDerivativeCoefficients(), n + 1, "second derivative");
    }

    // Companion matrix of size `size` for a series with size + 1 coefficients
    private double[] companionRoots(double[] derivative, int size, String what) {
        double lead = derivative[size];
        double largest = 0.0;
        for (double v : derivative) largest = Math.max(largest, Math.abs(v));
        if (!Double.isFinite(lead) || !(Math.abs(lead) > DEGENERACY_TOLERANCE * largest)) {
            onDegenerate.accept(what + ": vanishing leading coefficient");
            return NONE;
        }
        double[][] b = new double[size][size];
        for (int k = 0; k < size - 1; k++) {
            double f = Math.sqrt(k + 1.0) / SQRT2;
            b[k + 1][k] = f;
            b[k][k + 1] = f;
        }
        double factor = Math.sqrt(size / 2.0) / lead;
        for (int i = 0; i < size; i++) b[size - 1][i] -= factor * derivative[i];

        double[] real;
        double[] imag;
        try {
            EigenDecomposition eigen = new EigenDecomposition(new Array2DRowRealMatrix(b, false));
            real = eigen.getRealEigenvalues();
            imag = eigen.getImagEigenvalues();
        } catch (MaxCountExceededException | MathArithmeticException e) {
            log.debug("Eigenvalue solver failed for {}", what, e);
            onDegenerate.accept(what + ": eigenvalue solver failed (" + e.getClass().getSimpleName() + ")");
            return NONE;
        }
        double[] roots = new double[real.length];
        int count = 0;
        for (int i = 0; i < real.length; i++) {
            if (imag[i] == 0.0) roots[count++] = real[i];
        }
        double[] out = Arrays.copyOf(roots, count);
        Arrays.sort(out);
        return out;
    }
}
