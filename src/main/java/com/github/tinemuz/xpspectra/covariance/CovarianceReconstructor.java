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
 * Conversions between stored correlation data and absolute covariance
 * matrices. All methods are pure and return new arrays.
 */
public final class CovarianceReconstructor {
    /** Relative tolerance for the symmetry and unit-diagonal checks. */
    static final double SYMMETRY_TOLERANCE = 1e-9;

    private CovarianceReconstructor() {}

    /**
     * Absolute covariance
     * {@code cov[i][j] = correlation[i][j] * errors[i] * errors[j] * scale}.
     *
     * @param correlation square symmetric matrix with unit diagonal
     * @param formalErrors per-coefficient formal errors
     * @param standardDeviation standard deviation of the least-squares solution
     * @param convention format version the triple was stored with
     * @throws InvalidMatrixException on non-square, asymmetric or mismatched input
     */
    public static double[][] toCovariance(
            double[][] correlation,
            double[] formalErrors,
            double standardDeviation,
            CovarianceConvention convention) {
        int n = requireSymmetric(correlation, "Correlation");
        if (formalErrors == null || formalErrors.length != n) {
            throw new InvalidMatrixException("Expected " + n + " formal errors, got "
                    + (formalErrors == null ? "none" : String.valueOf(formalErrors.length)));
        }
        if (!(standardDeviation > 0.0) || Double.isInfinite(standardDeviation)) {
            throw new InvalidMatrixException("Standard deviation must be positive, got " + standardDeviation);
        }
        for (int i = 0; i < n; i++) {
            if (Math.abs(correlation[i][i] - 1.0) > 1e-6) {
                throw new InvalidMatrixException(
                        "Correlation diagonal must be 1, found " + correlation[i][i] + " at " + i);
            }
        }
        double diagonalScale = convention.scale(standardDeviation, true);
        double offDiagonalScale = convention.scale(standardDeviation, false);
        double[][] cov = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double s = i == j ? diagonalScale : offDiagonalScale;
                cov[i][j] = correlation[i][j] * formalErrors[i] * formalErrors[j] * s;
            }
        }
        return cov;
    }

    /**
     * Correlation matrix of a covariance matrix; entries where the covariance
     * is exactly zero stay zero.
     */
    public static double[][] correlationFromCovariance(double[][] covariance) {
        int n = requireSymmetric(covariance, "Covariance");
        double[] sigma = new double[n];
        for (int i = 0; i < n; i++) sigma[i] = Math.sqrt(covariance[i][i]);
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out[i][j] = covariance[i][j] == 0.0 ? 0.0 : covariance[i][j] / (sigma[i] * sigma[j]);
            }
        }
        return out;
    }

    /**
     * Check that a matrix is square and symmetric within tolerance.
     *
     * @return its size
     * @throws InvalidMatrixException otherwise
     */
    public static int requireSymmetric(double[][] matrix, String what) {
        if (matrix == null || matrix.length == 0) {
            throw new InvalidMatrixException(what + " matrix is empty");
        }
        int n = matrix.length;
        for (int i = 0; i < n; i++) {
            if (matrix[i] == null || matrix[i].length != n) {
                throw new InvalidMatrixException(what + " matrix is not square (row " + i + ")");
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double a = matrix[i][j];
                double b = matrix[j][i];
                double tol = SYMMETRY_TOLERANCE * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
                if (!(Math.abs(a - b) <= tol)) {
                    throw new InvalidMatrixException(
                            what + " matrix is not symmetric at (" + i + ", " + j + ")");
                }
            }
        }
        return n;
    }
}
