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

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Inverse and inverse square root of a coefficient covariance matrix, and the
 * chi-squared of a residual vector against it.
 *
 * <p>The covariance {@code C} is factored as {@code D R D} with {@code D} the
 * diagonal of standard errors and {@code R} the correlation matrix. The
 * Cholesky factor is taken of {@code R}, whose entries stay within [-1, 1],
 * so {@code W = L^-1 D^-1} with {@code R = L L^T}. Then {@code W^T W = C^-1}
 * and {@code |W r|^2} is the chi-squared of a residual {@code r}.</p>
 */
public final class InverseCovariance {
    /** Relative symmetry threshold handed to the Cholesky decomposition. */
    private static final double SYMMETRY_THRESHOLD = 1e-9;
    /** Smallest pivot accepted as positive. */
    private static final double POSITIVITY_THRESHOLD = 1e-14;

    private InverseCovariance() {}

    /**
     * Inverse square root {@code W} of a covariance matrix, with
     * {@code W^T W = C^-1}. {@code W} is lower triangular up to the column
     * scaling.
     *
     * @throws InvalidMatrixException if the matrix is not symmetric, has a
     *     non-positive variance or is not positive definite
     */
    public static double[][] inverseSquareRoot(double[][] covariance) {
        int n = CovarianceReconstructor.requireSymmetric(covariance, "Covariance");
        double[] sigma = new double[n];
        for (int i = 0; i < n; i++) {
            if (!(covariance[i][i] > 0.0) || Double.isInfinite(covariance[i][i])) {
                throw new InvalidMatrixException("Variance must be positive, found " + covariance[i][i]
                        + " at " + i);
            }
            sigma[i] = Math.sqrt(covariance[i][i]);
        }
        RealMatrix correlation =
                MatrixUtils.createRealMatrix(CovarianceReconstructor.correlationFromCovariance(covariance));
        RealMatrix lower;
        try {
            lower = new CholeskyDecomposition(correlation, SYMMETRY_THRESHOLD, POSITIVITY_THRESHOLD).getL();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new InvalidMatrixException("Covariance matrix has no Cholesky factor: " + e.getMessage(), e);
        }
        double[][] w = new double[n][n];
        for (int j = 0; j < n; j++) {
            // column j of L^-1, scaled by 1 / sigma_j
            RealVector unit = MatrixUtils.createRealVector(new double[n]);
            unit.setEntry(j, 1.0);
            MatrixUtils.solveLowerTriangularSystem(lower, unit);
            for (int i = 0; i < n; i++) w[i][j] = unit.getEntry(i) / sigma[j];
        }
        return w;
    }

    /**
     * Inverse square root of the covariance reconstructed from a stored
     * (correlation, formal error, standard deviation) triple.
     *
     * @see CovarianceReconstructor#toCovariance
     */
    public static double[][] inverseSquareRoot(
            double[][] correlation,
            double[] formalErrors,
            double standardDeviation,
            CovarianceConvention convention) {
        return inverseSquareRoot(
                CovarianceReconstructor.toCovariance(correlation, formalErrors, standardDeviation, convention));
    }

    /** Inverse covariance {@code W^T W}, exactly symmetric. */
    public static double[][] inverse(double[][] covariance) {
        double[][] w = inverseSquareRoot(covariance);
        int n = w.length;
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double sum = 0.0;
                for (int k = 0; k < n; k++) sum += w[k][i] * w[k][j];
                out[i][j] = sum;
                out[j][i] = sum;
            }
        }
        return out;
    }

    /**
     * Chi-squared {@code |W r|^2} of a residual vector (observed minus model
     * coefficients); never negative.
     *
     * @param inverseSquareRoot {@code W} from {@link #inverseSquareRoot(double[][])}
     * @throws IllegalArgumentException if the shapes do not match
     */
    public static double chiSquared(double[][] inverseSquareRoot, double[] residuals) {
        if (inverseSquareRoot == null || residuals == null) {
            throw new IllegalArgumentException("Inverse square root and residuals are required");
        }
        int n = residuals.length;
        if (inverseSquareRoot.length != n) {
            throw new IllegalArgumentException("Inverse square root has " + inverseSquareRoot.length
                    + " rows but there are " + n + " residuals");
        }
        double chi2 = 0.0;
        for (int i = 0; i < n; i++) {
            double[] row = inverseSquareRoot[i];
            if (row.length != n) {
                throw new IllegalArgumentException("Inverse square root row " + i + " has " + row.length
                        + " columns, expected " + n);
            }
            double x = 0.0;
            for (int k = 0; k < n; k++) x += row[k] * residuals[k];
            chi2 += x * x;
        }
        return chi2;
    }
}
