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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.xpspectra.InvalidMatrixException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InverseCovarianceTest {

    private static final double[][] SMALL = {
        {4.0, 2.0},
        {2.0, 9.0}
    };

    private static double[][] correlated(int n) {
        double[][] c = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) c[i][j] = 0.01 * (i + 1) * Math.pow(0.5, Math.abs(i - j));
        }
        // symmetrise the row scaling
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < i; j++) c[i][j] = c[j][i];
        }
        return c;
    }

    private static void assertIdentity(double[][] m, double tolerance) {
        for (int i = 0; i < m.length; i++) {
            for (int j = 0; j < m.length; j++) {
                assertEquals(i == j ? 1.0 : 0.0, m[i][j], tolerance, "(" + i + ", " + j + ")");
            }
        }
    }

    private static double[][] multiply(double[][] a, double[][] b) {
        int n = a.length;
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                for (int k = 0; k < n; k++) out[i][j] += a[i][k] * b[k][j];
            }
        }
        return out;
    }

    private static double[][] gram(double[][] w) {
        int n = w.length;
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                for (int k = 0; k < n; k++) out[i][j] += w[k][i] * w[k][j];
            }
        }
        return out;
    }

    @Nested
    @DisplayName("Inverse square root")
    class InverseSquareRoot {

        @Test
        @DisplayName("W^T W times the covariance is the identity")
        void whitens() {
            double[][] cov = correlated(6);
            double[][] w = InverseCovariance.inverseSquareRoot(cov);
            assertIdentity(multiply(gram(w), cov), 1e-9);
        }

        @Test
        @DisplayName("Result is lower triangular")
        void lowerTriangular() {
            double[][] w = InverseCovariance.inverseSquareRoot(correlated(4));
            for (int i = 0; i < 4; i++) {
                for (int j = i + 1; j < 4; j++) assertEquals(0.0, w[i][j], 0.0);
            }
        }

        @Test
        @DisplayName("Two by two case matches the closed form")
        void closedForm() {
            double[][] w = InverseCovariance.inverseSquareRoot(SMALL);
            // R = [[1, 1/3], [1/3, 1]], L = [[1, 0], [1/3, sqrt(8)/3]]
            double l11 = Math.sqrt(8.0) / 3.0;
            assertEquals(0.5, w[0][0], 1e-12);
            assertEquals(-(1.0 / 3.0) / l11 / 2.0, w[1][0], 1e-12);
            assertEquals(1.0 / l11 / 3.0, w[1][1], 1e-12);
        }

        @Test
        @DisplayName("Stored triple goes through the covariance reconstruction")
        void fromStoredTriple() {
            double[][] correlation = {{1.0, 0.5, -0.2}, {0.5, 1.0, 0.1}, {-0.2, 0.1, 1.0}};
            double[] errors = {0.1, 0.2, 0.4};
            for (CovarianceConvention convention : CovarianceConvention.values()) {
                double[][] cov = CovarianceReconstructor.toCovariance(correlation, errors, 1.3, convention);
                double[][] w = InverseCovariance.inverseSquareRoot(correlation, errors, 1.3, convention);
                assertIdentity(multiply(gram(w), cov), 1e-9);
            }
        }
    }

    @Nested
    @DisplayName("Inverse and chi-squared")
    class InverseAndChiSquared {

        @Test
        @DisplayName("Inverse of a two by two covariance")
        void inverse() {
            double[][] inv = InverseCovariance.inverse(SMALL);
            assertEquals(9.0 / 32.0, inv[0][0], 1e-12);
            assertEquals(-2.0 / 32.0, inv[0][1], 1e-12);
            assertEquals(inv[0][1], inv[1][0]);
            assertEquals(4.0 / 32.0, inv[1][1], 1e-12);
        }

        @Test
        @DisplayName("Chi-squared equals r^T C^-1 r")
        void chiSquared() {
            double[][] w = InverseCovariance.inverseSquareRoot(SMALL);
            // (9 - 2*2*2 + 4*4) / 32
            assertEquals(17.0 / 32.0, InverseCovariance.chiSquared(w, new double[] {1.0, 2.0}), 1e-12);
            assertEquals(0.0, InverseCovariance.chiSquared(w, new double[2]), 0.0);
        }

        @Test
        @DisplayName("Chi-squared rejects mismatched shapes")
        void chiSquaredShapes() {
            double[][] w = InverseCovariance.inverseSquareRoot(SMALL);
            assertThrows(IllegalArgumentException.class, () -> InverseCovariance.chiSquared(w, new double[3]));
            assertThrows(IllegalArgumentException.class, () -> InverseCovariance.chiSquared(null, new double[2]));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Matrix that is not positive definite is rejected")
        void notPositiveDefinite() {
            double[][] cov = {{1.0, 2.0}, {2.0, 1.0}};
            assertThrows(InvalidMatrixException.class, () -> InverseCovariance.inverseSquareRoot(cov));
        }

        @Test
        @DisplayName("Zero variance is rejected")
        void zeroVariance() {
            double[][] cov = {{1.0, 0.0}, {0.0, 0.0}};
            assertThrows(InvalidMatrixException.class, () -> InverseCovariance.inverseSquareRoot(cov));
        }

        @Test
        @DisplayName("Asymmetric matrix is rejected")
        void asymmetric() {
            double[][] cov = {{1.0, 0.2}, {0.3, 1.0}};
            assertThrows(InvalidMatrixException.class, () -> InverseCovariance.inverseSquareRoot(cov));
        }
    }
}
