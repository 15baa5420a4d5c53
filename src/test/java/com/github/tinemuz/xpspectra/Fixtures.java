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
package com.github.tinemuz.xpspectra;

import com.github.tinemuz.xpspectra.model.InstrumentModel;
import com.github.tinemuz.xpspectra.spectrum.BasisCoefficientRecord;

/** Shared test inputs. */
public final class Fixtures {
    /** Resource prefix of the four-basis model under src/test/resources. */
    public static final String TEST_MODEL_PREFIX = "test-";

    private Fixtures() {}

    public static InstrumentModel testModel() {
        return Holder.MODEL;
    }

    /** Record with a diagonal covariance of {@code sigma^2}, using the band's default basis set. */
    public static BasisCoefficientRecord diagonalRecord(
            long sourceId, Band band, double[] coefficients, double sigma, int nRelevantBases) {
        int n = coefficients.length;
        double[][] cov = new double[n][n];
        for (int i = 0; i < n; i++) cov[i][i] = sigma * sigma;
        return BasisCoefficientRecord.withCovariance(
                sourceId, band, coefficients, cov, 1.0, nRelevantBases, band.basisFunctionId());
    }

    /** Record with a dense, positive definite covariance. */
    public static BasisCoefficientRecord correlatedRecord(long sourceId, Band band, double[] coefficients) {
        int n = coefficients.length;
        double[][] cov = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                cov[i][j] = 0.01 * Math.pow(0.5, Math.abs(i - j));
            }
        }
        return BasisCoefficientRecord.withCovariance(
                sourceId, band, coefficients, cov, 1.0, n, band.basisFunctionId());
    }

    /** Smoothly decaying coefficients 1, 1/2, 1/3, ... */
    public static double[] decaying(int n) {
        double[] c = new double[n];
        for (int i = 0; i < n; i++) c[i] = 1.0 / (i + 1);
        return c;
    }

    private static final class Holder {
        static final InstrumentModel MODEL = InstrumentModel.load(TEST_MODEL_PREFIX);
    }
}
