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
package com.github.tinemuz.xpspectra.spectrum;

import com.github.tinemuz.xpspectra.Band;
import com.github.tinemuz.xpspectra.InvalidMatrixException;
import com.github.tinemuz.xpspectra.XpValidationException;
import com.github.tinemuz.xpspectra.covariance.CovarianceConvention;
import com.github.tinemuz.xpspectra.covariance.CovarianceReconstructor;
import com.github.tinemuz.xpspectra.covariance.TriangularPacking;

/**
 * Continuous representation of one band of one source: basis coefficients of
 * a least-squares fit with their absolute covariance.
 *
 * <p>Records are read-only inputs; arrays are copied on the way in and out.</p>
 */
public final class BasisCoefficientRecord {
    private final long sourceId;
    private final Band band;
    private final double[] coefficients;
    private final double[][] covariance;
    private final double standardDeviation;
    private final int nRelevantBases;
    private final int basisFunctionId;

    private BasisCoefficientRecord(
            long sourceId,
            Band band,
            double[] coefficients,
            double[][] covariance,
            double standardDeviation,
            int nRelevantBases,
            int basisFunctionId) {
        int n = coefficients.length;
        if (n == 0) {
            throw new XpValidationException("Source " + sourceId + " " + band.tag() + ": no coefficients");
        }
        if (CovarianceReconstructor.requireSymmetric(covariance, "Covariance") != n) {
            throw new InvalidMatrixException("Source " + sourceId + " " + band.tag() + ": covariance is "
                    + covariance.length + "x" + covariance.length + " but there are " + n + " coefficients");
        }
        if (nRelevantBases < 0 || nRelevantBases > n) {
            throw new XpValidationException("Source " + sourceId + " " + band.tag()
                    + ": n_relevant_bases " + nRelevantBases + " outside [0, " + n + "]");
        }
        this.sourceId = sourceId;
        this.band = band;
        this.coefficients = coefficients;
        this.covariance = covariance;
        this.standardDeviation = standardDeviation;
        this.nRelevantBases = nRelevantBases;
        this.basisFunctionId = basisFunctionId;
    }

    /** Record whose covariance matrix is stored directly. */
    public static BasisCoefficientRecord withCovariance(
            long sourceId,
            Band band,
            double[] coefficients,
            double[][] covariance,
            double standardDeviation,
            int nRelevantBases,
            int basisFunctionId) {
        return new BasisCoefficientRecord(sourceId, band, coefficients.clone(), copy(covariance),
                standardDeviation, nRelevantBases, basisFunctionId);
    }

    /** Record stored as a full correlation matrix plus formal errors. */
    public static BasisCoefficientRecord withCorrelations(
            long sourceId,
            Band band,
            double[] coefficients,
            double[][] correlations,
            double[] formalErrors,
            double standardDeviation,
            int nRelevantBases,
            int basisFunctionId,
            CovarianceConvention convention) {
        double[][] cov = CovarianceReconstructor.toCovariance(
                correlations, formalErrors, standardDeviation, convention);
        return new BasisCoefficientRecord(sourceId, band, coefficients.clone(), cov,
                standardDeviation, nRelevantBases, basisFunctionId);
    }

    /** Record stored as a packed lower-triangle correlation array plus formal errors. */
    public static BasisCoefficientRecord withPackedCorrelations(
            long sourceId,
            Band band,
            double[] coefficients,
            double[] packedCorrelations,
            double[] formalErrors,
            double standardDeviation,
            int nRelevantBases,
            int basisFunctionId,
            CovarianceConvention convention) {
        double[][] correlations = TriangularPacking.unpackLowerTriangle(packedCorrelations, coefficients.length);
        return withCorrelations(sourceId, band, coefficients, correlations, formalErrors,
                standardDeviation, nRelevantBases, basisFunctionId, convention);
    }

    public long sourceId() {
        return sourceId;
    }

    public Band band() {
        return band;
    }

    /** Number of coefficients (n_parameters). */
    public int nParameters() {
        return coefficients.length;
    }

    /** Truncation cutoff recommended for this record. */
    public int nRelevantBases() {
        return nRelevantBases;
    }

    public int basisFunctionId() {
        return basisFunctionId;
    }

    public double standardDeviation() {
        return standardDeviation;
    }

    public double coefficient(int index) {
        return coefficients[index];
    }

    public double covariance(int row, int column) {
        return covariance[row][column];
    }

    public double[] coefficients() {
        return coefficients.clone();
    }

    public double[][] covariance() {
        return copy(covariance);
    }

    /**
     * Number of leading coefficients that take part in a computation: all of
     * them, or only the relevant ones when truncation is requested.
     */
    public int activeBases(boolean truncation) {
        if (truncation && nRelevantBases > 0) return nRelevantBases;
        return coefficients.length;
    }

    /** Coefficients with every entry at index &ge; the active count set to zero. */
    public double[] truncatedCoefficients(boolean truncation) {
        double[] c = coefficients.clone();
        for (int i = activeBases(truncation); i < c.length; i++) c[i] = 0.0;
        return c;
    }

    private static double[][] copy(double[][] m) {
        if (m == null) return null;
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) out[i] = m[i] == null ? null : m[i].clone();
        return out;
    }

    @Override
    public String toString() {
        return "BasisCoefficientRecord[source=" + sourceId + ", band=" + band.tag()
                + ", n=" + coefficients.length + ", relevant=" + nRelevantBases + "]";
    }
}
