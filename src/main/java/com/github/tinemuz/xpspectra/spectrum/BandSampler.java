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

import com.github.tinemuz.xpspectra.basis.DesignMatrix;

/**
 * Linear mapping of basis coefficients and their covariance onto a sampled
 * curve.
 *
 * <p>With design matrix D (bases x points), coefficients c and covariance C:
 * flux = c D, covariance = D^T C D and error = sqrt(diag(D^T C D)). When
 * truncation is requested only the leading {@code n_relevant_bases}
 * coefficients, the matching rows of D and the leading block of C take part,
 * which is the same as zeroing the remaining coefficients and dropping their
 * uncertainty.</p>
 */
public final class BandSampler {

    private BandSampler() {}

    /**
     * Sample one band of one source.
     *
     * @throws IllegalArgumentException if the record and the design matrix
     *     disagree on the number of bases
     */
    public static SampledBandSpectrum sample(
            BasisCoefficientRecord record,
            DesignMatrix design,
            boolean truncation,
            boolean withCovariance) {
        if (record.nParameters() != design.rows()) {
            throw new IllegalArgumentException("Record " + record + " has " + record.nParameters()
                    + " coefficients but the design matrix has " + design.rows() + " bases");
        }
        int active = record.activeBases(truncation);
        int m = design.columns();
        double[] flux = new double[m];
        for (int j = 0; j < m; j++) {
            double sum = 0.0;
            for (int i = 0; i < active; i++) sum += record.coefficient(i) * design.get(i, j);
            flux[j] = sum;
        }
        double[] error = new double[m];
        double[][] cov = null;
        if (withCovariance) {
            cov = propagateCovariance(record, design, active);
            for (int j = 0; j < m; j++) error[j] = Math.sqrt(Math.max(0.0, cov[j][j]));
        } else {
            double[] column = new double[active];
            for (int j = 0; j < m; j++) {
                for (int i = 0; i < active; i++) {
                    double sum = 0.0;
                    for (int p = 0; p < active; p++) sum += record.covariance(i, p) * design.get(p, j);
                    column[i] = sum;
                }
                double variance = 0.0;
                for (int i = 0; i < active; i++) variance += design.get(i, j) * column[i];
                error[j] = Math.sqrt(Math.max(0.0, variance));
            }
        }
        return new SampledBandSpectrum(record.sourceId(), record.band(), design.grid(), flux, error, cov,
                record.standardDeviation());
    }

    // D^T C D restricted to the leading `active` bases, coefficient-major
    private static double[][] propagateCovariance(BasisCoefficientRecord record, DesignMatrix design, int active) {
        int m = design.columns();
        double[][] cd = new double[active][m];
        for (int i = 0; i < active; i++) {
            for (int p = 0; p < active; p++) {
                double c = record.covariance(i, p);
                if (c == 0.0) continue;
                for (int l = 0; l < m; l++) cd[i][l] += c * design.get(p, l);
            }
        }
        double[][] out = new double[m][m];
        for (int i = 0; i < active; i++) {
            for (int j = 0; j < m; j++) {
                double d = design.get(i, j);
                if (d == 0.0) continue;
                double[] row = out[j];
                double[] cdi = cd[i];
                for (int l = 0; l < m; l++) row[l] += d * cdi[l];
            }
        }
        // Enforce exact symmetry lost to summation order
        for (int j = 0; j < m; j++) {
            for (int l = j + 1; l < m; l++) {
                double avg = 0.5 * (out[j][l] + out[l][j]);
                out[j][l] = avg;
                out[l][j] = avg;
            }
        }
        return out;
    }
}
