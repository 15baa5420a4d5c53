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

/**
 * Scaling conventions of stored (correlation, formal error, standard deviation)
 * triples.
 *
 * <p>Successive data-format versions scaled the stored formal errors and
 * correlations differently by the standard deviation of the least-squares
 * solution. Each constant gives the factor that turns
 * {@code correlation[i][j] * error[i] * error[j]} into an absolute covariance
 * entry.</p>
 */
public enum CovarianceConvention {

    /** Published release format: formal errors already carry the standard deviation. */
    DR3 {
        @Override
        public double scale(double standardDeviation, boolean diagonal) {
            return 1.0;
        }
    },

    /**
     * Intermediate format where correlations were computed from
     * standard-deviation-scaled errors: off-diagonal terms need the square of
     * the standard deviation back, the unit diagonal does not.
     */
    DR3_INT4 {
        @Override
        public double scale(double standardDeviation, boolean diagonal) {
            return diagonal ? 1.0 : standardDeviation * standardDeviation;
        }
    },

    /** Early format with unit-weight formal errors. */
    DR3_INT3 {
        @Override
        public double scale(double standardDeviation, boolean diagonal) {
            return standardDeviation * standardDeviation;
        }
    };

    /** Factor applied to a diagonal or off-diagonal entry. */
    public abstract double scale(double standardDeviation, boolean diagonal);
}
