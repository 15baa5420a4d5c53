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

/**
 * Orthonormal Hermite functions
 * psi_n(x) = (2^n n! sqrt(pi))^(-1/2) exp(-x^2/2) H_n(x).
 *
 * <p>Values are produced with the stable three-term recurrence
 * psi_n = sqrt(2/n) x psi_(n-1) - sqrt((n-1)/n) psi_(n-2), which avoids the
 * factorial overflow of the closed form for the orders used here.</p>
 */
public final class HermiteFunctions {
    private static final double PI_POW_MINUS_QUARTER = Math.pow(Math.PI, -0.25);
    private static final double SQRT2 = Math.sqrt(2.0);

    private HermiteFunctions() {}

    /**
     * Fill {@code out[0..count-1]} with psi_0(x) .. psi_(count-1)(x).
     */
    public static void evaluate(double x, int count, double[] out) {
        if (count <= 0) return;
        double psi0 = PI_POW_MINUS_QUARTER * Math.exp(-0.5 * x * x);
        out[0] = psi0;
        if (count == 1) return;
        out[1] = SQRT2 * x * psi0;
        for (int n = 2; n < count; n++) {
            out[n] = Math.sqrt(2.0 / n) * x * out[n - 1] - Math.sqrt((n - 1.0) / n) * out[n - 2];
        }
    }

    /** psi_0(x) .. psi_(count-1)(x) in a new array. */
    public static double[] evaluate(double x, int count) {
        double[] out = new double[count];
        evaluate(x, count, out);
        return out;
    }

    /** Value of the series sum_k coefficients[k] psi_k(x). */
    public static double series(double[] coefficients, double x) {
        double[] psi = evaluate(x, coefficients.length);
        double sum = 0.0;
        for (int k = 0; k < coefficients.length; k++) sum += coefficients[k] * psi[k];
        return sum;
    }
}
