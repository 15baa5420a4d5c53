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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HermiteFunctionsTest {

    private static final double PSI0_AT_ZERO = Math.pow(Math.PI, -0.25);

    @Test
    @DisplayName("Low orders match their closed forms")
    void closedForms() {
        double[] at0 = HermiteFunctions.evaluate(0.0, 3);
        assertEquals(PSI0_AT_ZERO, at0[0], 1e-15);
        assertEquals(0.0, at0[1], 1e-15);
        assertEquals(-PSI0_AT_ZERO / Math.sqrt(2.0), at0[2], 1e-15);

        double x = 1.3;
        double psi0 = PSI0_AT_ZERO * Math.exp(-0.5 * x * x);
        double[] v = HermiteFunctions.evaluate(x, 4);
        assertEquals(psi0, v[0], 1e-15);
        assertEquals(Math.sqrt(2.0) * x * psi0, v[1], 1e-15);
        assertEquals((2 * x * x - 1) / Math.sqrt(2.0) * psi0, v[2], 1e-14);
        assertEquals((2 * x * x * x - 3 * x) / Math.sqrt(3.0) * psi0, v[3], 1e-14);
    }

    @Test
    @DisplayName("Functions are orthonormal")
    void orthonormal() {
        int order = 12;
        int points = 4001;
        double lo = -15.0;
        double h = 30.0 / (points - 1);
        double[][] gram = new double[order][order];
        double[] psi = new double[order];
        for (int p = 0; p < points; p++) {
            HermiteFunctions.evaluate(lo + p * h, order, psi);
            double w = (p == 0 || p == points - 1) ? 0.5 * h : h;
            for (int i = 0; i < order; i++) {
                for (int j = 0; j < order; j++) gram[i][j] += w * psi[i] * psi[j];
            }
        }
        for (int i = 0; i < order; i++) {
            for (int j = 0; j < order; j++) {
                assertEquals(i == j ? 1.0 : 0.0, gram[i][j], 1e-9, "<psi_" + i + ", psi_" + j + ">");
            }
        }
    }

    @Test
    @DisplayName("Series sums weighted functions")
    void series() {
        double x = -0.7;
        double[] psi = HermiteFunctions.evaluate(x, 3);
        assertEquals(2.0 * psi[0] - psi[2], HermiteFunctions.series(new double[] {2.0, 0.0, -1.0}, x), 1e-15);
        assertEquals(0.0, HermiteFunctions.series(new double[0], x));
    }

    @Test
    @DisplayName("High orders stay finite far from the origin")
    void stability() {
        double[] v = HermiteFunctions.evaluate(25.0, 60);
        for (double d : v) assertTrue(Double.isFinite(d));
    }
}
