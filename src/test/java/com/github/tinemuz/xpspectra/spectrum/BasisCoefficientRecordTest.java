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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.xpspectra.Band;
import com.github.tinemuz.xpspectra.InvalidMatrixException;
import com.github.tinemuz.xpspectra.XpValidationException;
import com.github.tinemuz.xpspectra.covariance.CovarianceConvention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BasisCoefficientRecordTest {

    private static final double[] COEFFICIENTS = {3.0, -1.0, 0.5};
    private static final double[][] COVARIANCE = {
        {0.04, 0.01, 0.0},
        {0.01, 0.09, 0.0},
        {0.0, 0.0, 0.16}
    };

    @Test
    @DisplayName("Packed correlations expand to the absolute covariance")
    void packedCorrelations() {
        BasisCoefficientRecord r = BasisCoefficientRecord.withPackedCorrelations(
                7L, Band.BP, COEFFICIENTS, new double[] {0.5, 0.0, 0.0}, new double[] {0.2, 0.3, 0.4},
                1.5, 2, 56, CovarianceConvention.DR3);
        assertEquals(3, r.nParameters());
        assertEquals(2, r.nRelevantBases());
        assertEquals(56, r.basisFunctionId());
        assertEquals(1.5, r.standardDeviation());
        assertEquals(0.04, r.covariance(0, 0), 1e-15);
        assertEquals(0.5 * 0.2 * 0.3, r.covariance(1, 0), 1e-15);
        assertEquals(0.0, r.covariance(2, 0));
    }

    @Test
    @DisplayName("Truncation keeps the relevant leading coefficients")
    void truncation() {
        BasisCoefficientRecord r =
                BasisCoefficientRecord.withCovariance(1L, Band.RP, COEFFICIENTS, COVARIANCE, 1.0, 2, 57);
        assertEquals(2, r.activeBases(true));
        assertEquals(3, r.activeBases(false));
        assertArrayEquals(new double[] {3.0, -1.0, 0.0}, r.truncatedCoefficients(true));
        assertArrayEquals(COEFFICIENTS, r.truncatedCoefficients(false));
    }

    @Test
    @DisplayName("Zero relevant bases means no truncation")
    void zeroRelevant() {
        BasisCoefficientRecord r =
                BasisCoefficientRecord.withCovariance(1L, Band.RP, COEFFICIENTS, COVARIANCE, 1.0, 0, 57);
        assertEquals(3, r.activeBases(true));
    }

    @Test
    @DisplayName("Inputs are copied")
    void copies() {
        double[] c = COEFFICIENTS.clone();
        BasisCoefficientRecord r = BasisCoefficientRecord.withCovariance(1L, Band.BP, c, COVARIANCE, 1.0, 3, 56);
        c[0] = 100.0;
        assertEquals(3.0, r.coefficient(0));
        r.coefficients()[0] = 100.0;
        r.covariance()[0][0] = 100.0;
        assertEquals(3.0, r.coefficient(0));
        assertEquals(0.04, r.covariance(0, 0));
    }

    @Test
    @DisplayName("Invalid records are rejected as validation errors")
    void validation() {
        assertThrows(InvalidMatrixException.class, () -> BasisCoefficientRecord.withCovariance(
                1L, Band.BP, new double[] {1.0, 2.0}, COVARIANCE, 1.0, 2, 56));
        assertThrows(InvalidMatrixException.class, () -> BasisCoefficientRecord.withCovariance(
                1L, Band.BP, new double[] {1.0, 2.0}, new double[][] {{1.0, 0.2}, {0.3, 1.0}}, 1.0, 2, 56));
        assertThrows(XpValidationException.class, () -> BasisCoefficientRecord.withCovariance(
                1L, Band.BP, COEFFICIENTS, COVARIANCE, 1.0, 4, 56));
        assertThrows(XpValidationException.class, () -> BasisCoefficientRecord.withCovariance(
                1L, Band.BP, new double[0], new double[0][0], 1.0, 0, 56));
        assertThrows(InvalidMatrixException.class, () -> BasisCoefficientRecord.withCovariance(
                1L, Band.BP, COEFFICIENTS, null, 1.0, 0, 56));
    }
}
