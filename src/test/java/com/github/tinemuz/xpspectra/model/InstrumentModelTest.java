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
package com.github.tinemuz.xpspectra.model;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.xpspectra.Band;
import com.github.tinemuz.xpspectra.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InstrumentModelTest {

    @Nested
    @DisplayName("Bundled model")
    class BundledModel {

        @Test
        @DisplayName("Loads once and is shared")
        void sharedInstance() {
            assertSame(InstrumentModel.defaultModel(), InstrumentModel.defaultModel());
            assertEquals(InstrumentModel.DEFAULT_PREFIX, InstrumentModel.defaultModel().prefix());
        }

        @Test
        @DisplayName("Defines one basis set per band")
        void basisSets() {
            InstrumentModel model = InstrumentModel.defaultModel();
            BasisConfiguration bp = model.basis(56);
            assertEquals(Band.BP, bp.band());
            assertEquals(55, bp.dimension());
            assertSame(bp, model.basis(Band.BP));
            assertEquals(Band.RP, model.basis(Band.RP).band());
            assertEquals(57, model.basis(Band.RP).id());
        }

        @Test
        @DisplayName("Unknown basis id is rejected")
        void unknownBasis() {
            assertThrows(IllegalArgumentException.class, () -> InstrumentModel.defaultModel().basis(99));
        }

        @Test
        @DisplayName("Pseudo-wavelength is rescaled linearly onto the Hermite abscissa")
        void normalisation() {
            BasisConfiguration bp = InstrumentModel.defaultModel().basis(Band.BP);
            assertEquals(0.25, bp.scale(), 1e-12);
            assertEquals(-7.5, bp.offset(), 1e-12);
            assertEquals(-10.0, bp.toNormalized(-10.0), 1e-12);
            assertEquals(10.0, bp.toNormalized(70.0), 1e-12);
            assertEquals(12.3, bp.toPseudoWavelength(bp.toNormalized(12.3)), 1e-12);
        }

        @Test
        @DisplayName("Transformation matrix is returned as a copy")
        void transformationCopy() {
            BasisConfiguration bp = InstrumentModel.defaultModel().basis(Band.BP);
            double[][] t = bp.transformation();
            double original = t[0][0];
            t[0][0] = 1234.0;
            assertEquals(original, bp.transformationEntry(0, 0));
        }

        @Test
        @DisplayName("Response is positive inside the table and zero outside")
        void response() {
            CalibrationModel bp = InstrumentModel.defaultModel().calibration(Band.BP);
            assertTrue(bp.response(500.0) > 0.0);
            assertEquals(0.0, bp.response(900.0));
            assertTrue(bp.energyNormalisation(500.0) > 0.0);
            assertEquals(0.0, bp.energyNormalisation(900.0));
            assertEquals(55, bp.inverseDimension());
        }
    }

    @Nested
    @DisplayName("Alternative models")
    class AlternativeModels {

        @Test
        @DisplayName("Models load from another resource prefix")
        void loadsPrefix() {
            InstrumentModel model = Fixtures.testModel();
            assertEquals(4, model.basis(Band.BP).dimension());
            assertEquals(1.0, model.basis(Band.RP).transformationEntry(3, 0));
        }

        @Test
        @DisplayName("Photon to energy normalisation uses h c / (A r lambda)")
        void energyNormalisation() {
            CalibrationModel bp = Fixtures.testModel().calibration(Band.BP);
            double expected = CalibrationModel.PLANCK * CalibrationModel.SPEED_OF_LIGHT * 1e9
                    / (CalibrationModel.TELESCOPE_PUPIL_AREA * 500.0);
            assertEquals(1.0, bp.response(500.0), 1e-12);
            assertEquals(expected, bp.energyNormalisation(500.0), expected * 1e-12);
        }

        @Test
        @DisplayName("Missing resources fail with IllegalStateException")
        void missingResources() {
            IllegalStateException e =
                    assertThrows(IllegalStateException.class, () -> InstrumentModel.load("does-not-exist-"));
            assertTrue(e.getMessage().contains("does-not-exist-dispersion.txt"));
        }
    }
}
