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

import com.github.tinemuz.xpspectra.Band;

import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * External-calibration model of one band: the bases, the inverse bases that
 * express them in Hermite functions, and the mean instrument response used to
 * turn photon counts into energy flux.
 */
public final class CalibrationModel {
    /** Telescope pupil area in m². */
    public static final double TELESCOPE_PUPIL_AREA = 0.7278;
    /** Planck constant in J s. */
    public static final double PLANCK = 6.62607004E-34;
    /** Speed of light in m/s. */
    public static final double SPEED_OF_LIGHT = 2.99792458E8;

    private static final double HC_NM = 1.0e9 * SPEED_OF_LIGHT * PLANCK;

    private final Band band;
    private final BasisConfiguration bases;
    private final double[][] inverseBases;
    private final PolynomialSplineFunction response;
    private final Interval responseRange;

    public CalibrationModel(
            Band band,
            BasisConfiguration bases,
            double[][] inverseBases,
            double[] responseWavelengths,
            double[] responseValues) {
        if (inverseBases.length != bases.dimension()) {
            throw new IllegalStateException("Inverse bases of band " + band.tag() + " have "
                    + inverseBases.length + " rows, expected " + bases.dimension());
        }
        this.band = band;
        this.bases = bases;
        this.inverseBases = BasisConfiguration.deepCopy(inverseBases);
        this.response = new SplineInterpolator().interpolate(responseWavelengths, responseValues);
        this.responseRange = new Interval(
                responseWavelengths[0], responseWavelengths[responseWavelengths.length - 1]);
    }

    public Band band() {
        return band;
    }

    public BasisConfiguration bases() {
        return bases;
    }

    /** Number of Hermite functions the inverse bases are expressed in. */
    public int inverseDimension() {
        return inverseBases[0].length;
    }

    public double inverseBasesEntry(int basis, int hermite) {
        return inverseBases[basis][hermite];
    }

    /** Instrument response at the given wavelength; zero outside the tabulated range. */
    public double response(double wavelengthNm) {
        if (!responseRange.contains(wavelengthNm)) return 0.0;
        return response.value(wavelengthNm);
    }

    /**
     * Factor converting a sampled photon flux into W nm^-1 m^-2 at the given
     * wavelength; zero where the response is not positive.
     */
    public double energyNormalisation(double wavelengthNm) {
        double r = response(wavelengthNm);
        if (r > 0.0) return HC_NM / (TELESCOPE_PUPIL_AREA * r * wavelengthNm);
        return 0.0;
    }
}
