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
package com.github.tinemuz.xpspectra.lines;

import com.github.tinemuz.xpspectra.Band;

/**
 * A line found in one band of one source.
 *
 * @param sourceId source the line belongs to
 * @param name catalogue name, or band tag and integer wavelength for
 *     uncatalogued extrema
 * @param cataloguePseudoWavelength where the catalogue placed the line; equal to
 *     the extremum position for uncatalogued extrema
 * @param extremum the matched extremum with its width and kind
 * @param absolute properties on the calibrated spectrum (W nm^-1 m^-2)
 * @param internal properties on the pseudo-wavelength spectrum (e- s^-1)
 */
public record SpectralLine(
        long sourceId,
        String name,
        double cataloguePseudoWavelength,
        Extremum extremum,
        LineMeasurement absolute,
        LineMeasurement internal) {

    public Band band() {
        return extremum.band();
    }

    public double pseudoWavelength() {
        return extremum.pseudoWavelength();
    }

    public double wavelengthNm() {
        return extremum.wavelengthNm();
    }

    public double widthNm() {
        return extremum.widthNm();
    }
}
