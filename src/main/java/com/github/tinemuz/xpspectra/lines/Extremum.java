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
 * One extremum of a band's continuous spectrum.
 *
 * @param band band the extremum was found in
 * @param pseudoWavelength position in pseudo-wavelength
 * @param wavelengthNm position in nm
 * @param widthPseudoWavelength distance between the nearest inflection points on
 *     either side, NaN when one side has none
 * @param widthNm the same width in nm
 * @param kind maximum or minimum
 */
public record Extremum(
        Band band,
        double pseudoWavelength,
        double wavelengthNm,
        double widthPseudoWavelength,
        double widthNm,
        Kind kind) {

    public enum Kind {
        MAXIMUM,
        MINIMUM
    }
}
