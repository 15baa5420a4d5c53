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
package com.github.tinemuz.xpspectra;

import java.util.Locale;

/**
 * The two low-resolution photometer channels.
 *
 * <p>Each band covers its own wavelength interval (in nanometres); the two
 * intervals overlap between 635 nm and 643 nm, which is where the blue and red
 * spectra are blended into a single absolute spectrum.</p>
 */
public enum Band {
    /** Blue photometer. */
    BP("bp", 330.0, 643.0, 56),
    /** Red photometer. */
    RP("rp", 635.0, 1020.0, 57);

    private final String tag;
    private final double wavelengthLowNm;
    private final double wavelengthHighNm;
    private final int basisFunctionId;

    Band(String tag, double wavelengthLowNm, double wavelengthHighNm, int basisFunctionId) {
        this.tag = tag;
        this.wavelengthLowNm = wavelengthLowNm;
        this.wavelengthHighNm = wavelengthHighNm;
        this.basisFunctionId = basisFunctionId;
    }

    /** Lower-case tag used in column names and messages ("bp" or "rp"). */
    public String tag() {
        return tag;
    }

    /** Lower end of the wavelength coverage in nm. */
    public double wavelengthLowNm() {
        return wavelengthLowNm;
    }

    /** Upper end of the wavelength coverage in nm. */
    public double wavelengthHighNm() {
        return wavelengthHighNm;
    }

    /** Basis-function id used by the published coefficient records of this band. */
    public int basisFunctionId() {
        return basisFunctionId;
    }

    /** The other photometer. */
    public Band other() {
        return this == BP ? RP : BP;
    }

    /**
     * Parse a band tag, ignoring case and surrounding blanks.
     *
     * @throws InvalidBandException if the tag is neither "bp" nor "rp"
     */
    public static Band fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (Band band : values()) {
                if (band.tag.equals(normalized)) return band;
            }
        }
        throw new InvalidBandException(tag);
    }
}
