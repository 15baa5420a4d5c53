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
import com.github.tinemuz.xpspectra.SamplingGrid;
import com.github.tinemuz.xpspectra.SamplingRangeException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Band-specific mapping between physical wavelength (nm) and pseudo-wavelength.
 *
 * <p>The relation is tabulated by the instrument model. Inside the table the
 * mapping is piecewise linear in both directions, which makes the two
 * directions exact inverses of each other; outside the table the first or last
 * segment is extended linearly.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class DispersionFunction {
    /** Wavelength domain accepted for merged (both-band) sampling grids. */
    public static final Interval COMBINED_WAVELENGTH_DOMAIN = new Interval(330.0, 1050.0);

    private final Map<Band, PiecewiseLinearFunction> toPseudo = new EnumMap<>(Band.class);
    private final Map<Band, PiecewiseLinearFunction> toWavelength = new EnumMap<>(Band.class);
    private final Map<Band, Interval> pseudoRanges = new EnumMap<>(Band.class);

    /**
     * Build from matching wavelength / pseudo-wavelength columns per band.
     * Both columns must be strictly monotonic and at least two entries long;
     * pseudo-wavelength may decrease with wavelength.
     *
     * @throws IllegalStateException if a band's table is missing or unusable
     */
    public DispersionFunction(Map<Band, double[][]> tables) {
        for (Band band : Band.values()) {
            double[][] table = tables.get(band);
            if (table == null) {
                throw new IllegalStateException("No dispersion table for band " + band.tag());
            }
            double[] wl = table[0];
            double[] pwl = table[1];
            try {
                toPseudo.put(band, new PiecewiseLinearFunction(wl, pwl));
                toWavelength.put(band, new PiecewiseLinearFunction(pwl, wl));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Unusable dispersion table for band " + band.tag(), e);
            }
            double a = wavelengthToPseudo(band, band.wavelengthLowNm());
            double b = wavelengthToPseudo(band, band.wavelengthHighNm());
            pseudoRanges.put(band, new Interval(Math.min(a, b), Math.max(a, b)));
        }
    }

    public double wavelengthToPseudo(Band band, double wavelengthNm) {
        return toPseudo.get(band).value(wavelengthNm);
    }

    public double pseudoToWavelength(Band band, double pseudoWavelength) {
        return toWavelength.get(band).value(pseudoWavelength);
    }

    public double[] wavelengthToPseudo(Band band, double[] wavelengthsNm) {
        return toPseudo.get(band).value(wavelengthsNm);
    }

    public double[] pseudoToWavelength(Band band, double[] pseudoWavelengths) {
        return toWavelength.get(band).value(pseudoWavelengths);
    }

    /**
     * Pseudo-wavelengths corresponding to the band's wavelength coverage, low
     * bound first whichever way the mapping runs.
     */
    public Interval pseudoWavelengthRange(Band band) {
        return pseudoRanges.get(band);
    }

    /** The band's wavelength coverage in nm. */
    public Interval wavelengthRange(Band band) {
        return new Interval(band.wavelengthLowNm(), band.wavelengthHighNm());
    }

    /** Validate a wavelength grid that will be sampled for one band only. */
    public void validateSamplingRange(Band band, SamplingGrid wavelengthsNm) {
        validateSamplingRange(wavelengthRange(band), wavelengthsNm, "nm");
    }

    /** Validate a wavelength grid that will be sampled for the merged spectrum. */
    public void validateSamplingRange(SamplingGrid wavelengthsNm) {
        validateSamplingRange(COMBINED_WAVELENGTH_DOMAIN, wavelengthsNm, "nm");
    }

    /**
     * Reject a grid that is empty, contains NaN, decreases anywhere or leaves the
     * given domain.
     *
     * @throws SamplingRangeException describing the first problem found
     */
    public static void validateSamplingRange(Interval domain, SamplingGrid grid, String unit) {
        if (grid == null) throw new SamplingRangeException("Sampling can't be null.");
        if (grid.size() == 0) throw new SamplingRangeException("Sampling must contain at least one point.");
        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < grid.size(); i++) {
            double v = grid.get(i);
            if (Double.isNaN(v)) {
                throw new SamplingRangeException("Sampling contains NaN at index " + i + ".");
            }
            if (v < previous) {
                throw new SamplingRangeException("Sampling should be a non-decreasing array (index " + i + ").");
            }
            previous = v;
        }
        if (grid.first() < domain.low() || grid.last() > domain.high()) {
            throw new SamplingRangeException(String.format(
                    "Wrong value for sampling. Sampling accepts an array of values where the minimum value is "
                            + "%s %s and the maximum is %s %s.",
                    domain.low(), unit, domain.high(), unit));
        }
    }
}
