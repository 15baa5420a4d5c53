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
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-band weights on a wavelength grid used to blend the blue and red sampled
 * spectra into one absolute spectrum.
 *
 * <p>The standard weights give BP full weight below the start of the RP
 * coverage (635 nm), RP full weight above the end of the BP coverage (643 nm)
 * and a linear cross-over in between, so the two weights sum to one
 * everywhere.</p>
 */
public final class BlendWeights {
    private final SamplingGrid grid;
    private final Map<Band, double[]> weights;

    private BlendWeights(SamplingGrid grid, Map<Band, double[]> weights) {
        this.grid = grid;
        this.weights = weights;
    }

    /** Standard linear cross-over weights on a wavelength grid (nm). */
    public static BlendWeights forGrid(SamplingGrid wavelengthsNm) {
        double crossLow = Band.RP.wavelengthLowNm();
        double crossHigh = Band.BP.wavelengthHighNm();
        int m = wavelengthsNm.size();
        double[] bp = new double[m];
        double[] rp = new double[m];
        for (int j = 0; j < m; j++) {
            double wl = wavelengthsNm.get(j);
            if (wl < crossLow) {
                bp[j] = 1.0;
            } else if (wl > crossHigh) {
                bp[j] = 0.0;
            } else {
                bp[j] = 1.0 - (wl - crossLow) / (crossHigh - crossLow);
            }
            rp[j] = 1.0 - bp[j];
        }
        return of(wavelengthsNm, bp, rp);
    }

    /** Caller-supplied weights (copied). */
    public static BlendWeights of(SamplingGrid grid, double[] bpWeights, double[] rpWeights) {
        if (bpWeights.length != grid.size() || rpWeights.length != grid.size()) {
            throw new IllegalArgumentException("Blend weights must have one value per grid point ("
                    + grid.size() + "), got " + bpWeights.length + " and " + rpWeights.length);
        }
        Map<Band, double[]> w = new EnumMap<>(Band.class);
        w.put(Band.BP, bpWeights.clone());
        w.put(Band.RP, rpWeights.clone());
        return new BlendWeights(grid, w);
    }

    public SamplingGrid grid() {
        return grid;
    }

    public double weight(Band band, int point) {
        return weights.get(band)[point];
    }

    /** A copy of the weights of one band. */
    public double[] weights(Band band) {
        return weights.get(band).clone();
    }
}
