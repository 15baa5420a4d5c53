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

import com.github.tinemuz.xpspectra.SamplingGrid;

/**
 * Absolute spectrum of one source on a wavelength grid, combining both bands.
 * Positions that no band informs hold NaN in flux, error and the matching
 * covariance rows and columns.
 */
public final class MergedSpectrum {
    private final long sourceId;
    private final SamplingGrid grid;
    private final double[] flux;
    private final double[] error;
    private final double[][] covariance;

    MergedSpectrum(long sourceId, SamplingGrid grid, double[] flux, double[] error, double[][] covariance) {
        this.sourceId = sourceId;
        this.grid = grid;
        this.flux = flux;
        this.error = error;
        this.covariance = covariance;
    }

    public long sourceId() {
        return sourceId;
    }

    public SamplingGrid grid() {
        return grid;
    }

    public int size() {
        return flux.length;
    }

    public double flux(int point) {
        return flux[point];
    }

    public double error(int point) {
        return error[point];
    }

    /** True where neither band covers the position. */
    public boolean isMissing(int point) {
        return Double.isNaN(flux[point]);
    }

    /** Per-position missing-coverage mask. */
    public boolean[] missingMask() {
        boolean[] mask = new boolean[flux.length];
        for (int j = 0; j < flux.length; j++) mask[j] = Double.isNaN(flux[j]);
        return mask;
    }

    public boolean hasCovariance() {
        return covariance != null;
    }

    public double covariance(int row, int column) {
        if (covariance == null) throw new IllegalStateException("Covariance was not computed");
        return covariance[row][column];
    }

    public double[] flux() {
        return flux.clone();
    }

    public double[] error() {
        return error.clone();
    }

    public double[][] covariance() {
        if (covariance == null) return null;
        double[][] out = new double[covariance.length][];
        for (int i = 0; i < covariance.length; i++) out[i] = covariance[i].clone();
        return out;
    }
}
