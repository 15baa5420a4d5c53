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

import com.github.tinemuz.xpspectra.Band;
import com.github.tinemuz.xpspectra.SamplingGrid;

/**
 * One band of one source sampled on a grid: flux, flux error and optionally
 * the full covariance of the samples.
 */
public final class SampledBandSpectrum {
    private final long sourceId;
    private final Band band;
    private final SamplingGrid grid;
    private final double[] flux;
    private final double[] error;
    private final double[][] covariance;
    private final double standardDeviation;

    SampledBandSpectrum(
            long sourceId,
            Band band,
            SamplingGrid grid,
            double[] flux,
            double[] error,
            double[][] covariance,
            double standardDeviation) {
        this.sourceId = sourceId;
        this.band = band;
        this.grid = grid;
        this.flux = flux;
        this.error = error;
        this.covariance = covariance;
        this.standardDeviation = standardDeviation;
    }

    public long sourceId() {
        return sourceId;
    }

    public Band band() {
        return band;
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

    public boolean hasCovariance() {
        return covariance != null;
    }

    /**
     * Covariance between two samples.
     *
     * @throws IllegalStateException if the covariance was not requested
     */
    public double covariance(int row, int column) {
        if (covariance == null) throw new IllegalStateException("Covariance was not computed");
        return covariance[row][column];
    }

    /** Standard deviation of the least-squares solution the samples come from. */
    public double standardDeviation() {
        return standardDeviation;
    }

    public double[] flux() {
        return flux.clone();
    }

    public double[] error() {
        return error.clone();
    }

    /** A copy of the covariance, or {@code null} if it was not computed. */
    public double[][] covariance() {
        if (covariance == null) return null;
        double[][] out = new double[covariance.length][];
        for (int i = 0; i < covariance.length; i++) out[i] = covariance[i].clone();
        return out;
    }
}
