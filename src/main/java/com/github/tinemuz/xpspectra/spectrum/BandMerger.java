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
import com.github.tinemuz.xpspectra.MissingBandException;
import com.github.tinemuz.xpspectra.SamplingGrid;
import com.github.tinemuz.xpspectra.model.BlendWeights;
import java.util.Arrays;
import java.util.Map;

/**
 * Combines the BP and RP samples of one source into one absolute spectrum.
 *
 * <p>With both bands present the result is the weighted sum of the bands,
 * treated as independent: flux = sum w f, variance = sum w^2 e^2 and each
 * band's covariance is scaled by its own weight outer product before summing.
 * With one band present the caller's {@link MissingBandPolicy} decides the
 * outcome.</p>
 */
public final class BandMerger {

    private BandMerger() {}

    /**
     * Merge band samples taken on the grid of {@code weights}.
     *
     * @throws MissingBandException if no band is present
     * @throws IllegalArgumentException if a band was sampled on another grid,
     *     the bands belong to different sources or only one carries covariance
     */
    public static MergedSpectrum merge(
            Map<Band, SampledBandSpectrum> bandSamples,
            BlendWeights weights,
            MissingBandPolicy policy) {
        SampledBandSpectrum bp = bandSamples.get(Band.BP);
        SampledBandSpectrum rp = bandSamples.get(Band.RP);
        if (bp == null && rp == null) throw new MissingBandException(Band.BP, Band.RP);
        SamplingGrid grid = weights.grid();
        if (bp != null) requireGrid(bp, grid);
        if (rp != null) requireGrid(rp, grid);
        if (bp != null && rp != null) return mergeBoth(bp, rp, weights);
        SampledBandSpectrum present = bp != null ? bp : rp;
        return policy == MissingBandPolicy.FULLY_MISSING ? fullyMissing(present) : maskedCoverage(present);
    }

    private static MergedSpectrum mergeBoth(SampledBandSpectrum bp, SampledBandSpectrum rp, BlendWeights weights) {
        if (bp.sourceId() != rp.sourceId()) {
            throw new IllegalArgumentException(
                    "Cannot merge bands of sources " + bp.sourceId() + " and " + rp.sourceId());
        }
        if (bp.hasCovariance() != rp.hasCovariance()) {
            throw new IllegalArgumentException("Both bands must be sampled with covariance, or neither");
        }
        int m = weights.grid().size();
        double[] wb = weights.weights(Band.BP);
        double[] wr = weights.weights(Band.RP);
        double[] flux = new double[m];
        double[] error = new double[m];
        for (int j = 0; j < m; j++) {
            flux[j] = wb[j] * bp.flux(j) + wr[j] * rp.flux(j);
            double eb = bp.error(j);
            double er = rp.error(j);
            error[j] = Math.sqrt(wb[j] * wb[j] * eb * eb + wr[j] * wr[j] * er * er);
        }
        double[][] cov = null;
        if (bp.hasCovariance()) {
            cov = new double[m][m];
            for (int j = 0; j < m; j++) {
                for (int l = 0; l < m; l++) {
                    cov[j][l] = wb[j] * wb[l] * bp.covariance(j, l) + wr[j] * wr[l] * rp.covariance(j, l);
                }
            }
        }
        return new MergedSpectrum(bp.sourceId(), weights.grid(), flux, error, cov);
    }

    private static MergedSpectrum fullyMissing(SampledBandSpectrum present) {
        int m = present.size();
        double[] flux = new double[m];
        double[] error = new double[m];
        Arrays.fill(flux, Double.NaN);
        Arrays.fill(error, Double.NaN);
        double[][] cov = null;
        if (present.hasCovariance()) {
            cov = new double[m][m];
            for (double[] row : cov) Arrays.fill(row, Double.NaN);
        }
        return new MergedSpectrum(present.sourceId(), present.grid(), flux, error, cov);
    }

    private static MergedSpectrum maskedCoverage(SampledBandSpectrum present) {
        SamplingGrid grid = present.grid();
        int m = grid.size();
        boolean[] masked = new boolean[m];
        for (int j = 0; j < m; j++) {
            double wl = grid.get(j);
            // RP alone leaves everything up to the start of its coverage uninformed, BP everything from its end
            masked[j] = present.band() == Band.RP
                    ? wl <= Band.RP.wavelengthLowNm()
                    : wl >= Band.BP.wavelengthHighNm();
        }
        double[] flux = present.flux();
        double[] error = present.error();
        double[][] cov = present.covariance();
        for (int j = 0; j < m; j++) {
            if (!masked[j]) continue;
            flux[j] = Double.NaN;
            error[j] = Double.NaN;
            if (cov != null) {
                for (int l = 0; l < m; l++) {
                    cov[j][l] = Double.NaN;
                    cov[l][j] = Double.NaN;
                }
            }
        }
        return new MergedSpectrum(present.sourceId(), grid, flux, error, cov);
    }

    private static void requireGrid(SampledBandSpectrum spectrum, SamplingGrid grid) {
        if (!spectrum.grid().equals(grid)) {
            throw new IllegalArgumentException("Band " + spectrum.band().tag()
                    + " was sampled on a different grid than the blend weights");
        }
    }
}
