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
package com.github.tinemuz.xpspectra.basis;

import com.github.tinemuz.xpspectra.Band;
import com.github.tinemuz.xpspectra.SamplingGrid;
import com.github.tinemuz.xpspectra.model.BasisConfiguration;
import com.github.tinemuz.xpspectra.model.BlendWeights;
import com.github.tinemuz.xpspectra.model.CalibrationModel;
import com.github.tinemuz.xpspectra.model.DispersionFunction;
import com.github.tinemuz.xpspectra.model.InstrumentModel;

/**
 * Evaluates basis sets of an {@link InstrumentModel} on sampling grids and keeps
 * the results for reuse.
 *
 * <p>Two flavours are produced. Pseudo-wavelength design matrices sample the
 * internally calibrated bases directly. Absolute design matrices sample the
 * external-calibration bases on a wavelength grid and include the conversion
 * to energy flux, so that coefficients map straight to W nm^-1 m^-2.</p>
 *
 * <p>One builder is meant to be shared by a whole batch; it is thread safe.</p>
 */
public final class DesignMatrixBuilder {

    /** Cache key: flavour, basis set / band and the exact grid. */
    record Key(boolean absolute, int basisFunctionId, Band band, SamplingGrid grid) {}

    private final InstrumentModel model;
    private final ReadThroughCache<Key, DesignMatrix> cache;
    private final ReadThroughCache<SamplingGrid, BlendWeights> blendWeights;

    public DesignMatrixBuilder(InstrumentModel model) {
        this.model = model;
        this.cache = new ReadThroughCache<>("design matrix", this::build);
        this.blendWeights = new ReadThroughCache<>("blend weights", BlendWeights::forGrid);
    }

    public InstrumentModel model() {
        return model;
    }

    /** Design matrix of the given basis set on a pseudo-wavelength grid. */
    public DesignMatrix pseudoWavelength(int basisFunctionId, SamplingGrid pseudoWavelengths) {
        return cache.get(new Key(false, basisFunctionId, model.basis(basisFunctionId).band(), pseudoWavelengths));
    }

    /** Absolute (energy flux) design matrix of a band on a wavelength grid in nm. */
    public DesignMatrix absolute(Band band, SamplingGrid wavelengthsNm) {
        return cache.get(new Key(true, band.basisFunctionId(), band, wavelengthsNm));
    }

    /** Standard blend weights for a wavelength grid. */
    public BlendWeights blendWeights(SamplingGrid wavelengthsNm) {
        return blendWeights.get(wavelengthsNm);
    }

    /** Number of cached design matrices. */
    public int cachedMatrices() {
        return cache.size();
    }

    private DesignMatrix build(Key key) {
        if (key.absolute()) {
            BlendWeights weights = blendWeights(key.grid());
            return absolute(model.calibration(key.band()), model.dispersion(), key.grid(),
                    weights.weights(key.band()));
        }
        return pseudoWavelength(model.basis(key.basisFunctionId()), key.grid());
    }

    /**
     * Sample a basis set on a pseudo-wavelength grid: the Hermite functions on
     * the rescaled abscissa, combined through the transformation matrix.
     */
    public static DesignMatrix pseudoWavelength(BasisConfiguration bases, SamplingGrid pseudoWavelengths) {
        int n = bases.dimension();
        int m = pseudoWavelengths.size();
        double[][] out = new double[n][m];
        double[] psi = new double[n];
        for (int j = 0; j < m; j++) {
            HermiteFunctions.evaluate(bases.toNormalized(pseudoWavelengths.get(j)), n, psi);
            for (int i = 0; i < n; i++) {
                double sum = 0.0;
                for (int k = 0; k < n; k++) sum += bases.transformationEntry(i, k) * psi[k];
                out[i][j] = sum;
            }
        }
        return new DesignMatrix(pseudoWavelengths, out);
    }

    /**
     * Sample the external-calibration bases of a band on a wavelength grid.
     * Columns where the band weight is not positive are left at zero.
     */
    public static DesignMatrix absolute(
            CalibrationModel calibration,
            DispersionFunction dispersion,
            SamplingGrid wavelengthsNm,
            double[] weights) {
        if (weights.length != wavelengthsNm.size()) {
            throw new IllegalArgumentException("Expected one weight per grid point");
        }
        BasisConfiguration bases = calibration.bases();
        Band band = calibration.band();
        int n = bases.dimension();
        int h = calibration.inverseDimension();
        int m = wavelengthsNm.size();
        double[][] out = new double[n][m];
        double[] psi = new double[h];
        double[] inverse = new double[n];
        for (int j = 0; j < m; j++) {
            if (!(weights[j] > 0.0)) continue;
            double wl = wavelengthsNm.get(j);
            double norm = calibration.energyNormalisation(wl);
            if (norm == 0.0) continue;
            double x = bases.toNormalized(dispersion.wavelengthToPseudo(band, wl));
            HermiteFunctions.evaluate(x, h, psi);
            for (int k = 0; k < n; k++) {
                double sum = 0.0;
                for (int q = 0; q < h; q++) sum += calibration.inverseBasesEntry(k, q) * psi[q];
                inverse[k] = sum;
            }
            for (int i = 0; i < n; i++) {
                double sum = 0.0;
                for (int k = 0; k < n; k++) sum += bases.transformationEntry(i, k) * inverse[k];
                out[i][j] = sum * norm;
            }
        }
        return new DesignMatrix(wavelengthsNm, out);
    }
}
