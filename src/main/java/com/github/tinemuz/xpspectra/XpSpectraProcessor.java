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

import com.github.tinemuz.xpspectra.basis.DesignMatrix;
import com.github.tinemuz.xpspectra.basis.DesignMatrixBuilder;
import com.github.tinemuz.xpspectra.lines.ExtremaFinder;
import com.github.tinemuz.xpspectra.lines.ExtremaSet;
import com.github.tinemuz.xpspectra.lines.Extremum;
import com.github.tinemuz.xpspectra.lines.LineFinder;
import com.github.tinemuz.xpspectra.lines.LineList;
import com.github.tinemuz.xpspectra.lines.SpectralLine;
import com.github.tinemuz.xpspectra.model.BasisConfiguration;
import com.github.tinemuz.xpspectra.model.DispersionFunction;
import com.github.tinemuz.xpspectra.model.InstrumentModel;
import com.github.tinemuz.xpspectra.spectrum.BandMerger;
import com.github.tinemuz.xpspectra.spectrum.BandSampler;
import com.github.tinemuz.xpspectra.spectrum.BasisCoefficientRecord;
import com.github.tinemuz.xpspectra.spectrum.MergedSpectrum;
import com.github.tinemuz.xpspectra.spectrum.MissingBandPolicy;
import com.github.tinemuz.xpspectra.spectrum.SampledBandSpectrum;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for turning basis-coefficient records into sampled spectra and
 * spectral features.
 *
 * <p>A processor owns the design-matrix and blend-weight caches of one
 * instrument model. Every method handles a single source and is safe to call
 * from many threads at once; batch code is expected to share one processor and
 * isolate per-source failures itself ({@link XpValidationException} marks bad
 * input data).</p>
 */
public final class XpSpectraProcessor {
    private final InstrumentModel model;
    private final DesignMatrixBuilder designMatrices;
    private final ExtremaFinder extremaFinder;
    private final LineFinder lineFinder;

    public XpSpectraProcessor(InstrumentModel model) {
        this.model = model;
        this.designMatrices = new DesignMatrixBuilder(model);
        this.extremaFinder = new ExtremaFinder(model);
        this.lineFinder = new LineFinder(model, extremaFinder);
    }

    /** Processor for the bundled instrument model. */
    public static XpSpectraProcessor withDefaultModel() {
        return new XpSpectraProcessor(InstrumentModel.defaultModel());
    }

    public InstrumentModel model() {
        return model;
    }

    public DesignMatrixBuilder designMatrices() {
        return designMatrices;
    }

    /**
     * Sample one band on a pseudo-wavelength grid (internal calibration).
     *
     * @throws SamplingRangeException if the grid leaves the basis range
     */
    public SampledBandSpectrum convert(
            BasisCoefficientRecord record,
            SamplingGrid pseudoWavelengths,
            boolean truncation,
            boolean withCovariance) {
        BasisConfiguration bases = model.basis(record.basisFunctionId());
        DispersionFunction.validateSamplingRange(bases.range(), pseudoWavelengths, "pseudo-wavelength units");
        DesignMatrix design = designMatrices.pseudoWavelength(record.basisFunctionId(), pseudoWavelengths);
        return BandSampler.sample(record, design, truncation, withCovariance);
    }

    /** {@link #convert} on the default 600-point grid over [0, 60]. */
    public SampledBandSpectrum convert(BasisCoefficientRecord record, boolean truncation, boolean withCovariance) {
        return convert(record, SamplingGrid.DEFAULT_PSEUDO_WAVELENGTH, truncation, withCovariance);
    }

    /**
     * Absolute spectrum of one source on a wavelength grid (external
     * calibration), blending whichever bands are present.
     *
     * @param records the source's records keyed by band; one band may be absent
     * @param policy what to do when only one band is present
     * @throws MissingBandException if no band is present
     * @throws SamplingRangeException if the grid leaves 330-1050 nm
     */
    public MergedSpectrum calibrate(
            Map<Band, BasisCoefficientRecord> records,
            SamplingGrid wavelengthsNm,
            boolean truncation,
            boolean withCovariance,
            MissingBandPolicy policy) {
        if (records.isEmpty()) throw new MissingBandException(Band.BP, Band.RP);
        model.dispersion().validateSamplingRange(wavelengthsNm);
        Map<Band, SampledBandSpectrum> samples = new EnumMap<>(Band.class);
        for (Map.Entry<Band, BasisCoefficientRecord> e : records.entrySet()) {
            BasisCoefficientRecord record = e.getValue();
            if (record.band() != e.getKey()) {
                throw new IllegalArgumentException("Record " + record + " filed under band " + e.getKey().tag());
            }
            DesignMatrix design = designMatrices.absolute(e.getKey(), wavelengthsNm);
            samples.put(e.getKey(), BandSampler.sample(record, design, truncation, withCovariance));
        }
        return BandMerger.merge(samples, designMatrices.blendWeights(wavelengthsNm), policy);
    }

    /** {@link #calibrate} on the default 336-1020 nm grid in 2 nm steps. */
    public MergedSpectrum calibrate(
            Map<Band, BasisCoefficientRecord> records,
            boolean truncation,
            boolean withCovariance,
            MissingBandPolicy policy) {
        return calibrate(records, SamplingGrid.DEFAULT_WAVELENGTH, truncation, withCovariance, policy);
    }

    /** Pseudo-wavelengths of all extrema and inflection points of one band. */
    public ExtremaSet findDerivativeRoots(BasisCoefficientRecord record, boolean truncation) {
        return extremaFinder.roots(record, truncation);
    }

    /** Extrema inside the band's coverage with wavelength, width and kind. */
    public List<Extremum> findExtrema(BasisCoefficientRecord record, boolean truncation) {
        return extremaFinder.extrema(record, truncation);
    }

    /**
     * Catalogue lines found in a source's spectrum, ordered by wavelength.
     *
     * <p>Each present band is searched for the catalogue lines that fall in
     * its coverage after redshifting. Found lines are measured on the band's
     * spectrum over the default pseudo-wavelength grid and on the calibrated
     * spectrum over the default wavelength grid, with the masked-coverage
     * policy when a band is missing.</p>
     *
     * @param redshift source redshift, 0 for stars
     * @throws MissingBandException if no band is present
     */
    public List<SpectralLine> findLines(
            Map<Band, BasisCoefficientRecord> records,
            LineList lines,
            double redshift,
            boolean truncation) {
        MergedSpectrum calibrated = calibrate(records, truncation, false, MissingBandPolicy.MASKED_COVERAGE);
        List<SpectralLine> out = new ArrayList<>();
        for (Map.Entry<Band, BasisCoefficientRecord> e : records.entrySet()) {
            BasisCoefficientRecord record = e.getValue();
            List<LineList.Position> positions = lines.positions(e.getKey(), model.dispersion(), redshift);
            if (positions.isEmpty()) continue;
            SampledBandSpectrum converted = convert(record, truncation, false);
            out.addAll(lineFinder.find(record, positions, converted, calibrated, truncation));
        }
        out.sort(Comparator.comparingDouble(SpectralLine::wavelengthNm));
        return out;
    }

    /** {@link #findLines} with the stellar line list at rest. */
    public List<SpectralLine> findLines(Map<Band, BasisCoefficientRecord> records, boolean truncation) {
        return findLines(records, LineList.STARS, 0.0, truncation);
    }

    /**
     * Every extremum inside each present band's coverage, measured like a
     * catalogue line and ordered by wavelength.
     *
     * @throws MissingBandException if no band is present
     */
    public List<SpectralLine> findAllLines(Map<Band, BasisCoefficientRecord> records, boolean truncation) {
        MergedSpectrum calibrated = calibrate(records, truncation, false, MissingBandPolicy.MASKED_COVERAGE);
        List<SpectralLine> out = new ArrayList<>();
        for (BasisCoefficientRecord record : records.values()) {
            SampledBandSpectrum converted = convert(record, truncation, false);
            out.addAll(lineFinder.findAll(record, converted, calibrated, truncation));
        }
        out.sort(Comparator.comparingDouble(SpectralLine::wavelengthNm));
        return out;
    }
}
