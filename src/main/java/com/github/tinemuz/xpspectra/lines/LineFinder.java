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
import com.github.tinemuz.xpspectra.model.DispersionFunction;
import com.github.tinemuz.xpspectra.model.InstrumentModel;
import com.github.tinemuz.xpspectra.model.PiecewiseLinearFunction;
import com.github.tinemuz.xpspectra.spectrum.BasisCoefficientRecord;
import com.github.tinemuz.xpspectra.spectrum.MergedSpectrum;
import com.github.tinemuz.xpspectra.spectrum.SampledBandSpectrum;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Matches catalogue lines to spectral extrema and measures them.
 *
 * <p>A catalogue line is found when the nearest first-derivative root lies
 * within {@link #TOLERANCE} pseudo-wavelength units of it. Each found line is
 * measured on two sampled spectra of the same source: the pseudo-wavelength
 * spectrum of its band and the calibrated (merged) absolute spectrum. Both
 * are interpolated linearly between samples and extended linearly beyond the
 * grid. The continuum is the median flux at one and two line widths on either
 * side of the line.</p>
 */
public final class LineFinder {
    /** Largest distance, in pseudo-wavelength pixels, between a catalogue line and its extremum. */
    public static final double TOLERANCE = 1.0;

    private final InstrumentModel model;
    private final ExtremaFinder extremaFinder;

    public LineFinder(InstrumentModel model, ExtremaFinder extremaFinder) {
        this.model = model;
        this.extremaFinder = extremaFinder;
    }

    /**
     * Catalogue lines found in one band, in catalogue order.
     *
     * @param lines catalogue positions in the record's band
     * @param converted the record sampled on a pseudo-wavelength grid
     * @param calibrated the source's calibrated spectrum
     * @throws IllegalArgumentException if the spectra belong to another source or band
     */
    public List<SpectralLine> find(
            BasisCoefficientRecord record,
            List<LineList.Position> lines,
            SampledBandSpectrum converted,
            MergedSpectrum calibrated,
            boolean truncation) {
        requireSameSource(record, converted, calibrated);
        if (lines.isEmpty()) return Collections.emptyList();
        List<Extremum> extrema = extremaFinder.allExtrema(record, truncation);
        if (extrema.isEmpty()) return Collections.emptyList();

        Spectra spectra = new Spectra(converted, calibrated);
        List<SpectralLine> out = new ArrayList<>();
        for (LineList.Position line : lines) {
            Extremum nearest = extrema.get(0);
            for (Extremum e : extrema) {
                if (Math.abs(e.pseudoWavelength() - line.pseudoWavelength())
                        < Math.abs(nearest.pseudoWavelength() - line.pseudoWavelength())) {
                    nearest = e;
                }
            }
            if (Math.abs(nearest.pseudoWavelength() - line.pseudoWavelength()) < TOLERANCE) {
                out.add(measure(record.sourceId(), line.name(), line.pseudoWavelength(), nearest, spectra));
            }
        }
        return out;
    }

    /**
     * Every extremum inside the band's coverage, measured and named after the
     * band and its integer wavelength (e.g. {@code bp_486}).
     */
    public List<SpectralLine> findAll(
            BasisCoefficientRecord record,
            SampledBandSpectrum converted,
            MergedSpectrum calibrated,
            boolean truncation) {
        requireSameSource(record, converted, calibrated);
        List<Extremum> extrema = extremaFinder.extrema(record, truncation);
        if (extrema.isEmpty()) return Collections.emptyList();
        Spectra spectra = new Spectra(converted, calibrated);
        List<SpectralLine> out = new ArrayList<>(extrema.size());
        for (Extremum e : extrema) {
            String name = record.band().tag() + "_" + (int) e.wavelengthNm();
            out.add(measure(record.sourceId(), name, e.pseudoWavelength(), e, spectra));
        }
        return out;
    }

    private SpectralLine measure(long sourceId, String name, double catalogue, Extremum e, Spectra spectra) {
        Band band = e.band();
        DispersionFunction dispersion = model.dispersion();
        double pwl = e.pseudoWavelength();
        double wl = e.wavelengthNm();
        double w = e.widthPseudoWavelength();

        double continuum = Double.NaN;
        double internalContinuum = Double.NaN;
        if (!Double.isNaN(w)) {
            double[] tests = {pwl - 2.0 * w, pwl - w, pwl + w, pwl + 2.0 * w};
            internalContinuum = median(spectra.internalFlux.value(tests));
            continuum = median(spectra.absoluteFlux.value(dispersion.pseudoToWavelength(band, tests)));
        }
        LineMeasurement absolute = measurement(
                spectra.absoluteFlux.value(wl), continuum, spectra.absoluteError.value(wl));
        LineMeasurement internal = measurement(
                spectra.internalFlux.value(pwl), internalContinuum, spectra.internalError.value(pwl));
        return new SpectralLine(sourceId, name, catalogue, e, absolute, internal);
    }

    private static LineMeasurement measurement(double flux, double continuum, double error) {
        double depth = flux - continuum;
        return new LineMeasurement(flux, continuum, depth, Math.abs(depth) / error);
    }

    // NaN if any sample is NaN
    private static double median(double[] values) {
        for (double v : values) {
            if (Double.isNaN(v)) return Double.NaN;
        }
        return new Median().evaluate(values);
    }

    private static void requireSameSource(
            BasisCoefficientRecord record, SampledBandSpectrum converted, MergedSpectrum calibrated) {
        if (converted.sourceId() != record.sourceId() || calibrated.sourceId() != record.sourceId()
                || converted.band() != record.band()) {
            throw new IllegalArgumentException("Spectra of source " + converted.sourceId() + " "
                    + converted.band().tag() + " and " + calibrated.sourceId() + " do not belong to " + record);
        }
    }

    private static final class Spectra {
        final PiecewiseLinearFunction internalFlux;
        final PiecewiseLinearFunction internalError;
        final PiecewiseLinearFunction absoluteFlux;
        final PiecewiseLinearFunction absoluteError;

        Spectra(SampledBandSpectrum converted, MergedSpectrum calibrated) {
            double[] pwl = converted.grid().toArray();
            double[] wl = calibrated.grid().toArray();
            this.internalFlux = new PiecewiseLinearFunction(pwl, converted.flux());
            this.internalError = new PiecewiseLinearFunction(pwl, converted.error());
            this.absoluteFlux = new PiecewiseLinearFunction(wl, calibrated.flux());
            this.absoluteError = new PiecewiseLinearFunction(wl, calibrated.error());
        }
    }
}
