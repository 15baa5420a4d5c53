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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.xpspectra.Band;
import com.github.tinemuz.xpspectra.Fixtures;
import com.github.tinemuz.xpspectra.MissingBandException;
import com.github.tinemuz.xpspectra.SamplingGrid;
import com.github.tinemuz.xpspectra.XpSpectraProcessor;
import com.github.tinemuz.xpspectra.model.DispersionFunction;
import com.github.tinemuz.xpspectra.spectrum.BasisCoefficientRecord;
import com.github.tinemuz.xpspectra.spectrum.MergedSpectrum;
import com.github.tinemuz.xpspectra.spectrum.MissingBandPolicy;
import com.github.tinemuz.xpspectra.spectrum.SampledBandSpectrum;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Runs against the four-basis test model with coefficients 1..4 in both
 * bands; BP then has four extrema inside its coverage and RP two.
 */
class LineFinderTest {

    private static final XpSpectraProcessor PROCESSOR = new XpSpectraProcessor(Fixtures.testModel());
    private static final DispersionFunction DISPERSION = Fixtures.testModel().dispersion();

    private static Map<Band, BasisCoefficientRecord> records(long id, double[] coefficients, Band... bands) {
        Map<Band, BasisCoefficientRecord> out = new EnumMap<>(Band.class);
        for (Band band : bands) out.put(band, Fixtures.diagonalRecord(id, band, coefficients, 0.1, 4));
        return out;
    }

    private static Map<Band, BasisCoefficientRecord> reference(long id) {
        return records(id, new double[] {1, 2, 3, 4}, Band.BP, Band.RP);
    }

    // Second BP extremum, well inside the band and bracketed by inflections
    private static Extremum bpExtremum() {
        return PROCESSOR.findExtrema(reference(1L).get(Band.BP), false).get(1);
    }

    private static LineList single(String name, double wavelengthNm) {
        return LineList.of(List.of(name), new double[] {wavelengthNm});
    }

    private static double interpolate(SamplingGrid grid, double[] values, double x) {
        for (int j = 0; j < grid.size() - 1; j++) {
            if (grid.get(j) <= x && x <= grid.get(j + 1)) {
                double t = (x - grid.get(j)) / (grid.get(j + 1) - grid.get(j));
                return values[j] + t * (values[j + 1] - values[j]);
            }
        }
        throw new AssertionError(x + " outside " + grid);
    }

    private static double medianOfFour(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return 0.5 * (sorted[1] + sorted[2]);
    }

    @Nested
    @DisplayName("Catalogue matching")
    class Matching {

        @Test
        @DisplayName("A catalogue line within one pixel of an extremum is found")
        void withinTolerance() {
            Extremum e = bpExtremum();
            double wl = DISPERSION.pseudoToWavelength(Band.BP, e.pseudoWavelength() + 0.5);
            List<SpectralLine> found = PROCESSOR.findLines(reference(1L), single("near", wl), 0.0, false);
            assertEquals(1, found.size());
            SpectralLine line = found.get(0);
            assertEquals("near", line.name());
            assertEquals(1L, line.sourceId());
            assertEquals(Band.BP, line.band());
            assertEquals(e, line.extremum());
            assertEquals(e.pseudoWavelength() + 0.5, line.cataloguePseudoWavelength(), 1e-9);
            assertEquals(1.0, LineFinder.TOLERANCE);
        }

        @Test
        @DisplayName("A catalogue line further than one pixel is not found")
        void beyondTolerance() {
            Extremum e = bpExtremum();
            double wl = DISPERSION.pseudoToWavelength(Band.BP, e.pseudoWavelength() + 1.5);
            assertTrue(PROCESSOR.findLines(reference(1L), single("far", wl), 0.0, false).isEmpty());
        }

        @Test
        @DisplayName("Redshift moves a rest-frame line onto the extremum")
        void redshifted() {
            Extremum e = bpExtremum();
            LineList rest = single("shifted", e.wavelengthNm() / 1.25);
            List<SpectralLine> found = PROCESSOR.findLines(reference(2L), rest, 0.25, false);
            assertEquals(1, found.size());
            assertEquals(e.pseudoWavelength(), found.get(0).pseudoWavelength(), 1e-12);
            assertEquals(e.pseudoWavelength(), found.get(0).cataloguePseudoWavelength(), 1e-6);
            assertTrue(PROCESSOR.findLines(reference(2L), rest, 0.0, false).isEmpty());
        }

        @Test
        @DisplayName("Results are ordered by wavelength across both bands")
        void ordered() {
            List<Extremum> bp = PROCESSOR.findExtrema(reference(3L).get(Band.BP), false);
            List<Extremum> rp = PROCESSOR.findExtrema(reference(3L).get(Band.RP), false);
            LineList lines = LineList.of(List.of("red", "blue2", "blue0"),
                    new double[] {rp.get(0).wavelengthNm(), bp.get(2).wavelengthNm(), bp.get(0).wavelengthNm()});
            List<SpectralLine> found = PROCESSOR.findLines(reference(3L), lines, 0.0, false);
            assertEquals(List.of("blue0", "blue2", "red"),
                    found.stream().map(SpectralLine::name).collect(Collectors.toList()));
            assertEquals(Band.RP, found.get(2).band());
        }

        @Test
        @DisplayName("A flat spectrum has no lines")
        void flat() {
            Map<Band, BasisCoefficientRecord> flat = records(4L, new double[4], Band.BP, Band.RP);
            assertTrue(PROCESSOR.findLines(flat, LineList.STARS, 0.0, false).isEmpty());
            assertTrue(PROCESSOR.findAllLines(flat, false).isEmpty());
        }

        @Test
        @DisplayName("No band at all fails like calibration")
        void noBand() {
            assertThrows(MissingBandException.class,
                    () -> PROCESSOR.findLines(new EnumMap<>(Band.class), false));
        }
    }

    @Nested
    @DisplayName("Measurements")
    class Measurements {

        @Test
        @DisplayName("Flux, continuum, depth and significance follow the sampled spectra")
        void consistentWithSpectra() {
            Map<Band, BasisCoefficientRecord> records = reference(5L);
            Extremum e = bpExtremum();
            SpectralLine line = PROCESSOR.findLines(records, single("line", e.wavelengthNm()), 0.0, false).get(0);

            MergedSpectrum calibrated =
                    PROCESSOR.calibrate(records, false, false, MissingBandPolicy.MASKED_COVERAGE);
            SampledBandSpectrum converted = PROCESSOR.convert(records.get(Band.BP), false, false);
            double pwl = e.pseudoWavelength();
            double w = e.widthPseudoWavelength();
            assertTrue(Double.isFinite(w) && w > 0.0);
            double[] tests = {pwl - 2 * w, pwl - w, pwl + w, pwl + 2 * w};

            double flux = interpolate(calibrated.grid(), calibrated.flux(), e.wavelengthNm());
            double[] around = new double[4];
            for (int i = 0; i < 4; i++) {
                around[i] = interpolate(calibrated.grid(), calibrated.flux(),
                        DISPERSION.pseudoToWavelength(Band.BP, tests[i]));
            }
            double scale = Math.abs(flux) + Math.abs(medianOfFour(around));
            LineMeasurement absolute = line.absolute();
            assertEquals(flux, absolute.flux(), 1e-9 * scale);
            assertEquals(medianOfFour(around), absolute.continuum(), 1e-9 * scale);
            assertEquals(absolute.flux() - absolute.continuum(), absolute.depth(), 0.0);
            double error = interpolate(calibrated.grid(), calibrated.error(), e.wavelengthNm());
            assertEquals(Math.abs(absolute.depth()) / error, absolute.significance(),
                    1e-9 * absolute.significance());

            double internalFlux = interpolate(converted.grid(), converted.flux(), pwl);
            double[] internalAround = new double[4];
            for (int i = 0; i < 4; i++) internalAround[i] = interpolate(converted.grid(), converted.flux(), tests[i]);
            LineMeasurement internal = line.internal();
            assertEquals(internalFlux, internal.flux(), 1e-9);
            assertEquals(medianOfFour(internalAround), internal.continuum(), 1e-9);
            assertEquals(internal.flux() - internal.continuum(), internal.depth(), 0.0);
            assertTrue(internal.significance() > 0.0);
            assertEquals(e.widthNm(), line.widthNm());
        }
    }

    @Nested
    @DisplayName("All extrema")
    class AllExtrema {

        @Test
        @DisplayName("Every extremum in coverage is reported and named after band and wavelength")
        void named() {
            Map<Band, BasisCoefficientRecord> records = reference(7L);
            int expected = PROCESSOR.findExtrema(records.get(Band.BP), false).size()
                    + PROCESSOR.findExtrema(records.get(Band.RP), false).size();
            List<SpectralLine> all = PROCESSOR.findAllLines(records, false);
            assertEquals(expected, all.size());
            double previous = Double.NEGATIVE_INFINITY;
            for (SpectralLine line : all) {
                assertEquals(line.band().tag() + "_" + (int) line.wavelengthNm(), line.name());
                assertEquals(line.pseudoWavelength(), line.cataloguePseudoWavelength());
                assertTrue(line.wavelengthNm() >= previous);
                previous = line.wavelengthNm();
            }
        }

        @Test
        @DisplayName("Only the bands present are searched")
        void singleBand() {
            Map<Band, BasisCoefficientRecord> bpOnly = records(8L, new double[] {1, 2, 3, 4}, Band.BP);
            List<SpectralLine> all = PROCESSOR.findAllLines(bpOnly, false);
            assertEquals(4, all.size());
            assertTrue(all.stream().allMatch(l -> l.band() == Band.BP));
        }
    }

    @Test
    @DisplayName("Spectra of another source are rejected")
    void mismatchedSource() {
        LineFinder finder = new LineFinder(Fixtures.testModel(), new ExtremaFinder(Fixtures.testModel()));
        BasisCoefficientRecord record = reference(9L).get(Band.BP);
        SampledBandSpectrum other = PROCESSOR.convert(reference(10L).get(Band.BP), false, false);
        MergedSpectrum calibrated = PROCESSOR.calibrate(reference(9L), false, false, MissingBandPolicy.MASKED_COVERAGE);
        List<LineList.Position> positions = LineList.STARS.positions(Band.BP, DISPERSION, 0.0);
        assertThrows(IllegalArgumentException.class,
                () -> finder.find(record, positions, other, calibrated, false));
    }
}
