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
import com.github.tinemuz.xpspectra.basis.HermiteFunctions;
import com.github.tinemuz.xpspectra.model.BasisConfiguration;
import com.github.tinemuz.xpspectra.model.DispersionFunction;
import com.github.tinemuz.xpspectra.model.InstrumentModel;
import com.github.tinemuz.xpspectra.model.Interval;
import com.github.tinemuz.xpspectra.spectrum.BasisCoefficientRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates spectral extrema directly from basis coefficients, without sampling.
 *
 * <p>Sources whose derivative has no usable companion matrix get empty root
 * sets. Each distinct reason is logged as a warning once per finder and at
 * debug level afterwards.</p>
 */
public final class ExtremaFinder {
    private static final Logger log = LoggerFactory.getLogger(ExtremaFinder.class);

    private final InstrumentModel model;
    private final Set<String> reported = ConcurrentHashMap.newKeySet();

    public ExtremaFinder(InstrumentModel model) {
        this.model = model;
    }

    /**
     * All real derivative roots of a record, mapped to pseudo-wavelength.
     *
     * @throws IllegalArgumentException if the record does not match its basis set
     */
    public ExtremaSet roots(BasisCoefficientRecord record, boolean truncation) {
        BasisConfiguration bases = model.basis(record.basisFunctionId());
        HermiteDerivativeRoots roots = rootsOf(record, bases, truncation);
        return new ExtremaSet(record.sourceId(), record.band(),
                toPseudoWavelength(bases, roots.firstDerivativeRoots()),
                toPseudoWavelength(bases, roots.secondDerivativeRoots()));
    }

    /**
     * Extrema inside the band's pseudo-wavelength coverage, ascending, with
     * position in nm, width and kind.
     */
    public List<Extremum> extrema(BasisCoefficientRecord record, boolean truncation) {
        return describe(record, truncation, true);
    }

    /** Every extremum, including those outside the band's coverage. */
    List<Extremum> allExtrema(BasisCoefficientRecord record, boolean truncation) {
        return describe(record, truncation, false);
    }

    private List<Extremum> describe(BasisCoefficientRecord record, boolean truncation, boolean withinCoverage) {
        BasisConfiguration bases = model.basis(record.basisFunctionId());
        HermiteDerivativeRoots roots = rootsOf(record, bases, truncation);
        double[] extrema = toPseudoWavelength(bases, roots.firstDerivativeRoots());
        if (extrema.length == 0) return Collections.emptyList();
        double[] inflections = toPseudoWavelength(bases, roots.secondDerivativeRoots());
        double[] curvature = roots.secondDerivativeCoefficients();

        Band band = record.band();
        DispersionFunction dispersion = model.dispersion();
        Interval coverage = dispersion.pseudoWavelengthRange(band);
        List<Extremum> out = new ArrayList<>();
        for (double pwl : extrema) {
            if (withinCoverage && !coverage.containsExclusive(pwl)) continue;
            double below = Double.NaN;
            double above = Double.NaN;
            for (double r : inflections) {
                if (r < pwl) below = r;
                if (r > pwl) {
                    above = r;
                    break;
                }
            }
            double widthPwl = Double.NaN;
            double widthNm = Double.NaN;
            if (!Double.isNaN(below) && !Double.isNaN(above)) {
                widthPwl = above - below;
                widthNm = Math.abs(dispersion.pseudoToWavelength(band, above)
                        - dispersion.pseudoToWavelength(band, below));
            }
            double second = HermiteFunctions.series(curvature, bases.toNormalized(pwl));
            Extremum.Kind kind = second < 0.0 ? Extremum.Kind.MAXIMUM : Extremum.Kind.MINIMUM;
            out.add(new Extremum(band, pwl, dispersion.pseudoToWavelength(band, pwl), widthPwl, widthNm, kind));
        }
        return out;
    }

    /** Distinct degeneracy reasons reported so far. */
    int reportedDegeneracies() {
        return reported.size();
    }

    private HermiteDerivativeRoots rootsOf(
            BasisCoefficientRecord record, BasisConfiguration bases, boolean truncation) {
        if (record.nParameters() != bases.dimension()) {
            throw new IllegalArgumentException("Record " + record + " does not match " + bases);
        }
        return new HermiteDerivativeRoots(bases.transformation(), bases.dimension(),
                record.activeBases(truncation), record.coefficients(),
                reason -> reportDegenerate(record, reason));
    }

    private void reportDegenerate(BasisCoefficientRecord record, String reason) {
        String key = record.band().tag() + ": " + reason;
        if (reported.add(key)) {
            log.warn("No roots for {} (source {}), reported as empty", key, record.sourceId());
        } else {
            log.debug("No roots for {} (source {})", key, record.sourceId());
        }
    }

    private static double[] toPseudoWavelength(BasisConfiguration bases, double[] normalized) {
        double[] out = new double[normalized.length];
        for (int i = 0; i < out.length; i++) out[i] = bases.toPseudoWavelength(normalized[i]);
        return out;
    }
}
