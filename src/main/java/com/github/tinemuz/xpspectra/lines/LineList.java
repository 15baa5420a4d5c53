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
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named spectral lines at rest-frame wavelengths (nm), to be looked for among
 * the extrema of a spectrum.
 *
 * <p>Two built-in lists are provided, one for stars and one for quasars.
 * Custom lists come from {@link #of} or from a whitespace-separated text file
 * with one {@code wavelength name} pair per row.</p>
 */
public final class LineList {
    private static final Logger log = LoggerFactory.getLogger(LineList.class);

    /** Balmer and helium lines for stellar spectra. */
    public static final LineList STARS = of(
            List.of("H_beta", "H_alpha", "He I_1", "He I_2", "He I_3"),
            new double[] {486.268, 656.461, 447.3, 587.7, 706.7});

    /** Broad emission lines of quasars, meant to be redshifted. */
    public static final LineList QUASARS = of(
            List.of("Ly_alpha", "C IV", "C III]", "Mg II", "H_beta", "H_alpha"),
            new double[] {121.524, 154.948, 190.8734, 279.9117, 486.268, 656.461});

    private final List<String> names;
    private final double[] restWavelengthsNm;

    private LineList(List<String> names, double[] restWavelengthsNm) {
        this.names = names;
        this.restWavelengthsNm = restWavelengthsNm;
    }

    /**
     * List from matching names and rest wavelengths.
     *
     * @throws IllegalArgumentException if the lengths differ or a wavelength is
     *     not a positive finite number
     */
    public static LineList of(List<String> names, double[] restWavelengthsNm) {
        if (names.size() != restWavelengthsNm.length) {
            throw new IllegalArgumentException("Got " + names.size() + " line names but "
                    + restWavelengthsNm.length + " wavelengths");
        }
        for (int i = 0; i < restWavelengthsNm.length; i++) {
            double wl = restWavelengthsNm[i];
            if (!(wl > 0.0) || Double.isInfinite(wl)) {
                throw new IllegalArgumentException("Line " + names.get(i) + " has wavelength " + wl);
            }
        }
        return new LineList(List.copyOf(names), restWavelengthsNm.clone());
    }

    /**
     * Read a list file: blank lines and lines starting with '#' are skipped,
     * every other row is a wavelength in nm followed by the line name.
     *
     * @throws IllegalStateException if the file cannot be read or parsed
     */
    public static LineList read(Path file) {
        List<String> names = new ArrayList<>();
        List<Double> wavelengths = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+", 2);
                if (toks.length != 2) {
                    throw new IllegalStateException("Malformed line list row: '" + line + "'");
                }
                wavelengths.add(Double.parseDouble(toks[0]));
                names.add(toks[1].trim());
            }
        } catch (IOException e) {
            log.error("Failed to read line list {}", file, e);
            throw new IllegalStateException("Failed to read line list " + file, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse line list {}", file, e);
            throw new IllegalStateException("Failed to parse line list " + file, e);
        }
        double[] wl = new double[wavelengths.size()];
        for (int i = 0; i < wl.length; i++) wl[i] = wavelengths.get(i);
        log.debug("Read {} lines from {}", wl.length, file);
        return of(names, wl);
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return names;
    }

    public double[] restWavelengthsNm() {
        return restWavelengthsNm.clone();
    }

    /**
     * Lines redshifted by {@code z} that fall strictly inside the band's
     * wavelength coverage, in list order, with their pseudo-wavelength.
     *
     * @throws IllegalArgumentException if the redshift is not finite or is at
     *     most -1
     */
    public List<Position> positions(Band band, DispersionFunction dispersion, double redshift) {
        if (!(redshift > -1.0) || Double.isInfinite(redshift)) {
            throw new IllegalArgumentException("Redshift must be finite and greater than -1, got " + redshift);
        }
        List<Position> out = new ArrayList<>();
        for (int i = 0; i < restWavelengthsNm.length; i++) {
            double wl = restWavelengthsNm[i] * (1.0 + redshift);
            if (wl > band.wavelengthLowNm() && wl < band.wavelengthHighNm()) {
                out.add(new Position(names.get(i), wl, dispersion.wavelengthToPseudo(band, wl)));
            }
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "LineList" + names + Arrays.toString(restWavelengthsNm);
    }

    /**
     * A catalogue line placed in one band.
     *
     * @param name line name
     * @param wavelengthNm observed (redshifted) wavelength
     * @param pseudoWavelength the same position in pseudo-wavelength
     */
    public record Position(String name, double wavelengthNm, double pseudoWavelength) {}
}
