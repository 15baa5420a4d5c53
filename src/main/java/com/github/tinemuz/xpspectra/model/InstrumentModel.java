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
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Versioned instrument model: dispersion relation, internal basis sets and the
 * external-calibration model of both bands.
 *
 * <p>The model is read from three classpath resources sharing a prefix
 * (<code>&lt;prefix&gt;dispersion.txt</code>, <code>&lt;prefix&gt;bases.txt</code>
 * and <code>&lt;prefix&gt;calibration.txt</code>). The files are plain text
 * tables: blank lines and lines starting with <code>#</code> are ignored.
 * A loaded model is immutable and can be shared by any number of threads.</p>
 */
public final class InstrumentModel {
    private static final Logger log = LoggerFactory.getLogger(InstrumentModel.class);
    /** Resource prefix of the bundled example model. */
    public static final String DEFAULT_PREFIX = "xp-";

    private final String prefix;
    private final DispersionFunction dispersion;
    private final Map<Integer, BasisConfiguration> bases;
    private final Map<Band, CalibrationModel> calibration;

    private InstrumentModel(
            String prefix,
            DispersionFunction dispersion,
            Map<Integer, BasisConfiguration> bases,
            Map<Band, CalibrationModel> calibration) {
        this.prefix = prefix;
        this.dispersion = dispersion;
        this.bases = Collections.unmodifiableMap(bases);
        this.calibration = Collections.unmodifiableMap(calibration);
    }

    /** The bundled model, loaded on first use. */
    public static InstrumentModel defaultModel() {
        return DefaultHolder.MODEL;
    }

    /**
     * Load a model from classpath resources with the given name prefix.
     *
     * @throws IllegalStateException if a resource is missing or malformed
     */
    public static InstrumentModel load(String prefix) {
        DispersionFunction dispersion = loadDispersion(prefix + "dispersion.txt");
        Map<Integer, BasisConfiguration> bases = loadBases(prefix + "bases.txt");
        Map<Band, CalibrationModel> calibration = loadCalibration(prefix + "calibration.txt", bases);
        log.info("Loaded instrument model '{}': {} basis sets, calibration for {}",
                prefix, bases.size(), calibration.keySet());
        return new InstrumentModel(prefix, dispersion, bases, calibration);
    }

    public String prefix() {
        return prefix;
    }

    public DispersionFunction dispersion() {
        return dispersion;
    }

    /**
     * Basis set with the given id.
     *
     * @throws IllegalArgumentException if the model does not define it
     */
    public BasisConfiguration basis(int basisFunctionId) {
        BasisConfiguration config = bases.get(basisFunctionId);
        if (config == null) {
            throw new IllegalArgumentException("Unknown basis function id " + basisFunctionId);
        }
        return config;
    }

    /** Default basis set of a band. */
    public BasisConfiguration basis(Band band) {
        return basis(band.basisFunctionId());
    }

    public CalibrationModel calibration(Band band) {
        CalibrationModel model = calibration.get(band);
        if (model == null) {
            throw new IllegalStateException("No calibration model for band " + band.tag());
        }
        return model;
    }

    private static DispersionFunction loadDispersion(String resource) {
        List<Double> wl = new ArrayList<>();
        List<Double> bp = new ArrayList<>();
        List<Double> rp = new ArrayList<>();
        try (BufferedReader br = open(resource)) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#") || line.startsWith("wl_nm")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length != 3) {
                    throw new IllegalStateException("Malformed dispersion row: '" + line + "'");
                }
                wl.add(Double.parseDouble(toks[0]));
                bp.add(Double.parseDouble(toks[1]));
                rp.add(Double.parseDouble(toks[2]));
            }
        } catch (IOException e) {
            log.error("Failed to read dispersion table {}", resource, e);
            throw new IllegalStateException("Failed to read dispersion table " + resource, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse dispersion table {}", resource, e);
            throw new IllegalStateException("Failed to parse dispersion table " + resource, e);
        }
        Map<Band, double[][]> tables = new EnumMap<>(Band.class);
        tables.put(Band.BP, column(wl, bp));
        tables.put(Band.RP, column(wl, rp));
        return new DispersionFunction(tables);
    }

    // Keep only rows where the band has a value (NaN marks missing entries)
    private static double[][] column(List<Double> wl, List<Double> pwl) {
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < wl.size(); i++) {
            if (!Double.isNaN(pwl.get(i))) rows.add(new double[] {wl.get(i), pwl.get(i)});
        }
        double[][] out = new double[2][rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            out[0][i] = rows.get(i)[0];
            out[1][i] = rows.get(i)[1];
        }
        return out;
    }

    private static Map<Integer, BasisConfiguration> loadBases(String resource) {
        Map<Integer, BasisConfiguration> out = new HashMap<>();
        try (BufferedReader br = open(resource)) {
            String line;
            Integer id = null;
            Band band = null;
            int dimension = -1;
            Interval range = null;
            Interval normalized = null;
            double[][] transform = null;
            while ((line = nextContentLine(br)) != null) {
                String[] toks = line.split("\\s+");
                switch (toks[0]) {
                    case "basis":
                        id = Integer.parseInt(toks[1]);
                        band = Band.fromTag(toks[2]);
                        dimension = -1;
                        range = null;
                        normalized = null;
                        transform = null;
                        break;
                    case "dimension":
                        dimension = Integer.parseInt(toks[1]);
                        break;
                    case "range":
                        range = new Interval(Double.parseDouble(toks[1]), Double.parseDouble(toks[2]));
                        break;
                    case "normalizedRange":
                        normalized = new Interval(Double.parseDouble(toks[1]), Double.parseDouble(toks[2]));
                        break;
                    case "transform":
                        transform = readMatrix(br, dimension, dimension);
                        break;
                    case "end":
                        if (id == null || band == null || range == null || normalized == null
                                || transform == null) {
                            throw new IllegalStateException("Incomplete basis block before 'end'");
                        }
                        out.put(id, new BasisConfiguration(id, band, range, normalized, transform));
                        id = null;
                        break;
                    default:
                        throw new IllegalStateException("Unexpected line in bases file: '" + line + "'");
                }
            }
        } catch (IOException e) {
            log.error("Failed to read basis definitions {}", resource, e);
            throw new IllegalStateException("Failed to read basis definitions " + resource, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse basis definitions {}", resource, e);
            throw new IllegalStateException("Failed to parse basis definitions " + resource, e);
        }
        if (out.isEmpty()) {
            throw new IllegalStateException("No basis definitions found in " + resource);
        }
        return out;
    }

    private static Map<Band, CalibrationModel> loadCalibration(
            String resource, Map<Integer, BasisConfiguration> bases) {
        Map<Band, CalibrationModel> out = new EnumMap<>(Band.class);
        try (BufferedReader br = open(resource)) {
            String line;
            Band band = null;
            BasisConfiguration basis = null;
            double[][] inverse = null;
            List<double[]> response = new ArrayList<>();
            boolean inResponse = false;
            while ((line = nextContentLine(br)) != null) {
                String[] toks = line.split("\\s+");
                if (inResponse && !"end".equals(toks[0])) {
                    response.add(new double[] {Double.parseDouble(toks[0]), Double.parseDouble(toks[1])});
                    continue;
                }
                switch (toks[0]) {
                    case "calibration":
                        band = Band.fromTag(toks[1]);
                        basis = null;
                        inverse = null;
                        response.clear();
                        break;
                    case "basis":
                        basis = bases.get(Integer.parseInt(toks[1]));
                        if (basis == null) {
                            throw new IllegalStateException("Calibration refers to unknown basis " + toks[1]);
                        }
                        break;
                    case "inverse":
                        if (basis == null) throw new IllegalStateException("'inverse' before 'basis'");
                        if ("identity".equals(toks[1])) {
                            inverse = identity(basis.dimension());
                        } else {
                            inverse = readMatrix(br, Integer.parseInt(toks[1]), Integer.parseInt(toks[2]));
                        }
                        break;
                    case "response":
                        inResponse = true;
                        break;
                    case "end":
                        if (band == null || basis == null || inverse == null || response.size() < 3) {
                            throw new IllegalStateException("Incomplete calibration block before 'end'");
                        }
                        double[] wl = new double[response.size()];
                        double[] r = new double[response.size()];
                        for (int i = 0; i < wl.length; i++) {
                            wl[i] = response.get(i)[0];
                            r[i] = response.get(i)[1];
                        }
                        out.put(band, new CalibrationModel(band, basis, inverse, wl, r));
                        inResponse = false;
                        break;
                    default:
                        throw new IllegalStateException("Unexpected line in calibration file: '" + line + "'");
                }
            }
        } catch (IOException e) {
            log.error("Failed to read calibration model {}", resource, e);
            throw new IllegalStateException("Failed to read calibration model " + resource, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse calibration model {}", resource, e);
            throw new IllegalStateException("Failed to parse calibration model " + resource, e);
        }
        return out;
    }

    private static BufferedReader open(String resource) {
        InputStream in = InstrumentModel.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Instrument model resource '{}' not found on classpath", resource);
            throw new IllegalStateException(
                    "Instrument model resource '" + resource + "' not found on classpath");
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    private static String nextContentLine(BufferedReader br) throws IOException {
        String line;
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (!line.isEmpty() && !line.startsWith("#")) return line;
        }
        return null;
    }

    private static double[][] readMatrix(BufferedReader br, int rows, int columns) throws IOException {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalStateException("Matrix size must be declared before its rows");
        }
        double[][] m = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            String line = nextContentLine(br);
            if (line == null) throw new IllegalStateException("Matrix truncated at row " + i);
            String[] toks = line.split("\\s+");
            if (toks.length != columns) {
                throw new IllegalStateException(
                        "Matrix row " + i + " has " + toks.length + " values, expected " + columns);
            }
            for (int j = 0; j < columns; j++) m[i][j] = Double.parseDouble(toks[j]);
        }
        return m;
    }

    private static double[][] identity(int n) {
        double[][] m = new double[n][n];
        for (int i = 0; i < n; i++) m[i][i] = 1.0;
        return m;
    }

    private static final class DefaultHolder {
        static final InstrumentModel MODEL = load(DEFAULT_PREFIX);
    }
}
