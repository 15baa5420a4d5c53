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

import java.util.Arrays;

/**
 * Immutable abscissa on which spectra are sampled, either in pseudo-wavelength
 * or in nanometres depending on the caller.
 *
 * <p>Equality is value based, so a grid can be used directly as (part of) a
 * cache key for design matrices and blend weights.</p>
 */
public final class SamplingGrid {
    /** Default pseudo-wavelength grid for per-band conversion. */
    public static final SamplingGrid DEFAULT_PSEUDO_WAVELENGTH = linspace(0.0, 60.0, 600);

    /** Default wavelength grid (nm) for absolute calibration. */
    public static final SamplingGrid DEFAULT_WAVELENGTH = arange(336.0, 1020.0, 2.0);

    private final double[] positions;
    private final int hash;

    private SamplingGrid(double[] positions) {
        this.positions = positions;
        this.hash = Arrays.hashCode(positions);
    }

    /** Grid holding a copy of the given positions. */
    public static SamplingGrid of(double... positions) {
        if (positions == null) throw new SamplingRangeException("Sampling can't be null.");
        return new SamplingGrid(positions.clone());
    }

    /** {@code count} evenly spaced points from {@code start} to {@code stop}, both included. */
    public static SamplingGrid linspace(double start, double stop, int count) {
        if (count < 1) throw new SamplingRangeException("Sampling must contain at least one point.");
        double[] p = new double[count];
        if (count == 1) {
            p[0] = start;
            return new SamplingGrid(p);
        }
        double step = (stop - start) / (count - 1);
        for (int i = 0; i < count; i++) p[i] = start + i * step;
        p[count - 1] = stop;
        return new SamplingGrid(p);
    }

    /** Points {@code start, start+step, ...} up to and including {@code stop} when it falls on the step. */
    public static SamplingGrid arange(double start, double stop, double step) {
        if (!(step > 0.0)) throw new SamplingRangeException("Step must be positive: " + step);
        int count = (int) Math.floor((stop - start) / step + 1e-9) + 1;
        if (count < 1) throw new SamplingRangeException("Sampling must contain at least one point.");
        double[] p = new double[count];
        for (int i = 0; i < count; i++) p[i] = start + i * step;
        return new SamplingGrid(p);
    }

    public int size() {
        return positions.length;
    }

    public double get(int index) {
        return positions[index];
    }

    public double first() {
        return positions[0];
    }

    public double last() {
        return positions[positions.length - 1];
    }

    /** A copy of the positions. */
    public double[] toArray() {
        return positions.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SamplingGrid)) return false;
        SamplingGrid other = (SamplingGrid) o;
        return hash == other.hash && Arrays.equals(positions, other.positions);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (positions.length == 0) return "SamplingGrid[]";
        return "SamplingGrid[" + positions.length + " points, " + first() + " .. " + last() + "]";
    }
}
