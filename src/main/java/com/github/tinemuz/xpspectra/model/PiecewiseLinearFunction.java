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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Piecewise-linear function through tabulated knots, extended linearly beyond
 * the first and last knot.
 *
 * <p>The abscissae must be strictly monotonic, either increasing or
 * decreasing; a decreasing table is reversed before interpolation.</p>
 */
public final class PiecewiseLinearFunction {
    private final PolynomialSplineFunction inside;
    private final double x0;
    private final double xn;
    private final double y0;
    private final double yn;
    private final double slopeLow;
    private final double slopeHigh;

    /**
     * @throws IllegalArgumentException if the columns differ in length, hold
     *     fewer than two knots, or the abscissae are not strictly monotonic
     */
    public PiecewiseLinearFunction(double[] x, double[] y) {
        if (x.length < 2 || x.length != y.length) {
            throw new IllegalArgumentException("Need at least two matching knots, got "
                    + x.length + " and " + y.length);
        }
        int n = x.length;
        double[] xs = x.clone();
        double[] ys = y.clone();
        if (xs[n - 1] < xs[0]) {
            reverse(xs);
            reverse(ys);
        }
        for (int i = 1; i < n; i++) {
            if (!(xs[i] > xs[i - 1])) {
                throw new IllegalArgumentException("Knots are not strictly monotonic at index " + i
                        + " (" + x[i - 1] + ", " + x[i] + ")");
            }
        }
        this.inside = new LinearInterpolator().interpolate(xs, ys);
        this.x0 = xs[0];
        this.xn = xs[n - 1];
        this.y0 = ys[0];
        this.yn = ys[n - 1];
        this.slopeLow = (ys[1] - ys[0]) / (xs[1] - xs[0]);
        this.slopeHigh = (ys[n - 1] - ys[n - 2]) / (xs[n - 1] - xs[n - 2]);
    }

    public double value(double x) {
        if (x < x0) return y0 + (x - x0) * slopeLow;
        if (x > xn) return yn + (x - xn) * slopeHigh;
        return inside.value(x);
    }

    public double[] value(double[] xs) {
        double[] out = new double[xs.length];
        for (int i = 0; i < out.length; i++) out[i] = value(xs[i]);
        return out;
    }

    private static void reverse(double[] a) {
        for (int i = 0, j = a.length - 1; i < j; i++, j--) {
            double t = a[i];
            a[i] = a[j];
            a[j] = t;
        }
    }
}
