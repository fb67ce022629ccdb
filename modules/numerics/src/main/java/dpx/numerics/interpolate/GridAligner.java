//******************************************************************************
//
// Title:       Diffraction Pattern X.
// Description: Diffraction Pattern X - Processing of 1-D X-ray Diffraction Patterns.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2020.
//
// This file is part of Diffraction Pattern X.
//
// Diffraction Pattern X is free software; you can redistribute it and/or modify
// it under the terms of the GNU General Public License version 3 as published
// by the Free Software Foundation.
//
// Diffraction Pattern X is distributed in the hope that it will be useful, but
// WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
// FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Diffraction Pattern X; if not, write to the Free Software Foundation, Inc.,
// 59 Temple Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
//******************************************************************************

package dpx.numerics.interpolate;

import static java.lang.String.format;
import static java.util.Arrays.copyOf;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * The GridAligner class brings two sampled curves onto a common grid.
 * <p>
 * When both grids are identical the inputs are passed through untouched.
 * Otherwise the second curve is interpolated onto the points of the first
 * curve that fall inside the closed x-range of the second curve. Points of
 * the first curve are never resampled, and the second curve is never
 * extrapolated.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public final class GridAligner {

    private static final Logger logger = Logger.getLogger(GridAligner.class.getName());

    private GridAligner() {
    }

    /**
     * Check whether two grids are element-wise identical.
     *
     * @param xA first grid.
     * @param xB second grid.
     * @return true if both grids have the same length and values.
     */
    public static boolean sameGrid(double[] xA, double[] xB) {
        return Arrays.equals(xA, xB);
    }

    /**
     * Align curve B onto the grid of curve A.
     *
     * @param xA   grid of curve A.
     * @param yA   values of curve A.
     * @param xB   grid of curve B (strictly monotonic).
     * @param yB   values of curve B.
     * @param kind interpolant used for curve B.
     * @param name name reported if the domains do not overlap.
     * @return the common grid with both curves evaluated on it.
     * @throws RangeOverlapException if no point of A lies within the range of B.
     */
    public static AlignedSeries align(double[] xA, double[] yA, double[] xB, double[] yB,
                                      InterpolationKind kind, String name) {
        if (xA.length != yA.length || xB.length != yB.length) {
            throw new IllegalArgumentException(format(" Curve %s has x and y arrays of unequal length.", name));
        }
        if (sameGrid(xA, xB)) {
            return new AlignedSeries(xA, yA, yB);
        }
        if (xB.length == 0) {
            throw new RangeOverlapException(name);
        }

        double xMin = xB[0];
        double xMax = xB[0];
        for (double v : xB) {
            xMin = min(xMin, v);
            xMax = max(xMax, v);
        }

        int n = 0;
        double[] x = new double[xA.length];
        double[] y = new double[xA.length];
        for (int i = 0; i < xA.length; i++) {
            if (xA[i] >= xMin && xA[i] <= xMax) {
                x[n] = xA[i];
                y[n] = yA[i];
                n++;
            }
        }
        if (n == 0) {
            throw new RangeOverlapException(name);
        }
        x = copyOf(x, n);
        y = copyOf(y, n);

        UnivariateFunction function = interpolant(xB, yB, kind);
        double[] yOnGrid = new double[n];
        for (int i = 0; i < n; i++) {
            yOnGrid[i] = function.value(x[i]);
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(format(" Aligned %s: %d of %d points within [%g, %g] (%s).",
                    name, n, xA.length, xMin, xMax, kind));
        }
        return new AlignedSeries(x, y, yOnGrid);
    }

    /**
     * Build an interpolant over (x, y). Decreasing grids are reversed first, and
     * grids too short for the requested kind fall back to a linear interpolant.
     *
     * @param x    strictly monotonic grid.
     * @param y    values.
     * @param kind requested interpolant.
     * @return a {@link org.apache.commons.math3.analysis.UnivariateFunction}.
     */
    static UnivariateFunction interpolant(double[] x, double[] y, InterpolationKind kind) {
        int n = x.length;
        if (n == 1) {
            double value = y[0];
            return t -> value;
        }
        double[] xs = x;
        double[] ys = y;
        if (x[0] > x[n - 1]) {
            xs = new double[n];
            ys = new double[n];
            for (int i = 0; i < n; i++) {
                xs[i] = x[n - 1 - i];
                ys[i] = y[n - 1 - i];
            }
        }
        if (n < kind.minimumPoints()) {
            logger.fine(format(" %d points are too few for a %s interpolant; using linear.", n, kind));
            kind = InterpolationKind.LINEAR;
        }
        return kind.interpolator().interpolate(xs, ys);
    }
}
