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

package dpx.numerics.background;

import static java.lang.String.format;
import static java.lang.System.arraycopy;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;

/**
 * Background extraction by iterative Br&uuml;ckner smoothing followed by a
 * least-squares Chebyshev polynomial fit.
 * <p>
 * The smoothing pass replaces every point that lies above the running window
 * average by that average, so peaks are eroded while the background is
 * preserved. The polynomial fit removes the residual ripple.
 *
 * @author Diffraction Pattern X Developers
 * @see <a href="http://dx.doi.org/10.1107/S0021889800013182" target="_blank">
 * S. Br&uuml;ckner, J. Appl. Cryst. (2000). 33, 977-979
 * </a>
 * @since 1.0
 */
public class BrucknerBackgroundExtractor implements BackgroundExtractor {

    private static final Logger logger = Logger.getLogger(BrucknerBackgroundExtractor.class.getName());

    /**
     * {@inheritDoc}
     * <p>
     * The parameters are the window half-width in x units, the number of
     * smoothing iterations and the Chebyshev order (capped at n - 1).
     */
    @Override
    public double[] extractBackground(double[] x, double[] y, BackgroundParameters parameters) {
        int n = x.length;
        if (n != y.length) {
            throw new IllegalArgumentException(format(" Background input has %d x and %d y values.", n, y.length));
        }
        if (n < 2) {
            logger.warning(format(" Background extraction needs at least 2 points (%d given).", n));
            return y.clone();
        }

        double spacing = abs(x[1] - x[0]);
        int smoothPoints = abs((int) (parameters.smoothWidth / spacing));
        int iterations = (int) parameters.iterations;
        int order = min((int) parameters.chebyshevOrder, n - 1);

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(format(" Extracting background: %d points, window %d, %d iterations, order %d.",
                    n, smoothPoints, iterations, order));
        }

        double[] smoothed = smoothBruckner(y, smoothPoints, iterations);
        double[] xc = chebyshevDomain(x);
        return chebyshevFit(xc, smoothed, order);
    }

    /**
     * Iteratively clip the data to the running average of a window of
     * 2 * halfWidth + 1 points. The data are padded at each end with the end
     * values, and values far above the mean are clipped before iterating.
     *
     * @param y          input data (not modified).
     * @param halfWidth  window half-width in points.
     * @param iterations number of passes.
     * @return the smoothed data.
     */
    static double[] smoothBruckner(double[] y, int halfWidth, int iterations) {
        int nData = y.length;
        int w = halfWidth;
        double[] padded = new double[nData + 2 * w];
        Arrays.fill(padded, 0, w, y[0]);
        arraycopy(y, 0, padded, w, nData);
        Arrays.fill(padded, w + nData, padded.length, y[nData - 1]);

        double sum = 0.0;
        double yMin = padded[0];
        for (double v : padded) {
            sum += v;
            yMin = min(yMin, v);
        }
        double yAvg = sum / padded.length;
        double yClip = yAvg + 2.0 * (yAvg - yMin);
        for (int i = 0; i < padded.length; i++) {
            if (padded[i] > yClip) {
                padded[i] = yClip;
            }
        }

        double windowSize = 2.0 * w + 1.0;
        for (int j = 0; j < iterations; j++) {
            double windowAvg = 0.0;
            for (int i = 0; i <= 2 * w; i++) {
                windowAvg += padded[i];
            }
            windowAvg /= windowSize;
            // The window around i spans [i - w, i + w]; advance it one point per step.
            for (int i = w; i < w + nData - 1; i++) {
                double shift = padded[i + w + 1] - padded[i - w];
                if (padded[i] > windowAvg) {
                    double clipped = windowAvg;
                    windowAvg += ((clipped - padded[i]) + shift) / windowSize;
                    padded[i] = clipped;
                } else {
                    windowAvg += shift / windowSize;
                }
            }
        }
        return Arrays.copyOfRange(padded, w, w + nData);
    }

    /**
     * Map the grid linearly onto [-1, 1].
     */
    static double[] chebyshevDomain(double[] x) {
        int n = x.length;
        double x0 = x[0];
        double range = x[n - 1] - x0;
        double[] xc = new double[n];
        for (int i = 0; i < n; i++) {
            xc[i] = 2.0 * (x[i] - x0) / range - 1.0;
        }
        return xc;
    }

    /**
     * Least-squares fit of a Chebyshev series, evaluated back on the fit points.
     *
     * @param xc    abscissae in [-1, 1].
     * @param y     values.
     * @param order polynomial order.
     * @return the fitted values.
     */
    static double[] chebyshevFit(double[] xc, double[] y, int order) {
        int n = xc.length;
        double[][] basis = new double[n][order + 1];
        for (int i = 0; i < n; i++) {
            double t = xc[i];
            basis[i][0] = 1.0;
            if (order > 0) {
                basis[i][1] = t;
            }
            for (int k = 2; k <= order; k++) {
                basis[i][k] = 2.0 * t * basis[i][k - 1] - basis[i][k - 2];
            }
        }
        Array2DRowRealMatrix design = new Array2DRowRealMatrix(basis, false);
        RealVector coefficients = new QRDecomposition(design).getSolver().solve(new ArrayRealVector(y, false));
        return design.operate(coefficients).toArray();
    }
}
