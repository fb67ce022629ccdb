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

package dpx.numerics.smoothing;

import static org.apache.commons.math3.util.FastMath.exp;

/**
 * One dimensional Gaussian smoothing of uniformly indexed data.
 * <p>
 * The width is a standard deviation in samples, not in x units. The kernel is
 * truncated at four standard deviations and the data are extended at both
 * ends by reflection about the edge (d c b a | a b c d | d c b a).
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public final class GaussianFilter {

    /**
     * Kernel half-width in units of the standard deviation.
     */
    public static final double TRUNCATE = 4.0;

    private GaussianFilter() {
    }

    /**
     * Normalized Gaussian weights for offsets -radius ... radius.
     *
     * @param sigma standard deviation in samples (must be positive).
     * @return the kernel.
     */
    public static double[] kernel(double sigma) {
        int radius = (int) (TRUNCATE * sigma + 0.5);
        double[] weights = new double[2 * radius + 1];
        double sum = 0.0;
        double denom = 2.0 * sigma * sigma;
        for (int i = -radius; i <= radius; i++) {
            double w = exp(-(i * i) / denom);
            weights[i + radius] = w;
            sum += w;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= sum;
        }
        return weights;
    }

    /**
     * Smooth data with a Gaussian kernel.
     *
     * @param y     input data (not modified).
     * @param sigma standard deviation in samples; values &lt;= 0 return a copy.
     * @return the smoothed data.
     */
    public static double[] filter(double[] y, double sigma) {
        int n = y.length;
        if (sigma <= 0.0 || n == 0) {
            return y.clone();
        }
        double[] weights = kernel(sigma);
        int radius = weights.length / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int k = -radius; k <= radius; k++) {
                sum += weights[k + radius] * y[reflect(i + k, n)];
            }
            out[i] = sum;
        }
        return out;
    }

    /**
     * Map an index outside [0, n) back into range by mirror reflection about
     * the array edges, repeating as often as needed.
     */
    static int reflect(int index, int n) {
        int period = 2 * n;
        int i = index % period;
        if (i < 0) {
            i += period;
        }
        return i < n ? i : period - 1 - i;
    }
}
