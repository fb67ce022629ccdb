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

import java.util.Arrays;

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The BackgroundParameters class holds the ordered parameter triple passed to
 * a {@link BackgroundExtractor}. For the default extractor the entries are the
 * smoothing width (x units), the number of smoothing iterations and the order
 * of the Chebyshev polynomial; other extractors may interpret them freely.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public class BackgroundParameters {

    /**
     * Default parameters (0.1, 50, 50).
     */
    public static final BackgroundParameters DEFAULT = new BackgroundParameters(0.1, 50, 50);

    public final double smoothWidth;
    public final double iterations;
    public final double chebyshevOrder;

    /**
     * <p>Constructor for BackgroundParameters.</p>
     *
     * @param smoothWidth    first parameter (smoothing width).
     * @param iterations     second parameter (iterations).
     * @param chebyshevOrder third parameter (polynomial order).
     */
    public BackgroundParameters(double smoothWidth, double iterations, double chebyshevOrder) {
        this.smoothWidth = smoothWidth;
        this.iterations = iterations;
        this.chebyshevOrder = chebyshevOrder;
    }

    /**
     * <p>Constructor for BackgroundParameters.</p>
     *
     * @param parameters an array of exactly three values.
     */
    public BackgroundParameters(double[] parameters) {
        this(checkLength(parameters)[0], parameters[1], parameters[2]);
    }

    private static double[] checkLength(double[] parameters) {
        if (parameters == null || parameters.length != 3) {
            throw new IllegalArgumentException(" Background parameters must be a triple: "
                    + Arrays.toString(parameters));
        }
        return parameters;
    }

    /**
     * <p>
     * checkProperties</p>
     *
     * @param properties a
     *                   {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     * @return a {@link dpx.numerics.background.BackgroundParameters} object.
     */
    public static BackgroundParameters checkProperties(CompositeConfiguration properties) {
        double smoothWidth = properties.getDouble("bkg-smooth-width", DEFAULT.smoothWidth);
        double iterations = properties.getDouble("bkg-iterations", DEFAULT.iterations);
        double order = properties.getDouble("bkg-cheb-order", DEFAULT.chebyshevOrder);
        return new BackgroundParameters(smoothWidth, iterations, order);
    }

    /**
     * Parameter by position.
     *
     * @param index 0, 1 or 2.
     * @return the parameter.
     */
    public double get(int index) {
        switch (index) {
            case 0:
                return smoothWidth;
            case 1:
                return iterations;
            case 2:
                return chebyshevOrder;
            default:
                throw new IndexOutOfBoundsException(" Background parameter index " + index);
        }
    }

    public double[] toArray() {
        return new double[]{smoothWidth, iterations, chebyshevOrder};
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(toArray(), ((BackgroundParameters) o).toArray());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toString() {
        return format("(%g, %g, %g)", smoothWidth, iterations, chebyshevOrder);
    }
}
