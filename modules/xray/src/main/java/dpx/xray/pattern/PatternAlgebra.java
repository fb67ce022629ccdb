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

package dpx.xray.pattern;

import java.util.function.DoubleBinaryOperator;

import dpx.numerics.interpolate.AlignedSeries;
import dpx.numerics.interpolate.GridAligner;
import dpx.numerics.interpolate.InterpolationKind;
import dpx.numerics.interpolate.RangeOverlapException;

/**
 * Arithmetic on the derived data of patterns. Results are new patterns with
 * no further connection to their operands.
 * <p>
 * If the grids differ the right operand is evaluated with a cubic spline on
 * the points of the left operand that lie inside its x-range.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public final class PatternAlgebra {

    private PatternAlgebra() {
    }

    /**
     * a + b
     *
     * @param a left operand.
     * @param b right operand.
     * @return the sum on the overlapping domain.
     * @throws RangeOverlapException (named after a) if the domains do not overlap.
     */
    public static Pattern add(Pattern a, Pattern b) {
        return combine(a, b, Double::sum);
    }

    /**
     * a - b
     *
     * @param a left operand.
     * @param b right operand.
     * @return the difference on the overlapping domain.
     * @throws RangeOverlapException (named after a) if the domains do not overlap.
     */
    public static Pattern subtract(Pattern a, Pattern b) {
        return combine(a, b, (ya, yb) -> ya - yb);
    }

    /**
     * factor * a. Negative factors are kept as given.
     *
     * @param a      the pattern.
     * @param factor the factor.
     * @return the scaled pattern.
     */
    public static Pattern multiply(Pattern a, double factor) {
        double[] x = a.getX();
        double[] y = a.getY();
        for (int i = 0; i < y.length; i++) {
            y[i] *= factor;
        }
        return new Pattern(x, y, a.getName());
    }

    private static Pattern combine(Pattern a, Pattern b, DoubleBinaryOperator operator) {
        AlignedSeries aligned = GridAligner.align(a.getX(), a.getY(), b.getX(), b.getY(),
                InterpolationKind.CUBIC, a.getName());
        double[] x = aligned.getX();
        double[] ya = aligned.getYA();
        double[] yb = aligned.getYB();
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = operator.applyAsDouble(ya[i], yb[i]);
        }
        return new Pattern(x, y, a.getName());
    }
}
