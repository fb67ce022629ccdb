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

package dpx.xray.units;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.asin;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.toDegrees;
import static org.apache.commons.math3.util.FastMath.toRadians;

import java.util.logging.Logger;

/**
 * Conversion of the angular coordinate between scattering angle (2&theta; in
 * degrees), momentum transfer q and lattice spacing d for a given wavelength.
 * <p>
 * Every conversion passes through 2&theta;. The wavelength and d share a
 * length unit and q is in the inverse of that unit. Invalid wavelengths are
 * not checked and give NaN or infinite results.
 * <p>
 * An unrecognized unit converts to 0 and logs a warning. Callers are expected
 * to validate unit tags before converting.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public final class UnitConverter {

    private static final Logger logger = Logger.getLogger(UnitConverter.class.getName());

    private UnitConverter() {
    }

    /**
     * q = 4&pi; sin(2&theta;/2) / &lambda;
     *
     * @param twoTheta   scattering angle in degrees.
     * @param wavelength the wavelength.
     * @return momentum transfer.
     */
    public static double twoThetaToQ(double twoTheta, double wavelength) {
        return 4.0 * PI * sin(toRadians(twoTheta) / 2.0) / wavelength;
    }

    /**
     * 2&theta; = 2 asin(q &lambda; / 4&pi;)
     *
     * @param q          momentum transfer.
     * @param wavelength the wavelength.
     * @return scattering angle in degrees.
     */
    public static double qToTwoTheta(double q, double wavelength) {
        return 2.0 * toDegrees(asin(q * wavelength / (4.0 * PI)));
    }

    /**
     * d = &lambda; / (2 sin(2&theta;/2))
     *
     * @param twoTheta   scattering angle in degrees.
     * @param wavelength the wavelength.
     * @return lattice spacing.
     */
    public static double twoThetaToD(double twoTheta, double wavelength) {
        return wavelength / (2.0 * sin(toRadians(twoTheta) / 2.0));
    }

    /**
     * 2&theta; = 2 asin(&lambda; / 2d)
     *
     * @param d          lattice spacing.
     * @param wavelength the wavelength.
     * @return scattering angle in degrees.
     */
    public static double dToTwoTheta(double d, double wavelength) {
        return 2.0 * toDegrees(asin(wavelength / (2.0 * d)));
    }

    /**
     * Convert a value between units.
     *
     * @param value      the value in unit from.
     * @param from       the unit of value.
     * @param to         the requested unit.
     * @param wavelength the wavelength.
     * @return the value in unit to, or 0 if either unit is null.
     */
    public static double convert(double value, AngleUnit from, AngleUnit to, double wavelength) {
        if (from == null || to == null) {
            logger.warning(format(" Cannot convert from %s to %s; returning 0.", from, to));
            return 0.0;
        }
        return fromTwoTheta(toTwoTheta(value, from, wavelength), to, wavelength);
    }

    /**
     * Convert an array of values between units.
     *
     * @param values     the values in unit from (not modified).
     * @param from       the unit of values.
     * @param to         the requested unit.
     * @param wavelength the wavelength.
     * @return a new array in unit to; all zeros if either unit is null.
     */
    public static double[] convert(double[] values, AngleUnit from, AngleUnit to, double wavelength) {
        double[] converted = new double[values.length];
        if (from == null || to == null) {
            logger.warning(format(" Cannot convert from %s to %s; returning 0.", from, to));
            return converted;
        }
        for (int i = 0; i < values.length; i++) {
            converted[i] = fromTwoTheta(toTwoTheta(values[i], from, wavelength), to, wavelength);
        }
        return converted;
    }

    /**
     * Convert a value between units given by their tags ("2th_deg", "q_A^-1",
     * "d_A").
     *
     * @param value      the value.
     * @param from       tag of the current unit.
     * @param to         tag of the requested unit.
     * @param wavelength the wavelength.
     * @return the converted value, or 0 if a tag is not recognized.
     */
    public static double convert(double value, String from, String to, double wavelength) {
        return convert(value, AngleUnit.parse(from), AngleUnit.parse(to), wavelength);
    }

    /**
     * Convert an array of values between units given by their tags.
     *
     * @param values     the values.
     * @param from       tag of the current unit.
     * @param to         tag of the requested unit.
     * @param wavelength the wavelength.
     * @return the converted values, all zeros if a tag is not recognized.
     */
    public static double[] convert(double[] values, String from, String to, double wavelength) {
        return convert(values, AngleUnit.parse(from), AngleUnit.parse(to), wavelength);
    }

    private static double toTwoTheta(double value, AngleUnit unit, double wavelength) {
        switch (unit) {
            case Q:
                return qToTwoTheta(value, wavelength);
            case D:
                return dToTwoTheta(value, wavelength);
            case TWO_THETA:
            default:
                return value;
        }
    }

    private static double fromTwoTheta(double twoTheta, AngleUnit unit, double wavelength) {
        switch (unit) {
            case Q:
                return twoThetaToQ(twoTheta, wavelength);
            case D:
                return twoThetaToD(twoTheta, wavelength);
            case TWO_THETA:
            default:
                return twoTheta;
        }
    }
}
