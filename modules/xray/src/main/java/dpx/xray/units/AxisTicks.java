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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.log10;
import static org.apache.commons.math3.util.FastMath.round;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.util.Precision;

/**
 * The AxisTicks class places labelled ticks of a q or d scale on an axis that
 * is linear in 2&theta;.
 * <p>
 * Tick values are evenly stepped in the tick unit and rounded to a number of
 * decimals derived from the step, so labels stay short; each rounded value is
 * converted back to its 2&theta; position.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public class AxisTicks {

    private static final Logger logger = Logger.getLogger(AxisTicks.class.getName());

    /**
     * Default number of tick intervals.
     */
    public static final int DEFAULT_TICKS = 8;

    private final AngleUnit unit;
    private final double wavelength;
    private final int nTicks;

    /**
     * A single tick: position on the 2&theta; axis, value in the tick unit and
     * its label.
     */
    public static class Tick {

        public final double position;
        public final double value;
        public final String label;

        Tick(double position, double value) {
            this.position = position;
            this.value = value;
            this.label = Double.toString(value);
        }

        /**
         * {@inheritDoc}
         */
        @Override
        public String toString() {
            return format("%s at %.4f", label, position);
        }
    }

    /**
     * <p>Constructor for AxisTicks.</p>
     *
     * @param unit       unit of the tick labels.
     * @param wavelength the wavelength.
     * @param nTicks     number of tick intervals across the displayed range.
     */
    public AxisTicks(AngleUnit unit, double wavelength, int nTicks) {
        if (nTicks < 1) {
            throw new IllegalArgumentException(" The number of ticks must be positive: " + nTicks);
        }
        this.unit = unit;
        this.wavelength = wavelength;
        this.nTicks = nTicks;
    }

    /**
     * <p>Constructor for AxisTicks.</p>
     *
     * @param unit       unit of the tick labels.
     * @param wavelength the wavelength.
     */
    public AxisTicks(AngleUnit unit, double wavelength) {
        this(unit, wavelength, DEFAULT_TICKS);
    }

    /**
     * <p>
     * checkProperties</p>
     *
     * @param properties a
     *                   {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     * @return a {@link dpx.xray.units.AxisTicks} object, or null if no positive
     * wavelength is configured.
     */
    public static AxisTicks checkProperties(CompositeConfiguration properties) {
        double wavelength = properties.getDouble("wavelength", -1.0);
        if (wavelength <= 0.0) {
            return null;
        }
        int nTicks = properties.getInt("axis-ticks", DEFAULT_TICKS);
        return new AxisTicks(AngleUnit.checkProperties(properties), wavelength, nTicks);
    }

    public AngleUnit getUnit() {
        return unit;
    }

    public double getWavelength() {
        return wavelength;
    }

    public int getTickCount() {
        return nTicks;
    }

    /**
     * Compute ticks for the displayed 2&theta; range. A 2&theta; tick unit needs
     * no custom ticks and yields an empty list, as does a range whose ends do
     * not convert to finite values.
     *
     * @param minTwoTheta lower end of the displayed range (degrees).
     * @param maxTwoTheta upper end of the displayed range (degrees).
     * @return ticks ordered from minTwoTheta towards maxTwoTheta.
     */
    public List<Tick> ticks(double minTwoTheta, double maxTwoTheta) {
        if (unit == null || unit == AngleUnit.TWO_THETA) {
            return Collections.emptyList();
        }
        double start = UnitConverter.convert(minTwoTheta, AngleUnit.TWO_THETA, unit, wavelength);
        double end = UnitConverter.convert(maxTwoTheta, AngleUnit.TWO_THETA, unit, wavelength);
        double step = (end - start) / nTicks;
        if (!Double.isFinite(step) || step == 0.0) {
            return Collections.emptyList();
        }

        int decimals = (int) abs(round(log10(abs(step)))) + 1;
        List<Tick> ticks = new ArrayList<>();
        double value = start;
        for (int i = 0; i <= nTicks; i++) {
            value = Precision.round(value + step, decimals);
            if (step > 0.0 ? value > end : value < end) {
                break;
            }
            ticks.add(new Tick(UnitConverter.convert(value, unit, AngleUnit.TWO_THETA, wavelength), value));
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(format(" %d %s ticks between %.3f and %.3f degrees.",
                    ticks.size(), unit.tag(), minTwoTheta, maxTwoTheta));
        }
        return ticks;
    }
}
