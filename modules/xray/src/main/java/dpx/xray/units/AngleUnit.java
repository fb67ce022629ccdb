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

import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Units of the angular coordinate of a diffraction pattern.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public enum AngleUnit {

    /**
     * Scattering angle 2&theta; in degrees.
     */
    TWO_THETA("2th_deg"),
    /**
     * Momentum transfer q in inverse wavelength units.
     */
    Q("q_A^-1"),
    /**
     * Lattice spacing d in wavelength units.
     */
    D("d_A");

    private static final Logger logger = Logger.getLogger(AngleUnit.class.getName());

    private final String tag;

    AngleUnit(String tag) {
        this.tag = tag;
    }

    /**
     * The tag used for this unit in configuration and pattern files.
     *
     * @return the unit tag.
     */
    public String tag() {
        return tag;
    }

    /**
     * Look up a unit by tag (case insensitive) or by enum name.
     *
     * @param tag a unit tag such as "2th_deg", "q_A^-1" or "d_A".
     * @return the unit, or null if the tag is not recognized.
     */
    public static AngleUnit parse(String tag) {
        if (tag == null) {
            return null;
        }
        String t = tag.trim();
        for (AngleUnit unit : values()) {
            if (unit.tag.equalsIgnoreCase(t) || unit.name().equalsIgnoreCase(t)) {
                return unit;
            }
        }
        return null;
    }

    /**
     * <p>
     * checkProperties</p>
     *
     * @param properties a
     *                   {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     * @return the configured integration unit (2&theta; if absent or unknown).
     */
    public static AngleUnit checkProperties(CompositeConfiguration properties) {
        String tag = properties.getString("integration-unit", TWO_THETA.tag);
        AngleUnit unit = parse(tag);
        if (unit == null) {
            logger.warning(format(" Unknown integration-unit %s; using %s.", tag, TWO_THETA.tag));
            return TWO_THETA;
        }
        return unit;
    }
}
