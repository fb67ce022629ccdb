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

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import dpx.numerics.background.BackgroundExtractor;
import dpx.numerics.background.BackgroundParameters;

/**
 * Background extraction for a stack of patterns, such as the patterns
 * integrated from a series of detector images.
 * <p>
 * The patterns are only read, so extraction runs in parallel across
 * patterns. None of the patterns may be modified while a batch is running.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public final class PatternBatch {

    private static final Logger logger = Logger.getLogger(PatternBatch.class.getName());

    private PatternBatch() {
    }

    /**
     * Extract the background of the derived data of every pattern.
     *
     * @param patterns   the patterns.
     * @param parameters extractor parameters.
     * @param extractor  the extractor; must be safe to call concurrently.
     * @return one background per pattern, in order.
     */
    public static List<double[]> extractBackgrounds(List<Pattern> patterns, BackgroundParameters parameters,
                                                    BackgroundExtractor extractor) {
        long time = -System.nanoTime();
        List<double[]> backgrounds = IntStream.range(0, patterns.size())
                .parallel()
                .mapToObj(i -> {
                    Pattern pattern = patterns.get(i);
                    return extractor.extractBackground(pattern.getX(), pattern.getY(), parameters);
                })
                .collect(Collectors.toList());
        time += System.nanoTime();
        logger.info(format(" Extracted %d backgrounds %s in %8.3f (sec).",
                backgrounds.size(), parameters, time * 1.0e-9));
        return backgrounds;
    }

    /**
     * Subtract backgrounds from the derived data of every pattern.
     *
     * @param patterns    the patterns.
     * @param backgrounds one background per pattern.
     * @return new, detached patterns.
     * @throws IllegalArgumentException if the shapes of data and backgrounds differ.
     */
    public static List<Pattern> subtractBackgrounds(List<Pattern> patterns, List<double[]> backgrounds) {
        if (patterns.size() != backgrounds.size()) {
            throw new IllegalArgumentException(format(" Shape of data (%d patterns) and background (%d) are different.",
                    patterns.size(), backgrounds.size()));
        }
        List<Pattern> subtracted = new ArrayList<>(patterns.size());
        for (int i = 0; i < patterns.size(); i++) {
            Pattern pattern = patterns.get(i);
            double[] x = pattern.getX();
            double[] y = pattern.getY();
            double[] background = backgrounds.get(i);
            if (background.length != y.length) {
                throw new IllegalArgumentException(format(
                        " Shape of pattern %d (%d points) and its background (%d points) are different.",
                        i, y.length, background.length));
            }
            for (int j = 0; j < y.length; j++) {
                y[j] -= background[j];
            }
            subtracted.add(new Pattern(x, y, pattern.getName()));
        }
        return subtracted;
    }
}
