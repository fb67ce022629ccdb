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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import dpx.numerics.background.BackgroundExtractor;
import dpx.numerics.background.BackgroundParameters;
import dpx.numerics.interpolate.RangeOverlapException;
import dpx.numerics.smoothing.GaussianFilter;
import dpx.utilities.DPXTest;

/**
 * Test recalculation of derived pattern data.
 *
 * @author Diffraction Pattern X Developers
 */
public class PatternTest extends DPXTest {

    private static final double TOL = 1.0e-12;

    /**
     * Returns a background of constant 1.
     */
    private static final BackgroundExtractor UNIT_BACKGROUND = (x, y, parameters) -> {
        double[] background = new double[x.length];
        Arrays.fill(background, 1.0);
        return background;
    };

    private static double[] range(double start, int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = start + i;
        }
        return x;
    }

    private static double[] constant(double value, int n) {
        double[] y = new double[n];
        Arrays.fill(y, value);
        return y;
    }

    @Test
    public void testDemoPattern() {
        Pattern pattern = new Pattern();
        double[] x = pattern.getX();
        double[] y = pattern.getY();
        assertEquals(100, pattern.size());
        assertEquals(0.1, x[0], TOL);
        assertEquals(15.0, x[99], TOL);
        assertEquals(Math.log(0.01) - 0.02 * 0.02, y[0], TOL);
        assertEquals(Math.log(225.0) - 9.0, y[99], TOL);
        assertEquals("", pattern.getName());
        assertFalse(pattern.hasBackground());
    }

    @Test
    public void testDemoCurveOnGivenX() {
        Pattern pattern = new Pattern(new double[]{1.0, 5.0}, null, "demo");
        assertArrayEquals(new double[]{-0.04, Math.log(25.0) - 1.0}, pattern.getY(), TOL);
    }

    @Test
    public void testUnequalLengths() {
        assertThrows(IllegalArgumentException.class, () -> new Pattern(new double[3], new double[2]));
        Pattern pattern = new Pattern(range(0, 3), constant(1, 3));
        assertThrows(IllegalArgumentException.class, () -> pattern.setData(new double[3], new double[4]));
        assertArrayEquals(constant(1, 3), pattern.getY(), 0.0);
    }

    @Test
    public void testMissingDataIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Pattern(null, null, "p"));
        assertThrows(IllegalArgumentException.class, () -> new Pattern(null, new double[2], "p"));
    }

    @Test
    public void testScalingAndOffset() {
        Pattern pattern = new Pattern(range(0, 5), new double[]{1, 2, 3, 4, 5}, "p");
        pattern.setScaling(2.0);
        pattern.setOffset(0.5);
        assertArrayEquals(new double[]{2.5, 4.5, 6.5, 8.5, 10.5}, pattern.getY(), TOL);

        // Undoing offset and scaling returns the original data.
        pattern.setOffset(0.0);
        pattern.setScaling(1.0);
        assertArrayEquals(pattern.getOriginalY(), pattern.getY(), TOL);
        assertArrayEquals(pattern.getOriginalX(), pattern.getX(), 0.0);
    }

    @Test
    public void testNegativeScalingIsClamped() {
        Pattern pattern = new Pattern(range(0, 4), new double[]{1, 2, 3, 4}, "p");
        pattern.setOffset(3.0);
        pattern.setScaling(-5.0);
        assertEquals(0.0, pattern.getScaling(), 0.0);
        double[] clamped = pattern.getY();
        pattern.setScaling(0.0);
        assertArrayEquals(clamped, pattern.getY(), 0.0);
        assertArrayEquals(constant(3.0, 4), clamped, 0.0);
    }

    @Test
    public void testRecalculationIsIdempotent() {
        Pattern pattern = new Pattern();
        pattern.setScaling(1.7);
        pattern.setSmoothing(2.0);
        double[] first = pattern.getY();
        pattern.recalculatePattern();
        pattern.recalculatePattern();
        assertArrayEquals(first, pattern.getY(), 0.0);
    }

    @Test
    public void testSetDataResetsScalingAndOffset() {
        Pattern pattern = new Pattern(range(0, 3), constant(1, 3), "p");
        pattern.setScaling(2.0);
        pattern.setOffset(1.0);
        pattern.setData(range(10, 2), new double[]{4, 5});
        assertEquals(1.0, pattern.getScaling(), 0.0);
        assertEquals(0.0, pattern.getOffset(), 0.0);
        assertArrayEquals(new double[]{10, 11}, pattern.getX(), 0.0);
        assertArrayEquals(new double[]{4, 5}, pattern.getY(), 0.0);
        assertEquals(2, pattern.size());
    }

    @Test
    public void testAccessorsReturnCopies() {
        Pattern pattern = new Pattern(range(0, 3), constant(1, 3), "p");
        pattern.getY()[0] = 100.0;
        pattern.getData()[1][1] = 100.0;
        assertArrayEquals(constant(1, 3), pattern.getY(), 0.0);
    }

    @Test
    public void testListenersAreNotified() {
        Pattern pattern = new Pattern(range(0, 3), constant(1, 3), "p");
        List<double[]> received = new ArrayList<>();
        PatternListener listener = (x, y) -> received.add(y);
        pattern.addPatternListener(listener);
        pattern.addPatternListener(listener);
        pattern.setOffset(2.0);
        assertEquals(1, received.size());
        assertArrayEquals(constant(3, 3), received.get(0), 0.0);

        // Listeners receive copies.
        received.get(0)[0] = -1.0;
        assertEquals(3.0, pattern.getY()[0], 0.0);

        pattern.removePatternListener(listener);
        pattern.setOffset(0.0);
        assertEquals(1, received.size());
    }

    @Test
    public void testListenerMayNotModifyPattern() {
        Pattern pattern = new Pattern(range(0, 3), constant(1, 3), "p");
        pattern.addPatternListener((x, y) -> pattern.setScaling(3.0));
        assertThrows(IllegalStateException.class, () -> pattern.setOffset(1.0));
        assertEquals(1.0, pattern.getScaling(), 0.0);
    }

    @Test
    public void testSmoothing() {
        double[] y = new double[21];
        y[10] = 1.0;
        Pattern pattern = new Pattern(range(0, 21), y, "spike");
        pattern.setSmoothing(2.0);
        double[] smoothed = pattern.getY();
        double sum = 0.0;
        for (double v : smoothed) {
            sum += v;
        }
        assertEquals(1.0, sum, 1.0e-6);
        assertTrue(smoothed[10] < 1.0);
        assertTrue(smoothed[9] > 0.0);
        assertEquals(smoothed[9], smoothed[11], TOL);

        pattern.setSmoothing(0.0);
        assertArrayEquals(y, pattern.getY(), 0.0);
        assertThrows(IllegalArgumentException.class, () -> pattern.setSmoothing(-1.0));
        assertEquals(0.0, pattern.getSmoothing(), 0.0);
    }

    @Test
    public void testBackgroundPatternOnSameGrid() {
        Pattern pattern = new Pattern(range(0, 5), new double[]{5, 6, 7, 8, 9}, "sample");
        Pattern background = new Pattern(range(0, 5), constant(2, 5), "empty");
        pattern.setBackgroundPattern(background);
        assertSame(background, pattern.getBackgroundPattern());
        assertTrue(pattern.hasBackground());
        assertArrayEquals(new double[]{3, 4, 5, 6, 7}, pattern.getY(), TOL);

        pattern.unsetBackgroundPattern();
        assertNull(pattern.getBackgroundPattern());
        assertArrayEquals(new double[]{5, 6, 7, 8, 9}, pattern.getY(), 0.0);
    }

    @Test
    public void testBackgroundPatternIsInterpolated() {
        Pattern pattern = new Pattern(range(0, 11), constant(10, 11), "sample");
        double[] bx = new double[10];
        for (int i = 0; i < 10; i++) {
            bx[i] = 0.5 + i;
        }
        Pattern background = new Pattern(bx, bx, "ramp");
        pattern.setBackgroundPattern(background);
        double[] x = pattern.getX();
        assertArrayEquals(range(1, 9), x, 0.0);
        for (int i = 0; i < x.length; i++) {
            assertEquals(10.0 - x[i], pattern.getY()[i], TOL);
        }
        // The original data keep the full grid.
        assertEquals(11, pattern.size());
    }

    @Test
    public void testBackgroundChangesCascade() {
        Pattern pattern = new Pattern(range(0, 5), constant(5, 5), "sample");
        Pattern background = new Pattern(range(0, 5), constant(1, 5), "empty");
        Pattern second = new Pattern(range(0, 5), constant(1, 5), "second");
        pattern.setBackgroundPattern(background);
        background.setBackgroundPattern(second);
        assertArrayEquals(constant(5, 5), pattern.getY(), TOL);

        second.setOffset(-2.0);
        assertArrayEquals(constant(2, 5), background.getY(), TOL);
        assertArrayEquals(constant(3, 5), pattern.getY(), TOL);

        background.setScaling(2.0);
        assertArrayEquals(constant(3, 5), background.getY(), TOL);
        assertArrayEquals(constant(2, 5), pattern.getY(), TOL);
    }

    @Test
    public void testReplacedBackgroundIsNoLongerFollowed() {
        Pattern pattern = new Pattern(range(0, 3), constant(5, 3), "sample");
        Pattern first = new Pattern(range(0, 3), constant(1, 3), "first");
        Pattern second = new Pattern(range(0, 3), constant(2, 3), "second");
        pattern.setBackgroundPattern(first);
        pattern.setBackgroundPattern(second);
        first.setOffset(10.0);
        assertArrayEquals(constant(3, 3), pattern.getY(), TOL);
    }

    @Test
    public void testCyclicBackgroundsAreRejected() {
        Pattern a = new Pattern(range(0, 3), constant(1, 3), "a");
        Pattern b = new Pattern(range(0, 3), constant(1, 3), "b");
        Pattern c = new Pattern(range(0, 3), constant(1, 3), "c");
        assertThrows(IllegalArgumentException.class, () -> a.setBackgroundPattern(a));
        a.setBackgroundPattern(b);
        b.setBackgroundPattern(c);
        assertThrows(IllegalArgumentException.class, () -> c.setBackgroundPattern(a));
        assertNull(c.getBackgroundPattern());
    }

    @Test
    public void testNonOverlappingBackgroundIsRolledBack() {
        Pattern pattern = new Pattern(range(0, 5), constant(5, 5), "sample");
        Pattern background = new Pattern(range(10, 5), constant(1, 5), "far");
        pattern.setOffset(1.0);
        double[] before = pattern.getY();
        try {
            pattern.setBackgroundPattern(background);
            fail(" Expected a RangeOverlapException.");
        } catch (RangeOverlapException e) {
            assertEquals("sample", e.getPatternName());
        }
        assertNull(pattern.getBackgroundPattern());
        assertArrayEquals(before, pattern.getY(), 0.0);

        // No subscription is left behind.
        background.setOffset(2.0);
        assertArrayEquals(before, pattern.getY(), 0.0);
    }

    @Test
    public void testFailedCascadeLeavesDependentStale() {
        Pattern pattern = new Pattern(range(0, 5), constant(5, 5), "sample");
        Pattern background = new Pattern(range(0, 5), constant(1, 5), "empty");
        pattern.setBackgroundPattern(background);
        assertThrows(RangeOverlapException.class, () -> background.setData(range(20, 5), constant(1, 5)));
        assertArrayEquals(range(20, 5), background.getX(), 0.0);
        assertArrayEquals(range(0, 5), pattern.getX(), 0.0);
        assertArrayEquals(constant(4, 5), pattern.getY(), TOL);
    }

    @Test
    public void testAutoBackgroundSideProducts() {
        Pattern pattern = new Pattern(range(0, 11), constant(4, 11), "sample");
        pattern.setBackgroundExtractor(UNIT_BACKGROUND);
        pattern.setScaling(2.0);
        assertNull(pattern.getAutoBackgroundPattern());
        assertNull(pattern.getAutoBackgroundBeforeSubtractionPattern());

        BackgroundParameters parameters = new BackgroundParameters(0.2, 10, 5);
        pattern.setAutoBackgroundSubtraction(parameters);
        assertTrue(pattern.isAutoBackgroundSubtraction());
        assertTrue(pattern.hasBackground());
        assertSame(parameters, pattern.getAutoBackgroundParameters());
        assertNull(pattern.getAutoBackgroundRoi());
        assertArrayEquals(constant(7, 11), pattern.getY(), TOL);
        Pattern before = pattern.getAutoBackgroundBeforeSubtractionPattern();
        Pattern background = pattern.getAutoBackgroundPattern();
        assertNotNull(before);
        assertArrayEquals(constant(8, 11), before.getY(), TOL);
        assertArrayEquals(constant(1, 11), background.getY(), 0.0);

        pattern.unsetAutoBackgroundSubtraction();
        assertFalse(pattern.hasBackground());
        assertNull(pattern.getAutoBackgroundPattern());
        assertNull(pattern.getAutoBackgroundBeforeSubtractionPattern());
        assertArrayEquals(constant(8, 11), pattern.getY(), TOL);
        assertSame(parameters, pattern.getAutoBackgroundParameters());
    }

    @Test
    public void testRegionOfInterest() {
        Pattern pattern = new Pattern(range(0, 11), constant(4, 11), "sample");
        pattern.setBackgroundExtractor(UNIT_BACKGROUND);
        pattern.setAutoBackgroundSubtraction(BackgroundParameters.DEFAULT, new double[]{1.0, 9.0});
        assertArrayEquals(new double[]{1.0, 9.0}, pattern.getAutoBackgroundRoi(), 0.0);
        assertArrayEquals(range(1, 9), pattern.getX(), 0.0);
        assertArrayEquals(range(0, 11), pattern.getAutoBackgroundBeforeSubtractionPattern().getX(), 0.0);

        pattern.setAutoBackgroundSubtraction(BackgroundParameters.DEFAULT, new double[]{-5.0, 20.0});
        assertArrayEquals(new double[]{0.0, 10.0}, pattern.getAutoBackgroundRoi(), 0.0);
        assertArrayEquals(range(0, 11), pattern.getX(), 0.0);
        assertArrayEquals(constant(3, 11), pattern.getY(), TOL);

        assertThrows(IllegalArgumentException.class,
                () -> pattern.setAutoBackgroundSubtraction(BackgroundParameters.DEFAULT, new double[]{1.0}));
    }

    @Test
    public void testEmptyRegionOfInterestIsRolledBack() {
        Pattern pattern = new Pattern(range(0, 11), constant(4, 11), "sample");
        pattern.setBackgroundExtractor(UNIT_BACKGROUND);
        assertThrows(RangeOverlapException.class,
                () -> pattern.setAutoBackgroundSubtraction(BackgroundParameters.DEFAULT, new double[]{20.0, 30.0}));
        assertFalse(pattern.isAutoBackgroundSubtraction());
        assertNull(pattern.getAutoBackgroundRoi());
        assertArrayEquals(constant(4, 11), pattern.getY(), 0.0);
    }

    @Test
    public void testExtractorMustMatchLength() {
        Pattern pattern = new Pattern(range(0, 5), constant(4, 5), "sample");
        pattern.setBackgroundExtractor((x, y, parameters) -> new double[x.length - 1]);
        assertThrows(IllegalStateException.class,
                () -> pattern.setAutoBackgroundSubtraction(BackgroundParameters.DEFAULT));
        assertFalse(pattern.isAutoBackgroundSubtraction());
        assertArrayEquals(constant(4, 5), pattern.getY(), 0.0);
    }

    @Test
    public void testDefaultAutoBackgroundOnDemoPattern() {
        Pattern pattern = new Pattern();
        pattern.setAutoBackgroundSubtraction(new BackgroundParameters(0.5, 20, 10));
        double[] before = pattern.getAutoBackgroundBeforeSubtractionPattern().getY();
        double[] background = pattern.getAutoBackgroundPattern().getY();
        double[] y = pattern.getY();
        assertEquals(100, y.length);
        for (int i = 0; i < y.length; i++) {
            assertEquals(before[i] - background[i], y[i], TOL);
        }
    }

    @Test
    public void testLimit() {
        Pattern pattern = new Pattern(range(0, 11), range(100, 11), "sample");
        Pattern limited = pattern.limit(2.0, 5.0);
        assertArrayEquals(new double[]{3, 4}, limited.getX(), 0.0);
        assertArrayEquals(new double[]{103, 104}, limited.getY(), 0.0);
        assertEquals("sample", limited.getName());
        assertEquals(0, pattern.limit(20.0, 30.0).size());
    }

    @Test
    public void testFailingDependentDoesNotStopNotification() {
        Pattern reference = new Pattern(range(0, 5), constant(1, 5), "reference");
        Pattern first = new Pattern(range(0, 3), constant(5, 3), "first");
        Pattern second = new Pattern(range(3, 5), constant(5, 5), "second");
        Pattern third = new Pattern(range(10, 3), constant(5, 3), "third");
        first.setBackgroundPattern(reference);
        second.setBackgroundPattern(reference);
        assertArrayEquals(new double[]{4, 4}, second.getY(), TOL);
        List<double[]> received = new ArrayList<>();
        reference.addPatternListener((x, y) -> received.add(x));

        // Moving the reference to [3, 7] leaves no overlap with the first pattern.
        RangeOverlapException e = assertThrows(RangeOverlapException.class,
                () -> reference.setData(range(3, 5), constant(2, 5)));
        assertEquals("first", e.getPatternName());
        assertEquals(0, e.getSuppressed().length);

        // Later subscribers were still updated.
        assertArrayEquals(range(3, 5), second.getX(), 0.0);
        assertArrayEquals(constant(3, 5), second.getY(), TOL);
        assertEquals(1, received.size());
        assertArrayEquals(range(3, 5), received.get(0), 0.0);
        // The failing dependent keeps its previous derived data.
        assertArrayEquals(range(0, 3), first.getX(), 0.0);
        assertArrayEquals(constant(4, 3), first.getY(), TOL);

        // Further failures are attached to the first one.
        second.unsetBackgroundPattern();
        reference.setData(range(0, 5), constant(1, 5));
        third.setData(range(0, 3), constant(5, 3));
        third.setBackgroundPattern(reference);
        e = assertThrows(RangeOverlapException.class, () -> reference.setData(range(20, 3), constant(1, 3)));
        assertEquals("first", e.getPatternName());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("third", ((RangeOverlapException) e.getSuppressed()[0]).getPatternName());
        assertEquals(3, received.size());
    }

    @Test
    public void testBackgroundIsSubtractedBeforeSmoothing() {
        double[] x = range(0, 31);
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 0.05 * x[i] * x[i] + (i == 15 ? 10.0 : 0.0);
        }
        Pattern pattern = new Pattern(x, y, "sample");
        pattern.setBackgroundExtractor((bx, by, parameters) -> {
            double[] ramp = new double[bx.length];
            for (int i = 0; i < bx.length; i++) {
                ramp[i] = 0.5 * bx[i];
            }
            return ramp;
        });
        pattern.setSmoothing(1.5);
        pattern.setAutoBackgroundSubtraction(BackgroundParameters.DEFAULT);

        double[] before = pattern.getAutoBackgroundBeforeSubtractionPattern().getY();
        double[] background = pattern.getAutoBackgroundPattern().getY();
        assertArrayEquals(y, before, 0.0);
        double[] difference = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            assertEquals(0.5 * x[i], background[i], 0.0);
            difference[i] = before[i] - background[i];
        }
        assertArrayEquals(GaussianFilter.filter(difference, 1.5), pattern.getY(), TOL);
    }

    @Test
    public void testExtractorExceptionIsPropagated() {
        Pattern pattern = new Pattern(range(0, 5), new double[]{1, 2, 3, 2, 1}, "sample");
        pattern.setOffset(1.0);
        double[] before = pattern.getY();
        UnsupportedOperationException failure = new UnsupportedOperationException(" No background available.");
        pattern.setBackgroundExtractor((x, y, parameters) -> {
            throw failure;
        });
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> pattern.setAutoBackgroundSubtraction(BackgroundParameters.DEFAULT, new double[]{0.0, 4.0}));
        assertSame(failure, e);
        assertFalse(pattern.isAutoBackgroundSubtraction());
        assertNull(pattern.getAutoBackgroundRoi());
        assertNull(pattern.getAutoBackgroundPattern());
        assertArrayEquals(before, pattern.getY(), 0.0);
    }
}
