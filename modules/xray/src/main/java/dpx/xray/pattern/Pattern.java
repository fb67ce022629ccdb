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
import static java.util.Arrays.copyOf;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import dpx.numerics.background.BackgroundExtractor;
import dpx.numerics.background.BackgroundParameters;
import dpx.numerics.background.BrucknerBackgroundExtractor;
import dpx.numerics.interpolate.AlignedSeries;
import dpx.numerics.interpolate.GridAligner;
import dpx.numerics.interpolate.InterpolationKind;
import dpx.numerics.interpolate.RangeOverlapException;
import dpx.numerics.smoothing.GaussianFilter;

/**
 * The Pattern class holds a 1-D diffraction pattern (intensity against
 * angle) together with the live parameters that turn its original data into
 * the displayed, derived data.
 * <p>
 * Every setter triggers a complete recalculation:
 * <ol>
 * <li>y = original y * scaling + offset</li>
 * <li>the derived data of the reference background pattern, if set, is
 * interpolated linearly onto the overlapping points and subtracted</li>
 * <li>if automatic background subtraction is enabled, the data are clipped to
 * the region of interest and the extracted background is subtracted</li>
 * <li>Gaussian smoothing, if the smoothing width is positive</li>
 * </ol>
 * followed by notification of all {@link PatternListener}s.
 * <p>
 * Recalculation is all-or-nothing. If it fails, the parameter change that
 * triggered it is rolled back, the derived data are left as they were and the
 * exception reaches the caller. Listeners are all notified even if some of
 * them fail; the first failure then reaches the caller.
 * <p>
 * A pattern set as the reference background of another pattern is not owned
 * by it and must stay alive until it is unset. Patterns are not thread-safe.
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public class Pattern {

    private static final Logger logger = Logger.getLogger(Pattern.class.getName());

    private String name;
    private String filename = "";

    private double[] originalX;
    private double[] originalY;
    private double[] x;
    private double[] y;

    private double offset = 0.0;
    private double scaling = 1.0;
    private double smoothing = 0.0;

    private Pattern backgroundPattern = null;
    private boolean autoBackgroundSubtraction = false;
    private BackgroundParameters autoBackgroundParameters = BackgroundParameters.DEFAULT;
    private double[] autoBackgroundRoi = null;
    private BackgroundExtractor backgroundExtractor = new BrucknerBackgroundExtractor();
    private Pattern autoBackgroundBeforeSubtractionPattern = null;
    private Pattern autoBackgroundPattern = null;

    private final List<PatternListener> listeners = new CopyOnWriteArrayList<>();
    /**
     * Registered with the reference background pattern.
     */
    private final PatternListener backgroundListener = (bx, by) -> recalculatePattern();
    private boolean recalculating = false;

    /**
     * Constructor for a demonstration pattern:
     * x = 100 points from 0.1 to 15, y = ln(x^2) - (0.2 x)^2.
     */
    public Pattern() {
        this(demoX(), null, "");
    }

    /**
     * <p>Constructor for Pattern.</p>
     *
     * @param x original x values.
     * @param y original y values.
     */
    public Pattern(double[] x, double[] y) {
        this(x, y, "");
    }

    /**
     * <p>Constructor for Pattern.</p>
     *
     * @param x    original x values.
     * @param y    original y values (null for the demonstration curve on x).
     * @param name name of the pattern.
     */
    public Pattern(double[] x, double[] y, String name) {
        if (x != null && y == null) {
            y = demoY(x);
        }
        checkLengths(x, y);
        this.name = name;
        originalX = x.clone();
        originalY = y.clone();
        this.x = originalX;
        this.y = originalY;
    }

    private static double[] demoX() {
        int n = 100;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = 0.1 + i * (15.0 - 0.1) / (n - 1);
        }
        return x;
    }

    private static double[] demoY(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double s = 0.2 * x[i];
            y[i] = log(x[i] * x[i]) - s * s;
        }
        return y;
    }

    private static void checkLengths(double[] x, double[] y) {
        if (x == null || y == null || x.length != y.length) {
            throw new IllegalArgumentException(format(" Pattern x (%d) and y (%d) must have equal length.",
                    x == null ? -1 : x.length, y == null ? -1 : y.length));
        }
    }

    /**
     * Read original data from a two column text file. The name is set to the
     * file's base name. Scaling and offset are kept.
     *
     * @param file the pattern file.
     * @throws IOException if the file cannot be read; a
     *                     {@link MalformedPatternException} if it cannot be parsed. The pattern is
     *                     unchanged in either case.
     */
    public void load(File file) throws IOException {
        double[][] data = new PatternFilter().readFile(file);
        String oldFilename = filename;
        String oldName = name;
        double[] oldX = originalX;
        double[] oldY = originalY;
        update(() -> {
            filename = file.getPath();
            name = PatternFilter.patternName(file);
            originalX = data[0];
            originalY = data[1];
        }, () -> {
            filename = oldFilename;
            name = oldName;
            originalX = oldX;
            originalY = oldY;
        });
    }

    /**
     * Write the original data as two columns.
     *
     * @param file   destination.
     * @param header header text, written as '#' comment lines (may be empty).
     * @throws IOException if the file cannot be written.
     */
    public void save(File file, String header) throws IOException {
        new PatternFilter().writeFile(file, originalX, originalY, header);
    }

    /**
     * Replace the original data; scaling is reset to 1 and offset to 0.
     *
     * @param x new original x values.
     * @param y new original y values.
     */
    public void setData(double[] x, double[] y) {
        checkLengths(x, y);
        double[] newX = x.clone();
        double[] newY = y.clone();
        double[] oldX = originalX;
        double[] oldY = originalY;
        double oldScaling = scaling;
        double oldOffset = offset;
        update(() -> {
            originalX = newX;
            originalY = newY;
            scaling = 1.0;
            offset = 0.0;
        }, () -> {
            originalX = oldX;
            originalY = oldY;
            scaling = oldScaling;
            offset = oldOffset;
        });
    }

    /**
     * Set the additive offset.
     *
     * @param offset the offset.
     */
    public void setOffset(double offset) {
        double old = this.offset;
        update(() -> this.offset = offset, () -> this.offset = old);
    }

    /**
     * Set the multiplicative scaling; negative values are floored to 0.
     *
     * @param scaling the scaling.
     */
    public void setScaling(double scaling) {
        double old = this.scaling;
        double value = scaling < 0.0 ? 0.0 : scaling;
        update(() -> this.scaling = value, () -> this.scaling = old);
    }

    /**
     * Set the Gaussian smoothing width, in samples (0 disables smoothing).
     *
     * @param smoothing the standard deviation of the smoothing kernel in samples.
     */
    public void setSmoothing(double smoothing) {
        if (!(smoothing >= 0.0)) {
            throw new IllegalArgumentException(format(" Smoothing width must be non-negative: %s", smoothing));
        }
        double old = this.smoothing;
        update(() -> this.smoothing = smoothing, () -> this.smoothing = old);
    }

    /**
     * Use the derived data of another pattern as background. This pattern
     * follows every later change of the background pattern.
     *
     * @param pattern the background pattern, or null to unset it.
     * @throws IllegalArgumentException if the pattern is this pattern or
     *                                  (transitively) uses this pattern as its background.
     */
    public void setBackgroundPattern(Pattern pattern) {
        if (pattern == null) {
            unsetBackgroundPattern();
            return;
        }
        for (Pattern p = pattern; p != null; p = p.backgroundPattern) {
            if (p == this) {
                throw new IllegalArgumentException(format(
                        " Pattern %s cannot use %s as background: the background chain would be cyclic.",
                        name, pattern.name));
            }
        }
        Pattern previous = backgroundPattern;
        update(() -> {
            if (previous != null) {
                previous.removePatternListener(backgroundListener);
            }
            backgroundPattern = pattern;
            pattern.addPatternListener(backgroundListener);
        }, () -> {
            pattern.removePatternListener(backgroundListener);
            backgroundPattern = previous;
            if (previous != null) {
                previous.addPatternListener(backgroundListener);
            }
        });
    }

    /**
     * Stop using a background pattern.
     */
    public void unsetBackgroundPattern() {
        Pattern previous = backgroundPattern;
        update(() -> {
            if (previous != null) {
                previous.removePatternListener(backgroundListener);
            }
            backgroundPattern = null;
        }, () -> {
            backgroundPattern = previous;
            if (previous != null) {
                previous.addPatternListener(backgroundListener);
            }
        });
    }

    /**
     * Enable automatic background subtraction over the whole pattern.
     *
     * @param parameters the extractor parameters.
     */
    public void setAutoBackgroundSubtraction(BackgroundParameters parameters) {
        setAutoBackgroundSubtraction(parameters, null);
    }

    /**
     * Enable automatic background subtraction.
     *
     * @param parameters the extractor parameters.
     * @param roi        the x range {min, max} to extract the background from, or
     *                   null for the whole pattern. It is clamped to the data extent.
     */
    public void setAutoBackgroundSubtraction(BackgroundParameters parameters, double[] roi) {
        if (parameters == null) {
            throw new IllegalArgumentException(" Background parameters are required.");
        }
        if (roi != null && roi.length != 2) {
            throw new IllegalArgumentException(format(" A region of interest needs 2 bounds, not %d.", roi.length));
        }
        double[] newRoi = roi == null ? null : roi.clone();
        boolean oldEnabled = autoBackgroundSubtraction;
        BackgroundParameters oldParameters = autoBackgroundParameters;
        double[] oldRoi = autoBackgroundRoi;
        update(() -> {
            autoBackgroundSubtraction = true;
            autoBackgroundParameters = parameters;
            autoBackgroundRoi = newRoi;
        }, () -> {
            autoBackgroundSubtraction = oldEnabled;
            autoBackgroundParameters = oldParameters;
            autoBackgroundRoi = oldRoi;
        });
    }

    /**
     * Disable automatic background subtraction. Parameters and region of
     * interest are kept for the next time it is enabled.
     */
    public void unsetAutoBackgroundSubtraction() {
        boolean oldEnabled = autoBackgroundSubtraction;
        update(() -> autoBackgroundSubtraction = false, () -> autoBackgroundSubtraction = oldEnabled);
    }

    /**
     * Replace the automatic background extractor.
     *
     * @param extractor the extractor.
     */
    public void setBackgroundExtractor(BackgroundExtractor extractor) {
        if (extractor == null) {
            throw new IllegalArgumentException(" A background extractor is required.");
        }
        BackgroundExtractor old = backgroundExtractor;
        update(() -> backgroundExtractor = extractor, () -> backgroundExtractor = old);
    }

    /**
     * Apply a change, recalculate and notify listeners. If the recalculation
     * fails the change is reverted before the exception propagates.
     */
    private void update(Runnable change, Runnable revert) {
        change.run();
        try {
            recalculate();
        } catch (RuntimeException e) {
            revert.run();
            throw e;
        }
        firePatternChanged();
    }

    /**
     * Recalculate the derived data from the original data and the current
     * parameters, then notify listeners.
     *
     * @throws RangeOverlapException if the background pattern or the region of
     *                               interest does not overlap the data.
     * @throws IllegalStateException if called again while this pattern is
     *                               recalculating or notifying its listeners.
     */
    public void recalculatePattern() {
        recalculate();
        firePatternChanged();
    }

    private void recalculate() {
        if (recalculating) {
            throw new IllegalStateException(format(" Pattern %s was modified during its own recalculation.", name));
        }
        recalculating = true;
        try {
            int n = originalX.length;
            double[] px = originalX;
            double[] py = new double[n];
            for (int i = 0; i < n; i++) {
                py[i] = originalY[i] * scaling + offset;
            }

            if (backgroundPattern != null) {
                AlignedSeries aligned = GridAligner.align(px, py, backgroundPattern.x, backgroundPattern.y,
                        InterpolationKind.LINEAR, name);
                px = aligned.getX();
                double[] signal = aligned.getYA();
                double[] background = aligned.getYB();
                py = new double[px.length];
                for (int i = 0; i < px.length; i++) {
                    py[i] = signal[i] - background[i];
                }
            }

            Pattern beforeSubtraction = null;
            Pattern extracted = null;
            double[] roi = autoBackgroundRoi;
            if (autoBackgroundSubtraction) {
                beforeSubtraction = new Pattern(px, py, name);
                if (roi != null) {
                    roi = clampToExtent(roi, px);
                    int m = 0;
                    double[] cx = new double[px.length];
                    double[] cy = new double[px.length];
                    for (int i = 0; i < px.length; i++) {
                        if (px[i] >= roi[0] && px[i] <= roi[1]) {
                            cx[m] = px[i];
                            cy[m] = py[i];
                            m++;
                        }
                    }
                    if (m == 0) {
                        throw new RangeOverlapException(name);
                    }
                    px = copyOf(cx, m);
                    py = copyOf(cy, m);
                }
                double[] background = backgroundExtractor.extractBackground(px.clone(), py.clone(),
                        autoBackgroundParameters);
                if (background == null || background.length != px.length) {
                    throw new IllegalStateException(format(
                            " The background extractor returned %d values for %d points of pattern %s.",
                            background == null ? 0 : background.length, px.length, name));
                }
                extracted = new Pattern(px, background, name);
                for (int i = 0; i < px.length; i++) {
                    py[i] -= background[i];
                }
            }

            if (smoothing > 0.0) {
                py = GaussianFilter.filter(py, smoothing);
            }

            x = px;
            y = py;
            autoBackgroundRoi = roi;
            autoBackgroundBeforeSubtractionPattern = beforeSubtraction;
            autoBackgroundPattern = extracted;

            if (logger.isLoggable(Level.FINE)) {
                logger.fine(format(" Recalculated pattern %s: %d of %d points (scaling %g, offset %g, smoothing %g).",
                        name, x.length, n, scaling, offset, smoothing));
            }
        } finally {
            recalculating = false;
        }
    }

    /**
     * Clamp a region of interest to the extent of x; the bounds may be given
     * in either order.
     */
    private static double[] clampToExtent(double[] roi, double[] x) {
        double lower = min(roi[0], roi[1]);
        double upper = max(roi[0], roi[1]);
        if (x.length == 0) {
            return new double[]{lower, upper};
        }
        double xMin = x[0];
        double xMax = x[0];
        for (double v : x) {
            xMin = min(xMin, v);
            xMax = max(xMax, v);
        }
        return new double[]{max(lower, xMin), min(upper, xMax)};
    }

    /**
     * Notify every listener, even if an earlier one fails. The first failure
     * is rethrown afterwards with any later failures attached as suppressed.
     */
    private void firePatternChanged() {
        RuntimeException failure = null;
        recalculating = true;
        try {
            for (PatternListener listener : listeners) {
                try {
                    listener.patternChanged(x.clone(), y.clone());
                } catch (RuntimeException e) {
                    logger.warning(format(" A listener of pattern %s failed: %s", name, e));
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        } finally {
            recalculating = false;
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Register a listener; registering the same listener twice has no effect.
     *
     * @param listener the listener.
     */
    public void addPatternListener(PatternListener listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    /**
     * Remove a listener.
     *
     * @param listener the listener.
     */
    public void removePatternListener(PatternListener listener) {
        listeners.remove(listener);
    }

    /**
     * Add another pattern (cubic interpolation onto the overlap if the grids
     * differ).
     *
     * @param other the other pattern.
     * @return a new, detached pattern.
     */
    public Pattern add(Pattern other) {
        return PatternAlgebra.add(this, other);
    }

    /**
     * Subtract another pattern (cubic interpolation onto the overlap if the
     * grids differ).
     *
     * @param other the other pattern.
     * @return a new, detached pattern.
     */
    public Pattern subtract(Pattern other) {
        return PatternAlgebra.subtract(this, other);
    }

    /**
     * Multiply by a scalar. Unlike {@link #setScaling(double)} negative factors
     * are allowed.
     *
     * @param factor the factor.
     * @return a new, detached pattern.
     */
    public Pattern multiply(double factor) {
        return PatternAlgebra.multiply(this, factor);
    }

    /**
     * A new pattern holding the derived points strictly between xMin and xMax.
     *
     * @param xMin lower bound (exclusive).
     * @param xMax upper bound (exclusive).
     * @return a new, detached pattern.
     */
    public Pattern limit(double xMin, double xMax) {
        int m = 0;
        double[] lx = new double[x.length];
        double[] ly = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            if (xMin < x[i] && x[i] < xMax) {
                lx[m] = x[i];
                ly[m] = y[i];
                m++;
            }
        }
        return new Pattern(copyOf(lx, m), copyOf(ly, m), name);
    }

    /**
     * Whether a background pattern or automatic background is in use.
     *
     * @return true if a background is subtracted.
     */
    public boolean hasBackground() {
        return backgroundPattern != null || autoBackgroundSubtraction;
    }

    /**
     * Derived data as {x, y}.
     *
     * @return copies of the derived x and y values.
     */
    public double[][] getData() {
        return new double[][]{x.clone(), y.clone()};
    }

    public double[] getX() {
        return x.clone();
    }

    public double[] getY() {
        return y.clone();
    }

    public double[] getOriginalX() {
        return originalX.clone();
    }

    public double[] getOriginalY() {
        return originalY.clone();
    }

    /**
     * Number of original data points.
     *
     * @return the original length.
     */
    public int size() {
        return originalX.length;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getFilename() {
        return filename;
    }

    public double getOffset() {
        return offset;
    }

    public double getScaling() {
        return scaling;
    }

    public double getSmoothing() {
        return smoothing;
    }

    public Pattern getBackgroundPattern() {
        return backgroundPattern;
    }

    public boolean isAutoBackgroundSubtraction() {
        return autoBackgroundSubtraction;
    }

    public BackgroundParameters getAutoBackgroundParameters() {
        return autoBackgroundParameters;
    }

    /**
     * The region of interest for automatic background extraction, clamped to
     * the data extent by the last recalculation.
     *
     * @return a copy of {min, max}, or null for the whole pattern.
     */
    public double[] getAutoBackgroundRoi() {
        return autoBackgroundRoi == null ? null : autoBackgroundRoi.clone();
    }

    public BackgroundExtractor getBackgroundExtractor() {
        return backgroundExtractor;
    }

    /**
     * The data before automatic background subtraction (after the reference
     * background was subtracted).
     *
     * @return a detached pattern, or null if automatic background is disabled.
     */
    public Pattern getAutoBackgroundBeforeSubtractionPattern() {
        return autoBackgroundBeforeSubtractionPattern;
    }

    /**
     * The automatically extracted background.
     *
     * @return a detached pattern, or null if automatic background is disabled.
     */
    public Pattern getAutoBackgroundPattern() {
        return autoBackgroundPattern;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toString() {
        if (x.length == 0) {
            return format("Pattern %s with no points.", name);
        }
        return format("Pattern %s with %d points from %9.3g to %9.3g.", name, x.length, x[0], x[x.length - 1]);
    }
}
