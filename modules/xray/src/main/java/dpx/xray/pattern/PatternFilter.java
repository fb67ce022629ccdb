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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FilenameUtils;

/**
 * The PatternFilter class reads and writes patterns stored as two columns of
 * text.
 * <p>
 * Lines starting with '#' and blank lines are ignored. Files with extension
 * "chi" carry 4 header lines. Files with extension "fxye" carry a header that
 * ends with the first line containing "BANK"; their x values are in
 * centidegrees and are divided by 100, unless the BANK line contains "CONQ".
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public class PatternFilter {

    private static final Logger logger = Logger.getLogger(PatternFilter.class.getName());

    /**
     * Header lines of a "chi" file.
     */
    public static final int CHI_HEADER_LINES = 4;

    /**
     * The name given to a pattern read from a file: its base name.
     *
     * @param file the pattern file.
     * @return the file name without directory and extension.
     */
    public static String patternName(File file) {
        return FilenameUtils.getBaseName(file.getName());
    }

    /**
     * Read a pattern file.
     *
     * @param file the pattern file.
     * @return {x, y}.
     * @throws IOException if the file cannot be read, or a
     *                     {@link MalformedPatternException} if it does not hold two equal
     *                     length numeric columns.
     */
    public double[][] readFile(File file) throws IOException {
        String extension = FilenameUtils.getExtension(file.getName()).toLowerCase(Locale.ROOT);
        List<String> lines = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            String str;
            while ((str = br.readLine()) != null) {
                lines.add(str);
            }
        }

        int skip = 0;
        double factor = 1.0;
        if (extension.equals("chi")) {
            skip = CHI_HEADER_LINES;
        } else if (extension.equals("fxye")) {
            factor = 1.0 / 100.0;
            skip = -1;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.contains("BANK")) {
                    skip = i + 1;
                    if (line.contains("CONQ")) {
                        factor = 1.0;
                    }
                    break;
                }
            }
            if (skip < 0) {
                throw new MalformedPatternException(format(" No BANK line in %s.", file.getName()));
            }
        }

        double[] x = new double[lines.size()];
        double[] y = new double[lines.size()];
        int n = 0;
        int columns = -1;
        for (int i = skip; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] tokens = line.split("\\s+");
            if (columns < 0) {
                columns = tokens.length;
            }
            if (tokens.length < 2 || tokens.length != columns) {
                throw new MalformedPatternException(format(" Line %d of %s has %d columns: %s",
                        i + 1, file.getName(), tokens.length, line));
            }
            try {
                x[n] = Double.parseDouble(tokens[0]) * factor;
                y[n] = Double.parseDouble(tokens[1]);
            } catch (NumberFormatException e) {
                throw new MalformedPatternException(format(" Line %d of %s is not numeric: %s",
                        i + 1, file.getName(), line), e);
            }
            n++;
        }
        if (n == 0) {
            throw new MalformedPatternException(format(" No data found in %s.", file.getName()));
        }

        if (logger.isLoggable(Level.INFO)) {
            logger.info(format(" Read %d points from %s (x from %g to %g).", n, file.getName(), x[0], x[n - 1]));
        }
        double[][] data = new double[2][n];
        System.arraycopy(x, 0, data[0], 0, n);
        System.arraycopy(y, 0, data[1], 0, n);
        return data;
    }

    /**
     * Write a pattern as two columns.
     *
     * @param file   destination.
     * @param x      x values.
     * @param y      y values.
     * @param header header text; each line is written with a leading "# ".
     * @throws IOException if the file cannot be written.
     */
    public void writeFile(File file, double[] x, double[] y, String header) throws IOException {
        if (x.length != y.length) {
            throw new IllegalArgumentException(format(" Cannot write %d x and %d y values.", x.length, y.length));
        }
        try (BufferedWriter bw = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            if (header != null && !header.isEmpty()) {
                for (String line : header.split("\\R", -1)) {
                    bw.write("# " + line);
                    bw.newLine();
                }
            }
            for (int i = 0; i < x.length; i++) {
                bw.write(String.format(Locale.US, "%.18e %.18e", x[i], y[i]));
                bw.newLine();
            }
        }
        logger.info(format(" Wrote %d points to %s.", x.length, file.getName()));
    }
}
