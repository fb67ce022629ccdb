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

package dpx.utilities;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.builder.fluent.PropertiesBuilderParameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The DPXProperties class assembles the layered configuration used by
 * pattern processing (background extraction defaults, axis units, tick
 * counts).
 *
 * @author Diffraction Pattern X Developers
 * @since 1.0
 */
public final class DPXProperties {

    private static final Logger logger = Logger.getLogger(DPXProperties.class.getName());

    /**
     * Classpath location of the built-in defaults.
     */
    public static final String DEFAULTS_RESOURCE = "dpx/defaults.properties";

    private DPXProperties() {
    }

    /**
     * Load properties without a pattern specific property file.
     *
     * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     */
    public static CompositeConfiguration loadProperties() {
        return loadProperties(null);
    }

    /**
     * This method sets up configuration properties in the following precedence
     * order:
     * <p>
     * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
     * System.setProperty("key","value") within Java code.
     * <p>
     * 2.) Pattern specific properties (for example sample.properties next to
     * sample.xy)
     * <p>
     * 3.) User specific properties (~/.dpx/dpx.properties)
     * <p>
     * 4.) System wide properties (file defined by environment variable
     * DPX_PROPERTIES)
     * <p>
     * 5.) Built-in defaults.
     *
     * @param file the pattern file, or null.
     * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     */
    public static CompositeConfiguration loadProperties(File file) {

        CompositeConfiguration properties = new CompositeConfiguration();

        /*
          JVM system properties are read first.
          a.) -Dkey=value from the Java command line
          b.) System.setProperty("key","value") within Java code.
         */
        PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
        systemConfiguration.append(new SystemConfiguration());
        systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
        properties.addConfiguration(systemConfiguration);

        // Pattern specific options are 2nd.
        if (file != null) {
            String patternBasename = FilenameUtils.removeExtension(file.getAbsolutePath());
            File patternPropFile = new File(patternBasename + ".properties");
            if (patternPropFile.exists() && patternPropFile.canRead()) {
                PropertiesConfiguration patternConfiguration = readProperties(
                        new Parameters().properties().setFile(patternPropFile), patternPropFile.getPath());
                if (patternConfiguration != null) {
                    patternConfiguration.setHeader("Pattern properties from (" + patternPropFile.getPath() + ").");
                    properties.addConfiguration(patternConfiguration);
                    try {
                        properties.addProperty("propertyFile", patternPropFile.getCanonicalPath());
                    } catch (IOException e) {
                        logger.log(Level.INFO, " Could not resolve {0}.", patternPropFile.getPath());
                    }
                }
            }
        }

        // User specific options are 3rd.
        String filename = System.getProperty("user.home") + File.separator + ".dpx" + File.separator + "dpx.properties";
        File userPropFile = new File(filename);
        if (userPropFile.exists() && userPropFile.canRead()) {
            PropertiesConfiguration userConfiguration = readProperties(
                    new Parameters().properties().setFile(userPropFile), filename);
            if (userConfiguration != null) {
                userConfiguration.setHeader("DPX user property file (" + filename + ").");
                properties.addConfiguration(userConfiguration);
            }
        }

        // System wide options are 2nd to last.
        filename = System.getenv("DPX_PROPERTIES");
        if (filename != null) {
            File systemPropFile = new File(filename);
            if (systemPropFile.exists() && systemPropFile.canRead()) {
                PropertiesConfiguration envConfiguration = readProperties(
                        new Parameters().properties().setFile(systemPropFile), filename);
                if (envConfiguration != null) {
                    envConfiguration.setHeader("Environment variable DPX_PROPERTIES (" + filename + ").");
                    properties.addConfiguration(envConfiguration);
                }
            }
        }

        // Built-in defaults are last.
        URL defaults = DPXProperties.class.getClassLoader().getResource(DEFAULTS_RESOURCE);
        if (defaults != null) {
            PropertiesConfiguration defaultConfiguration = readProperties(
                    new Parameters().properties().setURL(defaults), DEFAULTS_RESOURCE);
            if (defaultConfiguration != null) {
                defaultConfiguration.setHeader("Built-in defaults (" + DEFAULTS_RESOURCE + ").");
                properties.addConfiguration(defaultConfiguration);
            }
        }

        // Echo the interpolated configuration.
        if (logger.isLoggable(Level.FINE)) {
            Iterator<String> i = properties.getKeys();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("\n %-30s %s\n", "Property", "Value"));
            while (i.hasNext()) {
                String s = i.next();
                sb.append(String.format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
            }
            logger.fine(sb.toString());
        }

        return properties;
    }

    /**
     * Build a single properties layer; a layer that cannot be read is skipped.
     *
     * @param parameters builder parameters locating the source.
     * @param source     description of the source for logging.
     * @return the configuration, or null if it could not be read.
     */
    private static PropertiesConfiguration readProperties(PropertiesBuilderParameters parameters, String source) {
        try {
            FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
                    new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
                            .configure(parameters
                                    .setThrowExceptionOnMissing(false)
                                    .setIncludesAllowed(false));
            return builder.getConfiguration();
        } catch (ConfigurationException e) {
            logger.log(Level.INFO, " Error loading {0}.", source);
            return null;
        }
    }
}
