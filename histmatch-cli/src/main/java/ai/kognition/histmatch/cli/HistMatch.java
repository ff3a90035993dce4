/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.histmatch.cli;

import java.io.File;
import java.io.IOException;
import java.util.Properties;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.histmatch.image.HistogramMatchException;
import ai.kognition.histmatch.image.ImageFile;
import ai.kognition.histmatch.image.RgbRaster;
import ai.kognition.histmatch.image.calc.HistogramMatcher;
import ai.kognition.histmatch.image.calc.TieBreak;
import ai.kognition.histmatch.util.CommandLineParser;
import ai.kognition.histmatch.util.PropertiesUtils;
import ai.kognition.histmatch.util.Timer;

/**
 * Command line front end: reads a source and a reference image, matches the source's
 * histograms to the reference's and writes the result.
 */
public class HistMatch {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistMatch.class);

    public static final String CONFIG_SECTION = "histmatch";
    public static final String PROP_TIEBREAK = "tiebreak";
    public static final String PROP_PARALLEL = "parallel";
    public static final String PROP_OUTPUT_SUFFIX = "output.suffix";

    public static final String DEFAULT_OUTPUT_SUFFIX = "-matched";

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILED = 2;

    final String sourceFileName;
    final String referenceFileName;
    final String outputFileName;
    final TieBreak tieBreak;
    final boolean parallel;

    HistMatch(final String sourceFileName, final String referenceFileName, final String outputFileName, final TieBreak tieBreak,
        final boolean parallel) {
        this.sourceFileName = sourceFileName;
        this.referenceFileName = referenceFileName;
        this.outputFileName = outputFileName;
        this.tieBreak = tieBreak;
        this.parallel = parallel;
    }

    public static void main(final String[] args) {
        final int status = run(args);
        if(status != EXIT_OK)
            System.exit(status);
    }

    /**
     * Does everything {@link #main(String[])} does except exit the VM.
     */
    public static int run(final String[] args) {
        final HistMatch hm;
        try {
            hm = commandLine(args);
        } catch(final IllegalArgumentException iae) {
            LOGGER.error(iae.getMessage());
            usage();
            return EXIT_USAGE;
        }

        if(hm == null) {
            usage();
            return EXIT_USAGE;
        }

        try {
            hm.execute();
            return EXIT_OK;
        } catch(final IOException | HistogramMatchException | IllegalArgumentException e) {
            LOGGER.error("Failed to match '{}' to '{}'", hm.sourceFileName, hm.referenceFileName, e);
            return EXIT_FAILED;
        }
    }

    void execute() throws IOException {
        final Timer totalTime = Timer.started();

        final RgbRaster source = ImageFile.readRasterFromFile(sourceFileName);
        final RgbRaster reference = ImageFile.readRasterFromFile(referenceFileName);
        LOGGER.info("Matching {} ({}x{}) to {} ({}x{}) using {}", sourceFileName, source.width(), source.height(), referenceFileName,
            reference.width(), reference.height(), tieBreak);

        final HistogramMatcher matcher = new HistogramMatcher.Builder()
            .tieBreak(tieBreak)
            .parallelChannels(parallel)
            .build();

        ImageFile.writeImageFile(matcher.matchInPlace(source, reference), outputFileName);

        LOGGER.info("Wrote {} in {} seconds", outputFileName, totalTime.stop());
    }

    static String defaultOutputFileName(final String sourceFileName, final String suffix) {
        final String dir = FilenameUtils.getFullPath(sourceFileName);
        final String base = FilenameUtils.getBaseName(sourceFileName);
        final String ext = FilenameUtils.getExtension(sourceFileName);
        return dir + base + suffix + (ext.isEmpty() ? "" : FilenameUtils.EXTENSION_SEPARATOR_STR + ext);
    }

    /**
     * Returns null when the command line asks for help or is missing something required.
     *
     * @throws IllegalArgumentException if an option value can't be understood.
     */
    static HistMatch commandLine(final String[] args) {
        final CommandLineParser cl = new CommandLineParser(args);

        // see if we are asking for help
        if(cl.getProperty("help") != null || cl.getProperty("-help") != null)
            return null;

        final Properties config = new Properties();
        final String configFile = cl.getProperty("config");
        if(configFile != null) {
            if(!new File(configFile).exists())
                throw new IllegalArgumentException("Config file " + configFile + " doesn't exist");
            if(!PropertiesUtils.loadProps(config, configFile))
                throw new IllegalArgumentException("Couldn't read config file " + configFile);
        }
        final Properties section = PropertiesUtils.getSection(config, CONFIG_SECTION, true);

        final String source = cl.getProperty("s");
        final String reference = cl.getProperty("r");
        if(source == null || reference == null || "true".equals(source) || "true".equals(reference)) {
            LOGGER.error("Both a source (-s) and a reference (-r) image are required");
            return null;
        }

        final TieBreak tieBreak = TieBreak.parse(cl.getProperty("tiebreak",
            PropertiesUtils.getString(section, PROP_TIEBREAK, TieBreak.FIRST_INDEX_WINS.name())));

        final boolean parallel = cl.getProperty("parallel") != null ? cl.isSet("parallel")
            : PropertiesUtils.getBoolean(section, PROP_PARALLEL, false);

        final String outputOption = cl.getProperty("o");
        if("true".equals(outputOption)) {
            LOGGER.error("The output option (-o) needs a file name");
            return null;
        }
        final String output = outputOption != null ? outputOption
            : defaultOutputFileName(source, PropertiesUtils.getString(section, PROP_OUTPUT_SUFFIX, DEFAULT_OUTPUT_SUFFIX));

        return new HistMatch(source, reference, output, tieBreak, parallel);
    }

    private static void usage() {
        System.out.println("usage: java [javaargs] " + HistMatch.class.getName()
            + " -s sourceImage -r referenceImage [-o outputImage] [-config file.properties] [-tiebreak first|last] [-parallel]");
        System.out.println("       -o defaults to the source's name with \"" + DEFAULT_OUTPUT_SUFFIX + "\" added before the extension.");
        System.out.println("       -config properties: " + CONFIG_SECTION + "." + PROP_TIEBREAK + ", " + CONFIG_SECTION + "." + PROP_PARALLEL
            + ", " + CONFIG_SECTION + "." + PROP_OUTPUT_SUFFIX);
    }
}
