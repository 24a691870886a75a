/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.spectrum.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.background.BackgroundEstimator;
import com.twentyn.spectrum.background.BackgroundParameters;
import com.twentyn.spectrum.background.FilterOrder;
import com.twentyn.spectrum.background.WindowDirection;
import com.twentyn.spectrum.search.Peak;
import com.twentyn.spectrum.search.PeakSearchParameters;
import com.twentyn.spectrum.search.PeakSearcher;
import com.twentyn.spectrum.utils.SpectrumTSV;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class SpectrumAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumAnalyzer.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private static final String OPTION_INPUT_PATH = "i";
  private static final String OPTION_OUTPUT_PATH = "o";
  private static final String OPTION_SIGMA = "s";
  private static final String OPTION_THRESHOLD = "t";
  private static final String OPTION_NO_BACKGROUND = "no-background";
  private static final String OPTION_NO_MARKOV = "no-markov";
  private static final String OPTION_NO_DECONVOLUTION = "no-deconvolution";
  private static final String OPTION_AVERAGE_WINDOW = "w";
  private static final String OPTION_DECON_ITERATIONS = "d";
  private static final String OPTION_MAX_PEAKS = "m";
  private static final String OPTION_RESOLUTION = "r";
  private static final String OPTION_BACKGROUND_OUTPUT = "b";
  private static final String OPTION_BACKGROUND_ORDER = "n";
  private static final String OPTION_BACKGROUND_WINDOW = "W";
  private static final String OPTION_COMPTON = "compton";

  private static final String DEFAULT_SIGMA = "2";
  private static final String DEFAULT_THRESHOLD = "5";
  private static final String DEFAULT_BACKGROUND_ORDER = "2";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class reads a spectrum (a TSV file with 'channel' and 'counts' columns), searches it for peaks after ",
      "optional background removal, Markov smoothing and deconvolution, and writes the peaks as a JSON document. ",
      "The estimated background can be written alongside as TSV."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_PATH)
        .argName("input path")
        .desc("A TSV file holding the spectrum to analyze")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT_PATH)
        .argName("output path")
        .desc("A path where the peaks should be written as JSON")
        .hasArg().required()
        .longOpt("output")
    );
    add(Option.builder(OPTION_SIGMA)
        .argName("sigma")
        .desc(String.format("Expected peak standard deviation in channels (default %s)", DEFAULT_SIGMA))
        .hasArg()
        .longOpt("sigma")
    );
    add(Option.builder(OPTION_THRESHOLD)
        .argName("percent")
        .desc(String.format("Peaks below this percentage of the tallest one are dropped (default %s)",
            DEFAULT_THRESHOLD))
        .hasArg()
        .longOpt("threshold")
    );
    add(Option.builder()
        .desc("Do not remove the background before searching")
        .longOpt(OPTION_NO_BACKGROUND)
    );
    add(Option.builder()
        .desc("Do not apply Markov smoothing before searching")
        .longOpt(OPTION_NO_MARKOV)
    );
    add(Option.builder()
        .desc("Search the spectrum without sharpening it by deconvolution")
        .longOpt(OPTION_NO_DECONVOLUTION)
    );
    add(Option.builder(OPTION_AVERAGE_WINDOW)
        .argName("channels")
        .desc(String.format("Markov averaging window (default %d)", PeakSearcher.DEFAULT_AVERAGE_WINDOW))
        .hasArg()
        .longOpt("average-window")
    );
    add(Option.builder(OPTION_DECON_ITERATIONS)
        .argName("iterations")
        .desc(String.format("Number of deconvolution iterations (default %d)", PeakSearcher.DEFAULT_DECON_ITERATIONS))
        .hasArg()
        .longOpt("decon-iterations")
    );
    add(Option.builder(OPTION_MAX_PEAKS)
        .argName("count")
        .desc(String.format("Maximum number of peaks to report (default %d)", PeakSearcher.DEFAULT_MAX_PEAKS))
        .hasArg()
        .longOpt("max-peaks")
    );
    add(Option.builder(OPTION_RESOLUTION)
        .argName("resolution")
        .desc("Peaks closer than sigma / resolution channels are merged (default 1)")
        .hasArg()
        .longOpt("resolution")
    );
    add(Option.builder(OPTION_BACKGROUND_OUTPUT)
        .argName("background path")
        .desc("A path where the estimated background should be written as TSV")
        .hasArg()
        .longOpt("background-output")
    );
    add(Option.builder(OPTION_BACKGROUND_ORDER)
        .argName("order")
        .desc("Filter order of the written background, one of 2, 4, 6, 8 (default 2)")
        .hasArg()
        .longOpt("background-order")
    );
    add(Option.builder(OPTION_BACKGROUND_WINDOW)
        .argName("channels")
        .desc("Clipping window of the written background (default 7 * sigma)")
        .hasArg()
        .longOpt("background-window")
    );
    add(Option.builder()
        .desc("Follow Compton edges in the written background")
        .longOpt(OPTION_COMPTON)
    );
    add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );
  }};

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();

  static {
    HELP_FORMATTER.setWidth(100);
  }

  public static class AnalysisReport {
    @JsonProperty("channels")
    private Integer channels;

    @JsonProperty("buffer_full")
    private Boolean bufferFull;

    @JsonProperty("peaks")
    private List<Peak> peaks;

    protected AnalysisReport() {

    }

    public AnalysisReport(Integer channels, Boolean bufferFull, List<Peak> peaks) {
      this.channels = channels;
      this.bufferFull = bufferFull;
      this.peaks = peaks;
    }

    public Integer getChannels() {
      return channels;
    }

    public Boolean getBufferFull() {
      return bufferFull;
    }

    public List<Peak> getPeaks() {
      return peaks;
    }
  }

  public static void main(String[] args) throws Exception {
    Options opts = buildOptions();

    CommandLine cl = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cl = parser.parse(opts, args);
    } catch (ParseException e) {
      System.err.format("Argument parsing failed: %s\n", e.getMessage());
      HELP_FORMATTER.printHelp(SpectrumAnalyzer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(SpectrumAnalyzer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT_PATH));
    if (!inputFile.exists()) {
      System.err.format("Spectrum file at %s does not exist, nothing to analyze\n", inputFile.getAbsolutePath());
      HELP_FORMATTER.printHelp(SpectrumAnalyzer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    SpectrumAnalyzer analyzer = new SpectrumAnalyzer();
    try {
      analyzer.runAnalysis(cl, inputFile, new File(cl.getOptionValue(OPTION_OUTPUT_PATH)));
    } catch (NumberFormatException | SpectrumConfigurationException e) {
      System.err.format("Invalid analysis settings: %s\n", e.getMessage());
      HELP_FORMATTER.printHelp(SpectrumAnalyzer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    LOGGER.info("Done");
  }

  public AnalysisReport runAnalysis(CommandLine cl, File inputFile, File outputFile) throws IOException {
    LOGGER.info("Reading spectrum from %s", inputFile.getAbsolutePath());
    double[] spectrum = new SpectrumTSV().parse(inputFile);

    PeakSearcher searcher = searcherFromCommandLine(cl);
    PeakSearchParameters params = parametersFromCommandLine(cl);
    Optional<File> backgroundFile = cl.hasOption(OPTION_BACKGROUND_OUTPUT) ?
        Optional.of(new File(cl.getOptionValue(OPTION_BACKGROUND_OUTPUT))) : Optional.empty();

    LOGGER.info("Searching %d channels for peaks with %s", spectrum.length, params);
    searcher.search(spectrum, params);
    LOGGER.info("Found %d peaks", searcher.getNumberOfPeaks());

    AnalysisReport report = new AnalysisReport(spectrum.length, searcher.isOverflowed(), searcher.getPeaks());
    try (FileOutputStream fos = new FileOutputStream(outputFile)) {
      OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(fos, report);
    }

    // Don't use Optional.map here because exceptions.
    if (backgroundFile.isPresent()) {
      BackgroundParameters backgroundParameters = backgroundFromCommandLine(cl, params.getSigma(), spectrum.length);
      LOGGER.info("Writing background estimated with %s to %s", backgroundParameters,
          backgroundFile.get().getAbsolutePath());
      double[] background = new BackgroundEstimator().estimate(spectrum, backgroundParameters);
      new SpectrumTSV().write(backgroundFile.get(), background);
    }

    return report;
  }

  static PeakSearcher searcherFromCommandLine(CommandLine cl) {
    PeakSearcher searcher = new PeakSearcher();
    if (cl.hasOption(OPTION_MAX_PEAKS)) {
      searcher.setMaxPeaks(Integer.parseInt(cl.getOptionValue(OPTION_MAX_PEAKS)));
    }
    if (cl.hasOption(OPTION_RESOLUTION)) {
      searcher.setResolution(Double.parseDouble(cl.getOptionValue(OPTION_RESOLUTION)));
    }
    if (cl.hasOption(OPTION_AVERAGE_WINDOW)) {
      searcher.setAverageWindow(Integer.parseInt(cl.getOptionValue(OPTION_AVERAGE_WINDOW)));
    }
    if (cl.hasOption(OPTION_DECON_ITERATIONS)) {
      searcher.setDeconIterations(Integer.parseInt(cl.getOptionValue(OPTION_DECON_ITERATIONS)));
    }
    return searcher;
  }

  static PeakSearchParameters parametersFromCommandLine(CommandLine cl) {
    return new PeakSearchParameters(
        Double.parseDouble(cl.getOptionValue(OPTION_SIGMA, DEFAULT_SIGMA)),
        Double.parseDouble(cl.getOptionValue(OPTION_THRESHOLD, DEFAULT_THRESHOLD)),
        !cl.hasOption(OPTION_NO_BACKGROUND),
        !cl.hasOption(OPTION_NO_MARKOV),
        !cl.hasOption(OPTION_NO_DECONVOLUTION)
    );
  }

  static BackgroundParameters backgroundFromCommandLine(CommandLine cl, double sigma, int channels) {
    int window = cl.hasOption(OPTION_BACKGROUND_WINDOW) ?
        Integer.parseInt(cl.getOptionValue(OPTION_BACKGROUND_WINDOW)) :
        Math.max(1, Math.min((int) (7 * sigma + 0.5), (channels - 1) / 2));
    FilterOrder order = FilterOrder.fromPoints(
        Integer.parseInt(cl.getOptionValue(OPTION_BACKGROUND_ORDER, DEFAULT_BACKGROUND_ORDER)));
    return new BackgroundParameters(window, WindowDirection.INCREASING, order, false,
        BackgroundParameters.DEFAULT_SMOOTH_WINDOW, cl.hasOption(OPTION_COMPTON));
  }

  static Options buildOptions() {
    Options opts = new Options();
    for (Option.Builder b : OPTION_BUILDERS) {
      opts.addOption(b.build());
    }
    return opts;
  }
}
