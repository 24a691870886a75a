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

package com.twentyn.spectrum.search;

import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.background.BackgroundEstimator;
import com.twentyn.spectrum.background.BackgroundParameters;
import com.twentyn.spectrum.deconvolution.DeconvolutionParameters;
import com.twentyn.spectrum.deconvolution.DeconvolutionResult;
import com.twentyn.spectrum.deconvolution.GoldDeconvolver;
import com.twentyn.spectrum.deconvolution.ResponseKernel;
import com.twentyn.spectrum.smoothing.MarkovSmoother;
import com.twentyn.spectrum.utils.SpectrumArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * High resolution peak search (Morhac's SearchHighRes): the spectrum is optionally stripped of its background and
 * Markov-smoothed, then sharpened by Gold deconvolution against a Gaussian of the expected peak width, and the local
 * maxima of the sharpened spectrum become peaks.
 *
 * Candidates are ranked by sharpened height (lower channel first on ties) and accepted greedily as long as they keep
 * a distance of sigma / resolution channels to every accepted peak, so of two close maxima only the taller one
 * survives.  At most {@link #getMaxPeaks()} peaks are kept, the tallest ones.
 *
 * Each instance owns the results of its last search.  Instances are not safe for concurrent searches; use one per
 * thread or serialize calls.
 */
public class PeakSearcher {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakSearcher.class);

  public static final int DEFAULT_MAX_PEAKS = 100;
  public static final double DEFAULT_RESOLUTION = 1.0;
  public static final int DEFAULT_AVERAGE_WINDOW = MarkovSmoother.DEFAULT_AVERAGE_WINDOW;
  public static final int DEFAULT_DECON_ITERATIONS = 3;

  // The background clipping window spans this many sigmas.
  private static final double BACKGROUND_WINDOW_SIGMAS = 7.0;

  private static final Comparator<Candidate> BY_HEIGHT_THEN_CHANNEL = new Comparator<Candidate>() {
    @Override
    public int compare(Candidate o1, Candidate o2) {
      int byHeight = Double.compare(o2.height, o1.height);
      return byHeight != 0 ? byHeight : Integer.compare(o1.channel, o2.channel);
    }
  };

  private int maxPeaks = DEFAULT_MAX_PEAKS;
  private double resolution = DEFAULT_RESOLUTION;
  private int averageWindow = DEFAULT_AVERAGE_WINDOW;
  private DeconvolutionParameters deconvolutionParameters = DeconvolutionParameters.of(DEFAULT_DECON_ITERATIONS);

  private BackgroundEstimator backgroundEstimator = new BackgroundEstimator();
  private MarkovSmoother markovSmoother = new MarkovSmoother();
  private GoldDeconvolver deconvolver = new GoldDeconvolver();

  // Results of the last search.
  private List<Peak> peaks = Collections.emptyList();
  private double[] sharpened = null;
  private boolean overflowed = false;

  public PeakSearcher() {
  }

  public PeakSearcher(int maxPeaks) {
    setMaxPeaks(maxPeaks);
  }

  public PeakSearcher(int maxPeaks, double resolution) {
    setMaxPeaks(maxPeaks);
    setResolution(resolution);
  }

  /**
   * Searches with background removal, Markov smoothing and deconvolution enabled.
   */
  public int search(double[] source, double sigma, double threshold) {
    return search(source, PeakSearchParameters.defaults(sigma, threshold));
  }

  /**
   * Locates the peaks of a spectrum.  Previous results are discarded first, even when the request is rejected.
   * @param source The spectrum; it is not modified.
   * @param params Peak width, threshold and the stages to run.
   * @return The number of peaks found, also available through {@link #getNumberOfPeaks()}.
   * @throws SpectrumConfigurationException If sigma is not positive, the threshold is outside [0, 100] or the spectrum
   *                                        is empty.
   */
  public int search(double[] source, PeakSearchParameters params) {
    this.peaks = Collections.emptyList();
    this.sharpened = null;
    this.overflowed = false;

    if (params == null) {
      throw new SpectrumConfigurationException("Peak search parameters must not be null");
    }
    if (!(params.getSigma() > 0) || Double.isInfinite(params.getSigma())) {
      throw new SpectrumConfigurationException("Invalid sigma %f, must be positive", params.getSigma());
    }
    if (!(params.getThreshold() >= 0 && params.getThreshold() <= 100)) {
      throw new SpectrumConfigurationException("Invalid threshold %f, must be in [0, 100]", params.getThreshold());
    }
    SpectrumArrays.checkSpectrum(source, "Source spectrum");

    int size = source.length;
    double sigma = params.getSigma();
    double[] working = new double[size];
    for (int i = 0; i < size; i++) {
      working[i] = Math.max(source[i], 0.0);
    }

    if (params.isBackgroundRemove()) {
      int window = Math.min((int) (BACKGROUND_WINDOW_SIGMAS * sigma + 0.5), (size - 1) / 2);
      if (window >= 1) {
        working = backgroundEstimator.subtract(working, BackgroundParameters.defaults(window));
      } else {
        LOGGER.debug("Spectrum of %d channels is too short for background removal", size);
      }
    }

    if (params.isMarkov()) {
      working = markovSmoother.smooth(working, averageWindow);
    }

    if (params.isDeconvolution()) {
      // A kernel wider than the spectrum has no channels to act on beyond it.
      double halfWidth = Math.min(Math.ceil(ResponseKernel.GAUSSIAN_CUTOFF_SIGMAS * sigma), size - 1);
      DeconvolutionResult result = deconvolver.deconvolve(working,
          ResponseKernel.gaussian(sigma, (int) halfWidth), deconvolutionParameters);
      working = result.getValues();
    }
    this.sharpened = working;

    List<Candidate> accepted = enforceSeparation(findCandidates(working, params.getThreshold()), sigma / resolution);
    if (accepted.size() > maxPeaks) {
      LOGGER.warn("Peak buffer full: keeping the %d tallest of %d peaks", maxPeaks, accepted.size());
      this.overflowed = true;
      accepted = accepted.subList(0, maxPeaks);
    }

    List<Peak> found = new ArrayList<>(accepted.size());
    for (Candidate candidate : accepted) {
      found.add(new Peak(refinePosition(working, candidate.channel), source[candidate.channel]));
    }
    this.peaks = Collections.unmodifiableList(found);

    LOGGER.debug("Found %d peaks in %d channels with %s", found.size(), size, params);
    return found.size();
  }

  /**
   * Local maxima (s[i] > s[i-1] and s[i] >= s[i+1]) of the interior channels whose height exceeds `threshold` percent
   * of the spectrum maximum, tallest first and lower channel first among equal heights.
   */
  static List<Candidate> findCandidates(double[] sharpened, double threshold) {
    List<Candidate> candidates = new ArrayList<>();
    double max = SpectrumArrays.max(sharpened);
    if (!(max > 0)) {
      return candidates;
    }
    double cutoff = threshold / 100.0 * max;
    for (int i = 1; i < sharpened.length - 1; i++) {
      if (sharpened[i] > sharpened[i - 1] && sharpened[i] >= sharpened[i + 1] && sharpened[i] > cutoff) {
        candidates.add(new Candidate(i, sharpened[i]));
      }
    }
    Collections.sort(candidates, BY_HEIGHT_THEN_CHANNEL);
    return candidates;
  }

  /**
   * Walks the ranked candidates and drops every one that lies closer than `minSeparation` channels to a candidate
   * already accepted.
   */
  static List<Candidate> enforceSeparation(List<Candidate> ranked, double minSeparation) {
    List<Candidate> accepted = new ArrayList<>();
    for (Candidate candidate : ranked) {
      boolean isolated = true;
      for (Candidate kept : accepted) {
        if (Math.abs(candidate.channel - kept.channel) < minSeparation) {
          isolated = false;
          break;
        }
      }
      if (isolated) {
        accepted.add(candidate);
      }
    }
    return accepted;
  }

  /**
   * Centroid of the maximum and its two neighbours, clamped to the spectrum.
   */
  static double refinePosition(double[] sharpened, int channel) {
    double weighted = 0.0;
    double total = 0.0;
    for (int j = Math.max(channel - 1, 0); j <= Math.min(channel + 1, sharpened.length - 1); j++) {
      weighted += j * sharpened[j];
      total += sharpened[j];
    }
    double position = total > 0 ? weighted / total : channel;
    return Math.max(0.0, Math.min(position, sharpened.length - 1));
  }

  public int getNumberOfPeaks() {
    return peaks.size();
  }

  /**
   * The peaks of the last search, tallest first.
   */
  public List<Peak> getPeaks() {
    return peaks;
  }

  public double[] getPositions() {
    double[] positions = new double[peaks.size()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = peaks.get(i).getPosition();
    }
    return positions;
  }

  public double[] getHeights() {
    double[] heights = new double[peaks.size()];
    for (int i = 0; i < heights.length; i++) {
      heights[i] = peaks.get(i).getHeight();
    }
    return heights;
  }

  /**
   * The spectrum the peaks were picked from (after background removal, smoothing and deconvolution, as configured),
   * or null if the last search was rejected.
   */
  public double[] getSharpened() {
    return sharpened == null ? null : sharpened.clone();
  }

  /**
   * True if the last search found more peaks than {@link #getMaxPeaks()} and had to drop the smallest ones.
   */
  public boolean isOverflowed() {
    return overflowed;
  }

  public int getMaxPeaks() {
    return maxPeaks;
  }

  public void setMaxPeaks(int maxPeaks) {
    if (maxPeaks <= 0) {
      throw new SpectrumConfigurationException("Maximum number of peaks must be positive, got %d", maxPeaks);
    }
    this.maxPeaks = maxPeaks;
  }

  public double getResolution() {
    return resolution;
  }

  /**
   * Higher values let peaks sit closer together: accepted peaks are at least sigma / resolution channels apart.
   */
  public void setResolution(double resolution) {
    if (!(resolution > 0) || Double.isInfinite(resolution)) {
      throw new SpectrumConfigurationException("Resolution must be positive, got %f", resolution);
    }
    this.resolution = resolution;
  }

  public int getAverageWindow() {
    return averageWindow;
  }

  public void setAverageWindow(int averageWindow) {
    if (averageWindow <= 0) {
      throw new SpectrumConfigurationException("Averaging window must be positive, got %d", averageWindow);
    }
    this.averageWindow = averageWindow;
  }

  public DeconvolutionParameters getDeconvolutionParameters() {
    return deconvolutionParameters;
  }

  public void setDeconvolutionParameters(DeconvolutionParameters deconvolutionParameters) {
    if (deconvolutionParameters == null) {
      throw new SpectrumConfigurationException("Deconvolution parameters must not be null");
    }
    this.deconvolutionParameters = deconvolutionParameters;
  }

  public void setDeconIterations(int deconIterations) {
    setDeconvolutionParameters(new DeconvolutionParameters(deconIterations,
        deconvolutionParameters.getNumberRepetitions(), deconvolutionParameters.getBoost()));
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append(String.format("PeakSearcher: %d peaks found (max %d)%s", peaks.size(), maxPeaks,
        overflowed ? ", buffer full" : ""));
    for (Peak peak : peaks) {
      builder.append(String.format("%n  position = %10.3f, height = %12.3f", peak.getPosition(), peak.getHeight()));
    }
    return builder.toString();
  }

  static final class Candidate {
    final int channel;
    final double height;

    Candidate(int channel, double height) {
      this.channel = channel;
      this.height = height;
    }
  }
}
