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

/**
 * Per-call settings of a peak search.  Values are checked by {@link PeakSearcher#search}, not here, so that an invalid
 * request still clears the searcher's previous results.
 */
public class PeakSearchParameters {
  public static final boolean DEFAULT_BACKGROUND_REMOVE = true;
  public static final boolean DEFAULT_MARKOV = true;
  public static final boolean DEFAULT_DECONVOLUTION = true;

  // Expected standard deviation of the peaks, in channels.
  private double sigma;
  // Percentage of the tallest sharpened peak a candidate must exceed.
  private double threshold;
  private boolean backgroundRemove;
  private boolean markov;
  private boolean deconvolution;

  public PeakSearchParameters(double sigma, double threshold, boolean backgroundRemove, boolean markov,
                              boolean deconvolution) {
    this.sigma = sigma;
    this.threshold = threshold;
    this.backgroundRemove = backgroundRemove;
    this.markov = markov;
    this.deconvolution = deconvolution;
  }

  /**
   * Background removal, Markov smoothing and deconvolution all enabled.
   */
  public static PeakSearchParameters defaults(double sigma, double threshold) {
    return new PeakSearchParameters(sigma, threshold, DEFAULT_BACKGROUND_REMOVE, DEFAULT_MARKOV, DEFAULT_DECONVOLUTION);
  }

  public double getSigma() {
    return sigma;
  }

  public double getThreshold() {
    return threshold;
  }

  public boolean isBackgroundRemove() {
    return backgroundRemove;
  }

  public boolean isMarkov() {
    return markov;
  }

  public boolean isDeconvolution() {
    return deconvolution;
  }

  @Override
  public String toString() {
    return String.format("PeakSearchParameters{sigma=%.3f, threshold=%.2f%%, background=%s, markov=%s, decon=%s}",
        sigma, threshold, backgroundRemove, markov, deconvolution);
  }
}
