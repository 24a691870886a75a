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

package com.twentyn.spectrum.background;

import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.utils.SpectrumArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Estimates the smooth background under the peaks of a spectrum with the SNIP algorithm (Statistics-sensitive
 * Non-linear Iterative Peak-clipping, Morhac et al.).
 *
 * For every clipping window w (visited in increasing or decreasing order) each interior channel is replaced by the
 * smaller of its current value and a symmetric reference computed from channels w away from it.  Peaks are eroded
 * a little more on every pass while flat or slowly varying regions stay untouched, so the estimate never rises above
 * the source.
 *
 * Instances hold no state and can be shared between threads.
 */
public class BackgroundEstimator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BackgroundEstimator.class);

  // Channels whose background departs from the source by at least this many counts belong to a clipped region.
  private static final double COMPTON_EDGE_TOLERANCE = 1.0;

  /**
   * Computes the background of a spectrum.
   * @param source The spectrum; it is not modified.
   * @param params The clipping configuration.
   * @return A new array of the same length holding the background estimate.
   */
  public double[] estimate(double[] source, BackgroundParameters params) {
    if (params == null) {
      throw new SpectrumConfigurationException("Background parameters must not be null");
    }
    SpectrumArrays.checkSpectrum(source, "Source spectrum");
    int size = source.length;
    int maxWindow = params.getNumberIterations();
    if (size < 2 * maxWindow + 1) {
      throw new SpectrumConfigurationException("Too large clipping window %d for a spectrum of %d channels",
          maxWindow, size);
    }

    double[] current = source.clone();
    double[] next = source.clone();
    boolean increasing = params.getDirection() == WindowDirection.INCREASING;
    int window = increasing ? 1 : maxWindow;
    while (window >= 1 && window <= maxWindow) {
      for (int j = window; j < size - window; j++) {
        next[j] = Math.min(current[j], reference(current, j, window, params.getFilterOrder()));
      }
      for (int j = window; j < size - window; j++) {
        current[j] = next[j];
      }
      window += increasing ? 1 : -1;
    }

    if (params.isSmoothing()) {
      current = movingAverage(current, (params.getSmoothWindow() - 1) / 2);
    }

    if (params.isCompton()) {
      current = compensateComptonEdges(source, current);
    }

    // Smoothing and edge compensation may lift single channels; the estimate must stay below the data.
    for (int j = 0; j < size; j++) {
      current[j] = Math.min(current[j], source[j]);
    }

    LOGGER.debug("Estimated background over %d channels with %s", size, params);
    return current;
  }

  /**
   * Removes the estimated background from a spectrum.
   * @return A new array holding max(source - background, 0) per channel.
   */
  public double[] subtract(double[] source, BackgroundParameters params) {
    double[] background = estimate(source, params);
    double[] result = new double[source.length];
    for (int j = 0; j < source.length; j++) {
      result[j] = Math.max(source[j] - background[j], 0.0);
    }
    return result;
  }

  /**
   * The largest of the 2, 4, 6 and 8 point symmetric estimates up to the requested order.  Every offset used is at
   * most `window` away from `j`, so the caller only has to keep `j` in [window, size - window).
   */
  static double reference(double[] v, int j, int window, FilterOrder order) {
    double result = (v[j - window] + v[j + window]) / 2.0;
    if (order.getPoints() >= 4) {
      int ai = window / 2;
      double c = (-v[j - 2 * ai] + 4 * v[j - ai] + 4 * v[j + ai] - v[j + 2 * ai]) / 6.0;
      result = Math.max(result, c);
    }
    if (order.getPoints() >= 6) {
      int ai = window / 3;
      double d = (v[j - 3 * ai] - 6 * v[j - 2 * ai] + 15 * v[j - ai] + 15 * v[j + ai]
          - 6 * v[j + 2 * ai] + v[j + 3 * ai]) / 20.0;
      result = Math.max(result, d);
    }
    if (order.getPoints() >= 8) {
      int ai = window / 4;
      double e = (-v[j - 4 * ai] + 8 * v[j - 3 * ai] - 28 * v[j - 2 * ai] + 56 * v[j - ai] + 56 * v[j + ai]
          - 28 * v[j + 2 * ai] + 8 * v[j + 3 * ai] - v[j + 4 * ai]) / 70.0;
      result = Math.max(result, e);
    }
    return result;
  }

  static double[] movingAverage(double[] values, int halfWidth) {
    double[] result = new double[values.length];
    for (int j = 0; j < values.length; j++) {
      double sum = 0.0;
      int count = 0;
      for (int w = Math.max(0, j - halfWidth); w <= Math.min(values.length - 1, j + halfWidth); w++) {
        sum += values[w];
        count++;
      }
      result[j] = sum / count;
    }
    return result;
  }

  /**
   * Replaces the estimate over every clipped region by a curve that follows the cumulative source counts between
   * the region's end points, so a Compton edge turns into a step in the background instead of being clipped away.
   */
  static double[] compensateComptonEdges(double[] source, double[] clipped) {
    int size = source.length;
    double[] result = clipped.clone();
    int i = 0;
    while (i < size) {
      if (Math.abs(clipped[i] - source[i]) < COMPTON_EDGE_TOLERANCE) {
        i++;
        continue;
      }

      int b1 = Math.max(i - 1, 0);
      int b2 = b1 + 1;
      while (b2 < size && Math.abs(clipped[b2] - source[b2]) >= COMPTON_EDGE_TOLERANCE) {
        b2++;
      }
      // One channel past the first unclipped one, or the last channel.
      b2 = Math.min(b2 + 1, size - 1);

      double yb1 = clipped[b1];
      double yb2 = clipped[b2];
      if (yb1 <= yb2) {
        double area = 0.0;
        for (int j = b1; j <= b2; j++) {
          area += source[j] - yb1;
        }
        if (area > 1) {
          double scale = (yb2 - yb1) / area;
          double cumulative = 0.0;
          for (int j = b1; j <= b2; j++) {
            cumulative += source[j] - yb1;
            result[j] = scale * cumulative + yb1;
          }
        }
      } else {
        double area = 0.0;
        for (int j = b2; j >= b1; j--) {
          area += source[j] - yb2;
        }
        if (area > 1) {
          double scale = (yb1 - yb2) / area;
          double cumulative = 0.0;
          for (int j = b2; j >= b1; j--) {
            cumulative += source[j] - yb2;
            result[j] = scale * cumulative + yb2;
          }
        }
      }
      i = b2 + 1;
    }
    return result;
  }
}
