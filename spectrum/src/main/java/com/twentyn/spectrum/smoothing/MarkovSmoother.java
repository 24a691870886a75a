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

package com.twentyn.spectrum.smoothing;

import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.utils.SpectrumArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Smooths counting spectra by treating them as the stationary distribution of a Markov chain (Silagadze's method as
 * used by Morhac).  The chain only moves between neighbouring channels; the probability of moving up or down is
 * built from exp((a - b) / sqrt(a + b)) over an averaging window, which weighs differences by their Poisson error.
 * The stationary distribution is rescaled to the area of the source, so smoothing redistributes counts without
 * adding or removing any.
 */
public class MarkovSmoother {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MarkovSmoother.class);

  public static final int DEFAULT_AVERAGE_WINDOW = 3;

  public double[] smooth(double[] source) {
    return smooth(source, DEFAULT_AVERAGE_WINDOW);
  }

  /**
   * @param source The spectrum to smooth; it is not modified.
   * @param averWindow Number of neighbours on each side that contribute to a transition probability.
   * @return A new array with the same length and the same sum as the source.
   */
  public double[] smooth(double[] source, int averWindow) {
    if (averWindow <= 0) {
      throw new SpectrumConfigurationException("Averaging window must be positive, got %d", averWindow);
    }
    SpectrumArrays.checkSpectrum(source, "Source spectrum");

    int xmin = 0;
    int xmax = source.length - 1;
    double area = 0.0;
    double maxch = 0.0;
    for (double v : source) {
      maxch = Math.max(maxch, v);
      area += v;
    }
    if (maxch == 0) {
      LOGGER.debug("Nothing to smooth, the spectrum holds no counts");
      return source.clone();
    }

    double[] chain = new double[source.length];
    chain[xmin] = 1.0;
    double norm = 1.0;
    for (int i = xmin; i < xmax; i++) {
      double nip = source[i] / maxch;
      double nim = source[i + 1] / maxch;
      double sp = 0.0;
      double sm = 0.0;
      for (int l = 1; l <= averWindow; l++) {
        double up = (i + l > xmax ? source[xmax] : source[i + l]) / maxch;
        sp += transition(up, nip);
        double down = (i - l + 1 < xmin ? source[xmin] : source[i - l + 1]) / maxch;
        sm += transition(down, nim);
      }
      chain[i + 1] = chain[i] * sp / sm;
      norm += chain[i + 1];
    }

    double[] result = new double[source.length];
    for (int i = xmin; i <= xmax; i++) {
      result[i] = chain[i] / norm * area;
    }
    return result;
  }

  private static double transition(double neighbour, double self) {
    double total = neighbour + self;
    double scale = total <= 0 ? 1.0 : Math.sqrt(total);
    return Math.exp((neighbour - self) / scale);
  }
}
