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

package com.twentyn.spectrum.deconvolution;

import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.utils.SpectrumArrays;
import org.apache.logging.log4j.Logger;

/**
 * Shared driver for multiplicative deconvolution schemes.  Subclasses supply a single update step; this class
 * validates the inputs, runs the repetition blocks and applies boosting between them.
 *
 * Implementations are stateless, so one instance may serve concurrent calls on disjoint arrays.
 */
public abstract class IterativeDeconvolver {

  /**
   * Sharpens a spectrum against a known response.
   * @param source The observed spectrum; it is not modified.  All channels must be non-negative.
   * @param kernel The detector response.
   * @param params Iteration, repetition and boost settings.
   * @return The sharpened spectrum, same length as the source.
   */
  public DeconvolutionResult deconvolve(double[] source, ResponseKernel kernel, DeconvolutionParameters params) {
    checkInputs(source, kernel, params);

    DegeneracyCounter counter = new DegeneracyCounter();
    double[] estimate = source.clone();
    for (int repetition = 0; repetition < params.getNumberRepetitions(); repetition++) {
      if (repetition != 0) {
        applyBoost(estimate, SpectrumArrays.max(estimate), params.getBoost());
      }
      for (int iteration = 0; iteration < params.getNumberIterations(); iteration++) {
        estimate = update(source, estimate, kernel, counter);
      }
    }

    counter.report(getLogger(), getName());
    return new DeconvolutionResult(estimate, counter);
  }

  /**
   * Performs one refinement of the estimate.
   * @return The new estimate; may be `estimate` itself, updated in place.
   */
  protected abstract double[] update(double[] source, double[] estimate, ResponseKernel kernel,
                                     DegeneracyCounter counter);

  protected abstract String getName();

  protected abstract Logger getLogger();

  /**
   * Raises every value to the power `boost` after scaling by `max`, then scales back, so the tallest channel keeps its
   * height and smaller ones shrink (boost > 1) or grow (boost < 1).
   */
  public static void applyBoost(double[] values, double max, double boost) {
    if (!(max > 0) || boost == DeconvolutionParameters.NO_BOOST) {
      return;
    }
    for (int i = 0; i < values.length; i++) {
      values[i] = max * Math.pow(values[i] / max, boost);
    }
  }

  static void checkInputs(double[] source, ResponseKernel kernel, DeconvolutionParameters params) {
    if (kernel == null) {
      throw new SpectrumConfigurationException("Response kernel must not be null");
    }
    if (params == null) {
      throw new SpectrumConfigurationException("Deconvolution parameters must not be null");
    }
    SpectrumArrays.checkSpectrum(source, "Source spectrum");
    for (int i = 0; i < source.length; i++) {
      if (source[i] < 0) {
        throw new SpectrumConfigurationException("Source spectrum must not hold negative counts (channel %d: %f)",
            i, source[i]);
      }
    }
  }
}
