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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Gold's ratio method: x[i] *= y[i] / (h * x)[i].
 *
 * The estimate starts as the observed spectrum and stays non-negative.  At the fixed point the estimate reproduces
 * the observation when smeared with the response, so the total intensity approaches that of the source as the
 * iterations proceed.
 */
public class GoldDeconvolver extends IterativeDeconvolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GoldDeconvolver.class);

  @Override
  protected double[] update(double[] source, double[] estimate, ResponseKernel kernel, DegeneracyCounter counter) {
    double[] reconstructed = kernel.convolve(estimate);
    for (int i = 0; i < estimate.length; i++) {
      if (source[i] > 0) {
        counter.attempt();
      }
      if (!DegeneracyCounter.isUsableDenominator(reconstructed[i])) {
        if (source[i] > 0) {
          counter.skip();
        }
        continue;
      }
      estimate[i] *= source[i] / reconstructed[i];
    }
    return estimate;
  }

  @Override
  protected String getName() {
    return "Gold deconvolution";
  }

  @Override
  protected Logger getLogger() {
    return LOGGER;
  }
}
